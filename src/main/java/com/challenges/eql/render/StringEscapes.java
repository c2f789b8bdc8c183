package com.challenges.eql.render;

/**
 * Escaping of string literals. {@link #unescape(String)} is the exact inverse of {@link #escape(String)}.
 */
public final class StringEscapes {

    private StringEscapes() {
    }

    public static String escape(String s) {
        // nothing to escape
        boolean needsEscaping = false;
        for (int i = 0; i < s.length(); i++) {
            if (escapeOf(s.charAt(i)) != 0) {
                needsEscaping = true;
                break;
            }
        }

        if (!needsEscaping) {
            return s;
        }

        StringBuilder result = new StringBuilder(s.length() + 16);
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            char escape = escapeOf(c);
            if (escape != 0) {
                result.append('\\').append(escape);
            } else {
                result.append(c);
            }
        }
        return result.toString();
    }

    public static String unescape(String s) {
        if (s.indexOf('\\') < 0) {
            return s;
        }

        StringBuilder result = new StringBuilder(s.length());
        int i = 0;
        while (i < s.length()) {
            char c = s.charAt(i);
            if (c == '\\' && i + 1 < s.length() && s.charAt(i + 1) != '\n') {
                char next = s.charAt(i + 1);
                char unescaped = unescapeOf(next);
                if (unescaped != 0) {
                    result.append(unescaped);
                } else {
                    result.append(c).append(next);
                }
                i += 2;
            } else {
                result.append(c);
                i++;
            }
        }
        return result.toString();
    }

    private static char escapeOf(char c) {
        switch (c) {
            case '\\':
                return '\\';
            case '\b':
                return 'b';
            case '\t':
                return 't';
            case '\r':
                return 'r';
            case '\n':
                return 'n';
            case '\f':
                return 'f';
            case '"':
                return '"';
            case '\'':
                return '\'';
            default:
                return 0;
        }
    }

    private static char unescapeOf(char c) {
        switch (c) {
            case '\\':
                return '\\';
            case 'b':
                return '\b';
            case 't':
                return '\t';
            case 'r':
                return '\r';
            case 'n':
                return '\n';
            case 'f':
                return '\f';
            case '"':
                return '"';
            case '\'':
                return '\'';
            default:
                return 0;
        }
    }
}

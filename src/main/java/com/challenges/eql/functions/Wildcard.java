package com.challenges.eql.functions;

import com.challenges.eql.ast.Comparison;
import com.challenges.eql.ast.Expression;
import com.challenges.eql.ast.Literal;
import com.challenges.eql.render.Renderer;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * {@code wildcard(source, pattern, ...)}: case-insensitive match against any of the patterns, {@code *} matching
 * any run of characters. The parser produces it for {@code field == "pattern*"}, which is how it renders back.
 */
public final class Wildcard implements FunctionSignature {

    public static final String NAME = "wildcard";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Object evaluate(List<Object> arguments) {
        if (arguments.isEmpty()) {
            throw new UnsupportedConstantEvaluationException(NAME, "missing source");
        }
        if (!(arguments.get(0) instanceof String source)) {
            return false;
        }
        for (Object pattern : arguments.subList(1, arguments.size())) {
            if (!(pattern instanceof String text)) {
                throw new UnsupportedConstantEvaluationException(NAME, "pattern is not a string");
            }
            if (toRegex(text).matcher(source).matches()) {
                return true;
            }
        }
        return false;
    }

    @Override
    public Optional<String> alternateRender(List<Expression> arguments, Integer precedence, Renderer renderer) {
        if (arguments.size() == 2 && arguments.get(1) instanceof Literal.StringLiteral) {
            Comparison comparison = new Comparison(arguments.get(0), Comparison.Comparator.EQ, arguments.get(1));
            return Optional.of(renderer.render(comparison, precedence));
        }
        return Optional.empty();
    }

    static Pattern toRegex(String wildcard) {
        String regex = Arrays.stream(wildcard.split("\\*", -1))
                .map(Pattern::quote)
                .collect(Collectors.joining(".*"));
        return Pattern.compile(regex, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.DOTALL);
    }
}

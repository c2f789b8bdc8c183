package com.challenges.eql.ast;

public class MacroArityException extends EqlException {

    private final String macroName;
    private final int expected;
    private final int received;

    public MacroArityException(String macroName, int expected, int received) {
        super("Macro " + macroName + " expected " + expected + " arguments but received " + received);
        this.macroName = macroName;
        this.expected = expected;
        this.received = received;
    }

    public String getMacroName() {
        return macroName;
    }

    public int getExpected() {
        return expected;
    }

    public int getReceived() {
        return received;
    }
}

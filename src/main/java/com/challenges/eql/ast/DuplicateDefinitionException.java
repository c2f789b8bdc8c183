package com.challenges.eql.ast;

/**
 * A name was registered twice where definitions can't be replaced: constants, functions and pipes.
 */
public class DuplicateDefinitionException extends EqlException {

    private final String name;

    public DuplicateDefinitionException(String name, String message) {
        super(message);
        this.name = name;
    }

    public String getName() {
        return name;
    }
}

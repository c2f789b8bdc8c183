package com.challenges.eql.ast;

/**
 * Named definitions loaded into a preprocessor.
 */
public sealed interface Definition permits Constant, BaseMacro {

    String name();
}

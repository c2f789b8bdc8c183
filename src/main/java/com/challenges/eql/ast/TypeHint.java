package com.challenges.eql.ast;

public enum TypeHint {
    STRING,
    NUMBER,
    BOOLEAN,
    NULL,
    PRIMITIVES
}

package com.galois.cryptol.codegen.ast;

/**
 * Type constructors, type functions and predicates.
 */
public enum TC {
    // Types
    NUM,
    INF,
    BIT,
    SEQ,
    FUN,
    TUPLE,

    // Type functions on numeric types
    ADD,
    SUB,
    MUL,
    MIN,
    MAX,
    WIDTH,

    // Predicates, which only appear in schemas
    FIN,
    ARITH,
    CMP,
    GEQ;

    public boolean isPredicate() {
        return this == FIN || this == ARITH || this == CMP || this == GEQ;
    }
}

package com.galois.cryptol.codegen.sym;

/**
 * A unary word operation that is defined uniformly for every width.
 */
public interface WordUnOp {
    <W extends Width> SWord<W> apply(SWord<W> x);
}

package com.galois.cryptol.codegen.sym;

/**
 * A binary word operation that is defined uniformly for every width.  Both
 * operands and the result share the width <code>W</code>.
 */
public interface WordBinOp {
    <W extends Width> SWord<W> apply(SWord<W> x, SWord<W> y);
}

package com.galois.cryptol.codegen.sym;

/** A binary operation on values of type <code>T</code>. */
public interface BinOp<T> {
    T apply(T x, T y);
}

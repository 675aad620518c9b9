package com.galois.cryptol.codegen.sym;

/** A unary operation on values of type <code>T</code>. */
public interface UnOp<T> {
    T apply(T x);
}

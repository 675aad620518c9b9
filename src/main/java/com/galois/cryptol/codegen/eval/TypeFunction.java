package com.galois.cryptol.codegen.eval;

/** The host function underlying a {@link VPoly}. */
public interface TypeFunction<B, W> {
    Value<B, W> apply(TValue type);
}

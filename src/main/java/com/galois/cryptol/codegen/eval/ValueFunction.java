package com.galois.cryptol.codegen.eval;

/** The host function underlying a {@link VFun}. */
public interface ValueFunction<B, W> {
    Value<B, W> apply(Value<B, W> arg);
}

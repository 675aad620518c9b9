package com.galois.cryptol.codegen.eval;

/** A value abstracted over a type; instantiate it to use it. */
public final class VPoly<B, W> extends Value<B, W> {
    private final TypeFunction<B, W> fun;

    public VPoly(TypeFunction<B, W> fun) {
        if (fun == null) throw new NullPointerException("fun");
        this.fun = fun;
    }

    String shape() {
        return "polymorphic value";
    }

    public TypeFunction<B, W> fromVPoly() {
        return fun;
    }
}

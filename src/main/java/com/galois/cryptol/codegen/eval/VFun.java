package com.galois.cryptol.codegen.eval;

/** A function.  Its only observation is application. */
public final class VFun<B, W> extends Value<B, W> {
    private final ValueFunction<B, W> fun;

    public VFun(ValueFunction<B, W> fun) {
        if (fun == null) throw new NullPointerException("fun");
        this.fun = fun;
    }

    String shape() {
        return "function";
    }

    public ValueFunction<B, W> fromVFun() {
        return fun;
    }
}

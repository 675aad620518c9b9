package com.galois.cryptol.codegen.eval;

/** An infinite sequence, computed lazily. */
public final class VStream<B, W> extends Value<B, W> {
    private final LazyStream<Value<B, W>> elems;

    public VStream(LazyStream<Value<B, W>> elems) {
        if (elems == null) throw new NullPointerException("elems");
        this.elems = elems;
    }

    String shape() {
        return "stream";
    }

    public LazyStream<Value<B, W>> fromVStream() {
        return elems;
    }
}

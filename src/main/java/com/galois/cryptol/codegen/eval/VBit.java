package com.galois.cryptol.codegen.eval;

/** A single bit. */
public final class VBit<B, W> extends Value<B, W> {
    private final B bit;

    public VBit(B bit) {
        if (bit == null) throw new NullPointerException("bit");
        this.bit = bit;
    }

    String shape() {
        return "bit";
    }

    public B fromVBit() {
        return bit;
    }
}

package com.galois.cryptol.codegen.sym;

/** Marker for 64-bit words. */
public final class Width64 extends Width {
    public static final Width64 INSTANCE = new Width64();

    private Width64() {
        super(64);
    }
}

package com.galois.cryptol.codegen.sym;

/** Marker for 8-bit words. */
public final class Width8 extends Width {
    public static final Width8 INSTANCE = new Width8();

    private Width8() {
        super(8);
    }
}

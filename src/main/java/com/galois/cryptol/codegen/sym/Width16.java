package com.galois.cryptol.codegen.sym;

/** Marker for 16-bit words. */
public final class Width16 extends Width {
    public static final Width16 INSTANCE = new Width16();

    private Width16() {
        super(16);
    }
}

package com.galois.cryptol.codegen.sym;

/** Marker for 32-bit words. */
public final class Width32 extends Width {
    public static final Width32 INSTANCE = new Width32();

    private Width32() {
        super(32);
    }
}

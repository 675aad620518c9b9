package com.galois.cryptol.codegen.sym;

/**
 * A statically known word width.
 *
 * Each supported width has its own subclass with a single instance, so
 * that {@link SWord} can carry the width as a type parameter: an
 * <code>SWord&lt;Width8&gt;</code> cannot be combined with an
 * <code>SWord&lt;Width16&gt;</code> without a compile error.
 */
public abstract class Width {
    private final int bits;

    Width(int bits) {
        this.bits = bits;
    }

    /** Number of bits in a word of this width. */
    public final int bits() {
        return bits;
    }

    public String toString() {
        return "[" + bits + "]";
    }
}

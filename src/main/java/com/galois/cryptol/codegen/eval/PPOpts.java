package com.galois.cryptol.codegen.eval;

/**
 * Options for rendering values.
 */
public final class PPOpts {
    /** Radix 10, five elements of an infinite sequence. */
    public static final PPOpts DEFAULT = new PPOpts(10, 5);

    private final int base;
    private final int infLength;

    /**
     * @param base Radix used for known words: 2, 8, 10 or 16.
     * @param infLength Number of elements of an infinite sequence to show.
     */
    public PPOpts(int base, int infLength) {
        if (base != 2 && base != 8 && base != 10 && base != 16) {
            throw new IllegalArgumentException("Unsupported base " + base);
        }
        this.base = base;
        this.infLength = Math.max(infLength, 0);
    }

    public int getBase() {
        return base;
    }

    public int getInfLength() {
        return infLength;
    }

    public PPOpts withBase(int base) {
        return new PPOpts(base, infLength);
    }

    public PPOpts withInfLength(int infLength) {
        return new PPOpts(base, infLength);
    }
}

package com.galois.cryptol.codegen.sym;

/**
 * Operations that may appear at a node of a symbolic term.
 */
public enum SymOp {
    /** A named input of a given width. */
    INPUT,
    /** A constant; Boolean literals have width 0. */
    LITERAL,

    // word -> word
    ADD,
    SUB,
    MUL,
    QUOT,
    REM,
    NEG,
    AND,
    OR,
    XOR,
    COMPLEMENT,

    /** Boolean condition selecting between two terms of the same width. */
    ITE,

    // word -> bit
    EQ,
    ULT,

    // bit -> bit
    NOT,
    BOOL_AND,
    BOOL_OR,
    BOOL_XOR,

    /** Select one bit of a word, counted from the most significant end. */
    TEST_BIT,
    /** Assemble a word from bits, most significant first. */
    FROM_BITS;

    /**
     * Compute this operation on concrete arguments.  Words are represented
     * by their unsigned value masked to <code>width</code> bits, and bits by
     * 0 or 1.
     *
     * @param width Width of the result (0 for bits), or of the operand for
     *   word comparisons.
     * @param index Bit index for {@link #TEST_BIT}.
     * @param xs Concrete argument values.
     * @return the concrete result.
     */
    long compute(int width, long index, long... xs) {
        long mask = Term.mask(width);
        switch (this) {
        case ADD:        return (xs[0] + xs[1]) & mask;
        case SUB:        return (xs[0] - xs[1]) & mask;
        case MUL:        return (xs[0] * xs[1]) & mask;
        case QUOT:       return xs[1] == 0 ? 0 : Long.divideUnsigned(xs[0], xs[1]) & mask;
        case REM:        return xs[1] == 0 ? xs[0] : Long.remainderUnsigned(xs[0], xs[1]) & mask;
        case NEG:        return (-xs[0]) & mask;
        case AND:        return xs[0] & xs[1];
        case OR:         return xs[0] | xs[1];
        case XOR:        return xs[0] ^ xs[1];
        case COMPLEMENT: return ~xs[0] & mask;
        case ITE:        return xs[0] != 0 ? xs[1] : xs[2];
        case EQ:         return xs[0] == xs[1] ? 1 : 0;
        case ULT:        return Long.compareUnsigned(xs[0], xs[1]) < 0 ? 1 : 0;
        case NOT:        return xs[0] ^ 1;
        case BOOL_AND:   return xs[0] & xs[1];
        case BOOL_OR:    return xs[0] | xs[1];
        case BOOL_XOR:   return xs[0] ^ xs[1];
        case TEST_BIT:   return (xs[0] >>> (width - 1 - index)) & 1;
        case FROM_BITS: {
            long r = 0;
            for (long b : xs) {
                r = (r << 1) | b;
            }
            return r;
        }
        default:
            throw new UnsupportedOperationException("No concrete semantics for " + this);
        }
    }
}

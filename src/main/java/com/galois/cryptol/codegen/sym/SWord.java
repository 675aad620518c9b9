package com.galois.cryptol.codegen.sym;

import java.util.ArrayList;
import java.util.List;

/**
 * A symbolic word whose width is fixed by the type parameter
 * <code>W</code>.  Arithmetic is modulo 2^width and words are unsigned.
 */
public final class SWord<W extends Width> {
    private final W width;
    private final Term term;

    private SWord(W width, Term term) {
        if (term.getWidth() != width.bits()) {
            throw new IllegalArgumentException(
                "Term of width " + term.getWidth() + " used at width " + width.bits());
        }
        this.width = width;
        this.term = term;
    }

    /**
     * Create a constant word.  The value is truncated to the width.
     */
    public static <W extends Width> SWord<W> literal(W width, long value) {
        return new SWord<W>(width, Term.literal(width.bits(), value));
    }

    /**
     * Create a fresh symbolic word.
     *
     * @param width The width of the input.
     * @param name Name of the input.
     */
    public static <W extends Width> SWord<W> input(W width, String name) {
        return new SWord<W>(width, Term.input(width.bits(), name));
    }

    /**
     * Assemble a word from bits, most significant bit first.
     *
     * @throws IllegalArgumentException if the number of bits differs from
     *   the width.
     */
    public static <W extends Width> SWord<W> fromBitsBE(W width, List<SBool> bits) {
        if (bits.size() != width.bits()) {
            throw new IllegalArgumentException(
                "fromBitsBE expects " + width.bits() + " bits, given " + bits.size());
        }
        Term[] args = new Term[bits.size()];
        for (int i = 0; i != args.length; ++i) {
            args[i] = bits.get(i).getTerm();
        }
        return new SWord<W>(width, Term.apply(SymOp.FROM_BITS, width.bits(), args));
    }

    public W getWidth() {
        return width;
    }

    public int bits() {
        return width.bits();
    }

    public Term getTerm() {
        return term;
    }

    /**
     * Return the unsigned value of this word if it is statically known.
     *
     * @return the value, or null if the word is symbolic.
     */
    public Long asLiteral() {
        return term.isLiteral() ? Long.valueOf(term.getValue()) : null;
    }

    private SWord<W> op(SymOp op, SWord<W> y) {
        return new SWord<W>(width, Term.apply(op, width.bits(), term, y.term));
    }

    private SWord<W> op(SymOp op) {
        return new SWord<W>(width, Term.apply(op, width.bits(), term));
    }

    public SWord<W> add(SWord<W> y)     { return op(SymOp.ADD, y); }
    public SWord<W> sub(SWord<W> y)     { return op(SymOp.SUB, y); }
    public SWord<W> mul(SWord<W> y)     { return op(SymOp.MUL, y); }

    /** Unsigned quotient; division by zero yields zero. */
    public SWord<W> sDiv(SWord<W> y)    { return op(SymOp.QUOT, y); }

    /** Unsigned remainder; division by zero yields the dividend. */
    public SWord<W> sMod(SWord<W> y)    { return op(SymOp.REM, y); }

    public SWord<W> negate()            { return op(SymOp.NEG); }
    public SWord<W> and(SWord<W> y)     { return op(SymOp.AND, y); }
    public SWord<W> or(SWord<W> y)      { return op(SymOp.OR, y); }
    public SWord<W> xor(SWord<W> y)     { return op(SymOp.XOR, y); }
    public SWord<W> complement()        { return op(SymOp.COMPLEMENT); }

    public SBool eq(SWord<W> y) {
        return SBool.of(Term.apply(SymOp.EQ, 0, term, y.term));
    }

    /** Unsigned less-than. */
    public SBool lessThan(SWord<W> y) {
        return SBool.of(Term.apply(SymOp.ULT, 0, term, y.term));
    }

    /**
     * Three-way unsigned comparison.
     */
    public SOrdering compareTo(SWord<W> y) {
        return SOrdering.of(lessThan(y), eq(y));
    }

    /**
     * Select bit <code>i</code>, counted from the most significant end.
     */
    public SBool testBit(int i) {
        if (i < 0 || i >= width.bits()) {
            throw new IndexOutOfBoundsException(
                "Bit " + i + " of a " + width.bits() + "-bit word");
        }
        if (term.isLiteral()) {
            return SBool.literal(SymOp.TEST_BIT.compute(width.bits(), i, term.getValue()) != 0);
        }
        return SBool.of(Term.testBit(term, i));
    }

    /**
     * Split the word into bits, most significant bit first.
     */
    public List<SBool> blastBE() {
        List<SBool> r = new ArrayList<SBool>(width.bits());
        for (int i = 0; i != width.bits(); ++i) {
            r.add(testBit(i));
        }
        return r;
    }

    /**
     * if-then-else on words of the same width.
     */
    public static <W extends Width> SWord<W> ite(SBool c, SWord<W> t, SWord<W> f) {
        Boolean b = c.asLiteral();
        if (b != null) return b ? t : f;
        if (t == f) return t;
        return new SWord<W>(t.width, Term.apply(SymOp.ITE, t.bits(), c.getTerm(), t.term, f.term));
    }

    public String toString() {
        return term.toString();
    }
}

package com.galois.cryptol.codegen.sym;

/**
 * A symbolic bit: either a known Boolean or a term over symbolic inputs.
 */
public final class SBool {
    public static final SBool TRUE = new SBool(Term.literal(0, 1));
    public static final SBool FALSE = new SBool(Term.literal(0, 0));

    private final Term term;

    SBool(Term term) {
        if (term.getWidth() != 0)
            throw new IllegalArgumentException("SBool expects a Boolean term.");
        this.term = term;
    }

    static SBool of(Term term) {
        if (term.isLiteral()) {
            return term.getValue() != 0 ? TRUE : FALSE;
        }
        return new SBool(term);
    }

    public static SBool literal(boolean b) {
        return b ? TRUE : FALSE;
    }

    /**
     * Create a fresh symbolic bit.
     *
     * @param name Name of the input.
     */
    public static SBool input(String name) {
        return new SBool(Term.input(0, name));
    }

    public Term getTerm() {
        return term;
    }

    /**
     * Return the value of this bit if it is statically known.
     *
     * @return the Boolean, or null if the bit is symbolic.
     */
    public Boolean asLiteral() {
        if (!term.isLiteral()) return null;
        return term.getValue() != 0;
    }

    public boolean isLiteral() {
        return term.isLiteral();
    }

    public SBool not() {
        if (this == TRUE) return FALSE;
        if (this == FALSE) return TRUE;
        return of(Term.apply(SymOp.NOT, 0, term));
    }

    public SBool and(SBool y) {
        if (this == FALSE || y == FALSE) return FALSE;
        if (this == TRUE) return y;
        if (y == TRUE) return this;
        return of(Term.apply(SymOp.BOOL_AND, 0, term, y.term));
    }

    public SBool or(SBool y) {
        if (this == TRUE || y == TRUE) return TRUE;
        if (this == FALSE) return y;
        if (y == FALSE) return this;
        return of(Term.apply(SymOp.BOOL_OR, 0, term, y.term));
    }

    public SBool xor(SBool y) {
        if (this == FALSE) return y;
        if (y == FALSE) return this;
        if (this == TRUE) return y.not();
        if (y == TRUE) return not();
        return of(Term.apply(SymOp.BOOL_XOR, 0, term, y.term));
    }

    /**
     * if-then-else on bits.  A known condition selects its branch without
     * building a term.
     */
    public static SBool ite(SBool c, SBool t, SBool f) {
        Boolean b = c.asLiteral();
        if (b != null) return b ? t : f;
        if (t == f) return t;
        return of(Term.apply(SymOp.ITE, 0, c.term, t.term, f.term));
    }

    public String toString() {
        return term.toString();
    }
}

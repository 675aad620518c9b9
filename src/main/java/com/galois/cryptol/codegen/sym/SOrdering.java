package com.galois.cryptol.codegen.sym;

/**
 * A symbolic result of a three-way comparison, represented by the two
 * predicates "less than" and "equal".
 */
public final class SOrdering {
    public static final SOrdering EQ = new SOrdering(SBool.FALSE, SBool.TRUE);

    private final SBool lt;
    private final SBool eq;

    private SOrdering(SBool lt, SBool eq) {
        this.lt = lt;
        this.eq = eq;
    }

    public static SOrdering of(SBool lt, SBool eq) {
        return new SOrdering(lt, eq);
    }

    public SBool lt()  { return lt; }
    public SBool eq()  { return eq; }
    public SBool neq() { return eq.not(); }
    public SBool gt()  { return lt.or(eq).not(); }

    /** Not greater than, i.e. less than or equal. */
    public SBool ngt() { return lt.or(eq); }

    /** Not less than, i.e. greater than or equal. */
    public SBool nlt() { return lt.not(); }

    /**
     * Lexicographic combination: the result of this comparison unless it
     * found the operands equal, in which case the result of
     * <code>rest</code>.
     */
    public SOrdering thenCompare(SOrdering rest) {
        return new SOrdering(lt.or(eq.and(rest.lt)), eq.and(rest.eq));
    }

    public String toString() {
        return "SOrdering(lt = " + lt + ", eq = " + eq + ")";
    }
}

package com.galois.cryptol.codegen.ast;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A static type, before evaluation.
 *
 * Types are either constructor applications ({@link TCon}), type variables
 * ({@link TVar}) or records ({@link TRec}).
 */
public abstract class Type {
    Type() {}

    /** The type of bits. */
    public static final Type BIT = new TCon(TC.BIT);

    /** The infinite numeric type. */
    public static final Type INF = new TCon(TC.INF);

    public static Type num(long n) {
        return num(BigInteger.valueOf(n));
    }

    public static Type num(BigInteger n) {
        return new TCon(n);
    }

    public static Type seq(Type len, Type elem) {
        return new TCon(TC.SEQ, len, elem);
    }

    /** The type <code>[n]</code> of <code>n</code>-bit words. */
    public static Type word(long n) {
        return seq(num(n), BIT);
    }

    public static Type fun(Type arg, Type res) {
        return new TCon(TC.FUN, arg, res);
    }

    /** A curried function type <code>a -&gt; b -&gt; ... -&gt; r</code>. */
    public static Type fun(Type first, Type... rest) {
        Type[] all = new Type[rest.length + 1];
        all[0] = first;
        System.arraycopy(rest, 0, all, 1, rest.length);
        Type r = all[all.length - 1];
        for (int i = all.length - 2; i >= 0; --i) {
            r = fun(all[i], r);
        }
        return r;
    }

    public static Type tuple(Type... elems) {
        return new TCon(TC.TUPLE, elems);
    }

    /** Apply a substitution to this type. */
    public abstract Type apply(Subst s);

    /** Add the type variables occurring in this type to <code>acc</code>. */
    abstract void collectFreeVars(Set<TVar> acc);

    public final Set<TVar> freeVars() {
        Set<TVar> acc = new LinkedHashSet<TVar>();
        collectFreeVars(acc);
        return acc;
    }

    /**
     * If this type is <code>[n]Bit</code> for a numeral <code>n</code>,
     * return <code>n</code>; otherwise return null.
     */
    public Long wordWidth() {
        return null;
    }

    public boolean isFun() {
        return false;
    }

    /** Argument type of a function type. */
    public Type funArg() {
        throw new UnsupportedOperationException("Expected function type: " + this);
    }

    /** Result type of a function type. */
    public Type funResult() {
        throw new UnsupportedOperationException("Expected function type: " + this);
    }

    static String join(Object[] xs, String sep) {
        StringBuilder b = new StringBuilder();
        for (int i = 0; i != xs.length; ++i) {
            if (i > 0) b.append(sep);
            b.append(xs[i]);
        }
        return b.toString();
    }

    static boolean sameArgs(Type[] a, Type[] b) {
        return Arrays.equals(a, b);
    }
}

package com.galois.cryptol.codegen.ast;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * Application of a type constructor, type function or predicate to
 * arguments.  Numerals carry their value instead of arguments.
 */
public final class TCon extends Type {
    private final TC tc;
    private final BigInteger num;
    private final Type[] args;

    TCon(BigInteger num) {
        if (num == null) throw new NullPointerException("num");
        if (num.signum() < 0)
            throw new IllegalArgumentException("Numeric types cannot be negative.");
        this.tc = TC.NUM;
        this.num = num;
        this.args = new Type[0];
    }

    public TCon(TC tc, Type... args) {
        if (tc == TC.NUM) throw new IllegalArgumentException("Use Type.num for numerals.");
        this.tc = tc;
        this.num = null;
        this.args = args.clone();
    }

    public TC getTC() {
        return tc;
    }

    /** Value of a numeral, or null. */
    public BigInteger getNum() {
        return num;
    }

    public List<Type> getArgs() {
        return Collections.unmodifiableList(Arrays.asList(args));
    }

    public Type arg(int i) {
        return args[i];
    }

    public Type apply(Subst s) {
        if (args.length == 0) return this;
        Type[] r = new Type[args.length];
        for (int i = 0; i != args.length; ++i) {
            r[i] = args[i].apply(s);
        }
        return new TCon(tc, r);
    }

    void collectFreeVars(Set<TVar> acc) {
        for (Type a : args) {
            a.collectFreeVars(acc);
        }
    }

    public Long wordWidth() {
        if (tc != TC.SEQ || !(args[0] instanceof TCon) || !args[1].equals(BIT)) return null;
        BigInteger n = ((TCon) args[0]).num;
        if (n == null || n.bitLength() > 31) return null;
        return n.longValue();
    }

    public boolean isFun() {
        return tc == TC.FUN;
    }

    public Type funArg() {
        if (tc != TC.FUN) return super.funArg();
        return args[0];
    }

    public Type funResult() {
        if (tc != TC.FUN) return super.funResult();
        return args[1];
    }

    public boolean equals(Object o) {
        if (!(o instanceof TCon)) return false;
        TCon r = (TCon) o;
        return tc == r.tc
            && (num == null ? r.num == null : num.equals(r.num))
            && sameArgs(args, r.args);
    }

    public int hashCode() {
        return Arrays.hashCode(new Object[] { tc, num, Arrays.hashCode(args) });
    }

    public String toString() {
        switch (tc) {
        case NUM:   return num.toString();
        case INF:   return "inf";
        case BIT:   return "Bit";
        case SEQ:   return "[" + args[0] + "]" + (args[1].equals(BIT) ? "" : args[1].toString());
        case FUN:   return "(" + args[0] + " -> " + args[1] + ")";
        case TUPLE: return "(" + join(args, ", ") + ")";
        default:    return tc.name().toLowerCase() + " " + join(args, " ");
        }
    }
}

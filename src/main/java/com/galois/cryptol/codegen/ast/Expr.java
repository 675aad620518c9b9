package com.galois.cryptol.codegen.ast;

/**
 * A typed core expression.  Expressions reaching the evaluator have been
 * renamed and type checked, so every variable refers to a binding in
 * scope.
 */
public abstract class Expr {
    Expr() {}

    public abstract <R> R accept(Visitor<R> v);

    /**
     * Visitor over the expression forms.
     */
    public interface Visitor<R> {
        R visitECon(EConExpr e);
        R visitEList(EList e);
        R visitETuple(ETuple e);
        R visitERec(ERec e);
        R visitESel(ESel e);
        R visitEIf(EIf e);
        R visitEVar(EVar e);
        R visitETAbs(ETAbs e);
        R visitETApp(ETApp e);
        R visitEApp(EApp e);
        R visitEAbs(EAbs e);
        R visitECast(ECast e);
        R visitEWhere(EWhere e);
    }

    // Convenience constructors.

    public static Expr con(ECon c) {
        return new EConExpr(c);
    }

    public static Expr var(QName n) {
        return new EVar(n);
    }

    /** Apply <code>f</code> to each argument in turn. */
    public static Expr app(Expr f, Expr... args) {
        Expr r = f;
        for (Expr a : args) {
            r = new EApp(r, a);
        }
        return r;
    }

    /** Instantiate <code>e</code> at each type in turn. */
    public static Expr tapp(Expr e, Type... types) {
        Expr r = e;
        for (Type t : types) {
            r = new ETApp(r, t);
        }
        return r;
    }

    /**
     * A word literal: <code>demote`{value, width}</code>.
     */
    public static Expr word(long value, long width) {
        return tapp(con(ECon.DEMOTE), Type.num(value), Type.num(width));
    }
}

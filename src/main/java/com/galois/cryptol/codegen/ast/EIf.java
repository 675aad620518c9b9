package com.galois.cryptol.codegen.ast;

/** A conditional expression. */
public final class EIf extends Expr {
    private final Expr cond;
    private final Expr then;
    private final Expr otherwise;

    public EIf(Expr cond, Expr then, Expr otherwise) {
        if (cond == null) throw new NullPointerException("cond");
        if (then == null) throw new NullPointerException("then");
        if (otherwise == null) throw new NullPointerException("otherwise");
        this.cond = cond;
        this.then = then;
        this.otherwise = otherwise;
    }

    public Expr getCond() {
        return cond;
    }

    public Expr getThen() {
        return then;
    }

    public Expr getOtherwise() {
        return otherwise;
    }

    public <R> R accept(Visitor<R> v) {
        return v.visitEIf(this);
    }

    public String toString() {
        return "(if " + cond + " then " + then + " else " + otherwise + ")";
    }
}

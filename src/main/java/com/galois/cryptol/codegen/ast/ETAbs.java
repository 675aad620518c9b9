package com.galois.cryptol.codegen.ast;

/** Abstraction over a type variable. */
public final class ETAbs extends Expr {
    private final TVar param;
    private final Expr body;

    public ETAbs(TVar param, Expr body) {
        if (param == null) throw new NullPointerException("param");
        if (body == null) throw new NullPointerException("body");
        this.param = param;
        this.body = body;
    }

    public TVar getParam() {
        return param;
    }

    public Expr getBody() {
        return body;
    }

    public <R> R accept(Visitor<R> v) {
        return v.visitETAbs(this);
    }

    public String toString() {
        return "(\\{" + param + "} -> " + body + ")";
    }
}

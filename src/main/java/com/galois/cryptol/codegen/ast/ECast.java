package com.galois.cryptol.codegen.ast;

/** An expression annotated with its type. */
public final class ECast extends Expr {
    private final Expr expr;
    private final Type type;

    public ECast(Expr expr, Type type) {
        if (expr == null) throw new NullPointerException("expr");
        if (type == null) throw new NullPointerException("type");
        this.expr = expr;
        this.type = type;
    }

    public Expr getExpr() {
        return expr;
    }

    public Type getType() {
        return type;
    }

    public <R> R accept(Visitor<R> v) {
        return v.visitECast(this);
    }

    public String toString() {
        return "(" + expr + " : " + type + ")";
    }
}

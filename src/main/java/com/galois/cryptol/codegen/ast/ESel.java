package com.galois.cryptol.codegen.ast;

/** Selection of a component from a tuple, record or sequence. */
public final class ESel extends Expr {
    private final Expr expr;
    private final Selector selector;

    public ESel(Expr expr, Selector selector) {
        if (expr == null) throw new NullPointerException("expr");
        if (selector == null) throw new NullPointerException("selector");
        this.expr = expr;
        this.selector = selector;
    }

    public Expr getExpr() {
        return expr;
    }

    public Selector getSelector() {
        return selector;
    }

    public <R> R accept(Visitor<R> v) {
        return v.visitESel(this);
    }

    public String toString() {
        return expr + "." + selector;
    }
}

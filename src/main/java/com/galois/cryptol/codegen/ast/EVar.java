package com.galois.cryptol.codegen.ast;

/** A reference to a variable. */
public final class EVar extends Expr {
    private final QName name;

    public EVar(QName name) {
        if (name == null) throw new NullPointerException("name");
        this.name = name;
    }

    public QName getName() {
        return name;
    }

    public <R> R accept(Visitor<R> v) {
        return v.visitEVar(this);
    }

    public String toString() {
        return name.toString();
    }
}

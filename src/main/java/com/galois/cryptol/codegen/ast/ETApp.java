package com.galois.cryptol.codegen.ast;

/** Instantiation of a polymorphic expression at a type. */
public final class ETApp extends Expr {
    private final Expr fun;
    private final Type type;

    public ETApp(Expr fun, Type type) {
        if (fun == null) throw new NullPointerException("fun");
        if (type == null) throw new NullPointerException("type");
        this.fun = fun;
        this.type = type;
    }

    public Expr getFun() {
        return fun;
    }

    public Type getType() {
        return type;
    }

    public <R> R accept(Visitor<R> v) {
        return v.visitETApp(this);
    }

    public String toString() {
        return fun + "`{" + type + "}";
    }
}

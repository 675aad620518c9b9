package com.galois.cryptol.codegen.ast;

/** Function application. */
public final class EApp extends Expr {
    private final Expr fun;
    private final Expr arg;

    public EApp(Expr fun, Expr arg) {
        if (fun == null) throw new NullPointerException("fun");
        if (arg == null) throw new NullPointerException("arg");
        this.fun = fun;
        this.arg = arg;
    }

    public Expr getFun() {
        return fun;
    }

    public Expr getArg() {
        return arg;
    }

    public <R> R accept(Visitor<R> v) {
        return v.visitEApp(this);
    }

    public String toString() {
        return "(" + fun + " " + arg + ")";
    }
}

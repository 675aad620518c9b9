package com.galois.cryptol.codegen.ast;

/** A built-in constant or primitive operator. */
public final class EConExpr extends Expr {
    private final ECon con;

    public EConExpr(ECon con) {
        if (con == null) throw new NullPointerException("con");
        this.con = con;
    }

    public ECon getCon() {
        return con;
    }

    public <R> R accept(Visitor<R> v) {
        return v.visitECon(this);
    }

    public String toString() {
        return con.getSymbol();
    }
}

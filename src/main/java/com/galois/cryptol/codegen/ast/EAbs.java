package com.galois.cryptol.codegen.ast;

/** A lambda abstraction binding one argument. */
public final class EAbs extends Expr {
    private final QName param;
    private final Type paramType;
    private final Expr body;

    public EAbs(QName param, Type paramType, Expr body) {
        if (param == null) throw new NullPointerException("param");
        if (paramType == null) throw new NullPointerException("paramType");
        if (body == null) throw new NullPointerException("body");
        this.param = param;
        this.paramType = paramType;
        this.body = body;
    }

    public QName getParam() {
        return param;
    }

    public Type getParamType() {
        return paramType;
    }

    public Expr getBody() {
        return body;
    }

    public <R> R accept(Visitor<R> v) {
        return v.visitEAbs(this);
    }

    public String toString() {
        return "(\\(" + param + " : " + paramType + ") -> " + body + ")";
    }
}

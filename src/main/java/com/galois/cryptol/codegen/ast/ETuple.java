package com.galois.cryptol.codegen.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** A tuple expression. */
public final class ETuple extends Expr {
    private final List<Expr> elems;

    public ETuple(List<Expr> elems) {
        this.elems = Collections.unmodifiableList(new ArrayList<Expr>(elems));
    }

    public List<Expr> getElems() {
        return elems;
    }

    public <R> R accept(Visitor<R> v) {
        return v.visitETuple(this);
    }

    public String toString() {
        return "(" + Type.join(elems.toArray(), ", ") + ")";
    }
}

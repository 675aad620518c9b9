package com.galois.cryptol.codegen.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A finite sequence literal.  The element type decides whether the
 * sequence is a word (elements of type <code>Bit</code>) or a list.
 */
public final class EList extends Expr {
    private final List<Expr> elems;
    private final Type elemType;

    public EList(List<Expr> elems, Type elemType) {
        if (elemType == null) throw new NullPointerException("elemType");
        this.elems = Collections.unmodifiableList(new ArrayList<Expr>(elems));
        this.elemType = elemType;
    }

    public List<Expr> getElems() {
        return elems;
    }

    public Type getElemType() {
        return elemType;
    }

    public <R> R accept(Visitor<R> v) {
        return v.visitEList(this);
    }

    public String toString() {
        return "[" + Type.join(elems.toArray(), ", ") + "]";
    }
}

package com.galois.cryptol.codegen.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An expression with local declarations.  Each declaration may refer to
 * the ones before it.
 */
public final class EWhere extends Expr {
    private final Expr body;
    private final List<Decl> decls;

    public EWhere(Expr body, List<Decl> decls) {
        if (body == null) throw new NullPointerException("body");
        this.body = body;
        this.decls = Collections.unmodifiableList(new ArrayList<Decl>(decls));
    }

    public Expr getBody() {
        return body;
    }

    public List<Decl> getDecls() {
        return decls;
    }

    public <R> R accept(Visitor<R> v) {
        return v.visitEWhere(this);
    }

    public String toString() {
        return "(" + body + " where " + Type.join(decls.toArray(), "; ") + ")";
    }
}

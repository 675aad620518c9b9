package com.galois.cryptol.codegen.frontend;

import com.galois.cryptol.codegen.ast.Expr;
import com.galois.cryptol.codegen.ast.Subst;

/**
 * A defaulted expression and the substitution that made it so.
 */
public final class Defaulted {
    private final Subst subst;
    private final Expr expr;

    public Defaulted(Subst subst, Expr expr) {
        if (subst == null) throw new NullPointerException("subst");
        if (expr == null) throw new NullPointerException("expr");
        this.subst = subst;
        this.expr = expr;
    }

    public Subst getSubst() {
        return subst;
    }

    public Expr getExpr() {
        return expr;
    }
}

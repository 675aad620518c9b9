package com.galois.cryptol.codegen.frontend;

import com.galois.cryptol.codegen.ast.Expr;
import com.galois.cryptol.codegen.ast.Schema;
import com.galois.cryptol.codegen.ast.Subst;

/**
 * Chooses nothing: the expression is returned unchanged with an empty
 * substitution.  A polymorphic scheme stays polymorphic.
 */
public class IdentityDefaulter implements Defaulter {
    public Defaulted defaultExpr(Position location, Expr expr, Schema schema) {
        return new Defaulted(Subst.EMPTY, expr);
    }
}

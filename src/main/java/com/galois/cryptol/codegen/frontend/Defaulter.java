package com.galois.cryptol.codegen.frontend;

import com.galois.cryptol.codegen.ast.Expr;
import com.galois.cryptol.codegen.ast.Schema;

/**
 * Chooses types for the remaining type parameters of an expression.
 */
public interface Defaulter {
    /**
     * @return the defaulted expression, or null if no choice was found.
     */
    Defaulted defaultExpr(Position location, Expr expr, Schema schema);
}

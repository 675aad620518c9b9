package com.galois.cryptol.codegen.eval;

import com.galois.cryptol.codegen.ast.TVar;

/** Bindings of type variables to evaluated types. */
public interface TypeEnv {
    /**
     * @return the binding of <code>var</code>, or null if it is unbound.
     */
    TValue lookupType(TVar var);
}

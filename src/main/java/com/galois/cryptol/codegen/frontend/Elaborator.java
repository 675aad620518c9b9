package com.galois.cryptol.codegen.frontend;

/**
 * Renames and type checks a parsed expression against a module
 * environment.
 */
public interface Elaborator {
    Elaborated elaborate(ParsedExpr expr, ModuleEnv env) throws ElaborationException;
}

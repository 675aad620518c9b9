package com.galois.cryptol.codegen.frontend;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.galois.cryptol.codegen.ast.Expr;
import com.galois.cryptol.codegen.ast.Schema;

/**
 * The result of elaborating an expression: the typed expression, its
 * scheme, the module environment afterwards, and any warnings.
 */
public final class Elaborated {
    private final Expr expr;
    private final Schema schema;
    private final ModuleEnv env;
    private final List<String> diagnostics;

    public Elaborated(Expr expr, Schema schema, ModuleEnv env, List<String> diagnostics) {
        this.expr = expr;
        this.schema = schema;
        this.env = env;
        this.diagnostics = Collections.unmodifiableList(new ArrayList<String>(diagnostics));
    }

    public Expr getExpr() {
        return expr;
    }

    public Schema getSchema() {
        return schema;
    }

    public ModuleEnv getEnv() {
        return env;
    }

    public List<String> getDiagnostics() {
        return diagnostics;
    }
}

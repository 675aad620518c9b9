package com.galois.cryptol.codegen.frontend;

import java.util.Collections;

import com.galois.cryptol.codegen.ast.Decl;
import com.galois.cryptol.codegen.ast.Expr;
import com.galois.cryptol.codegen.ast.QName;

/**
 * Elaborates references to top-level declarations.  An unqualified name
 * resolves in the focused module; a qualified one in the named module.
 * The expression's scheme is the declaration's scheme.
 */
public class DeclarationElaborator implements Elaborator {
    public Elaborated elaborate(ParsedExpr expr, ModuleEnv env) throws ElaborationException {
        ParsedExpr e = ParsedExpr.dislocate(expr);
        if (!(e instanceof ParsedExpr.PVar)) {
            throw new ElaborationException("Unsupported expression: " + e);
        }
        QName name = ((ParsedExpr.PVar) e).getName();

        Decl d;
        if (name.getModule() == null) {
            d = env.getFocused().lookupLocal(name);
        } else {
            Module m = env.findModule(name.getModule());
            if (m == null) {
                throw new ElaborationException("Module not loaded: " + name.getModule());
            }
            d = m.lookup(name);
        }
        if (d == null) {
            throw new ElaborationException(
                "Value not in scope: " + name + " (at " + ParsedExpr.location(expr) + ")");
        }
        return new Elaborated(Expr.var(d.getName()), d.getSchema(), env,
                              Collections.<String>emptyList());
    }
}

package com.galois.cryptol.codegen;

import com.galois.cryptol.codegen.ast.Name;
import com.galois.cryptol.codegen.ast.QName;

/**
 * Identifiers for generated code.
 */
public final class CName {
    private CName() {}

    /**
     * A source name is its text; a generated name is its pass and number
     * joined by an underscore.
     */
    public static String cName(Name n) {
        if (n.isGenerated()) {
            return n.getPass() + "_" + n.getId();
        }
        return n.getText();
    }

    /** Module segments and the name, joined by underscores. */
    public static String cName(QName q) {
        if (q.getModule() == null) {
            return cName(q.getName());
        }
        return String.join("_", q.getModule().getSegments()) + "_" + cName(q.getName());
    }
}

package com.galois.cryptol.codegen.ast;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** A record expression; fields keep their written order. */
public final class ERec extends Expr {
    private final Map<String, Expr> fields;

    public ERec(Map<String, Expr> fields) {
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<String, Expr>(fields));
    }

    public Map<String, Expr> getFields() {
        return fields;
    }

    public <R> R accept(Visitor<R> v) {
        return v.visitERec(this);
    }

    public String toString() {
        StringBuilder b = new StringBuilder("{");
        boolean first = true;
        for (Map.Entry<String, Expr> e : fields.entrySet()) {
            if (!first) b.append(", ");
            b.append(e.getKey()).append(" = ").append(e.getValue());
            first = false;
        }
        return b.append("}").toString();
    }
}

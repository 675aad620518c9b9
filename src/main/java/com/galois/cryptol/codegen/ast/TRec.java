package com.galois.cryptol.codegen.ast;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * A record type.  Field order is preserved for display.
 */
public final class TRec extends Type {
    private final Map<String, Type> fields;

    public TRec(Map<String, Type> fields) {
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<String, Type>(fields));
    }

    public Map<String, Type> getFields() {
        return fields;
    }

    public Type apply(Subst s) {
        Map<String, Type> r = new LinkedHashMap<String, Type>();
        for (Map.Entry<String, Type> e : fields.entrySet()) {
            r.put(e.getKey(), e.getValue().apply(s));
        }
        return new TRec(r);
    }

    void collectFreeVars(Set<TVar> acc) {
        for (Type t : fields.values()) {
            t.collectFreeVars(acc);
        }
    }

    public boolean equals(Object o) {
        if (!(o instanceof TRec)) return false;
        return fields.equals(((TRec) o).fields);
    }

    public int hashCode() {
        return fields.hashCode();
    }

    public String toString() {
        StringBuilder b = new StringBuilder("{");
        boolean first = true;
        for (Map.Entry<String, Type> e : fields.entrySet()) {
            if (!first) b.append(", ");
            b.append(e.getKey()).append(" : ").append(e.getValue());
            first = false;
        }
        return b.append("}").toString();
    }
}

package com.galois.cryptol.codegen.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * A substitution of types for type variables.
 */
public final class Subst {
    public static final Subst EMPTY = new Subst(Collections.<TVar, Type>emptyMap());

    private final Map<TVar, Type> map;

    public Subst(Map<TVar, Type> map) {
        this.map = Collections.unmodifiableMap(new HashMap<TVar, Type>(map));
    }

    public static Subst single(TVar v, Type t) {
        return new Subst(Collections.singletonMap(v, t));
    }

    Type lookup(TVar v) {
        return map.get(v);
    }

    public boolean isEmpty() {
        return map.isEmpty();
    }

    public Type apply(Type t) {
        return t.apply(this);
    }

    /**
     * Apply this substitution to a scheme.  Variables bound by the scheme
     * are not replaced.
     */
    public Schema apply(Schema s) {
        Subst inner = this;
        if (!s.getParams().isEmpty()) {
            Map<TVar, Type> m = new HashMap<TVar, Type>(map);
            for (TVar p : s.getParams()) {
                m.remove(p);
            }
            inner = new Subst(m);
        }
        List<Type> props = new ArrayList<Type>();
        for (Type p : s.getProps()) {
            props.add(p.apply(inner));
        }
        return new Schema(s.getParams(), props, s.getBody().apply(inner));
    }

    public String toString() {
        return map.toString();
    }
}

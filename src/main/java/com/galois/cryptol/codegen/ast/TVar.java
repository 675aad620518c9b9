package com.galois.cryptol.codegen.ast;

import java.util.Set;

/**
 * A type variable.  Variables are identified by their unique number; the
 * name is only used for display.
 */
public final class TVar extends Type {
    private final int id;
    private final String name;

    public TVar(int id, String name) {
        this.id = id;
        this.name = name;
    }

    public int getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public Type apply(Subst s) {
        Type t = s.lookup(this);
        return t == null ? this : t;
    }

    void collectFreeVars(Set<TVar> acc) {
        acc.add(this);
    }

    public boolean equals(Object o) {
        if (!(o instanceof TVar)) return false;
        return id == ((TVar) o).id;
    }

    public int hashCode() {
        return id;
    }

    public String toString() {
        return name == null ? "a`" + id : name;
    }
}

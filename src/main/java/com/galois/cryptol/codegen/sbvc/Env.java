package com.galois.cryptol.codegen.sbvc;

import com.galois.cryptol.codegen.Panic;
import com.galois.cryptol.codegen.ast.QName;
import com.galois.cryptol.codegen.ast.Schema;
import com.galois.cryptol.codegen.ast.TVar;
import com.galois.cryptol.codegen.eval.LazyValue;
import com.galois.cryptol.codegen.eval.TValue;
import com.galois.cryptol.codegen.eval.TypeEnv;
import com.galois.cryptol.codegen.eval.Value;
import com.galois.cryptol.codegen.sym.SBool;

/**
 * An evaluation environment with three parts: local terms (including
 * global declarations that are inlined), uninterpreted declarations with
 * their schemes, and type variable bindings.
 *
 * Local terms may be bound lazily; their value is computed on first
 * lookup.  Every uninterpreted name is also a local name.  Environments are
 * immutable; the bind methods return an extended copy that shares its
 * parent.
 */
public final class Env implements TypeEnv {
    public static final Env EMPTY =
        new Env(Bindings.<QName, LazyValue<SBool, CWord>>empty(),
                Bindings.<QName, Schema>empty(),
                Bindings.<TVar, TValue>empty());

    private final Bindings<QName, LazyValue<SBool, CWord>> locals;
    private final Bindings<QName, Schema> uninterpreted;
    private final Bindings<TVar, TValue> types;

    private Env(Bindings<QName, LazyValue<SBool, CWord>> locals,
                Bindings<QName, Schema> uninterpreted,
                Bindings<TVar, TValue> types) {
        this.locals = locals;
        this.uninterpreted = uninterpreted;
        this.types = types;
    }

    public Env bindLocalTerm(QName name, Value<SBool, CWord> value) {
        return bindLocalTerm(name, LazyValue.of(value));
    }

    /**
     * Bind a term whose value is computed when the name is first looked
     * up.
     */
    public Env bindLocalTerm(QName name, LazyValue<SBool, CWord> value) {
        return new Env(locals.bind(name, value), uninterpreted, types);
    }

    /**
     * Record a scheme for <code>name</code> without a local value.  On its
     * own this breaks the subset invariant; use {@link #bindGlobalTerm}.
     */
    Env bindUninterpretedTerm(QName name, Schema schema) {
        return new Env(locals, uninterpreted.bind(name, schema), types);
    }

    /** Bind a top-level declaration: its value and its scheme. */
    public Env bindGlobalTerm(QName name, Value<SBool, CWord> value, Schema schema) {
        return bindGlobalTerm(name, LazyValue.of(value), schema);
    }

    public Env bindGlobalTerm(QName name, LazyValue<SBool, CWord> value, Schema schema) {
        return bindUninterpretedTerm(name, schema).bindLocalTerm(name, value);
    }

    public Env bindType(TVar var, TValue type) {
        return new Env(locals, uninterpreted, types.bind(var, type));
    }

    public TermLookup<Value<SBool, CWord>> lookupLocalTerm(QName name) {
        LazyValue<SBool, CWord> v = locals.lookup(name);
        return v == null
            ? TermLookup.<Value<SBool, CWord>>absent()
            : TermLookup.found(v.force());
    }

    /**
     * Look up an uninterpreted declaration.  No value is made for
     * uninterpreted declarations yet, so a bound name reports
     * UNSUPPORTED.
     */
    TermLookup<Value<SBool, CWord>> lookupUninterpretedTerm(QName name) {
        if (uninterpreted.contains(name)) {
            return TermLookup.unsupported();
        }
        return TermLookup.absent();
    }

    /**
     * Look up a name, preferring an uninterpreted value and falling back
     * to the local binding.
     */
    public TermLookup<Value<SBool, CWord>> lookupGlobalTerm(QName name) {
        TermLookup<Value<SBool, CWord>> u = lookupUninterpretedTerm(name);
        if (u.isFound()) {
            return u;
        }
        return lookupLocalTerm(name);
    }

    /**
     * Look up a name that must be in scope.
     *
     * @throws Panic if it is not.
     */
    public Value<SBool, CWord> lookupTerm(QName name) {
        TermLookup<Value<SBool, CWord>> r = lookupGlobalTerm(name);
        if (!r.isFound()) {
            throw Panic.panic("Env.lookupTerm", "No term named " + name + " in scope");
        }
        return r.getValue();
    }

    public TValue lookupType(TVar var) {
        return types.lookup(var);
    }
}

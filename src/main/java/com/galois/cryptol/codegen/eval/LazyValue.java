package com.galois.cryptol.codegen.eval;

import com.galois.cryptol.codegen.Panic;

/**
 * A value computed the first time it is needed and remembered after that.
 */
public abstract class LazyValue<B, W> {
    private Value<B, W> value;
    private boolean forcing;

    /** Compute the value. */
    protected abstract Value<B, W> compute();

    /**
     * Return the value, computing it if this is the first request.
     *
     * @throws Panic if computing the value needs the value itself.
     */
    public final Value<B, W> force() {
        if (value == null) {
            if (forcing) {
                throw Panic.panic("LazyValue.force", "Value depends on itself");
            }
            forcing = true;
            try {
                value = compute();
            } finally {
                forcing = false;
            }
            if (value == null) throw new NullPointerException("compute");
        }
        return value;
    }

    /** An already computed value. */
    public static <B, W> LazyValue<B, W> of(final Value<B, W> v) {
        if (v == null) throw new NullPointerException("v");
        return new LazyValue<B, W>() {
            protected Value<B, W> compute() {
                return v;
            }
        };
    }
}

package com.galois.cryptol.codegen.eval;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A possibly infinite sequence whose elements are computed on demand and
 * remembered.  Element <code>i</code> is computed after elements
 * <code>0..i-1</code>, so an element may refer to earlier ones.
 */
public abstract class LazyStream<T> {
    private final List<T> memo = new ArrayList<T>();

    /** Compute element <code>i</code>. */
    protected abstract T compute(int i);

    public final T get(int i) {
        if (i < 0) throw new IndexOutOfBoundsException("Negative stream index " + i);
        while (memo.size() <= i) {
            memo.add(compute(memo.size()));
        }
        return memo.get(i);
    }

    /**
     * Return the first <code>n</code> elements, forcing no others.
     */
    public final List<T> take(int n) {
        List<T> r = new ArrayList<T>(Math.max(n, 0));
        for (int i = 0; i < n; ++i) {
            r.add(get(i));
        }
        return Collections.unmodifiableList(r);
    }

    /** Number of elements computed so far. */
    public final int forced() {
        return memo.size();
    }
}

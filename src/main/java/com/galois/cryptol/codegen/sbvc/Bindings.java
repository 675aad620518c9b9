package com.galois.cryptol.codegen.sbvc;

/**
 * An immutable map built by extension.  Each binding points at the
 * bindings it extends, so extending never copies or changes the parent,
 * and a later binding of the same key shadows an earlier one.
 */
final class Bindings<K, V> {
    private final K key;
    private final V value;
    private final Bindings<K, V> parent;

    private Bindings(K key, V value, Bindings<K, V> parent) {
        this.key = key;
        this.value = value;
        this.parent = parent;
    }

    static <K, V> Bindings<K, V> empty() {
        return new Bindings<K, V>(null, null, null);
    }

    Bindings<K, V> bind(K key, V value) {
        if (key == null) throw new NullPointerException("key");
        if (value == null) throw new NullPointerException("value");
        return new Bindings<K, V>(key, value, this);
    }

    /** Return the innermost binding of <code>key</code>, or null. */
    V lookup(K key) {
        for (Bindings<K, V> b = this; b.parent != null; b = b.parent) {
            if (b.key.equals(key)) {
                return b.value;
            }
        }
        return null;
    }

    boolean contains(K key) {
        return lookup(key) != null;
    }
}

package com.galois.cryptol.codegen.sbvc;

/**
 * The result of looking a term up in an {@link Env}.
 */
public final class TermLookup<V> {
    /** Outcome of a lookup. */
    public enum Status {
        /** The name is bound to a value. */
        FOUND,
        /** The name is not bound. */
        ABSENT,
        /**
         * The name is bound as an uninterpreted declaration, but no value
         * can be made for it.
         */
        UNSUPPORTED
    }

    private final Status status;
    private final V value;

    private TermLookup(Status status, V value) {
        this.status = status;
        this.value = value;
    }

    static <V> TermLookup<V> found(V value) {
        return new TermLookup<V>(Status.FOUND, value);
    }

    static <V> TermLookup<V> absent() {
        return new TermLookup<V>(Status.ABSENT, null);
    }

    static <V> TermLookup<V> unsupported() {
        return new TermLookup<V>(Status.UNSUPPORTED, null);
    }

    public Status getStatus() {
        return status;
    }

    public boolean isFound() {
        return status == Status.FOUND;
    }

    /**
     * @return the value, or null unless the status is FOUND.
     */
    public V getValue() {
        return value;
    }

    public String toString() {
        return status == Status.FOUND ? "FOUND(" + value + ")" : status.toString();
    }
}

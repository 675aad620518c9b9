package com.galois.cryptol.codegen.frontend;

/**
 * A location that diagnostics can point to.
 */
public abstract class Position {
    private static final Position UNKNOWN = new Position() {
        public String toString() {
            return "<unknown position>";
        }
    };

    /** The position used when nothing better is known. */
    public static Position empty() {
        return UNKNOWN;
    }
}

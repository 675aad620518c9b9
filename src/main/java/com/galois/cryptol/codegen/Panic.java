package com.galois.cryptol.codegen;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Panic is thrown when an internal consistency condition fails: a word
 * width mismatch, an unsupported primitive, a lookup of a name that is not
 * in scope, or a value of the wrong shape.  These conditions should have
 * been ruled out by an earlier phase (type checking, defaulting), so they
 * indicate a bug in the caller rather than bad user input.
 */
public final class Panic extends RuntimeException {
    private final String location;
    private final List<String> details;

    private Panic(String location, List<String> details) {
        super(format(location, details));
        this.location = location;
        this.details = details;
    }

    /**
     * Create a panic raised from <code>location</code>.
     *
     * @param location The qualified name of the method that panicked.
     * @param details Lines describing the failure.
     * @return the exception, for the caller to throw.
     */
    public static Panic panic(String location, String... details) {
        return new Panic(location,
                         Collections.unmodifiableList(Arrays.asList(details.clone())));
    }

    /** Return the qualified name of the method that panicked. */
    public String getLocation() {
        return location;
    }

    /** Return the diagnostic lines. */
    public List<String> getDetails() {
        return details;
    }

    private static String format(String location, List<String> details) {
        StringBuilder b = new StringBuilder();
        b.append("[").append(location).append("] internal error");
        for (String d : details) {
            b.append("\n  ").append(d);
        }
        return b.toString();
    }
}

package com.galois.cryptol.codegen.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A module name, as a non-empty path of segments (<code>A::B</code>).
 */
public final class ModName {
    private final List<String> segments;

    public ModName(List<String> segments) {
        if (segments.isEmpty()) {
            throw new IllegalArgumentException("Module names need at least one segment.");
        }
        this.segments = Collections.unmodifiableList(new ArrayList<String>(segments));
    }

    public static ModName of(String... segments) {
        List<String> l = new ArrayList<String>();
        Collections.addAll(l, segments);
        return new ModName(l);
    }

    public List<String> getSegments() {
        return segments;
    }

    public boolean equals(Object o) {
        if (!(o instanceof ModName)) return false;
        return segments.equals(((ModName) o).segments);
    }

    public int hashCode() {
        return segments.hashCode();
    }

    public String toString() {
        return String.join("::", segments);
    }
}

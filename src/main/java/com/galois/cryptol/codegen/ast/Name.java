package com.galois.cryptol.codegen.ast;

/**
 * An unqualified name.  Names written by the user carry their text;
 * names introduced by a compiler pass carry the pass and a unique number.
 */
public final class Name {
    private final String text;
    private final Pass pass;
    private final int id;

    private Name(String text, Pass pass, int id) {
        this.text = text;
        this.pass = pass;
        this.id = id;
    }

    /** A name from the source program. */
    public static Name of(String text) {
        if (text == null) throw new NullPointerException("text");
        return new Name(text, null, 0);
    }

    /** A name generated by <code>pass</code>. */
    public static Name generated(Pass pass, int id) {
        if (pass == null) throw new NullPointerException("pass");
        return new Name(null, pass, id);
    }

    public boolean isGenerated() {
        return pass != null;
    }

    /** Return the source text, or null for a generated name. */
    public String getText() {
        return text;
    }

    /** Return the generating pass, or null for a source name. */
    public Pass getPass() {
        return pass;
    }

    public int getId() {
        return id;
    }

    public boolean equals(Object o) {
        if (!(o instanceof Name)) return false;
        Name r = (Name) o;
        if (isGenerated()) return pass == r.pass && id == r.id;
        return !r.isGenerated() && text.equals(r.text);
    }

    public int hashCode() {
        return isGenerated() ? pass.hashCode() * 31 + id : text.hashCode();
    }

    public String toString() {
        return isGenerated() ? pass + "::" + id : text;
    }
}

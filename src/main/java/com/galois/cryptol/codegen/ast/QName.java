package com.galois.cryptol.codegen.ast;

/**
 * A name, optionally qualified by the module that declares it.
 */
public final class QName {
    private final ModName module;
    private final Name name;

    public QName(ModName module, Name name) {
        if (name == null) throw new NullPointerException("name");
        this.module = module;
        this.name = name;
    }

    /** An unqualified source name. */
    public static QName local(String text) {
        return new QName(null, Name.of(text));
    }

    public static QName qualified(ModName module, String text) {
        if (module == null) throw new NullPointerException("module");
        return new QName(module, Name.of(text));
    }

    /** Return the declaring module, or null for an unqualified name. */
    public ModName getModule() {
        return module;
    }

    public Name getName() {
        return name;
    }

    public boolean equals(Object o) {
        if (!(o instanceof QName)) return false;
        QName r = (QName) o;
        return name.equals(r.name)
            && (module == null ? r.module == null : module.equals(r.module));
    }

    public int hashCode() {
        return name.hashCode() * 31 + (module == null ? 0 : module.hashCode());
    }

    public String toString() {
        return module == null ? name.toString() : module + "::" + name;
    }
}

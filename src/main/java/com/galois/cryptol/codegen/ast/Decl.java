package com.galois.cryptol.codegen.ast;

/**
 * A named declaration with its type scheme and defining expression.
 */
public final class Decl {
    private final QName name;
    private final Schema schema;
    private final Expr definition;

    public Decl(QName name, Schema schema, Expr definition) {
        if (name == null) throw new NullPointerException("name");
        if (schema == null) throw new NullPointerException("schema");
        if (definition == null) throw new NullPointerException("definition");
        this.name = name;
        this.schema = schema;
        this.definition = definition;
    }

    public QName getName() {
        return name;
    }

    public Schema getSchema() {
        return schema;
    }

    public Expr getDefinition() {
        return definition;
    }

    public String toString() {
        return name + " : " + schema + " = " + definition;
    }
}

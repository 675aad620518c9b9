package com.galois.cryptol.codegen;

/**
 * What to generate code for.
 */
public abstract class GenerationRoot {
    GenerationRoot() {}

    /** A top-level declaration named by a possibly qualified identifier. */
    public static final class Identifier extends GenerationRoot {
        private final String text;

        public Identifier(String text) {
            if (text == null) throw new NullPointerException("text");
            this.text = text;
        }

        public String getText() {
            return text;
        }

        public String toString() {
            return text;
        }
    }

    public static GenerationRoot identifier(String text) {
        return new Identifier(text);
    }
}

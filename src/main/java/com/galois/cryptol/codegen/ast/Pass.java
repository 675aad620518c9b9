package com.galois.cryptol.codegen.ast;

/**
 * Compiler passes that introduce generated names.
 */
public enum Pass {
    NO_PAT("NoPat"),
    MONO_VALUES("MonoValues");

    private final String displayName;

    Pass(String displayName) {
        this.displayName = displayName;
    }

    public String toString() {
        return displayName;
    }
}

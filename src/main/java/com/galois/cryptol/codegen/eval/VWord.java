package com.galois.cryptol.codegen.eval;

/** A word, i.e. a finite sequence of bits packed by the backend. */
public final class VWord<B, W> extends Value<B, W> {
    private final W word;

    public VWord(W word) {
        if (word == null) throw new NullPointerException("word");
        this.word = word;
    }

    String shape() {
        return "word";
    }

    public W fromVWord() {
        return word;
    }
}

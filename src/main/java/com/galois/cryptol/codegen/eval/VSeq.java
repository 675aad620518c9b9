package com.galois.cryptol.codegen.eval;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** A finite sequence of values that are not bits. */
public final class VSeq<B, W> extends Value<B, W> {
    private final List<Value<B, W>> elems;

    public VSeq(List<Value<B, W>> elems) {
        this.elems = Collections.unmodifiableList(new ArrayList<Value<B, W>>(elems));
    }

    String shape() {
        return "sequence";
    }

    public List<Value<B, W>> fromVSeq() {
        return elems;
    }
}

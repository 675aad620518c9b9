package com.galois.cryptol.codegen.eval;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** A tuple. */
public final class VTuple<B, W> extends Value<B, W> {
    private final List<Value<B, W>> elems;

    public VTuple(List<Value<B, W>> elems) {
        this.elems = Collections.unmodifiableList(new ArrayList<Value<B, W>>(elems));
    }

    String shape() {
        return "tuple";
    }

    public List<Value<B, W>> fromVTuple() {
        return elems;
    }
}

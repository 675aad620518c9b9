package com.galois.cryptol.codegen.eval;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A record.  Fields are looked up by name and displayed in the order they
 * were given.
 */
public final class VRecord<B, W> extends Value<B, W> {
    private final Map<String, Value<B, W>> fields;

    public VRecord(Map<String, Value<B, W>> fields) {
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<String, Value<B, W>>(fields));
    }

    String shape() {
        return "record";
    }

    public Map<String, Value<B, W>> fromVRecord() {
        return fields;
    }
}

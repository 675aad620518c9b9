package com.galois.cryptol.codegen.eval;

import java.util.List;
import java.util.Map;

import com.galois.cryptol.codegen.Panic;

/**
 * A runtime value, parameterized by the representation <code>B</code> of
 * bits and <code>W</code> of words.
 *
 * Values are immutable.  The accessors <code>fromV*</code> return the
 * payload of the expected shape and panic on any other shape; a shape
 * mismatch means the expression was not well typed.
 */
public abstract class Value<B, W> {
    Value() {}

    /** Short description of the shape, for diagnostics. */
    abstract String shape();

    private Panic expected(String what) {
        return Panic.panic("Value.from" + what, "Expected a " + what + " value, got a " + shape());
    }

    public B fromVBit() {
        throw expected("VBit");
    }

    public W fromVWord() {
        throw expected("VWord");
    }

    /** Elements of a finite sequence. */
    public List<Value<B, W>> fromVSeq() {
        throw expected("VSeq");
    }

    public LazyStream<Value<B, W>> fromVStream() {
        throw expected("VStream");
    }

    public List<Value<B, W>> fromVTuple() {
        throw expected("VTuple");
    }

    public Map<String, Value<B, W>> fromVRecord() {
        throw expected("VRecord");
    }

    public ValueFunction<B, W> fromVFun() {
        throw expected("VFun");
    }

    public TypeFunction<B, W> fromVPoly() {
        throw expected("VPoly");
    }

    /** Apply a function value to an argument. */
    public Value<B, W> apply(Value<B, W> arg) {
        return fromVFun().apply(arg);
    }

    /** Instantiate a polymorphic value at a type. */
    public Value<B, W> instantiate(TValue type) {
        return fromVPoly().apply(type);
    }

    /** Look up a record field, panicking if it is missing. */
    public Value<B, W> lookupRecord(String field) {
        Value<B, W> v = fromVRecord().get(field);
        if (v == null) {
            throw Panic.panic("Value.lookupRecord", "Record has no field " + field);
        }
        return v;
    }
}

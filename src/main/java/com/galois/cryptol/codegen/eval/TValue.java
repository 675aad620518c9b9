package com.galois.cryptol.codegen.eval;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.galois.cryptol.codegen.Panic;

/**
 * An evaluated type: a type with every variable replaced by its binding
 * and every type function computed.
 */
public final class TValue {
    /** Kinds of evaluated types. */
    public enum Kind {
        NUM,
        INF,
        BIT,
        SEQ,
        FUN,
        TUPLE,
        RECORD
    }

    final Kind kind;
    final BigInteger num;
    final TValue[] params;
    final String[] fields;

    private TValue(Kind kind, BigInteger num, TValue[] params, String[] fields) {
        this.kind = kind;
        this.num = num;
        this.params = params;
        this.fields = fields;
    }

    private TValue(Kind kind, TValue... params) {
        this(kind, null, params, new String[0]);
    }

    public static final TValue BIT = new TValue(Kind.BIT);

    public static final TValue INF = new TValue(Kind.INF);

    public static TValue num(BigInteger n) {
        if (n.signum() < 0)
            throw new IllegalArgumentException("Numeric types cannot be negative.");
        return new TValue(Kind.NUM, n, new TValue[0], new String[0]);
    }

    public static TValue num(long n) {
        return num(BigInteger.valueOf(n));
    }

    public static TValue seq(TValue len, TValue elem) {
        return new TValue(Kind.SEQ, len, elem);
    }

    /** The type of <code>n</code>-bit words. */
    public static TValue word(long n) {
        return seq(num(n), BIT);
    }

    public static TValue fun(TValue arg, TValue res) {
        return new TValue(Kind.FUN, arg, res);
    }

    public static TValue tuple(List<TValue> elems) {
        return new TValue(Kind.TUPLE, elems.toArray(new TValue[elems.size()]));
    }

    public static TValue record(Map<String, TValue> fields) {
        String[] names = fields.keySet().toArray(new String[fields.size()]);
        TValue[] types = fields.values().toArray(new TValue[fields.size()]);
        return new TValue(Kind.RECORD, null, types, names);
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isBit()    { return kind == Kind.BIT; }
    public boolean isSeq()    { return kind == Kind.SEQ; }
    public boolean isFun()    { return kind == Kind.FUN; }
    public boolean isTuple()  { return kind == Kind.TUPLE; }
    public boolean isRecord() { return kind == Kind.RECORD; }
    public boolean isInf()    { return kind == Kind.INF; }

    /** True for a finite numeric type. */
    public boolean isFin()    { return kind == Kind.NUM; }

    /**
     * Return the value of a finite numeric type.
     */
    public BigInteger getNum() {
        if (kind != Kind.NUM) {
            throw Panic.panic("TValue.getNum", "Expected a finite numeric type, got " + this);
        }
        return num;
    }

    private void expect(Kind k, String where) {
        if (kind != k) {
            throw Panic.panic("TValue." + where, "Expected " + k + " type, got " + this);
        }
    }

    public TValue seqLength() {
        expect(Kind.SEQ, "seqLength");
        return params[0];
    }

    public TValue seqElem() {
        expect(Kind.SEQ, "seqElem");
        return params[1];
    }

    public TValue funArg() {
        expect(Kind.FUN, "funArg");
        return params[0];
    }

    public TValue funResult() {
        expect(Kind.FUN, "funResult");
        return params[1];
    }

    public List<TValue> tupleElems() {
        expect(Kind.TUPLE, "tupleElems");
        return Collections.unmodifiableList(Arrays.asList(params));
    }

    /** Fields of a record type, in declaration order. */
    public Map<String, TValue> recordFields() {
        expect(Kind.RECORD, "recordFields");
        Map<String, TValue> r = new LinkedHashMap<String, TValue>();
        for (int i = 0; i != fields.length; ++i) {
            r.put(fields[i], params[i]);
        }
        return r;
    }

    public boolean equals(Object o) {
        if (!(o instanceof TValue)) return false;
        TValue r = (TValue) o;
        return kind == r.kind
            && (num == null ? r.num == null : num.equals(r.num))
            && Arrays.equals(params, r.params)
            && Arrays.equals(fields, r.fields);
    }

    public int hashCode() {
        return Arrays.hashCode(new Object[] { kind, num, Arrays.hashCode(params), Arrays.hashCode(fields) });
    }

    public String toString() {
        switch (kind) {
        case NUM: return num.toString();
        case INF: return "inf";
        case BIT: return "Bit";
        case SEQ: return "[" + params[0] + "]" + (params[1].isBit() ? "" : params[1].toString());
        case FUN: return "(" + params[0] + " -> " + params[1] + ")";
        case TUPLE: {
            List<String> l = new ArrayList<String>();
            for (TValue p : params) l.add(p.toString());
            return "(" + String.join(", ", l) + ")";
        }
        default: {
            List<String> l = new ArrayList<String>();
            for (int i = 0; i != fields.length; ++i) l.add(fields[i] + " : " + params[i]);
            return "{" + String.join(", ", l) + "}";
        }
        }
    }
}

package com.galois.cryptol.codegen.eval;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.galois.cryptol.codegen.Panic;

/**
 * Symbolic if-then-else on values.
 *
 * Subclasses say how to recognize a known condition and how to merge bits
 * and words; {@link #ite} then handles every other shape component-wise.
 */
public abstract class Merge<B, W> {
    /**
     * @return the condition as a Boolean, or null if it is not known.
     */
    protected abstract Boolean asLiteral(B cond);

    protected abstract B iteBit(B cond, B then, B otherwise);

    protected abstract W iteWord(B cond, W then, W otherwise);

    /**
     * Select <code>then</code> or <code>otherwise</code>.  A known condition
     * returns the selected branch itself; otherwise the result combines
     * both branches.
     */
    public final Value<B, W> ite(B cond, Value<B, W> then, Value<B, W> otherwise) {
        Boolean b = asLiteral(cond);
        if (b != null) {
            return b ? then : otherwise;
        }
        return mergeValue(cond, then, otherwise);
    }

    /**
     * Merge two values of the same shape under a condition, without
     * inspecting whether the condition is known.
     */
    public Value<B, W> mergeValue(final B cond, final Value<B, W> l, final Value<B, W> r) {
        if (l instanceof VBit && r instanceof VBit) {
            return new VBit<B, W>(iteBit(cond, l.fromVBit(), r.fromVBit()));
        }
        if (l instanceof VWord && r instanceof VWord) {
            return new VWord<B, W>(iteWord(cond, l.fromVWord(), r.fromVWord()));
        }
        if (l instanceof VSeq && r instanceof VSeq) {
            return new VSeq<B, W>(mergeList("sequences", cond, l.fromVSeq(), r.fromVSeq()));
        }
        if (l instanceof VTuple && r instanceof VTuple) {
            return new VTuple<B, W>(mergeList("tuples", cond, l.fromVTuple(), r.fromVTuple()));
        }
        if (l instanceof VRecord && r instanceof VRecord) {
            Map<String, Value<B, W>> fs = new LinkedHashMap<String, Value<B, W>>();
            Map<String, Value<B, W>> rfs = r.fromVRecord();
            for (Map.Entry<String, Value<B, W>> e : l.fromVRecord().entrySet()) {
                Value<B, W> rv = rfs.get(e.getKey());
                if (rv == null) {
                    throw Panic.panic("Merge.mergeValue", "Record field mismatch at " + e.getKey());
                }
                fs.put(e.getKey(), mergeValue(cond, e.getValue(), rv));
            }
            return new VRecord<B, W>(fs);
        }
        if (l instanceof VStream && r instanceof VStream) {
            final LazyStream<Value<B, W>> ls = l.fromVStream();
            final LazyStream<Value<B, W>> rs = r.fromVStream();
            return new VStream<B, W>(new LazyStream<Value<B, W>>() {
                protected Value<B, W> compute(int i) {
                    return mergeValue(cond, ls.get(i), rs.get(i));
                }
            });
        }
        if (l instanceof VFun && r instanceof VFun) {
            return new VFun<B, W>(new ValueFunction<B, W>() {
                public Value<B, W> apply(Value<B, W> x) {
                    return mergeValue(cond, l.apply(x), r.apply(x));
                }
            });
        }
        if (l instanceof VPoly && r instanceof VPoly) {
            return new VPoly<B, W>(new TypeFunction<B, W>() {
                public Value<B, W> apply(TValue t) {
                    return mergeValue(cond, l.instantiate(t), r.instantiate(t));
                }
            });
        }
        throw Panic.panic("Merge.mergeValue",
                          "Cannot merge a " + l.shape() + " with a " + r.shape());
    }

    private List<Value<B, W>> mergeList(String what, B cond, List<Value<B, W>> l, List<Value<B, W>> r) {
        if (l.size() != r.size()) {
            throw Panic.panic("Merge.mergeValue",
                              "Cannot merge " + what + " of lengths " + l.size() + " and " + r.size());
        }
        List<Value<B, W>> res = new ArrayList<Value<B, W>>(l.size());
        for (int i = 0; i != l.size(); ++i) {
            res.add(mergeValue(cond, l.get(i), r.get(i)));
        }
        return res;
    }
}

package com.galois.cryptol.codegen.sym;

import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.Map;

/**
 * A concrete value for each of a set of named inputs.  Evaluating a term
 * under an assignment replaces its inputs and folds the result to a
 * literal.
 */
public final class Assignment {
    private final Map<String, Long> inputs = new HashMap<String, Long>();

    /**
     * Assign a value to a word input.  The value is truncated to the width
     * of the input when the input is read.
     */
    public Assignment set(String name, long value) {
        inputs.put(name, value);
        return this;
    }

    /** Assign a value to a bit input. */
    public Assignment set(String name, boolean value) {
        inputs.put(name, value ? 1L : 0L);
        return this;
    }

    public SBool evaluate(SBool b) {
        return SBool.literal(eval(b.getTerm(), new IdentityHashMap<Term, Long>()) != 0);
    }

    public <W extends Width> SWord<W> evaluate(SWord<W> w) {
        return SWord.literal(w.getWidth(), eval(w.getTerm(), new IdentityHashMap<Term, Long>()));
    }

    private long eval(Term t, Map<Term, Long> memo) {
        Long cached = memo.get(t);
        if (cached != null) return cached;

        long r;
        switch (t.getOp()) {
        case LITERAL:
            r = t.getValue();
            break;
        case INPUT: {
            Long v = inputs.get(t.getName());
            if (v == null) {
                throw new IllegalArgumentException("No value assigned to input " + t.getName());
            }
            r = v & Term.mask(t.getWidth());
            break;
        }
        case TEST_BIT:
            r = SymOp.TEST_BIT.compute(t.arg(0).getWidth(), t.getValue(), eval(t.arg(0), memo));
            break;
        case ITE: {
            // Only the selected branch needs inputs.
            long c = eval(t.arg(0), memo);
            r = eval(c != 0 ? t.arg(1) : t.arg(2), memo);
            break;
        }
        default: {
            long[] xs = new long[t.argCount()];
            for (int i = 0; i != xs.length; ++i) {
                xs[i] = eval(t.arg(i), memo);
            }
            int width = t.getOp() == SymOp.EQ || t.getOp() == SymOp.ULT
                ? t.arg(0).getWidth() : t.getWidth();
            r = t.getOp().compute(width, 0, xs);
            break;
        }
        }
        memo.put(t, r);
        return r;
    }
}

package com.galois.cryptol.codegen.sbvc;

import java.util.List;
import java.util.Map;

import com.galois.cryptol.codegen.eval.PPOpts;
import com.galois.cryptol.codegen.eval.VBit;
import com.galois.cryptol.codegen.eval.VFun;
import com.galois.cryptol.codegen.eval.VPoly;
import com.galois.cryptol.codegen.eval.VRecord;
import com.galois.cryptol.codegen.eval.VSeq;
import com.galois.cryptol.codegen.eval.VStream;
import com.galois.cryptol.codegen.eval.VTuple;
import com.galois.cryptol.codegen.eval.VWord;
import com.galois.cryptol.codegen.eval.Value;
import com.galois.cryptol.codegen.sym.SBool;

/**
 * Renders values for diagnostics.  Known bits and words print as their
 * values; symbolic ones print as a placeholder naming their type.
 */
public final class ValuePrinter {
    private final PPOpts opts;

    public ValuePrinter(PPOpts opts) {
        if (opts == null) throw new NullPointerException("opts");
        this.opts = opts;
    }

    public static String render(Value<SBool, CWord> v) {
        return new ValuePrinter(PPOpts.DEFAULT).print(v);
    }

    public String print(Value<SBool, CWord> v) {
        StringBuilder b = new StringBuilder();
        go(b, v);
        return b.toString();
    }

    /**
     * Render a word: its value in the configured base if known, otherwise
     * <code>&lt;[N]&gt;</code>.
     */
    public String word(CWord w) {
        Long v = w.asLiteral();
        if (v == null) {
            return "<[" + w.width() + "]>";
        }
        long x = v.longValue();
        switch (opts.getBase()) {
        case 16: return "0x" + Long.toHexString(x);
        case 8:  return "0o" + Long.toOctalString(x);
        case 2:  return "0b" + Long.toBinaryString(x);
        default: return Long.toUnsignedString(x);
        }
    }

    public static String bit(SBool b) {
        Boolean v = b.asLiteral();
        if (v == null) return "<Bit>";
        return v ? "True" : "False";
    }

    private void go(StringBuilder b, Value<SBool, CWord> v) {
        if (v instanceof VBit) {
            b.append(bit(v.fromVBit()));
        } else if (v instanceof VWord) {
            b.append(word(v.fromVWord()));
        } else if (v instanceof VSeq) {
            list(b, "[", v.fromVSeq(), "]");
        } else if (v instanceof VTuple) {
            list(b, "(", v.fromVTuple(), ")");
        } else if (v instanceof VRecord) {
            b.append('{');
            boolean first = true;
            for (Map.Entry<String, Value<SBool, CWord>> f : v.fromVRecord().entrySet()) {
                if (!first) b.append(", ");
                first = false;
                b.append(f.getKey()).append(" = ");
                go(b, f.getValue());
            }
            b.append('}');
        } else if (v instanceof VStream) {
            // Only the displayed prefix is forced.
            List<Value<SBool, CWord>> prefix = v.fromVStream().take(opts.getInfLength());
            b.append('[');
            for (Value<SBool, CWord> x : prefix) {
                go(b, x);
                b.append(", ");
            }
            b.append("...]");
        } else if (v instanceof VFun) {
            b.append("<function>");
        } else if (v instanceof VPoly) {
            b.append("<polymorphic value>");
        }
    }

    private void list(StringBuilder b, String open, List<Value<SBool, CWord>> vs, String close) {
        b.append(open);
        for (int i = 0; i != vs.size(); ++i) {
            if (i != 0) b.append(", ");
            go(b, vs.get(i));
        }
        b.append(close);
    }
}

package com.galois.cryptol.codegen.sbvc;

import java.util.List;

import com.galois.cryptol.codegen.Panic;
import com.galois.cryptol.codegen.ast.ECon;
import com.galois.cryptol.codegen.ast.Expr;
import com.galois.cryptol.codegen.ast.QName;
import com.galois.cryptol.codegen.ast.TVar;
import com.galois.cryptol.codegen.ast.Type;
import com.galois.cryptol.codegen.eval.Evaluator;
import com.galois.cryptol.codegen.eval.ExprOperations;
import com.galois.cryptol.codegen.eval.PPOpts;
import com.galois.cryptol.codegen.eval.TValue;
import com.galois.cryptol.codegen.eval.TypeEvaluator;
import com.galois.cryptol.codegen.eval.VBit;
import com.galois.cryptol.codegen.eval.VSeq;
import com.galois.cryptol.codegen.eval.VStream;
import com.galois.cryptol.codegen.eval.VWord;
import com.galois.cryptol.codegen.eval.Value;
import com.galois.cryptol.codegen.sym.SBool;

/**
 * Evaluation over symbolic bits and {@link CWord}s in an {@link Env}.
 */
public final class SBVCOperations implements ExprOperations<Env, SBool, CWord> {
    private final ValuePrinter printer;

    public SBVCOperations() {
        this(PPOpts.DEFAULT);
    }

    /**
     * @param opts Options used when values are rendered in diagnostics.
     */
    public SBVCOperations(PPOpts opts) {
        this.printer = new ValuePrinter(opts);
    }

    /** An evaluator using the default rendering options. */
    public static Evaluator<Env, SBool, CWord> withSBVC() {
        return new Evaluator<Env, SBool, CWord>(new SBVCOperations());
    }

    /** Evaluate <code>expr</code> in <code>env</code>. */
    public static Value<SBool, CWord> evalExpr(Env env, Expr expr) {
        return withSBVC().evaluate(env, expr);
    }

    public Value<SBool, CWord> evalECon(ECon con) {
        return SBVCPrims.evalECon(con);
    }

    public Env bindTerm(QName name, Value<SBool, CWord> value, Env env) {
        return env.bindLocalTerm(name, value);
    }

    public Env bindType(TVar var, TValue type, Env env) {
        return env.bindType(var, type);
    }

    public Value<SBool, CWord> lookupTerm(QName name, Env env) {
        return env.lookupTerm(name);
    }

    public TValue evalType(Env env, Type type) {
        return TypeEvaluator.evalType(env, type);
    }

    /**
     * Select element <code>index</code>: a bit of a word counted from the
     * most significant end, or an element of a sequence or stream.
     */
    public Value<SBool, CWord> listSel(int index, Value<SBool, CWord> value) {
        if (value instanceof VWord) {
            CWord w = value.fromVWord();
            if (!w.isSupported()) {
                throw Panic.panic("SBVCOperations.listSel",
                                  "Trying to index into a word of unsupported size " + w.width());
            }
            return new VBit<SBool, CWord>(w.testBit(index));
        }
        if (value instanceof VSeq) {
            List<Value<SBool, CWord>> vs = value.fromVSeq();
            if (index >= vs.size()) {
                throw Panic.panic("SBVCOperations.listSel",
                                  "Index " + index + " out of range for a sequence of length " + vs.size());
            }
            return vs.get(index);
        }
        if (value instanceof VStream) {
            return value.fromVStream().get(index);
        }
        throw Panic.panic("SBVCOperations.listSel",
                          "Trying to index into a non-list value:",
                          printer.print(value));
    }

    public Boolean asLiteral(SBool cond) {
        return cond.asLiteral();
    }

    public Value<SBool, CWord> ite(SBool cond, Value<SBool, CWord> then, Value<SBool, CWord> otherwise) {
        return SBVCMerge.INSTANCE.ite(cond, then, otherwise);
    }

    public CWord packWord(List<SBool> bits) {
        return CWord.pack(bits);
    }

    public String render(Value<SBool, CWord> value) {
        return printer.print(value);
    }
}

package com.galois.cryptol.codegen.eval;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.galois.cryptol.codegen.Panic;
import com.galois.cryptol.codegen.ast.Decl;
import com.galois.cryptol.codegen.ast.EAbs;
import com.galois.cryptol.codegen.ast.EApp;
import com.galois.cryptol.codegen.ast.ECast;
import com.galois.cryptol.codegen.ast.EConExpr;
import com.galois.cryptol.codegen.ast.EIf;
import com.galois.cryptol.codegen.ast.EList;
import com.galois.cryptol.codegen.ast.ERec;
import com.galois.cryptol.codegen.ast.ESel;
import com.galois.cryptol.codegen.ast.ETAbs;
import com.galois.cryptol.codegen.ast.ETApp;
import com.galois.cryptol.codegen.ast.ETuple;
import com.galois.cryptol.codegen.ast.EVar;
import com.galois.cryptol.codegen.ast.EWhere;
import com.galois.cryptol.codegen.ast.Expr;
import com.galois.cryptol.codegen.ast.Selector;

/**
 * Evaluates typed expressions to values.  The evaluator itself knows
 * nothing about how bits, words and environments are represented; all of
 * that is delegated to an {@link ExprOperations} table.
 */
public final class Evaluator<E, B, W> {
    private final ExprOperations<E, B, W> ops;

    public Evaluator(ExprOperations<E, B, W> ops) {
        if (ops == null) throw new NullPointerException("ops");
        this.ops = ops;
    }

    public ExprOperations<E, B, W> getOperations() {
        return ops;
    }

    /**
     * Evaluate <code>expr</code> in <code>env</code>.
     */
    public Value<B, W> evaluate(E env, Expr expr) {
        return expr.accept(new Visitor(env));
    }

    /**
     * Evaluate local declarations in order, each in the environment that
     * binds the declarations before it.
     *
     * @return the environment extended with every declaration.
     */
    public E evalDecls(E env, List<Decl> decls) {
        E cur = env;
        for (Decl d : decls) {
            cur = ops.bindTerm(d.getName(), evaluate(cur, d.getDefinition()), cur);
        }
        return cur;
    }

    private Value<B, W> select(final Selector sel, Value<B, W> v) {
        if (sel instanceof Selector.ListSel) {
            return ops.listSel(((Selector.ListSel) sel).getIndex(), v);
        }
        // Tuple and record selection map over sequences and functions.
        if (v instanceof VSeq) {
            List<Value<B, W>> res = new ArrayList<Value<B, W>>();
            for (Value<B, W> x : v.fromVSeq()) {
                res.add(select(sel, x));
            }
            return new VSeq<B, W>(res);
        }
        if (v instanceof VStream) {
            final LazyStream<Value<B, W>> xs = v.fromVStream();
            return new VStream<B, W>(new LazyStream<Value<B, W>>() {
                protected Value<B, W> compute(int i) {
                    return select(sel, xs.get(i));
                }
            });
        }
        if (v instanceof VFun) {
            final Value<B, W> f = v;
            return new VFun<B, W>(new ValueFunction<B, W>() {
                public Value<B, W> apply(Value<B, W> x) {
                    return select(sel, f.apply(x));
                }
            });
        }
        if (sel instanceof Selector.TupleSel) {
            int i = ((Selector.TupleSel) sel).getIndex();
            List<Value<B, W>> elems = v.fromVTuple();
            if (i >= elems.size()) {
                throw Panic.panic("Evaluator.select",
                                  "Tuple index " + i + " out of range for a "
                                  + elems.size() + "-tuple");
            }
            return elems.get(i);
        }
        return v.lookupRecord(((Selector.RecordSel) sel).getField());
    }

    private final class Visitor implements Expr.Visitor<Value<B, W>> {
        private final E env;

        Visitor(E env) {
            this.env = env;
        }

        private Value<B, W> eval(Expr e) {
            return evaluate(env, e);
        }

        public Value<B, W> visitECon(EConExpr e) {
            return ops.evalECon(e.getCon());
        }

        public Value<B, W> visitEList(EList e) {
            List<Value<B, W>> vs = new ArrayList<Value<B, W>>(e.getElems().size());
            for (Expr x : e.getElems()) {
                vs.add(eval(x));
            }
            if (ops.evalType(env, e.getElemType()).isBit()) {
                List<B> bits = new ArrayList<B>(vs.size());
                for (Value<B, W> v : vs) {
                    bits.add(v.fromVBit());
                }
                return new VWord<B, W>(ops.packWord(bits));
            }
            return new VSeq<B, W>(vs);
        }

        public Value<B, W> visitETuple(ETuple e) {
            List<Value<B, W>> vs = new ArrayList<Value<B, W>>(e.getElems().size());
            for (Expr x : e.getElems()) {
                vs.add(eval(x));
            }
            return new VTuple<B, W>(vs);
        }

        public Value<B, W> visitERec(ERec e) {
            Map<String, Value<B, W>> fs = new LinkedHashMap<String, Value<B, W>>();
            for (Map.Entry<String, Expr> f : e.getFields().entrySet()) {
                fs.put(f.getKey(), eval(f.getValue()));
            }
            return new VRecord<B, W>(fs);
        }

        public Value<B, W> visitESel(ESel e) {
            return select(e.getSelector(), eval(e.getExpr()));
        }

        public Value<B, W> visitEIf(EIf e) {
            B c = eval(e.getCond()).fromVBit();
            Boolean known = ops.asLiteral(c);
            if (known != null) {
                return eval(known.booleanValue() ? e.getThen() : e.getOtherwise());
            }
            return ops.ite(c, eval(e.getThen()), eval(e.getOtherwise()));
        }

        public Value<B, W> visitEVar(EVar e) {
            return ops.lookupTerm(e.getName(), env);
        }

        public Value<B, W> visitETAbs(final ETAbs e) {
            return new VPoly<B, W>(new TypeFunction<B, W>() {
                public Value<B, W> apply(TValue t) {
                    return evaluate(ops.bindType(e.getParam(), t, env), e.getBody());
                }
            });
        }

        public Value<B, W> visitETApp(ETApp e) {
            return eval(e.getFun()).instantiate(ops.evalType(env, e.getType()));
        }

        public Value<B, W> visitEApp(EApp e) {
            return eval(e.getFun()).apply(eval(e.getArg()));
        }

        public Value<B, W> visitEAbs(final EAbs e) {
            return new VFun<B, W>(new ValueFunction<B, W>() {
                public Value<B, W> apply(Value<B, W> x) {
                    return evaluate(ops.bindTerm(e.getParam(), x, env), e.getBody());
                }
            });
        }

        public Value<B, W> visitECast(ECast e) {
            return eval(e.getExpr());
        }

        public Value<B, W> visitEWhere(EWhere e) {
            return evaluate(evalDecls(env, e.getDecls()), e.getBody());
        }
    }
}

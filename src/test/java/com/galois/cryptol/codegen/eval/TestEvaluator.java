package com.galois.cryptol.codegen.eval;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.junit.Assert;
import org.junit.Test;

import com.galois.cryptol.codegen.Panic;
import com.galois.cryptol.codegen.ast.EAbs;
import com.galois.cryptol.codegen.ast.ECon;
import com.galois.cryptol.codegen.ast.EIf;
import com.galois.cryptol.codegen.ast.EList;
import com.galois.cryptol.codegen.ast.Expr;
import com.galois.cryptol.codegen.ast.QName;
import com.galois.cryptol.codegen.ast.TVar;
import com.galois.cryptol.codegen.ast.Type;
import com.galois.cryptol.codegen.sym.BinOp;

/**
 * Runs the evaluator with a concrete backend: bits are Booleans and words
 * are unsigned values of any width.
 */
public class TestEvaluator {
    /** A concrete word. */
    static final class Word {
        final int width;
        final BigInteger value;

        Word(int width, BigInteger value) {
            this.width = width;
            this.value = value.mod(BigInteger.ONE.shiftLeft(width));
        }
    }

    /** A concrete environment; binding copies. */
    static final class Bound implements TypeEnv {
        final Map<QName, Value<Boolean, Word>> terms;
        final Map<TVar, TValue> types;

        Bound(Map<QName, Value<Boolean, Word>> terms, Map<TVar, TValue> types) {
            this.terms = terms;
            this.types = types;
        }

        static final Bound EMPTY = new Bound(new HashMap<QName, Value<Boolean, Word>>(),
                                             new HashMap<TVar, TValue>());

        public TValue lookupType(TVar v) {
            return types.get(v);
        }
    }

    static final Merge<Boolean, Word> MERGE = new Merge<Boolean, Word>() {
        protected Boolean asLiteral(Boolean c) { return c; }
        protected Boolean iteBit(Boolean c, Boolean t, Boolean f) { return c ? t : f; }
        protected Word iteWord(Boolean c, Word t, Word f) { return c ? t : f; }
    };

    static final Prims.OrderOps<Boolean, Word, Integer> ORDER =
        new Prims.OrderOps<Boolean, Word, Integer>() {
            public Integer cmpBit(Boolean l, Boolean r) { return Integer.signum(l.compareTo(r)); }
            public Integer cmpWord(Word l, Word r) { return l.value.compareTo(r.value); }
            public Integer equal() { return 0; }
            public Integer lexico(Integer first, Integer rest) { return first != 0 ? first : rest; }
        };

    static final ExprOperations<Bound, Boolean, Word> CONCRETE =
        new ExprOperations<Bound, Boolean, Word>() {
            public Value<Boolean, Word> evalECon(ECon con) {
                switch (con) {
                case TRUE:
                    return new VBit<Boolean, Word>(Boolean.TRUE);
                case FALSE:
                    return new VBit<Boolean, Word>(Boolean.FALSE);
                case DEMOTE:
                    return Prims.ecDemoteGeneric("concrete", new Prims.WordMaker<Word>() {
                            public Word make(BigInteger width, BigInteger value) {
                                return new Word(width.intValue(), value);
                            }
                        });
                case PLUS:
                    return Prims.binary(Prims.<Boolean, Word>pointwiseBinary(
                        new BinOp<Boolean>() {
                            public Boolean apply(Boolean x, Boolean y) { return x ^ y; }
                        },
                        new Prims.SizedBinOp<Word>() {
                            public Word apply(BigInteger width, Word l, Word r) {
                                return new Word(width.intValue(), l.value.add(r.value));
                            }
                        }));
                case LT:
                    return Prims.binary(Prims.cmpOrder(ORDER, new Prims.OrderTest<Integer, Boolean>() {
                            public Boolean test(Integer o) { return o < 0; }
                        }));
                case MAX:
                    return Prims.binary(Prims.withOrder(ORDER, new Prims.OrderTest<Integer, Boolean>() {
                            public Boolean test(Integer o) { return o >= 0; }
                        }, MERGE));
                default:
                    throw Panic.panic("TestEvaluator", "operation not supported: " + con);
                }
            }

            public Bound bindTerm(QName n, Value<Boolean, Word> v, Bound env) {
                Map<QName, Value<Boolean, Word>> m = new HashMap<QName, Value<Boolean, Word>>(env.terms);
                m.put(n, v);
                return new Bound(m, env.types);
            }

            public Bound bindType(TVar var, TValue t, Bound env) {
                Map<TVar, TValue> m = new HashMap<TVar, TValue>(env.types);
                m.put(var, t);
                return new Bound(env.terms, m);
            }

            public Value<Boolean, Word> lookupTerm(QName n, Bound env) {
                Value<Boolean, Word> v = env.terms.get(n);
                if (v == null) throw Panic.panic("TestEvaluator", "No term named " + n);
                return v;
            }

            public TValue evalType(Bound env, Type t) {
                return TypeEvaluator.evalType(env, t);
            }

            public Value<Boolean, Word> listSel(int i, Value<Boolean, Word> v) {
                return v.fromVSeq().get(i);
            }

            public Boolean asLiteral(Boolean c) {
                return c;
            }

            public Value<Boolean, Word> ite(Boolean c, Value<Boolean, Word> t, Value<Boolean, Word> f) {
                return MERGE.ite(c, t, f);
            }

            public Word packWord(List<Boolean> bits) {
                BigInteger r = BigInteger.ZERO;
                for (Boolean b : bits) {
                    r = r.shiftLeft(1).add(b ? BigInteger.ONE : BigInteger.ZERO);
                }
                return new Word(bits.size(), r);
            }

            public String render(Value<Boolean, Word> v) {
                return v instanceof VWord ? v.fromVWord().value.toString() : "<value>";
            }
        };

    private final Evaluator<Bound, Boolean, Word> evaluator =
        new Evaluator<Bound, Boolean, Word>(CONCRETE);

    private Word eval(Expr e) {
        return evaluator.evaluate(Bound.EMPTY, e).fromVWord();
    }

    private static Expr plus(long width, Expr a, Expr b) {
        return Expr.app(Expr.tapp(Expr.con(ECon.PLUS), Type.word(width)), a, b);
    }

    @Test
    public void wordsOfAnyWidth() {
        Word w = eval(plus(12, Expr.word(4095, 12), Expr.word(2, 12)));
        Assert.assertEquals(12, w.width);
        Assert.assertEquals(BigInteger.ONE, w.value);
    }

    @Test
    public void bitListsPackWithTheBackend() {
        Expr bits = new EList(Arrays.asList(Expr.con(ECon.TRUE), Expr.con(ECon.FALSE), Expr.con(ECon.TRUE)),
                              Type.BIT);
        Word w = eval(bits);
        Assert.assertEquals(3, w.width);
        Assert.assertEquals(BigInteger.valueOf(5), w.value);
    }

    @Test
    public void conditionalsAndComparisons() {
        Expr lt = Expr.app(Expr.tapp(Expr.con(ECon.LT), Type.word(8)), Expr.word(3, 8), Expr.word(4, 8));
        Expr e = new EIf(lt, Expr.word(10, 8), Expr.word(20, 8));
        Assert.assertEquals(BigInteger.TEN, eval(e).value);
    }

    @Test
    public void knownConditionsSkipTheOtherBranch() {
        Expr unbound = Expr.var(QName.local("nowhere"));
        Assert.assertEquals(BigInteger.ONE,
                            eval(new EIf(Expr.con(ECon.TRUE), Expr.word(1, 8), unbound)).value);
        Assert.assertEquals(BigInteger.valueOf(2),
                            eval(new EIf(Expr.con(ECon.FALSE), unbound, Expr.word(2, 8))).value);
    }

    @Test
    public void maxSelectsOperand() {
        Expr e = Expr.app(Expr.tapp(Expr.con(ECon.MAX), Type.word(8)), Expr.word(3, 8), Expr.word(9, 8));
        Assert.assertEquals(BigInteger.valueOf(9), eval(e).value);
    }

    @Test
    public void closuresCaptureTheirEnvironment() {
        QName x = QName.local("x");
        QName y = QName.local("y");
        // (\x -> \y -> x + y) 5 6
        Expr add = new EAbs(x, Type.word(8), new EAbs(y, Type.word(8),
                                                      plus(8, Expr.var(x), Expr.var(y))));
        Assert.assertEquals(BigInteger.valueOf(11),
                            eval(Expr.app(add, Expr.word(5, 8), Expr.word(6, 8))).value);
    }

    @Test
    public void lazyStreamsMemoize() {
        final int[] calls = { 0 };
        LazyStream<Integer> s = new LazyStream<Integer>() {
            protected Integer compute(int i) {
                calls[0]++;
                return i * i;
            }
        };
        Assert.assertEquals(Integer.valueOf(9), s.get(3));
        Assert.assertEquals(4, calls[0]);
        Assert.assertEquals(Arrays.asList(0, 1), s.take(2));
        Assert.assertEquals(4, calls[0]);
        Assert.assertEquals(4, s.forced());
    }

    @Test
    public void typeEvaluation() {
        TVar n = new TVar(1, "n");
        Bound env = CONCRETE.bindType(n, TValue.num(8), Bound.EMPTY);
        Type t = Type.seq(n, Type.BIT);
        Assert.assertEquals(TValue.word(8), TypeEvaluator.evalType(env, t));
    }

    @Test(expected = Panic.class)
    public void unboundTypeVariableIsFatal() {
        TypeEvaluator.evalType(Bound.EMPTY, new TVar(2, "m"));
    }

    @Test(expected = Panic.class)
    public void mergingDifferentShapesIsFatal() {
        MERGE.mergeValue(Boolean.TRUE, new VBit<Boolean, Word>(Boolean.TRUE),
                         new VWord<Boolean, Word>(new Word(8, BigInteger.ONE)));
    }
}

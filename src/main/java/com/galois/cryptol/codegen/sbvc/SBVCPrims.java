package com.galois.cryptol.codegen.sbvc;

import java.math.BigInteger;

import com.galois.cryptol.codegen.Panic;
import com.galois.cryptol.codegen.ast.ECon;
import com.galois.cryptol.codegen.eval.Prims;
import com.galois.cryptol.codegen.eval.TValue;
import com.galois.cryptol.codegen.eval.TypeFunction;
import com.galois.cryptol.codegen.eval.VBit;
import com.galois.cryptol.codegen.eval.VPoly;
import com.galois.cryptol.codegen.eval.Value;
import com.galois.cryptol.codegen.sym.BinOp;
import com.galois.cryptol.codegen.sym.SBool;
import com.galois.cryptol.codegen.sym.SOrdering;
import com.galois.cryptol.codegen.sym.SWord;
import com.galois.cryptol.codegen.sym.UnOp;
import com.galois.cryptol.codegen.sym.Width;
import com.galois.cryptol.codegen.sym.WordBinOp;
import com.galois.cryptol.codegen.sym.WordUnOp;

/**
 * Primitive operators over symbolic bits and {@link CWord}s.
 */
public final class SBVCPrims {
    private SBVCPrims() {}

    private static final String LOCATION = "SBVCPrims.evalECon";

    /** Orderings on bits (False before True) and unsigned words. */
    static final Prims.OrderOps<SBool, CWord, SOrdering> ORDER =
        new Prims.OrderOps<SBool, CWord, SOrdering>() {
            public SOrdering cmpBit(SBool l, SBool r) {
                return SOrdering.of(l.not().and(r), l.xor(r).not());
            }

            public SOrdering cmpWord(CWord l, CWord r) {
                return CWord.cmp(l, r);
            }

            public SOrdering equal() {
                return SOrdering.EQ;
            }

            public SOrdering lexico(SOrdering first, SOrdering rest) {
                return first.thenCompare(rest);
            }
        };

    static final Prims.OrderTest<SOrdering, SBool> LT =
        new Prims.OrderTest<SOrdering, SBool>() {
            public SBool test(SOrdering o) { return o.lt(); }
        };

    static final Prims.OrderTest<SOrdering, SBool> GT =
        new Prims.OrderTest<SOrdering, SBool>() {
            public SBool test(SOrdering o) { return o.gt(); }
        };

    static final Prims.OrderTest<SOrdering, SBool> NGT =
        new Prims.OrderTest<SOrdering, SBool>() {
            public SBool test(SOrdering o) { return o.ngt(); }
        };

    static final Prims.OrderTest<SOrdering, SBool> NLT =
        new Prims.OrderTest<SOrdering, SBool>() {
            public SBool test(SOrdering o) { return o.nlt(); }
        };

    static final Prims.OrderTest<SOrdering, SBool> EQ =
        new Prims.OrderTest<SOrdering, SBool>() {
            public SBool test(SOrdering o) { return o.eq(); }
        };

    static final Prims.OrderTest<SOrdering, SBool> NEQ =
        new Prims.OrderTest<SOrdering, SBool>() {
            public SBool test(SOrdering o) { return o.neq(); }
        };

    private static final WordBinOp ADD = new WordBinOp() {
        public <W extends Width> SWord<W> apply(SWord<W> x, SWord<W> y) { return x.add(y); }
    };

    private static final WordBinOp SUB = new WordBinOp() {
        public <W extends Width> SWord<W> apply(SWord<W> x, SWord<W> y) { return x.sub(y); }
    };

    private static final WordBinOp MUL = new WordBinOp() {
        public <W extends Width> SWord<W> apply(SWord<W> x, SWord<W> y) { return x.mul(y); }
    };

    private static final WordBinOp DIV = new WordBinOp() {
        public <W extends Width> SWord<W> apply(SWord<W> x, SWord<W> y) { return x.sDiv(y); }
    };

    private static final WordBinOp MOD = new WordBinOp() {
        public <W extends Width> SWord<W> apply(SWord<W> x, SWord<W> y) { return x.sMod(y); }
    };

    private static final WordUnOp NEG = new WordUnOp() {
        public <W extends Width> SWord<W> apply(SWord<W> x) { return x.negate(); }
    };

    private static final WordBinOp AND = new WordBinOp() {
        public <W extends Width> SWord<W> apply(SWord<W> x, SWord<W> y) { return x.and(y); }
    };

    private static final WordBinOp OR = new WordBinOp() {
        public <W extends Width> SWord<W> apply(SWord<W> x, SWord<W> y) { return x.or(y); }
    };

    private static final WordBinOp XOR = new WordBinOp() {
        public <W extends Width> SWord<W> apply(SWord<W> x, SWord<W> y) { return x.xor(y); }
    };

    private static final WordUnOp COMPLEMENT = new WordUnOp() {
        public <W extends Width> SWord<W> apply(SWord<W> x) { return x.complement(); }
    };

    /**
     * Return the value of a primitive.
     *
     * Primitives with no symbolic implementation panic when instantiated.
     */
    public static Value<SBool, CWord> evalECon(ECon con) {
        switch (con) {
        case TRUE:
            return new VBit<SBool, CWord>(SBool.TRUE);
        case FALSE:
            return new VBit<SBool, CWord>(SBool.FALSE);
        case DEMOTE:
            return Prims.ecDemoteGeneric(LOCATION, new Prims.WordMaker<CWord>() {
                    public CWord make(BigInteger width, BigInteger value) {
                        return CWord.makeWord(width, value);
                    }
                });

        case PLUS:  return binArith("+", ADD);
        case MINUS: return binArith("-", SUB);
        case MUL:   return binArith("*", MUL);
        case DIV:   return binArith("div", DIV);
        case MOD:   return binArith("mod", MOD);
        case NEG:   return unArith("neg", NEG);

        case LT:     return Prims.binary(Prims.cmpOrder(ORDER, LT));
        case GT:     return Prims.binary(Prims.cmpOrder(ORDER, GT));
        case LT_EQ:  return Prims.binary(Prims.cmpOrder(ORDER, NGT));
        case GT_EQ:  return Prims.binary(Prims.cmpOrder(ORDER, NLT));
        case EQ:     return Prims.binary(Prims.cmpOrder(ORDER, EQ));
        case NOT_EQ: return Prims.binary(Prims.cmpOrder(ORDER, NEQ));

        case FUN_EQ:     return Prims.<SBool, CWord, SOrdering>funCmp(ORDER, EQ);
        case FUN_NOT_EQ: return Prims.<SBool, CWord, SOrdering>funCmp(ORDER, NEQ);

        case MIN: return Prims.binary(Prims.withOrder(ORDER, NGT, SBVCMerge.INSTANCE));
        case MAX: return Prims.binary(Prims.withOrder(ORDER, NLT, SBVCMerge.INSTANCE));

        case AND:
            return bitwise("&&", new BinOp<SBool>() {
                    public SBool apply(SBool x, SBool y) { return x.and(y); }
                }, AND);
        case OR:
            return bitwise("||", new BinOp<SBool>() {
                    public SBool apply(SBool x, SBool y) { return x.or(y); }
                }, OR);
        case XOR:
            return bitwise("^", new BinOp<SBool>() {
                    public SBool apply(SBool x, SBool y) { return x.xor(y); }
                }, XOR);
        case COMPL:
            return Prims.unary(Prims.<SBool, CWord>pointwiseUnary(new UnOp<SBool>() {
                    public SBool apply(SBool x) { return x.not(); }
                }, sizedUnary("~", COMPLEMENT)));

        default:
            return unsupported(con);
        }
    }

    /**
     * A primitive with no symbolic implementation.  Evaluating it is
     * harmless; instantiating it panics.
     */
    private static Value<SBool, CWord> unsupported(final ECon con) {
        return new VPoly<SBool, CWord>(new TypeFunction<SBool, CWord>() {
                public Value<SBool, CWord> apply(TValue type) {
                    throw Panic.panic(LOCATION, "operation not supported: " + con.getSymbol());
                }
            });
    }

    private static Value<SBool, CWord> binArith(final String name, WordBinOp op) {
        BinOp<SBool> onBits = new BinOp<SBool>() {
            public SBool apply(SBool x, SBool y) {
                throw Panic.panic(LOCATION, "Bits were a complete surprise when evaluating " + name);
            }
        };
        return Prims.binary(Prims.<SBool, CWord>pointwiseBinary(onBits, sizedBinary(name, op)));
    }

    private static Value<SBool, CWord> unArith(final String name, WordUnOp op) {
        UnOp<SBool> onBits = new UnOp<SBool>() {
            public SBool apply(SBool x) {
                throw Panic.panic(LOCATION, "Bits were a complete surprise when evaluating " + name);
            }
        };
        return Prims.unary(Prims.<SBool, CWord>pointwiseUnary(onBits, sizedUnary(name, op)));
    }

    private static Value<SBool, CWord> bitwise(String name, BinOp<SBool> onBits, WordBinOp op) {
        return Prims.binary(Prims.<SBool, CWord>pointwiseBinary(onBits, sizedBinary(name, op)));
    }

    /**
     * Lift a word operation for use in a primitive.  Unlike
     * {@link CWord#liftBinary}, operands of unsupported width are rejected
     * even when their widths agree.
     */
    static Prims.SizedBinOp<CWord> sizedBinary(final String name, final WordBinOp op) {
        return new Prims.SizedBinOp<CWord>() {
            public CWord apply(BigInteger width, CWord l, CWord r) {
                if (l.width() == r.width()) {
                    requireSupported(name, l);
                }
                return CWord.liftBinary(op, l, r);
            }
        };
    }

    static Prims.SizedUnOp<CWord> sizedUnary(final String name, final WordUnOp op) {
        return new Prims.SizedUnOp<CWord>() {
            public CWord apply(BigInteger width, CWord x) {
                requireSupported(name, x);
                return CWord.liftUnary(op, x);
            }
        };
    }

    private static void requireSupported(String name, CWord w) {
        if (!w.isSupported()) {
            throw Panic.panic(LOCATION,
                              "Words of width " + w.width()
                              + " are not supported when evaluating " + name);
        }
    }
}

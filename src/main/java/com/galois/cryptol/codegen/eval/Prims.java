package com.galois.cryptol.codegen.eval;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.galois.cryptol.codegen.Panic;
import com.galois.cryptol.codegen.sym.BinOp;
import com.galois.cryptol.codegen.sym.UnOp;

/**
 * Combinators for building primitive operators that work for any bit and
 * word representation.
 *
 * Primitives are polymorphic values: <code>binary(f)</code> is
 * <code>\{a} (x : a) (y : a) -&gt; f a x y</code>, and the pointwise and
 * comparison combinators follow the shape of the instantiating type.
 */
public final class Prims {
    private Prims() {}

    /** A binary operation on values that may inspect their common type. */
    public interface TypedBinOp<B, W> {
        Value<B, W> apply(TValue type, Value<B, W> l, Value<B, W> r);
    }

    /** A unary operation on values that may inspect their type. */
    public interface TypedUnOp<B, W> {
        Value<B, W> apply(TValue type, Value<B, W> x);
    }

    /** A binary word operation given the width of its operands. */
    public interface SizedBinOp<W> {
        W apply(BigInteger width, W l, W r);
    }

    /** A unary word operation given the width of its operand. */
    public interface SizedUnOp<W> {
        W apply(BigInteger width, W x);
    }

    /** Builds a word of a given width from a value. */
    public interface WordMaker<W> {
        W make(BigInteger width, BigInteger value);
    }

    /**
     * Three-way comparison on bits and words, yielding an ordering of type
     * <code>O</code>.
     */
    public interface OrderOps<B, W, O> {
        O cmpBit(B l, B r);

        O cmpWord(W l, W r);

        /** The ordering of two empty sequences. */
        O equal();

        /** <code>first</code>, unless it is equality, then <code>rest</code>. */
        O lexico(O first, O rest);
    }

    /** A relation read off an ordering, such as "less than". */
    public interface OrderTest<O, B> {
        B test(O ordering);
    }

    public static <B, W> Value<B, W> lam(ValueFunction<B, W> f) {
        return new VFun<B, W>(f);
    }

    public static <B, W> Value<B, W> tlam(TypeFunction<B, W> f) {
        return new VPoly<B, W>(f);
    }

    /**
     * Wrap a typed binary operation as <code>\{a} x y -&gt; op a x y</code>.
     */
    public static <B, W> Value<B, W> binary(final TypedBinOp<B, W> op) {
        return tlam(new TypeFunction<B, W>() {
            public Value<B, W> apply(final TValue ty) {
                return lam(new ValueFunction<B, W>() {
                    public Value<B, W> apply(final Value<B, W> l) {
                        return lam(new ValueFunction<B, W>() {
                            public Value<B, W> apply(Value<B, W> r) {
                                return op.apply(ty, l, r);
                            }
                        });
                    }
                });
            }
        });
    }

    /**
     * Wrap a typed unary operation as <code>\{a} x -&gt; op a x</code>.
     */
    public static <B, W> Value<B, W> unary(final TypedUnOp<B, W> op) {
        return tlam(new TypeFunction<B, W>() {
            public Value<B, W> apply(final TValue ty) {
                return lam(new ValueFunction<B, W>() {
                    public Value<B, W> apply(Value<B, W> x) {
                        return op.apply(ty, x);
                    }
                });
            }
        });
    }

    /**
     * Extend operations on bits and words to every type built from them:
     * sequences, streams, tuples and records component-wise, functions on
     * their results.
     */
    public static <B, W> TypedBinOp<B, W> pointwiseBinary(final BinOp<B> bop,
                                                          final SizedBinOp<W> wop) {
        return new TypedBinOp<B, W>() {
            public Value<B, W> apply(TValue ty, Value<B, W> l, Value<B, W> r) {
                return loopBinary(bop, wop, ty, l, r);
            }
        };
    }

    private static <B, W> Value<B, W> loopBinary(final BinOp<B> bop,
                                                 final SizedBinOp<W> wop,
                                                 final TValue ty,
                                                 final Value<B, W> l,
                                                 final Value<B, W> r) {
        switch (ty.getKind()) {
        case BIT:
            return new VBit<B, W>(bop.apply(l.fromVBit(), r.fromVBit()));

        case SEQ: {
            final TValue elem = ty.seqElem();
            TValue len = ty.seqLength();
            if (len.isFin() && elem.isBit()) {
                return new VWord<B, W>(wop.apply(len.getNum(), l.fromVWord(), r.fromVWord()));
            }
            if (len.isInf()) {
                final LazyStream<Value<B, W>> ls = l.fromVStream();
                final LazyStream<Value<B, W>> rs = r.fromVStream();
                return new VStream<B, W>(new LazyStream<Value<B, W>>() {
                    protected Value<B, W> compute(int i) {
                        return loopBinary(bop, wop, elem, ls.get(i), rs.get(i));
                    }
                });
            }
            List<Value<B, W>> ls = l.fromVSeq();
            List<Value<B, W>> rs = r.fromVSeq();
            List<Value<B, W>> res = new ArrayList<Value<B, W>>(ls.size());
            for (int i = 0; i != ls.size(); ++i) {
                res.add(loopBinary(bop, wop, elem, ls.get(i), rs.get(i)));
            }
            return new VSeq<B, W>(res);
        }

        case FUN:
            return lam(new ValueFunction<B, W>() {
                public Value<B, W> apply(Value<B, W> x) {
                    return loopBinary(bop, wop, ty.funResult(), l.apply(x), r.apply(x));
                }
            });

        case TUPLE: {
            List<TValue> tys = ty.tupleElems();
            List<Value<B, W>> ls = l.fromVTuple();
            List<Value<B, W>> rs = r.fromVTuple();
            List<Value<B, W>> res = new ArrayList<Value<B, W>>(tys.size());
            for (int i = 0; i != tys.size(); ++i) {
                res.add(loopBinary(bop, wop, tys.get(i), ls.get(i), rs.get(i)));
            }
            return new VTuple<B, W>(res);
        }

        case RECORD: {
            Map<String, Value<B, W>> res = new LinkedHashMap<String, Value<B, W>>();
            for (Map.Entry<String, TValue> f : ty.recordFields().entrySet()) {
                String n = f.getKey();
                res.put(n, loopBinary(bop, wop, f.getValue(), l.lookupRecord(n), r.lookupRecord(n)));
            }
            return new VRecord<B, W>(res);
        }

        default:
            throw Panic.panic("Prims.pointwiseBinary", "Invalid type " + ty);
        }
    }

    /**
     * Unary counterpart of {@link #pointwiseBinary}.
     */
    public static <B, W> TypedUnOp<B, W> pointwiseUnary(final UnOp<B> bop,
                                                        final SizedUnOp<W> wop) {
        return new TypedUnOp<B, W>() {
            public Value<B, W> apply(TValue ty, Value<B, W> x) {
                return loopUnary(bop, wop, ty, x);
            }
        };
    }

    private static <B, W> Value<B, W> loopUnary(final UnOp<B> bop,
                                                final SizedUnOp<W> wop,
                                                final TValue ty,
                                                final Value<B, W> x) {
        switch (ty.getKind()) {
        case BIT:
            return new VBit<B, W>(bop.apply(x.fromVBit()));

        case SEQ: {
            final TValue elem = ty.seqElem();
            TValue len = ty.seqLength();
            if (len.isFin() && elem.isBit()) {
                return new VWord<B, W>(wop.apply(len.getNum(), x.fromVWord()));
            }
            if (len.isInf()) {
                final LazyStream<Value<B, W>> xs = x.fromVStream();
                return new VStream<B, W>(new LazyStream<Value<B, W>>() {
                    protected Value<B, W> compute(int i) {
                        return loopUnary(bop, wop, elem, xs.get(i));
                    }
                });
            }
            List<Value<B, W>> res = new ArrayList<Value<B, W>>();
            for (Value<B, W> v : x.fromVSeq()) {
                res.add(loopUnary(bop, wop, elem, v));
            }
            return new VSeq<B, W>(res);
        }

        case FUN:
            return lam(new ValueFunction<B, W>() {
                public Value<B, W> apply(Value<B, W> a) {
                    return loopUnary(bop, wop, ty.funResult(), x.apply(a));
                }
            });

        case TUPLE: {
            List<TValue> tys = ty.tupleElems();
            List<Value<B, W>> xs = x.fromVTuple();
            List<Value<B, W>> res = new ArrayList<Value<B, W>>(tys.size());
            for (int i = 0; i != tys.size(); ++i) {
                res.add(loopUnary(bop, wop, tys.get(i), xs.get(i)));
            }
            return new VTuple<B, W>(res);
        }

        case RECORD: {
            Map<String, Value<B, W>> res = new LinkedHashMap<String, Value<B, W>>();
            for (Map.Entry<String, TValue> f : ty.recordFields().entrySet()) {
                res.put(f.getKey(), loopUnary(bop, wop, f.getValue(), x.lookupRecord(f.getKey())));
            }
            return new VRecord<B, W>(res);
        }

        default:
            throw Panic.panic("Prims.pointwiseUnary", "Invalid type " + ty);
        }
    }

    /**
     * Compare two values of the same type.  Sequences, tuples and records
     * compare lexicographically, in element or field order.
     */
    public static <B, W, O> O cmpValue(OrderOps<B, W, O> ops, Value<B, W> l, Value<B, W> r) {
        if (l instanceof VBit) {
            return ops.cmpBit(l.fromVBit(), r.fromVBit());
        }
        if (l instanceof VWord) {
            return ops.cmpWord(l.fromVWord(), r.fromVWord());
        }
        if (l instanceof VSeq) {
            return cmpList(ops, l.fromVSeq(), r.fromVSeq());
        }
        if (l instanceof VTuple) {
            return cmpList(ops, l.fromVTuple(), r.fromVTuple());
        }
        if (l instanceof VRecord) {
            List<Value<B, W>> ls = new ArrayList<Value<B, W>>();
            List<Value<B, W>> rs = new ArrayList<Value<B, W>>();
            for (Map.Entry<String, Value<B, W>> e : l.fromVRecord().entrySet()) {
                ls.add(e.getValue());
                rs.add(r.lookupRecord(e.getKey()));
            }
            return cmpList(ops, ls, rs);
        }
        throw Panic.panic("Prims.cmpValue", "Values of shape " + l.shape() + " are not comparable");
    }

    private static <B, W, O> O cmpList(OrderOps<B, W, O> ops, List<Value<B, W>> ls, List<Value<B, W>> rs) {
        if (ls.size() != rs.size()) {
            throw Panic.panic("Prims.cmpValue",
                              "Comparing sequences of lengths " + ls.size() + " and " + rs.size());
        }
        O acc = ops.equal();
        for (int i = ls.size() - 1; i >= 0; --i) {
            acc = ops.lexico(cmpValue(ops, ls.get(i), rs.get(i)), acc);
        }
        return acc;
    }

    /**
     * A comparison primitive: compare the operands and read the relation
     * <code>test</code> off the ordering.
     */
    public static <B, W, O> TypedBinOp<B, W> cmpOrder(final OrderOps<B, W, O> ops,
                                                      final OrderTest<O, B> test) {
        return new TypedBinOp<B, W>() {
            public Value<B, W> apply(TValue ty, Value<B, W> l, Value<B, W> r) {
                return new VBit<B, W>(test.test(cmpValue(ops, l, r)));
            }
        };
    }

    /**
     * Select one of the operands by a relation on their ordering: the left
     * operand where <code>test</code> holds, else the right one.  This is how
     * <code>min</code> and <code>max</code> are built.
     */
    public static <B, W, O> TypedBinOp<B, W> withOrder(final OrderOps<B, W, O> ops,
                                                       final OrderTest<O, B> test,
                                                       final Merge<B, W> merge) {
        return new TypedBinOp<B, W>() {
            public Value<B, W> apply(TValue ty, Value<B, W> l, Value<B, W> r) {
                return merge.ite(test.test(cmpValue(ops, l, r)), l, r);
            }
        };
    }

    /**
     * Comparison of functions at a point:
     * <code>\{a, b} f g x -&gt; test (cmp (f x) (g x))</code>.
     */
    public static <B, W, O> Value<B, W> funCmp(final OrderOps<B, W, O> ops,
                                               final OrderTest<O, B> test) {
        return tlam(new TypeFunction<B, W>() {
            public Value<B, W> apply(TValue a) {
                return tlam(new TypeFunction<B, W>() {
                    public Value<B, W> apply(TValue b) {
                        return lam(new ValueFunction<B, W>() {
                            public Value<B, W> apply(final Value<B, W> f) {
                                return lam(new ValueFunction<B, W>() {
                                    public Value<B, W> apply(final Value<B, W> g) {
                                        return lam(new ValueFunction<B, W>() {
                                            public Value<B, W> apply(Value<B, W> x) {
                                                return new VBit<B, W>(
                                                    test.test(cmpValue(ops, f.apply(x), g.apply(x))));
                                            }
                                        });
                                    }
                                });
                            }
                        });
                    }
                });
            }
        });
    }

    /**
     * The value of a finite numeric type.
     */
    public static BigInteger numTValue(String where, TValue ty) {
        if (!ty.isFin()) {
            throw Panic.panic(where, "Expected a finite numeric type, got " + ty);
        }
        return ty.getNum();
    }

    /**
     * <code>demote : {val, bits} [bits]</code>, turning the numeric type
     * <code>val</code> into a word of width <code>bits</code>.
     */
    public static <B, W> Value<B, W> ecDemoteGeneric(final String where, final WordMaker<W> mk) {
        return tlam(new TypeFunction<B, W>() {
            public Value<B, W> apply(final TValue valT) {
                return tlam(new TypeFunction<B, W>() {
                    public Value<B, W> apply(TValue bitT) {
                        return new VWord<B, W>(mk.make(numTValue(where, bitT), numTValue(where, valT)));
                    }
                });
            }
        });
    }
}

package com.galois.cryptol.codegen.eval;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.galois.cryptol.codegen.Panic;
import com.galois.cryptol.codegen.ast.TCon;
import com.galois.cryptol.codegen.ast.TRec;
import com.galois.cryptol.codegen.ast.TVar;
import com.galois.cryptol.codegen.ast.Type;

/**
 * Evaluates static types to {@link TValue}s.
 */
public final class TypeEvaluator {
    private TypeEvaluator() {}

    public static TValue evalType(TypeEnv env, Type type) {
        if (type instanceof TVar) {
            TValue v = env.lookupType((TVar) type);
            if (v == null) {
                throw Panic.panic("TypeEvaluator.evalType", "Unbound type variable " + type);
            }
            return v;
        }
        if (type instanceof TRec) {
            Map<String, TValue> fields = new LinkedHashMap<String, TValue>();
            for (Map.Entry<String, Type> e : ((TRec) type).getFields().entrySet()) {
                fields.put(e.getKey(), evalType(env, e.getValue()));
            }
            return TValue.record(fields);
        }

        TCon c = (TCon) type;
        List<TValue> args = new ArrayList<TValue>();
        for (Type a : c.getArgs()) {
            args.add(evalType(env, a));
        }
        switch (c.getTC()) {
        case NUM:   return TValue.num(c.getNum());
        case INF:   return TValue.INF;
        case BIT:   return TValue.BIT;
        case SEQ:   return TValue.seq(args.get(0), args.get(1));
        case FUN:   return TValue.fun(args.get(0), args.get(1));
        case TUPLE: return TValue.tuple(args);
        case ADD:   return add(args.get(0), args.get(1));
        case SUB:   return sub(args.get(0), args.get(1));
        case MUL:   return mul(args.get(0), args.get(1));
        case MIN:   return min(args.get(0), args.get(1));
        case MAX:   return max(args.get(0), args.get(1));
        case WIDTH: return width(args.get(0));
        default:
            throw Panic.panic("TypeEvaluator.evalType", "Cannot evaluate predicate " + type);
        }
    }

    static TValue add(TValue x, TValue y) {
        if (x.isInf() || y.isInf()) return TValue.INF;
        return TValue.num(x.getNum().add(y.getNum()));
    }

    static TValue sub(TValue x, TValue y) {
        if (y.isInf()) {
            throw Panic.panic("TypeEvaluator.sub", "Subtraction of inf from " + x);
        }
        if (x.isInf()) return TValue.INF;
        BigInteger r = x.getNum().subtract(y.getNum());
        if (r.signum() < 0) {
            throw Panic.panic("TypeEvaluator.sub", "Negative type " + x + " - " + y);
        }
        return TValue.num(r);
    }

    static TValue mul(TValue x, TValue y) {
        if (isZero(x) || isZero(y)) return TValue.num(0);
        if (x.isInf() || y.isInf()) return TValue.INF;
        return TValue.num(x.getNum().multiply(y.getNum()));
    }

    static TValue min(TValue x, TValue y) {
        if (x.isInf()) return y;
        if (y.isInf()) return x;
        return TValue.num(x.getNum().min(y.getNum()));
    }

    static TValue max(TValue x, TValue y) {
        if (x.isInf() || y.isInf()) return TValue.INF;
        return TValue.num(x.getNum().max(y.getNum()));
    }

    /** Number of bits needed to represent the argument. */
    static TValue width(TValue x) {
        if (x.isInf()) return TValue.INF;
        return TValue.num(x.getNum().bitLength());
    }

    private static boolean isZero(TValue x) {
        return x.isFin() && x.getNum().signum() == 0;
    }
}

package com.galois.cryptol.codegen.sym;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * An immutable node in a graph of symbolic terms.
 *
 * Terms are shared between the values that use them, so a graph built by
 * evaluating an expression is a DAG rooted at the declared outputs.
 * Equality is identity; two structurally equal terms built separately are
 * different nodes.
 */
public final class Term {
    private final SymOp op;
    private final int width;
    private final long value;
    private final String name;
    private final Term[] args;

    private Term(SymOp op, int width, long value, String name, Term[] args) {
        this.op = op;
        this.width = width;
        this.value = value;
        this.name = name;
        this.args = args;
    }

    static long mask(int width) {
        if (width >= 64) return -1L;
        if (width <= 0) return 1L;
        return (1L << width) - 1;
    }

    static Term literal(int width, long value) {
        return new Term(SymOp.LITERAL, width, value & mask(width), null, new Term[0]);
    }

    static Term input(int width, String name) {
        if (name == null) throw new NullPointerException("name");
        return new Term(SymOp.INPUT, width, 0, name, new Term[0]);
    }

    static Term testBit(Term word, int index) {
        return new Term(SymOp.TEST_BIT, 0, index, null, new Term[] { word });
    }

    /**
     * Apply <code>op</code>, folding to a literal when every argument is a
     * literal.
     */
    static Term apply(SymOp op, int width, Term... args) {
        boolean concrete = true;
        for (Term a : args) {
            if (!a.isLiteral()) {
                concrete = false;
                break;
            }
        }
        if (concrete) {
            long[] xs = new long[args.length];
            for (int i = 0; i != args.length; ++i) {
                xs[i] = args[i].value;
            }
            return literal(width, op.compute(operandWidth(op, width, args), 0, xs));
        }
        return new Term(op, width, 0, null, args.clone());
    }

    private static int operandWidth(SymOp op, int width, Term[] args) {
        if (op == SymOp.EQ || op == SymOp.ULT) return args[0].width;
        return width;
    }

    public SymOp getOp() {
        return op;
    }

    /** Width in bits, or 0 for a Boolean term. */
    public int getWidth() {
        return width;
    }

    public boolean isLiteral() {
        return op == SymOp.LITERAL;
    }

    /**
     * Return the literal payload, or the selected bit index of a
     * {@link SymOp#TEST_BIT} node.
     */
    public long getValue() {
        return value;
    }

    /** Return the name of an input, or null. */
    public String getName() {
        return name;
    }

    public List<Term> getArgs() {
        return Collections.unmodifiableList(Arrays.asList(args));
    }

    Term arg(int i) {
        return args[i];
    }

    int argCount() {
        return args.length;
    }

    public String toString() {
        switch (op) {
        case LITERAL:
            return width == 0 ? (value != 0 ? "True" : "False")
                              : Long.toUnsignedString(value) + ":[" + width + "]";
        case INPUT:
            return name + ":[" + width + "]";
        case TEST_BIT:
            return "(" + args[0] + " @ " + value + ")";
        default:
            StringBuilder b = new StringBuilder();
            b.append("(").append(op.name().toLowerCase());
            for (Term a : args) {
                b.append(" ").append(a);
            }
            return b.append(")").toString();
        }
    }
}

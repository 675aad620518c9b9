package com.galois.cryptol.codegen.eval;

import java.util.List;

import com.galois.cryptol.codegen.ast.ECon;
import com.galois.cryptol.codegen.ast.QName;
import com.galois.cryptol.codegen.ast.TVar;
import com.galois.cryptol.codegen.ast.Type;

/**
 * The backend-specific half of evaluation.  {@link Evaluator} walks
 * expressions and calls back into this table whenever the answer depends on
 * the environment representation <code>E</code>, the bit representation
 * <code>B</code> or the word representation <code>W</code>.
 */
public interface ExprOperations<E, B, W> {
    /** Value of a primitive constant or operator. */
    Value<B, W> evalECon(ECon con);

    /** Extend <code>env</code> with a term binding. */
    E bindTerm(QName name, Value<B, W> value, E env);

    /** Extend <code>env</code> with a type variable binding. */
    E bindType(TVar var, TValue type, E env);

    /**
     * Look up a term.  A missing name is an internal error, since
     * expressions reaching the evaluator are already resolved.
     */
    Value<B, W> lookupTerm(QName name, E env);

    /** Evaluate a type under the type bindings of <code>env</code>. */
    TValue evalType(E env, Type type);

    /** Select element <code>index</code> of a word, sequence or stream. */
    Value<B, W> listSel(int index, Value<B, W> value);

    /**
     * Return the value of a condition if it is known, or null.  Only the
     * selected branch of a conditional on a known condition is evaluated.
     */
    Boolean asLiteral(B cond);

    /**
     * Select between two values on a condition, merging them when the
     * condition is not known.
     */
    Value<B, W> ite(B cond, Value<B, W> then, Value<B, W> otherwise);

    /** Pack bits, most significant first, into a word. */
    W packWord(List<B> bits);

    /** Render a value for diagnostics. */
    String render(Value<B, W> value);
}

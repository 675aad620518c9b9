package com.galois.cryptol.codegen.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A type scheme <code>{params} (props) =&gt; body</code>.
 */
public final class Schema {
    private final List<TVar> params;
    private final List<Type> props;
    private final Type body;

    public Schema(List<TVar> params, List<Type> props, Type body) {
        this.params = Collections.unmodifiableList(new ArrayList<TVar>(params));
        this.props = Collections.unmodifiableList(new ArrayList<Type>(props));
        this.body = body;
    }

    /** A scheme with no parameters and no predicates. */
    public static Schema mono(Type body) {
        return new Schema(Collections.<TVar>emptyList(), Collections.<Type>emptyList(), body);
    }

    public List<TVar> getParams() {
        return params;
    }

    public List<Type> getProps() {
        return props;
    }

    public Type getBody() {
        return body;
    }

    /**
     * A scheme is monomorphic when it quantifies over nothing, has no
     * predicates and its body has no free type variables.
     */
    public boolean isMonomorphic() {
        return params.isEmpty() && props.isEmpty() && body.freeVars().isEmpty();
    }

    public String toString() {
        StringBuilder b = new StringBuilder();
        if (!params.isEmpty()) {
            b.append("{").append(Type.join(params.toArray(), ", ")).append("} ");
        }
        if (!props.isEmpty()) {
            b.append("(").append(Type.join(props.toArray(), ", ")).append(") => ");
        }
        return b.append(body).toString();
    }
}

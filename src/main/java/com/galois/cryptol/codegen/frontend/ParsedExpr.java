package com.galois.cryptol.codegen.frontend;

import com.galois.cryptol.codegen.ast.QName;

/**
 * A surface expression before elaboration.  Only the forms needed to name
 * a generation root are represented.
 */
public abstract class ParsedExpr {
    ParsedExpr() {}

    /** A reference to a named declaration. */
    public static final class PVar extends ParsedExpr {
        private final QName name;

        public PVar(QName name) {
            if (name == null) throw new NullPointerException("name");
            this.name = name;
        }

        public QName getName() {
            return name;
        }

        public String toString() {
            return name.toString();
        }
    }

    /** An expression annotated with where it came from. */
    public static final class PLocated extends ParsedExpr {
        private final ParsedExpr expr;
        private final Position position;

        public PLocated(ParsedExpr expr, Position position) {
            if (expr == null) throw new NullPointerException("expr");
            if (position == null) throw new NullPointerException("position");
            this.expr = expr;
            this.position = position;
        }

        public ParsedExpr getExpr() {
            return expr;
        }

        public Position getPosition() {
            return position;
        }

        public String toString() {
            return expr.toString();
        }
    }

    /** Strip every location annotation. */
    public static ParsedExpr dislocate(ParsedExpr e) {
        while (e instanceof PLocated) {
            e = ((PLocated) e).expr;
        }
        return e;
    }

    /**
     * Return the outermost location of <code>e</code>, or the empty
     * position if it has none.
     */
    public static Position location(ParsedExpr e) {
        if (e instanceof PLocated) {
            return ((PLocated) e).position;
        }
        return Position.empty();
    }
}

package com.galois.cryptol.codegen.ast;

/**
 * A component selector: <code>e.0</code> on tuples, <code>e.x</code> on
 * records, or a constant index into a sequence.
 */
public abstract class Selector {
    Selector() {}

    public static Selector tuple(int index) {
        return new TupleSel(index);
    }

    public static Selector record(String field) {
        return new RecordSel(field);
    }

    public static Selector list(int index) {
        return new ListSel(index);
    }

    /** Select a tuple component by position. */
    public static final class TupleSel extends Selector {
        private final int index;

        TupleSel(int index) {
            if (index < 0) throw new IllegalArgumentException("index");
            this.index = index;
        }

        public int getIndex() {
            return index;
        }

        public String toString() {
            return String.valueOf(index);
        }
    }

    /** Select a record field by name. */
    public static final class RecordSel extends Selector {
        private final String field;

        RecordSel(String field) {
            if (field == null) throw new NullPointerException("field");
            this.field = field;
        }

        public String getField() {
            return field;
        }

        public String toString() {
            return field;
        }
    }

    /** Select a sequence element by position. */
    public static final class ListSel extends Selector {
        private final int index;

        ListSel(int index) {
            if (index < 0) throw new IllegalArgumentException("index");
            this.index = index;
        }

        public int getIndex() {
            return index;
        }

        public String toString() {
            return "@" + index;
        }
    }
}

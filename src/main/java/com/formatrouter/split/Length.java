package com.formatrouter.split;

/**
 * An indentation amount: a fixed column delta or "align to the column the
 * output is currently at".
 */
public abstract class Length {

    /**
     * Aligns to the current output column.
     */
    public static final Length STATE_COLUMN = new Length() {
        @Override
        public boolean isZero() {
            return false;
        }

        @Override
        public String toString() {
            return "StateColumn";
        }
    };

    private Length() {
    }

    public static Length num(int n) {
        return new Num(n);
    }

    public abstract boolean isZero();

    /**
     * Fixed column delta; may be negative to unindent.
     */
    public static final class Num extends Length {
        private final int n;

        private Num(int n) {
            this.n = n;
        }

        public int getN() {
            return n;
        }

        @Override
        public boolean isZero() {
            return n == 0;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Num && ((Num) o).n == n;
        }

        @Override
        public int hashCode() {
            return Integer.hashCode(n);
        }

        @Override
        public String toString() {
            return Integer.toString(n);
        }
    }
}

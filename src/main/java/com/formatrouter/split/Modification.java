package com.formatrouter.split;

/**
 * The whitespace rendered between two tokens.
 */
public abstract class Modification {

    public enum Kind {
        NO_SPLIT,
        SPACE,
        NEWLINE
    }

    public static final Modification NO_SPLIT = new NoSplit();
    public static final Modification SPACE = new Space();
    public static final Newline NEWLINE = new Newline(false, false, false, false);
    public static final Newline NEWLINE_2X = new Newline(true, false, false, false);

    private Modification() {
    }

    /**
     * A space when {@code flag} holds, nothing otherwise.
     */
    public static Modification space(boolean flag) {
        return flag ? SPACE : NO_SPLIT;
    }

    public static Newline newline(boolean isDouble) {
        return isDouble ? NEWLINE_2X : NEWLINE;
    }

    public static Newline newline(boolean isDouble, boolean noIndent) {
        return new Newline(isDouble, noIndent, false, false);
    }

    /**
     * Reproduces the line breaks the source already has: a space when there
     * are none, a (double) newline otherwise.
     */
    public static Modification fromNewlines(int newlines, boolean noIndent) {
        if (newlines == 0) {
            return SPACE;
        }
        return newline(newlines > 1, noIndent);
    }

    public static Modification fromNewlines(int newlines) {
        return fromNewlines(newlines, false);
    }

    /**
     * This modification when {@code keep} holds, a plain newline otherwise.
     */
    public Modification orNewline(boolean keep) {
        return keep ? this : NEWLINE;
    }

    public abstract Kind getKind();

    /**
     * Characters this modification adds to the current line.
     */
    public abstract int getLength();

    public boolean isNewline() {
        return getKind() == Kind.NEWLINE;
    }

    private static final class NoSplit extends Modification {
        @Override
        public Kind getKind() {
            return Kind.NO_SPLIT;
        }

        @Override
        public int getLength() {
            return 0;
        }

        @Override
        public String toString() {
            return "NoSplit";
        }
    }

    private static final class Space extends Modification {
        @Override
        public Kind getKind() {
            return Kind.SPACE;
        }

        @Override
        public int getLength() {
            return 1;
        }

        @Override
        public String toString() {
            return "Space";
        }
    }

    /**
     * A line break. {@code noIndent} renders the next token at column zero,
     * {@code acceptSpace}/{@code acceptNoSplit} let the renderer keep the
     * tokens on one line when the search decides the break is not needed.
     */
    public static final class Newline extends Modification {
        private final boolean isDouble;
        private final boolean noIndent;
        private final boolean acceptSpace;
        private final boolean acceptNoSplit;

        private Newline(boolean isDouble, boolean noIndent, boolean acceptSpace, boolean acceptNoSplit) {
            this.isDouble = isDouble;
            this.noIndent = noIndent;
            this.acceptSpace = acceptSpace;
            this.acceptNoSplit = acceptNoSplit;
        }

        public boolean isDouble() { return isDouble; }
        public boolean isNoIndent() { return noIndent; }
        public boolean acceptsSpace() { return acceptSpace; }
        public boolean acceptsNoSplit() { return acceptNoSplit; }

        public Newline withNoIndent(boolean value) {
            return new Newline(isDouble, value, acceptSpace, acceptNoSplit);
        }

        public Newline withAcceptSpace(boolean value) {
            return new Newline(isDouble, noIndent, value, acceptNoSplit);
        }

        public Newline withAcceptNoSplit(boolean value) {
            return new Newline(isDouble, noIndent, acceptSpace, value);
        }

        @Override
        public Kind getKind() {
            return Kind.NEWLINE;
        }

        @Override
        public int getLength() {
            return 0;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Newline)) return false;
            Newline other = (Newline) o;
            return isDouble == other.isDouble && noIndent == other.noIndent
                    && acceptSpace == other.acceptSpace && acceptNoSplit == other.acceptNoSplit;
        }

        @Override
        public int hashCode() {
            int result = Boolean.hashCode(isDouble);
            result = 31 * result + Boolean.hashCode(noIndent);
            result = 31 * result + Boolean.hashCode(acceptSpace);
            return 31 * result + Boolean.hashCode(acceptNoSplit);
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder(isDouble ? "Newline2x" : "Newline");
            if (noIndent) sb.append("(noIndent)");
            if (acceptSpace) sb.append("(acceptSpace)");
            if (acceptNoSplit) sb.append("(acceptNoSplit)");
            return sb.toString();
        }
    }
}

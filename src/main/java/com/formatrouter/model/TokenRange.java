package com.formatrouter.model;

/**
 * Half-open source offset range {@code [start, end)}.
 */
public final class TokenRange {
    private final int start;
    private final int end;

    public TokenRange(int start, int end) {
        this.start = start;
        this.end = end;
    }

    /**
     * Range from the start of {@code open} to the end of {@code close}.
     */
    public static TokenRange between(Token open, Token close) {
        return new TokenRange(open.getStart(), close.getEnd());
    }

    public int getStart() { return start; }
    public int getEnd() { return end; }

    public boolean contains(int offset) {
        return offset >= start && offset < end;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TokenRange)) return false;
        TokenRange other = (TokenRange) o;
        return start == other.start && end == other.end;
    }

    @Override
    public int hashCode() {
        return 31 * start + end;
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + ")";
    }
}

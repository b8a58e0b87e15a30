package com.formatrouter.split;

import com.formatrouter.model.Token;

/**
 * Rendering hint: the search should try to reach this token on the current
 * line before considering other splits. With {@code killOnFail} the split is
 * abandoned when the token cannot be reached without overflowing.
 */
public final class OptimalToken {
    private final Token token;
    private final boolean killOnFail;

    public OptimalToken(Token token, boolean killOnFail) {
        if (token == null) {
            throw new IllegalArgumentException("Optimal token cannot be null");
        }
        this.token = token;
        this.killOnFail = killOnFail;
    }

    public OptimalToken(Token token) {
        this(token, false);
    }

    public Token getToken() { return token; }
    public boolean isKillOnFail() { return killOnFail; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof OptimalToken)) return false;
        OptimalToken other = (OptimalToken) o;
        return token == other.token && killOnFail == other.killOnFail;
    }

    @Override
    public int hashCode() {
        return 31 * System.identityHashCode(token) + Boolean.hashCode(killOnFail);
    }

    @Override
    public String toString() {
        return token.getText() + "@" + token.getStart() + (killOnFail ? "!" : "");
    }
}

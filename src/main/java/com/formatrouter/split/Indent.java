package com.formatrouter.split;

import com.formatrouter.model.Token;

import java.util.Objects;

/**
 * Indentation applied from the split that carries it up to its expire token.
 */
public final class Indent {
    private final Length length;
    private final Token expire;
    private final ExpiresOn expiresOn;

    public Indent(Length length, Token expire, ExpiresOn expiresOn) {
        this.length = Objects.requireNonNull(length, "length");
        this.expire = Objects.requireNonNull(expire, "expire");
        this.expiresOn = Objects.requireNonNull(expiresOn, "expiresOn");
    }

    public Length getLength() { return length; }
    public Token getExpire() { return expire; }
    public ExpiresOn getExpiresOn() { return expiresOn; }

    /**
     * Offset after which the indent no longer applies.
     */
    public int expireEnd() {
        return expire.getEnd();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Indent)) return false;
        Indent other = (Indent) o;
        return length.equals(other.length) && expire == other.expire && expiresOn == other.expiresOn;
    }

    @Override
    public int hashCode() {
        return Objects.hash(length, System.identityHashCode(expire), expiresOn);
    }

    @Override
    public String toString() {
        return "Indent(" + length + ", " + expire.getText() + "@" + expire.getStart() + ", " + expiresOn + ")";
    }
}

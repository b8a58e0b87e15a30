package com.formatrouter.split;

import com.formatrouter.model.Token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One candidate decision for a token pair.
 * Splits are immutable; every {@code with*} method returns a copy. A split
 * whose guard failed stays in the list the router returns but reports
 * {@link #isIgnored()} and is dropped by the decision cache.
 */
public final class Split {
    private final Modification modification;
    private final int cost;
    private final Policy policy;
    private final List<Indent> indents;
    private final OptimalToken optimalToken;
    private final boolean ignored;
    private final SplitTag tag;
    private final String origin;

    public Split(Modification modification, int cost) {
        this(modification, cost, Policy.NO_POLICY, Collections.emptyList(), null, false, null, "");
    }

    private Split(Modification modification, int cost, Policy policy, List<Indent> indents,
                  OptimalToken optimalToken, boolean ignored, SplitTag tag, String origin) {
        if (cost < 0) {
            throw new IllegalArgumentException("Split cost must not be negative: " + cost);
        }
        this.modification = Objects.requireNonNull(modification, "modification");
        this.cost = cost;
        this.policy = policy == null ? Policy.NO_POLICY : policy;
        this.indents = indents;
        this.optimalToken = optimalToken;
        this.ignored = ignored;
        this.tag = tag;
        this.origin = origin;
    }

    // Getters
    public Modification getModification() { return modification; }
    public int getCost() { return cost; }
    public Policy getPolicy() { return policy; }
    public List<Indent> getIndents() { return indents; }
    public OptimalToken getOptimalToken() { return optimalToken; }
    public boolean isIgnored() { return ignored; }
    public SplitTag getTag() { return tag; }
    public String getOrigin() { return origin; }

    /**
     * A split whose guard failed, for rules that build a candidate only
     * under some condition.
     */
    public static Split ignored() {
        return new Split(Modification.NO_SPLIT, 0).onlyIf(false);
    }

    public boolean isActive() {
        return !ignored;
    }

    public boolean isNewline() {
        return modification.isNewline();
    }

    public boolean hasPolicy() {
        return !policy.isEmpty();
    }

    public Split withModification(Modification value) {
        return new Split(value, cost, policy, indents, optimalToken, ignored, tag, origin);
    }

    public Split withCost(int value) {
        return new Split(modification, value, policy, indents, optimalToken, ignored, tag, origin);
    }

    /**
     * Adds to the current cost.
     */
    public Split withPenalty(int penalty) {
        return withCost(cost + penalty);
    }

    /**
     * Replaces the policy.
     */
    public Split withPolicy(Policy value) {
        return new Split(modification, cost, value, indents, optimalToken, ignored, tag, origin);
    }

    /**
     * Replaces the policy only when {@code when} holds.
     */
    public Split withPolicy(Policy value, boolean when) {
        return when ? withPolicy(value) : this;
    }

    public Split andThenPolicy(Policy next) {
        return withPolicy(policy.andThen(next));
    }

    public Split orElsePolicy(Policy fallback) {
        return withPolicy(policy.orElse(fallback));
    }

    /**
     * Adds an indent; fixed zero indents are dropped.
     */
    public Split withIndent(Length length, Token expire, ExpiresOn expiresOn) {
        return withIndent(new Indent(length, expire, expiresOn));
    }

    public Split withIndent(Indent indent) {
        if (indent.getLength().isZero()) {
            return this;
        }
        List<Indent> copy = new ArrayList<>(indents);
        copy.add(indent);
        return new Split(modification, cost, policy, Collections.unmodifiableList(copy),
                optimalToken, ignored, tag, origin);
    }

    public Split withIndent(int n, Token expire, ExpiresOn expiresOn) {
        return withIndent(Length.num(n), expire, expiresOn);
    }

    public Split withOptimalToken(Token token, boolean killOnFail) {
        return withOptimalToken(token == null ? null : new OptimalToken(token, killOnFail));
    }

    public Split withOptimalToken(Token token) {
        return withOptimalToken(token, false);
    }

    public Split withOptimalToken(OptimalToken value) {
        return new Split(modification, cost, policy, indents, value, ignored, tag, origin);
    }

    /**
     * Keeps the split active only when {@code flag} holds.
     */
    public Split onlyIf(boolean flag) {
        return flag ? this : ignore();
    }

    public Split notIf(boolean flag) {
        return onlyIf(!flag);
    }

    private Split ignore() {
        return new Split(modification, cost, policy, indents, optimalToken, true, tag, origin);
    }

    /**
     * Offers the split only when the style enables {@code value}.
     */
    public Split onlyFor(SplitTag value) {
        return new Split(modification, cost, policy, indents, optimalToken, ignored, value, origin);
    }

    /**
     * Records the name of the rule that produced the split.
     */
    public Split withOrigin(String value) {
        return new Split(modification, cost, policy, indents, optimalToken, ignored, tag,
                value == null ? "" : value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Split)) return false;
        Split other = (Split) o;
        return cost == other.cost
                && ignored == other.ignored
                && modification.equals(other.modification)
                && policy.equals(other.policy)
                && indents.equals(other.indents)
                && Objects.equals(optimalToken, other.optimalToken)
                && tag == other.tag
                && origin.equals(other.origin);
    }

    @Override
    public int hashCode() {
        return Objects.hash(modification, cost, policy, indents, optimalToken, ignored, tag, origin);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(modification.toString()).append(':').append(cost);
        if (!indents.isEmpty()) sb.append(' ').append(indents);
        if (hasPolicy()) sb.append(" policy=").append(policy);
        if (optimalToken != null) sb.append(" opt=").append(optimalToken);
        if (tag != null) sb.append(" tag=").append(tag);
        if (ignored) sb.append(" [ignored]");
        if (!origin.isEmpty()) sb.append(" <").append(origin).append('>');
        return sb.toString();
    }
}

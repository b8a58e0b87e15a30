package com.formatrouter.split;

import com.formatrouter.model.FormatToken;
import com.formatrouter.model.Token;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A constraint on the decisions of later token pairs.
 * <p>
 * A policy covers every pair whose left token ends at or before its expire
 * offset, so a policy expiring at a token still sees the pair that follows
 * that token; outside that range it leaves the candidates alone. Inside the
 * range its rule may restrict or reprice the candidates, or decline (return
 * {@code null}) to say it has no opinion on that pair. {@link #apply} never
 * lets a rule add a kind of modification the candidates did not already
 * offer.
 * <p>
 * Policies are immutable and may be shared between threads.
 */
public abstract class Policy {

    /**
     * Decides a pair inside the policy's range, or returns {@code null}.
     */
    @FunctionalInterface
    public interface DecisionRule {
        List<Split> decide(Decision decision);
    }

    public static final Policy NO_POLICY = new Empty();

    private final int expire;

    private Policy(int expire) {
        this.expire = expire;
    }

    /**
     * A policy that expires with the end of {@code expire}. Two policies with
     * the same expiry and description are equal, so the description must name
     * every input {@code rule} depends on.
     */
    public static Policy of(Token expire, String description, DecisionRule rule) {
        return new RulePolicy(expire.getEnd(), description, rule);
    }

    public static Policy of(int expire, String description, DecisionRule rule) {
        return new RulePolicy(expire, description, rule);
    }

    /**
     * Offset past which the policy no longer applies.
     */
    public int getExpire() {
        return expire;
    }

    public boolean isEmpty() {
        return false;
    }

    public boolean appliesTo(FormatToken ft) {
        return ft.getLeft().getEnd() <= expire;
    }

    /**
     * The rule's verdict, {@code null} when it has none for this pair.
     */
    protected abstract List<Split> decide(Decision decision);

    /**
     * The candidates left once this policy has been applied to
     * {@code decision}.
     */
    public final List<Split> apply(Decision decision) {
        if (!appliesTo(decision.getFormatToken())) {
            return decision.getSplits();
        }
        List<Split> result = decide(decision);
        if (result == null) {
            return decision.getSplits();
        }
        Set<Modification.Kind> allowed = decision.modificationKinds();
        List<Split> narrowed = new ArrayList<>(result.size());
        for (Split split : result) {
            if (allowed.contains(split.getModification().getKind())) {
                narrowed.add(split);
            }
        }
        return narrowed;
    }

    /**
     * Applies this policy, then {@code next} to whatever it left.
     */
    public Policy andThen(Policy next) {
        if (next.isEmpty()) return this;
        if (isEmpty()) return next;
        return new AndThen(this, next);
    }

    /**
     * Applies this policy, falling back to {@code fallback} where it has no
     * verdict.
     */
    public Policy orElse(Policy fallback) {
        if (fallback.isEmpty()) return this;
        if (isEmpty()) return fallback;
        return new OrElse(this, fallback);
    }

    /**
     * Verdict of a part of a composed policy, respecting that part's own range.
     */
    private static List<Split> decidePart(Policy part, Decision decision) {
        return part.appliesTo(decision.getFormatToken()) ? part.decide(decision) : null;
    }

    private static final class Empty extends Policy {
        private Empty() {
            super(0);
        }

        @Override
        public boolean isEmpty() {
            return true;
        }

        @Override
        public boolean appliesTo(FormatToken ft) {
            return false;
        }

        @Override
        protected List<Split> decide(Decision decision) {
            return null;
        }

        @Override
        public String toString() {
            return "NoPolicy";
        }
    }

    private static final class RulePolicy extends Policy {
        private final String description;
        private final DecisionRule rule;

        private RulePolicy(int expire, String description, DecisionRule rule) {
            super(expire);
            this.description = Objects.requireNonNull(description, "description");
            this.rule = Objects.requireNonNull(rule, "rule");
        }

        @Override
        protected List<Split> decide(Decision decision) {
            return rule.decide(decision);
        }

        // compared by what they were built from, not by lambda identity
        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof RulePolicy)) return false;
            RulePolicy other = (RulePolicy) o;
            return getExpire() == other.getExpire() && description.equals(other.description);
        }

        @Override
        public int hashCode() {
            return 31 * getExpire() + description.hashCode();
        }

        @Override
        public String toString() {
            return description + "<" + getExpire();
        }
    }

    private static final class AndThen extends Policy {
        private final Policy first;
        private final Policy second;

        private AndThen(Policy first, Policy second) {
            super(Math.max(first.getExpire(), second.getExpire()));
            this.first = first;
            this.second = second;
        }

        @Override
        protected List<Split> decide(Decision decision) {
            List<Split> firstResult = decidePart(first, decision);
            Decision next = firstResult == null ? decision : decision.withSplits(firstResult);
            List<Split> secondResult = decidePart(second, next);
            return secondResult != null ? secondResult : firstResult;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof AndThen)) return false;
            AndThen other = (AndThen) o;
            return first.equals(other.first) && second.equals(other.second);
        }

        @Override
        public int hashCode() {
            return Objects.hash("andThen", first, second);
        }

        @Override
        public String toString() {
            return "(" + first + " andThen " + second + ")";
        }
    }

    private static final class OrElse extends Policy {
        private final Policy first;
        private final Policy fallback;

        private OrElse(Policy first, Policy fallback) {
            super(Math.max(first.getExpire(), fallback.getExpire()));
            this.first = first;
            this.fallback = fallback;
        }

        @Override
        protected List<Split> decide(Decision decision) {
            List<Split> result = decidePart(first, decision);
            return result != null ? result : decidePart(fallback, decision);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof OrElse)) return false;
            OrElse other = (OrElse) o;
            return first.equals(other.first) && fallback.equals(other.fallback);
        }

        @Override
        public int hashCode() {
            return Objects.hash("orElse", first, fallback);
        }

        @Override
        public String toString() {
            return "(" + first + " orElse " + fallback + ")";
        }
    }
}

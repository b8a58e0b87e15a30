package com.formatrouter.split;

import com.formatrouter.model.FormatToken;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * The candidate splits the search holds for one token pair, as seen by a
 * policy.
 */
public final class Decision {
    private final FormatToken formatToken;
    private final List<Split> splits;

    public Decision(FormatToken formatToken, List<Split> splits) {
        this.formatToken = formatToken;
        this.splits = Collections.unmodifiableList(new ArrayList<>(splits));
    }

    public FormatToken getFormatToken() { return formatToken; }
    public List<Split> getSplits() { return splits; }

    public Decision withSplits(List<Split> values) {
        return new Decision(formatToken, values);
    }

    public Set<Modification.Kind> modificationKinds() {
        Set<Modification.Kind> kinds = EnumSet.noneOf(Modification.Kind.class);
        for (Split split : splits) {
            kinds.add(split.getModification().getKind());
        }
        return kinds;
    }

    /**
     * Splits that do not break the line. May be empty, which leaves the
     * search without a way forward on this path.
     */
    public List<Split> noNewlines() {
        List<Split> result = new ArrayList<>();
        for (Split split : splits) {
            if (!split.isNewline()) {
                result.add(split);
            }
        }
        return result;
    }

    /**
     * Newline splits only; may be empty.
     */
    public List<Split> onlyNewlinesWithoutFallback() {
        List<Split> result = new ArrayList<>();
        for (Split split : splits) {
            if (split.isNewline()) {
                result.add(split);
            }
        }
        return result;
    }

    /**
     * Newline splits only, none of them more expensive than {@code fallback}.
     * Without any newline split the verdict is {@code fallback} alone; a
     * policy then narrows it away unless the pair offered a newline, so the
     * pair keeps no candidate.
     */
    public List<Split> onlyNewlinesWithFallback(Split fallback) {
        List<Split> newlines = onlyNewlinesWithoutFallback();
        if (newlines.isEmpty()) {
            return Collections.singletonList(fallback);
        }
        List<Split> result = new ArrayList<>(newlines.size());
        for (Split split : newlines) {
            result.add(split.getCost() > fallback.getCost() ? split.withCost(fallback.getCost()) : split);
        }
        return result;
    }

    /**
     * Every split with the given penalty added; newline splits only when
     * {@code newlinesOnly} holds.
     */
    public List<Split> withPenalty(int penalty, boolean newlinesOnly) {
        List<Split> result = new ArrayList<>(splits.size());
        for (Split split : splits) {
            result.add(!newlinesOnly || split.isNewline() ? split.withPenalty(penalty) : split);
        }
        return result;
    }

    @Override
    public String toString() {
        return formatToken + " -> " + splits;
    }
}

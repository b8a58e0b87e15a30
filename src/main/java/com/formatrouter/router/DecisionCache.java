package com.formatrouter.router;

import com.formatrouter.config.FormatStyle;
import com.formatrouter.model.FormatToken;
import com.formatrouter.split.Modification;
import com.formatrouter.split.Split;
import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Memoizes the router's decisions for one run, keyed by pair index, and
 * applies the corrections every decision gets around single-line comments.
 * <p>
 * Entries are never invalidated: a run routes one immutable token sequence.
 */
public class DecisionCache {
    private final Router router;
    private final FormatStyle style;
    private final Int2ObjectOpenHashMap<List<Split>> cache = new Int2ObjectOpenHashMap<>();

    public DecisionCache(Router router) {
        this.router = router;
        this.style = router.getOps().getStyle();
    }

    public Router getRouter() {
        return router;
    }

    /**
     * The active candidate splits of {@code ft}, computed on first request.
     */
    public List<Split> getOrCompute(FormatToken ft) {
        List<Split> cached = cache.get(ft.getIndex());
        if (cached == null) {
            cached = Collections.unmodifiableList(compute(ft));
            cache.put(ft.getIndex(), cached);
        }
        return cached;
    }

    public int size() {
        return cache.size();
    }

    private List<Split> compute(FormatToken ft) {
        List<Split> splits = new ArrayList<>();
        boolean commentedOut = TokenOps.rhsIsCommentedOut(ft);
        for (Split split : router.getSplits(ft)) {
            if (split.isIgnored() || (split.getTag() != null && !style.isEnabled(split.getTag()))) {
                continue;
            }
            splits.add(commentedOut ? adaptToCommentedOutCode(split) : split);
        }

        if (TokenOps.isSingleLineComment(ft.getLeft())) {
            // nothing may follow a line comment on its line
            List<Split> newlines = new ArrayList<>();
            for (Split split : splits) {
                if (split.isNewline()) {
                    newlines.add(split);
                }
            }
            if (newlines.isEmpty()) {
                newlines.add(new Split(Modification.NEWLINE, 0).withOrigin("SingleLineComment"));
            }
            return newlines;
        }
        if (TokenOps.isAttachedSingleLineComment(ft)) {
            // a trailing comment stays on its line
            List<Split> result = new ArrayList<>(splits.size());
            for (Split split : splits) {
                result.add(split.isNewline() ? split.withModification(Modification.SPACE) : split);
            }
            return result;
        }
        return splits;
    }

    // commented-out code keeps its column
    private static Split adaptToCommentedOutCode(Split split) {
        Modification mod = split.getModification();
        if (mod instanceof Modification.Newline) {
            return split.withModification(((Modification.Newline) mod).withNoIndent(true));
        }
        return split;
    }
}

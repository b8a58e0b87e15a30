package com.formatrouter.api;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.formatrouter.api.error.FormatterError;
import com.formatrouter.model.FormatToken;
import com.formatrouter.model.FormatTokens;
import com.formatrouter.model.Token;
import com.formatrouter.split.Policy;
import com.formatrouter.split.Split;

import it.unimi.dsi.fastutil.ints.Int2ObjectMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;

/**
 * Result of routing one file: the active candidate splits of every token
 * pair, the policies those splits carry indexed by expiry offset, and the
 * diagnostics of the run.
 */
public class DecisionGraph {
    private final boolean successful;
    private final FormatTokens formatTokens;
    private final List<List<Split>> splits;
    private final Int2ObjectMap<List<Policy>> policiesByExpire;
    private final List<FormatterError> errors;

    private DecisionGraph(Builder builder) {
        this.successful = builder.successful;
        this.formatTokens = builder.formatTokens;
        this.splits = Collections.unmodifiableList(new ArrayList<>(builder.splits));
        this.policiesByExpire = new Int2ObjectOpenHashMap<>();
        for (List<Split> pairSplits : this.splits) {
            for (Split split : pairSplits) {
                if (split.hasPolicy()) {
                    policiesByExpire
                            .computeIfAbsent(split.getPolicy().getExpire(), k -> new ArrayList<>())
                            .add(split.getPolicy());
                }
            }
        }
        this.errors = Collections.unmodifiableList(new ArrayList<>(builder.errors));
    }

    public boolean isSuccessful() {
        return successful;
    }

    public FormatTokens getFormatTokens() {
        return formatTokens;
    }

    public List<FormatterError> getErrors() {
        return errors;
    }

    /**
     * Number of token pairs that have a decision list; zero for a failed run.
     */
    public int size() {
        return splits.size();
    }

    public List<Split> getSplits(int pairIndex) {
        return splits.get(pairIndex);
    }

    public List<Split> getSplits(FormatToken ft) {
        return getSplits(ft.getIndex());
    }

    /**
     * Policies that stop applying once the given offset has been passed.
     */
    public List<Policy> policiesExpiringAt(int offset) {
        List<Policy> result = policiesByExpire.get(offset);
        return result == null ? Collections.emptyList() : Collections.unmodifiableList(result);
    }

    public List<Policy> policiesExpiringAt(Token token) {
        return policiesExpiringAt(token.getEnd());
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private boolean successful;
        private FormatTokens formatTokens;
        private List<List<Split>> splits = new ArrayList<>();
        private List<FormatterError> errors = new ArrayList<>();

        public Builder successful(boolean successful) {
            this.successful = successful;
            return this;
        }

        public Builder formatTokens(FormatTokens formatTokens) {
            this.formatTokens = formatTokens;
            return this;
        }

        public Builder addSplits(List<Split> pairSplits) {
            this.splits.add(Collections.unmodifiableList(new ArrayList<>(pairSplits)));
            return this;
        }

        public Builder addError(FormatterError error) {
            this.errors.add(error);
            return this;
        }

        public Builder errors(List<FormatterError> errors) {
            this.errors = new ArrayList<>(errors);
            return this;
        }

        public DecisionGraph build() {
            return new DecisionGraph(this);
        }
    }
}

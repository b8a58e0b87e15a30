package com.formatrouter.router;

import com.formatrouter.config.EditionGate;
import com.formatrouter.config.FormatStyle;
import com.formatrouter.model.FormatToken;
import com.formatrouter.model.FormatTokens;
import com.formatrouter.model.Token;
import com.formatrouter.model.TokenKind;
import com.formatrouter.model.TreeNode;
import com.formatrouter.split.Split;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * The token pair a rule is deciding, with the per-file lookups it needs.
 */
public final class RouteContext {
    private final FormatToken ft;
    private final FormatOps ops;

    public RouteContext(FormatToken ft, FormatOps ops) {
        this.ft = ft;
        this.ops = ops;
    }

    public FormatToken ft() { return ft; }
    public FormatOps ops() { return ops; }
    public FormatStyle style() { return ops.getStyle(); }
    public FormatTokens tokens() { return ops.getTokens(); }
    public Token left() { return ft.getLeft(); }
    public Token right() { return ft.getRight(); }
    public TreeNode leftOwner() { return ft.getLeftOwner(); }
    public TreeNode rightOwner() { return ft.getRightOwner(); }
    public int newlines() { return ft.getNewlinesBetween(); }

    public boolean leftIs(TokenKind... kinds) {
        return ft.getLeft().isAny(kinds);
    }

    public boolean rightIs(TokenKind... kinds) {
        return ft.getRight().isAny(kinds);
    }

    public boolean isActive(EditionGate gate) {
        return ops.getStyle().isActive(gate);
    }

    /**
     * Mutable list of the given splits, for rules that append more later.
     */
    public static List<Split> splits(Split... values) {
        return new ArrayList<>(Arrays.asList(values));
    }

    @Override
    public String toString() {
        return ft.toString();
    }
}

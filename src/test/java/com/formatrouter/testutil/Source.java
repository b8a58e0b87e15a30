package com.formatrouter.testutil;

import com.formatrouter.config.FormatStyle;
import com.formatrouter.model.FormatToken;
import com.formatrouter.model.FormatTokens;
import com.formatrouter.model.Token;
import com.formatrouter.model.TreeNode;
import com.formatrouter.router.DecisionCache;
import com.formatrouter.router.FormatOps;
import com.formatrouter.router.Router;

import java.util.Map;

/**
 * A laid-out test file with lookups by token text.
 */
public final class Source {
    private final FormatTokens tokens;
    private final Map<TreeDsl.NodeSpec, TreeNode> nodes;

    Source(FormatTokens tokens, Map<TreeDsl.NodeSpec, TreeNode> nodes) {
        this.tokens = tokens;
        this.nodes = nodes;
    }

    public FormatTokens getTokens() {
        return tokens;
    }

    public TreeNode node(TreeDsl.NodeSpec spec) {
        TreeNode node = nodes.get(spec);
        if (node == null) {
            throw new IllegalArgumentException("Node is not part of this source");
        }
        return node;
    }

    public Token token(String text) {
        return token(text, 0);
    }

    /**
     * The {@code nth} token (from zero) spelled {@code text}.
     */
    public Token token(String text, int nth) {
        int seen = 0;
        for (Token token : tokens.getTokens()) {
            if (token.getText().equals(text) && seen++ == nth) {
                return token;
            }
        }
        throw new IllegalArgumentException("No token #" + nth + " spelled '" + text + "'");
    }

    public FormatToken pair(String left, String right) {
        return pair(left, right, 0);
    }

    /**
     * The {@code nth} pair (from zero) of tokens spelled {@code left} and
     * {@code right}.
     */
    public FormatToken pair(String left, String right, int nth) {
        int seen = 0;
        for (FormatToken ft : tokens.getPairs()) {
            if (ft.getLeft().getText().equals(left) && ft.getRight().getText().equals(right) && seen++ == nth) {
                return ft;
            }
        }
        throw new IllegalArgumentException("No pair #" + nth + " '" + left + "' '" + right + "'");
    }

    /**
     * The pair whose left token is {@code token}.
     */
    public FormatToken after(Token token) {
        return tokens.at(token);
    }

    public Router router(FormatStyle style) {
        return new Router(new FormatOps(tokens, style));
    }

    public DecisionCache cache(FormatStyle style) {
        return new DecisionCache(router(style));
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (Token token : tokens.getTokens()) {
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(token.getText());
        }
        return sb.toString();
    }
}

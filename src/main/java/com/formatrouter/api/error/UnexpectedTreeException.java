package com.formatrouter.api.error;

import com.formatrouter.model.FormatToken;
import com.formatrouter.model.NodeKind;
import com.formatrouter.model.TreeNode;

/**
 * Raised by a rule whose precondition on the shape of the syntax tree does
 * not hold. Routing the rest of the file would produce wrong decisions, so
 * the engine stops at the first one.
 */
public class UnexpectedTreeException extends RuntimeException {
    private final NodeKind expected;
    private final transient TreeNode actual;
    private final transient FormatToken formatToken;

    public UnexpectedTreeException(NodeKind expected, TreeNode actual, FormatToken formatToken) {
        super("Expected " + expected + " but found " + actual + " at " + formatToken);
        this.expected = expected;
        this.actual = actual;
        this.formatToken = formatToken;
    }

    /**
     * Wraps a failure a rule ran into while navigating a malformed tree, such
     * as a node without tokens or an unmatched delimiter.
     */
    public UnexpectedTreeException(FormatToken formatToken, RuntimeException cause) {
        super("Malformed syntax tree at " + formatToken + ": " + cause.getMessage(), cause);
        this.expected = null;
        this.actual = null;
        this.formatToken = formatToken;
    }

    /**
     * The node kind the rule required; {@code null} when the failure was
     * wrapped from a navigation error.
     */
    public NodeKind getExpected() { return expected; }
    public TreeNode getActual() { return actual; }
    public FormatToken getFormatToken() { return formatToken; }
}

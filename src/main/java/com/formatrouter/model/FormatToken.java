package com.formatrouter.model;

/**
 * Two adjacent tokens plus their syntax ownership context: the unit the
 * router decides on. Identity is the pair's index in its {@link FormatTokens}.
 */
public final class FormatToken {
    private final Token left;
    private final Token right;
    private final int index;
    private final TreeNode leftOwner;
    private final TreeNode rightOwner;
    private final int newlinesBetween;

    public FormatToken(Token left, Token right, int index, TreeNode leftOwner, TreeNode rightOwner) {
        this.left = left;
        this.right = right;
        this.index = index;
        this.leftOwner = leftOwner;
        this.rightOwner = rightOwner;
        this.newlinesBetween = Math.max(0, right.getStartLine() - left.getEndLine());
    }

    public Token getLeft() { return left; }
    public Token getRight() { return right; }
    public int getIndex() { return index; }
    public TreeNode getLeftOwner() { return leftOwner; }
    public TreeNode getRightOwner() { return rightOwner; }

    /**
     * Number of line breaks the original source has between the two tokens.
     */
    public int getNewlinesBetween() {
        return newlinesBetween;
    }

    /**
     * True when the left token itself spans several lines (a multi-line
     * string or block comment).
     */
    public boolean leftHasNewline() {
        return left.getEndLine() > left.getStartLine();
    }

    @Override
    public String toString() {
        return "[" + index + "] " + left.getText() + " | " + right.getText()
                + " (" + leftOwner.getKind() + ", " + rightOwner.getKind() + ", nl=" + newlinesBetween + ")";
    }
}

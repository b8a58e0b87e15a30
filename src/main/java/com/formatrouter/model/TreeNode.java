package com.formatrouter.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * A node of the syntax tree handed over by the parser collaborator.
 * A node covers an inclusive range of token indices of the file's token list;
 * nodes without source tokens (an implicit unit literal, say) cover nothing.
 */
public final class TreeNode {
    private final NodeKind kind;
    private final Role role;
    private final List<Token> source;
    private final int firstTokenIndex;
    private final int lastTokenIndex;
    private final List<TreeNode> children;
    private TreeNode parent;

    public TreeNode(NodeKind kind, Role role, List<Token> source,
                    int firstTokenIndex, int lastTokenIndex, List<TreeNode> children) {
        this.kind = kind;
        this.role = role == null ? Role.NONE : role;
        this.source = source;
        this.firstTokenIndex = firstTokenIndex;
        this.lastTokenIndex = lastTokenIndex;
        this.children = Collections.unmodifiableList(new ArrayList<>(children));
        for (TreeNode child : this.children) {
            if (child.parent != null) {
                throw new IllegalArgumentException("Node already has a parent: " + child);
            }
            child.parent = this;
        }
    }

    public NodeKind getKind() {
        return kind;
    }

    public Role getRole() {
        return role;
    }

    public Optional<TreeNode> getParent() {
        return Optional.ofNullable(parent);
    }

    public List<TreeNode> getChildren() {
        return children;
    }

    public boolean is(NodeKind... kinds) {
        for (NodeKind k : kinds) {
            if (kind == k) {
                return true;
            }
        }
        return false;
    }

    public boolean parentIs(NodeKind... kinds) {
        return parent != null && parent.is(kinds);
    }

    /**
     * First child in the given role.
     */
    public Optional<TreeNode> child(Role childRole) {
        for (TreeNode child : children) {
            if (child.role == childRole) {
                return Optional.of(child);
            }
        }
        return Optional.empty();
    }

    public List<TreeNode> children(Role childRole) {
        List<TreeNode> result = new ArrayList<>();
        for (TreeNode child : children) {
            if (child.role == childRole) {
                result.add(child);
            }
        }
        return result;
    }

    public boolean hasTokens() {
        return firstTokenIndex >= 0 && lastTokenIndex >= firstTokenIndex;
    }

    public List<Token> tokens() {
        if (!hasTokens()) {
            return Collections.emptyList();
        }
        return source.subList(firstTokenIndex, lastTokenIndex + 1);
    }

    public Token firstToken() {
        requireTokens();
        return source.get(firstTokenIndex);
    }

    public Token lastToken() {
        requireTokens();
        return source.get(lastTokenIndex);
    }

    public int getFirstTokenIndex() {
        return firstTokenIndex;
    }

    public int getLastTokenIndex() {
        return lastTokenIndex;
    }

    public boolean containsTokenIndex(int index) {
        return hasTokens() && index >= firstTokenIndex && index <= lastTokenIndex;
    }

    private void requireTokens() {
        if (!hasTokens()) {
            throw new IllegalStateException("Node has no tokens: " + kind);
        }
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(kind.name()).append('[');
        for (Token token : tokens()) {
            if (sb.charAt(sb.length() - 1) != '[') {
                sb.append(' ');
            }
            sb.append(token.getText());
        }
        return sb.append(']').toString();
    }
}

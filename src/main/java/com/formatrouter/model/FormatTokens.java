package com.formatrouter.model;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The token pair stream of one file.
 * The token list must start with a {@link TokenKind#BOF} token and end with a
 * {@link TokenKind#EOF} token, so every source token is the left side of
 * exactly one pair.
 */
public final class FormatTokens {
    private static final Map<TokenKind, TokenKind> OPEN_TO_CLOSE = new EnumMap<>(TokenKind.class);

    static {
        OPEN_TO_CLOSE.put(TokenKind.LEFT_PAREN, TokenKind.RIGHT_PAREN);
        OPEN_TO_CLOSE.put(TokenKind.LEFT_BRACKET, TokenKind.RIGHT_BRACKET);
        OPEN_TO_CLOSE.put(TokenKind.LEFT_BRACE, TokenKind.RIGHT_BRACE);
        OPEN_TO_CLOSE.put(TokenKind.INTERPOLATION_START, TokenKind.INTERPOLATION_END);
        OPEN_TO_CLOSE.put(TokenKind.INTERPOLATION_SPLICE_START, TokenKind.INTERPOLATION_SPLICE_END);
        OPEN_TO_CLOSE.put(TokenKind.XML_START, TokenKind.XML_END);
        OPEN_TO_CLOSE.put(TokenKind.XML_SPLICE_START, TokenKind.XML_SPLICE_END);
    }

    private final List<Token> tokens;
    private final TreeNode root;
    private final TreeNode[] owners;
    private final List<FormatToken> pairs;
    private final Map<Token, Token> matching = new IdentityHashMap<>();

    /**
     * Builds the pair stream, resolving each token's owner as the deepest
     * node whose span contains it.
     */
    public FormatTokens(List<Token> tokens, TreeNode root) {
        this(tokens, root, resolveOwners(tokens, root));
    }

    /**
     * Builds the pair stream with owners supplied by the parser collaborator,
     * indexed by token index.
     */
    public FormatTokens(List<Token> tokens, TreeNode root, TreeNode[] owners) {
        if (tokens.size() < 2
                || !tokens.get(0).is(TokenKind.BOF)
                || !tokens.get(tokens.size() - 1).is(TokenKind.EOF)) {
            throw new IllegalArgumentException("Token list must be delimited by BOF and EOF tokens");
        }
        if (owners.length != tokens.size()) {
            throw new IllegalArgumentException("Expected " + tokens.size() + " owners, got " + owners.length);
        }
        this.tokens = Collections.unmodifiableList(new ArrayList<>(tokens));
        this.root = root;
        this.owners = owners.clone();

        List<FormatToken> built = new ArrayList<>(tokens.size() - 1);
        for (int i = 0; i + 1 < tokens.size(); i++) {
            Token left = tokens.get(i);
            Token right = tokens.get(i + 1);
            if (left.getIndex() != i) {
                throw new IllegalArgumentException("Token " + left + " has index " + left.getIndex() + ", expected " + i);
            }
            built.add(new FormatToken(left, right, i, ownerOrRoot(i), ownerOrRoot(i + 1)));
        }
        this.pairs = Collections.unmodifiableList(built);
        computeMatching();
    }

    private static TreeNode[] resolveOwners(List<Token> tokens, TreeNode root) {
        TreeNode[] result = new TreeNode[tokens.size()];
        Deque<TreeNode> pending = new ArrayDeque<>();
        pending.push(root);
        // preorder: children are visited after their parent and overwrite it
        while (!pending.isEmpty()) {
            TreeNode node = pending.pop();
            if (node.hasTokens()) {
                int last = Math.min(node.getLastTokenIndex(), tokens.size() - 1);
                for (int i = node.getFirstTokenIndex(); i <= last; i++) {
                    result[i] = node;
                }
            }
            List<TreeNode> children = node.getChildren();
            for (int i = children.size() - 1; i >= 0; i--) {
                pending.push(children.get(i));
            }
        }
        return result;
    }

    private TreeNode ownerOrRoot(int index) {
        TreeNode owner = owners[index];
        return owner == null ? root : owner;
    }

    private void computeMatching() {
        Map<TokenKind, Deque<Token>> open = new EnumMap<>(TokenKind.class);
        for (Token token : tokens) {
            TokenKind closeKind = OPEN_TO_CLOSE.get(token.getKind());
            if (closeKind != null) {
                open.computeIfAbsent(token.getKind(), k -> new ArrayDeque<>()).push(token);
                continue;
            }
            for (Map.Entry<TokenKind, TokenKind> entry : OPEN_TO_CLOSE.entrySet()) {
                if (entry.getValue() == token.getKind()) {
                    Deque<Token> stack = open.get(entry.getKey());
                    if (stack != null && !stack.isEmpty()) {
                        Token opening = stack.pop();
                        matching.put(opening, token);
                        matching.put(token, opening);
                    }
                    break;
                }
            }
        }
    }

    public List<Token> getTokens() {
        return tokens;
    }

    public TreeNode getRoot() {
        return root;
    }

    public List<FormatToken> getPairs() {
        return pairs;
    }

    public int size() {
        return pairs.size();
    }

    public FormatToken get(int index) {
        return pairs.get(index);
    }

    /**
     * The pair whose left token is the given token; for EOF, the last pair.
     */
    public FormatToken at(Token token) {
        return pairs.get(Math.min(token.getIndex(), pairs.size() - 1));
    }

    /**
     * The pair whose right token is the given token; for BOF, the first pair.
     */
    public FormatToken before(Token token) {
        return pairs.get(Math.max(token.getIndex() - 1, 0));
    }

    public FormatToken next(FormatToken ft) {
        return pairs.get(Math.min(ft.getIndex() + 1, pairs.size() - 1));
    }

    public FormatToken prev(FormatToken ft) {
        return pairs.get(Math.max(ft.getIndex() - 1, 0));
    }

    /**
     * The pair {@code offset} positions away, clamped to the stream.
     */
    public FormatToken offset(FormatToken ft, int offset) {
        int target = Math.max(0, Math.min(pairs.size() - 1, ft.getIndex() + offset));
        return pairs.get(target);
    }

    public Optional<Token> matchingOpt(Token token) {
        return Optional.ofNullable(matching.get(token));
    }

    /**
     * The delimiter matching an opening or closing delimiter.
     *
     * @throws IllegalArgumentException if the token has no matching delimiter
     */
    public Token matching(Token token) {
        Token result = matching.get(token);
        if (result == null) {
            throw new IllegalArgumentException("No matching delimiter for " + token);
        }
        return result;
    }

    public TreeNode owner(Token token) {
        return ownerOrRoot(token.getIndex());
    }
}

package com.formatrouter.testutil;

import com.formatrouter.model.FormatTokens;
import com.formatrouter.model.NodeKind;
import com.formatrouter.model.Role;
import com.formatrouter.model.Token;
import com.formatrouter.model.TokenKind;
import com.formatrouter.model.TreeNode;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Lays out tokens and syntax nodes together.
 * <p>
 * A node lists its parts in source order: tokens it owns directly and child
 * nodes. Positions are derived from the token texts, one space apart unless
 * {@link #nl()} asks for a line break; a token's owner is the node that lists
 * it. For example {@code foo(1)}:
 * <pre>
 * node(NodeKind.TERM_APPLY,
 *     node(Role.FUN, NodeKind.TERM_NAME, ident("foo")),
 *     tok(TokenKind.LEFT_PAREN),
 *     node(Role.ARG, NodeKind.LIT, lit("1")),
 *     tok(TokenKind.RIGHT_PAREN))
 * </pre>
 */
public final class TreeDsl {

    private TreeDsl() {
    }

    /** A token, a line break or a child node. */
    public interface Part {
    }

    static final class Tok implements Part {
        final TokenKind kind;
        final String text;

        Tok(TokenKind kind, String text) {
            this.kind = kind;
            this.text = text;
        }
    }

    static final class Newlines implements Part {
        final int count;

        Newlines(int count) {
            this.count = count;
        }
    }

    /** A syntax node still to be built. */
    public static final class NodeSpec implements Part {
        final NodeKind kind;
        final List<Part> parts;
        Role role;

        NodeSpec(NodeKind kind, Role role, List<Part> parts) {
            this.kind = kind;
            this.role = role;
            this.parts = parts;
        }

        /** Puts the node in {@code value}'s role and returns it. */
        public NodeSpec as(Role value) {
            this.role = value;
            return this;
        }
    }

    public static NodeSpec node(NodeKind kind, Part... parts) {
        return new NodeSpec(kind, Role.NONE, Arrays.asList(parts));
    }

    public static NodeSpec node(Role role, NodeKind kind, Part... parts) {
        return new NodeSpec(kind, role, Arrays.asList(parts));
    }

    public static Part tok(TokenKind kind) {
        return new Tok(kind, kind.getDefaultText());
    }

    public static Part tok(TokenKind kind, String text) {
        return new Tok(kind, text);
    }

    public static Part ident(String name) {
        return new Tok(TokenKind.IDENT, name);
    }

    public static Part lit(String text) {
        return new Tok(TokenKind.LITERAL, text);
    }

    public static Part comment(String text) {
        return new Tok(TokenKind.COMMENT, text);
    }

    /** A line break before the next token. */
    public static Part nl() {
        return new Newlines(1);
    }

    /** A blank line before the next token. */
    public static Part blank() {
        return new Newlines(2);
    }

    /** A term name node holding one identifier. */
    public static NodeSpec name(Role role, String name) {
        return node(role, NodeKind.TERM_NAME, ident(name));
    }

    /** A literal node. */
    public static NodeSpec literal(Role role, String text) {
        return node(role, NodeKind.LIT, lit(text));
    }

    /**
     * A call {@code fun(args...)} with literal or name arguments.
     */
    public static NodeSpec call(Role role, String fun, NodeSpec... args) {
        List<Part> parts = new ArrayList<>();
        parts.add(name(Role.FUN, fun));
        parts.add(tok(TokenKind.LEFT_PAREN));
        for (int i = 0; i < args.length; i++) {
            if (i > 0) {
                parts.add(tok(TokenKind.COMMA));
            }
            parts.add(args[i].as(Role.ARG));
        }
        parts.add(tok(TokenKind.RIGHT_PAREN));
        return new NodeSpec(NodeKind.TERM_APPLY, role, parts);
    }

    /**
     * Wraps statements into a source file and lays everything out.
     */
    public static Source source(NodeSpec... stats) {
        List<Part> parts = new ArrayList<>();
        for (int i = 0; i < stats.length; i++) {
            if (i > 0) {
                parts.add(nl());
            }
            parts.add(stats[i].as(Role.STAT));
        }
        return build(new NodeSpec(NodeKind.SOURCE, Role.NONE, parts));
    }

    /**
     * Lays out {@code root}, which becomes the tree's root.
     */
    public static Source build(NodeSpec root) {
        return new Layout().build(root);
    }

    private static final class Layout {
        private final List<Token> tokens = new ArrayList<>();
        private final List<NodeSpec> tokenOwners = new ArrayList<>();
        private final Map<NodeSpec, TreeNode> nodes = new IdentityHashMap<>();
        private int offset;
        private int line;
        private int column;
        private int pendingNewlines;

        Source build(NodeSpec root) {
            addToken(TokenKind.BOF, "", root);
            pendingNewlines = 0;
            layOut(root);
            pendingNewlines = Math.max(pendingNewlines, 1);
            addToken(TokenKind.EOF, "", root);

            TreeNode rootNode = create(root);
            TreeNode[] owners = new TreeNode[tokens.size()];
            for (int i = 0; i < owners.length; i++) {
                owners[i] = nodes.get(tokenOwners.get(i));
            }
            FormatTokens formatTokens = new FormatTokens(tokens, rootNode, owners);
            return new Source(formatTokens, nodes);
        }

        private void layOut(NodeSpec spec) {
            for (Part part : spec.parts) {
                if (part instanceof Tok) {
                    Tok tok = (Tok) part;
                    addToken(tok.kind, tok.text, spec);
                } else if (part instanceof Newlines) {
                    pendingNewlines += ((Newlines) part).count;
                } else {
                    layOut((NodeSpec) part);
                }
            }
        }

        private void addToken(TokenKind kind, String text, NodeSpec owner) {
            if (!tokens.isEmpty()) {
                if (pendingNewlines > 0) {
                    offset += pendingNewlines;
                    line += pendingNewlines;
                    column = 0;
                } else if (tokens.size() > 1) {
                    offset++;
                    column++;
                }
            }
            pendingNewlines = 0;
            int startLine = line;
            int startColumn = column;
            int start = offset;
            for (char ch : text.toCharArray()) {
                offset++;
                if (ch == '\n') {
                    line++;
                    column = 0;
                } else {
                    column++;
                }
            }
            tokens.add(new Token(kind, text, tokens.size(), start, offset, startLine, line, startColumn));
            tokenOwners.add(owner);
        }

        // the first and last token of each node are found by walking its parts
        private TreeNode create(NodeSpec spec) {
            List<TreeNode> children = new ArrayList<>();
            for (Part part : spec.parts) {
                if (part instanceof NodeSpec) {
                    children.add(create((NodeSpec) part));
                }
            }
            int first = -1;
            int last = -2;
            for (int i = 1; i < tokens.size() - 1; i++) {
                if (within(spec, tokenOwners.get(i))) {
                    if (first < 0) {
                        first = i;
                    }
                    last = i;
                }
            }
            TreeNode node = new TreeNode(spec.kind, spec.role, tokens, first, last, children);
            nodes.put(spec, node);
            return node;
        }

        private boolean within(NodeSpec ancestor, NodeSpec spec) {
            if (ancestor == spec) {
                return true;
            }
            for (Part part : ancestor.parts) {
                if (part instanceof NodeSpec && within((NodeSpec) part, spec)) {
                    return true;
                }
            }
            return false;
        }
    }
}

package com.formatrouter.model;

import com.formatrouter.testutil.Source;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.formatrouter.testutil.TreeDsl.call;
import static com.formatrouter.testutil.TreeDsl.literal;
import static com.formatrouter.testutil.TreeDsl.name;
import static com.formatrouter.testutil.TreeDsl.nl;
import static com.formatrouter.testutil.TreeDsl.node;
import static com.formatrouter.testutil.TreeDsl.source;
import static com.formatrouter.testutil.TreeDsl.tok;
import static org.junit.jupiter.api.Assertions.*;

class FormatTokensTest {

    private static Source fooCall() {
        return source(call(Role.NONE, "foo", literal(Role.ARG, "1"), literal(Role.ARG, "2")));
    }

    @Test
    @DisplayName("Every token but EOF is the left side of exactly one pair")
    void testPairs() {
        FormatTokens tokens = fooCall().getTokens();

        assertEquals(tokens.getTokens().size() - 1, tokens.size());
        for (int i = 0; i < tokens.size(); i++) {
            FormatToken ft = tokens.get(i);
            assertEquals(i, ft.getIndex());
            assertSame(tokens.getTokens().get(i), ft.getLeft());
            assertSame(tokens.getTokens().get(i + 1), ft.getRight());
        }
        assertTrue(tokens.get(0).getLeft().is(TokenKind.BOF));
        assertTrue(tokens.get(tokens.size() - 1).getRight().is(TokenKind.EOF));
    }

    @Test
    @DisplayName("The token list must be delimited by BOF and EOF")
    void testDelimiters() {
        List<Token> tokens = new ArrayList<>(fooCall().getTokens().getTokens());
        TreeNode root = new TreeNode(NodeKind.SOURCE, Role.NONE, tokens, 1, tokens.size() - 2, List.of());

        assertThrows(IllegalArgumentException.class,
                () -> new FormatTokens(tokens.subList(1, tokens.size()), root));
        assertThrows(IllegalArgumentException.class,
                () -> new FormatTokens(tokens.subList(0, tokens.size() - 1), root));
    }

    @Test
    @DisplayName("Token indices must match their positions")
    void testIndices() {
        List<Token> tokens = List.of(
                new Token(TokenKind.BOF, "", 0, 0, 0, 0, 0, 0),
                new Token(TokenKind.IDENT, "a", 5, 0, 1, 0, 0, 0),
                new Token(TokenKind.EOF, "", 2, 2, 2, 1, 1, 0));
        TreeNode root = new TreeNode(NodeKind.SOURCE, Role.NONE, tokens, 1, 1, List.of());

        assertThrows(IllegalArgumentException.class, () -> new FormatTokens(tokens, root));
    }

    @Test
    @DisplayName("Delimiters are matched by kind and nesting")
    void testMatching() {
        Source src = source(node(NodeKind.TERM_BLOCK,
                tok(TokenKind.LEFT_BRACE),
                call(Role.STAT, "f", call(Role.NONE, "g")),
                tok(TokenKind.RIGHT_BRACE)));
        FormatTokens tokens = src.getTokens();

        Token outerParen = src.token("(", 0);
        Token innerParen = src.token("(", 1);
        assertSame(src.token(")", 1), tokens.matching(outerParen));
        assertSame(src.token(")", 0), tokens.matching(innerParen));
        assertSame(outerParen, tokens.matching(src.token(")", 1)));
        assertSame(src.token("}"), tokens.matching(src.token("{")));
        assertFalse(tokens.matchingOpt(src.token("f")).isPresent());
        assertThrows(IllegalArgumentException.class, () -> tokens.matching(src.token("f")));
    }

    @Test
    @DisplayName("Owners given by the parser match the deepest enclosing node")
    void testOwners() {
        Source src = fooCall();
        FormatTokens given = src.getTokens();
        FormatTokens resolved = new FormatTokens(given.getTokens(), given.getRoot());

        assertEquals(NodeKind.TERM_NAME, given.owner(src.token("foo")).getKind());
        assertEquals(NodeKind.TERM_APPLY, given.owner(src.token("(")).getKind());
        assertEquals(NodeKind.LIT, given.owner(src.token("1")).getKind());
        assertEquals(NodeKind.SOURCE, given.owner(given.getTokens().get(0)).getKind());
        for (Token token : given.getTokens()) {
            assertSame(given.owner(token), resolved.owner(token), "owner of " + token);
        }
    }

    @Test
    @DisplayName("Line breaks between tokens are counted from the source lines")
    void testNewlines() {
        Source src = source(name(Role.STAT, "a"), node(NodeKind.TERM_NAME, nl(), tok(TokenKind.IDENT, "b")));
        FormatToken ab = src.pair("a", "b");

        assertEquals(2, ab.getNewlinesBetween());
        assertEquals(0, fooCall().pair("foo", "(").getNewlinesBetween());
        assertFalse(ab.leftHasNewline());
    }

    @Test
    @DisplayName("Navigation is clamped to the pair stream")
    void testNavigation() {
        FormatTokens tokens = fooCall().getTokens();
        FormatToken first = tokens.get(0);
        FormatToken last = tokens.get(tokens.size() - 1);

        assertSame(first, tokens.prev(first));
        assertSame(last, tokens.next(last));
        assertSame(tokens.get(1), tokens.next(first));
        assertSame(last, tokens.offset(first, 100));
        assertSame(first, tokens.before(first.getLeft()));
        assertSame(last, tokens.at(last.getRight()));
        assertSame(tokens.get(3), tokens.before(tokens.getTokens().get(4)));
    }

    @Test
    @DisplayName("Tree nodes know their parent, children and token span")
    void testTreeNode() {
        Source src = fooCall();
        TreeNode apply = src.getTokens().owner(src.token("("));

        assertEquals(NodeKind.SOURCE, apply.getParent().get().getKind());
        assertEquals(2, apply.children(Role.ARG).size());
        assertEquals("foo", apply.child(Role.FUN).get().firstToken().getText());
        assertSame(src.token(")"), apply.lastToken());
        assertTrue(apply.containsTokenIndex(src.token("2").getIndex()));
        assertFalse(apply.parentIs(NodeKind.TERM_APPLY));

        TreeNode empty = new TreeNode(NodeKind.LIT_UNIT, Role.ARG, src.getTokens().getTokens(), -1, -2, List.of());
        assertFalse(empty.hasTokens());
        assertTrue(empty.tokens().isEmpty());
        assertThrows(IllegalStateException.class, empty::firstToken);
        assertThrows(IllegalArgumentException.class,
                () -> new TreeNode(NodeKind.SOURCE, Role.NONE, List.of(), -1, -2, List.of(apply)));
    }
}

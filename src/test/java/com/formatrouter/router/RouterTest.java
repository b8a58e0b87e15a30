package com.formatrouter.router;

import com.formatrouter.api.error.UnexpectedTreeException;
import com.formatrouter.config.FormatStyle;
import com.formatrouter.model.FormatToken;
import com.formatrouter.model.NodeKind;
import com.formatrouter.model.Role;
import com.formatrouter.model.TokenKind;
import com.formatrouter.split.ExpiresOn;
import com.formatrouter.split.Indent;
import com.formatrouter.split.Length;
import com.formatrouter.split.Modification;
import com.formatrouter.split.Split;
import com.formatrouter.testutil.Source;
import com.formatrouter.testutil.Styles;
import com.formatrouter.testutil.TreeDsl.NodeSpec;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static com.formatrouter.testutil.TreeDsl.call;
import static com.formatrouter.testutil.TreeDsl.ident;
import static com.formatrouter.testutil.TreeDsl.literal;
import static com.formatrouter.testutil.TreeDsl.name;
import static com.formatrouter.testutil.TreeDsl.node;
import static com.formatrouter.testutil.TreeDsl.source;
import static com.formatrouter.testutil.TreeDsl.tok;
import static org.junit.jupiter.api.Assertions.*;

class RouterTest {

    private static final String[] MEMBERS = {"b", "c", "d", "e"};

    private final FormatStyle style = Styles.defaults();

    private static NodeSpec select(NodeSpec qual, String member) {
        return node(NodeKind.TERM_SELECT, qual.as(Role.QUAL), tok(TokenKind.DOT), name(Role.NAME, member));
    }

    private static NodeSpec apply(NodeSpec fun, String arg) {
        return node(NodeKind.TERM_APPLY, fun.as(Role.FUN),
                tok(TokenKind.LEFT_PAREN), literal(Role.ARG, arg), tok(TokenKind.RIGHT_PAREN));
    }

    /** {@code a.b(1).c(2)...} with {@code calls} calls. */
    private static Source chain(int calls) {
        NodeSpec expr = name(Role.NONE, "a");
        for (int i = 0; i < calls; i++) {
            expr = apply(select(expr, MEMBERS[i]), String.valueOf(i + 1));
        }
        return source(expr);
    }

    private static NodeSpec ifThen() {
        return node(NodeKind.TERM_IF,
                tok(TokenKind.KW_IF), tok(TokenKind.LEFT_PAREN), name(Role.COND, "x"), tok(TokenKind.RIGHT_PAREN),
                name(Role.THEN, "y"));
    }

    private static Split newlineOf(List<Split> splits) {
        return splits.stream().filter(Split::isNewline).filter(Split::isActive).findFirst()
                .orElseThrow(() -> new AssertionError("No active newline split in " + splits));
    }

    @Test
    @DisplayName("Empty braces collapse")
    void testEmptyBraces() {
        Source src = source(node(NodeKind.TERM_BLOCK, tok(TokenKind.LEFT_BRACE), tok(TokenKind.RIGHT_BRACE)));

        List<Split> splits = src.router(style).getSplits(src.pair("{", "}"));

        assertEquals(1, splits.size());
        assertEquals(Modification.NO_SPLIT, splits.get(0).getModification());
        assertEquals(0, splits.get(0).getCost());
        assertEquals("EmptyBraces", splits.get(0).getOrigin());
    }

    @Test
    @DisplayName("A bin-packed call that overflows still offers the one-line candidate")
    void testBinPackedCallSite() {
        String arg = "\"0123456789012345678901234567\"";
        Source src = source(call(Role.NONE, "foo",
                literal(Role.ARG, arg), literal(Role.ARG, arg), literal(Role.ARG, arg)));
        FormatStyle binPack = Styles.with("binPack.callSite", true);
        assertTrue(src.token(")").getEnd() > binPack.getMaxColumn());

        FormatToken open = src.pair("(", arg);
        List<Split> splits = src.router(binPack).getSplits(open);

        assertEquals("BinPackCallSite", splits.get(0).getOrigin());
        Split noSplit = splits.get(0);
        assertEquals(Modification.NO_SPLIT, noSplit.getModification());
        assertEquals(0, noSplit.getCost());
        assertTrue(noSplit.isActive());
        assertTrue(noSplit.hasPolicy());

        Split newline = newlineOf(splits);
        assertTrue(newline.getCost() > 0);
        Indent indent = newline.getIndents().get(0);
        assertSame(src.token(")"), indent.getExpire());
        assertEquals(Length.num(4), indent.getLength());
    }

    @Test
    @DisplayName("The paren after if aligns its condition up to the closing paren")
    void testIfOpenParen() {
        Source src = source(ifThen());
        FormatToken afterParen = src.pair("(", "x");

        List<Split> aligned = src.router(style).getSplits(afterParen);
        assertEquals(1, aligned.size());
        assertEquals(Modification.NO_SPLIT, aligned.get(0).getModification());
        Indent indent = aligned.get(0).getIndents().get(0);
        assertSame(Length.STATE_COLUMN, indent.getLength());
        assertSame(src.token(")"), indent.getExpire());
        assertEquals(ExpiresOn.LEFT, indent.getExpiresOn());

        List<Split> fixed = src.router(Styles.with("align.ifWhileOpenParen", false)).getSplits(afterParen);
        assertEquals(1, fixed.size());
        assertEquals(Length.num(style.getContinuationIndentCallSite()), fixed.get(0).getIndents().get(0).getLength());

        assertEquals("IfKeyword", src.router(style).matchingRule(src.pair("if", "(")).orElse(""));
    }

    @Test
    @DisplayName("Breaking a longer chain costs more")
    void testChainLengthPenalty() {
        int previous = -1;
        for (int calls = 1; calls <= 4; calls++) {
            Source src = chain(calls);
            List<Split> splits = src.router(style).getSplits(src.pair("a", "."));

            assertEquals("SelectChain", splits.get(0).getOrigin(), "chain of " + calls);
            assertTrue(splits.get(0).isActive());
            int cost = newlineOf(splits).getCost();
            assertTrue(cost > previous, "chain of " + calls + " costs " + cost + ", not more than " + previous);
            previous = cost;
        }
    }

    @Test
    @DisplayName("Routing is deterministic")
    void testDeterminism() {
        Source src = chain(3);
        Router first = src.router(style);
        Router second = src.router(style);

        for (FormatToken ft : src.getTokens().getPairs()) {
            assertEquals(first.getSplits(ft), second.getSplits(ft), ft.toString());
            assertEquals(first.getSplits(ft), first.getSplits(ft), ft.toString());
        }
    }

    @Test
    @DisplayName("Chain policies built under different styles are not interchangeable")
    void testChainPolicyEquality() {
        Source src = chain(3);
        FormatToken ft = src.pair("a", ".");

        Split plain = newlineOf(src.router(style).getSplits(ft));
        Split again = newlineOf(src.router(style).getSplits(ft));
        Split inside = newlineOf(src.router(Styles.with("optIn.breaksInsideChains", true)).getSplits(ft));

        assertEquals(plain.getPolicy(), again.getPolicy());
        assertNotEquals(plain.getPolicy(), inside.getPolicy());
    }

    @Test
    @DisplayName("Every split records the rule that produced it")
    void testOrigins() {
        Source src = chain(2);
        Router router = src.router(style);
        Set<String> names = new HashSet<>(Router.ruleNames());

        for (FormatToken ft : src.getTokens().getPairs()) {
            List<Split> splits = router.getSplits(ft);
            assertFalse(splits.isEmpty(), ft.toString());
            for (Split split : splits) {
                assertTrue(names.contains(split.getOrigin()), split.toString());
                assertEquals(router.matchingRule(ft).get(), split.getOrigin());
            }
        }
        assertTrue(router.getUnmatchedPairs().isEmpty());
    }

    @Test
    @DisplayName("Rule names are unique")
    void testRuleNames() {
        List<String> names = Router.ruleNames();
        assertEquals(names.size(), new HashSet<>(names).size());
    }

    @Test
    @DisplayName("A pair no rule knows gets no candidates and is recorded")
    void testUnmatched() {
        Source src = source(node(NodeKind.TERM_NAME,
                ident("s"), tok(TokenKind.INTERPOLATION_START), tok(TokenKind.INTERPOLATION_END)));
        Router router = src.router(style);
        FormatToken ft = src.after(src.token("s"));

        assertTrue(router.getSplits(ft).isEmpty());
        assertFalse(router.matchingRule(ft).isPresent());
        assertEquals(1, router.getUnmatchedPairs().size());
        assertEquals(ft.getIndex(), router.getUnmatchedPairs().getInt(0));
    }

    @Test
    @DisplayName("An else outside an if is an inconsistent tree")
    void testElseOutsideIf() {
        Source src = source(node(NodeKind.TERM_NAME, tok(TokenKind.KW_ELSE), ident("x")));
        Router router = src.router(style);

        UnexpectedTreeException e = assertThrows(UnexpectedTreeException.class,
                () -> router.getSplits(src.pair("else", "x")));
        assertEquals(NodeKind.TERM_IF, e.getExpected());
        assertEquals(NodeKind.TERM_NAME, e.getActual().getKind());
        assertSame(src.pair("else", "x"), e.getFormatToken());
    }

    @Test
    @DisplayName("Navigation failures inside a rule are reported against the pair")
    void testCaseWithoutArrow() {
        Source src = source(node(NodeKind.CASE, tok(TokenKind.KW_CASE), name(Role.PAT, "x"), name(Role.BODY, "y")));
        Router router = src.router(style);
        FormatToken ft = src.pair("case", "x");

        UnexpectedTreeException e = assertThrows(UnexpectedTreeException.class, () -> router.getSplits(ft));
        assertSame(ft, e.getFormatToken());
        assertNull(e.getExpected());
        assertTrue(e.getCause() instanceof IllegalStateException);
        assertThrows(UnexpectedTreeException.class, () -> router.matchingRule(ft));
    }

    @Test
    @DisplayName("Each edition gate can be turned off on its own")
    void testEditionGate() {
        Source src = source(node(NodeKind.TERM_WHILE,
                tok(TokenKind.KW_WHILE), tok(TokenKind.LEFT_PAREN), name(Role.COND, "x"), tok(TokenKind.RIGHT_PAREN),
                name(Role.BODY, "y")));
        FormatToken body = src.pair(")", "y");

        assertEquals("ControlCloseParen", src.router(style).matchingRule(body).orElse(""));
        FormatStyle without2020 = Styles.with("editions.2020-01", false);
        assertEquals("AfterDelim", src.router(without2020).matchingRule(body).orElse(""));
        // the if rule is not gated
        Source ifSrc = source(ifThen());
        assertEquals("ControlCloseParen", ifSrc.router(without2020).matchingRule(ifSrc.pair(")", "y")).orElse(""));
    }

    @Test
    @DisplayName("Named families always get at least one active candidate")
    void testNonEmptiness() {
        Source src = source(
                ifThen(),
                call(Role.NONE, "f", literal(Role.ARG, "1"), literal(Role.ARG, "2")),
                node(NodeKind.TERM_BLOCK, tok(TokenKind.LEFT_BRACE), name(Role.STAT, "z"), tok(TokenKind.RIGHT_BRACE)));
        DecisionCache cache = src.cache(style);

        for (FormatToken ft : src.getTokens().getPairs()) {
            assertFalse(cache.getOrCompute(ft).isEmpty(), ft.toString());
        }
    }

    @Test
    @DisplayName("No policy expires before the pair that created it")
    void testPolicyRange() {
        String arg = "\"0123456789012345678901234567\"";
        Source src = source(
                ifThen(),
                call(Role.NONE, "foo", literal(Role.ARG, arg), literal(Role.ARG, arg), literal(Role.ARG, arg)),
                node(NodeKind.TERM_BLOCK, tok(TokenKind.LEFT_BRACE), name(Role.STAT, "z"), tok(TokenKind.RIGHT_BRACE)));
        Router router = src.router(Styles.with("binPack.callSite", true));

        int policies = 0;
        for (FormatToken ft : src.getTokens().getPairs()) {
            for (Split split : router.getSplits(ft)) {
                if (split.hasPolicy()) {
                    policies++;
                    assertTrue(split.getPolicy().getExpire() >= ft.getLeft().getEnd(),
                            split.getOrigin() + " at " + ft);
                }
            }
        }
        assertTrue(policies > 0);
    }
}

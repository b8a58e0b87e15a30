package com.formatrouter.router;

import com.formatrouter.config.FormatStyle;
import com.formatrouter.model.FormatToken;
import com.formatrouter.model.NodeKind;
import com.formatrouter.model.Role;
import com.formatrouter.model.TokenKind;
import com.formatrouter.split.Modification;
import com.formatrouter.split.Split;
import com.formatrouter.testutil.Source;
import com.formatrouter.testutil.Styles;
import com.formatrouter.testutil.TreeDsl.Part;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.formatrouter.testutil.TreeDsl.call;
import static com.formatrouter.testutil.TreeDsl.comment;
import static com.formatrouter.testutil.TreeDsl.lit;
import static com.formatrouter.testutil.TreeDsl.literal;
import static com.formatrouter.testutil.TreeDsl.name;
import static com.formatrouter.testutil.TreeDsl.nl;
import static com.formatrouter.testutil.TreeDsl.node;
import static com.formatrouter.testutil.TreeDsl.source;
import static com.formatrouter.testutil.TreeDsl.tok;
import static org.junit.jupiter.api.Assertions.*;

class DecisionCacheTest {

    private final FormatStyle style = Styles.defaults();

    /** {@code if (x) y else <between> z}. */
    private static Source ifElse(Part... between) {
        Part[] parts = new Part[7 + between.length];
        parts[0] = tok(TokenKind.KW_IF);
        parts[1] = tok(TokenKind.LEFT_PAREN);
        parts[2] = name(Role.COND, "x");
        parts[3] = tok(TokenKind.RIGHT_PAREN);
        parts[4] = name(Role.THEN, "y");
        parts[5] = tok(TokenKind.KW_ELSE);
        System.arraycopy(between, 0, parts, 6, between.length);
        parts[parts.length - 1] = name(Role.ELSE, "z");
        return source(node(NodeKind.TERM_IF, parts));
    }

    @Test
    @DisplayName("Ignored splits never leave the cache")
    void testDropsIgnored() {
        Source src = source(node(NodeKind.TERM_BLOCK,
                tok(TokenKind.LEFT_BRACE), name(Role.STAT, "x"), tok(TokenKind.RIGHT_BRACE)));
        DecisionCache cache = src.cache(style);
        FormatToken ft = src.pair("{", "x");

        List<Split> routed = cache.getRouter().getSplits(ft);
        List<Split> active = cache.getOrCompute(ft);

        assertEquals(3, routed.size());
        assertEquals(2, active.size());
        assertTrue(active.stream().allMatch(Split::isActive));
        assertTrue(active.stream().anyMatch(Split::isNewline));
    }

    @Test
    @DisplayName("Results are memoized per pair")
    void testMemoized() {
        Source src = source(call(Role.NONE, "f", literal(Role.ARG, "1"), literal(Role.ARG, "2")));
        DecisionCache cache = src.cache(style);
        FormatToken ft = src.pair("(", "1");

        List<Split> first = cache.getOrCompute(ft);
        assertSame(first, cache.getOrCompute(ft));
        assertEquals(1, cache.size());

        for (FormatToken pair : src.getTokens().getPairs()) {
            cache.getOrCompute(pair);
        }
        assertEquals(src.getTokens().size(), cache.size());
        assertThrows(UnsupportedOperationException.class, () -> first.add(new Split(Modification.SPACE, 0)));
    }

    @Test
    @DisplayName("A line comment is always followed by a line break")
    void testAfterLineComment() {
        Source src = source(call(Role.NONE, "f",
                node(Role.ARG, NodeKind.LIT, lit("1"), comment("// c"), nl()),
                literal(Role.ARG, "2")));
        DecisionCache cache = src.cache(style);
        FormatToken ft = src.pair("// c", ",");

        List<Split> routed = cache.getRouter().getSplits(ft);
        assertEquals(1, routed.size());
        assertFalse(routed.get(0).isNewline());
        assertEquals("BeforeComma", routed.get(0).getOrigin());

        List<Split> splits = cache.getOrCompute(ft);
        assertEquals(1, splits.size());
        assertEquals(Modification.NEWLINE, splits.get(0).getModification());
        assertEquals(0, splits.get(0).getCost());
        assertEquals("SingleLineComment", splits.get(0).getOrigin());
    }

    @Test
    @DisplayName("A trailing line comment stays on its line")
    void testAttachedLineComment() {
        Source src = ifElse(comment("// c"), nl());
        DecisionCache cache = src.cache(style);
        FormatToken ft = src.pair("else", "// c");

        List<Split> routed = cache.getRouter().getSplits(ft);
        assertEquals(2, routed.size());
        assertTrue(routed.get(1).isNewline());

        List<Split> splits = cache.getOrCompute(ft);
        assertEquals(2, splits.size());
        for (Split split : splits) {
            assertEquals(Modification.SPACE, split.getModification());
        }
        assertEquals(0, splits.get(0).getCost());
        assertEquals(1, splits.get(1).getCost());
    }

    @Test
    @DisplayName("Commented-out code keeps column zero")
    void testCommentedOutCode() {
        Source src = ifElse(nl(), comment("// c"), nl());
        DecisionCache cache = src.cache(style);
        FormatToken ft = src.pair("else", "// c");
        assertEquals(0, ft.getRight().getStartColumn());

        List<Split> splits = cache.getOrCompute(ft);

        assertEquals(1, splits.size());
        assertEquals(Modification.NEWLINE.withNoIndent(true), splits.get(0).getModification());
        assertEquals(1, splits.get(0).getCost());
    }

    @Test
    @DisplayName("Plain pairs pass through unchanged")
    void testPassThrough() {
        Source src = ifElse();
        DecisionCache cache = src.cache(style);
        FormatToken ft = src.pair("else", "z");

        assertEquals(cache.getRouter().getSplits(ft), cache.getOrCompute(ft));
    }
}

package com.formatrouter.core;

import com.formatrouter.api.DecisionGraph;
import com.formatrouter.api.error.FormatterError;
import com.formatrouter.api.error.Severity;
import com.formatrouter.model.FormatTokens;
import com.formatrouter.model.NodeKind;
import com.formatrouter.model.Role;
import com.formatrouter.model.TokenKind;
import com.formatrouter.testutil.Source;
import com.formatrouter.testutil.Styles;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.formatrouter.testutil.TreeDsl.call;
import static com.formatrouter.testutil.TreeDsl.ident;
import static com.formatrouter.testutil.TreeDsl.literal;
import static com.formatrouter.testutil.TreeDsl.name;
import static com.formatrouter.testutil.TreeDsl.node;
import static com.formatrouter.testutil.TreeDsl.source;
import static com.formatrouter.testutil.TreeDsl.tok;
import static org.junit.jupiter.api.Assertions.*;

class RouterEngineTest {

    private RouterEngine engine;

    @BeforeEach
    void setUp() {
        engine = new RouterEngine(Styles.defaults(), 2);
    }

    @AfterEach
    void tearDown() {
        engine.close();
    }

    private static FormatTokens wellFormed() {
        return source(call(Role.NONE, "f", literal(Role.ARG, "1"), literal(Role.ARG, "2"))).getTokens();
    }

    private static FormatTokens unmatched() {
        return source(node(NodeKind.TERM_NAME,
                ident("s"), tok(TokenKind.INTERPOLATION_START), tok(TokenKind.INTERPOLATION_END))).getTokens();
    }

    private static FormatTokens inconsistent() {
        return source(node(NodeKind.TERM_NAME, tok(TokenKind.KW_ELSE), ident("x"))).getTokens();
    }

    @Test
    @DisplayName("A well-formed file gets a decision list for every pair")
    void testRouteFile() {
        FormatTokens tokens = wellFormed();

        DecisionGraph graph = engine.routeFile(Paths.get("Good.scala"), tokens);

        assertTrue(graph.isSuccessful());
        assertTrue(graph.getErrors().isEmpty());
        assertEquals(tokens.size(), graph.size());
        for (int i = 0; i < graph.size(); i++) {
            assertFalse(graph.getSplits(i).isEmpty(), "pair " + i);
        }
        assertSame(tokens, graph.getFormatTokens());
    }

    @Test
    @DisplayName("Policies are indexed by the offset they expire at")
    void testPolicyIndex() {
        Source src = source(call(Role.NONE, "f", literal(Role.ARG, "1"), literal(Role.ARG, "2")));

        DecisionGraph graph = engine.routeFile(Paths.get("Good.scala"), src.getTokens());

        int policies = 0;
        for (int i = 0; i < graph.size(); i++) {
            policies += (int) graph.getSplits(i).stream().filter(s -> s.hasPolicy()).count();
        }
        int indexed = 0;
        for (int offset = 0; offset <= src.getTokens().getTokens().get(src.getTokens().size()).getEnd(); offset++) {
            indexed += graph.policiesExpiringAt(offset).size();
        }
        assertEquals(policies, indexed);
        assertTrue(graph.policiesExpiringAt(-1).isEmpty());
    }

    @Test
    @DisplayName("A pair no rule matches is reported as a warning")
    void testUnmatchedPair() {
        FormatTokens tokens = unmatched();

        DecisionGraph graph = engine.routeFile(Paths.get("Interp.scala"), tokens);

        assertTrue(graph.isSuccessful());
        assertEquals(tokens.size(), graph.size());
        assertEquals(1, graph.getErrors().size());
        FormatterError warning = graph.getErrors().get(0);
        assertEquals(Severity.WARNING, warning.getSeverity());
        assertEquals(1, warning.getLine());
        assertEquals(3, warning.getColumn());
        assertEquals(1, engine.getUnmatchedPairCount());
    }

    @Test
    @DisplayName("An inconsistent tree fails the file with a fatal error")
    void testInconsistentTree() {
        DecisionGraph graph = engine.routeFile(Paths.get("Bad.scala"), inconsistent());

        assertFalse(graph.isSuccessful());
        assertEquals(0, graph.size());
        assertEquals(1, graph.getErrors().size());
        FormatterError error = graph.getErrors().get(0);
        assertEquals(Severity.FATAL, error.getSeverity());
        assertEquals(1, error.getLine());
        assertEquals(6, error.getColumn());
        assertTrue(error.getMessage().contains("TERM_IF"), error.getMessage());
        assertNotNull(error.getSuggestion());
        assertEquals(1, engine.getErrorCount());
    }

    @Test
    @DisplayName("A case clause without an arrow fails the file at the clause")
    void testCaseWithoutArrow() {
        FormatTokens tokens = source(node(NodeKind.CASE,
                tok(TokenKind.KW_CASE), name(Role.PAT, "x"), name(Role.BODY, "y"))).getTokens();

        DecisionGraph graph = engine.routeFile(Paths.get("Case.scala"), tokens);

        assertFalse(graph.isSuccessful());
        assertEquals(0, graph.size());
        FormatterError error = graph.getErrors().get(0);
        assertEquals(Severity.FATAL, error.getSeverity());
        assertEquals(1, error.getLine());
        assertEquals(6, error.getColumn());
        assertTrue(error.getMessage().contains("without arrow"), error.getMessage());
        assertEquals(1, engine.getErrorCount());
        assertEquals(0, engine.getSuccessCount());
    }

    @Test
    @DisplayName("A failing file does not affect the others in a batch")
    void testBatchIsolation() {
        Map<Path, FormatTokens> files = new LinkedHashMap<>();
        files.put(Paths.get("c/Good.scala"), wellFormed());
        files.put(Paths.get("a/Bad.scala"), inconsistent());
        files.put(Paths.get("b/Interp.scala"), unmatched());
        files.put(Paths.get("d/Other.scala"), wellFormed());

        Map<Path, DecisionGraph> results = engine.routeFiles(files);

        assertEquals(new ArrayList<>(files.keySet()), new ArrayList<>(results.keySet()));
        assertTrue(results.get(Paths.get("c/Good.scala")).isSuccessful());
        assertFalse(results.get(Paths.get("a/Bad.scala")).isSuccessful());
        assertTrue(results.get(Paths.get("b/Interp.scala")).isSuccessful());
        assertTrue(results.get(Paths.get("d/Other.scala")).isSuccessful());

        assertEquals(4, engine.getProcessedFileCount());
        assertEquals(3, engine.getSuccessCount());
        assertEquals(1, engine.getErrorCount());
        assertEquals(1, engine.getUnmatchedPairCount());
    }

    @Test
    @DisplayName("Routing a file twice gives the same decisions")
    void testDeterministic() {
        FormatTokens tokens = wellFormed();
        DecisionGraph first = engine.routeFile(Paths.get("Good.scala"), tokens);
        DecisionGraph second = new RouterEngine(Styles.defaults(), 1).routeFile(Paths.get("Good.scala"), tokens);

        List<Object> a = new ArrayList<>();
        List<Object> b = new ArrayList<>();
        for (int i = 0; i < first.size(); i++) {
            a.add(first.getSplits(i));
            b.add(second.getSplits(i));
        }
        assertEquals(a, b);
    }

    @Test
    @DisplayName("An empty batch routes nothing")
    void testEmptyBatch() {
        assertTrue(engine.routeFiles(Map.of()).isEmpty());
        assertEquals(0, engine.getProcessedFileCount());
    }

    @Test
    @DisplayName("The thread count must be positive")
    void testThreadCount() {
        assertThrows(IllegalArgumentException.class, () -> new RouterEngine(Styles.defaults(), 0));
    }
}

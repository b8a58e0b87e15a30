package com.formatrouter.util;

import com.formatrouter.api.DecisionGraph;
import com.formatrouter.api.error.FormatterError;
import com.formatrouter.api.error.Severity;
import com.formatrouter.model.Token;
import com.formatrouter.model.TokenKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ErrorFormatterTest {

    private final ErrorFormatter plain = new ErrorFormatter(false);

    private static DecisionGraph graph(FormatterError... errors) {
        DecisionGraph.Builder builder = DecisionGraph.builder().successful(true);
        for (FormatterError error : errors) {
            builder.addError(error);
        }
        return builder.build();
    }

    @Test
    @DisplayName("A diagnostic shows severity, message and position")
    void testFormatError() {
        FormatterError error = new FormatterError(Severity.WARNING, "No rule matches", 3, 7);

        assertEquals("WARNING: No rule matches (3:7)", plain.formatError(error));
    }

    @Test
    @DisplayName("Suggestions go on their own line")
    void testSuggestion() {
        FormatterError error = new FormatterError(Severity.FATAL, "Bad tree", 1, 6, "Fix the parser");

        assertEquals("FATAL: Bad tree (1:6)\n  Suggestion: Fix the parser", plain.formatError(error));
        assertFalse(plain.formatError(new FormatterError(Severity.INFO, "x", 1, 1, "")).contains("Suggestion"));
    }

    @Test
    @DisplayName("Token positions become 1-based")
    void testAtToken() {
        Token token = new Token(TokenKind.IDENT, "x", 4, 20, 21, 2, 2, 6);

        FormatterError error = FormatterError.at(Severity.WARNING, "w", token, null);

        assertEquals(3, error.getLine());
        assertEquals(7, error.getColumn());
        assertFalse(error.hasSuggestion());
        assertEquals(new FormatterError(Severity.WARNING, "w", 3, 7), error);
    }

    @Test
    @DisplayName("Colors wrap the severity only when enabled")
    void testColors() {
        ErrorFormatter colored = new ErrorFormatter(true);
        FormatterError error = new FormatterError(Severity.ERROR, "Broken", 2, 2);

        assertTrue(colored.formatError(error).startsWith(ErrorFormatter.ANSI_RED + "ERROR" + ErrorFormatter.ANSI_RESET));
        assertFalse(plain.formatError(error).contains("\u001B"));
        assertEquals("text", plain.colorize(ErrorFormatter.ANSI_BLUE, "text"));
    }

    @Test
    @DisplayName("The summary counts diagnostics per file and in total")
    void testSummary() {
        Map<Path, DecisionGraph> graphs = new LinkedHashMap<>();
        graphs.put(Paths.get("src/B.scala"), graph(
                new FormatterError(Severity.WARNING, "w", 1, 1),
                new FormatterError(Severity.WARNING, "w", 2, 1)));
        graphs.put(Paths.get("src/A.scala"), graph(new FormatterError(Severity.FATAL, "f", 1, 1)));
        graphs.put(Paths.get("src/Clean.scala"), graph());

        String summary = plain.formatErrorSummary(graphs);

        assertTrue(summary.startsWith("Routing Summary:\n"));
        assertTrue(summary.contains("A.scala: 1 fatal\n"), summary);
        assertTrue(summary.contains("B.scala: 2 warnings\n"), summary);
        assertFalse(summary.contains("Clean.scala"));
        assertTrue(summary.indexOf("A.scala") < summary.indexOf("B.scala"));
        assertTrue(summary.endsWith("Total: 1 fatal, 2 warnings"), summary);
    }

    @Test
    @DisplayName("A clean run says so")
    void testCleanSummary() {
        String summary = plain.formatErrorSummary(Map.of(Paths.get("A.scala"), graph()));

        assertTrue(summary.endsWith("Total: no diagnostics"));
    }
}

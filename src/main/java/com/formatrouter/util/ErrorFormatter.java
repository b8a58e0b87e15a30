package com.formatrouter.util;

import com.formatrouter.api.DecisionGraph;
import com.formatrouter.api.error.FormatterError;
import com.formatrouter.api.error.Severity;

import java.nio.file.Path;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Renders routing diagnostics for people.
 */
public class ErrorFormatter {
    public static final String ANSI_RESET = "\u001B[0m";
    public static final String ANSI_RED = "\u001B[31m";
    public static final String ANSI_GREEN = "\u001B[32m";
    public static final String ANSI_YELLOW = "\u001B[33m";
    public static final String ANSI_BLUE = "\u001B[34m";
    public static final String ANSI_BOLD = "\u001B[1m";

    private final boolean useColors;

    /**
     * @param useColors whether to wrap severities in ANSI colors
     */
    public ErrorFormatter(boolean useColors) {
        this.useColors = useColors;
    }

    /**
     * One diagnostic as {@code SEVERITY: message (line:column)}, followed by
     * its suggestion when there is one.
     */
    public String formatError(FormatterError error) {
        StringBuilder sb = new StringBuilder();
        sb.append(severityLabel(error.getSeverity())).append(": ");
        sb.append(error.getMessage());
        sb.append(" (").append(error.getLine()).append(':').append(error.getColumn()).append(')');

        if (error.hasSuggestion()) {
            sb.append("\n  ").append(colorize(ANSI_GREEN, "Suggestion: "))
                    .append(error.getSuggestion());
        }

        return sb.toString();
    }

    /**
     * Per-file counts of diagnostics by severity, then the totals. Files
     * without diagnostics are left out.
     */
    public String formatErrorSummary(Map<Path, DecisionGraph> graphs) {
        StringBuilder sb = new StringBuilder();
        sb.append(colorize(ANSI_BOLD, "Routing Summary:\n"));

        Map<Severity, Long> totals = new EnumMap<>(Severity.class);
        graphs.entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .forEach(entry -> {
                    List<FormatterError> errors = entry.getValue().getErrors();
                    if (errors.isEmpty()) {
                        return;
                    }
                    Map<Severity, Long> counts = countBySeverity(errors);
                    counts.forEach((severity, count) -> totals.merge(severity, count, Long::sum));
                    Path fileName = entry.getKey().getFileName();
                    sb.append(fileName == null ? entry.getKey() : fileName).append(": ")
                            .append(renderCounts(counts)).append('\n');
                });

        sb.append("\nTotal: ");
        sb.append(totals.isEmpty() ? colorize(ANSI_GREEN, "no diagnostics") : renderCounts(totals));
        return sb.toString();
    }

    private Map<Severity, Long> countBySeverity(List<FormatterError> errors) {
        Map<Severity, Long> counts = new EnumMap<>(Severity.class);
        for (FormatterError error : errors) {
            counts.merge(error.getSeverity(), 1L, Long::sum);
        }
        return counts;
    }

    private String renderCounts(Map<Severity, Long> counts) {
        return counts.entrySet().stream()
                .map(e -> colorize(colorOf(e.getKey()), e.getValue() + " " + nounOf(e.getKey())))
                .collect(Collectors.joining(", "));
    }

    private String severityLabel(Severity severity) {
        return colorize(colorOf(severity), severity.name());
    }

    private static String colorOf(Severity severity) {
        return switch (severity) {
            case FATAL, ERROR -> ANSI_RED;
            case WARNING -> ANSI_YELLOW;
            case INFO -> ANSI_BLUE;
        };
    }

    private static String nounOf(Severity severity) {
        return switch (severity) {
            case FATAL -> "fatal";
            case ERROR -> "errors";
            case WARNING -> "warnings";
            case INFO -> "info";
        };
    }

    /**
     * Applies ANSI color to text if colors are enabled.
     */
    public String colorize(String color, String message) {
        if (useColors) {
            return color + message + ANSI_RESET;
        }
        return message;
    }
}

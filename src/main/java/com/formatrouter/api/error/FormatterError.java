package com.formatrouter.api.error;

import com.formatrouter.model.Token;

import java.util.Objects;

/**
 * A diagnostic produced while routing a file. Positions are 1-based.
 */
public class FormatterError {
    private final Severity severity;
    private final String message;
    private final int line;
    private final int column;
    private final String suggestion;

    public FormatterError(Severity severity, String message, int line, int column) {
        this(severity, message, line, column, null);
    }

    public FormatterError(Severity severity, String message, int line, int column, String suggestion) {
        this.severity = Objects.requireNonNull(severity, "severity");
        this.message = message;
        this.line = line;
        this.column = column;
        this.suggestion = suggestion;
    }

    /**
     * Diagnostic positioned at the start of a token, whose line and column
     * are 0-based.
     */
    public static FormatterError at(Severity severity, String message, Token token, String suggestion) {
        return new FormatterError(severity, message, token.getStartLine() + 1, token.getStartColumn() + 1, suggestion);
    }

    public Severity getSeverity() { return severity; }
    public String getMessage() { return message; }
    public int getLine() { return line; }
    public int getColumn() { return column; }
    public String getSuggestion() { return suggestion; }

    public boolean hasSuggestion() {
        return suggestion != null && !suggestion.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FormatterError)) return false;
        FormatterError that = (FormatterError) o;
        return line == that.line && column == that.column && severity == that.severity
                && Objects.equals(message, that.message) && Objects.equals(suggestion, that.suggestion);
    }

    @Override
    public int hashCode() {
        return Objects.hash(severity, message, line, column, suggestion);
    }

    @Override
    public String toString() {
        return severity + " " + line + ":" + column + " " + message;
    }
}

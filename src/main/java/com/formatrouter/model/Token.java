package com.formatrouter.model;

/**
 * A lexical token of the formatted file.
 * Tokens use identity semantics: two tokens are the same only if they are the
 * same object, which is what policies and indents rely on when they name an
 * expiry token.
 */
public final class Token {
    private final TokenKind kind;
    private final String text;
    private final int index;
    private final int start;
    private final int end;
    private final int startLine;
    private final int endLine;
    private final int startColumn;

    public Token(TokenKind kind, String text, int index, int start, int end,
                 int startLine, int endLine, int startColumn) {
        if (kind == null) {
            throw new IllegalArgumentException("Token kind cannot be null");
        }
        if (end < start) {
            throw new IllegalArgumentException("Token end " + end + " precedes start " + start);
        }
        this.kind = kind;
        this.text = text == null ? "" : text;
        this.index = index;
        this.start = start;
        this.end = end;
        this.startLine = startLine;
        this.endLine = endLine;
        this.startColumn = startColumn;
    }

    public TokenKind getKind() { return kind; }
    public String getText() { return text; }
    public int getIndex() { return index; }
    public int getStart() { return start; }
    public int getEnd() { return end; }
    public int getStartLine() { return startLine; }
    public int getEndLine() { return endLine; }
    public int getStartColumn() { return startColumn; }

    public boolean is(TokenKind other) {
        return kind == other;
    }

    public boolean isAny(TokenKind... kinds) {
        for (TokenKind k : kinds) {
            if (kind == k) {
                return true;
            }
        }
        return false;
    }

    public boolean isIdent(String name) {
        return kind == TokenKind.IDENT && text.equals(name);
    }

    @Override
    public String toString() {
        return kind + "(" + text + ")@" + start;
    }
}

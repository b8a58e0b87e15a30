package com.formatrouter.router;

import com.formatrouter.model.FormatToken;
import com.formatrouter.model.Token;
import com.formatrouter.model.TokenKind;
import com.formatrouter.split.Modification;

/**
 * Stateless predicates over single tokens and token pairs.
 */
public final class TokenOps {

    private TokenOps() {
    }

    public static boolean isSingleLineComment(Token token) {
        return token.is(TokenKind.COMMENT) && token.getText().startsWith("//");
    }

    public static boolean isDocstring(Token token) {
        return token.is(TokenKind.COMMENT) && token.getText().startsWith("/**");
    }

    public static boolean isTripleQuote(Token token) {
        return token.getText().startsWith("\"\"\"");
    }

    /**
     * True for names that cannot start an alphanumeric identifier, e.g.
     * {@code ::} or {@code +}.
     */
    public static boolean isSymbolicName(String name) {
        if (name.isEmpty()) {
            return false;
        }
        char first = name.charAt(0);
        return !Character.isLetterOrDigit(first) && first != '_' && first != '$' && first != '`';
    }

    public static boolean isSymbolicIdent(Token token) {
        return token.is(TokenKind.IDENT) && isSymbolicName(token.getText());
    }

    public static boolean endsWithSymbolIdent(Token token) {
        if (!token.is(TokenKind.IDENT) || token.getText().isEmpty()) {
            return false;
        }
        String text = token.getText();
        char last = text.charAt(text.length() - 1);
        return !Character.isLetterOrDigit(last) && last != '`' && last != '_' && last != '$';
    }

    /**
     * Space after an identifier ending in an operator character, so that
     * {@code a_:} is never glued to a following colon.
     */
    public static Modification identModification(Token ident) {
        String text = ident.getText();
        if (text.isEmpty()) {
            return Modification.NO_SPLIT;
        }
        char last = text.charAt(text.length() - 1);
        return Modification.space(!Character.isLetterOrDigit(last) && last != '`');
    }

    public static boolean isBoolOperator(Token token) {
        return token.isIdent("&&") || token.isIdent("||");
    }

    /**
     * A single-line comment on the same line as the token before it.
     */
    public static boolean isAttachedSingleLineComment(FormatToken ft) {
        return isSingleLineComment(ft.getRight()) && ft.getNewlinesBetween() == 0;
    }

    /**
     * A single-line comment starting at column zero, which is how
     * commented-out code usually looks.
     */
    public static boolean rhsIsCommentedOut(FormatToken ft) {
        return isSingleLineComment(ft.getRight()) && ft.getRight().getStartColumn() == 0;
    }

    public static Modification newlines2Modification(FormatToken ft) {
        return Modification.fromNewlines(ft.getNewlinesBetween(), rhsIsCommentedOut(ft));
    }

    public static boolean isOpenDelim(Token token) {
        return token.isAny(TokenKind.LEFT_PAREN, TokenKind.LEFT_BRACKET, TokenKind.LEFT_BRACE);
    }

    public static boolean isCloseDelim(Token token) {
        return token.isAny(TokenKind.RIGHT_PAREN, TokenKind.RIGHT_BRACKET, TokenKind.RIGHT_BRACE);
    }

    public static boolean isKeywordOrModifier(Token token) {
        return token.getKind().isKeyword();
    }
}

package com.formatrouter.model;

/**
 * Kinds of tokens produced by the lexer collaborator.
 * Each kind knows whether it is a keyword, a modifier keyword or a delimiter,
 * which is all the rule table needs for its fallback cases.
 */
public enum TokenKind {
    BOF("", Category.NONE),
    EOF("", Category.NONE),

    IDENT("", Category.NONE),
    LITERAL("", Category.NONE),
    COMMENT("", Category.TRIVIA),

    INTERPOLATION_ID("", Category.NONE),
    INTERPOLATION_START("\"", Category.NONE),
    INTERPOLATION_PART("", Category.NONE),
    INTERPOLATION_SPLICE_START("$", Category.NONE),
    INTERPOLATION_SPLICE_END("", Category.NONE),
    INTERPOLATION_END("\"", Category.NONE),

    XML_START("", Category.NONE),
    XML_PART("", Category.NONE),
    XML_SPLICE_START("", Category.NONE),
    XML_SPLICE_END("", Category.NONE),
    XML_END("", Category.NONE),

    LEFT_BRACE("{", Category.DELIM),
    RIGHT_BRACE("}", Category.DELIM),
    LEFT_PAREN("(", Category.DELIM),
    RIGHT_PAREN(")", Category.DELIM),
    LEFT_BRACKET("[", Category.DELIM),
    RIGHT_BRACKET("]", Category.DELIM),
    COMMA(",", Category.DELIM),
    SEMICOLON(";", Category.DELIM),
    DOT(".", Category.DELIM),
    COLON(":", Category.DELIM),
    EQUALS("=", Category.DELIM),
    AT("@", Category.DELIM),
    HASH("#", Category.DELIM),
    UNDERSCORE("_", Category.DELIM),
    RIGHT_ARROW("=>", Category.DELIM),
    LEFT_ARROW("<-", Category.DELIM),
    SUBTYPE("<:", Category.DELIM),
    SUPERTYPE(">:", Category.DELIM),
    VIEWBOUND("<%", Category.DELIM),

    KW_ABSTRACT("abstract", Category.MODIFIER),
    KW_CASE("case", Category.KEYWORD),
    KW_CATCH("catch", Category.KEYWORD),
    KW_CLASS("class", Category.KEYWORD),
    KW_DEF("def", Category.KEYWORD),
    KW_DO("do", Category.KEYWORD),
    KW_ELSE("else", Category.KEYWORD),
    KW_EXTENDS("extends", Category.KEYWORD),
    KW_FINAL("final", Category.MODIFIER),
    KW_FINALLY("finally", Category.KEYWORD),
    KW_FOR("for", Category.KEYWORD),
    KW_IF("if", Category.KEYWORD),
    KW_IMPLICIT("implicit", Category.MODIFIER),
    KW_IMPORT("import", Category.KEYWORD),
    KW_LAZY("lazy", Category.MODIFIER),
    KW_MATCH("match", Category.KEYWORD),
    KW_NEW("new", Category.KEYWORD),
    KW_OBJECT("object", Category.KEYWORD),
    KW_OVERRIDE("override", Category.MODIFIER),
    KW_PACKAGE("package", Category.KEYWORD),
    KW_PRIVATE("private", Category.MODIFIER),
    KW_PROTECTED("protected", Category.MODIFIER),
    KW_RETURN("return", Category.KEYWORD),
    KW_SEALED("sealed", Category.MODIFIER),
    KW_SUPER("super", Category.KEYWORD),
    KW_THIS("this", Category.KEYWORD),
    KW_THROW("throw", Category.KEYWORD),
    KW_TRAIT("trait", Category.KEYWORD),
    KW_TRY("try", Category.KEYWORD),
    KW_TYPE("type", Category.KEYWORD),
    KW_VAL("val", Category.KEYWORD),
    KW_VAR("var", Category.KEYWORD),
    KW_WHILE("while", Category.KEYWORD),
    KW_WITH("with", Category.KEYWORD),
    KW_YIELD("yield", Category.KEYWORD);

    private enum Category { NONE, TRIVIA, DELIM, KEYWORD, MODIFIER }

    private final String defaultText;
    private final Category category;

    TokenKind(String defaultText, Category category) {
        this.defaultText = defaultText;
        this.category = category;
    }

    /**
     * Source text of tokens of this kind when the kind has a fixed spelling,
     * empty otherwise.
     */
    public String getDefaultText() {
        return defaultText;
    }

    /**
     * Modifier keywords count as keywords too.
     */
    public boolean isKeyword() {
        return category == Category.KEYWORD || category == Category.MODIFIER;
    }

    public boolean isModifier() {
        return category == Category.MODIFIER;
    }

    public boolean isDelim() {
        return category == Category.DELIM;
    }

    public boolean isTrivia() {
        return category == Category.TRIVIA;
    }
}

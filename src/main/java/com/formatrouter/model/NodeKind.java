package com.formatrouter.model;

/**
 * Syntax tree node kinds supplied by the parser collaborator.
 */
public enum NodeKind {
    SOURCE,
    PKG,
    PKG_OBJECT,
    IMPORT,
    IMPORTER,
    IMPORTEE,

    DEFN_CLASS,
    DEFN_TRAIT,
    DEFN_OBJECT,
    DEFN_DEF,
    DEFN_MACRO,
    DEFN_VAL,
    DEFN_VAR,
    DEFN_TYPE,
    DECL_DEF,
    DECL_VAL,
    DECL_TYPE,
    CTOR_PRIMARY,
    CTOR_SECONDARY,
    TEMPLATE,
    SELF,
    INIT,
    NAME,

    TERM_NAME,
    TERM_SELECT,
    TERM_APPLY,
    TERM_APPLY_TYPE,
    TERM_APPLY_INFIX,
    TERM_APPLY_UNARY,
    TERM_BLOCK,
    TERM_FUNCTION,
    TERM_PARTIAL_FUNCTION,
    TERM_IF,
    TERM_WHILE,
    TERM_DO,
    TERM_FOR,
    TERM_FOR_YIELD,
    TERM_MATCH,
    TERM_TRY,
    TERM_TRY_WITH_HANDLER,
    TERM_RETURN,
    TERM_THROW,
    TERM_NEW,
    TERM_NEW_ANONYMOUS,
    TERM_ASSIGN,
    TERM_PARAM,
    TERM_TUPLE,
    TERM_INTERPOLATE,
    TERM_XML,
    TERM_SUPER,
    TERM_THIS,
    TERM_REPEATED,
    TERM_ASCRIBE,

    LIT,
    LIT_UNIT,

    CASE,
    PAT_VAR,
    PAT_BIND,
    PAT_ALTERNATIVE,
    PAT_EXTRACT,
    PAT_EXTRACT_INFIX,
    PAT_TUPLE,
    PAT_TYPED,
    PAT_WILDCARD,
    PAT_INTERPOLATE,
    PAT_XML,

    TYPE_NAME,
    TYPE_SELECT,
    TYPE_APPLY,
    TYPE_APPLY_INFIX,
    TYPE_WITH,
    TYPE_FUNCTION,
    TYPE_TUPLE,
    TYPE_PARAM,
    TYPE_BY_NAME,
    TYPE_REPEATED,
    TYPE_SINGLETON,

    ENUMERATOR_GENERATOR,
    ENUMERATOR_GUARD,
    ENUMERATOR_VAL,

    MOD_ANNOT,
    MOD_PRIVATE,
    MOD_PROTECTED,
    MOD_IMPLICIT,
    MOD
}

package com.formatrouter.model;

/**
 * The slot a syntax node occupies inside its parent, e.g. the condition of
 * an {@code if} or one argument of an application.
 */
public enum Role {
    NONE,
    STAT,
    MOD,
    NAME,
    TYPE_PARAM,
    PARAM,
    DECLTPE,
    BODY,
    RHS,
    CTOR,
    TEMPLATE,
    INIT,
    SELF,
    FUN,
    ARG,
    TYPE_ARG,
    QUAL,
    LHS,
    OP,
    COND,
    THEN,
    ELSE,
    ENUM,
    EXPR,
    CASE,
    CATCH,
    FINALLY,
    PAT,
    GUARD,
    DEFAULT,
    TPE,
    LOWER_BOUND,
    UPPER_BOUND,
    CONTEXT_BOUND,
    REF,
    IMPORTER,
    IMPORTEE,
    PART
}

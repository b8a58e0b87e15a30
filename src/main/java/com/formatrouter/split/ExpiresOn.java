package com.formatrouter.split;

/**
 * When an indent stops applying: once its expire token has been seen as the
 * left token of a pair, or already when it appears as the right token.
 */
public enum ExpiresOn {
    LEFT,
    RIGHT
}

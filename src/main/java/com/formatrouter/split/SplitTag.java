package com.formatrouter.split;

/**
 * Families of splits that are only offered when a style flag turns them on.
 */
public enum SplitTag {
    ONE_ARG_PER_LINE
}

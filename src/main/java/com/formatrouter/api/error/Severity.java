package com.formatrouter.api.error;

public enum Severity {
    FATAL,   // The syntax tree contradicts a rule; the file gets no decisions
    ERROR,   // A decision graph was produced but cannot be trusted
    WARNING, // A token pair no rule recognized; left as in the source
    INFO     // Informational messages about the run
}

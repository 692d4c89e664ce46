package com.vidnyan.vbuilder.domain.error;

/**
 * Kinds of failures a design operation can report.
 * Every kind is recoverable at the call boundary.
 */
public enum ErrorKind {
    SYNTAX,
    PARSE,
    INVALID_NAME,
    DUPLICATE_NAME,
    UNKNOWN_MODULE,
    UNKNOWN_INSTANCE,
    UNKNOWN_PORT,
    UNKNOWN_PARAMETER,
    DIRECTION_MISMATCH,
    IN_USE,
    CONFLICTING_SIGNAL_KIND,
    IO,
    DECODE
}

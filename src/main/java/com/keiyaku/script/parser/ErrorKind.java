package com.keiyaku.script.parser;

/** Failure categories. None of them is recoverable from inside a program. */
public enum ErrorKind {
    UNRESOLVED_REFERENCE,
    UNKNOWN_FUNCTION,
    ARITY_MISMATCH,
    TYPE_MISMATCH,
    INVALID_IDENTIFIER,
    NEGATIVE_REPEAT_COUNT,
    UNTERMINATED_BLOCK,
    SYNTAX_ERROR,
    DIVISION_BY_ZERO,
    CALL_DEPTH_EXCEEDED
}

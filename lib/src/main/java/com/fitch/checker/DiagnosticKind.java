package com.fitch.checker;

public enum DiagnosticKind {
    /** Malformed formula text. */
    SYNTAX_ERROR,
    /** A line does not have exactly four fields. */
    MALFORMED_RECORD,
    /** Line numbering is not 1, 2, 3, ... */
    INVALID_INDEX,
    /** Unsorted, duplicate or forward context entry, or a reference to a line that does not exist. */
    INVALID_CONTEXT,
    /** Declared context differs from the visible lines, or a scope was discharged incorrectly. */
    CONTEXT_MISMATCH,
    UNKNOWN_JUSTIFICATION,
    /** The cited premises do not yield the stated formula under the named rule. */
    RULE_VIOLATION,
    /** Sub-proofs are still open at the end of the input. */
    INCOMPLETE_PROOF,
    UNTERMINATED_COMMENT,
    /** A formula nests deeper than the configured maximum. */
    DEPTH_EXCEEDED
}

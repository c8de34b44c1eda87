package com.fitch.checker.parser;

import com.fitch.checker.DiagnosticKind;

/**
 * Checked exception signalling that a piece of proof text could not be parsed. Carries the
 * diagnostic kind and the 1-based column at which the problem was found.
 */
public final class ProofParseException extends Exception {
    private static final long serialVersionUID = 1L;

    private final DiagnosticKind kind;
    private final int column;

    public ProofParseException(DiagnosticKind kind, int column, String message) {
        super(message);
        this.kind = kind;
        this.column = column;
    }

    public ProofParseException(DiagnosticKind kind, int column, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.column = column;
    }

    public DiagnosticKind getKind() {
        return kind;
    }

    public int getColumn() {
        return column;
    }
}

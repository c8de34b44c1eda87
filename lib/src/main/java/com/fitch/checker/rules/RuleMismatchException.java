package com.fitch.checker.rules;

/** Signals that the cited premises do not fit a rule's pattern. */
public final class RuleMismatchException extends Exception {
    private static final long serialVersionUID = 1L;

    public RuleMismatchException(String message) {
        super(message);
    }
}

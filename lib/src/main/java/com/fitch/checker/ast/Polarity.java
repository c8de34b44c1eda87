package com.fitch.checker.ast;

/** Role of a statement in the scoping discipline, set by its leading keyword. */
public enum Polarity {
    /** {@code Supposons}: opens a sub-proof. */
    HYPOTHESIS("Supposons"),
    /** {@code Donc}: discharges the innermost sub-proof. */
    CONCLUSION("Donc"),
    PLAIN("");

    private final String keyword;

    Polarity(String keyword) {
        this.keyword = keyword;
    }

    public String getKeyword() {
        return keyword;
    }
}

package com.fitch.checker.ast;

import java.util.Objects;

public final class Statement {
    private final Polarity polarity;
    private final Formula formula;

    /**
     * @param formula the parsed formula, or {@code null} when the formula text failed to parse.
     *     The polarity is still known in that case and keeps scope tracking in step.
     */
    public Statement(Polarity polarity, Formula formula) {
        this.polarity = Objects.requireNonNull(polarity, "polarity");
        this.formula = formula;
    }

    public Polarity getPolarity() {
        return polarity;
    }

    public Formula getFormula() {
        return formula;
    }

    public boolean isParsed() {
        return formula != null;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Statement)) {
            return false;
        }
        Statement other = (Statement) obj;
        return polarity == other.polarity && Objects.equals(formula, other.formula);
    }

    @Override
    public int hashCode() {
        return Objects.hash(polarity, formula);
    }

    @Override
    public String toString() {
        String text = formula == null ? "?" : formula.render();
        return polarity == Polarity.PLAIN ? text : polarity.getKeyword() + " " + text;
    }
}

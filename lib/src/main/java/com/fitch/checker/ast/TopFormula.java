package com.fitch.checker.ast;

public final class TopFormula extends Formula {
    static final TopFormula INSTANCE = new TopFormula();

    private TopFormula() {}

    @Override
    void appendTo(StringBuilder builder) {
        builder.append('T');
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof TopFormula;
    }

    @Override
    public int hashCode() {
        return 1;
    }
}

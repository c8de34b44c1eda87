package com.fitch.checker.ast;

public final class BottomFormula extends Formula {
    static final BottomFormula INSTANCE = new BottomFormula();

    private BottomFormula() {}

    @Override
    void appendTo(StringBuilder builder) {
        builder.append('_');
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof BottomFormula;
    }

    @Override
    public int hashCode() {
        return 2;
    }
}

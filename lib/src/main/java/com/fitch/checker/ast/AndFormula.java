package com.fitch.checker.ast;

public final class AndFormula extends BinaryFormula {

    public AndFormula(Formula left, Formula right) {
        super(left, right);
    }

    @Override
    public String getOperator() {
        return "^";
    }
}

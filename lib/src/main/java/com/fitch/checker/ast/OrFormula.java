package com.fitch.checker.ast;

public final class OrFormula extends BinaryFormula {

    public OrFormula(Formula left, Formula right) {
        super(left, right);
    }

    @Override
    public String getOperator() {
        return "v";
    }
}

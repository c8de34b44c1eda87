package com.fitch.checker.ast;

public final class ConverseImpliesFormula extends BinaryFormula {

    public ConverseImpliesFormula(Formula left, Formula right) {
        super(left, right);
    }

    @Override
    public String getOperator() {
        return "<=";
    }
}

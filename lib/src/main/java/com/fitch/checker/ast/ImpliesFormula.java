package com.fitch.checker.ast;

public final class ImpliesFormula extends BinaryFormula {

    public ImpliesFormula(Formula left, Formula right) {
        super(left, right);
    }

    @Override
    public String getOperator() {
        return "=>";
    }
}

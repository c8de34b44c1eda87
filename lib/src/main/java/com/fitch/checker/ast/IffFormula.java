package com.fitch.checker.ast;

public final class IffFormula extends BinaryFormula {

    public IffFormula(Formula left, Formula right) {
        super(left, right);
    }

    @Override
    public String getOperator() {
        return "<=>";
    }
}

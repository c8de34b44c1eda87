package com.fitch.checker.ast;

import java.util.Objects;

public final class NotFormula extends Formula {
    private final Formula operand;

    public NotFormula(Formula operand) {
        super(1 + operand.getDepth());
        this.operand = Objects.requireNonNull(operand, "operand");
    }

    public Formula getOperand() {
        return operand;
    }

    @Override
    void appendTo(StringBuilder builder) {
        builder.append('-');
        operand.appendOperandTo(builder);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof NotFormula)) {
            return false;
        }
        return operand.equals(((NotFormula) obj).operand);
    }

    @Override
    public int hashCode() {
        return 31 * operand.hashCode() + 3;
    }
}

package com.fitch.checker.ast;

import java.util.Objects;

/** Base class for the connectives taking two operands. */
public abstract class BinaryFormula extends Formula {
    private final Formula left;
    private final Formula right;

    BinaryFormula(Formula left, Formula right) {
        super(1 + Math.max(left.getDepth(), right.getDepth()));
        this.left = Objects.requireNonNull(left, "left");
        this.right = Objects.requireNonNull(right, "right");
    }

    public Formula getLeft() {
        return left;
    }

    public Formula getRight() {
        return right;
    }

    /** ASCII spelling of the connective, as accepted by the formula parser. */
    public abstract String getOperator();

    @Override
    void appendTo(StringBuilder builder) {
        left.appendOperandTo(builder);
        builder.append(' ').append(getOperator()).append(' ');
        right.appendOperandTo(builder);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || obj.getClass() != getClass()) {
            return false;
        }
        BinaryFormula other = (BinaryFormula) obj;
        return left.equals(other.left) && right.equals(other.right);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getOperator(), left, right);
    }
}

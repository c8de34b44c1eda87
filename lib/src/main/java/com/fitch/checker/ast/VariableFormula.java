package com.fitch.checker.ast;

public final class VariableFormula extends Formula {
    private final char name;

    public VariableFormula(char name) {
        this.name = name;
    }

    public char getName() {
        return name;
    }

    @Override
    void appendTo(StringBuilder builder) {
        builder.append(name);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof VariableFormula)) {
            return false;
        }
        return name == ((VariableFormula) obj).name;
    }

    @Override
    public int hashCode() {
        return Character.hashCode(name);
    }
}

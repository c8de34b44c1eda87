package com.fitch.checker.ast;

/**
 * Immutable propositional formula. Equality is structural: two formulas are equal only when
 * their trees match node for node, so {@code a ^ b} and {@code b ^ a} are different formulas.
 *
 * <p>{@link #render()} produces the canonical ASCII notation accepted by the formula parser;
 * re-parsing a rendered formula yields an equal tree.</p>
 */
public abstract class Formula {
    private final int depth;

    Formula() {
        this(0);
    }

    Formula(int depth) {
        this.depth = depth;
    }

    public static Formula variable(char name) {
        return new VariableFormula(name);
    }

    public static Formula top() {
        return TopFormula.INSTANCE;
    }

    public static Formula bottom() {
        return BottomFormula.INSTANCE;
    }

    public static Formula not(Formula operand) {
        return new NotFormula(operand);
    }

    public static Formula and(Formula left, Formula right) {
        return new AndFormula(left, right);
    }

    public static Formula or(Formula left, Formula right) {
        return new OrFormula(left, right);
    }

    public static Formula implies(Formula left, Formula right) {
        return new ImpliesFormula(left, right);
    }

    public static Formula converseImplies(Formula left, Formula right) {
        return new ConverseImpliesFormula(left, right);
    }

    public static Formula iff(Formula left, Formula right) {
        return new IffFormula(left, right);
    }

    /**
     * Number of connectives on the longest path from the root to an atom. Atoms have depth 0,
     * {@code -a} has depth 1 and {@code (a ^ b) v c} has depth 2.
     */
    public final int getDepth() {
        return depth;
    }

    public final String render() {
        StringBuilder builder = new StringBuilder();
        appendTo(builder);
        return builder.toString();
    }

    abstract void appendTo(StringBuilder builder);

    /** Appends this formula, parenthesized when it is a binary formula. */
    final void appendOperandTo(StringBuilder builder) {
        if (this instanceof BinaryFormula) {
            builder.append('(');
            appendTo(builder);
            builder.append(')');
        } else {
            appendTo(builder);
        }
    }

    @Override
    public final String toString() {
        return render();
    }
}

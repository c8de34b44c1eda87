package com.fitch.checker.rules;

import java.util.Optional;

/**
 * The closed set of inference rules. Each constant carries the code written in a proof's
 * justification field and the number of lines the rule cites, in the order listed.
 */
public enum RuleCode {
    /** {@code a}, {@code b} gives {@code a ^ b}. */
    AND_INTRODUCTION("IAnd", 2),
    /** {@code a ^ b} gives {@code a}. */
    AND_ELIMINATION_LEFT("EAndL", 1),
    /** {@code a ^ b} gives {@code b}. */
    AND_ELIMINATION_RIGHT("EAndR", 1),
    /** {@code b} gives {@code x v b}, with {@code x} taken from the stated formula. */
    OR_INTRODUCTION_LEFT("IOrL", 1),
    /** {@code a} gives {@code a v x}, with {@code x} taken from the stated formula. */
    OR_INTRODUCTION_RIGHT("IOrR", 1),
    /** {@code a => c}, {@code b => c}, {@code a v b} gives {@code c}. */
    OR_ELIMINATION("EOr", 3),
    /** {@code a}, {@code a => b} gives {@code b}. */
    IMPLIES_ELIMINATION("EImpl", 2),
    /** {@code b}, {@code a <= b} gives {@code a}. */
    CONVERSE_IMPLIES_ELIMINATION("ERImpl", 2),
    /** {@code a => b}, {@code b => a} gives {@code a <=> b}. */
    IFF_INTRODUCTION("IEquiv", 2),
    /** {@code a <=> b} gives {@code a => b}. */
    IFF_ELIMINATION_LEFT("EEquivL", 1),
    /** {@code a <=> b} gives {@code b => a}. */
    IFF_ELIMINATION_RIGHT("EEquivR", 1),
    /** {@code a => _} gives {@code -a}. */
    NOT_INTRODUCTION("INot", 1),
    /** {@code a}, {@code -a} gives {@code _}. */
    NOT_ELIMINATION("ENot", 2),
    /** {@code _} gives anything. */
    EX_FALSO("Efq", 1),
    /** {@code --a} gives {@code a}. */
    DOUBLE_NEGATION_ELIMINATION("Raa", 1),
    /** {@code a} gives {@code a}. */
    REITERATION("Rwrt", 1),
    /** Gives {@code T} from nothing. */
    TOP_INTRODUCTION("ITop", 0);

    /** Optional explicit justification of a {@code Supposons} line. */
    public static final String HYPOTHESIS_CODE = "Hyp";
    /** Optional explicit justification of a {@code Donc} line. */
    public static final String DISCHARGE_CODE = "IImpl";

    private final String code;
    private final int arity;

    RuleCode(String code, int arity) {
        this.code = code;
        this.arity = arity;
    }

    public String getCode() {
        return code;
    }

    public int getArity() {
        return arity;
    }

    public static Optional<RuleCode> fromCode(String code) {
        for (RuleCode rule : values()) {
            if (rule.code.equals(code)) {
                return Optional.of(rule);
            }
        }
        return Optional.empty();
    }
}

package com.fitch.checker.rules;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Fixed mapping from {@link RuleCode} to the {@link InferenceRule} implementing it. Keeps a
 * single place to register rules; {@link #standard()} wires in the full propositional set.
 */
public final class RuleTable {

    private static final RuleTable STANDARD = buildStandard();

    private final Map<RuleCode, InferenceRule> rules;

    public RuleTable(Map<RuleCode, InferenceRule> rules) {
        Objects.requireNonNull(rules, "rules");
        this.rules = rules.isEmpty() ? new EnumMap<>(RuleCode.class) : new EnumMap<>(rules);
    }

    public static RuleTable standard() {
        return STANDARD;
    }

    private static RuleTable buildStandard() {
        Map<RuleCode, InferenceRule> rules = new EnumMap<>(RuleCode.class);
        rules.put(RuleCode.AND_INTRODUCTION, StandardRules::andIntroduction);
        rules.put(RuleCode.AND_ELIMINATION_LEFT, StandardRules::andEliminationLeft);
        rules.put(RuleCode.AND_ELIMINATION_RIGHT, StandardRules::andEliminationRight);
        rules.put(RuleCode.OR_INTRODUCTION_LEFT, StandardRules::orIntroductionLeft);
        rules.put(RuleCode.OR_INTRODUCTION_RIGHT, StandardRules::orIntroductionRight);
        rules.put(RuleCode.OR_ELIMINATION, StandardRules::orElimination);
        rules.put(RuleCode.IMPLIES_ELIMINATION, StandardRules::impliesElimination);
        rules.put(RuleCode.CONVERSE_IMPLIES_ELIMINATION, StandardRules::converseImpliesElimination);
        rules.put(RuleCode.IFF_INTRODUCTION, StandardRules::iffIntroduction);
        rules.put(RuleCode.IFF_ELIMINATION_LEFT, StandardRules::iffEliminationLeft);
        rules.put(RuleCode.IFF_ELIMINATION_RIGHT, StandardRules::iffEliminationRight);
        rules.put(RuleCode.NOT_INTRODUCTION, StandardRules::notIntroduction);
        rules.put(RuleCode.NOT_ELIMINATION, StandardRules::notElimination);
        rules.put(RuleCode.EX_FALSO, StandardRules::exFalso);
        rules.put(RuleCode.DOUBLE_NEGATION_ELIMINATION, StandardRules::doubleNegationElimination);
        rules.put(RuleCode.REITERATION, StandardRules::reiteration);
        rules.put(RuleCode.TOP_INTRODUCTION, StandardRules::topIntroduction);
        return new RuleTable(rules);
    }

    /** Resolves a justification's code, or returns empty if no registered rule has it. */
    public Optional<RuleCode> lookup(String code) {
        return RuleCode.fromCode(code).filter(rules::containsKey);
    }

    /**
     * @throws IllegalArgumentException if {@code code} is not registered in this table
     */
    public InferenceRule get(RuleCode code) {
        InferenceRule rule = rules.get(code);
        if (rule == null) {
            throw new IllegalArgumentException("Rule not registered: " + code.getCode());
        }
        return rule;
    }

    public boolean contains(RuleCode code) {
        return rules.containsKey(code);
    }
}

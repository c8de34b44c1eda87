package com.fitch.checker.rules;

import com.fitch.checker.ast.Formula;
import java.util.List;

/**
 * Premise pattern plus conclusion builder of one inference rule. Implementations are pure
 * functions of their arguments.
 */
@FunctionalInterface
public interface InferenceRule {

    /**
     * Match the premises against this rule's pattern and build the formula the rule concludes.
     *
     * @param premises Formulas of the cited lines, in citation order; the table guarantees the
     *     count matches the rule's arity.
     * @param stated The formula the line claims. Only consulted for the parts of the conclusion
     *     the premises leave open, such as the new disjunct of an or-introduction.
     * @return The expected conclusion. The caller compares it structurally with {@code stated}.
     * @throws RuleMismatchException if the premises do not have the shape the rule needs
     */
    Formula conclude(List<Formula> premises, Formula stated) throws RuleMismatchException;
}

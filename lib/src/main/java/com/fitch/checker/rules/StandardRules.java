package com.fitch.checker.rules;

import com.fitch.checker.ast.AndFormula;
import com.fitch.checker.ast.BottomFormula;
import com.fitch.checker.ast.ConverseImpliesFormula;
import com.fitch.checker.ast.Formula;
import com.fitch.checker.ast.IffFormula;
import com.fitch.checker.ast.ImpliesFormula;
import com.fitch.checker.ast.NotFormula;
import com.fitch.checker.ast.OrFormula;
import java.util.List;

/** Introduction and elimination rules of Fitch-style propositional natural deduction. */
final class StandardRules {

    private StandardRules() {}

    static Formula andIntroduction(List<Formula> premises, Formula stated) {
        return Formula.and(premises.get(0), premises.get(1));
    }

    static Formula andEliminationLeft(List<Formula> premises, Formula stated) throws RuleMismatchException {
        return expect(AndFormula.class, premises, 0, "a ^ b").getLeft();
    }

    static Formula andEliminationRight(List<Formula> premises, Formula stated) throws RuleMismatchException {
        return expect(AndFormula.class, premises, 0, "a ^ b").getRight();
    }

    static Formula orIntroductionLeft(List<Formula> premises, Formula stated) throws RuleMismatchException {
        if (!(stated instanceof OrFormula)) {
            throw new RuleMismatchException(
                    "the line must state a disjunction x v " + premises.get(0) + " but states " + stated);
        }
        return Formula.or(((OrFormula) stated).getLeft(), premises.get(0));
    }

    static Formula orIntroductionRight(List<Formula> premises, Formula stated) throws RuleMismatchException {
        if (!(stated instanceof OrFormula)) {
            throw new RuleMismatchException(
                    "the line must state a disjunction " + premises.get(0) + " v x but states " + stated);
        }
        return Formula.or(premises.get(0), ((OrFormula) stated).getRight());
    }

    static Formula orElimination(List<Formula> premises, Formula stated) throws RuleMismatchException {
        ImpliesFormula leftCase = expect(ImpliesFormula.class, premises, 0, "a => c");
        ImpliesFormula rightCase = expect(ImpliesFormula.class, premises, 1, "b => c");
        OrFormula disjunction = expect(OrFormula.class, premises, 2, "a v b");
        if (!disjunction.getLeft().equals(leftCase.getLeft())) {
            throw new RuleMismatchException(
                    "first case assumes " + leftCase.getLeft() + " but the disjunction's left side is "
                            + disjunction.getLeft());
        }
        if (!disjunction.getRight().equals(rightCase.getLeft())) {
            throw new RuleMismatchException(
                    "second case assumes " + rightCase.getLeft() + " but the disjunction's right side is "
                            + disjunction.getRight());
        }
        if (!leftCase.getRight().equals(rightCase.getRight())) {
            throw new RuleMismatchException(
                    "cases reach different conclusions " + leftCase.getRight() + " and " + rightCase.getRight());
        }
        return leftCase.getRight();
    }

    static Formula impliesElimination(List<Formula> premises, Formula stated) throws RuleMismatchException {
        ImpliesFormula implication = expect(ImpliesFormula.class, premises, 1, "a => b");
        if (!implication.getLeft().equals(premises.get(0))) {
            throw new RuleMismatchException(
                    "implication " + implication + " needs " + implication.getLeft() + " but the cited line states "
                            + premises.get(0));
        }
        return implication.getRight();
    }

    static Formula converseImpliesElimination(List<Formula> premises, Formula stated)
            throws RuleMismatchException {
        ConverseImpliesFormula implication = expect(ConverseImpliesFormula.class, premises, 1, "a <= b");
        if (!implication.getRight().equals(premises.get(0))) {
            throw new RuleMismatchException(
                    "implication " + implication + " needs " + implication.getRight()
                            + " but the cited line states " + premises.get(0));
        }
        return implication.getLeft();
    }

    static Formula iffIntroduction(List<Formula> premises, Formula stated) throws RuleMismatchException {
        ImpliesFormula forward = expect(ImpliesFormula.class, premises, 0, "a => b");
        ImpliesFormula backward = expect(ImpliesFormula.class, premises, 1, "b => a");
        if (!forward.getLeft().equals(backward.getRight()) || !forward.getRight().equals(backward.getLeft())) {
            throw new RuleMismatchException(backward + " is not the converse of " + forward);
        }
        return Formula.iff(forward.getLeft(), forward.getRight());
    }

    static Formula iffEliminationLeft(List<Formula> premises, Formula stated) throws RuleMismatchException {
        IffFormula iff = expect(IffFormula.class, premises, 0, "a <=> b");
        return Formula.implies(iff.getLeft(), iff.getRight());
    }

    static Formula iffEliminationRight(List<Formula> premises, Formula stated) throws RuleMismatchException {
        IffFormula iff = expect(IffFormula.class, premises, 0, "a <=> b");
        return Formula.implies(iff.getRight(), iff.getLeft());
    }

    static Formula notIntroduction(List<Formula> premises, Formula stated) throws RuleMismatchException {
        ImpliesFormula implication = expect(ImpliesFormula.class, premises, 0, "a => _");
        if (!(implication.getRight() instanceof BottomFormula)) {
            throw new RuleMismatchException(
                    "cited line must have the form a => _ but is " + implication);
        }
        return Formula.not(implication.getLeft());
    }

    static Formula notElimination(List<Formula> premises, Formula stated) throws RuleMismatchException {
        NotFormula negation = expect(NotFormula.class, premises, 1, "-a");
        if (!negation.getOperand().equals(premises.get(0))) {
            throw new RuleMismatchException(
                    premises.get(0) + " and " + negation + " do not contradict each other");
        }
        return Formula.bottom();
    }

    static Formula exFalso(List<Formula> premises, Formula stated) throws RuleMismatchException {
        expect(BottomFormula.class, premises, 0, "_");
        return stated;
    }

    static Formula doubleNegationElimination(List<Formula> premises, Formula stated)
            throws RuleMismatchException {
        NotFormula outer = expect(NotFormula.class, premises, 0, "--a");
        if (!(outer.getOperand() instanceof NotFormula)) {
            throw new RuleMismatchException("cited line must have the form --a but is " + outer);
        }
        return ((NotFormula) outer.getOperand()).getOperand();
    }

    static Formula reiteration(List<Formula> premises, Formula stated) {
        return premises.get(0);
    }

    static Formula topIntroduction(List<Formula> premises, Formula stated) {
        return Formula.top();
    }

    private static <T extends Formula> T expect(Class<T> type, List<Formula> premises, int position, String shape)
            throws RuleMismatchException {
        Formula premise = premises.get(position);
        if (!type.isInstance(premise)) {
            throw new RuleMismatchException(
                    ordinal(position) + " cited line must have the form " + shape + " but is " + premise);
        }
        return type.cast(premise);
    }

    private static String ordinal(int position) {
        switch (position) {
            case 0:
                return "first";
            case 1:
                return "second";
            case 2:
                return "third";
            default:
                return "#" + (position + 1);
        }
    }
}

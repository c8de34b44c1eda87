package com.fitch.checker.semantic;

import com.fitch.checker.Diagnostic;
import com.fitch.checker.DiagnosticKind;
import com.fitch.checker.ast.Formula;
import com.fitch.checker.ast.ImpliesFormula;
import com.fitch.checker.ast.Justification;
import com.fitch.checker.ast.ProofNode;
import com.fitch.checker.ast.ProofRecord;
import com.fitch.checker.ast.SourceLocation;
import com.fitch.checker.rules.InferenceRule;
import com.fitch.checker.rules.RuleCode;
import com.fitch.checker.rules.RuleMismatchException;
import com.fitch.checker.rules.RuleTable;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Single forward pass over a proof's records, applying each record's scope transition and
 * checking its justification. All state lives in a per-call {@link AnalyzerState}, so one
 * analyzer can serve concurrent callers.
 */
public final class ProofAnalyzer {
    private static final Logger LOGGER = Logger.getLogger(ProofAnalyzer.class.getName());

    private final RuleTable rules;

    public ProofAnalyzer() {
        this(RuleTable.standard());
    }

    public ProofAnalyzer(RuleTable rules) {
        this.rules = Objects.requireNonNull(rules, "rules");
    }

    /**
     * Checks every record of {@code proof} in index order.
     *
     * @param truncated whether parsing stopped before the end of the input; an incomplete proof
     *     is only reported when the whole input was read
     */
    public ProofAnalysis analyze(ProofNode proof, boolean truncated) {
        Objects.requireNonNull(proof, "proof");
        AnalyzerState state = new AnalyzerState(proof);
        for (ProofRecord record : proof.getRecords()) {
            switch (record.getPolarity()) {
                case HYPOTHESIS:
                    checkHypothesis(record, state);
                    break;
                case CONCLUSION:
                    checkConclusion(record, state);
                    break;
                default:
                    checkPlain(record, state);
                    break;
            }
        }
        if (!truncated && state.scopes.depth() > 0) {
            List<Integer> open = state.scopes.openHypotheses();
            ProofRecord last = proof.get(proof.size());
            state.messages.add(
                    new Diagnostic(
                            DiagnosticKind.INCOMPLETE_PROOF,
                            0,
                            "proof ends with " + open.size() + " open Supposons (line "
                                    + ScopeTracker.join(open) + ")",
                            last.getLocation()));
        }
        return new ProofAnalysis(state.messages, state.scopes.depth());
    }

    private void checkHypothesis(ProofRecord record, AnalyzerState state) {
        checkContext(record, state);
        Justification justification = record.getJustification();
        if (justification != null && !isMarker(justification, RuleCode.HYPOTHESIS_CODE)) {
            state.report(
                    DiagnosticKind.RULE_VIOLATION,
                    record,
                    "a Supposons line takes no rule but is justified by " + justification);
        }
        state.scopes.openScope(record.getIndex(), record.getFormula());
        LOGGER.log(
                Level.FINER,
                "Line {0} opens scope at depth {1}",
                new Object[] {record.getIndex(), state.scopes.depth()});
    }

    private void checkConclusion(ProofRecord record, AnalyzerState state) {
        if (state.scopes.depth() == 0) {
            state.report(
                    DiagnosticKind.CONTEXT_MISMATCH,
                    record,
                    "Donc has no open Supposons to discharge");
            state.scopes.markVisible(record.getIndex());
            return;
        }
        checkContext(record, state);
        Justification justification = record.getJustification();
        if (justification != null && !isMarker(justification, RuleCode.DISCHARGE_CODE)) {
            state.report(
                    DiagnosticKind.RULE_VIOLATION,
                    record,
                    "a Donc line takes no rule but is justified by " + justification);
        }
        Scope scope = state.scopes.current();
        Formula assumption = scope.getAssumption();
        Formula formula = record.getFormula();
        if (assumption != null && formula != null) {
            checkDischarge(record, formula, scope, state);
        }
        state.scopes.closeScope(record.getIndex());
        LOGGER.log(
                Level.FINER,
                "Line {0} closes scope opened at line {1}",
                new Object[] {record.getIndex(), scope.getOpeningIndex()});
    }

    private void checkDischarge(ProofRecord record, Formula formula, Scope scope, AnalyzerState state) {
        Formula assumption = scope.getAssumption();
        if (!(formula instanceof ImpliesFormula)
                || !((ImpliesFormula) formula).getLeft().equals(assumption)) {
            state.report(
                    DiagnosticKind.RULE_VIOLATION,
                    record,
                    "Donc must state an implication from " + assumption + ", the Supposons at line "
                            + scope.getOpeningIndex() + ", but states " + formula);
            return;
        }
        Formula consequent = ((ImpliesFormula) formula).getRight();
        for (Integer index : state.scopes.visibleIndices()) {
            ProofRecord visible = state.proof.get(index);
            // A damaged line was already reported; do not reject the discharge because of it.
            if (visible.getFormula() == null || consequent.equals(visible.getFormula())) {
                return;
            }
        }
        state.report(
                DiagnosticKind.RULE_VIOLATION,
                record,
                "consequent " + consequent + " is not established in the sub-proof opened at line "
                        + scope.getOpeningIndex());
    }

    private void checkPlain(ProofRecord record, AnalyzerState state) {
        checkContext(record, state);
        checkJustification(record, state);
        state.scopes.markVisible(record.getIndex());
    }

    private void checkJustification(ProofRecord record, AnalyzerState state) {
        Justification justification = record.getJustification();
        if (justification == null) {
            return;
        }
        if (justification.isEmpty()) {
            state.report(DiagnosticKind.UNKNOWN_JUSTIFICATION, record, "line has no justification");
            return;
        }
        String code = justification.getCode();
        if (code.equals(RuleCode.HYPOTHESIS_CODE) || code.equals(RuleCode.DISCHARGE_CODE)) {
            state.report(
                    DiagnosticKind.RULE_VIOLATION,
                    record,
                    code + " only justifies " + (code.equals(RuleCode.HYPOTHESIS_CODE) ? "Supposons" : "Donc")
                            + " lines");
            return;
        }
        Optional<RuleCode> resolved = rules.lookup(code);
        if (resolved.isEmpty()) {
            state.report(DiagnosticKind.UNKNOWN_JUSTIFICATION, record, "unknown rule '" + code + "'");
            return;
        }
        RuleCode rule = resolved.get();
        List<Integer> references = justification.getReferences();
        if (references.size() != rule.getArity()) {
            state.report(
                    DiagnosticKind.RULE_VIOLATION,
                    record,
                    "rule " + rule.getCode() + " cites " + rule.getArity() + " line(s) but "
                            + references.size() + " given");
            return;
        }
        List<Formula> premises = new ArrayList<>(references.size());
        boolean complete = true;
        for (Integer reference : references) {
            if (!state.scopes.isVisible(reference)) {
                state.report(
                        DiagnosticKind.CONTEXT_MISMATCH,
                        record,
                        "line " + reference + " is not visible here");
                return;
            }
            Formula premise = state.proof.get(reference).getFormula();
            complete &= premise != null;
            premises.add(premise);
        }
        Formula stated = record.getFormula();
        if (!complete || stated == null) {
            return;
        }
        InferenceRule inference = rules.get(rule);
        Formula expected;
        try {
            expected = inference.conclude(premises, stated);
        } catch (RuleMismatchException ex) {
            state.report(DiagnosticKind.RULE_VIOLATION, record, "rule " + rule.getCode() + ": " + ex.getMessage());
            return;
        }
        if (!expected.equals(stated)) {
            state.report(
                    DiagnosticKind.RULE_VIOLATION,
                    record,
                    "rule " + rule.getCode() + " concludes " + expected + " but the line states " + stated);
        }
    }

    private void checkContext(ProofRecord record, AnalyzerState state) {
        List<Integer> context = record.getContext();
        if (context == null) {
            return;
        }
        String mismatch = state.scopes.describeContextMismatch(context);
        if (mismatch != null) {
            state.report(DiagnosticKind.CONTEXT_MISMATCH, record, mismatch);
        }
    }

    private static boolean isMarker(Justification justification, String code) {
        return justification.isEmpty()
                || (code.equals(justification.getCode()) && justification.getReferences().isEmpty());
    }

    private static final class AnalyzerState {
        private final ProofNode proof;
        private final ScopeTracker scopes = new ScopeTracker();
        private final List<Diagnostic> messages = new ArrayList<>();

        AnalyzerState(ProofNode proof) {
            this.proof = proof;
        }

        void report(DiagnosticKind kind, ProofRecord record, String message) {
            SourceLocation location = record.getLocation();
            messages.add(new Diagnostic(kind, record.getIndex(), message, location));
        }
    }
}

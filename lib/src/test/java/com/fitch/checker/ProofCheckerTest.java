package com.fitch.checker;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fitch.checker.rules.InferenceRule;
import com.fitch.checker.rules.RuleCode;
import com.fitch.checker.rules.RuleTable;
import com.fitch.checker.testing.TestResources;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ProofCheckerTest {
    private final ProofChecker checker = new ProofChecker();

    @Test
    void identityProofIsValid() {
        CheckResult result = checker.check(TestResources.lines("1;;Supposons a;", "2;1;Donc a=>a;"));

        assertTrue(result.isValid(), result.getDiagnostics().toString());
        assertEquals(2, result.getValidPrefix());
        assertEquals(2, result.getProof().size());
    }

    @Test
    void fixtureProofsAreValid() {
        for (String name : List.of("modus-ponens.proof", "contraposition.proof")) {
            CheckResult result = checker.check(name, TestResources.proof(name));
            assertTrue(result.isValid(), name + ": " + result.getDiagnostics());
            assertEquals(result.getProof().size(), result.getValidPrefix());
        }
    }

    @Test
    void modusPonensUnderOpenHypothesesOnlyLacksDischarge() {
        CheckResult result =
                checker.check(TestResources.lines("1;;Supposons a;", "2;1;Supposons a=>b;", "3;1,2;b;EImpl:1,2"));

        assertEquals(1, result.getDiagnostics().size());
        assertEquals(DiagnosticKind.INCOMPLETE_PROOF, result.getDiagnostics().get(0).getKind());
        assertEquals(3, result.getValidPrefix());
    }

    @Test
    void emptyProofIsValid() {
        CheckResult result = checker.check("(* nothing to prove *)\n");

        assertTrue(result.isValid());
        assertEquals(0, result.getValidPrefix());
    }

    @Test
    void skippedIndexIsInvalidIndex() {
        CheckResult result = checker.check(TestResources.lines("1;;Supposons a;", "3;1;Donc a=>a;"));

        assertEquals(1, result.getDiagnostics().size());
        Diagnostic diagnostic = result.getDiagnostics().get(0);
        assertEquals(DiagnosticKind.INVALID_INDEX, diagnostic.getKind());
        assertEquals(2, diagnostic.getRecordIndex());
        assertEquals(1, result.getValidPrefix());
        assertFalse(result.hasDiagnostic(DiagnosticKind.INCOMPLETE_PROOF));
    }

    @Test
    void conclusionWithoutHypothesisIsContextMismatch() {
        CheckResult result = checker.check("top.proof", "1;;Donc a=>a;\n");

        assertEquals(1, result.getDiagnostics().size());
        Diagnostic diagnostic = result.getDiagnostics().get(0);
        assertEquals(DiagnosticKind.CONTEXT_MISMATCH, diagnostic.getKind());
        assertEquals("Donc has no open Supposons to discharge", diagnostic.getMessage());
        assertEquals("top.proof", diagnostic.getLocation().getSourceName());
        assertEquals(0, result.getValidPrefix());
    }

    @Test
    void referenceIntoClosedScopeIsContextMismatch() {
        CheckResult result = checker.check(TestResources.proof("closed-scope-reference.proof"));

        assertEquals(1, result.getDiagnostics().size());
        Diagnostic diagnostic = result.getDiagnostics().get(0);
        assertEquals(DiagnosticKind.CONTEXT_MISMATCH, diagnostic.getKind());
        assertEquals(3, diagnostic.getRecordIndex());
        assertEquals("line 1 is not visible here", diagnostic.getMessage());
        assertEquals(4, diagnostic.getLocation().getLine());
        assertEquals(2, result.getValidPrefix());
    }

    @Test
    void referenceToMissingLineIsInvalidContext() {
        CheckResult result = checker.check(TestResources.lines("1;;T;ITop", "2;1;T;Rwrt:7"));

        assertEquals(1, result.getDiagnostics().size());
        assertEquals(DiagnosticKind.INVALID_CONTEXT, result.getDiagnostics().get(0).getKind());
        assertEquals(2, result.getDiagnostics().get(0).getRecordIndex());
        assertEquals(1, result.getValidPrefix());
    }

    @Test
    void contextMustListExactlyTheVisibleLines() {
        CheckResult result = checker.check(TestResources.lines("1;;Supposons a;", "2;;a;Rwrt:1", "3;1,2;Donc a=>a;"));

        assertEquals(1, result.getDiagnostics().size());
        assertEquals(DiagnosticKind.CONTEXT_MISMATCH, result.getDiagnostics().get(0).getKind());
        assertEquals(2, result.getDiagnostics().get(0).getRecordIndex());
    }

    @Test
    void diagnosticsAreOrderedByLine() {
        CheckResult result = checker.check(TestResources.lines("1;;T;ITop", "2;1;a;Rwrt:1", "3;1,2;b ^;ITop"));

        assertEquals(2, result.getDiagnostics().size());
        assertEquals(DiagnosticKind.RULE_VIOLATION, result.getDiagnostics().get(0).getKind());
        assertEquals(2, result.getDiagnostics().get(0).getRecordIndex());
        assertEquals(DiagnosticKind.SYNTAX_ERROR, result.getDiagnostics().get(1).getKind());
        assertEquals(3, result.getDiagnostics().get(1).getRecordIndex());
        assertEquals(1, result.getValidPrefix());
    }

    @Test
    void unterminatedCommentRejectsTheWholeProof() {
        CheckResult result = checker.check(TestResources.proof("unterminated-comment.proof"));

        assertEquals(1, result.getDiagnostics().size());
        assertEquals(DiagnosticKind.UNTERMINATED_COMMENT, result.getDiagnostics().get(0).getKind());
        assertEquals(0, result.getProof().size());
        assertEquals(0, result.getValidPrefix());
    }

    @Test
    void nestingLimitComesFromOptions() {
        ProofChecker shallow = new ProofChecker(CheckerOptions.defaults().withMaxNestingDepth(2));

        CheckResult result = shallow.check("1;;---a;ITop\n");

        assertEquals(1, result.getDiagnostics().size());
        assertEquals(DiagnosticKind.DEPTH_EXCEEDED, result.getDiagnostics().get(0).getKind());
        assertTrue(checker.check("1;;---T;ITop\n").hasDiagnostic(DiagnosticKind.RULE_VIOLATION));
    }

    @Test
    void longFlatChainIsRejectedWithoutExhaustingTheStack() {
        StringBuilder chain = new StringBuilder("a");
        for (int i = 0; i < 100_000; i++) {
            chain.append("^a");
        }
        String formula = chain.toString();

        CheckResult result =
                checker.check(TestResources.lines("1;;Supposons " + formula + ";", "2;1;Donc " + formula + "=>" + formula + ";"));

        assertEquals(2, result.getDiagnostics().size());
        for (Diagnostic diagnostic : result.getDiagnostics()) {
            assertEquals(DiagnosticKind.DEPTH_EXCEEDED, diagnostic.getKind());
        }
        assertEquals(0, result.getValidPrefix());
    }

    @Test
    void customRuleTableLimitsTheAcceptedRules() {
        Map<RuleCode, InferenceRule> rules = new EnumMap<>(RuleCode.class);
        rules.put(RuleCode.TOP_INTRODUCTION, (premises, stated) -> stated);
        ProofChecker restricted = new ProofChecker(CheckerOptions.defaults(), new RuleTable(rules));

        CheckResult result = restricted.check(TestResources.lines("1;;T;ITop", "2;1;T;Rwrt:1"));

        assertEquals(1, result.getDiagnostics().size());
        assertEquals(DiagnosticKind.UNKNOWN_JUSTIFICATION, result.getDiagnostics().get(0).getKind());
    }

    @Test
    void checkingIsDeterministic() {
        String text = TestResources.lines("1;;Supposons a;", "2;;b;EImpl:1,1", "3;1;Donc a=>b;", "4;9;c;");

        CheckResult first = checker.check(text);
        CheckResult second = checker.check(text);

        assertFalse(first.isValid());
        assertEquals(first.getDiagnostics(), second.getDiagnostics());
        assertEquals(first.getValidPrefix(), second.getValidPrefix());
    }
}

package com.fitch.checker.parser;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fitch.checker.Diagnostic;
import com.fitch.checker.DiagnosticKind;
import com.fitch.checker.ast.Formula;
import com.fitch.checker.ast.Justification;
import com.fitch.checker.ast.Polarity;
import com.fitch.checker.ast.ProofRecord;
import com.fitch.checker.ast.SourceLocation;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class RecordParserTest {
    private final RecordParser parser = new RecordParser("test.proof", new FormulaParser());
    private List<Diagnostic> diagnostics;

    @BeforeEach
    void setUp() {
        diagnostics = new ArrayList<>();
    }

    @Test
    void parsesPlainRecord() throws Exception {
        ProofRecord record = parser.parse("3; 1, 2 ; b ; EImpl:1,2", 7, 3, diagnostics);

        assertTrue(diagnostics.isEmpty());
        assertEquals(3, record.getIndex());
        assertEquals(List.of(1, 2), record.getContext());
        assertEquals(Polarity.PLAIN, record.getPolarity());
        assertEquals(Formula.variable('b'), record.getFormula());
        assertEquals(Justification.rule("EImpl", List.of(1, 2)), record.getJustification());
        assertEquals(new SourceLocation("test.proof", 7, 1), record.getLocation());
        assertFalse(record.isDamaged());
    }

    @Test
    void keywordsSetPolarity() throws Exception {
        ProofRecord hypothesis = parser.parse("1;;Supposons a;", 1, 1, diagnostics);
        assertEquals(Polarity.HYPOTHESIS, hypothesis.getPolarity());
        assertEquals(Formula.variable('a'), hypothesis.getFormula());
        assertTrue(hypothesis.getJustification().isEmpty());

        ProofRecord conclusion = parser.parse("2;1;Donc a=>a;IImpl", 2, 2, diagnostics);
        assertEquals(Polarity.CONCLUSION, conclusion.getPolarity());
        assertEquals(Formula.implies(Formula.variable('a'), Formula.variable('a')), conclusion.getFormula());
        assertEquals("IImpl", conclusion.getJustification().getCode());
        assertTrue(diagnostics.isEmpty());
    }

    @Test
    void keywordMustBeFollowedBySpace() throws Exception {
        ProofRecord record = parser.parse("1;;Supposonsa;", 1, 1, diagnostics);

        assertEquals(Polarity.PLAIN, record.getPolarity());
        assertNull(record.getFormula());
        assertTrue(record.isDamaged());
        assertEquals(1, diagnostics.size());
        assertEquals(DiagnosticKind.SYNTAX_ERROR, diagnostics.get(0).getKind());
    }

    @Test
    void formulaErrorsReportColumnsOfTheWholeLine() throws Exception {
        ProofRecord record = parser.parse("1;;Supposons a ^;", 4, 1, diagnostics);

        assertEquals(Polarity.HYPOTHESIS, record.getPolarity());
        assertNull(record.getFormula());
        assertEquals(1, diagnostics.size());
        Diagnostic diagnostic = diagnostics.get(0);
        assertEquals(DiagnosticKind.SYNTAX_ERROR, diagnostic.getKind());
        assertEquals(1, diagnostic.getRecordIndex());
        assertEquals("operator '^' at column 16 has no right-hand side", diagnostic.getMessage());
        assertEquals(4, diagnostic.getLocation().getLine());
    }

    @Test
    void wrongFieldCountIsMalformed() {
        ProofParseException ex =
                assertThrows(ProofParseException.class, () -> parser.parse("1;;a", 1, 1, diagnostics));
        assertEquals(DiagnosticKind.MALFORMED_RECORD, ex.getKind());
        assertEquals("expected 4 fields separated by ';' but found 3", ex.getMessage());

        ProofParseException extra =
                assertThrows(ProofParseException.class, () -> parser.parse("1;;a;Rwrt;x", 1, 1, diagnostics));
        assertEquals(DiagnosticKind.MALFORMED_RECORD, extra.getKind());
    }

    @Test
    void indexMustBeTheExpectedOne() {
        ProofParseException skipped =
                assertThrows(ProofParseException.class, () -> parser.parse("3;;a;", 2, 2, diagnostics));
        assertEquals(DiagnosticKind.INVALID_INDEX, skipped.getKind());
        assertEquals("expected line index 2 but found 3", skipped.getMessage());

        ProofParseException text =
                assertThrows(ProofParseException.class, () -> parser.parse("one;;a;", 1, 1, diagnostics));
        assertEquals(DiagnosticKind.INVALID_INDEX, text.getKind());
    }

    @Test
    void badContextsDamageTheRecord() throws Exception {
        assertContextError("3;2,1;a;", "context must be in ascending order but 1 follows 2");
        assertContextError("3;1,1;a;", "context lists line 1 twice");
        assertContextError("3;1,3;a;", "context entry 3 does not precede line 3");
        assertContextError("3;0;a;", "context entry 0 is not a line index");
        assertContextError("3;1,x;a;", "context entry 'x' is not a line index");
    }

    @Test
    void justificationReferencesAreChecked() throws Exception {
        ProofRecord forward = parser.parse("3;;a;Rwrt:5", 1, 3, diagnostics);
        assertNull(forward.getJustification());
        assertEquals(DiagnosticKind.INVALID_CONTEXT, diagnostics.get(0).getKind());
        assertEquals("reference 5 does not precede line 3", diagnostics.get(0).getMessage());

        diagnostics.clear();
        parser.parse("3;;a;Rwrt:", 1, 3, diagnostics);
        assertEquals(DiagnosticKind.INVALID_CONTEXT, diagnostics.get(0).getKind());

        diagnostics.clear();
        parser.parse("3;;a;:1", 1, 3, diagnostics);
        assertEquals(DiagnosticKind.UNKNOWN_JUSTIFICATION, diagnostics.get(0).getKind());
    }

    @Test
    void unknownRuleCodeIsLeftForTheChecker() throws Exception {
        ProofRecord record = parser.parse("2;1;b;Modus:1", 1, 2, diagnostics);
        assertTrue(diagnostics.isEmpty());
        assertEquals(Justification.rule("Modus", List.of(1)), record.getJustification());
    }

    @Test
    void peekIndexReadsOnlyTheFirstField() {
        assertEquals(12, RecordParser.peekIndex(" 12 ;garbage"));
        assertEquals(-1, RecordParser.peekIndex("x;;a;"));
        assertEquals(4, RecordParser.peekIndex("4"));
    }

    private void assertContextError(String line, String message) throws Exception {
        diagnostics.clear();
        ProofRecord record = parser.parse(line, 1, 3, diagnostics);
        assertNull(record.getContext());
        assertEquals(Formula.variable('a'), record.getFormula());
        assertEquals(1, diagnostics.size(), line);
        assertEquals(DiagnosticKind.INVALID_CONTEXT, diagnostics.get(0).getKind());
        assertEquals(message, diagnostics.get(0).getMessage());
    }
}

package com.fitch.checker.parser;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fitch.checker.Diagnostic;
import com.fitch.checker.DiagnosticKind;
import com.fitch.checker.ast.SourceLocation;
import com.fitch.checker.testing.TestResources;
import org.junit.jupiter.api.Test;

class ProofParserTest {
    private final ProofParser parser = new ProofParser();

    @Test
    void commentsAndBlankLinesKeepSourcePositions() {
        ParsedProof parsed = parser.parse("mp.proof", TestResources.proof("modus-ponens.proof"));

        assertTrue(parsed.getDiagnostics().isEmpty());
        assertFalse(parsed.isTruncated());
        assertEquals(5, parsed.getProof().size());
        assertEquals(2, parsed.getProof().get(1).getLocation().getLine());
        assertEquals(6, parsed.getProof().get(5).getLocation().getLine());
    }

    @Test
    void windowsLineEndingsAreAccepted() {
        ParsedProof parsed = parser.parse("crlf", "1;;Supposons a;\r\n\r\n2;1;Donc a=>a;\r\n");

        assertTrue(parsed.getDiagnostics().isEmpty());
        assertEquals(2, parsed.getProof().size());
        assertEquals(3, parsed.getProof().get(2).getLocation().getLine());
    }

    @Test
    void emptyInputGivesEmptyProof() {
        ParsedProof parsed = parser.parse("empty", "  \n(* nothing *)\n");

        assertEquals(0, parsed.getProof().size());
        assertTrue(parsed.getDiagnostics().isEmpty());
        assertFalse(parsed.isTruncated());
    }

    @Test
    void unterminatedCommentStopsBeforeAnyRecord() {
        ParsedProof parsed = parser.parse("open", TestResources.proof("unterminated-comment.proof"));

        assertTrue(parsed.isTruncated());
        assertEquals(0, parsed.getProof().size());
        assertEquals(1, parsed.getDiagnostics().size());
        Diagnostic diagnostic = parsed.getDiagnostics().get(0);
        assertEquals(DiagnosticKind.UNTERMINATED_COMMENT, diagnostic.getKind());
        assertEquals(0, diagnostic.getRecordIndex());
        assertEquals(new SourceLocation("open", 2, 1), diagnostic.getLocation());
    }

    @Test
    void indexGapTruncatesButLaterLinesAreStillReported() {
        String text = TestResources.lines("1;;Supposons a;", "3;1;Donc a=>a;", "4;9;a;", "5;;b;Rwrt:1");

        ParsedProof parsed = parser.parse("gap", text);

        assertTrue(parsed.isTruncated());
        assertEquals(1, parsed.getProof().size());
        assertEquals(2, parsed.getDiagnostics().size());
        Diagnostic gap = parsed.getDiagnostics().get(0);
        assertEquals(DiagnosticKind.INVALID_INDEX, gap.getKind());
        assertEquals(2, gap.getRecordIndex());
        assertEquals(2, gap.getLocation().getLine());
        Diagnostic context = parsed.getDiagnostics().get(1);
        assertEquals(DiagnosticKind.INVALID_CONTEXT, context.getKind());
        assertEquals(4, context.getRecordIndex());
    }

    @Test
    void malformedLineDoesNotShiftFollowingIndices() {
        String text = TestResources.lines("1;;a;Rwrt", "oops", "3;;a;");

        ParsedProof parsed = parser.parse("malformed", text);

        assertEquals(1, parsed.getDiagnostics().size());
        assertEquals(DiagnosticKind.MALFORMED_RECORD, parsed.getDiagnostics().get(0).getKind());
        assertEquals(2, parsed.getDiagnostics().get(0).getRecordIndex());
        assertEquals(1, parsed.getProof().size());
    }
}

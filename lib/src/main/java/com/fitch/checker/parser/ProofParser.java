package com.fitch.checker.parser;

import com.fitch.checker.CheckerOptions;
import com.fitch.checker.Diagnostic;
import com.fitch.checker.ast.ProofNode;
import com.fitch.checker.ast.ProofRecord;
import com.fitch.checker.ast.SourceLocation;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Turns proof text into a {@link ParsedProof}: strips comments, then parses one record per
 * non-blank line. Each line is parsed on its own, so a broken line does not stop later lines
 * from being reported.
 */
public final class ProofParser {

    private final FormulaParser formulaParser;

    public ProofParser() {
        this(CheckerOptions.defaults());
    }

    public ProofParser(CheckerOptions options) {
        this.formulaParser = new FormulaParser(options);
    }

    public ParsedProof parse(String sourceName, String text) {
        Objects.requireNonNull(sourceName, "sourceName");
        Objects.requireNonNull(text, "text");
        List<Diagnostic> diagnostics = new ArrayList<>();
        String stripped;
        try {
            stripped = CommentStripper.strip(text);
        } catch (CommentStripper.UnterminatedCommentException ex) {
            diagnostics.add(
                    new Diagnostic(
                            ex.getKind(),
                            0,
                            ex.getMessage(),
                            new SourceLocation(sourceName, ex.getLine(), ex.getColumn())));
            return new ParsedProof(new ProofNode(List.of()), diagnostics, true);
        }

        RecordParser recordParser = new RecordParser(sourceName, formulaParser);
        List<ProofRecord> records = new ArrayList<>();
        boolean truncated = false;
        int expectedIndex = 1;
        String[] lines = stripped.split("\r?\n", -1);
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i];
            if (line.isBlank()) {
                continue;
            }
            int lineNumber = i + 1;
            try {
                ProofRecord record = recordParser.parse(line, lineNumber, expectedIndex, diagnostics);
                // After a break, later records are still parsed for their own diagnostics.
                if (!truncated) {
                    records.add(record);
                }
                expectedIndex = record.getIndex() + 1;
            } catch (ProofParseException ex) {
                diagnostics.add(
                        new Diagnostic(
                                ex.getKind(),
                                expectedIndex,
                                ex.getMessage(),
                                new SourceLocation(sourceName, lineNumber, ex.getColumn())));
                truncated = true;
                int found = RecordParser.peekIndex(line);
                expectedIndex = found > 0 ? found + 1 : expectedIndex + 1;
            }
        }
        return new ParsedProof(new ProofNode(records), diagnostics, truncated);
    }
}

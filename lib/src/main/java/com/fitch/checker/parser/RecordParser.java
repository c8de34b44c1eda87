package com.fitch.checker.parser;

import com.fitch.checker.Diagnostic;
import com.fitch.checker.DiagnosticKind;
import com.fitch.checker.ast.Formula;
import com.fitch.checker.ast.Justification;
import com.fitch.checker.ast.Polarity;
import com.fitch.checker.ast.ProofRecord;
import com.fitch.checker.ast.SourceLocation;
import com.fitch.checker.ast.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Parses one proof line of the form {@code index;context;statement;justification}.
 *
 * <p>Failures of the first two kinds ({@link DiagnosticKind#MALFORMED_RECORD},
 * {@link DiagnosticKind#INVALID_INDEX}) are thrown because nothing about the line can be trusted.
 * Failures in the context, statement or justification fields are reported to the caller's
 * diagnostic list and produce a damaged {@link ProofRecord} instead.</p>
 */
public final class RecordParser {
    static final char FIELD_SEPARATOR = ';';
    static final char LIST_SEPARATOR = ',';
    static final char REFERENCE_MARKER = ':';
    private static final int FIELD_COUNT = 4;

    private final String sourceName;
    private final FormulaParser formulaParser;

    public RecordParser(String sourceName, FormulaParser formulaParser) {
        this.sourceName = Objects.requireNonNull(sourceName, "sourceName");
        this.formulaParser = Objects.requireNonNull(formulaParser, "formulaParser");
    }

    /**
     * @param line the line text, comments already blanked out
     * @param lineNumber 1-based line number in the source text
     * @param expectedIndex the index this record must carry
     * @param diagnostics receives the problems found in the context, statement and justification
     * @throws ProofParseException with kind {@code MALFORMED_RECORD} or {@code INVALID_INDEX}
     */
    public ProofRecord parse(String line, int lineNumber, int expectedIndex, List<Diagnostic> diagnostics)
            throws ProofParseException {
        List<Field> fields = split(line);
        if (fields.size() != FIELD_COUNT) {
            throw new ProofParseException(
                    DiagnosticKind.MALFORMED_RECORD,
                    1,
                    "expected 4 fields separated by ';' but found " + fields.size());
        }
        int index = parseIndex(fields.get(0), expectedIndex);
        SourceLocation location = new SourceLocation(sourceName, lineNumber, 1);

        List<Integer> context = null;
        Formula formula = null;
        Justification justification = null;
        try {
            context = parseContext(fields.get(1), index);
        } catch (ProofParseException ex) {
            diagnostics.add(toDiagnostic(ex, index, location));
        }
        Field statementField = fields.get(2);
        Polarity polarity = polarityOf(statementField.text);
        try {
            formula = parseFormula(statementField, polarity);
        } catch (ProofParseException ex) {
            diagnostics.add(toDiagnostic(ex, index, location));
        }
        try {
            justification = parseJustification(fields.get(3), index);
        } catch (ProofParseException ex) {
            diagnostics.add(toDiagnostic(ex, index, location));
        }
        return new ProofRecord(index, context, new Statement(polarity, formula), justification, location);
    }

    /** Reads the index field alone, or returns -1 if it is not a number. */
    static int peekIndex(String line) {
        int separator = line.indexOf(FIELD_SEPARATOR);
        String text = (separator < 0 ? line : line.substring(0, separator)).trim();
        try {
            return Integer.parseInt(text);
        } catch (NumberFormatException ex) {
            return -1;
        }
    }

    private static int parseIndex(Field field, int expectedIndex) throws ProofParseException {
        int index;
        try {
            index = Integer.parseInt(field.text);
        } catch (NumberFormatException ex) {
            throw new ProofParseException(
                    DiagnosticKind.INVALID_INDEX,
                    field.column,
                    "line index '" + field.text + "' is not a positive integer",
                    ex);
        }
        if (index != expectedIndex) {
            throw new ProofParseException(
                    DiagnosticKind.INVALID_INDEX,
                    field.column,
                    "expected line index " + expectedIndex + " but found " + index);
        }
        return index;
    }

    private static List<Integer> parseContext(Field field, int index) throws ProofParseException {
        List<Integer> context = new ArrayList<>();
        if (field.text.isEmpty()) {
            return context;
        }
        int previous = 0;
        for (String entry : field.text.split(String.valueOf(LIST_SEPARATOR), -1)) {
            int value = parseLineReference(entry.trim(), index, field.column, "context entry");
            if (value == previous) {
                throw new ProofParseException(
                        DiagnosticKind.INVALID_CONTEXT, field.column, "context lists line " + value + " twice");
            }
            if (value < previous) {
                throw new ProofParseException(
                        DiagnosticKind.INVALID_CONTEXT,
                        field.column,
                        "context must be in ascending order but " + value + " follows " + previous);
            }
            context.add(value);
            previous = value;
        }
        return context;
    }

    private Formula parseFormula(Field field, Polarity polarity) throws ProofParseException {
        String text = field.text;
        int column = field.column;
        if (polarity != Polarity.PLAIN) {
            String keyword = polarity.getKeyword();
            String rest = text.substring(keyword.length());
            String remainder = rest.stripLeading();
            column += keyword.length() + (rest.length() - remainder.length());
            text = remainder;
        }
        return formulaParser.parse(text, column);
    }

    private static Polarity polarityOf(String text) {
        for (Polarity polarity : new Polarity[] {Polarity.HYPOTHESIS, Polarity.CONCLUSION}) {
            String keyword = polarity.getKeyword();
            if (text.startsWith(keyword)
                    && (text.length() == keyword.length() || Character.isWhitespace(text.charAt(keyword.length())))) {
                return polarity;
            }
        }
        return Polarity.PLAIN;
    }

    private static Justification parseJustification(Field field, int index) throws ProofParseException {
        String text = field.text;
        if (text.isEmpty()) {
            return Justification.empty();
        }
        int marker = text.indexOf(REFERENCE_MARKER);
        String code = (marker < 0 ? text : text.substring(0, marker)).trim();
        if (code.isEmpty()) {
            throw new ProofParseException(
                    DiagnosticKind.UNKNOWN_JUSTIFICATION, field.column, "justification has no rule name");
        }
        List<Integer> references = new ArrayList<>();
        if (marker >= 0) {
            String list = text.substring(marker + 1).trim();
            if (list.isEmpty()) {
                throw new ProofParseException(
                        DiagnosticKind.INVALID_CONTEXT,
                        field.column + marker,
                        "rule " + code + " has an empty reference list after ':'");
            }
            for (String entry : list.split(String.valueOf(LIST_SEPARATOR), -1)) {
                references.add(parseLineReference(entry.trim(), index, field.column, "reference"));
            }
        }
        return Justification.rule(code, references);
    }

    private static int parseLineReference(String text, int index, int column, String what)
            throws ProofParseException {
        int value;
        try {
            value = Integer.parseInt(text);
        } catch (NumberFormatException ex) {
            throw new ProofParseException(
                    DiagnosticKind.INVALID_CONTEXT, column, what + " '" + text + "' is not a line index", ex);
        }
        if (value < 1) {
            throw new ProofParseException(
                    DiagnosticKind.INVALID_CONTEXT, column, what + " " + value + " is not a line index");
        }
        if (value >= index) {
            throw new ProofParseException(
                    DiagnosticKind.INVALID_CONTEXT,
                    column,
                    what + " " + value + " does not precede line " + index);
        }
        return value;
    }

    private Diagnostic toDiagnostic(ProofParseException ex, int index, SourceLocation location) {
        return new Diagnostic(ex.getKind(), index, ex.getMessage(), location.withColumn(ex.getColumn()));
    }

    private static List<Field> split(String line) {
        List<Field> fields = new ArrayList<>(FIELD_COUNT);
        int start = 0;
        while (true) {
            int separator = line.indexOf(FIELD_SEPARATOR, start);
            int end = separator < 0 ? line.length() : separator;
            fields.add(Field.of(line, start, end));
            if (separator < 0) {
                return fields;
            }
            start = separator + 1;
        }
    }

    /** Trimmed field text plus the 1-based column of its first non-blank character. */
    private static final class Field {
        private final String text;
        private final int column;

        private Field(String text, int column) {
            this.text = text;
            this.column = column;
        }

        static Field of(String line, int start, int end) {
            String raw = line.substring(start, end);
            String leading = raw.stripLeading();
            return new Field(leading.stripTrailing(), start + (raw.length() - leading.length()) + 1);
        }
    }
}

package com.fitch.checker;

import com.fitch.checker.parser.ParsedProof;
import com.fitch.checker.parser.ProofParser;
import com.fitch.checker.rules.RuleTable;
import com.fitch.checker.semantic.ProofAnalysis;
import com.fitch.checker.semantic.ProofAnalyzer;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Entry point for checking natural-deduction proofs. Parses the text, then analyzes the records
 * in one forward pass. Never throws for malformed input: every problem comes back as a
 * {@link Diagnostic} in the {@link CheckResult}.
 *
 * <p>Instances are immutable and may be shared between threads.</p>
 */
public final class ProofChecker {
    private static final Logger LOGGER = Logger.getLogger(ProofChecker.class.getName());
    static final String DEFAULT_SOURCE_NAME = "<input>";

    private final ProofParser parser;
    private final ProofAnalyzer analyzer;

    public ProofChecker() {
        this(CheckerOptions.defaults());
    }

    public ProofChecker(CheckerOptions options) {
        this(options, RuleTable.standard());
    }

    public ProofChecker(CheckerOptions options, RuleTable rules) {
        Objects.requireNonNull(options, "options");
        this.parser = new ProofParser(options);
        this.analyzer = new ProofAnalyzer(rules);
    }

    public CheckResult check(String text) {
        return check(DEFAULT_SOURCE_NAME, text);
    }

    public CheckResult check(String sourceName, String text) {
        Objects.requireNonNull(sourceName, "sourceName");
        Objects.requireNonNull(text, "text");
        LOGGER.log(Level.FINE, "Checking {0} with fitch-checker {1}", new Object[] {sourceName, Version.RUNTIME});

        ParsedProof parsed = parser.parse(sourceName, text);
        ProofAnalysis analysis = analyzer.analyze(parsed.getProof(), parsed.isTruncated());

        List<Diagnostic> diagnostics = new ArrayList<>(parsed.getDiagnostics());
        diagnostics.addAll(analysis.getMessages());
        diagnostics.sort(ProofChecker::compareByRecord);
        int validPrefix = validPrefix(parsed, diagnostics);

        if (diagnostics.isEmpty()) {
            LOGGER.log(Level.FINE, "{0}: proof of {1} line(s) is valid", new Object[] {sourceName, parsed.getProof().size()});
        } else {
            LOGGER.log(
                    Level.FINE,
                    "{0}: proof rejected with {1} diagnostic(s), valid through line {2}",
                    new Object[] {sourceName, diagnostics.size(), validPrefix});
        }
        return new CheckResult(parsed.getProof(), diagnostics, validPrefix);
    }

    /** Orders line-bound diagnostics by line, keeping discovery order within a line; others go last. */
    private static int compareByRecord(Diagnostic left, Diagnostic right) {
        int leftIndex = left.getRecordIndex() == 0 ? Integer.MAX_VALUE : left.getRecordIndex();
        int rightIndex = right.getRecordIndex() == 0 ? Integer.MAX_VALUE : right.getRecordIndex();
        return Integer.compare(leftIndex, rightIndex);
    }

    private static int validPrefix(ParsedProof parsed, List<Diagnostic> diagnostics) {
        int prefix = parsed.getProof().size();
        for (Diagnostic diagnostic : diagnostics) {
            if (diagnostic.getRecordIndex() > 0) {
                prefix = Math.min(prefix, diagnostic.getRecordIndex() - 1);
            } else if (diagnostic.getKind() == DiagnosticKind.UNTERMINATED_COMMENT) {
                prefix = 0;
            }
        }
        return prefix;
    }
}

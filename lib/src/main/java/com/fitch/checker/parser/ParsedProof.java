package com.fitch.checker.parser;

import com.fitch.checker.Diagnostic;
import com.fitch.checker.ast.ProofNode;
import java.util.List;

/** Output of {@link ProofParser}: the record arena plus the problems found while parsing. */
public final class ParsedProof {
    private final ProofNode proof;
    private final List<Diagnostic> diagnostics;
    private final boolean truncated;

    ParsedProof(ProofNode proof, List<Diagnostic> diagnostics, boolean truncated) {
        this.proof = proof;
        this.diagnostics = List.copyOf(diagnostics);
        this.truncated = truncated;
    }

    public ProofNode getProof() {
        return proof;
    }

    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }

    /**
     * True when a line could not be placed in the arena (wrong field count, wrong index or an
     * unterminated comment). The arena then stops before that line and scope tracking cannot
     * run past it.
     */
    public boolean isTruncated() {
        return truncated;
    }
}

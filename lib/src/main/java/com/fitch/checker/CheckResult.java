package com.fitch.checker;

import com.fitch.checker.ast.ProofNode;
import java.util.List;

/** Verdict of one {@link ProofChecker#check} call. */
public final class CheckResult {
    private final ProofNode proof;
    private final List<Diagnostic> diagnostics;
    private final int validPrefix;

    public CheckResult(ProofNode proof, List<Diagnostic> diagnostics, int validPrefix) {
        this.proof = proof;
        this.diagnostics = List.copyOf(diagnostics);
        this.validPrefix = validPrefix;
    }

    public boolean isValid() {
        return diagnostics.isEmpty();
    }

    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }

    /** Records that parsed far enough to be checked, in index order. */
    public ProofNode getProof() {
        return proof;
    }

    /**
     * Highest index {@code n} such that lines {@code 1..n} raised no diagnostic. Equal to the
     * number of records for a valid proof, and also for a proof whose only fault is being
     * left incomplete.
     */
    public int getValidPrefix() {
        return validPrefix;
    }

    public boolean hasDiagnostic(DiagnosticKind kind) {
        for (Diagnostic diagnostic : diagnostics) {
            if (diagnostic.getKind() == kind) {
                return true;
            }
        }
        return false;
    }
}

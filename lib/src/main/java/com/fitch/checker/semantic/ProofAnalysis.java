package com.fitch.checker.semantic;

import com.fitch.checker.Diagnostic;
import java.util.List;

public final class ProofAnalysis {
    private final List<Diagnostic> messages;
    private final int openScopes;

    public ProofAnalysis(List<Diagnostic> messages, int openScopes) {
        this.messages = List.copyOf(messages);
        this.openScopes = openScopes;
    }

    public List<Diagnostic> getMessages() {
        return messages;
    }

    /** Sub-proofs still open after the last record. */
    public int getOpenScopes() {
        return openScopes;
    }
}

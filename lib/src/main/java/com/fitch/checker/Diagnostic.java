package com.fitch.checker;

import com.fitch.checker.ast.SourceLocation;
import java.util.Objects;

/**
 * A problem found while checking a proof. {@link #getRecordIndex()} is {@code 0} when the
 * problem is not tied to one line (an unterminated comment, an incomplete proof).
 */
public final class Diagnostic {
    private final DiagnosticKind kind;
    private final int recordIndex;
    private final String message;
    private final SourceLocation location;

    public Diagnostic(DiagnosticKind kind, int recordIndex, String message, SourceLocation location) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.recordIndex = recordIndex;
        this.message = Objects.requireNonNull(message, "message");
        this.location = location;
    }

    public DiagnosticKind getKind() {
        return kind;
    }

    public int getRecordIndex() {
        return recordIndex;
    }

    public String getMessage() {
        return message;
    }

    /** Position of the problem in the source text, or {@code null} when unknown. */
    public SourceLocation getLocation() {
        return location;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Diagnostic)) {
            return false;
        }
        Diagnostic other = (Diagnostic) obj;
        return kind == other.kind
                && recordIndex == other.recordIndex
                && message.equals(other.message)
                && Objects.equals(location, other.location);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, recordIndex, message, location);
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();
        if (location != null) {
            builder.append(location).append(": ");
        }
        builder.append(kind);
        if (recordIndex > 0) {
            builder.append(" (line ").append(recordIndex).append(')');
        }
        return builder.append(": ").append(message).toString();
    }
}

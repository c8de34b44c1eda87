package com.fitch.checker.ast;

import java.util.List;
import java.util.Objects;

/**
 * Either empty (hypotheses and conclusions) or a rule code with the indices of the lines it
 * cites. The code is kept exactly as written; resolving it against the rule table is left to
 * the checker so that an unknown code is reported as a semantic problem, not a syntax one.
 */
public final class Justification {
    private static final Justification EMPTY = new Justification(null, List.of());

    private final String code;
    private final List<Integer> references;

    private Justification(String code, List<Integer> references) {
        this.code = code;
        this.references = List.copyOf(references);
    }

    public static Justification empty() {
        return EMPTY;
    }

    public static Justification rule(String code, List<Integer> references) {
        return new Justification(Objects.requireNonNull(code, "code"), references);
    }

    public boolean isEmpty() {
        return code == null;
    }

    /** Returns the rule code, or {@code null} for an empty justification. */
    public String getCode() {
        return code;
    }

    public List<Integer> getReferences() {
        return references;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Justification)) {
            return false;
        }
        Justification other = (Justification) obj;
        return Objects.equals(code, other.code) && references.equals(other.references);
    }

    @Override
    public int hashCode() {
        return Objects.hash(code, references);
    }

    @Override
    public String toString() {
        if (code == null) {
            return "";
        }
        if (references.isEmpty()) {
            return code;
        }
        StringBuilder builder = new StringBuilder(code).append(':');
        for (int i = 0; i < references.size(); i++) {
            if (i > 0) {
                builder.append(',');
            }
            builder.append(references.get(i));
        }
        return builder.toString();
    }
}

package com.fitch.checker.ast;

import java.util.List;
import java.util.Objects;

/**
 * One line of a proof. Records refer to each other only through indices, never by reference.
 *
 * <p>A record is <em>damaged</em> when its index parsed but one of the other fields did not.
 * The unparsed parts are {@code null}; the checker still applies the record's scope transition
 * but skips its own checks.</p>
 */
public final class ProofRecord {
    private final int index;
    private final List<Integer> context;
    private final Statement statement;
    private final Justification justification;
    private final SourceLocation location;

    public ProofRecord(
            int index,
            List<Integer> context,
            Statement statement,
            Justification justification,
            SourceLocation location) {
        if (index < 1) {
            throw new IllegalArgumentException("Record index must be positive: " + index);
        }
        this.index = index;
        this.context = context == null ? null : List.copyOf(context);
        this.statement = Objects.requireNonNull(statement, "statement");
        this.justification = justification;
        this.location = location;
    }

    public int getIndex() {
        return index;
    }

    /** Declared context in ascending order, or {@code null} when the field failed to parse. */
    public List<Integer> getContext() {
        return context;
    }

    public Statement getStatement() {
        return statement;
    }

    public Polarity getPolarity() {
        return statement.getPolarity();
    }

    /** Convenience for {@code getStatement().getFormula()}; {@code null} when damaged. */
    public Formula getFormula() {
        return statement.getFormula();
    }

    /** The justification, or {@code null} when the field failed to parse. */
    public Justification getJustification() {
        return justification;
    }

    public SourceLocation getLocation() {
        return location;
    }

    public boolean isDamaged() {
        return context == null || justification == null || !statement.isParsed();
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder().append(index).append(';');
        if (context != null) {
            for (int i = 0; i < context.size(); i++) {
                if (i > 0) {
                    builder.append(',');
                }
                builder.append(context.get(i));
            }
        } else {
            builder.append('?');
        }
        builder.append(';').append(statement).append(';');
        builder.append(justification == null ? "?" : justification.toString());
        return builder.toString();
    }
}

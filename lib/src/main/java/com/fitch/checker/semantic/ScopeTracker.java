package com.fitch.checker.semantic;

import com.fitch.checker.ast.Formula;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Explicit stack of open sub-proofs. A line is visible when it opened a scope that is still
 * open or was made visible inside one; lines of a closed scope disappear with it, while the
 * implication that discharged it stays visible in the parent.
 */
public final class ScopeTracker {
    private final Deque<Scope> scopes = new ArrayDeque<>();

    public ScopeTracker() {
        scopes.push(Scope.topLevel());
    }

    public SortedSet<Integer> visibleIndices() {
        SortedSet<Integer> visible = new TreeSet<>();
        for (Scope scope : scopes) {
            if (!scope.isTopLevel()) {
                visible.add(scope.getOpeningIndex());
            }
            visible.addAll(scope.getVisibleIndices());
        }
        return visible;
    }

    public boolean isVisible(int index) {
        return visibleIndices().contains(index);
    }

    /** Number of open sub-proofs, not counting the top level. */
    public int depth() {
        return scopes.size() - 1;
    }

    public Scope current() {
        return scopes.peek();
    }

    /**
     * Compares a declared context with the visible lines.
     *
     * @return {@code null} when they are equal, otherwise a description of the difference
     */
    public String describeContextMismatch(List<Integer> declared) {
        SortedSet<Integer> visible = visibleIndices();
        SortedSet<Integer> stated = new TreeSet<>(declared);
        if (visible.equals(stated)) {
            return null;
        }
        SortedSet<Integer> missing = new TreeSet<>(visible);
        missing.removeAll(stated);
        SortedSet<Integer> extra = new TreeSet<>(stated);
        extra.removeAll(visible);
        StringBuilder message = new StringBuilder("context {").append(join(stated))
                .append("} does not match visible lines {").append(join(visible)).append('}');
        if (!missing.isEmpty()) {
            message.append("; missing ").append(join(missing));
        }
        if (!extra.isEmpty()) {
            message.append("; not visible ").append(join(extra));
        }
        return message.toString();
    }

    public void openScope(int openingIndex, Formula assumption) {
        scopes.push(new Scope(openingIndex, assumption));
    }

    /**
     * Pops the innermost scope and makes {@code conclusionIndex} visible in its parent.
     *
     * @throws IllegalStateException if only the top level is open
     */
    public Scope closeScope(int conclusionIndex) {
        if (depth() == 0) {
            throw new IllegalStateException("No open sub-proof to close at line " + conclusionIndex);
        }
        Scope closed = scopes.pop();
        scopes.peek().markVisible(conclusionIndex);
        return closed;
    }

    public void markVisible(int index) {
        scopes.peek().markVisible(index);
    }

    /** Opening lines of the open sub-proofs, outermost first. */
    public List<Integer> openHypotheses() {
        List<Integer> open = new ArrayList<>();
        Iterator<Scope> outermostFirst = scopes.descendingIterator();
        while (outermostFirst.hasNext()) {
            Scope scope = outermostFirst.next();
            if (!scope.isTopLevel()) {
                open.add(scope.getOpeningIndex());
            }
        }
        return open;
    }

    static String join(Iterable<Integer> indices) {
        StringBuilder builder = new StringBuilder();
        for (Integer index : indices) {
            if (builder.length() > 0) {
                builder.append(", ");
            }
            builder.append(index);
        }
        return builder.toString();
    }
}

package com.fitch.checker.semantic;

import com.fitch.checker.ast.Formula;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One open sub-proof: the line that opened it, its assumption and the lines made visible while
 * it is open. The implicit top-level scope has opening index 0 and no assumption.
 */
public final class Scope {
    private final int openingIndex;
    private final Formula assumption;
    private final List<Integer> visibleIndices = new ArrayList<>();

    Scope(int openingIndex, Formula assumption) {
        this.openingIndex = openingIndex;
        this.assumption = assumption;
    }

    static Scope topLevel() {
        return new Scope(0, null);
    }

    public boolean isTopLevel() {
        return openingIndex == 0;
    }

    public int getOpeningIndex() {
        return openingIndex;
    }

    /** The hypothesis formula, or {@code null} for the top level or an unparsed hypothesis. */
    public Formula getAssumption() {
        return assumption;
    }

    public List<Integer> getVisibleIndices() {
        return Collections.unmodifiableList(visibleIndices);
    }

    void markVisible(int index) {
        visibleIndices.add(index);
    }
}

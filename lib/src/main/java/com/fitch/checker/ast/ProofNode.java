package com.fitch.checker.ast;

import java.util.List;

/** Append-only arena of records, addressed by their 1-based index. */
public final class ProofNode {
    private final List<ProofRecord> records;

    public ProofNode(List<ProofRecord> records) {
        this.records = List.copyOf(records);
        for (int i = 0; i < this.records.size(); i++) {
            if (this.records.get(i).getIndex() != i + 1) {
                throw new IllegalArgumentException(
                        "Record at position " + (i + 1) + " has index " + this.records.get(i).getIndex());
            }
        }
    }

    public List<ProofRecord> getRecords() {
        return records;
    }

    public int size() {
        return records.size();
    }

    public boolean contains(int index) {
        return index >= 1 && index <= records.size();
    }

    public ProofRecord get(int index) {
        if (!contains(index)) {
            throw new IndexOutOfBoundsException("No record with index " + index);
        }
        return records.get(index - 1);
    }
}

package com.scratchodds.domain.model;

/**
 * Detail fetches completed so far out of the total for the run.
 */
public record SnapshotProgress(int current, int total) {

    public static final SnapshotProgress NONE = new SnapshotProgress(0, 0);

    public boolean isComplete() {
        return current >= total;
    }
}

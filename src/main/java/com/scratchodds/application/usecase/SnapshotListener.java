package com.scratchodds.application.usecase;

import com.scratchodds.domain.model.GameRecord;
import com.scratchodds.domain.model.SnapshotProgress;
import com.scratchodds.domain.model.SnapshotState;

import java.util.List;

/**
 * Observer for a running snapshot. Callbacks are made one at a time, in the order the
 * changes were applied, from whichever thread applied them.
 */
public interface SnapshotListener {

    SnapshotListener NONE = new SnapshotListener() {};

    /**
     * Called after the run moves to a new state.
     */
    default void onStateChange(SnapshotState state) {
    }

    /**
     * Called after every merged detail result.
     *
     * @param records  copy of all records of the run, in listing order
     * @param progress completed and total detail fetches
     */
    default void onRecords(List<GameRecord> records, SnapshotProgress progress) {
    }
}

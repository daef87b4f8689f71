package com.scratchodds.infrastructure.rest;

import com.scratchodds.application.usecase.GameRecordQuery;
import com.scratchodds.application.usecase.SnapshotRun;
import com.scratchodds.domain.model.CachedSnapshot;
import com.scratchodds.domain.model.GameRecord;
import com.scratchodds.domain.model.SnapshotProgress;
import com.scratchodds.domain.model.SnapshotState;

import java.time.Instant;
import java.util.List;

/**
 * Response body for the snapshot endpoints: either a live run or the cached snapshot.
 *
 * @param runId       id of the live run, null when serving the cache
 * @param lastUpdated when the records were produced, null while a run is in flight
 * @param stale       true when a cached snapshot is older than a day
 * @param age         human readable age of a cached snapshot
 */
public record SnapshotView(
    String runId,
    SnapshotState state,
    SnapshotProgress progress,
    List<GameRecord> records,
    String error,
    Instant lastUpdated,
    boolean stale,
    String age
) {

    public static SnapshotView empty() {
        return new SnapshotView(null, SnapshotState.IDLE, SnapshotProgress.NONE, List.of(), null, null, false, null);
    }

    public static SnapshotView fromRun(SnapshotRun run, GameRecordQuery query) {
        return new SnapshotView(
            run.getId(),
            run.getState(),
            run.getProgress(),
            query.apply(run.getRecords()),
            run.getErrorMessage(),
            run.getFinishedAt(),
            false,
            null
        );
    }

    /**
     * @param runError error of a failed live run, reported alongside the cached records
     */
    public static SnapshotView fromCache(CachedSnapshot snapshot, GameRecordQuery query, Instant now, String runError) {
        int size = snapshot.games().size();
        return new SnapshotView(
            null,
            SnapshotState.DONE,
            new SnapshotProgress(size, size),
            query.apply(snapshot.games()),
            runError,
            snapshot.timestamp(),
            snapshot.isStale(now),
            snapshot.describeAge(now)
        );
    }
}

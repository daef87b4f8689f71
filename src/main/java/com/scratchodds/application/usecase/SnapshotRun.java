package com.scratchodds.application.usecase;

import com.scratchodds.domain.model.GameRecord;
import com.scratchodds.domain.model.GameStatus;
import com.scratchodds.domain.model.GameSummary;
import com.scratchodds.domain.model.SnapshotProgress;
import com.scratchodds.domain.model.SnapshotState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * State of one snapshot run: its phase, the record collection keyed by game number and the
 * completed-fetch counter.
 *
 * <p>All mutation goes through one lock, so a merge and its counter increment are applied
 * together even when two fetches finish at the same instant. Listener callbacks happen
 * while the lock is held, which keeps the observed progress monotonic.
 */
public class SnapshotRun {

    private static final Logger logger = LoggerFactory.getLogger(SnapshotRun.class);

    private final Object lock = new Object();
    private final String id = UUID.randomUUID().toString();
    private final SnapshotListener listener;
    private final Map<String, GameRecord> records = new LinkedHashMap<>();

    private SnapshotState state = SnapshotState.IDLE;
    private int completed;
    private int total;
    private String errorMessage;
    private Instant startedAt;
    private Instant finishedAt;

    public SnapshotRun(SnapshotListener listener) {
        this.listener = listener == null ? SnapshotListener.NONE : listener;
    }

    public String getId() {
        return id;
    }

    void beginListing() {
        synchronized (lock) {
            requireState(SnapshotState.IDLE);
            startedAt = Instant.now();
            moveTo(SnapshotState.LISTING);
        }
    }

    /**
     * Seeds one pending record per summary and enters the detailing phase.
     */
    void beginDetailing(List<GameSummary> summaries) {
        synchronized (lock) {
            requireState(SnapshotState.LISTING);
            for (GameSummary summary : summaries) {
                records.putIfAbsent(summary.gameNumber(), GameRecord.pending(summary));
            }
            total = records.size();
            moveTo(SnapshotState.DETAILING);
            notifyRecords();
        }
    }

    /**
     * Applies a terminal record for its game number and bumps the completed count.
     *
     * @return false if the game is unknown or already terminal, in which case nothing changes
     */
    boolean merge(GameRecord result) {
        synchronized (lock) {
            if (state != SnapshotState.DETAILING) {
                logger.warn("Ignoring result for game {} while run {} is {}", result.getGameNumber(), id, state);
                return false;
            }
            GameRecord existing = records.get(result.getGameNumber());
            if (existing == null) {
                logger.warn("Ignoring result for unknown game {}", result.getGameNumber());
                return false;
            }
            if (existing.getStatus().isTerminal()) {
                logger.warn("Game {} already {}, ignoring {}", result.getGameNumber(), existing.getStatus(), result.getStatus());
                return false;
            }
            GameRecord merged = result.getStatus() == GameStatus.RESOLVED
                ? existing.resolve(result.getDetail())
                : existing.fail(result.getErrorMessage());
            records.put(merged.getGameNumber(), merged);
            completed++;
            notifyRecords();
            return true;
        }
    }

    void complete() {
        synchronized (lock) {
            requireState(SnapshotState.DETAILING);
            finishedAt = Instant.now();
            moveTo(SnapshotState.DONE);
        }
    }

    void fail(String message) {
        synchronized (lock) {
            requireState(SnapshotState.LISTING);
            errorMessage = message;
            finishedAt = Instant.now();
            moveTo(SnapshotState.ERROR);
        }
    }

    public SnapshotState getState() {
        synchronized (lock) {
            return state;
        }
    }

    public boolean isInFlight() {
        SnapshotState current = getState();
        return current == SnapshotState.LISTING || current == SnapshotState.DETAILING;
    }

    public SnapshotProgress getProgress() {
        synchronized (lock) {
            return getProgressLocked();
        }
    }

    public List<GameRecord> getRecords() {
        synchronized (lock) {
            return copyRecords();
        }
    }

    public String getErrorMessage() {
        synchronized (lock) {
            return errorMessage;
        }
    }

    public Instant getStartedAt() {
        synchronized (lock) {
            return startedAt;
        }
    }

    public Instant getFinishedAt() {
        synchronized (lock) {
            return finishedAt;
        }
    }

    private SnapshotProgress getProgressLocked() {
        return new SnapshotProgress(completed, total);
    }

    private List<GameRecord> copyRecords() {
        return List.copyOf(records.values());
    }

    private void notifyRecords() {
        try {
            listener.onRecords(copyRecords(), getProgressLocked());
        } catch (RuntimeException e) {
            logger.error("Snapshot listener failed on run {}", id, e);
        }
    }

    private void requireState(SnapshotState expected) {
        if (state != expected) {
            throw new IllegalStateException("Run " + id + " is " + state + ", expected " + expected);
        }
    }

    private void moveTo(SnapshotState next) {
        logger.debug("Run {} {} -> {}", id, state, next);
        state = next;
        try {
            listener.onStateChange(next);
        } catch (RuntimeException e) {
            logger.error("Snapshot listener failed on run {}", id, e);
        }
    }
}

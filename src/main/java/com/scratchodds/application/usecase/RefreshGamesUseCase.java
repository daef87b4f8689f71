package com.scratchodds.application.usecase;

import com.scratchodds.domain.exception.ListingFailureException;
import com.scratchodds.domain.model.CachedSnapshot;
import com.scratchodds.domain.model.GameDetail;
import com.scratchodds.domain.model.GameRecord;
import com.scratchodds.domain.model.GameStatus;
import com.scratchodds.domain.model.GameSummary;
import com.scratchodds.domain.ports.GameScraperGateway;
import com.scratchodds.domain.ports.SnapshotCache;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Use case for taking a snapshot of all games: fetch the listing, then fetch every detail
 * page in fixed-size batches.
 *
 * <p>All fetches of a batch run in parallel and the next batch starts only when every fetch
 * of the current one has finished or timed out. A failed or timed-out detail fetch becomes a
 * failed record and never stops its siblings. Failed items are not retried.
 */
@Service
public class RefreshGamesUseCase {

    private static final Logger logger = LoggerFactory.getLogger(RefreshGamesUseCase.class);

    public static final int DEFAULT_BATCH_SIZE = 8;

    private final GameScraperGateway scraper;
    private final SnapshotCache snapshotCache;
    private final int batchSize;
    private final long itemTimeoutSeconds;
    private final ExecutorService detailExecutor;
    private final ExecutorService runExecutor;
    private final AtomicReference<SnapshotRun> currentRun = new AtomicReference<>();

    public RefreshGamesUseCase(
            GameScraperGateway scraper,
            SnapshotCache snapshotCache,
            @Value("${scraper.batch-size:8}") int batchSize,
            @Value("${scraper.item-timeout-seconds:30}") long itemTimeoutSeconds) {
        this.scraper = scraper;
        this.snapshotCache = snapshotCache;
        this.batchSize = batchSize > 0 ? batchSize : DEFAULT_BATCH_SIZE;
        this.itemTimeoutSeconds = itemTimeoutSeconds;
        // Unbounded so a hung fetch never holds a slot the next batch needs; batches bound the fan-out
        this.detailExecutor = Executors.newCachedThreadPool();
        this.runExecutor = Executors.newSingleThreadExecutor();
    }

    /**
     * Fetches the games-index page.
     *
     * @return the listed games, never empty
     * @throws ListingFailureException if the page cannot be fetched or lists no games
     */
    public List<GameSummary> listGames() {
        List<GameSummary> summaries;
        try {
            summaries = scraper.fetchListing();
        } catch (Exception e) {
            logger.error("Fetching game list from {} failed", scraper.getProviderName(), e);
            throw new ListingFailureException(describe(e), e);
        }
        if (summaries == null || summaries.isEmpty()) {
            throw new ListingFailureException("No games returned from list page");
        }
        logger.info("Listing from {} returned {} games", scraper.getProviderName(), summaries.size());
        return summaries;
    }

    /**
     * Fetches one game's detail page. Never throws: any failure is returned as a failed record.
     */
    public GameRecord fetchDetail(GameSummary summary) {
        try {
            GameDetail detail = scraper.fetchDetail(summary.detailUrl());
            return GameRecord.resolved(summary, detail);
        } catch (Exception e) {
            logger.warn("Detail fetch for game {} failed: {}", summary.gameNumber(), e.getMessage());
            return GameRecord.failed(summary, describe(e));
        }
    }

    /**
     * Runs a complete snapshot on the calling thread.
     *
     * @param listener receives every state change and every merged result
     * @return the finished run, in state DONE or ERROR
     */
    public SnapshotRun runSnapshot(SnapshotListener listener) {
        SnapshotRun run = new SnapshotRun(listener);
        execute(run);
        return run;
    }

    /**
     * Starts a snapshot on a background thread unless one is already in flight.
     *
     * @return the started run, or empty if another run is still in flight
     */
    public Optional<SnapshotRun> startSnapshot(SnapshotListener listener) {
        SnapshotRun previous = currentRun.get();
        if (previous != null && previous.isInFlight()) {
            return Optional.empty();
        }
        SnapshotRun run = new SnapshotRun(listener);
        // Leave IDLE before publishing so a concurrent caller sees this run as in flight
        run.beginListing();
        if (!currentRun.compareAndSet(previous, run)) {
            return Optional.empty();
        }
        runExecutor.submit(() -> {
            try {
                executeFromListing(run);
            } catch (RuntimeException e) {
                logger.error("Snapshot run {} aborted", run.getId(), e);
            }
        });
        return Optional.of(run);
    }

    /**
     * The run most recently started through {@link #startSnapshot(SnapshotListener)}.
     */
    public Optional<SnapshotRun> getCurrentRun() {
        return Optional.ofNullable(currentRun.get());
    }

    public Optional<CachedSnapshot> loadCachedSnapshot() {
        try {
            return snapshotCache.load();
        } catch (Exception e) {
            logger.error("Failed to load cached snapshot", e);
            return Optional.empty();
        }
    }

    private void execute(SnapshotRun run) {
        run.beginListing();
        executeFromListing(run);
    }

    private void executeFromListing(SnapshotRun run) {
        logger.info("Starting snapshot run {} with provider {}", run.getId(), scraper.getProviderName());

        List<GameSummary> summaries;
        try {
            summaries = listGames();
        } catch (ListingFailureException e) {
            run.fail(e.getMessage());
            return;
        }

        run.beginDetailing(summaries);
        List<GameSummary> pending = run.getRecords().stream().map(GameRecord::getSummary).toList();

        for (int i = 0; i < pending.size(); i += batchSize) {
            List<GameSummary> batch = pending.subList(i, Math.min(i + batchSize, pending.size()));
            logger.debug("Run {}: fetching batch {}-{} of {}", run.getId(), i + 1, i + batch.size(), pending.size());

            List<CompletableFuture<Void>> futures = new ArrayList<>(batch.size());
            for (GameSummary summary : batch) {
                futures.add(submitDetail(summary).thenAccept(run::merge));
            }

            // Wait for the whole batch before starting the next one
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        }

        run.complete();
        logger.info("Snapshot run {} finished: {}/{} games, {} failed", run.getId(),
            run.getProgress().current(), run.getProgress().total(),
            run.getRecords().stream().filter(r -> r.getStatus() == GameStatus.FAILED).count());

        cacheSnapshot(run);
    }

    /**
     * Starts one detail fetch. The timeout counts from the moment the fetch starts; when it
     * expires the fetch is cancelled and its worker interrupted, and a late result is dropped.
     */
    private CompletableFuture<GameRecord> submitDetail(GameSummary summary) {
        CompletableFuture<GameRecord> result = new CompletableFuture<>();
        Future<?> task = detailExecutor.submit(() -> result.complete(fetchDetail(summary)));
        return result
            .orTimeout(itemTimeoutSeconds, TimeUnit.SECONDS)
            .exceptionally(ex -> {
                task.cancel(true);
                String message = describeAsyncFailure(ex);
                logger.warn("Detail fetch for game {} abandoned: {}", summary.gameNumber(), message);
                return GameRecord.failed(summary, message);
            });
    }

    /**
     * Stores the resolved records of a finished run, or every record if none resolved.
     * Caching is best effort: failures are logged and the run still counts as successful.
     */
    private void cacheSnapshot(SnapshotRun run) {
        List<GameRecord> records = run.getRecords();
        List<GameRecord> resolved = records.stream()
            .filter(r -> r.getStatus() == GameStatus.RESOLVED)
            .toList();
        try {
            snapshotCache.save(new CachedSnapshot(resolved.isEmpty() ? records : resolved, Instant.now()));
        } catch (Exception e) {
            logger.error("Failed to cache snapshot {}", run.getId(), e);
        }
    }

    private String describeAsyncFailure(Throwable ex) {
        Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
        if (cause instanceof TimeoutException) {
            return "Detail fetch timed out after " + itemTimeoutSeconds + "s";
        }
        return describe(cause);
    }

    private static String describe(Throwable e) {
        String message = e.getMessage();
        return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
    }

    @PreDestroy
    public void shutdown() {
        runExecutor.shutdownNow();
        detailExecutor.shutdownNow();
    }
}

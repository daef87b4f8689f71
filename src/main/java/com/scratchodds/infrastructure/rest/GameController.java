package com.scratchodds.infrastructure.rest;

import com.scratchodds.application.usecase.GameRecordQuery;
import com.scratchodds.application.usecase.RefreshGamesUseCase;
import com.scratchodds.application.usecase.SnapshotListener;
import com.scratchodds.application.usecase.SnapshotRun;
import com.scratchodds.domain.exception.ListingFailureException;
import com.scratchodds.domain.exception.PageFetchException;
import com.scratchodds.domain.model.CachedSnapshot;
import com.scratchodds.domain.model.GameDetail;
import com.scratchodds.domain.model.GameSummary;
import com.scratchodds.domain.model.SnapshotState;
import com.scratchodds.domain.ports.GameScraperGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * REST controller for scratch-off game operations.
 */
@RestController
@RequestMapping("/games")
public class GameController {

    private static final Logger logger = LoggerFactory.getLogger(GameController.class);

    private final RefreshGamesUseCase refreshGamesUseCase;
    private final GameScraperGateway scraper;
    private final Clock clock;

    @Autowired
    public GameController(RefreshGamesUseCase refreshGamesUseCase, GameScraperGateway scraper) {
        this(refreshGamesUseCase, scraper, Clock.systemUTC());
    }

    GameController(RefreshGamesUseCase refreshGamesUseCase, GameScraperGateway scraper, Clock clock) {
        this.refreshGamesUseCase = refreshGamesUseCase;
        this.scraper = scraper;
        this.clock = clock;
    }

    /**
     * Lists all games on the games-index page.
     *
     * GET /games
     */
    @GetMapping
    public ResponseEntity<?> listGames() {
        try {
            List<GameSummary> games = refreshGamesUseCase.listGames();
            return ResponseEntity.ok(games);
        } catch (ListingFailureException e) {
            return error(HttpStatus.BAD_GATEWAY, e.getMessage());
        }
    }

    /**
     * Fetches and parses one detail page.
     *
     * GET /games/detail?url=...
     */
    @GetMapping("/detail")
    public ResponseEntity<?> gameDetail(@RequestParam(name = "url", required = false) String url) {
        if (url == null || url.isBlank()) {
            return error(HttpStatus.BAD_REQUEST, "Missing url parameter");
        }
        try {
            GameDetail detail = scraper.fetchDetail(url);
            return ResponseEntity.ok(detail);
        } catch (PageFetchException e) {
            logger.warn("Detail fetch for {} failed: {}", url, e.getMessage());
            return error(HttpStatus.BAD_GATEWAY, e.getMessage());
        }
    }

    /**
     * Starts a snapshot run in the background.
     *
     * POST /games/refresh
     *
     * @return 202 with the new run, or 409 if a run is already in flight
     */
    @PostMapping("/refresh")
    public ResponseEntity<?> refresh() {
        logger.info("Received request to refresh games");

        Optional<SnapshotRun> started = refreshGamesUseCase.startSnapshot(new LoggingListener());
        if (started.isEmpty()) {
            return error(HttpStatus.CONFLICT, "A snapshot is already running");
        }
        return ResponseEntity.status(HttpStatus.ACCEPTED)
            .body(SnapshotView.fromRun(started.get(), GameRecordQuery.of(null, null, null)));
    }

    /**
     * Returns the current run, or the cached snapshot when no run has been started.
     *
     * GET /games/snapshot?sort=maxLoss&dir=desc&price=5&price=10
     */
    @GetMapping("/snapshot")
    public ResponseEntity<?> snapshot(
            @RequestParam(name = "sort", required = false) String sort,
            @RequestParam(name = "dir", required = false) String direction,
            @RequestParam(name = "price", required = false) List<Double> prices) {
        GameRecordQuery query;
        try {
            query = GameRecordQuery.of(sort, direction, prices);
        } catch (IllegalArgumentException e) {
            return error(HttpStatus.BAD_REQUEST, e.getMessage());
        }

        Optional<SnapshotRun> run = refreshGamesUseCase.getCurrentRun();
        if (run.isPresent() && run.get().getState() != SnapshotState.ERROR) {
            return ResponseEntity.ok(SnapshotView.fromRun(run.get(), query));
        }

        // No run yet, or the last one failed at listing: fall back to the cache
        String runError = run.map(SnapshotRun::getErrorMessage).orElse(null);
        Optional<CachedSnapshot> cached = refreshGamesUseCase.loadCachedSnapshot();
        if (cached.isPresent()) {
            return ResponseEntity.ok(SnapshotView.fromCache(cached.get(), query, clock.instant(), runError));
        }
        return ResponseEntity.ok(run.map(r -> SnapshotView.fromRun(r, query)).orElseGet(SnapshotView::empty));
    }

    private static ResponseEntity<Map<String, String>> error(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(Map.of("error", message == null ? status.getReasonPhrase() : message));
    }

    private static final class LoggingListener implements SnapshotListener {

        @Override
        public void onStateChange(SnapshotState state) {
            logger.info("Snapshot state: {}", state);
        }
    }
}

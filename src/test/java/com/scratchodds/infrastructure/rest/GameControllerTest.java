package com.scratchodds.infrastructure.rest;

import com.scratchodds.application.usecase.RefreshGamesUseCase;
import com.scratchodds.domain.exception.PageFetchException;
import com.scratchodds.domain.model.CachedSnapshot;
import com.scratchodds.domain.model.GameDetail;
import com.scratchodds.domain.model.GameRecord;
import com.scratchodds.domain.model.GameSummary;
import com.scratchodds.domain.model.SnapshotState;
import com.scratchodds.domain.ports.GameScraperGateway;
import com.scratchodds.domain.ports.SnapshotCache;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for GameController.
 */
class GameControllerTest {

    private static final Instant NOW = Instant.parse("2025-03-02T12:00:00Z");
    private static final GameSummary SUMMARY =
        new GameSummary("2501", "Lucky 7s", "01/01/2025", 5.0, "https://lottery.test/details.html_2501");

    private RefreshGamesUseCase useCase;

    @AfterEach
    void tearDown() {
        if (useCase != null) {
            useCase.shutdown();
        }
    }

    @Test
    void testListGames() {
        GameController controller = controller(new StubScraper(List.of(SUMMARY)), new StubCache(null));

        ResponseEntity<?> response = controller.listGames();

        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertEquals(List.of(SUMMARY), response.getBody());
    }

    @Test
    void testListGamesFailureIsBadGateway() {
        GameController controller = controller(new StubScraper(List.of()), new StubCache(null));

        ResponseEntity<?> response = controller.listGames();

        assertEquals(HttpStatus.BAD_GATEWAY, response.getStatusCode());
        assertEquals(Map.of("error", "No games returned from list page"), response.getBody());
    }

    @Test
    void testDetailRequiresUrl() {
        GameController controller = controller(new StubScraper(List.of(SUMMARY)), new StubCache(null));

        ResponseEntity<?> response = controller.gameDetail("  ");

        assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
        assertEquals(Map.of("error", "Missing url parameter"), response.getBody());
    }

    @Test
    void testDetail() {
        GameController controller = controller(new StubScraper(List.of(SUMMARY)), new StubCache(null));

        ResponseEntity<?> response = controller.gameDetail(SUMMARY.detailUrl());

        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertEquals(StubScraper.DETAIL, response.getBody());
    }

    @Test
    void testDetailFetchFailureIsBadGateway() {
        GameController controller = controller(new StubScraper(List.of(SUMMARY)), new StubCache(null));

        ResponseEntity<?> response = controller.gameDetail("https://lottery.test/missing");

        assertEquals(HttpStatus.BAD_GATEWAY, response.getStatusCode());
        assertEquals(Map.of("error", "Failed to fetch page: 404"), response.getBody());
    }

    @Test
    void testSnapshotServesCacheWhenNoRunStarted() {
        CachedSnapshot cached = new CachedSnapshot(
            List.of(GameRecord.resolved(SUMMARY, StubScraper.DETAIL)), NOW.minus(Duration.ofHours(30)));
        GameController controller = controller(new StubScraper(List.of(SUMMARY)), new StubCache(cached));

        ResponseEntity<?> response = controller.snapshot(null, null, null);

        SnapshotView view = (SnapshotView) response.getBody();
        assertNotNull(view);
        assertEquals(SnapshotState.DONE, view.state());
        assertEquals(1, view.records().size());
        assertTrue(view.stale());
        assertEquals("1 day ago", view.age());
        assertNull(view.runId());
    }

    @Test
    void testSnapshotWithoutRunOrCacheIsIdle() {
        GameController controller = controller(new StubScraper(List.of(SUMMARY)), new StubCache(null));

        SnapshotView view = (SnapshotView) controller.snapshot(null, null, null).getBody();

        assertNotNull(view);
        assertEquals(SnapshotState.IDLE, view.state());
        assertTrue(view.records().isEmpty());
    }

    @Test
    void testSnapshotRejectsUnknownSortField() {
        GameController controller = controller(new StubScraper(List.of(SUMMARY)), new StubCache(null));

        ResponseEntity<?> response = controller.snapshot("color", null, null);

        assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
    }

    @Test
    void testRefreshStartsRunAndReportsIt() throws InterruptedException {
        GameController controller = controller(new StubScraper(List.of(SUMMARY)), new StubCache(null));

        ResponseEntity<?> response = controller.refresh();

        assertEquals(HttpStatus.ACCEPTED, response.getStatusCode());
        SnapshotView started = (SnapshotView) response.getBody();
        assertNotNull(started);
        assertNotNull(started.runId());

        long deadline = System.currentTimeMillis() + 10_000;
        while (useCase.getCurrentRun().orElseThrow().isInFlight() && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }

        SnapshotView view = (SnapshotView) controller.snapshot("gameName", "asc", List.of(5.0)).getBody();
        assertNotNull(view);
        assertEquals(started.runId(), view.runId());
        assertEquals(SnapshotState.DONE, view.state());
        assertEquals(1, view.records().size());
        assertEquals(1, view.progress().current());
    }

    private GameController controller(GameScraperGateway scraper, SnapshotCache cache) {
        useCase = new RefreshGamesUseCase(scraper, cache, 8, 30);
        return new GameController(useCase, scraper, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    /**
     * Test scraper returning a fixed listing and one detail for every known game.
     */
    private static class StubScraper implements GameScraperGateway {

        static final GameDetail DETAIL = new GameDetail(60, 250, 1_000_000, "1 in 4.33", 50_000, 4, 1, true);

        private final List<GameSummary> listing;

        StubScraper(List<GameSummary> listing) {
            this.listing = listing;
        }

        @Override
        public String getProviderName() {
            return "stub";
        }

        @Override
        public List<GameSummary> fetchListing() {
            return listing;
        }

        @Override
        public GameDetail fetchDetail(String detailUrl) throws PageFetchException {
            boolean known = listing.stream().anyMatch(s -> s.detailUrl().equals(detailUrl));
            if (!known) {
                throw new PageFetchException("Failed to fetch page: 404", 404, detailUrl);
            }
            return DETAIL;
        }
    }

    /**
     * Test cache holding at most one snapshot.
     */
    private static class StubCache implements SnapshotCache {

        private CachedSnapshot snapshot;

        StubCache(CachedSnapshot snapshot) {
            this.snapshot = snapshot;
        }

        @Override
        public Optional<CachedSnapshot> load() {
            return Optional.ofNullable(snapshot);
        }

        @Override
        public void save(CachedSnapshot snapshot) {
            this.snapshot = snapshot;
        }

        @Override
        public void clear() {
            snapshot = null;
        }
    }
}

package com.scratchodds.domain.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for GameRecord.
 */
class GameRecordTest {

    private static final GameSummary SUMMARY =
        new GameSummary("2500", "Lucky 7s", "09/01/2024", 5.0, "https://www.texaslottery.com/details.html_2500.html");

    private static final GameDetail DETAIL =
        new GameDetail(75, 200, 10_080_000, "1 in 3.87", 100_000, 4, 1, true);

    @Test
    void testDerivedFields() {
        GameRecord record = GameRecord.resolved(SUMMARY, DETAIL);

        assertEquals(375, record.getPackCost(), 0.0001);
        assertEquals(-175, record.getMaxLoss(), 0.0001);
        assertEquals(175.0 / 375 * 100, record.getMaxLossPercent(), 0.0001);
        assertEquals(3, record.getTopPrizesRemaining());
        assertTrue(record.isGuaranteedLoss());
    }

    @Test
    void testMaxLossPercentIsZeroWithoutPackCost() {
        GameRecord record = GameRecord.resolved(SUMMARY, new GameDetail(0, 200, 0, "N/A", 0, 0, 0, false));

        assertEquals(0, record.getPackCost(), 0.0001);
        assertEquals(0, record.getMaxLossPercent(), 0.0001);
        assertEquals(200, record.getMaxLoss(), 0.0001);
    }

    @Test
    void testTopPrizesRemainingNeverNegative() {
        GameRecord record = GameRecord.resolved(SUMMARY, new GameDetail(75, 0, 0, "N/A", 500, 2, 5, true));

        assertEquals(0, record.getTopPrizesRemaining());
    }

    @Test
    void testPendingAndFailedPlaceholders() {
        GameRecord pending = GameRecord.pending(SUMMARY);
        assertEquals(GameStatus.PENDING, pending.getStatus());
        assertEquals("...", pending.getOverallOdds());
        assertEquals(0, pending.getPackSize());

        GameRecord failed = pending.fail(null);
        assertEquals(GameStatus.FAILED, failed.getStatus());
        assertEquals("Failed", failed.getErrorMessage());
        assertEquals("N/A", failed.getOverallOdds());
    }

    @Test
    void testTerminalRecordCannotChange() {
        GameRecord resolved = GameRecord.pending(SUMMARY).resolve(DETAIL);

        assertThrows(IllegalStateException.class, () -> resolved.resolve(DETAIL));
        assertThrows(IllegalStateException.class, () -> resolved.fail("late"));
        assertThrows(IllegalStateException.class, () -> GameRecord.failed(SUMMARY, "x").resolve(DETAIL));
    }

    @Test
    void testJsonRoundTrip() throws Exception {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());

        GameRecord resolved = GameRecord.resolved(SUMMARY, DETAIL);
        String json = mapper.writeValueAsString(resolved);

        // Derived fields are written for consumers but ignored when reading back
        assertTrue(json.contains("\"maxLoss\":-175.0"));
        assertEquals(resolved, mapper.readValue(json, GameRecord.class));

        GameRecord failed = GameRecord.failed(SUMMARY, "Failed to fetch page: 404");
        assertEquals(failed, mapper.readValue(mapper.writeValueAsString(failed), GameRecord.class));
    }
}

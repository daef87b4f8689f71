package com.scratchodds.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A listed game joined with its detail-page fields.
 *
 * <p>Derived values (pack cost, max loss, max-loss percent, top prizes remaining) are
 * computed from the raw fields on every call and are never stored. Records are immutable;
 * a state change produces a new record via {@link #resolve(GameDetail)} or
 * {@link #fail(String)}, both of which are only allowed from {@link GameStatus#PENDING}.
 *
 * <p>Spreadsheet column order for exporters: game number, name, start date, ticket price,
 * pack size, guaranteed prize amount, pack cost, max loss, top prize, top prizes remaining,
 * total tickets, overall odds.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class GameRecord {

    static final String PENDING_ODDS = "...";
    static final String MISSING_ODDS = "N/A";

    private final GameSummary summary;
    private final GameDetail detail;
    private final GameStatus status;
    private final String errorMessage;

    private GameRecord(GameSummary summary, GameDetail detail, GameStatus status, String errorMessage) {
        this.summary = Objects.requireNonNull(summary, "summary");
        this.detail = detail;
        this.status = status;
        this.errorMessage = errorMessage;
    }

    public static GameRecord pending(GameSummary summary) {
        return new GameRecord(summary, null, GameStatus.PENDING, null);
    }

    public static GameRecord resolved(GameSummary summary, GameDetail detail) {
        return new GameRecord(summary, Objects.requireNonNull(detail, "detail"), GameStatus.RESOLVED, null);
    }

    public static GameRecord failed(GameSummary summary, String errorMessage) {
        String message = errorMessage == null || errorMessage.isBlank() ? "Failed" : errorMessage;
        return new GameRecord(summary, null, GameStatus.FAILED, message);
    }

    /**
     * Rebuilds a record from its serialized form (used when reading a cached snapshot).
     */
    @JsonCreator
    static GameRecord fromJson(
            @JsonProperty("gameNumber") String gameNumber,
            @JsonProperty("gameName") String gameName,
            @JsonProperty("startDate") String startDate,
            @JsonProperty("ticketPrice") double ticketPrice,
            @JsonProperty("detailUrl") String detailUrl,
            @JsonProperty("packSize") long packSize,
            @JsonProperty("guaranteedPrizeAmount") double guaranteedPrizeAmount,
            @JsonProperty("totalTickets") long totalTickets,
            @JsonProperty("overallOdds") String overallOdds,
            @JsonProperty("topPrize") double topPrize,
            @JsonProperty("topPrizeInGame") long topPrizeInGame,
            @JsonProperty("topPrizeClaimed") long topPrizeClaimed,
            @JsonProperty("prizesFound") boolean prizesFound,
            @JsonProperty("status") GameStatus status,
            @JsonProperty("errorMessage") String errorMessage) {
        GameSummary summary = new GameSummary(gameNumber, gameName, startDate, ticketPrice, detailUrl);
        if (status == GameStatus.RESOLVED) {
            return resolved(summary, new GameDetail(packSize, guaranteedPrizeAmount, totalTickets,
                overallOdds, topPrize, topPrizeInGame, topPrizeClaimed, prizesFound));
        }
        if (status == GameStatus.FAILED) {
            return failed(summary, errorMessage);
        }
        return pending(summary);
    }

    public GameRecord resolve(GameDetail newDetail) {
        requirePending();
        return resolved(summary, newDetail);
    }

    public GameRecord fail(String message) {
        requirePending();
        return failed(summary, message);
    }

    private void requirePending() {
        if (status.isTerminal()) {
            throw new IllegalStateException("Game " + summary.gameNumber() + " is already " + status);
        }
    }

    @JsonIgnore
    public GameSummary getSummary() {
        return summary;
    }

    @JsonIgnore
    public GameDetail getDetail() {
        return detail;
    }

    public GameStatus getStatus() {
        return status;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public String getGameNumber() {
        return summary.gameNumber();
    }

    public String getGameName() {
        return summary.gameName();
    }

    public String getStartDate() {
        return summary.startDate();
    }

    public double getTicketPrice() {
        return summary.ticketPrice();
    }

    public String getDetailUrl() {
        return summary.detailUrl();
    }

    public long getPackSize() {
        return detail != null ? detail.packSize() : 0;
    }

    public double getGuaranteedPrizeAmount() {
        return detail != null ? detail.guaranteedPrizeAmount() : 0;
    }

    public long getTotalTickets() {
        return detail != null ? detail.totalTickets() : 0;
    }

    public String getOverallOdds() {
        if (detail != null) {
            return detail.overallOdds();
        }
        return status == GameStatus.PENDING ? PENDING_ODDS : MISSING_ODDS;
    }

    public double getTopPrize() {
        return detail != null ? detail.topPrize() : 0;
    }

    public long getTopPrizeInGame() {
        return detail != null ? detail.topPrizeInGame() : 0;
    }

    public long getTopPrizeClaimed() {
        return detail != null ? detail.topPrizeClaimed() : 0;
    }

    public boolean isPrizesFound() {
        return detail != null && detail.prizesFound();
    }

    // Derived fields

    public double getPackCost() {
        return getTicketPrice() * getPackSize();
    }

    /**
     * Guaranteed prize amount minus pack cost. Negative means buying the whole pack is a
     * guaranteed net loss.
     */
    public double getMaxLoss() {
        return getGuaranteedPrizeAmount() - getPackCost();
    }

    public double getMaxLossPercent() {
        double packCost = getPackCost();
        return packCost > 0 ? Math.abs(getMaxLoss()) / packCost * 100 : 0;
    }

    public long getTopPrizesRemaining() {
        return Math.max(0, getTopPrizeInGame() - getTopPrizeClaimed());
    }

    @JsonIgnore
    public boolean isGuaranteedLoss() {
        return getMaxLoss() < 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GameRecord other)) return false;
        return summary.equals(other.summary)
            && Objects.equals(detail, other.detail)
            && status == other.status
            && Objects.equals(errorMessage, other.errorMessage);
    }

    @Override
    public int hashCode() {
        return Objects.hash(summary, detail, status, errorMessage);
    }

    @Override
    public String toString() {
        return "GameRecord{" + summary.gameNumber() + ", " + status + "}";
    }
}

package com.scratchodds.application.usecase;

import com.scratchodds.domain.model.GameRecord;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;

/**
 * Sorting and price filtering over a record collection.
 * Numeric fields compare numerically, text fields lexicographically.
 */
public record GameRecordQuery(String sortField, boolean ascending, Set<Double> ticketPrices) {

    public static final String DEFAULT_SORT_FIELD = "ticketPrice";

    private static final Map<String, Comparator<GameRecord>> COMPARATORS = Map.ofEntries(
        text("gameNumber", GameRecord::getGameNumber),
        text("gameName", GameRecord::getGameName),
        text("startDate", GameRecord::getStartDate),
        text("overallOdds", GameRecord::getOverallOdds),
        number("ticketPrice", GameRecord::getTicketPrice),
        number("packSize", r -> (double) r.getPackSize()),
        number("guaranteedPrizeAmount", GameRecord::getGuaranteedPrizeAmount),
        number("packCost", GameRecord::getPackCost),
        number("maxLoss", GameRecord::getMaxLoss),
        number("maxLossPercent", GameRecord::getMaxLossPercent),
        number("topPrize", GameRecord::getTopPrize),
        number("topPrizesRemaining", r -> (double) r.getTopPrizesRemaining()),
        number("totalTickets", r -> (double) r.getTotalTickets())
    );

    public GameRecordQuery {
        sortField = sortField == null || sortField.isBlank() ? DEFAULT_SORT_FIELD : sortField;
        if (!COMPARATORS.containsKey(sortField)) {
            throw new IllegalArgumentException("Unknown sort field: " + sortField);
        }
        ticketPrices = ticketPrices == null ? Set.of() : Set.copyOf(ticketPrices);
    }

    public static GameRecordQuery of(String sortField, String direction, List<Double> ticketPrices) {
        boolean ascending = direction == null || !direction.trim().toLowerCase(Locale.ROOT).equals("desc");
        return new GameRecordQuery(sortField, ascending, ticketPrices == null ? null : Set.copyOf(ticketPrices));
    }

    public static Set<String> sortFields() {
        return COMPARATORS.keySet();
    }

    public List<GameRecord> apply(List<GameRecord> records) {
        Comparator<GameRecord> comparator = COMPARATORS.get(sortField);
        if (!ascending) {
            comparator = comparator.reversed();
        }
        return records.stream()
            .filter(r -> ticketPrices.isEmpty() || ticketPrices.contains(r.getTicketPrice()))
            .sorted(comparator)
            .toList();
    }

    private static Map.Entry<String, Comparator<GameRecord>> text(String name, Function<GameRecord, String> key) {
        Comparator<GameRecord> comparator = Comparator.comparing(r -> Objects.requireNonNullElse(key.apply(r), ""));
        return Map.entry(name, comparator);
    }

    private static Map.Entry<String, Comparator<GameRecord>> number(String name, Function<GameRecord, Double> key) {
        return Map.entry(name, Comparator.comparing(key));
    }
}

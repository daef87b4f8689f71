package com.scratchodds.infrastructure.scraper;

import org.jsoup.nodes.Element;

import java.util.List;
import java.util.Locale;

/**
 * Column positions of a prize table, derived once from its header row.
 *
 * @param prizeAmountCol column holding the prize amount
 * @param inGameCol      column holding the number of prizes in the game
 * @param claimedCol     column holding the number of prizes claimed
 */
public record PrizeColumns(int prizeAmountCol, int inGameCol, int claimedCol) {

    public static final PrizeColumns DEFAULT = new PrizeColumns(0, 1, 2);

    /**
     * Reads the header cells; a header match overrides the positional default for its role.
     */
    public static PrizeColumns fromHeader(List<Element> headerCells) {
        int prizeAmountCol = DEFAULT.prizeAmountCol();
        int inGameCol = DEFAULT.inGameCol();
        int claimedCol = DEFAULT.claimedCol();

        for (int i = 0; i < headerCells.size(); i++) {
            String text = headerCells.get(i).text().toLowerCase(Locale.ROOT);
            if (text.contains("amount")) {
                prizeAmountCol = i;
            } else if (text.contains("in game")) {
                inGameCol = i;
            } else if (text.contains("claimed")) {
                claimedCol = i;
            }
        }
        return new PrizeColumns(prizeAmountCol, inGameCol, claimedCol);
    }
}

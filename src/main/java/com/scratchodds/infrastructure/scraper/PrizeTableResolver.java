package com.scratchodds.infrastructure.scraper;

import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Finds the prize-tier tables on a detail page and picks the top prize.
 *
 * <p>Expected columns: Prize Amount | No. In Game | No. Prizes Claimed | No. Prizes Remaining,
 * in any order as long as the header names them.
 */
@Component
public class PrizeTableResolver {

    private static final Logger logger = LoggerFactory.getLogger(PrizeTableResolver.class);

    private static final int MIN_CELLS = 3;

    public TopPrize resolve(Document document) {
        TopPrize top = TopPrize.NONE;

        for (Element table : document.select("table")) {
            if (!isPrizeTable(table)) {
                continue;
            }
            List<Element> rows = ownRows(table);
            if (rows.isEmpty()) {
                continue;
            }
            PrizeColumns columns = PrizeColumns.fromHeader(TableCells.headerOrDataCells(rows.get(0)));
            top = scanRows(rows, columns, top);
        }

        if (top.prizesFound()) {
            logger.debug("Top prize {} ({} in game, {} claimed)", top.amount(), top.inGame(), top.claimed());
        }
        return top;
    }

    static boolean isPrizeTable(Element table) {
        String text = table.text().toLowerCase(Locale.ROOT);
        return text.contains("prize") && (text.contains("in game") || text.contains("claimed"));
    }

    private static TopPrize scanRows(List<Element> rows, PrizeColumns columns, TopPrize current) {
        TopPrize top = current;
        for (Element row : rows) {
            List<Element> cells = TableCells.dataCells(row);
            if (cells.size() < MIN_CELLS) {
                continue;
            }

            double amount = NormalizationUtils.parseCurrency(cellText(cells, columns.prizeAmountCol()));
            if (amount <= 0) {
                continue;
            }
            long inGame = NormalizationUtils.parseCount(cellText(cells, columns.inGameCol()));
            long claimed = NormalizationUtils.parseCount(cellText(cells, columns.claimedCol()));

            // strictly greater: the first tier seen keeps a tie
            if (amount > top.amount()) {
                top = new TopPrize(amount, inGame, claimed, true);
            }
        }
        return top;
    }

    private static String cellText(List<Element> cells, int index) {
        return index < cells.size() ? cells.get(index).text().trim() : "";
    }

    /**
     * Rows belonging to this table, not to a table nested inside it.
     */
    private static List<Element> ownRows(Element table) {
        return table.select("tr").stream()
            .filter(row -> row.closest("table") == table)
            .toList();
    }
}

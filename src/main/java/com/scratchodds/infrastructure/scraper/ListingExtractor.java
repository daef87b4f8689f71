package com.scratchodds.infrastructure.scraper;

import com.scratchodds.domain.model.GameSummary;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Extracts game summaries from the scratch-off games-index page.
 *
 * <p>The index table mixes one primary row per game with prize-tier rows. Only rows whose
 * first cell links to a detail page count as game rows, and the first row seen for a game
 * number wins.
 */
@Component
public class ListingExtractor {

    private static final Logger logger = LoggerFactory.getLogger(ListingExtractor.class);

    static final String DETAIL_PAGE_MARKER = "details.html";

    // Column order: Game#(0), Start Date(1), Ticket Price(2), spacer(3), Game Name(4)
    private static final int MIN_CELLS = 5;
    private static final int START_DATE_COL = 1;
    private static final int PRICE_COL = 2;
    private static final int NAME_COL = 4;

    private static final Pattern HAS_LETTER = Pattern.compile(".*\\p{L}.*");

    /**
     * Parses the index page.
     *
     * @param html    raw HTML of the games-index page
     * @param baseUrl origin prefixed to relative detail links
     * @return summaries in document order, without duplicates
     */
    public List<GameSummary> extract(String html, String baseUrl) {
        Document doc = Jsoup.parse(html == null ? "" : html);
        List<GameSummary> games = new ArrayList<>();
        Set<String> seenGameNumbers = new HashSet<>();

        for (Element row : doc.select("table tr")) {
            List<Element> cells = TableCells.dataCells(row);
            if (cells.size() < MIN_CELLS) {
                continue;
            }

            Element link = cells.get(0).selectFirst("a[href]");
            if (link == null) {
                continue;
            }
            String href = link.attr("href").trim();
            if (!href.contains(DETAIL_PAGE_MARKER)) {
                continue;
            }

            String gameNumber = link.text().trim();
            if (gameNumber.isEmpty() || !seenGameNumbers.add(gameNumber)) {
                continue;
            }

            String gameName = resolveName(cells);
            if (gameName.isEmpty() || gameName.equals("*")) {
                logger.debug("Skipping game {} without a name", gameNumber);
                continue;
            }

            games.add(new GameSummary(
                gameNumber,
                gameName,
                cells.get(START_DATE_COL).text().trim(),
                NormalizationUtils.parseCurrency(cells.get(PRICE_COL).text()),
                HttpClientUtil.resolveUrl(baseUrl, href)
            ));
        }

        logger.info("Extracted {} games from listing page", games.size());
        return games;
    }

    /**
     * Name from the fixed column, or from the first text cell after the price when a
     * revision of the page drops the spacer column.
     */
    private static String resolveName(List<Element> cells) {
        String positional = cells.get(NAME_COL).text().trim();
        if (!positional.isEmpty()) {
            return positional;
        }
        for (int i = PRICE_COL + 1; i < cells.size(); i++) {
            String text = cells.get(i).text().trim();
            if (HAS_LETTER.matcher(text).matches()) {
                return text;
            }
        }
        return "";
    }
}

package com.scratchodds.domain.ports;

import com.scratchodds.domain.exception.PageFetchException;
import com.scratchodds.domain.model.GameDetail;
import com.scratchodds.domain.model.GameSummary;

import java.util.List;

/**
 * Port for scraping scratch-off games from a lottery site.
 */
public interface GameScraperGateway {

    /**
     * Gets the name of the lottery this scraper handles.
     *
     * @return provider name (e.g., "texaslottery")
     */
    String getProviderName();

    /**
     * Fetches and parses the games-index page.
     *
     * @return games in page order, possibly empty
     * @throws PageFetchException if the page could not be retrieved
     */
    List<GameSummary> fetchListing() throws PageFetchException;

    /**
     * Fetches and parses one game's detail page.
     *
     * @param detailUrl absolute URL or site-relative path of the detail page
     * @return the extracted detail
     * @throws PageFetchException if the page could not be retrieved
     */
    GameDetail fetchDetail(String detailUrl) throws PageFetchException;
}

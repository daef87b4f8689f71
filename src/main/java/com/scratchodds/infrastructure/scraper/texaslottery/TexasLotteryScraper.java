package com.scratchodds.infrastructure.scraper.texaslottery;

import com.scratchodds.domain.exception.PageFetchException;
import com.scratchodds.domain.model.GameDetail;
import com.scratchodds.domain.model.GameSummary;
import com.scratchodds.domain.ports.GameScraperGateway;
import com.scratchodds.infrastructure.scraper.DetailExtractor;
import com.scratchodds.infrastructure.scraper.HttpClientUtil;
import com.scratchodds.infrastructure.scraper.ListingExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Scraper implementation for the Texas Lottery scratch-off pages.
 */
@Component
public class TexasLotteryScraper implements GameScraperGateway {

    private static final Logger logger = LoggerFactory.getLogger(TexasLotteryScraper.class);

    private static final String PROVIDER_NAME = "texaslottery";

    private static final Map<String, String> HEADERS = Map.of(
        "accept", "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8",
        "accept-language", "en-US,en;q=0.9",
        "user-agent", "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36"
    );

    private final ListingExtractor listingExtractor;
    private final DetailExtractor detailExtractor;
    private final String baseUrl;
    private final String listingUrl;
    private final Duration connectTimeout;
    private final Duration responseTimeout;

    public TexasLotteryScraper(
            ListingExtractor listingExtractor,
            DetailExtractor detailExtractor,
            @Value("${scraper.base-url:https://www.texaslottery.com}") String baseUrl,
            @Value("${scraper.listing-path:/export/sites/lottery/Games/Scratch_Offs/all.html}") String listingPath,
            @Value("${scraper.connect-timeout-seconds:10}") long connectTimeoutSeconds,
            @Value("${scraper.response-timeout-seconds:20}") long responseTimeoutSeconds) {
        this.listingExtractor = listingExtractor;
        this.detailExtractor = detailExtractor;
        this.baseUrl = baseUrl;
        this.listingUrl = HttpClientUtil.resolveUrl(baseUrl, listingPath);
        this.connectTimeout = Duration.ofSeconds(connectTimeoutSeconds);
        this.responseTimeout = Duration.ofSeconds(responseTimeoutSeconds);
    }

    @Override
    public String getProviderName() {
        return PROVIDER_NAME;
    }

    @Override
    public List<GameSummary> fetchListing() throws PageFetchException {
        logger.info("Fetching game list from {}", listingUrl);
        String html = HttpClientUtil.getHtml(listingUrl, HEADERS, connectTimeout, responseTimeout);
        return listingExtractor.extract(html, baseUrl);
    }

    @Override
    public GameDetail fetchDetail(String detailUrl) throws PageFetchException {
        if (detailUrl == null || detailUrl.isBlank()) {
            throw new PageFetchException("Missing url parameter", 400, detailUrl);
        }
        String url = HttpClientUtil.resolveUrl(baseUrl, detailUrl.trim());
        logger.debug("Fetching detail page {}", url);
        String html = HttpClientUtil.getHtml(url, HEADERS, connectTimeout, responseTimeout);
        return detailExtractor.extract(html);
    }
}

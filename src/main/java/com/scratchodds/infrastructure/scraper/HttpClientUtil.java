package com.scratchodds.infrastructure.scraper;

import com.scratchodds.domain.exception.PageFetchException;
import org.apache.hc.client5.http.classic.methods.HttpGet;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.CloseableHttpResponse;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.core5.http.HttpEntity;
import org.apache.hc.core5.http.ParseException;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.apache.hc.core5.util.Timeout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;

/**
 * Utility for making HTTP requests to the lottery site.
 */
public class HttpClientUtil {

    private static final Logger logger = LoggerFactory.getLogger(HttpClientUtil.class);
    private static final int MAX_LOG_BODY_LENGTH = 500;

    private HttpClientUtil() {
    }

    /**
     * Helper method to log response body preview for debugging.
     */
    private static void logResponseBodyPreview(String responseBody) {
        String preview = responseBody.length() > MAX_LOG_BODY_LENGTH
            ? responseBody.substring(0, MAX_LOG_BODY_LENGTH) + "..."
            : responseBody;
        logger.debug("Response body preview: {}", preview);
    }

    /**
     * Makes a GET request and returns the response body as a string.
     *
     * @param url             absolute URL
     * @param headers         request headers, may be null
     * @param connectTimeout  TCP connect timeout
     * @param responseTimeout maximum wait for response data
     * @return response body
     * @throws PageFetchException on transport errors, unreadable bodies and non-2xx responses
     */
    public static String getHtml(String url, Map<String, String> headers,
                                 Duration connectTimeout, Duration responseTimeout) throws PageFetchException {
        ConnectionConfig connectionConfig = ConnectionConfig.custom()
            .setConnectTimeout(Timeout.of(connectTimeout))
            .setSocketTimeout(Timeout.of(responseTimeout))
            .build();
        RequestConfig requestConfig = RequestConfig.custom()
            .setResponseTimeout(Timeout.of(responseTimeout))
            .build();

        try (CloseableHttpClient httpClient = HttpClients.custom()
                .setConnectionManager(PoolingHttpClientConnectionManagerBuilder.create()
                    .setDefaultConnectionConfig(connectionConfig)
                    .build())
                .setDefaultRequestConfig(requestConfig)
                .build()) {
            HttpGet request = new HttpGet(url);

            if (headers != null) {
                headers.forEach(request::addHeader);
            }

            try (CloseableHttpResponse response = httpClient.execute(request)) {
                int statusCode = response.getCode();
                HttpEntity entity = response.getEntity();
                String responseBody;
                try {
                    responseBody = entity != null ? EntityUtils.toString(entity, StandardCharsets.UTF_8) : "";
                } catch (ParseException e) {
                    throw new PageFetchException("Failed to read response from " + url, url, e);
                }

                if (statusCode < 200 || statusCode >= 300) {
                    logger.error("HTTP request to {} failed with status {}", url, statusCode);
                    logResponseBodyPreview(responseBody);
                    throw new PageFetchException("Failed to fetch page: " + statusCode, statusCode, url);
                }
                return responseBody;
            }
        } catch (PageFetchException e) {
            throw e;
        } catch (IOException e) {
            logger.error("HTTP request to {} failed: {}", url, e.getMessage());
            throw new PageFetchException("Failed to fetch page: " + describe(e), url, e);
        }
    }

    /**
     * Turns a site-relative reference into an absolute URL; absolute references pass through.
     */
    public static String resolveUrl(String baseUrl, String reference) {
        if (reference.startsWith("http")) {
            return reference;
        }
        String base = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        return base + (reference.startsWith("/") ? "" : "/") + reference;
    }

    private static String describe(Exception e) {
        String message = e.getMessage();
        return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
    }
}

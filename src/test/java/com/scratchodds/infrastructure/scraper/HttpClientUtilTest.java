package com.scratchodds.infrastructure.scraper;

import com.scratchodds.domain.exception.PageFetchException;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for HttpClientUtil against a local stub server.
 */
class HttpClientUtilTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private static HttpServer server;
    private static String baseUrl;

    @BeforeAll
    static void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress(0), 0);
        baseUrl = "http://localhost:" + server.getAddress().getPort();

        server.createContext("/ok", exchange -> {
            String agent = exchange.getRequestHeaders().getFirst("user-agent");
            byte[] body = ("<html><body>agent=" + agent + "</body></html>").getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().set("Content-Type", "text/html; charset=utf-8");
            exchange.sendResponseHeaders(200, body.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(body);
            }
        });

        server.createContext("/missing", exchange -> {
            byte[] body = "not here".getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(404, body.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(body);
            }
        });

        server.start();
    }

    @AfterAll
    static void stopServer() {
        server.stop(0);
    }

    @Test
    void testGetHtmlReturnsBodyAndSendsHeaders() throws PageFetchException {
        String html = HttpClientUtil.getHtml(baseUrl + "/ok", Map.of("user-agent", "test-agent"), TIMEOUT, TIMEOUT);

        assertTrue(html.contains("agent=test-agent"));
    }

    @Test
    void testGetHtmlFailsOnNon2xx() {
        PageFetchException e = assertThrows(PageFetchException.class,
            () -> HttpClientUtil.getHtml(baseUrl + "/missing", null, TIMEOUT, TIMEOUT));

        assertEquals(404, e.getStatusCode());
        assertEquals("Failed to fetch page: 404", e.getMessage());
        assertEquals(baseUrl + "/missing", e.getUrl());
    }

    @Test
    void testGetHtmlWrapsTransportErrors() throws IOException {
        // Bind and release a port so nothing is listening on it
        int port;
        try (ServerSocket socket = new ServerSocket(0)) {
            port = socket.getLocalPort();
        }

        PageFetchException e = assertThrows(PageFetchException.class,
            () -> HttpClientUtil.getHtml("http://localhost:" + port + "/", null, TIMEOUT, TIMEOUT));

        assertEquals(PageFetchException.NO_STATUS, e.getStatusCode());
        assertNotNull(e.getCause());
    }

    @Test
    void testResolveUrl() {
        assertEquals("https://a.com/x.html", HttpClientUtil.resolveUrl("https://a.com", "/x.html"));
        assertEquals("https://a.com/x.html", HttpClientUtil.resolveUrl("https://a.com/", "x.html"));
        assertEquals("http://b.com/y", HttpClientUtil.resolveUrl("https://a.com", "http://b.com/y"));
    }
}

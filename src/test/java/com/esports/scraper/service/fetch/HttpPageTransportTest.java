package com.esports.scraper.service.fetch;

import com.esports.scraper.config.ScraperProperties;
import com.esports.scraper.config.WebClientConfiguration;
import com.esports.scraper.model.FetchTarget;
import com.esports.scraper.model.PageTemplate;
import com.esports.scraper.model.RawPage;
import com.esports.scraper.model.RenderMode;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HttpPageTransportTest {

    private static final Instant NOW = Instant.parse("2024-07-15T08:00:00Z");
    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private MockWebServer server;

    private HttpPageTransport transport;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        transport = new HttpPageTransport(WebClient.builder(), "esports-scraper-test/1.0",
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void testFetchReturnsMarkupAndReplaysCookies() throws Exception {
        server.enqueue(new MockResponse()
                .setHeader("Content-Type", "text/html; charset=utf-8")
                .addHeader("Set-Cookie", "cf_token=abc123; Path=/")
                .setBody("<html><body>first</body></html>"));
        server.enqueue(new MockResponse()
                .setHeader("Content-Type", "text/html; charset=utf-8")
                .setBody("<html><body>second</body></html>"));

        RawPage first = transport.fetch(target("/matches"), TIMEOUT);
        RawPage second = transport.fetch(target("/matches/results"), TIMEOUT);

        assertEquals(200, first.status());
        assertEquals(NOW, first.fetchedAt());
        assertTrue(first.html().contains("first"));
        assertTrue(second.html().contains("second"));
        assertEquals("abc123", transport.cookies().get("cf_token"));

        RecordedRequest r1 = server.takeRequest();
        assertEquals("esports-scraper-test/1.0", r1.getHeader("User-Agent"));
        assertTrue(r1.getHeader("Accept").startsWith("text/html"));
        RecordedRequest r2 = server.takeRequest();
        assertTrue(r2.getHeader("Cookie").contains("cf_token=abc123"));
    }

    @Test
    void testServerErrorIsTransientStatus() {
        server.enqueue(new MockResponse().setResponseCode(503).setBody("busy"));

        FetchException ex = assertThrows(FetchException.class, () -> transport.fetch(target("/matches"), TIMEOUT));

        assertEquals(FetchErrorKind.HTTP_STATUS, ex.getKind());
        assertEquals(503, ex.getStatusCode());
        assertTrue(ex.isTransientFailure());
    }

    @Test
    void testNotFoundIsFinalStatus() {
        server.enqueue(new MockResponse().setResponseCode(404).setBody("not found"));

        FetchException ex = assertThrows(FetchException.class, () -> transport.fetch(target("/404"), TIMEOUT));

        assertEquals(404, ex.getStatusCode());
        assertFalse(ex.isTransientFailure());
    }

    @Test
    void testEmptyBodyIsNetworkFailure() {
        server.enqueue(new MockResponse().setResponseCode(200).setBody(""));

        FetchException ex = assertThrows(FetchException.class, () -> transport.fetch(target("/matches"), TIMEOUT));

        assertEquals(FetchErrorKind.NETWORK, ex.getKind());
    }

    @Test
    void testSlowResponseIsTimeout() {
        server.enqueue(new MockResponse()
                .setHeadersDelay(2, TimeUnit.SECONDS)
                .setBody("<html>late</html>"));

        FetchException ex = assertThrows(FetchException.class,
                () -> transport.fetch(target("/matches"), Duration.ofMillis(200)));

        assertEquals(FetchErrorKind.TIMEOUT, ex.getKind());
        assertTrue(ex.isTransientFailure());
    }

    @Test
    void testRunTimeoutAboveConfiguredDefaultIsHonoured() {
        ScraperProperties props = new ScraperProperties();
        props.getFetch().setRequestTimeout(Duration.ofMillis(300));
        HttpPageTransport configured = new HttpPageTransport(new WebClientConfiguration().webClientBuilder(props),
                "esports-scraper-test/1.0", Clock.fixed(NOW, ZoneOffset.UTC));
        server.enqueue(new MockResponse()
                .setHeadersDelay(1, TimeUnit.SECONDS)
                .setHeader("Content-Type", "text/html; charset=utf-8")
                .setBody("<html><body>slow but fine</body></html>"));

        RawPage page = configured.fetch(target("/matches"), TIMEOUT);

        assertTrue(page.html().contains("slow but fine"));
    }

    @Test
    void testTimeoutMessageNamesRunLimit() {
        server.enqueue(new MockResponse()
                .setHeadersDelay(2, TimeUnit.SECONDS)
                .setBody("<html>late</html>"));

        FetchException ex = assertThrows(FetchException.class,
                () -> transport.fetch(target("/matches"), Duration.ofMillis(250)));

        assertEquals(FetchErrorKind.TIMEOUT, ex.getKind());
        assertTrue(ex.getMessage().contains("PT0.25S"), ex.getMessage());
    }

    @Test
    void testRefusedConnectionIsNetworkFailure() throws IOException {
        MockWebServer gone = new MockWebServer();
        gone.start();
        FetchTarget target = FetchTarget.of(gone.url("/matches").toString(),
                PageTemplate.MATCH_LISTING, RenderMode.HTTP, 0);
        gone.shutdown();

        FetchException ex = assertThrows(FetchException.class, () -> transport.fetch(target, TIMEOUT));

        assertEquals(FetchErrorKind.NETWORK, ex.getKind());
    }

    private FetchTarget target(final String path) {
        return FetchTarget.of(server.url(path).toString(), PageTemplate.MATCH_LISTING, RenderMode.HTTP, 0);
    }
}

package com.esports.scraper.support;

import com.esports.scraper.model.FetchTarget;
import com.esports.scraper.model.PageTemplate;
import com.esports.scraper.model.RawPage;
import com.esports.scraper.model.RenderMode;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;

/**
 * Loads HTML fixtures from {@code src/test/resources/fixtures}.
 */
public final class Fixtures {

    public static final String BASE = "https://www.vlr.gg";

    public static final Instant FETCHED_AT = Instant.parse("2024-07-15T08:00:00Z");

    private Fixtures() {
    }

    public static String html(final String name) {
        try (InputStream in = Fixtures.class.getResourceAsStream("/fixtures/" + name)) {
            if (in == null) {
                throw new IllegalArgumentException("missing fixture " + name);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new UncheckedIOException(ex);
        }
    }

    public static RawPage page(final String name, final String path, final PageTemplate template) {
        return page(name, path, template, 0);
    }

    public static RawPage page(final String name, final String path, final PageTemplate template, final int ordinal) {
        FetchTarget target = FetchTarget.of(BASE + path, template, RenderMode.HTTP, ordinal);
        return new RawPage(target, html(name), FETCHED_AT, 200);
    }
}

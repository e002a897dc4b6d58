package com.esports.scraper.config;

import com.esports.scraper.service.fetch.ChromeDriverFactory;
import org.openqa.selenium.WebDriver;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.function.Supplier;

/**
 * Wiring for the extraction pipeline's collaborators that are not components
 * themselves.
 */
@Configuration
@EnableConfigurationProperties(ScraperProperties.class)
public class PipelineConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Opens one browser session per call; the per-run pool decides when.
     */
    @Bean
    public Supplier<WebDriver> webDriverFactory(final ScraperProperties props) {
        return new ChromeDriverFactory(props.getBrowser(), props.getUpstream().getUserAgent());
    }
}

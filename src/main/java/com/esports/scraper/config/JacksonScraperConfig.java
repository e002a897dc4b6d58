package com.esports.scraper.config;

import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.boot.autoconfigure.jackson.Jackson2ObjectMapperBuilderCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class JacksonScraperConfig {

    /**
     * Output tuning for extracted records.
     * <p>
     * • Times are written as ISO-8601 strings, e.g. <code>2024-07-14T18:00:00Z</code>.<br>
     * • Applied to the mapper Spring Boot builds, so the REST layer serializes
     * records exactly as the pipeline hands them out.
     *
     * @return customizer for the auto-configured mapper
     */
    @Bean
    public Jackson2ObjectMapperBuilderCustomizer scraperJacksonCustomizer() {
        return builder -> builder
                .modulesToInstall(new JavaTimeModule())
                .featuresToDisable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

}

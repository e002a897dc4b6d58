package com.esports.scraper;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * The main entry point for the esports extraction service.
 *
 * <p>This Spring Boot application exposes a REST endpoint that runs one
 * extraction over VLR.gg listing and detail pages:
 * <ul>
 *   <li>fetching pages over HTTP or through a headless browser,</li>
 *   <li>parsing them per page template,</li>
 *   <li>normalizing and merging the results into canonical event and match records.</li>
 * </ul>
 * </p>
 *
 * <p>Usage:
 * <pre>{@code
 *   // From the command line:
 *   mvn spring-boot:run
 *
 *   // Trigger a run:
 *   curl -X POST localhost:8080/api/extraction/runs -H 'Content-Type: application/json' -d '{}'
 * }</pre>
 */
@SpringBootApplication
public class EsportsScraperApplication {

    /**
     * Bootstrap method to launch the Spring Boot application.
     *
     * @param args command-line arguments (ignored)
     */
    public static void main(final String[] args) {
        SpringApplication.run(EsportsScraperApplication.class, args);
    }
}

package com.esports.scraper.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.logging.LogLevel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.HttpProtocol;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;
import reactor.netty.transport.logging.AdvancedByteBufFormat;

import java.time.Duration;

/**
 * Shared {@link WebClient.Builder} for HTML page retrieval. Each run clones
 * it and adds its own cookie jar and headers. The response timeout is set per
 * request from the run's fetch policy, not here.
 */
@Configuration
@Slf4j
public class WebClientConfiguration {

    /** Event pages with long match lists run past the 256 KB codec default. */
    private static final int MAX_PAGE_BYTES = 4 * 1024 * 1024;

    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(20);

    @Bean
    public WebClient.Builder webClientBuilder(final ScraperProperties props) {

        ExchangeStrategies strategies = ExchangeStrategies.builder()
                .codecs(cfg -> cfg.defaultCodecs().maxInMemorySize(MAX_PAGE_BYTES))
                .build();

        ConnectionProvider pool = ConnectionProvider.builder("upstream-pool")
                .maxConnections(Math.max(4, props.getRun().getMaxConcurrency() * 2))
                .pendingAcquireTimeout(Duration.ofSeconds(10))
                .build();

        HttpClient tcpClient = HttpClient.create(pool)
                .protocol(HttpProtocol.HTTP11)
                .followRedirect(true)
                .compress(true)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) CONNECT_TIMEOUT.toMillis())
                .wiretap("reactor.netty.http.client.HttpClient",
                        LogLevel.DEBUG, AdvancedByteBufFormat.SIMPLE);

        return WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(tcpClient))
                .filter(logRequest())
                .filter(logResponse())
                .exchangeStrategies(strategies);
    }

    private static ExchangeFilterFunction logRequest() {
        return ExchangeFilterFunction.ofRequestProcessor(req -> {
            log.debug("--> {} {}", req.method(), req.url());
            return Mono.just(req);
        });
    }

    private static ExchangeFilterFunction logResponse() {
        return ExchangeFilterFunction.ofResponseProcessor(res -> {
            log.debug("<-- {}  {}", res.statusCode().value(), res.headers().contentType().orElse(null));
            return Mono.just(res);
        });
    }
}

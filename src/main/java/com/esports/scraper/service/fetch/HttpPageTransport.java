package com.esports.scraper.service.fetch;

import com.esports.scraper.model.FetchTarget;
import com.esports.scraper.model.RawPage;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.exception.ExceptionUtils;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.lang.NonNull;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClientRequest;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.util.Collection;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeoutException;

/**
 * Plain HTTP GET through a {@link WebClient}, with browser-like headers and a
 * cookie jar that replays whatever the upstream set on earlier responses.
 * <p>
 * The jar belongs to this transport instance, so every run starts with a
 * clean session.
 * </p>
 */
@Slf4j
public class HttpPageTransport implements PageTransport {

    private final Map<String, String> cookieJar = new ConcurrentHashMap<>();

    private final WebClient webClient;

    private final Clock clock;

    public HttpPageTransport(final WebClient.Builder builder, final String userAgent, final Clock clock) {
        this.clock = clock;
        this.webClient = builder.clone()
                .filters(f -> f.add(saveCookies()))
                .filter((req, next) -> next.exchange(ClientRequest.from(req)
                        .cookies(c -> cookieJar.forEach(c::add))
                        .build()))
                .defaultHeaders(h -> {
                    h.set(HttpHeaders.ACCEPT, "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8");
                    h.set(HttpHeaders.ACCEPT_LANGUAGE, "en-US,en;q=0.5");
                    h.set(HttpHeaders.USER_AGENT, userAgent);
                    h.set("Sec-CH-UA-Mobile", "?0");
                    h.set("Sec-CH-UA-Platform", "\"Windows\"");
                    h.set("Upgrade-Insecure-Requests", "1");
                })
                .build();
    }

    @Override
    public RawPage fetch(final FetchTarget target, final Duration timeout) {
        String url = target.url();
        ResponseEntity<String> response;
        try {
            response = webClient.get()
                    .uri(URI.create(url))
                    .httpRequest(req -> {
                        HttpClientRequest nettyRequest = req.getNativeRequest();
                        nettyRequest.responseTimeout(timeout);
                    })
                    .retrieve()
                    .toEntity(String.class)
                    .timeout(timeout)
                    .block();
        } catch (WebClientResponseException ex) {
            throw FetchException.httpStatus(url, ex.getStatusCode().value(), ex);
        } catch (WebClientRequestException ex) {
            if (isTimeout(ex)) {
                throw FetchException.timeout(url, "no response within " + timeout, ex);
            }
            throw FetchException.network(url, ex.getMostSpecificCause().toString(), ex);
        } catch (RuntimeException ex) {
            Throwable cause = Exceptions.unwrap(ex);
            if (isTimeout(cause)) {
                throw FetchException.timeout(url, "no response within " + timeout, cause);
            }
            throw FetchException.network(url, cause.toString(), cause);
        }

        if (response == null || StringUtils.isBlank(response.getBody())) {
            throw FetchException.network(url, "empty response body", null);
        }
        int status = response.getStatusCode().value();
        log.debug("GET {} -> {} ({} chars)", url, status, response.getBody().length());
        return new RawPage(target, response.getBody(), clock.instant(), status);
    }

    /**
     * Cookies set by the upstream, e.g. anti-bot tokens, kept for the run.
     */
    public Map<String, String> cookies() {
        return Map.copyOf(cookieJar);
    }

    private ExchangeFilterFunction saveCookies() {
        return ExchangeFilterFunction.ofResponseProcessor(resp -> {
            resp.cookies().values().stream()
                    .flatMap(Collection::stream)
                    .forEach(c -> putCookie(c.getName(), c.getValue()));
            return Mono.just(resp);
        });
    }

    private void putCookie(@NonNull final String name, @NonNull final String value) {
        String previous = cookieJar.put(name, value);
        if (!value.equals(previous)) {
            log.debug("Upstream cookie updated: {}", name);
        }
    }

    private static boolean isTimeout(final Throwable ex) {
        return ExceptionUtils.indexOfType(ex, TimeoutException.class) >= 0
                || ExceptionUtils.indexOfType(ex, io.netty.handler.timeout.TimeoutException.class) >= 0;
    }
}

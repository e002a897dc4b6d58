package com.esports.scraper.service.fetch;

import lombok.Getter;
import org.springframework.lang.Nullable;

/**
 * A page could not be retrieved. Always names the URL and how many attempts
 * were made; never accompanied by partial markup.
 */
@Getter
public class FetchException extends RuntimeException {

    private static final int TOO_MANY_REQUESTS = 429;

    private final FetchErrorKind kind;

    private final String url;

    private final int attempts;

    @Nullable
    private final Integer statusCode;

    private final boolean transientFailure;

    public FetchException(final FetchErrorKind kind,
                          final String url,
                          final String message,
                          @Nullable final Integer statusCode,
                          final boolean transientFailure,
                          final int attempts,
                          @Nullable final Throwable cause) {
        super(kind + " for " + url + ": " + message, cause);
        this.kind = kind;
        this.url = url;
        this.statusCode = statusCode;
        this.transientFailure = transientFailure;
        this.attempts = attempts;
    }

    public static FetchException timeout(final String url, final String message, @Nullable final Throwable cause) {
        return new FetchException(FetchErrorKind.TIMEOUT, url, message, null, true, 1, cause);
    }

    public static FetchException network(final String url, final String message, @Nullable final Throwable cause) {
        return new FetchException(FetchErrorKind.NETWORK, url, message, null, true, 1, cause);
    }

    public static FetchException renderFailure(final String url, final String message, @Nullable final Throwable cause) {
        return new FetchException(FetchErrorKind.RENDER_FAILURE, url, message, null, true, 1, cause);
    }

    /**
     * 5xx and 429 are worth another try; every other status is final.
     */
    public static FetchException httpStatus(final String url, final int status, @Nullable final Throwable cause) {
        boolean retryable = status >= 500 || status == TOO_MANY_REQUESTS;
        return new FetchException(FetchErrorKind.HTTP_STATUS, url, "HTTP " + status, status, retryable, 1, cause);
    }

    public static FetchException malformedUrl(final String url, final String message) {
        return new FetchException(FetchErrorKind.MALFORMED_URL, url, message, null, false, 0, null);
    }

    public static FetchException interrupted(final String url, final InterruptedException cause) {
        return new FetchException(FetchErrorKind.NETWORK, url, "interrupted", null, false, 1, cause);
    }

    /** Same failure, re-stamped with the final attempt count. */
    public FetchException withAttempts(final int count) {
        FetchException copy = new FetchException(kind, url, reason(), statusCode,
                transientFailure, count, getCause());
        copy.setStackTrace(getStackTrace());
        return copy;
    }

    private String reason() {
        String message = getMessage();
        int idx = message.indexOf(": ");
        return idx < 0 ? message : message.substring(idx + 2);
    }
}

package com.esports.scraper.service.fetch;

/**
 * Why a page could not be retrieved.
 */
public enum FetchErrorKind {
    TIMEOUT,
    HTTP_STATUS,
    RENDER_FAILURE,
    NETWORK,
    MALFORMED_URL
}

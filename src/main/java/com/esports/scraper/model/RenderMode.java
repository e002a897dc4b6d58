package com.esports.scraper.model;

/**
 * How a page is retrieved: a plain HTTP GET or a full browser render.
 */
public enum RenderMode {
    HTTP,
    BROWSER
}

package com.esports.scraper.parser;

public enum ParseErrorKind {

    /** None of the template's anchor elements were found. */
    STRUCTURE_MISMATCH
}

package com.notionexport.core.crawl;

/**
 * What the export root turned out to be.
 */
public enum RootKind {
    /** A single page: the crawl starts from it. */
    DOCUMENT,
    /** A database: its member pages seed the crawl; the database itself is not exported. */
    COLLECTION
}

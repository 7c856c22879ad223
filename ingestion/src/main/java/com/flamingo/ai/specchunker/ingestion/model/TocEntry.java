package com.flamingo.ai.specchunker.ingestion.model;

/**
 * One entry of the document's native table of contents.
 *
 * @param level heading depth (1 = top level)
 * @param title entry title, usually prefixed by its section number
 * @param page 1-indexed target page
 */
public record TocEntry(int level, String title, int page) {}

package com.flamingo.ai.specchunker.ingestion.chunking;

/**
 * A term and its definition.
 *
 * @param term defined term as written
 * @param definition defining phrase
 */
public record TermDefinition(String term, String definition) {}

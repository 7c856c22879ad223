package com.flamingo.ai.specchunker.ingestion.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A page that could not be extracted and is missing from the chunk stream.
 *
 * @param pageNumber 1-indexed page number
 * @param reason failure description
 */
public record PageGap(
    @JsonProperty("page_number") int pageNumber, @JsonProperty("reason") String reason) {}

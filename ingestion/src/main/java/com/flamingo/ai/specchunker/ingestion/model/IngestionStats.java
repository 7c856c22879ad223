package com.flamingo.ai.specchunker.ingestion.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/** Summary counts for one ingestion run. */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class IngestionStats {
  int totalPages;
  int bodyStartPage;
  int totalChunks;
  int indexableChunks;
  int frontMatterChunks;
  int glossaryTerms;
  int skippedPages;
  int lowConfidenceClassifications;
  boolean truncated;

  /** Chunk count per content type wire name, in enum order. */
  Map<String, Long> chunksByType;
}

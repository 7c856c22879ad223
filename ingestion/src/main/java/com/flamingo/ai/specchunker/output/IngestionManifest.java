package com.flamingo.ai.specchunker.output;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flamingo.ai.specchunker.ingestion.model.IngestionResult;
import com.flamingo.ai.specchunker.ingestion.model.IngestionStats;
import com.flamingo.ai.specchunker.ingestion.model.PageGap;
import java.util.List;

/**
 * Run summary written next to the chunk file.
 *
 * @param source source identifier
 * @param version document version tag
 * @param label document label used in the context prefix
 * @param chunksFile name of the JSON Lines file
 * @param glossaryFile name of the glossary file
 * @param stats run statistics
 * @param skippedPages pages that could not be extracted
 */
public record IngestionManifest(
    @JsonProperty("source") String source,
    @JsonProperty("version") String version,
    @JsonProperty("label") String label,
    @JsonProperty("chunks_file") String chunksFile,
    @JsonProperty("glossary_file") String glossaryFile,
    @JsonProperty("stats") IngestionStats stats,
    @JsonProperty("skipped_pages") List<PageGap> skippedPages) {

  static IngestionManifest of(
      IngestionResult result, String label, String chunksFile, String glossaryFile) {
    return new IngestionManifest(
        result.getSource(),
        result.getVersion(),
        label,
        chunksFile,
        glossaryFile,
        result.stats(),
        result.getSkippedPages());
  }
}

package com.flamingo.ai.specchunker.ingestion.model;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/** Output of one pipeline run over a document. */
@Value
@Builder
public class IngestionResult {

  String source;
  String version;
  int totalPages;
  int bodyStartPage;

  /** All chunks ordered by start page, then emission order. Includes front matter. */
  List<Chunk> chunks;

  /** Chunks worth indexing: body content above the per-type minimum length. */
  List<Chunk> indexableChunks;

  Glossary glossary;

  @Builder.Default List<PageGap> skippedPages = List.of();

  int lowConfidenceClassifications;

  /** Set when the run stopped before the last page. */
  boolean truncated;

  public IngestionStats stats() {
    Map<ContentType, Long> counts = new EnumMap<>(ContentType.class);
    for (Chunk chunk : chunks) {
      counts.merge(chunk.getContentType(), 1L, Long::sum);
    }
    Map<String, Long> byType = new LinkedHashMap<>();
    counts.forEach((type, count) -> byType.put(type.wireName(), count));
    return IngestionStats.builder()
        .totalPages(totalPages)
        .bodyStartPage(bodyStartPage)
        .totalChunks(chunks.size())
        .indexableChunks(indexableChunks.size())
        .frontMatterChunks((int) chunks.stream().filter(Chunk::isFrontMatter).count())
        .glossaryTerms(glossary.size())
        .skippedPages(skippedPages.size())
        .lowConfidenceClassifications(lowConfidenceClassifications)
        .truncated(truncated)
        .chunksByType(byType)
        .build();
  }
}

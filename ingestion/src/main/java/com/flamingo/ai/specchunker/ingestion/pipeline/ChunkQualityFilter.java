package com.flamingo.ai.specchunker.ingestion.pipeline;

import com.flamingo.ai.specchunker.config.IngestionConfig;
import com.flamingo.ai.specchunker.ingestion.model.Chunk;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Decides which chunks are worth indexing. Front matter, stubs below the per-type minimum raw
 * length and continuation markers are kept in the stream but left out of the index.
 */
@Component
public class ChunkQualityFilter {

  private final Map<String, Integer> minRawChars;
  private final int minRowChunkChars;
  private final List<Pattern> noisePatterns;

  public ChunkQualityFilter(IngestionConfig config) {
    IngestionConfig.Indexing indexing = config.getIndexing();
    this.minRawChars = Map.copyOf(indexing.getMinRawChars());
    this.minRowChunkChars = indexing.getMinRowChunkChars();
    this.noisePatterns = indexing.getNoisePatterns().stream().map(Pattern::compile).toList();
  }

  public List<Chunk> indexable(List<Chunk> chunks) {
    return chunks.stream().filter(this::isIndexable).toList();
  }

  public boolean isIndexable(Chunk chunk) {
    if (chunk.isFrontMatter()) {
      return false;
    }
    String raw = chunk.getRawText() == null ? "" : chunk.getRawText().strip();
    int minimum =
        chunk.isRowChunk()
            ? minRowChunkChars
            : minRawChars.getOrDefault(chunk.getContentType().wireName(), 0);
    if (raw.length() < minimum) {
      return false;
    }
    for (Pattern noise : noisePatterns) {
      if (noise.matcher(raw).matches()) {
        return false;
      }
    }
    return true;
  }
}

package com.flamingo.ai.specchunker.ingestion.pipeline;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.specchunker.config.IngestionConfig;
import com.flamingo.ai.specchunker.ingestion.model.Chunk;
import com.flamingo.ai.specchunker.ingestion.model.ContentType;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ChunkQualityFilter Tests")
class ChunkQualityFilterTest {

  private final ChunkQualityFilter filter = new ChunkQualityFilter(new IngestionConfig());

  private static Chunk chunk(ContentType type, String raw) {
    return Chunk.builder().contentType(type).rawText(raw).build();
  }

  @Test
  @DisplayName("should keep body chunks above the minimum length for their type")
  void shouldKeepSubstantialChunks() {
    assertThat(filter.isIndexable(chunk(ContentType.TEXT, "The host sends CMD1 repeatedly.")))
        .isTrue();
    assertThat(filter.isIndexable(chunk(ContentType.DEFINITION, "ABC: bus"))).isTrue();
  }

  @Test
  @DisplayName("should drop stubs below the minimum length for their type")
  void shouldDropStubs() {
    assertThat(filter.isIndexable(chunk(ContentType.TEXT, "  Reserved  "))).isFalse();
    assertThat(filter.isIndexable(chunk(ContentType.FIGURE, "[Figure: (no caption)]")))
        .isFalse();
  }

  @Test
  @DisplayName("should drop front matter")
  void shouldDropFrontMatter() {
    Chunk foreword =
        chunk(ContentType.TEXT, "This standard was prepared by the committee.")
            .toBuilder()
            .frontMatter(true)
            .build();

    assertThat(filter.isIndexable(foreword)).isFalse();
  }

  @Test
  @DisplayName("should drop continuation markers")
  void shouldDropContinuationMarkers() {
    assertThat(filter.isIndexable(chunk(ContentType.TEXT, "Continued on next page"))).isFalse();
  }

  @Test
  @DisplayName("should apply the row-chunk minimum to row-group chunks")
  void shouldUseRowChunkMinimum() {
    Chunk row =
        chunk(ContentType.TABLE, "| Bit | Field |\n| --- | ----- |\n| 7 | BUSY |")
            .toBuilder()
            .rowChunk(true)
            .build();
    Chunk table = row.toBuilder().rowChunk(false).build();

    assertThat(filter.indexable(List.of(row, table))).containsExactly(row);
  }
}

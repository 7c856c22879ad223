package com.flamingo.ai.specchunker.ingestion.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * A self-contained, context-annotated unit of a specification document.
 *
 * <p>{@code text} is the context prefix followed by the raw body; {@code rawText} is the body
 * alone. Page ranges are inclusive and 1-indexed. Serialized as one JSON Lines record with
 * snake_case field names.
 */
@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({
  "chunk_id",
  "source",
  "version",
  "page_start",
  "page_end",
  "section_path",
  "section_title",
  "heading_level",
  "content_type",
  "is_front_matter",
  "chunk_index",
  "text",
  "raw_text",
  "table_markdown",
  "table_notes",
  "figure_caption",
  "term",
  "contains_inline_definition",
  "parent_chunk_id",
  "is_row_chunk"
})
public class Chunk {

  @JsonProperty("chunk_id")
  String chunkId;

  @JsonProperty("source")
  String source;

  @JsonProperty("version")
  String version;

  @JsonProperty("page_start")
  int pageStart;

  @JsonProperty("page_end")
  int pageEnd;

  /** Numeric section path, e.g. ["6", "6.10", "6.10.4"]; empty only for front matter. */
  @Builder.Default
  @JsonProperty("section_path")
  List<String> sectionPath = List.of();

  @JsonProperty("section_title")
  String sectionTitle;

  @JsonProperty("heading_level")
  int headingLevel;

  @JsonProperty("content_type")
  ContentType contentType;

  @JsonProperty("is_front_matter")
  boolean frontMatter;

  /** Sequence number of this chunk within its section. */
  @JsonProperty("chunk_index")
  int chunkIndex;

  @JsonProperty("text")
  String text;

  @JsonProperty("raw_text")
  String rawText;

  @JsonProperty("table_markdown")
  String tableMarkdown;

  @JsonProperty("table_notes")
  String tableNotes;

  @JsonProperty("figure_caption")
  String figureCaption;

  /** Defined term; set on definition chunks only. */
  @JsonProperty("term")
  String term;

  @JsonInclude(JsonInclude.Include.NON_DEFAULT)
  @JsonProperty("contains_inline_definition")
  boolean containsInlineDefinition;

  /** Full-table chunk this row-group chunk belongs to. */
  @JsonProperty("parent_chunk_id")
  String parentChunkId;

  @JsonInclude(JsonInclude.Include.NON_DEFAULT)
  @JsonProperty("is_row_chunk")
  boolean rowChunk;
}

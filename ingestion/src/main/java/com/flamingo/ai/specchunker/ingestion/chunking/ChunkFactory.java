package com.flamingo.ai.specchunker.ingestion.chunking;

import com.flamingo.ai.specchunker.ingestion.model.Chunk;
import com.flamingo.ai.specchunker.ingestion.model.ContentType;
import com.flamingo.ai.specchunker.ingestion.structure.SectionNode;
import java.nio.charset.StandardCharsets;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Creates the chunks of one document run: assigns identifiers, per-section sequence numbers,
 * section metadata, the front-matter flag and the context prefix.
 *
 * <p>Identifiers are name-based UUIDs of the source and the emission sequence, so re-running the
 * same document yields the same identifiers. Not thread-safe; owned by the run.
 */
public class ChunkFactory {

  static final String FRONT_MATTER_LABEL = "(front matter)";

  private final String source;
  private final String version;
  private final String label;
  private final int bodyStartPage;

  private final Map<SectionNode, Integer> sectionCounters = new IdentityHashMap<>();
  private int frontMatterCounter;
  private int sequence;

  public ChunkFactory(String source, String version, String label, int bodyStartPage) {
    this.source = source;
    this.version = version;
    this.label = label;
    this.bodyStartPage = bodyStartPage;
  }

  /**
   * Starts a chunk with every common field set. Callers add {@code text}, {@code rawText} and any
   * type-specific fields.
   */
  public Chunk.ChunkBuilder newChunk(
      ContentType type, SectionNode section, int pageStart, int pageEnd) {
    int start = Math.min(pageStart, pageEnd);
    int end = Math.max(pageStart, pageEnd);
    boolean frontMatter = section == null || end < bodyStartPage;
    return Chunk.builder()
        .chunkId(nextId())
        .source(source)
        .version(version)
        .pageStart(start)
        .pageEnd(end)
        .sectionPath(section == null ? List.of() : section.getPath())
        .sectionTitle(section == null ? "" : section.getTitle())
        .headingLevel(section == null ? 0 : section.getLevel())
        .contentType(type)
        .frontMatter(frontMatter)
        .chunkIndex(nextIndex(section));
  }

  /** Builds a chunk whose text is the context prefix followed by {@code body}. */
  public Chunk create(
      ContentType type, SectionNode section, int pageStart, int pageEnd, String body) {
    return newChunk(type, section, pageStart, pageEnd)
        .text(prefix(section, pageStart) + "\n" + body)
        .rawText(body)
        .build();
  }

  /** Builds a definition chunk with raw text {@code term: definition}. */
  public Chunk definition(
      SectionNode section, int pageStart, int pageEnd, String term, String definition) {
    String body = term + ": " + definition;
    return newChunk(ContentType.DEFINITION, section, pageStart, pageEnd)
        .text(prefix(section, pageStart) + "\n" + body)
        .rawText(body)
        .term(term)
        .build();
  }

  /** Context line, e.g. {@code [eMMC 5.1 | 6.10.4 Detailed command description | Page 118]}. */
  public String prefix(SectionNode section, int page) {
    String sectionLabel = section == null ? FRONT_MATTER_LABEL : section.label();
    String document = version.isEmpty() ? label : label + " " + version;
    return "[" + document + " | " + sectionLabel + " | Page " + page + "]";
  }

  private String nextId() {
    String name = source + "#" + sequence++;
    return UUID.nameUUIDFromBytes(name.getBytes(StandardCharsets.UTF_8)).toString();
  }

  private int nextIndex(SectionNode section) {
    if (section == null) {
      return frontMatterCounter++;
    }
    return sectionCounters.merge(section, 1, Integer::sum) - 1;
  }
}

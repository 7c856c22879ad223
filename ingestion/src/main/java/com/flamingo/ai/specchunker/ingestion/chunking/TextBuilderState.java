package com.flamingo.ai.specchunker.ingestion.chunking;

import com.flamingo.ai.specchunker.ingestion.model.ContentType;
import com.flamingo.ai.specchunker.ingestion.structure.SectionNode;
import java.util.ArrayList;
import java.util.List;

/**
 * Buffered prose waiting to be flushed into chunks. Immutable; every change returns a new state.
 *
 * @param section section of the buffered blocks
 * @param headingLevel level of the heading that opened the buffer, or the section level
 * @param type {@code TEXT} or {@code REGISTER}
 * @param pageStart page of the first buffered block
 * @param pageEnd page of the last buffered block
 * @param parts buffered block texts
 * @param tokens running size in token equivalents
 */
public record TextBuilderState(
    SectionNode section,
    int headingLevel,
    ContentType type,
    int pageStart,
    int pageEnd,
    List<String> parts,
    int tokens) {

  private static final TextBuilderState EMPTY =
      new TextBuilderState(null, 0, ContentType.TEXT, 0, 0, List.of(), 0);

  public TextBuilderState {
    parts = List.copyOf(parts);
  }

  public static TextBuilderState empty() {
    return EMPTY;
  }

  public boolean isEmpty() {
    return parts.isEmpty();
  }

  static TextBuilderState start(TextUnit unit, int headingLevel, int tokens) {
    return new TextBuilderState(
        unit.section(),
        headingLevel,
        unit.type(),
        unit.page(),
        unit.page(),
        List.of(unit.text()),
        tokens);
  }

  TextBuilderState append(TextUnit unit, int unitTokens) {
    List<String> next = new ArrayList<>(parts.size() + 1);
    next.addAll(parts);
    next.add(unit.text());
    return new TextBuilderState(
        section,
        headingLevel,
        type,
        pageStart,
        Math.max(pageEnd, unit.page()),
        next,
        tokens + unitTokens);
  }

  String body() {
    return String.join("\n", parts);
  }

  String lastPart() {
    return parts.isEmpty() ? "" : parts.get(parts.size() - 1);
  }
}

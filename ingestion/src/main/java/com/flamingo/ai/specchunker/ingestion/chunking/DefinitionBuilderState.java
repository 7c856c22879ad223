package com.flamingo.ai.specchunker.ingestion.chunking;

import com.flamingo.ai.specchunker.ingestion.structure.SectionNode;
import java.util.ArrayList;
import java.util.List;

/**
 * Terminology-section blocks collected until the section ends.
 *
 * @param section terminology section
 * @param pageStart page of the first block
 * @param pageEnd page of the last block
 * @param blocks block texts in reading order
 */
public record DefinitionBuilderState(
    SectionNode section, int pageStart, int pageEnd, List<String> blocks) {

  private static final DefinitionBuilderState EMPTY =
      new DefinitionBuilderState(null, 0, 0, List.of());

  public DefinitionBuilderState {
    blocks = List.copyOf(blocks);
  }

  public static DefinitionBuilderState empty() {
    return EMPTY;
  }

  public boolean isEmpty() {
    return blocks.isEmpty();
  }

  DefinitionBuilderState append(String text, int page) {
    List<String> next = new ArrayList<>(blocks);
    next.add(text);
    return new DefinitionBuilderState(section, pageStart, Math.max(pageEnd, page), next);
  }
}

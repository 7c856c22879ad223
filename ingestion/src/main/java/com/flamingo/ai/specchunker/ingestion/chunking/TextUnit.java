package com.flamingo.ai.specchunker.ingestion.chunking;

import com.flamingo.ai.specchunker.ingestion.model.ContentType;
import com.flamingo.ai.specchunker.ingestion.structure.HeadingMatch;
import com.flamingo.ai.specchunker.ingestion.structure.SectionNode;

/**
 * One prose block handed to the {@link TextChunker}.
 *
 * @param type {@code TEXT} or {@code REGISTER}
 * @param text block text
 * @param page page the block is on
 * @param section section the block belongs to, or {@code null} before the first section
 * @param heading heading recognised in the block, or {@code null}
 */
public record TextUnit(
    ContentType type, String text, int page, SectionNode section, HeadingMatch heading) {

  public static TextUnit of(ContentType type, String text, int page, SectionNode section) {
    return new TextUnit(type, text, page, section, null);
  }
}

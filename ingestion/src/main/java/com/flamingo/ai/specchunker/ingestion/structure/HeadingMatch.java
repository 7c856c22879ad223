package com.flamingo.ai.specchunker.ingestion.structure;

import java.util.Optional;

/**
 * A text block recognised as a section heading.
 *
 * @param level heading depth
 * @param section TOC section the heading opens, or {@code null} for a numbered heading with no TOC
 *     entry
 * @param text heading line as it appears on the page
 */
public record HeadingMatch(int level, SectionNode section, String text) {

  public Optional<SectionNode> resolvedSection() {
    return Optional.ofNullable(section);
  }
}

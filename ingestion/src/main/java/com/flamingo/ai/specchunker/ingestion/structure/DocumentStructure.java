package com.flamingo.ai.specchunker.ingestion.structure;

import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import lombok.AccessLevel;
import lombok.Getter;

/**
 * Section hierarchy and page metadata of one document. Shared read-only by every page task and
 * chunk builder of a run.
 */
@Getter
public class DocumentStructure {

  private static final Pattern BULLET_VARIANTS = Pattern.compile("[\\u2022\\u2219*]");
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  private final String source;
  private final String version;
  private final int totalPages;
  private final List<SectionNode> roots;

  /** Every node in TOC order. */
  private final List<SectionNode> sections;

  /** First page of the body; earlier pages are front matter. */
  private final int bodyStartPage;

  @Getter(AccessLevel.NONE)
  private final SectionNode[] pageSections;

  private final Map<String, SectionNode> labelToSection;
  private final Map<String, SectionNode> numberToSection;
  private final Set<Integer> tocPages;

  DocumentStructure(
      String source,
      String version,
      int totalPages,
      List<SectionNode> roots,
      List<SectionNode> sections,
      int bodyStartPage,
      SectionNode[] pageSections,
      Map<String, SectionNode> labelToSection,
      Map<String, SectionNode> numberToSection,
      Set<Integer> tocPages) {
    this.source = source;
    this.version = version;
    this.totalPages = totalPages;
    this.roots = List.copyOf(roots);
    this.sections = List.copyOf(sections);
    this.bodyStartPage = bodyStartPage;
    this.pageSections = pageSections.clone();
    this.labelToSection = Collections.unmodifiableMap(labelToSection);
    this.numberToSection = Collections.unmodifiableMap(numberToSection);
    this.tocPages = Set.copyOf(tocPages);
  }

  /** Deepest section covering {@code page}; empty for pages before the first TOC entry. */
  public Optional<SectionNode> sectionForPage(int page) {
    if (page < 1 || page >= pageSections.length) {
      return Optional.empty();
    }
    return Optional.ofNullable(pageSections[page]);
  }

  /** First section in TOC order whose heading is on {@code page}. */
  public Optional<SectionNode> firstSectionStartingOn(int page) {
    return sections.stream().filter(s -> s.getStartPage() == page).findFirst();
  }

  public Optional<SectionNode> findByLabel(String text) {
    return Optional.ofNullable(labelToSection.get(normalizeLabel(text)));
  }

  public Optional<SectionNode> findByNumber(String number) {
    return Optional.ofNullable(numberToSection.get(number));
  }

  public boolean isFrontMatterPage(int page) {
    return page < bodyStartPage;
  }

  /** Returns {@code true} for pages covered by a "Contents" TOC entry. */
  public boolean isTocPage(int page) {
    return tocPages.contains(page);
  }

  /**
   * Normalizes a heading label for lookup: lower case, bullet glyph variants unified, whitespace
   * collapsed, surrounding dots and spaces removed.
   */
  public static String normalizeLabel(String text) {
    String normalized = text.strip().toLowerCase(Locale.ROOT);
    normalized = BULLET_VARIANTS.matcher(normalized).replaceAll(" ");
    normalized = WHITESPACE.matcher(normalized).replaceAll(" ");
    int start = 0;
    int end = normalized.length();
    while (start < end && isTrimmed(normalized.charAt(start))) {
      start++;
    }
    while (end > start && isTrimmed(normalized.charAt(end - 1))) {
      end--;
    }
    return normalized.substring(start, end);
  }

  private static boolean isTrimmed(char c) {
    return c == '.' || c == ' ';
  }
}

package com.flamingo.ai.specchunker.ingestion.structure;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import lombok.AccessLevel;
import lombok.Getter;

/**
 * One node of the document's section tree, built from a TOC entry.
 *
 * <p>Nodes are assembled by {@link StructureExtractor} and are read-only afterwards. The parent
 * reference does not own the parent; children are owned by this node.
 */
@Getter
public class SectionNode {

  private final int level;

  /** Title without its section number, e.g. "Detailed command description". */
  private final String title;

  /** Section number such as "6.10.4", or {@code null} for un-numbered entries. */
  private final String number;

  /** Numeric path, e.g. ["6", "6.10", "6.10.4"]. Never empty. */
  private final List<String> path;

  private final int startPage;

  private int endPage;

  private boolean frontMatter;

  @Getter(AccessLevel.NONE)
  private final SectionNode parent;

  @Getter(AccessLevel.NONE)
  private final List<SectionNode> children = new ArrayList<>();

  SectionNode(
      int level,
      String title,
      String number,
      List<String> path,
      int startPage,
      SectionNode parent) {
    this.level = level;
    this.title = title;
    this.number = number;
    this.path = List.copyOf(path);
    this.startPage = startPage;
    this.endPage = startPage;
    this.parent = parent;
  }

  /** Number and title as printed in a heading, e.g. "6.10.4 Detailed command description". */
  public String label() {
    return number == null ? title : number + " " + title;
  }

  public Optional<SectionNode> getParent() {
    return Optional.ofNullable(parent);
  }

  public List<SectionNode> getChildren() {
    return Collections.unmodifiableList(children);
  }

  void addChild(SectionNode child) {
    children.add(child);
  }

  void setEndPage(int endPage) {
    this.endPage = endPage;
  }

  void setFrontMatter(boolean frontMatter) {
    this.frontMatter = frontMatter;
  }

  @Override
  public String toString() {
    return "SectionNode[" + label() + ", pages " + startPage + "-" + endPage + "]";
  }
}

package com.flamingo.ai.specchunker.ingestion.structure;

import com.flamingo.ai.specchunker.config.IngestionConfig;
import com.flamingo.ai.specchunker.ingestion.model.TocEntry;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Builds a {@link DocumentStructure} from a document's native table of contents.
 *
 * <p>Entries are inserted into the tree with a level stack: the stack is popped while its top is
 * at the same or a deeper level than the new entry, the entry is attached to the new top (or
 * becomes a root) and is pushed. An empty TOC yields a single "Document" root spanning every
 * page.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class StructureExtractor {

  static final String ROOT_TITLE = "Document";

  private static final Pattern NUMBERED_TITLE =
      Pattern.compile("^(\\d+(?:\\.\\d+)*|[A-Z](?:\\.\\d+)+)\\.?\\s+(\\S.*)$");

  private final IngestionConfig config;

  public DocumentStructure extract(
      String source, String version, int totalPages, List<TocEntry> toc) {
    int pages = Math.max(1, totalPages);
    if (toc.isEmpty()) {
      log.info("No table of contents in {}; using a single root section", source);
      return singleRoot(source, version, pages);
    }

    List<TocEntry> entries = sanitize(toc, pages);
    List<SectionNode> roots = new ArrayList<>();
    List<SectionNode> nodes = new ArrayList<>(entries.size());
    Deque<SectionNode> stack = new ArrayDeque<>();

    for (TocEntry entry : entries) {
      while (!stack.isEmpty() && stack.peek().getLevel() >= entry.level()) {
        stack.pop();
      }
      SectionNode parent = stack.peek();
      SectionNode node = createNode(entry, parent);
      if (parent == null) {
        roots.add(node);
      } else {
        parent.addChild(node);
      }
      stack.push(node);
      nodes.add(node);
    }

    assignEndPages(nodes, pages);
    int bodyStart = bodyStartPage(nodes);
    nodes.forEach(node -> node.setFrontMatter(node.getStartPage() < bodyStart));

    DocumentStructure structure =
        new DocumentStructure(
            source,
            version,
            pages,
            roots,
            nodes,
            bodyStart,
            pageMap(nodes, pages),
            labelMap(nodes),
            numberMap(nodes),
            tocPages(nodes));
    log.info(
        "Structure of {}: {} sections, body starts at page {}, {} TOC page(s)",
        source,
        nodes.size(),
        bodyStart,
        structure.getTocPages().size());
    return structure;
  }

  private DocumentStructure singleRoot(String source, String version, int pages) {
    SectionNode root = new SectionNode(1, ROOT_TITLE, null, List.of(ROOT_TITLE), 1, null);
    root.setEndPage(pages);
    SectionNode[] pageSections = new SectionNode[pages + 1];
    for (int p = 1; p <= pages; p++) {
      pageSections[p] = root;
    }
    return new DocumentStructure(
        source,
        version,
        pages,
        List.of(root),
        List.of(root),
        1,
        pageSections,
        labelMap(List.of(root)),
        Map.of(),
        Set.of());
  }

  /** Clamps target pages into the document and repairs unresolved (non-positive) targets. */
  private List<TocEntry> sanitize(List<TocEntry> toc, int pages) {
    List<TocEntry> result = new ArrayList<>(toc.size());
    int previousPage = 1;
    for (TocEntry entry : toc) {
      int page = entry.page() < 1 ? previousPage : Math.min(entry.page(), pages);
      int level = Math.max(1, entry.level());
      String title = entry.title() == null ? "" : entry.title().strip();
      if (title.isEmpty()) {
        continue;
      }
      result.add(new TocEntry(level, title, page));
      previousPage = page;
    }
    return result;
  }

  private SectionNode createNode(TocEntry entry, SectionNode parent) {
    Matcher m = NUMBERED_TITLE.matcher(entry.title());
    if (m.matches()) {
      String number = m.group(1);
      return new SectionNode(
          entry.level(), m.group(2).strip(), number, numericPath(number), entry.page(), parent);
    }
    List<String> path = new ArrayList<>();
    if (parent != null) {
      path.addAll(parent.getPath());
    }
    path.add(entry.title());
    return new SectionNode(entry.level(), entry.title(), null, path, entry.page(), parent);
  }

  static List<String> numericPath(String number) {
    String[] parts = number.split("\\.");
    List<String> path = new ArrayList<>(parts.length);
    StringBuilder prefix = new StringBuilder();
    for (String part : parts) {
      if (prefix.length() > 0) {
        prefix.append('.');
      }
      prefix.append(part);
      path.add(prefix.toString());
    }
    return path;
  }

  private void assignEndPages(List<SectionNode> nodes, int pages) {
    for (int i = 0; i < nodes.size(); i++) {
      SectionNode node = nodes.get(i);
      int end = pages;
      for (int j = i + 1; j < nodes.size(); j++) {
        if (nodes.get(j).getLevel() <= node.getLevel()) {
          end = nodes.get(j).getStartPage() - 1;
          break;
        }
      }
      node.setEndPage(Math.max(node.getStartPage(), end));
    }
  }

  private int bodyStartPage(List<SectionNode> nodes) {
    SectionNode firstLevelOne = null;
    for (SectionNode node : nodes) {
      if (node.getLevel() != 1) {
        continue;
      }
      if (firstLevelOne == null) {
        firstLevelOne = node;
      }
      if (!isFrontMatterTitle(node.getTitle())) {
        return node.getStartPage();
      }
    }
    return firstLevelOne != null ? firstLevelOne.getStartPage() : 1;
  }

  private boolean isFrontMatterTitle(String title) {
    String normalized = DocumentStructure.normalizeLabel(title);
    return config.getStructure().getFrontMatterKeywords().stream()
        .anyMatch(keyword -> normalized.equals(keyword.toLowerCase(Locale.ROOT)));
  }

  /** Page to deepest section: the last TOC entry whose start page is not after the page. */
  private SectionNode[] pageMap(List<SectionNode> nodes, int pages) {
    SectionNode[] pageSections = new SectionNode[pages + 1];
    for (SectionNode node : nodes) {
      for (int p = node.getStartPage(); p <= pages; p++) {
        pageSections[p] = node;
      }
    }
    return pageSections;
  }

  private Map<String, SectionNode> labelMap(List<SectionNode> nodes) {
    Map<String, SectionNode> map = new LinkedHashMap<>();
    for (SectionNode node : nodes) {
      map.putIfAbsent(DocumentStructure.normalizeLabel(node.label()), node);
    }
    return map;
  }

  private Map<String, SectionNode> numberMap(List<SectionNode> nodes) {
    Map<String, SectionNode> map = new LinkedHashMap<>();
    for (SectionNode node : nodes) {
      if (node.getNumber() != null) {
        map.putIfAbsent(node.getNumber(), node);
      }
    }
    return map;
  }

  private Set<Integer> tocPages(List<SectionNode> nodes) {
    Set<String> tocTitles = new HashSet<>();
    config.getStructure().getTocTitles().forEach(t -> tocTitles.add(t.toLowerCase(Locale.ROOT)));
    Set<Integer> pages = new HashSet<>();
    for (SectionNode node : nodes) {
      if (tocTitles.contains(DocumentStructure.normalizeLabel(node.getTitle()))) {
        for (int p = node.getStartPage(); p <= node.getEndPage(); p++) {
          pages.add(p);
        }
      }
    }
    return pages;
  }
}

package com.flamingo.ai.specchunker.ingestion.chunking;

import com.flamingo.ai.specchunker.config.IngestionConfig;
import com.flamingo.ai.specchunker.ingestion.chunking.TableBuilderState.Pending;
import com.flamingo.ai.specchunker.ingestion.classify.NormalizedTable;
import com.flamingo.ai.specchunker.ingestion.classify.TableNormalizer;
import com.flamingo.ai.specchunker.ingestion.model.Chunk;
import com.flamingo.ai.specchunker.ingestion.model.ContentType;
import com.flamingo.ai.specchunker.ingestion.structure.SectionNode;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Serializes tables as Markdown pipe tables and joins tables continued across pages.
 *
 * <p>The last table of page p and the first table of page p+1 are one logical table when their
 * column counts match and their left and right edges align within the continuation tolerance. The
 * continuation fragment is re-read without a header zone and only rows repeating the header are
 * dropped.
 *
 * <p>A table whose prefixed Markdown exceeds {@code maxTableChars} is split into parts that each
 * repeat the header. Splits fall only where the key value changes, and the notes go to the last
 * part. With row-group chunks enabled, every key group also gets its own small chunk pointing at
 * the first full-table chunk.
 */
@Slf4j
@Component
public class TableChunker {

  static final String NOTES_HEADING = "\n\n**Notes:**\n";

  private static final List<String> REGISTER_KEY_WORDS = List.of("bit", "index", "byte", "offset");

  private final IngestionConfig.Table config;
  private final TableNormalizer normalizer;

  public TableChunker(IngestionConfig config, TableNormalizer normalizer) {
    this.config = config.getTable();
    this.normalizer = normalizer;
  }

  public BuilderStep<TableBuilderState> accept(
      TableBuilderState state, TableUnit unit, ChunkFactory factory) {
    List<Chunk> emitted = new ArrayList<>();
    Pending pending;
    if (!state.isEmpty() && continues(state.pending(), unit)) {
      pending = extend(state.pending(), unit);
      log.debug(
          "Table continued from page {} to page {}", pending.pageStart(), pending.pageEnd());
    } else {
      if (!state.isEmpty()) {
        emitted.addAll(flush(state.pending(), factory));
      }
      pending = start(unit);
    }
    if (!unit.lastOnPage()) {
      emitted.addAll(flush(pending, factory));
      return new BuilderStep<>(TableBuilderState.empty(), emitted);
    }
    return new BuilderStep<>(new TableBuilderState(pending), emitted);
  }

  /** Flushes a buffered table that did not continue onto {@code page}. */
  public BuilderStep<TableBuilderState> endPage(
      TableBuilderState state, int page, ChunkFactory factory) {
    if (state.isEmpty() || state.pending().pageEnd() >= page) {
      return BuilderStep.of(state);
    }
    return new BuilderStep<>(TableBuilderState.empty(), flush(state.pending(), factory));
  }

  public List<Chunk> finish(TableBuilderState state, ChunkFactory factory) {
    return state.isEmpty() ? List.of() : flush(state.pending(), factory);
  }

  private boolean continues(Pending pending, TableUnit unit) {
    float tolerance = config.getContinuationTolerance();
    return unit.firstOnPage()
        && unit.page() == pending.pageEnd() + 1
        && unit.table().columnCount() == pending.header().size()
        && Math.abs(unit.bbox().x0() - pending.lastBox().x0()) <= tolerance
        && Math.abs(unit.bbox().x1() - pending.lastBox().x1()) <= tolerance;
  }

  private static Pending start(TableUnit unit) {
    NormalizedTable table = unit.table();
    return new Pending(
        table.header(),
        table.body(),
        table.notes(),
        unit.section(),
        unit.caption(),
        unit.page(),
        unit.page(),
        unit.bbox());
  }

  private Pending extend(Pending pending, TableUnit unit) {
    NormalizedTable table = normalizer.continuation(unit.rows(), pending.header());
    List<List<String>> rows = new ArrayList<>(pending.body());
    rows.addAll(table.body());
    String notes =
        pending.notes().isEmpty()
            ? table.notes()
            : table.notes().isEmpty() ? pending.notes() : pending.notes() + "\n" + table.notes();
    return new Pending(
        pending.header(),
        TableNormalizer.forwardFillKey(rows),
        notes,
        pending.section(),
        pending.caption().isEmpty() ? unit.caption() : pending.caption(),
        pending.pageStart(),
        unit.page(),
        unit.bbox());
  }

  private List<Chunk> flush(Pending table, ChunkFactory factory) {
    if (table.header().isEmpty() || table.body().isEmpty()) {
      return List.of();
    }
    String prefix = tablePrefix(factory, table);
    String notesSection = table.notes().isEmpty() ? "" : NOTES_HEADING + table.notes();
    String markdown = markdown(table.header(), table.body());

    List<Chunk> chunks = new ArrayList<>();
    if (prefix.length() + markdown.length() + notesSection.length() <= config.getMaxTableChars()) {
      chunks.add(tableChunk(factory, table, prefix, markdown, notesSection));
    } else {
      int budget = config.getMaxTableChars() - prefix.length();
      List<List<List<String>>> parts = splitRows(table, budget);
      for (int i = 0; i < parts.size(); i++) {
        boolean last = i == parts.size() - 1;
        chunks.add(
            tableChunk(
                factory,
                table,
                prefix,
                markdown(table.header(), parts.get(i)),
                last ? notesSection : ""));
      }
      log.debug(
          "Table on pages {}-{} split into {} parts",
          table.pageStart(),
          table.pageEnd(),
          parts.size());
    }

    if (config.isRowGroupChunks()) {
      chunks.addAll(rowGroupChunks(factory, table, prefix, chunks.get(0).getChunkId()));
    }
    return chunks;
  }

  private static String tablePrefix(ChunkFactory factory, Pending table) {
    String context = factory.prefix(table.section(), table.pageStart());
    return table.caption().isEmpty()
        ? context + "\n\n"
        : context + "\n" + table.caption() + "\n\n";
  }

  private static Chunk tableChunk(
      ChunkFactory factory, Pending table, String prefix, String markdown, String notesSection) {
    String raw = markdown + notesSection;
    return factory
        .newChunk(ContentType.TABLE, table.section(), table.pageStart(), table.pageEnd())
        .text(prefix + raw)
        .rawText(raw)
        .tableMarkdown(markdown)
        .tableNotes(notesSection.isEmpty() ? null : table.notes())
        .figureCaption(table.caption().isEmpty() ? null : table.caption())
        .build();
  }

  /** Packs key groups into parts whose Markdown fits {@code budget} characters. */
  private List<List<List<String>>> splitRows(Pending table, int budget) {
    int headerChars = markdown(table.header(), List.of()).length();
    List<List<List<String>>> parts = new ArrayList<>();
    List<List<String>> current = new ArrayList<>();
    int currentChars = headerChars;
    for (List<List<String>> group : keyGroups(table.body())) {
      int groupChars = rowsLength(group);
      if (!current.isEmpty() && currentChars + groupChars > budget) {
        parts.add(current);
        current = new ArrayList<>();
        currentChars = headerChars;
      }
      if (headerChars + groupChars > budget) {
        // a single key group larger than a part: fall back to row boundaries
        for (List<String> row : group) {
          int rowChars = rowLength(row);
          if (!current.isEmpty() && currentChars + rowChars > budget) {
            parts.add(current);
            current = new ArrayList<>();
            currentChars = headerChars;
          }
          current.add(row);
          currentChars += rowChars;
        }
        continue;
      }
      current.addAll(group);
      currentChars += groupChars;
    }
    if (!current.isEmpty()) {
      parts.add(current);
    }
    return parts;
  }

  private List<Chunk> rowGroupChunks(
      ChunkFactory factory, Pending table, String prefix, String parentId) {
    String key = table.header().get(0).toLowerCase(Locale.ROOT);
    String context = "";
    if (REGISTER_KEY_WORDS.stream().anyMatch(key::contains)) {
      String name = table.caption().isEmpty() ? sectionTitle(table.section()) : table.caption();
      context = "**Register Context: " + name + "**\n\n";
    }
    List<List<List<String>>> groups = keyGroups(table.body());
    List<Chunk> chunks = new ArrayList<>(groups.size());
    for (int i = 0; i < groups.size(); i++) {
      String markdown = markdown(table.header(), groups.get(i));
      String raw = context + markdown;
      if (i == groups.size() - 1 && !table.notes().isEmpty()) {
        raw += NOTES_HEADING + table.notes();
      }
      chunks.add(
          factory
              .newChunk(ContentType.TABLE, table.section(), table.pageStart(), table.pageEnd())
              .text(prefix + raw)
              .rawText(raw)
              .tableMarkdown(markdown)
              .figureCaption(table.caption().isEmpty() ? null : table.caption())
              .parentChunkId(parentId)
              .rowChunk(true)
              .build());
    }
    return chunks;
  }

  private static String sectionTitle(SectionNode section) {
    return section == null ? "Register" : section.getTitle();
  }

  /** Consecutive rows sharing a key value. */
  static List<List<List<String>>> keyGroups(List<List<String>> body) {
    List<List<List<String>>> groups = new ArrayList<>();
    List<List<String>> current = new ArrayList<>();
    String key = null;
    for (List<String> row : body) {
      String rowKey = row.isEmpty() ? "" : row.get(0);
      if (key != null && !key.equals(rowKey)) {
        groups.add(current);
        current = new ArrayList<>();
      }
      key = rowKey;
      current.add(row);
    }
    if (!current.isEmpty()) {
      groups.add(current);
    }
    return groups;
  }

  /** GitHub-flavored Markdown pipe table; the separator is at least three dashes per column. */
  static String markdown(List<String> header, List<List<String>> rows) {
    StringBuilder sb = new StringBuilder();
    appendRow(sb, header, header.size());
    sb.append('\n');
    List<String> separator = new ArrayList<>(header.size());
    for (String cell : header) {
      separator.add("-".repeat(Math.max(cell.length(), 3)));
    }
    appendRow(sb, separator, header.size());
    for (List<String> row : rows) {
      sb.append('\n');
      appendRow(sb, row, header.size());
    }
    return sb.toString();
  }

  private static void appendRow(StringBuilder sb, List<String> cells, int columns) {
    sb.append('|');
    for (int c = 0; c < columns; c++) {
      String cell = c < cells.size() && cells.get(c) != null ? cells.get(c) : "";
      sb.append(' ').append(cell.replace("|", "\\|")).append(" |");
    }
  }

  private static int rowsLength(List<List<String>> rows) {
    int total = 0;
    for (List<String> row : rows) {
      total += rowLength(row);
    }
    return total;
  }

  private static int rowLength(List<String> row) {
    StringBuilder sb = new StringBuilder("\n");
    appendRow(sb, row, row.size());
    return sb.length();
  }
}

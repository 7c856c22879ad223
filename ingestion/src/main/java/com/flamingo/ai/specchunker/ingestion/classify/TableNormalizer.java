package com.flamingo.ai.specchunker.ingestion.classify;

import com.flamingo.ai.specchunker.config.IngestionConfig;
import com.flamingo.ai.specchunker.ingestion.model.TableRegion;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Turns raw table cells into a {@link NormalizedTable}.
 *
 * <ol>
 *   <li>The header zone is row 0 (or the reader's header hint) plus every following row up to the
 *       first complete data row: key cell populated and at least half the cells populated.
 *   <li>Header fragments are merged column-wise with a space.
 *   <li>Trailing rows whose key cell starts with the note marker and whose other cells are empty
 *       become the notes.
 *   <li>An empty key cell is filled with the nearest populated key above it.
 * </ol>
 *
 * <p>In-cell line breaks are joined with a space.
 */
@Component
public class TableNormalizer {

  private static final Pattern WHITESPACE = Pattern.compile("\\s+");
  private static final int MAX_REPEATED_HEADER_ROWS = 3;

  private final Pattern noteRow;
  private final Pattern numberedNote;

  public TableNormalizer(IngestionConfig config) {
    String marker = Pattern.quote(config.getTable().getNoteMarker());
    this.noteRow = Pattern.compile("^" + marker + "\\b", Pattern.CASE_INSENSITIVE);
    this.numberedNote = Pattern.compile(" (" + marker + " \\d)", Pattern.CASE_INSENSITIVE);
  }

  public NormalizedTable normalize(TableRegion region) {
    List<List<String>> rows = region.rows();
    int columns = region.columnCount();
    if (rows.isEmpty() || columns == 0) {
      return new NormalizedTable(List.of(), List.of(), "");
    }

    int dataStart = findDataStart(rows, columns, region.headerRowHint());
    List<String> header = mergeHeader(rows.subList(0, dataStart), columns);
    return withBody(header, rows.subList(dataStart, rows.size()));
  }

  /**
   * Reads a fragment that continues a table from the previous page. There is no header zone:
   * only leading rows that repeat {@code header} are dropped, so keyless sub-rows stay separate
   * rows. Leading keyless rows keep an empty key for the caller to fill from the earlier fragment.
   */
  public NormalizedTable continuation(List<List<String>> rows, List<String> header) {
    int columns = header.size();
    int dataStart = 0;
    for (int k = 1; k <= Math.min(MAX_REPEATED_HEADER_ROWS, rows.size()); k++) {
      if (sameCells(mergeHeader(rows.subList(0, k), columns), header)) {
        dataStart = k;
        break;
      }
    }
    NormalizedTable table = withBody(header, rows.subList(dataStart, rows.size()));
    List<List<String>> body =
        table.body().stream().filter(row -> row.stream().anyMatch(c -> !c.isEmpty())).toList();
    return new NormalizedTable(header, body, table.notes());
  }

  private NormalizedTable withBody(List<String> header, List<List<String>> rows) {
    int columns = header.size();
    List<List<String>> body = new ArrayList<>();
    for (List<String> row : rows) {
      List<String> cleaned = new ArrayList<>(columns);
      for (int c = 0; c < columns; c++) {
        cleaned.add(c < row.size() ? cell(row.get(c)) : "");
      }
      body.add(cleaned);
    }

    List<String> notes = new ArrayList<>();
    int cutoff = body.size();
    for (int i = body.size() - 1; i >= 0; i--) {
      List<String> row = body.get(i);
      if (!isNoteRow(row)) {
        break;
      }
      notes.add(0, numberedNote.matcher(row.get(0)).replaceAll("\n$1"));
      cutoff = i;
    }
    body = forwardFillKey(body.subList(0, cutoff));

    return new NormalizedTable(header, body, String.join("\n", notes));
  }

  private int findDataStart(List<List<String>> rows, int columns, int headerRowHint) {
    int minFilled = Math.max(1, (columns + 1) / 2);
    int start = Math.min(headerRowHint, rows.size());
    for (int i = start; i < rows.size(); i++) {
      List<String> row = rows.get(i);
      String key = row.isEmpty() ? "" : cell(row.get(0));
      long filled = row.stream().filter(c -> !cell(c).isEmpty()).count();
      if (!key.isEmpty() && filled >= minFilled) {
        return i;
      }
    }
    return start;
  }

  private List<String> mergeHeader(List<List<String>> headerRows, int columns) {
    List<String> header = new ArrayList<>(columns);
    for (int c = 0; c < columns; c++) {
      StringBuilder merged = new StringBuilder();
      for (List<String> row : headerRows) {
        String text = c < row.size() ? cell(row.get(c)) : "";
        if (!text.isEmpty()) {
          if (merged.length() > 0) {
            merged.append(' ');
          }
          merged.append(text);
        }
      }
      header.add(merged.toString());
    }
    return header;
  }

  private boolean isNoteRow(List<String> row) {
    if (row.isEmpty() || row.get(0).isEmpty() || !noteRow.matcher(row.get(0)).find()) {
      return false;
    }
    for (int c = 1; c < row.size(); c++) {
      if (!row.get(c).isEmpty()) {
        return false;
      }
    }
    return true;
  }

  /** Fills empty key cells (column 0) with the nearest populated key above. */
  public static List<List<String>> forwardFillKey(List<List<String>> body) {
    List<List<String>> result = new ArrayList<>(body.size());
    String lastKey = "";
    for (List<String> row : body) {
      List<String> copy = new ArrayList<>(row);
      if (!copy.isEmpty()) {
        if (!copy.get(0).isEmpty()) {
          lastKey = copy.get(0);
        } else if (!lastKey.isEmpty()) {
          copy.set(0, lastKey);
        }
      }
      result.add(copy);
    }
    return result;
  }

  /** Compares header cells ignoring whitespace and case. */
  public static boolean sameCells(List<String> a, List<String> b) {
    if (a.size() != b.size()) {
      return false;
    }
    for (int i = 0; i < a.size(); i++) {
      String left = WHITESPACE.matcher(a.get(i)).replaceAll("");
      String right = WHITESPACE.matcher(b.get(i)).replaceAll("");
      if (!left.equalsIgnoreCase(right)) {
        return false;
      }
    }
    return true;
  }

  static String cell(String value) {
    if (value == null) {
      return "";
    }
    return WHITESPACE.matcher(value).replaceAll(" ").strip();
  }
}

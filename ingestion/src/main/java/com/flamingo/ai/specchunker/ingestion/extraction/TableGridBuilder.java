package com.flamingo.ai.specchunker.ingestion.extraction;

import com.flamingo.ai.specchunker.ingestion.model.BoundingBox;
import com.flamingo.ai.specchunker.ingestion.model.TableRegion;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * Detects ruled tables from horizontal and vertical rulings and fills their cells with glyphs.
 *
 * <p>Rulings that touch each other form one connected grid. Each grid with at least two distinct
 * horizontal and two distinct vertical lines becomes a table whose row and column boundaries are
 * the snapped line positions. A glyph belongs to the cell containing its center. Rows and columns
 * without any text are dropped.
 */
final class TableGridBuilder {

  private final float snapTolerance;
  private final float minRulingLength;

  TableGridBuilder(float snapTolerance, float minRulingLength) {
    this.snapTolerance = snapTolerance;
    this.minRulingLength = minRulingLength;
  }

  List<TableRegion> build(List<Ruling> rulings, List<Glyph> glyphs) {
    List<Ruling> horizontals = new ArrayList<>();
    List<Ruling> verticals = new ArrayList<>();
    for (Ruling ruling : rulings) {
      if (ruling.length() < minRulingLength) {
        continue;
      }
      if (ruling.isHorizontal(snapTolerance)) {
        horizontals.add(ruling);
      } else if (ruling.isVertical(snapTolerance)) {
        verticals.add(ruling);
      }
    }
    if (horizontals.size() < 2 || verticals.size() < 2) {
      return List.of();
    }

    int h = horizontals.size();
    UnionFind uf = new UnionFind(h + verticals.size());
    for (int i = 0; i < h; i++) {
      for (int j = 0; j < verticals.size(); j++) {
        if (touches(horizontals.get(i), verticals.get(j))) {
          uf.union(i, h + j);
        }
      }
    }

    List<TableRegion> tables = new ArrayList<>();
    for (List<Integer> group : uf.groups()) {
      List<Float> ys = new ArrayList<>();
      List<Float> xs = new ArrayList<>();
      for (int index : group) {
        if (index < h) {
          ys.add(horizontals.get(index).y());
        } else {
          xs.add(verticals.get(index - h).x());
        }
      }
      float[] rowEdges = snap(ys);
      float[] colEdges = snap(xs);
      if (rowEdges.length < 2 || colEdges.length < 2) {
        continue;
      }
      if (rowEdges.length < 3 && colEdges.length < 3) {
        continue;
      }
      TableRegion table = fill(rowEdges, colEdges, glyphs);
      if (table != null) {
        tables.add(table);
      }
    }
    tables.sort(Comparator.comparingDouble(t -> t.bbox().y0()));
    return tables;
  }

  private boolean touches(Ruling horizontal, Ruling vertical) {
    float x = vertical.x();
    float y = horizontal.y();
    return x >= horizontal.x0() - snapTolerance
        && x <= horizontal.x1() + snapTolerance
        && y >= vertical.top() - snapTolerance
        && y <= vertical.bottom() + snapTolerance;
  }

  /** Sorts positions and merges those closer than the snap tolerance into their mean. */
  private float[] snap(List<Float> positions) {
    List<Float> sorted = new ArrayList<>(positions);
    sorted.sort(Float::compare);
    List<Float> result = new ArrayList<>();
    float sum = 0;
    int count = 0;
    float last = Float.NaN;
    for (float value : sorted) {
      if (count > 0 && value - last > snapTolerance) {
        result.add(sum / count);
        sum = 0;
        count = 0;
      }
      sum += value;
      count++;
      last = value;
    }
    if (count > 0) {
      result.add(sum / count);
    }
    float[] edges = new float[result.size()];
    for (int i = 0; i < edges.length; i++) {
      edges[i] = result.get(i);
    }
    return edges;
  }

  private TableRegion fill(float[] rowEdges, float[] colEdges, List<Glyph> glyphs) {
    int rows = rowEdges.length - 1;
    int cols = colEdges.length - 1;
    BoundingBox bbox =
        new BoundingBox(colEdges[0], rowEdges[0], colEdges[cols], rowEdges[rows]);

    @SuppressWarnings("unchecked")
    List<Glyph>[][] cells = new List[rows][cols];
    for (Glyph glyph : glyphs) {
      float cx = glyph.bbox().centerX();
      float cy = glyph.bbox().centerY();
      if (!bbox.contains(cx, cy, 0f)) {
        continue;
      }
      int row = interval(rowEdges, cy);
      int col = interval(colEdges, cx);
      if (cells[row][col] == null) {
        cells[row][col] = new ArrayList<>();
      }
      cells[row][col].add(glyph);
    }

    boolean[] keepCol = new boolean[cols];
    List<String[]> textRows = new ArrayList<>();
    for (int r = 0; r < rows; r++) {
      String[] texts = new String[cols];
      boolean any = false;
      for (int c = 0; c < cols; c++) {
        if (cells[r][c] != null) {
          texts[c] = TextLayout.cellText(cells[r][c]);
          if (texts[c] != null) {
            any = true;
            keepCol[c] = true;
          }
        }
      }
      if (any) {
        textRows.add(texts);
      }
    }
    if (textRows.isEmpty()) {
      return null;
    }

    List<List<String>> result = new ArrayList<>(textRows.size());
    for (String[] texts : textRows) {
      List<String> row = new ArrayList<>();
      for (int c = 0; c < cols; c++) {
        if (keepCol[c]) {
          row.add(texts[c]);
        }
      }
      result.add(row);
    }
    return new TableRegion(bbox, result);
  }

  private static int interval(float[] edges, float value) {
    int index = Arrays.binarySearch(edges, value);
    if (index < 0) {
      index = -index - 2;
    }
    return Math.max(0, Math.min(edges.length - 2, index));
  }
}

package com.flamingo.ai.specchunker.ingestion.extraction;

import com.flamingo.ai.specchunker.ingestion.model.BoundingBox;
import com.flamingo.ai.specchunker.ingestion.model.TextBlock;
import java.util.ArrayList;
import java.util.List;

/**
 * Rebuilds lines and blocks from positioned glyphs.
 *
 * <p>Glyphs are expected in reading order (top to bottom, then left to right). A glyph whose
 * baseline moves by more than {@link #LINE_TOLERANCE} starts a new line; a wide horizontal gap
 * inside a line starts a new fragment so that side-by-side columns stay apart.
 */
final class TextLayout {

  static final float LINE_TOLERANCE = 2.0f;

  private static final float COLUMN_GAP_SPACES = 4.0f;
  private static final float COLUMN_GAP_EM = 1.5f;
  private static final float PARAGRAPH_GAP_EM = 0.6f;
  private static final float FONT_SIZE_TOLERANCE = 1.0f;

  private TextLayout() {}

  /** A run of glyphs on one baseline. */
  record Line(BoundingBox bbox, String text, float fontSize, boolean bold) {}

  static List<Line> lines(List<Glyph> glyphs, boolean splitColumns) {
    List<Line> lines = new ArrayList<>();
    List<Glyph> current = new ArrayList<>();
    boolean pendingSpace = false;
    Glyph previous = null;

    for (Glyph glyph : glyphs) {
      if (glyph.text().isBlank()) {
        pendingSpace = true;
        continue;
      }
      if (previous != null) {
        boolean newLine = Math.abs(glyph.bbox().y1() - previous.bbox().y1()) > LINE_TOLERANCE;
        float gap = glyph.bbox().x0() - previous.bbox().x1();
        boolean newColumn =
            splitColumns
                && gap
                    > Math.max(
                        previous.effectiveSpaceWidth() * COLUMN_GAP_SPACES,
                        previous.fontSize() * COLUMN_GAP_EM);
        if (newLine || newColumn || gap < -previous.fontSize()) {
          addLine(lines, current);
          current = new ArrayList<>();
          pendingSpace = false;
        } else if (pendingSpace || gap > previous.effectiveSpaceWidth() * 0.5f) {
          current.add(spaceAfter(previous));
        }
      }
      pendingSpace = false;
      current.add(glyph);
      previous = glyph;
    }
    addLine(lines, current);
    return lines;
  }

  /** Groups vertically adjacent, horizontally overlapping lines of similar style into blocks. */
  static List<TextBlock> blocks(List<Line> lines) {
    List<List<Line>> groups = new ArrayList<>();
    List<BoundingBox> groupBoxes = new ArrayList<>();

    for (Line line : lines) {
      int target = -1;
      for (int i = groups.size() - 1; i >= 0; i--) {
        List<Line> group = groups.get(i);
        Line last = group.get(group.size() - 1);
        BoundingBox box = groupBoxes.get(i);
        float gap = line.bbox().y0() - last.bbox().y1();
        boolean overlapsHorizontally =
            line.bbox().x0() < box.x1() && line.bbox().x1() > box.x0();
        boolean sameStyle =
            Math.abs(line.fontSize() - last.fontSize()) <= FONT_SIZE_TOLERANCE
                && line.bold() == last.bold();
        if (overlapsHorizontally
            && sameStyle
            && gap >= -LINE_TOLERANCE
            && gap <= Math.max(last.fontSize(), line.fontSize()) * PARAGRAPH_GAP_EM) {
          target = i;
          break;
        }
      }
      if (target < 0) {
        groups.add(new ArrayList<>(List.of(line)));
        groupBoxes.add(line.bbox());
      } else {
        groups.get(target).add(line);
        groupBoxes.set(target, groupBoxes.get(target).union(line.bbox()));
      }
    }

    List<TextBlock> blocks = new ArrayList<>(groups.size());
    for (int i = 0; i < groups.size(); i++) {
      List<Line> group = groups.get(i);
      StringBuilder text = new StringBuilder();
      float sizeSum = 0;
      for (Line line : group) {
        if (text.length() > 0) {
          text.append('\n');
        }
        text.append(line.text());
        sizeSum += line.fontSize();
      }
      blocks.add(
          new TextBlock(
              groupBoxes.get(i), text.toString(), sizeSum / group.size(), group.get(0).bold(), i));
    }
    return blocks;
  }

  /** Text of a table cell: its lines joined by {@code \n}, or {@code null} when empty. */
  static String cellText(List<Glyph> glyphs) {
    List<Line> lines = lines(glyphs, false);
    if (lines.isEmpty()) {
      return null;
    }
    StringBuilder sb = new StringBuilder();
    for (Line line : lines) {
      if (sb.length() > 0) {
        sb.append('\n');
      }
      sb.append(line.text());
    }
    return sb.toString();
  }

  private static Glyph spaceAfter(Glyph glyph) {
    return new Glyph(glyph.bbox(), " ", glyph.fontSize(), glyph.spaceWidth(), glyph.bold());
  }

  private static void addLine(List<Line> lines, List<Glyph> glyphs) {
    if (glyphs.isEmpty()) {
      return;
    }
    StringBuilder text = new StringBuilder();
    List<BoundingBox> boxes = new ArrayList<>(glyphs.size());
    float sizeSum = 0;
    int visible = 0;
    int boldCount = 0;
    for (Glyph glyph : glyphs) {
      text.append(glyph.text());
      if (!glyph.text().isBlank()) {
        boxes.add(glyph.bbox());
        sizeSum += glyph.fontSize();
        visible++;
        if (glyph.bold()) {
          boldCount++;
        }
      }
    }
    String lineText = text.toString().strip();
    if (lineText.isEmpty()) {
      return;
    }
    lines.add(
        new Line(
            BoundingBox.enclosing(boxes), lineText, sizeSum / visible, boldCount * 2 > visible));
  }
}

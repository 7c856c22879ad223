package com.flamingo.ai.specchunker.ingestion.chunking;

import com.flamingo.ai.specchunker.config.IngestionConfig;
import com.flamingo.ai.specchunker.ingestion.model.BoundingBox;
import com.flamingo.ai.specchunker.ingestion.model.TextBlock;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/** Finds {@code Table N - ...} and {@code Figure N - ...} captions next to a region. */
@Component
public class CaptionLocator {

  private static final Pattern TABLE_CAPTION =
      Pattern.compile("Table\\s+\\d+[\\s\\u2014\\-]+[^\\n]{5,80}", Pattern.CASE_INSENSITIVE);
  private static final Pattern FIGURE_CAPTION =
      Pattern.compile("Figure\\s+\\d+[\\s\\u2014\\-]+[^\\n]{3,120}", Pattern.CASE_INSENSITIVE);

  private final float searchMargin;

  public CaptionLocator(IngestionConfig config) {
    this.searchMargin = config.getFigure().getCaptionSearchMargin();
  }

  /**
   * Caption of a table: the nearest matching block above it, otherwise the nearest matching block
   * below it within the search margin. Empty if none.
   */
  public String tableCaption(BoundingBox table, List<TextBlock> blocks) {
    String above = nearest(table, blocks, TABLE_CAPTION, true, Float.MAX_VALUE);
    return above.isEmpty() ? nearest(table, blocks, TABLE_CAPTION, false, searchMargin) : above;
  }

  /** Caption of a figure: the nearest matching block above or below within the search margin. */
  public String figureCaption(BoundingBox figure, List<TextBlock> blocks) {
    String best = "";
    float bestGap = Float.MAX_VALUE;
    for (TextBlock block : blocks) {
      float gap = figure.verticalGap(block.bbox());
      if (gap < 0 || gap > searchMargin || gap >= bestGap) {
        continue;
      }
      Matcher m = FIGURE_CAPTION.matcher(block.text());
      if (m.find()) {
        best = m.group().strip();
        bestGap = gap;
      }
    }
    return best;
  }

  private static String nearest(
      BoundingBox region, List<TextBlock> blocks, Pattern pattern, boolean above, float margin) {
    String best = "";
    float bestGap = Float.MAX_VALUE;
    for (TextBlock block : blocks) {
      boolean isAbove = block.bbox().y1() <= region.y0() + 1f;
      boolean isBelow = block.bbox().y0() >= region.y1() - 1f;
      if (above ? !isAbove : !isBelow) {
        continue;
      }
      float gap = above ? region.y0() - block.bbox().y1() : block.bbox().y0() - region.y1();
      if (gap > margin || gap >= bestGap) {
        continue;
      }
      Matcher m = pattern.matcher(block.text());
      if (m.find()) {
        best = m.group().strip();
        bestGap = gap;
      }
    }
    return best;
  }
}

package com.flamingo.ai.specchunker.ingestion.classify;

import com.flamingo.ai.specchunker.config.IngestionConfig;
import com.flamingo.ai.specchunker.ingestion.model.BoundingBox;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.Function;

/**
 * Orders page elements for reading.
 *
 * <p>Single-column pages are read top to bottom, then left to right. A page is two-column when at
 * least {@code twoColumnMinBlocksPerSide} elements sit entirely on each side of the vertical
 * midline and few elements straddle it. Full-width elements then split the page into bands; within
 * a band the left column is read before the right column.
 */
final class ReadingOrder {

  private static final Comparator<BoundingBox> TOP_DOWN =
      Comparator.comparingDouble(BoundingBox::y0).thenComparingDouble(BoundingBox::x0);

  private final IngestionConfig.Classification settings;

  ReadingOrder(IngestionConfig.Classification settings) {
    this.settings = settings;
  }

  <T> List<T> sort(List<T> items, Function<T, BoundingBox> bounds, float pageWidth) {
    float mid = pageWidth / 2f;
    List<T> left = new ArrayList<>();
    List<T> right = new ArrayList<>();
    List<T> spanning = new ArrayList<>();
    for (T item : items) {
      BoundingBox box = bounds.apply(item);
      if (box.x1() <= mid) {
        left.add(item);
      } else if (box.x0() >= mid) {
        right.add(item);
      } else {
        spanning.add(item);
      }
    }

    List<T> result = new ArrayList<>(items);
    boolean twoColumn =
        left.size() >= settings.getTwoColumnMinBlocksPerSide()
            && right.size() >= settings.getTwoColumnMinBlocksPerSide()
            && spanning.size() <= items.size() * settings.getTwoColumnMaxStraddleRatio();
    if (!twoColumn) {
      result.sort(Comparator.comparing(bounds, TOP_DOWN));
      return result;
    }

    spanning.sort(Comparator.comparing(bounds, TOP_DOWN));
    result.clear();
    for (int band = 0; band <= spanning.size(); band++) {
      float bandTop =
          band == 0 ? Float.NEGATIVE_INFINITY : bounds.apply(spanning.get(band - 1)).y0();
      float bandBottom =
          band == spanning.size() ? Float.POSITIVE_INFINITY : bounds.apply(spanning.get(band)).y0();
      result.addAll(inBand(left, bounds, bandTop, bandBottom));
      result.addAll(inBand(right, bounds, bandTop, bandBottom));
      if (band < spanning.size()) {
        result.add(spanning.get(band));
      }
    }
    return result;
  }

  private static <T> List<T> inBand(
      List<T> column, Function<T, BoundingBox> bounds, float top, float bottom) {
    List<T> result = new ArrayList<>();
    for (T item : column) {
      float y = bounds.apply(item).y0();
      if (y >= top && y < bottom) {
        result.add(item);
      }
    }
    result.sort(Comparator.comparing(bounds, TOP_DOWN));
    return result;
  }
}

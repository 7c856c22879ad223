package com.flamingo.ai.specchunker.ingestion.chunking;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.specchunker.config.IngestionConfig;
import com.flamingo.ai.specchunker.ingestion.model.BoundingBox;
import com.flamingo.ai.specchunker.ingestion.model.TextBlock;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("CaptionLocator Tests")
class CaptionLocatorTest {

  private static final BoundingBox TABLE = new BoundingBox(50, 300, 550, 500);
  private static final BoundingBox FIGURE = new BoundingBox(100, 200, 500, 400);

  private final CaptionLocator locator = new CaptionLocator(new IngestionConfig());

  private static TextBlock block(float y0, String text) {
    return TextBlock.of(new BoundingBox(50, y0, 400, y0 + 12), text);
  }

  @Test
  @DisplayName("should pick the nearest table caption above the table")
  void shouldPreferNearestCaptionAbove() {
    List<TextBlock> blocks =
        List.of(block(100, "Table 11 - Card states"), block(270, "Table 12 - Device status"));

    assertThat(locator.tableCaption(TABLE, blocks)).isEqualTo("Table 12 - Device status");
  }

  @Test
  @DisplayName("should fall back to a caption below the table within the search margin")
  void shouldFallBackToCaptionBelow() {
    assertThat(locator.tableCaption(TABLE, List.of(block(510, "Table 12 - Device status"))))
        .isEqualTo("Table 12 - Device status");
    assertThat(locator.tableCaption(TABLE, List.of(block(600, "Table 12 - Device status"))))
        .isEmpty();
  }

  @Test
  @DisplayName("should ignore blocks that are not captions")
  void shouldIgnoreNonCaptionBlocks() {
    assertThat(locator.tableCaption(TABLE, List.of(block(270, "Device status register"))))
        .isEmpty();
  }

  @Test
  @DisplayName("should find a figure caption above or below within the search margin")
  void shouldFindFigureCaption() {
    assertThat(locator.figureCaption(FIGURE, List.of(block(410, "Figure 3 - Bus timing"))))
        .isEqualTo("Figure 3 - Bus timing");
    assertThat(locator.figureCaption(FIGURE, List.of(block(170, "Figure 2 - Reset"))))
        .isEqualTo("Figure 2 - Reset");
    assertThat(locator.figureCaption(FIGURE, List.of(block(500, "Figure 3 - Bus timing"))))
        .isEmpty();
  }
}

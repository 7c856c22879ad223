package com.flamingo.ai.specchunker.ingestion.chunking;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.specchunker.config.IngestionConfig;
import com.flamingo.ai.specchunker.ingestion.classify.FigureRegion;
import com.flamingo.ai.specchunker.ingestion.model.BoundingBox;
import com.flamingo.ai.specchunker.ingestion.model.Chunk;
import com.flamingo.ai.specchunker.ingestion.model.ContentType;
import com.flamingo.ai.specchunker.ingestion.model.DrawingRegion;
import com.flamingo.ai.specchunker.ingestion.model.ImageRegion;
import com.flamingo.ai.specchunker.ingestion.model.TextBlock;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("FigureChunker Tests")
class FigureChunkerTest {

  private static final BoundingBox AREA = new BoundingBox(100, 200, 500, 400);
  private static final TextBlock CAPTION =
      TextBlock.of(new BoundingBox(100, 410, 300, 422), "Figure 3 - Bus timing");

  private final FigureChunker chunker =
      new FigureChunker(new CaptionLocator(new IngestionConfig()));
  private final ChunkFactory factory = new ChunkFactory("spec.pdf", "5.1", "eMMC", 1);

  private static FigureRegion timingDiagram() {
    return new FigureRegion(
        new DrawingRegion(AREA, 12),
        List.of(
            TextBlock.of(new BoundingBox(120, 220, 160, 232), "CLK"),
            TextBlock.of(new BoundingBox(120, 260, 160, 272), "CMD")));
  }

  @Test
  @DisplayName("should render the caption followed by the labels inside the figure")
  void shouldRenderCaptionAndLabels() {
    Chunk chunk = chunker.figure(timingDiagram(), List.of(CAPTION), 7, null, factory);

    assertThat(chunk.getContentType()).isEqualTo(ContentType.FIGURE);
    assertThat(chunk.getRawText()).isEqualTo("[Figure: Figure 3 - Bus timing]\nCLK\nCMD");
    assertThat(chunk.getFigureCaption()).isEqualTo("Figure 3 - Bus timing");
    assertThat(chunk.getPageStart()).isEqualTo(7);
    assertThat(chunk.getPageEnd()).isEqualTo(7);
  }

  @Test
  @DisplayName("should mark a figure without caption")
  void shouldMarkMissingCaption() {
    Chunk chunk = chunker.figure(timingDiagram(), List.of(), 7, null, factory);

    assertThat(chunk.getRawText()).isEqualTo("[Figure: (no caption)]\nCLK\nCMD");
    assertThat(chunk.getFigureCaption()).isNull();
  }

  @Test
  @DisplayName("should describe a bitmap by its caption only")
  void shouldDescribeBitmap() {
    ImageRegion image = new ImageRegion(AREA, 640, 480);

    Chunk captioned = chunker.bitmap(image, List.of(CAPTION), 7, null, factory);
    Chunk bare = chunker.bitmap(image, List.of(), 7, null, factory);

    assertThat(captioned.getContentType()).isEqualTo(ContentType.BITMAP);
    assertThat(captioned.getRawText()).isEqualTo("[Figure: Figure 3 - Bus timing]");
    assertThat(bare.getRawText()).isEqualTo("[Figure: bitmap image]");
    assertThat(bare.getFigureCaption()).isNull();
  }
}

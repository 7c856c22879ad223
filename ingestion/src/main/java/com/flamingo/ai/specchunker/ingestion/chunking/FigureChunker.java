package com.flamingo.ai.specchunker.ingestion.chunking;

import com.flamingo.ai.specchunker.ingestion.classify.FigureRegion;
import com.flamingo.ai.specchunker.ingestion.model.Chunk;
import com.flamingo.ai.specchunker.ingestion.model.ContentType;
import com.flamingo.ai.specchunker.ingestion.model.ImageRegion;
import com.flamingo.ai.specchunker.ingestion.model.TextBlock;
import com.flamingo.ai.specchunker.ingestion.structure.SectionNode;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * One chunk per figure: {@code [Figure: <caption>]} followed by the labels drawn inside it, one per
 * line. Bitmaps carry the caption only.
 */
@Component
@RequiredArgsConstructor
public class FigureChunker {

  static final String NO_CAPTION = "(no caption)";
  static final String BITMAP = "bitmap image";

  private final CaptionLocator captions;

  public Chunk figure(
      FigureRegion figure,
      List<TextBlock> pageBlocks,
      int page,
      SectionNode section,
      ChunkFactory factory) {
    String caption = captions.figureCaption(figure.drawing().bbox(), pageBlocks);
    StringBuilder body =
        new StringBuilder("[Figure: ").append(caption.isEmpty() ? NO_CAPTION : caption).append(']');
    for (TextBlock label : figure.annotations()) {
      String text = label.text().strip();
      if (!text.isEmpty() && !text.equals(caption)) {
        body.append('\n').append(text);
      }
    }
    return build(ContentType.FIGURE, caption, body.toString(), page, section, factory);
  }

  public Chunk bitmap(
      ImageRegion image,
      List<TextBlock> pageBlocks,
      int page,
      SectionNode section,
      ChunkFactory factory) {
    String caption = captions.figureCaption(image.bbox(), pageBlocks);
    String body = "[Figure: " + (caption.isEmpty() ? BITMAP : caption) + "]";
    return build(ContentType.BITMAP, caption, body, page, section, factory);
  }

  private static Chunk build(
      ContentType type,
      String caption,
      String body,
      int page,
      SectionNode section,
      ChunkFactory factory) {
    return factory
        .newChunk(type, section, page, page)
        .text(factory.prefix(section, page) + "\n" + body)
        .rawText(body)
        .figureCaption(caption.isEmpty() ? null : caption)
        .build();
  }
}

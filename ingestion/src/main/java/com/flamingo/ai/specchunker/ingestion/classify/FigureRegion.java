package com.flamingo.ai.specchunker.ingestion.classify;

import com.flamingo.ai.specchunker.ingestion.model.DrawingRegion;
import com.flamingo.ai.specchunker.ingestion.model.TextBlock;
import java.util.List;

/**
 * A drawing accepted as a figure, with the text blocks placed inside it.
 *
 * @param drawing the drawing cluster
 * @param annotations labels inside the drawing, in reading order
 */
public record FigureRegion(DrawingRegion drawing, List<TextBlock> annotations) {

  public FigureRegion {
    annotations = List.copyOf(annotations);
  }
}

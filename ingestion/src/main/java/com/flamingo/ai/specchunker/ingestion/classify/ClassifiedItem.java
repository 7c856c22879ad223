package com.flamingo.ai.specchunker.ingestion.classify;

import com.flamingo.ai.specchunker.ingestion.model.BoundingBox;
import com.flamingo.ai.specchunker.ingestion.model.ContentType;
import com.flamingo.ai.specchunker.ingestion.model.ImageRegion;
import com.flamingo.ai.specchunker.ingestion.model.TableRegion;
import com.flamingo.ai.specchunker.ingestion.model.TextBlock;

/**
 * One page element with its content type. Exactly one payload is set, depending on the type: a
 * text block for prose, register and definition items, a table, a figure or an image.
 *
 * @param type content type
 * @param bbox element bounds, used for reading order
 * @param block text payload
 * @param table table payload
 * @param normalizedTable normalized table payload
 * @param figure figure payload
 * @param image bitmap payload
 */
public record ClassifiedItem(
    ContentType type,
    BoundingBox bbox,
    TextBlock block,
    TableRegion table,
    NormalizedTable normalizedTable,
    FigureRegion figure,
    ImageRegion image) {

  public static ClassifiedItem text(ContentType type, TextBlock block) {
    return new ClassifiedItem(type, block.bbox(), block, null, null, null, null);
  }

  public static ClassifiedItem table(TableRegion table, NormalizedTable normalized) {
    return new ClassifiedItem(
        ContentType.TABLE, table.bbox(), null, table, normalized, null, null);
  }

  public static ClassifiedItem figure(FigureRegion figure) {
    return new ClassifiedItem(
        ContentType.FIGURE, figure.drawing().bbox(), null, null, null, figure, null);
  }

  public static ClassifiedItem bitmap(ImageRegion image) {
    return new ClassifiedItem(ContentType.BITMAP, image.bbox(), null, null, null, null, image);
  }
}

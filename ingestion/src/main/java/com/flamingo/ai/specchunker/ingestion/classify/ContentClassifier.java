package com.flamingo.ai.specchunker.ingestion.classify;

import com.flamingo.ai.specchunker.config.IngestionConfig;
import com.flamingo.ai.specchunker.ingestion.model.BoundingBox;
import com.flamingo.ai.specchunker.ingestion.model.ContentType;
import com.flamingo.ai.specchunker.ingestion.model.DrawingRegion;
import com.flamingo.ai.specchunker.ingestion.model.ImageRegion;
import com.flamingo.ai.specchunker.ingestion.model.PageModel;
import com.flamingo.ai.specchunker.ingestion.model.TableRegion;
import com.flamingo.ai.specchunker.ingestion.model.TextBlock;
import com.flamingo.ai.specchunker.ingestion.structure.SectionNode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Assigns a {@link ContentType} to every element of a page and resolves overlaps between the
 * page-content pass and the table-geometry pass.
 *
 * <p>Priority cascade, first match wins:
 *
 * <ol>
 *   <li>a table region with at least one data row is a {@code TABLE}; text blocks whose center
 *       lies inside it (within {@code centerTolerance}) are table content and are suppressed, as
 *       are drawings centered inside it (its rulings);
 *   <li>a drawing region of at least {@code minFigureArea} is a {@code FIGURE}; text blocks
 *       centered inside it become its annotations;
 *   <li>an image region is a {@code BITMAP};
 *   <li>a text block in a section whose title names a terminology vocabulary word is a {@code
 *       DEFINITION};
 *   <li>a text block with a register signature is a {@code REGISTER};
 *   <li>anything else is {@code TEXT}.
 * </ol>
 *
 * <p>A table region without data rows is demoted: it suppresses nothing, and when no text block
 * lies inside it its cell text becomes a synthetic text block. Classification depends only on the
 * page and section, so the same input always gives the same result.
 */
@Slf4j
@Component
public class ContentClassifier {

  private final IngestionConfig.Classification settings;
  private final TableNormalizer tableNormalizer;
  private final ReadingOrder readingOrder;

  public ContentClassifier(IngestionConfig config, TableNormalizer tableNormalizer) {
    this.settings = config.getClassification();
    this.tableNormalizer = tableNormalizer;
    this.readingOrder = new ReadingOrder(settings);
  }

  public PageClassification classify(PageModel page, SectionNode section) {
    float tolerance = settings.getCenterTolerance();
    int[] lowConfidence = {0};
    List<ClassifiedItem> items = new ArrayList<>();
    Set<TextBlock> claimed = Collections.newSetFromMap(new IdentityHashMap<>());

    // 1. tables
    List<TableRegion> accepted = new ArrayList<>();
    List<TableRegion> demoted = new ArrayList<>();
    for (TableRegion region : page.tableRegions()) {
      NormalizedTable normalized = tableNormalizer.normalize(region);
      if (normalized.isStructured()) {
        accepted.add(region);
        items.add(ClassifiedItem.table(region, normalized));
      } else {
        demoted.add(region);
      }
    }
    for (TextBlock block : page.textBlocks()) {
      for (TableRegion table : accepted) {
        if (centeredIn(block.bbox(), table.bbox(), tolerance, lowConfidence, page, "table")) {
          claimed.add(block);
          break;
        }
      }
    }
    List<TextBlock> synthetic = new ArrayList<>();
    for (TableRegion table : demoted) {
      boolean covered =
          page.textBlocks().stream()
              .anyMatch(b -> table.bbox().containsCenterOf(b.bbox(), tolerance));
      String text = table.plainText();
      log.debug(
          "Page {}: demoted table region at {} ({} rows)",
          page.pageNumber(),
          table.bbox(),
          table.rows().size());
      if (!covered && !text.isEmpty()) {
        synthetic.add(TextBlock.of(table.bbox(), text));
      }
    }

    // 2. figures
    for (DrawingRegion drawing : page.drawingRegions()) {
      boolean inTable =
          accepted.stream().anyMatch(t -> t.bbox().containsCenterOf(drawing.bbox(), tolerance));
      if (inTable || drawing.area() < settings.getMinFigureArea()) {
        continue;
      }
      List<TextBlock> annotations = new ArrayList<>();
      for (TextBlock block : page.textBlocks()) {
        if (claimed.contains(block)) {
          continue;
        }
        if (centeredIn(block.bbox(), drawing.bbox(), tolerance, lowConfidence, page, "figure")) {
          claimed.add(block);
          annotations.add(block);
        }
      }
      List<TextBlock> ordered = readingOrder.sort(annotations, TextBlock::bbox, page.width());
      items.add(ClassifiedItem.figure(new FigureRegion(drawing, ordered)));
    }

    // 3. bitmaps
    for (ImageRegion image : page.imageRegions()) {
      items.add(ClassifiedItem.bitmap(image));
    }

    // 4-6. prose
    for (TextBlock block : page.textBlocks()) {
      if (!claimed.contains(block)) {
        items.add(ClassifiedItem.text(classifyText(block, section), block));
      }
    }
    for (TextBlock block : synthetic) {
      items.add(ClassifiedItem.text(classifyText(block, section), block));
    }

    List<ClassifiedItem> ordered = readingOrder.sort(items, ClassifiedItem::bbox, page.width());
    if (lowConfidence[0] > 0) {
      log.debug("Page {}: {} low-confidence placement(s)", page.pageNumber(), lowConfidence[0]);
    }
    return new PageClassification(
        page.pageNumber(), section, ordered, page.textBlocks(), lowConfidence[0]);
  }

  /** Content type of a text block that no region claimed, in the context of {@code section}. */
  public ContentType classifyText(TextBlock block, SectionNode section) {
    if (isTerminologySection(section)) {
      return ContentType.DEFINITION;
    }
    if (RegisterSignature.matches(block.text())) {
      return ContentType.REGISTER;
    }
    return ContentType.TEXT;
  }

  public boolean isTerminologySection(SectionNode section) {
    if (section == null) {
      return false;
    }
    String title = section.getTitle().toLowerCase(Locale.ROOT);
    return settings.getTerminologyKeywords().stream()
        .anyMatch(keyword -> title.contains(keyword.toLowerCase(Locale.ROOT)));
  }

  private boolean centeredIn(
      BoundingBox block,
      BoundingBox region,
      float tolerance,
      int[] lowConfidence,
      PageModel page,
      String regionKind) {
    if (!region.containsCenterOf(block, tolerance)) {
      return false;
    }
    if (!region.containsCenterOf(block, 0f)) {
      lowConfidence[0]++;
      log.debug(
          "Page {}: block at {} assigned to {} at {} inside tolerance band",
          page.pageNumber(),
          block,
          regionKind,
          region);
    }
    return true;
  }
}

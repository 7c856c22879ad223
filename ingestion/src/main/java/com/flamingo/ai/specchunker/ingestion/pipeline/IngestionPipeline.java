package com.flamingo.ai.specchunker.ingestion.pipeline;

import com.flamingo.ai.specchunker.config.IngestionConfig;
import com.flamingo.ai.specchunker.exception.PageExtractionException;
import com.flamingo.ai.specchunker.ingestion.chunking.BuilderStep;
import com.flamingo.ai.specchunker.ingestion.chunking.CaptionLocator;
import com.flamingo.ai.specchunker.ingestion.chunking.ChunkFactory;
import com.flamingo.ai.specchunker.ingestion.chunking.DefinitionBuilderState;
import com.flamingo.ai.specchunker.ingestion.chunking.DefinitionChunker;
import com.flamingo.ai.specchunker.ingestion.chunking.FigureChunker;
import com.flamingo.ai.specchunker.ingestion.chunking.TableBuilderState;
import com.flamingo.ai.specchunker.ingestion.chunking.TableChunker;
import com.flamingo.ai.specchunker.ingestion.chunking.TableUnit;
import com.flamingo.ai.specchunker.ingestion.chunking.TextBuilderState;
import com.flamingo.ai.specchunker.ingestion.chunking.TextChunker;
import com.flamingo.ai.specchunker.ingestion.chunking.TextUnit;
import com.flamingo.ai.specchunker.ingestion.classify.ClassifiedItem;
import com.flamingo.ai.specchunker.ingestion.classify.ContentClassifier;
import com.flamingo.ai.specchunker.ingestion.classify.PageClassification;
import com.flamingo.ai.specchunker.ingestion.extraction.DocumentSource;
import com.flamingo.ai.specchunker.ingestion.extraction.PageExtractor;
import com.flamingo.ai.specchunker.ingestion.model.Chunk;
import com.flamingo.ai.specchunker.ingestion.model.ContentType;
import com.flamingo.ai.specchunker.ingestion.model.Glossary;
import com.flamingo.ai.specchunker.ingestion.model.IngestionResult;
import com.flamingo.ai.specchunker.ingestion.model.PageGap;
import com.flamingo.ai.specchunker.ingestion.model.PageModel;
import com.flamingo.ai.specchunker.ingestion.structure.DocumentStructure;
import com.flamingo.ai.specchunker.ingestion.structure.HeadingDetector;
import com.flamingo.ai.specchunker.ingestion.structure.HeadingMatch;
import com.flamingo.ai.specchunker.ingestion.structure.SectionNode;
import com.flamingo.ai.specchunker.ingestion.structure.StructureExtractor;
import com.flamingo.ai.specchunker.ingestion.structure.TocPageDetector;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.Executor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Runs one document through structure extraction, page extraction, classification and the chunk
 * builders.
 *
 * <p>Pages are extracted and classified ahead of time on the page-extraction pool and consumed
 * strictly in page order. The builder states belong to the run and are flushed at the end of the
 * document, or when the run is cancelled or hits its page limit. Chunks are returned ordered by
 * start page, then by the reading position of the item that opened them.
 */
@Service
@Slf4j
public class IngestionPipeline {

  private final IngestionConfig config;
  private final StructureExtractor structureExtractor;
  private final PageExtractor pageExtractor;
  private final ContentClassifier classifier;
  private final HeadingDetector headingDetector;
  private final TocPageDetector tocPageDetector;
  private final TextChunker textChunker;
  private final DefinitionChunker definitionChunker;
  private final TableChunker tableChunker;
  private final FigureChunker figureChunker;
  private final CaptionLocator captionLocator;
  private final ChunkQualityFilter qualityFilter;
  private final MeterRegistry meterRegistry;
  private final Executor pageExtractionExecutor;

  public IngestionPipeline(
      IngestionConfig config,
      StructureExtractor structureExtractor,
      PageExtractor pageExtractor,
      ContentClassifier classifier,
      HeadingDetector headingDetector,
      TocPageDetector tocPageDetector,
      TextChunker textChunker,
      DefinitionChunker definitionChunker,
      TableChunker tableChunker,
      FigureChunker figureChunker,
      CaptionLocator captionLocator,
      ChunkQualityFilter qualityFilter,
      MeterRegistry meterRegistry,
      @Qualifier("pageExtractionExecutor") Executor pageExtractionExecutor) {
    this.config = config;
    this.structureExtractor = structureExtractor;
    this.pageExtractor = pageExtractor;
    this.classifier = classifier;
    this.headingDetector = headingDetector;
    this.tocPageDetector = tocPageDetector;
    this.textChunker = textChunker;
    this.definitionChunker = definitionChunker;
    this.tableChunker = tableChunker;
    this.figureChunker = figureChunker;
    this.captionLocator = captionLocator;
    this.qualityFilter = qualityFilter;
    this.meterRegistry = meterRegistry;
    this.pageExtractionExecutor = pageExtractionExecutor;
  }

  public IngestionResult run(DocumentSource source, String label) {
    return run(source, label, 0, CancellationToken.none());
  }

  /**
   * Ingests {@code source}.
   *
   * @param source document to read; the caller closes it
   * @param label short document name for the context prefix
   * @param maxPages stop after this many pages; 0 or less reads every page
   * @param cancellation stop signal checked after every page
   * @return chunks, glossary and run statistics
   */
  @Timed(value = "ingestion.run", description = "Time to ingest one document")
  public IngestionResult run(
      DocumentSource source, String label, int maxPages, CancellationToken cancellation) {
    int totalPages = source.pageCount();
    int lastPage = maxPages > 0 ? Math.min(maxPages, totalPages) : totalPages;
    DocumentStructure structure =
        structureExtractor.extract(
            source.sourceId(), source.version(), totalPages, source.tableOfContents());
    log.info(
        "Ingesting {} ({} pages, body starts at page {}, {} sections)",
        source.sourceId(),
        totalPages,
        structure.getBodyStartPage(),
        structure.getSections().size());

    Run run =
        new Run(
            structure,
            new ChunkFactory(
                source.sourceId(), source.version(), label, structure.getBodyStartPage()));
    List<PageGap> gaps = new ArrayList<>();
    int lowConfidence = 0;
    boolean truncated = lastPage < totalPages;

    Executor executor =
        config.getExtraction().getWorkerThreads() > 0 ? pageExtractionExecutor : null;
    try (PagePrefetcher prefetcher =
        new PagePrefetcher(
            executor,
            config.getExtraction().getPrefetchDepth(),
            1,
            lastPage,
            page -> processPage(source, structure, page))) {
      while (prefetcher.hasNext()) {
        PageOutcome outcome = prefetcher.next();
        if (outcome.isGap()) {
          gaps.add(outcome.gap());
          run.onGap();
          meterRegistry.counter("ingestion.pages.skipped").increment();
        } else {
          PageClassification page = outcome.classification();
          distribute(run, page);
          lowConfidence += page.lowConfidenceCount();
          meterRegistry.counter("ingestion.pages.processed").increment();
        }
        if (cancellation.isCancelled() && outcome.pageNumber() < lastPage) {
          log.info(
              "Ingestion of {} cancelled after page {}", source.sourceId(), outcome.pageNumber());
          truncated = true;
          break;
        }
      }
    }
    run.finish();
    if (lowConfidence > 0) {
      meterRegistry.counter("ingestion.classification.low_confidence").increment(lowConfidence);
    }

    List<Chunk> emitted = run.emitted();
    Glossary glossary = new Glossary();
    for (Chunk chunk : emitted) {
      if (chunk.getContentType() == ContentType.DEFINITION) {
        glossary.put(chunk);
      }
      meterRegistry
          .counter("ingestion.chunks.emitted", "type", chunk.getContentType().wireName())
          .increment();
    }
    List<Chunk> ordered = run.ordered();

    IngestionResult result =
        IngestionResult.builder()
            .source(source.sourceId())
            .version(source.version())
            .totalPages(totalPages)
            .bodyStartPage(structure.getBodyStartPage())
            .chunks(List.copyOf(ordered))
            .indexableChunks(qualityFilter.indexable(ordered))
            .glossary(glossary)
            .skippedPages(List.copyOf(gaps))
            .lowConfidenceClassifications(lowConfidence)
            .truncated(truncated)
            .build();
    log.info(
        "Ingested {}: {} chunks ({} indexable), {} glossary terms, {} skipped pages{}",
        source.sourceId(),
        ordered.size(),
        result.getIndexableChunks().size(),
        glossary.size(),
        gaps.size(),
        truncated ? ", truncated" : "");
    return result;
  }

  private PageOutcome processPage(DocumentSource source, DocumentStructure structure, int page) {
    try {
      PageModel model = pageExtractor.extract(source, page);
      SectionNode section = structure.sectionForPage(page).orElse(null);
      return PageOutcome.processed(classifier.classify(model, section));
    } catch (PageExtractionException e) {
      log.warn(
          "Skipping page {} of {}: {}", e.getPageNumber(), source.sourceId(), e.getMessage());
      return PageOutcome.skipped(e.getPageNumber(), e.getMessage());
    }
  }

  private void distribute(Run run, PageClassification page) {
    int pageNumber = page.pageNumber();
    DocumentStructure structure = run.structure;
    if (structure.isTocPage(pageNumber)
        || (structure.isFrontMatterPage(pageNumber)
            && tocPageDetector.isTocListing(page.textBlocks()))) {
      log.debug("Page {} is a table of contents listing, skipped", pageNumber);
      run.endPage(pageNumber);
      return;
    }

    List<ClassifiedItem> items = page.items();
    List<HeadingMatch> headings = new ArrayList<>(items.size());
    boolean headingOpensSection = false;
    for (ClassifiedItem item : items) {
      HeadingMatch heading =
          isText(item) ? headingDetector.detect(item.block(), structure).orElse(null) : null;
      headings.add(heading);
      if (heading != null
          && heading.section() != null
          && heading.section().getStartPage() == pageNumber) {
        headingOpensSection = true;
      }
    }
    run.enterPage(pageNumber, headingOpensSection);

    int tableCount = (int) items.stream().filter(i -> i.type() == ContentType.TABLE).count();
    int tableIndex = 0;
    for (int i = 0; i < items.size(); i++) {
      ClassifiedItem item = items.get(i);
      run.nextItem();
      switch (item.type()) {
        case TABLE -> {
          TableUnit unit =
              new TableUnit(
                  item.bbox(),
                  item.normalizedTable(),
                  pageNumber,
                  run.section,
                  captionLocator.tableCaption(item.bbox(), page.textBlocks()),
                  tableIndex == 0,
                  tableIndex == tableCount - 1,
                  item.table().rows());
          tableIndex++;
          run.acceptTable(unit);
        }
        case FIGURE -> run.acceptFigure(
            figureChunker.figure(
                item.figure(), page.textBlocks(), pageNumber, run.section, run.factory));
        case BITMAP -> run.acceptFigure(
            figureChunker.bitmap(
                item.image(), page.textBlocks(), pageNumber, run.section, run.factory));
        default -> acceptText(run, page, item, headings.get(i));
      }
    }
    run.endPage(pageNumber);
  }

  private static boolean isText(ClassifiedItem item) {
    return item.type() != ContentType.TABLE
        && item.type() != ContentType.FIGURE
        && item.type() != ContentType.BITMAP;
  }

  private void acceptText(
      Run run, PageClassification page, ClassifiedItem item, HeadingMatch heading) {
    if (heading != null && heading.section() != null && heading.section() != run.section) {
      log.debug("Page {}: heading '{}' opens a new section", page.pageNumber(), heading.text());
      run.section = heading.section();
    }
    ContentType type = item.type();
    if (run.section != page.section()) {
      type = classifier.classifyText(item.block(), run.section);
    }
    TextUnit unit =
        new TextUnit(type, item.block().text(), page.pageNumber(), run.section, heading);
    if (type == ContentType.DEFINITION) {
      run.acceptDefinition(unit);
    } else {
      run.acceptText(unit);
    }
  }

  /** A chunk with the reading position of the item that opened it. */
  private record Placed(Chunk chunk, int anchor) {}

  /** Builder states and emitted chunks of one run. */
  private final class Run {

    private final DocumentStructure structure;
    private final ChunkFactory factory;
    private final List<Placed> placed = new ArrayList<>();

    private TextBuilderState text = TextBuilderState.empty();
    private DefinitionBuilderState definitions = DefinitionBuilderState.empty();
    private TableBuilderState tables = TableBuilderState.empty();
    private SectionNode section;

    private int cursor;
    private int textAnchor;
    private int definitionAnchor;
    private int tableAnchor;

    private Run(DocumentStructure structure, ChunkFactory factory) {
      this.structure = structure;
      this.factory = factory;
    }

    /**
     * Follows the page map at a page boundary. A section whose heading is detected on this page
     * takes over when its heading block is reached. Otherwise the first section starting on this
     * page is entered at the top of the page, and the mapped section at the latest on the next
     * page. The current section never moves back in TOC order.
     */
    void enterPage(int page, boolean headingOpensSection) {
      SectionNode mapped = structure.sectionForPage(page).orElse(null);
      if (mapped == null) {
        return;
      }
      SectionNode target;
      if (mapped.getStartPage() < page) {
        target = mapped;
      } else if (!headingOpensSection || section == null) {
        target = structure.firstSectionStartingOn(page).orElse(mapped);
      } else {
        return;
      }
      if (section == null || order(section) < order(target)) {
        section = target;
      }
    }

    private int order(SectionNode node) {
      return structure.getSections().indexOf(node);
    }

    void nextItem() {
      cursor++;
    }

    void acceptText(TextUnit unit) {
      emit(definitionChunker.finish(definitions, factory), definitionAnchor);
      definitions = DefinitionBuilderState.empty();
      if (text.isEmpty()) {
        textAnchor = cursor;
      }
      BuilderStep<TextBuilderState> step = textChunker.accept(text, unit, factory);
      emit(step.emitted(), textAnchor);
      text = step.state();
      if (!step.emitted().isEmpty()) {
        textAnchor = cursor;
      }
    }

    void acceptDefinition(TextUnit unit) {
      emit(textChunker.finish(text, factory), textAnchor);
      text = TextBuilderState.empty();
      if (definitions.isEmpty()) {
        definitionAnchor = cursor;
      }
      BuilderStep<DefinitionBuilderState> step =
          definitionChunker.accept(definitions, unit, factory);
      emit(step.emitted(), definitionAnchor);
      definitions = step.state();
      if (!step.emitted().isEmpty()) {
        definitionAnchor = cursor;
      }
    }

    void acceptTable(TableUnit unit) {
      BuilderStep<TableBuilderState> step = tableChunker.accept(tables, unit, factory);
      for (Chunk chunk : step.emitted()) {
        placed.add(new Placed(chunk, chunk.getPageStart() == unit.page() ? cursor : tableAnchor));
      }
      tables = step.state();
      if (!tables.isEmpty() && tables.pending().pageStart() == unit.page()) {
        tableAnchor = cursor;
      }
    }

    void acceptFigure(Chunk chunk) {
      placed.add(new Placed(chunk, cursor));
    }

    void endPage(int page) {
      BuilderStep<TableBuilderState> step = tableChunker.endPage(tables, page, factory);
      emit(step.emitted(), tableAnchor);
      tables = step.state();
    }

    void onGap() {
      emit(tableChunker.finish(tables, factory), tableAnchor);
      tables = TableBuilderState.empty();
    }

    void finish() {
      emit(textChunker.finish(text, factory), textAnchor);
      emit(definitionChunker.finish(definitions, factory), definitionAnchor);
      emit(tableChunker.finish(tables, factory), tableAnchor);
      text = TextBuilderState.empty();
      definitions = DefinitionBuilderState.empty();
      tables = TableBuilderState.empty();
    }

    private void emit(List<Chunk> chunks, int anchor) {
      for (Chunk chunk : chunks) {
        placed.add(new Placed(chunk, anchor));
      }
    }

    /** Chunks in emission order. */
    List<Chunk> emitted() {
      return placed.stream().map(Placed::chunk).toList();
    }

    /** Chunks by start page, then by the reading position that opened them. */
    List<Chunk> ordered() {
      return placed.stream()
          .sorted(
              Comparator.comparingInt((Placed p) -> p.chunk().getPageStart())
                  .thenComparingInt(Placed::anchor))
          .map(Placed::chunk)
          .toList();
    }
  }
}

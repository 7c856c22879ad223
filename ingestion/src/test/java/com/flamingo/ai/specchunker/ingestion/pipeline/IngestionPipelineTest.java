package com.flamingo.ai.specchunker.ingestion.pipeline;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.specchunker.config.IngestionConfig;
import com.flamingo.ai.specchunker.exception.PageExtractionException;
import com.flamingo.ai.specchunker.ingestion.chunking.CaptionLocator;
import com.flamingo.ai.specchunker.ingestion.chunking.DefinitionChunker;
import com.flamingo.ai.specchunker.ingestion.chunking.FigureChunker;
import com.flamingo.ai.specchunker.ingestion.chunking.InlineDefinitionScanner;
import com.flamingo.ai.specchunker.ingestion.chunking.TableChunker;
import com.flamingo.ai.specchunker.ingestion.chunking.TextChunker;
import com.flamingo.ai.specchunker.ingestion.classify.ContentClassifier;
import com.flamingo.ai.specchunker.ingestion.classify.TableNormalizer;
import com.flamingo.ai.specchunker.ingestion.extraction.DocumentSource;
import com.flamingo.ai.specchunker.ingestion.extraction.DrawingClusterer;
import com.flamingo.ai.specchunker.ingestion.extraction.PageContentReader;
import com.flamingo.ai.specchunker.ingestion.extraction.PageExtractor;
import com.flamingo.ai.specchunker.ingestion.extraction.TableGeometryReader;
import com.flamingo.ai.specchunker.ingestion.extraction.TextNormalizer;
import com.flamingo.ai.specchunker.ingestion.model.BoundingBox;
import com.flamingo.ai.specchunker.ingestion.model.Chunk;
import com.flamingo.ai.specchunker.ingestion.model.ContentType;
import com.flamingo.ai.specchunker.ingestion.model.IngestionResult;
import com.flamingo.ai.specchunker.ingestion.model.PageContent;
import com.flamingo.ai.specchunker.ingestion.model.PageGap;
import com.flamingo.ai.specchunker.ingestion.model.TableRegion;
import com.flamingo.ai.specchunker.ingestion.model.TextBlock;
import com.flamingo.ai.specchunker.ingestion.model.TocEntry;
import com.flamingo.ai.specchunker.ingestion.structure.HeadingDetector;
import com.flamingo.ai.specchunker.ingestion.structure.StructureExtractor;
import com.flamingo.ai.specchunker.ingestion.structure.TocPageDetector;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.IntConsumer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("IngestionPipeline Tests")
class IngestionPipelineTest {

  private static final float WIDTH = 612f;
  private static final float HEIGHT = 792f;

  private SimpleMeterRegistry meterRegistry;
  private IngestionPipeline pipeline;

  @BeforeEach
  void setUp() {
    IngestionConfig config = new IngestionConfig();
    config.getExtraction().setWorkerThreads(0);
    meterRegistry = new SimpleMeterRegistry();
    CaptionLocator captionLocator = new CaptionLocator(config);
    pipeline =
        new IngestionPipeline(
            config,
            new StructureExtractor(config),
            new PageExtractor(config, new TextNormalizer(config), new DrawingClusterer(config)),
            new ContentClassifier(config, new TableNormalizer(config)),
            new HeadingDetector(),
            new TocPageDetector(config),
            new TextChunker(config, new InlineDefinitionScanner(config)),
            new DefinitionChunker(config),
            new TableChunker(config, new TableNormalizer(config)),
            new FigureChunker(captionLocator),
            captionLocator,
            new ChunkQualityFilter(config),
            meterRegistry,
            Runnable::run);
  }

  private static TextBlock block(float y0, String text) {
    return TextBlock.of(new BoundingBox(72, y0, 540, y0 + 14), text);
  }

  /** Five pages: contents, scope, terminology, and a bus-modes clause with a table. */
  private static FakeSource specification() {
    FakeSource source = new FakeSource();
    source.toc.addAll(
        List.of(
            new TocEntry(1, "Contents", 1),
            new TocEntry(1, "1 Scope", 2),
            new TocEntry(1, "2 Terms and definitions", 3),
            new TocEntry(1, "3 Bus modes", 4)));
    source.page(1, block(100, "1 Scope ........ 2\n2 Terms and definitions ........ 3"));
    source.page(
        2,
        block(100, "1 Scope"),
        block(130, "This standard specifies the behaviour of the embedded device."));
    source.page(
        3,
        block(100, "2 Terms and definitions"),
        block(130, "ABC: Abbreviation for a bus clock\nCMD: Command token sent by the host"));
    source.page(
        4,
        block(100, "3 Bus modes"),
        block(130, "The threshold which is defined as the alpha value. Devices shall honour it."),
        block(200, "Table 1 - Mode list"));
    source.tables.put(
        4,
        List.of(
            new TableRegion(
                new BoundingBox(72, 220, 540, 300),
                List.of(
                    Arrays.asList("Index", "Name"),
                    Arrays.asList(null, "Range"),
                    Arrays.asList("1", "a"),
                    Arrays.asList("2", "b")))));
    source.page(5, block(100, "The selected mode stays active until the next reset."));
    return source;
  }

  @Test
  @DisplayName("should chunk a document by section, type and page in order")
  void shouldChunkDocument() {
    IngestionResult result = pipeline.run(specification(), "eMMC");

    List<Chunk> chunks = result.getChunks();
    assertThat(chunks)
        .extracting(Chunk::getContentType)
        .containsExactly(
            ContentType.TEXT,
            ContentType.DEFINITION,
            ContentType.DEFINITION,
            ContentType.TEXT,
            ContentType.DEFINITION,
            ContentType.TABLE);
    assertThat(chunks)
        .allSatisfy(c -> assertThat(c.getPageStart()).isLessThanOrEqualTo(c.getPageEnd()));
    assertThat(chunks).noneMatch(c -> c.getRawText().contains("........"));

    Chunk scope = chunks.get(0);
    assertThat(scope.getSectionPath()).containsExactly("1");
    assertThat(scope.getText()).startsWith("[eMMC 5.1 | 1 Scope | Page 2]\n1 Scope\n");
    assertThat(scope.isFrontMatter()).isFalse();

    Chunk table = chunks.get(5);
    assertThat(table.getTableMarkdown()).startsWith("| Index | Name Range |");
    assertThat(table.getFigureCaption()).isEqualTo("Table 1 - Mode list");

    Chunk busModes = chunks.get(3);
    assertThat(busModes.getPageStart()).isEqualTo(4);
    assertThat(busModes.getPageEnd()).isEqualTo(5);
    assertThat(busModes.isContainsInlineDefinition()).isTrue();

    assertThat(result.getGlossary().asMap().keySet()).containsExactly("ABC", "CMD", "threshold");
    assertThat(result.getBodyStartPage()).isEqualTo(2);
    assertThat(result.isTruncated()).isFalse();
    assertThat(result.getSkippedPages()).isEmpty();
  }

  @Test
  @DisplayName("should place prose above a table before the table on the same page")
  void shouldOrderChunksByReadingPosition() {
    List<Chunk> chunks = pipeline.run(specification(), "eMMC").getChunks();

    List<Chunk> pageFour = chunks.stream().filter(c -> c.getPageStart() == 4).toList();
    assertThat(pageFour)
        .extracting(Chunk::getContentType)
        .containsExactly(ContentType.TEXT, ContentType.DEFINITION, ContentType.TABLE);
    assertThat(pageFour.get(0).getRawText()).startsWith("3 Bus modes");
  }

  @Test
  @DisplayName("should enter a section whose heading block is missing at its start page")
  void shouldEnterSection_whenHeadingBlockMissing() {
    FakeSource source = new FakeSource();
    source.toc.addAll(List.of(new TocEntry(1, "1 Definitions", 1), new TocEntry(1, "2 Body", 2)));
    source.page(1, block(100, "ABC: means something"));
    source.page(
        2,
        block(100, "The threshold which is defined as the alpha value. Devices shall honour it."));
    source.page(3, block(100, "Body text on page three continues here."));

    IngestionResult result = pipeline.run(source, "eMMC");

    List<Chunk> chunks = result.getChunks();
    assertThat(chunks)
        .extracting(Chunk::getContentType)
        .containsExactly(ContentType.DEFINITION, ContentType.TEXT, ContentType.DEFINITION);
    Chunk abc = chunks.get(0);
    assertThat(abc.getPageStart()).isEqualTo(1);
    assertThat(abc.getPageEnd()).isEqualTo(1);
    assertThat(abc.getSectionPath()).containsExactly("1");
    Chunk body = chunks.get(1);
    assertThat(body.getSectionPath()).containsExactly("2");
    assertThat(body.getPageStart()).isEqualTo(2);
    assertThat(body.getPageEnd()).isEqualTo(3);
    assertThat(body.isContainsInlineDefinition()).isTrue();
    assertThat(result.getGlossary().asMap().keySet()).containsExactly("ABC", "threshold");
  }

  @Test
  @DisplayName("should split a page that opens several top-level sections")
  void shouldSplitSectionsSharingStartPage() {
    FakeSource source = new FakeSource();
    source.toc.addAll(
        List.of(
            new TocEntry(1, "1 Scope", 2),
            new TocEntry(1, "2 Normative references", 2),
            new TocEntry(1, "3 Overview", 2)));
    source.page(1, block(100, "Prepared by the memory device committee."));
    source.page(
        2,
        block(100, "1 Scope"),
        block(130, "This standard covers the embedded device."),
        block(200, "2 Normative references"),
        block(230, "The referenced documents are listed here."),
        block(300, "3 Overview"),
        block(330, "The device exposes a single bus."));

    IngestionResult result = pipeline.run(source, "eMMC");

    assertThat(result.getBodyStartPage()).isEqualTo(2);
    List<Chunk> chunks = result.getChunks();
    assertThat(chunks).hasSize(4);
    assertThat(chunks.get(0).isFrontMatter()).isTrue();
    assertThat(chunks.get(0).getSectionPath()).isEmpty();
    assertThat(chunks.subList(1, 4))
        .extracting(c -> String.join(".", c.getSectionPath()))
        .containsExactly("1", "2", "3");
    assertThat(chunks.subList(1, 4)).noneMatch(Chunk::isFrontMatter);
    assertThat(chunks.get(3).getRawText()).contains("single bus");
  }

  @Test
  @DisplayName("should mark chunks before the first body section as front matter")
  void shouldMarkFrontMatterChunks() {
    FakeSource source = new FakeSource();
    source.toc.addAll(
        List.of(
            new TocEntry(1, "Foreword", 2),
            new TocEntry(1, "List of tables", 10),
            new TocEntry(1, "1 Scope", 21)));
    for (int page = 1; page <= 22; page++) {
      source.page(page, block(100, "Paragraph on page " + page + " describes the device."));
    }

    IngestionResult result = pipeline.run(source, "eMMC");

    assertThat(result.getBodyStartPage()).isEqualTo(21);
    List<Chunk> chunks = result.getChunks();
    assertThat(chunks).anyMatch(Chunk::isFrontMatter);
    assertThat(chunks).anyMatch(c -> !c.isFrontMatter());
    assertThat(chunks)
        .allSatisfy(
            c -> {
              if (c.getPageEnd() < 21) {
                assertThat(c.isFrontMatter()).isTrue();
              } else {
                assertThat(c.getPageStart()).isGreaterThanOrEqualTo(21);
                assertThat(c.isFrontMatter()).isFalse();
              }
            });
  }

  @Test
  @DisplayName("should record metrics for pages and emitted chunks")
  void shouldRecordMetrics() {
    pipeline.run(specification(), "eMMC");

    assertThat(meterRegistry.counter("ingestion.pages.processed").count()).isEqualTo(5.0);
    assertThat(meterRegistry.counter("ingestion.chunks.emitted", "type", "definition").count())
        .isEqualTo(3.0);
  }

  @Test
  @DisplayName("should skip an unreadable page, record the gap and keep going")
  void shouldRecordGapForUnreadablePage() {
    FakeSource source = specification();
    source.failing.add(5);

    IngestionResult result = pipeline.run(source, "eMMC");

    assertThat(result.getSkippedPages()).containsExactly(new PageGap(5, "unreadable page 5"));
    assertThat(result.getChunks()).extracting(Chunk::getContentType).contains(ContentType.TABLE);
    assertThat(result.getChunks()).allSatisfy(c -> assertThat(c.getPageEnd()).isLessThan(5));
    assertThat(result.stats().getSkippedPages()).isEqualTo(1);
  }

  @Test
  @DisplayName("should stop at the page limit and flush what was buffered")
  void shouldStopAtPageLimit() {
    IngestionResult result =
        pipeline.run(specification(), "eMMC", 3, new CancellationToken());

    assertThat(result.isTruncated()).isTrue();
    assertThat(result.getChunks())
        .extracting(Chunk::getContentType)
        .containsExactly(ContentType.TEXT, ContentType.DEFINITION, ContentType.DEFINITION);
  }

  @Test
  @DisplayName("should stop after the current page when cancelled")
  void shouldStopWhenCancelled() {
    CancellationToken cancellation = new CancellationToken();
    FakeSource source = specification();
    source.onRead = page -> {
      if (page == 3) {
        cancellation.cancel();
      }
    };

    IngestionResult result = pipeline.run(source, "eMMC", 0, cancellation);

    assertThat(result.isTruncated()).isTrue();
    assertThat(result.getChunks()).isNotEmpty();
    assertThat(result.getChunks()).allSatisfy(c -> assertThat(c.getPageEnd()).isLessThan(4));
  }

  @Test
  @DisplayName("should treat a document without bookmarks as a single section")
  void shouldHandleMissingToc() {
    FakeSource source = new FakeSource();
    source.page(1, block(100, "The device supports a single bus mode only."));

    IngestionResult result = pipeline.run(source, "eMMC");

    assertThat(result.getChunks()).hasSize(1);
    assertThat(result.getChunks().get(0).getSectionTitle()).isEqualTo("Document");
  }

  private static final class FakeSource implements DocumentSource {

    private final List<TocEntry> toc = new ArrayList<>();
    private final Map<Integer, List<TextBlock>> blocks = new HashMap<>();
    private final Map<Integer, List<TableRegion>> tables = new HashMap<>();
    private final Set<Integer> failing = new HashSet<>();
    private IntConsumer onRead = page -> {};

    void page(int number, TextBlock... pageBlocks) {
      blocks.put(number, List.of(pageBlocks));
    }

    @Override
    public String sourceId() {
      return "spec.pdf";
    }

    @Override
    public String version() {
      return "5.1";
    }

    @Override
    public int pageCount() {
      return blocks.size();
    }

    @Override
    public List<TocEntry> tableOfContents() {
      return toc;
    }

    @Override
    public PageContentReader pageContentReader() {
      return page -> {
        onRead.accept(page);
        if (failing.contains(page)) {
          throw new PageExtractionException(page, "unreadable page " + page);
        }
        return new PageContent(
            page, WIDTH, HEIGHT, blocks.getOrDefault(page, List.of()), List.of(), List.of());
      };
    }

    @Override
    public TableGeometryReader tableGeometryReader() {
      return page -> tables.getOrDefault(page, List.of());
    }

    @Override
    public void close() {}
  }
}

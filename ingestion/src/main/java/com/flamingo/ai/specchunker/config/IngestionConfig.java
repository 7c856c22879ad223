package com.flamingo.ai.specchunker.config;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the ingestion pipeline. */
@Configuration
@ConfigurationProperties(prefix = "ingestion")
@Getter
@Setter
public class IngestionConfig {

  private Document document = new Document();
  private Structure structure = new Structure();
  private Extraction extraction = new Extraction();
  private Classification classification = new Classification();
  private Chunking chunking = new Chunking();
  private Table table = new Table();
  private Figure figure = new Figure();
  private Definition definition = new Definition();
  private Indexing indexing = new Indexing();
  private Output output = new Output();

  /** Identity of the document being ingested, used in every chunk's context prefix. */
  @Getter
  @Setter
  public static class Document {
    /** Short name printed in the context prefix, e.g. "eMMC". Empty means use the file stem. */
    private String label = "";

    /** Version/edition tag. Empty means derive it from the file name. */
    private String version = "";
  }

  @Getter
  @Setter
  public static class Structure {
    /** Level-1 TOC titles that never mark the start of the body. */
    private List<String> frontMatterKeywords =
        new ArrayList<>(
            List.of(
                "cover",
                "contents",
                "table of contents",
                "figures",
                "list of figures",
                "tables",
                "list of tables",
                "foreword",
                "preface",
                "legal notice",
                "notice"));

    /** TOC entry titles whose page range is the table of contents itself. */
    private List<String> tocTitles =
        new ArrayList<>(List.of("contents", "table of contents"));

    /** Share of a front-matter page's lines that must look like TOC lines to skip the page. */
    private double tocListingLineRatio = 0.5;
  }

  @Getter
  @Setter
  public static class Extraction {
    /** Blocks entirely inside this top band (pt) are running headers and are dropped. */
    private float headerMargin = 60.0f;

    /** Blocks entirely inside this bottom band (pt) are running footers and are dropped. */
    private float footerMargin = 60.0f;

    /** Padding (pt) used when merging vector drawing elements into clusters. */
    private float drawingClusterPadding = 4.0f;

    /** Regular expressions removed from extracted text (watermarks, running titles). */
    private List<String> noisePatterns = new ArrayList<>(List.of("(?im)^\\s*Page\\s+\\d+\\s*$"));

    /** Tolerance (pt) for snapping ruling lines onto the same grid coordinate. */
    private float rulingSnapTolerance = 3.0f;

    /** Ruling segments shorter than this (pt) are ignored. */
    private float minRulingLength = 3.0f;

    /** Tables wider than this many columns are checked for false-positive heading rules. */
    private int maxPlausibleColumns = 8;

    /** Minimum cell fill rate for a table wider than {@code maxPlausibleColumns}. */
    private double minWideTableFillRate = 0.4;

    /** Worker threads for page extraction look-ahead; 0 extracts on the calling thread. */
    private int workerThreads = 2;

    /** Maximum number of pages extracted ahead of the builders. */
    private int prefetchDepth = 4;
  }

  @Getter
  @Setter
  public static class Classification {
    /** Tolerance (pt) around a region's box for the center-in-box test. */
    private float centerTolerance = 2.0f;

    /** Minimum bounding area (pt²) for a drawing cluster to count as a figure. */
    private float minFigureArea = 5000.0f;

    /** Section-title vocabulary that marks a terminology section (case-insensitive). */
    private List<String> terminologyKeywords =
        new ArrayList<>(List.of("definition", "abbreviation", "glossary"));

    /** Minimum blocks on each side of the midline before a page is read as two columns. */
    private int twoColumnMinBlocksPerSide = 2;

    /** Maximum share of blocks straddling the midline on a two-column page. */
    private double twoColumnMaxStraddleRatio = 0.2;
  }

  @Getter
  @Setter
  public static class Chunking {
    /** Characters per token-equivalent. */
    private int charsPerToken = 4;

    /** Buffer size (tokens) after which prose is flushed at the next sentence boundary. */
    private int highWaterTokens = 800;

    /** Hard ceiling (tokens) above which even atomic register descriptions are split. */
    private int hardCeilingTokens = 1200;
  }

  @Getter
  @Setter
  public static class Table {
    /** Serialized size (chars) above which a table is split into row groups. */
    private int maxTableChars = 6000;

    /** Left/right edge alignment tolerance (pt) for cross-page table continuation. */
    private float continuationTolerance = 5.0f;

    /** Marker that starts a trailing note row. */
    private String noteMarker = "NOTE";

    /** Also emit one small chunk per key group, linked to the full-table chunk. */
    private boolean rowGroupChunks = false;
  }

  @Getter
  @Setter
  public static class Figure {
    /** Vertical distance (pt) searched above and below a figure for its caption. */
    private float captionSearchMargin = 40.0f;
  }

  @Getter
  @Setter
  public static class Definition {
    /** Minimum length of a definition body. */
    private int minDefinitionChars = 5;

    /** Maximum length of a definition body. */
    private int maxDefinitionChars = 300;

    /** Maximum number of words in an inline-derived term. */
    private int maxInlineTermWords = 4;
  }

  /** Rules for the indexable view of the chunk stream. */
  @Getter
  @Setter
  public static class Indexing {
    /** Minimum raw body length per content type; shorter chunks are stubs. */
    private Map<String, Integer> minRawChars =
        new LinkedHashMap<>(
            Map.of(
                "text", 20,
                "table", 80,
                "figure", 30,
                "bitmap", 30,
                "definition", 8,
                "register", 40));

    /** Minimum raw body length for row-group table chunks. */
    private int minRowChunkChars = 25;

    /** Bodies matching one of these patterns are continuation markers or margin leftovers. */
    private List<String> noisePatterns =
        new ArrayList<>(
            List.of(
                "(?i)^(cont'd|continued|continued\\s+on\\s+next\\s+page"
                    + "|to\\s+be\\s+continued)\\.?$"));
  }

  @Getter
  @Setter
  public static class Output {
    /** Directory receiving the JSONL, glossary and manifest files. */
    private String directory = "data/processed";
  }
}

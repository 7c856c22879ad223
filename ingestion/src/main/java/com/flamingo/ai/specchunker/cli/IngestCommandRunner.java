package com.flamingo.ai.specchunker.cli;

import com.flamingo.ai.specchunker.config.IngestionConfig;
import com.flamingo.ai.specchunker.exception.DocumentProcessingException;
import com.flamingo.ai.specchunker.ingestion.model.IngestionResult;
import com.flamingo.ai.specchunker.ingestion.model.IngestionStats;
import com.flamingo.ai.specchunker.service.DocumentIngestionService;
import java.nio.file.Path;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

/**
 * Command line: {@code --pdf=<file|dir> [--output=<dir>] [--max-pages=<n>]}.
 *
 * <p>Exits with 1 when a document cannot be ingested and 2 on invalid arguments.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class IngestCommandRunner implements ApplicationRunner, ExitCodeGenerator {

  static final String PDF_OPTION = "pdf";
  static final String OUTPUT_OPTION = "output";
  static final String MAX_PAGES_OPTION = "max-pages";

  private static final String USAGE =
      "Usage: --pdf=<file|directory> [--output=<directory>] [--max-pages=<n>]";

  private final DocumentIngestionService ingestionService;
  private final IngestionConfig config;

  private int exitCode;

  @Override
  public void run(ApplicationArguments args) {
    if (!args.containsOption(PDF_OPTION)) {
      log.info(USAGE);
      return;
    }
    Path input = Path.of(single(args, PDF_OPTION, ""));
    Path output =
        Path.of(
            args.containsOption(OUTPUT_OPTION)
                ? single(args, OUTPUT_OPTION, config.getOutput().getDirectory())
                : config.getOutput().getDirectory());
    int maxPages;
    try {
      maxPages = Integer.parseInt(single(args, MAX_PAGES_OPTION, "0"));
    } catch (NumberFormatException e) {
      log.error("--{} must be a number. {}", MAX_PAGES_OPTION, USAGE);
      exitCode = 2;
      return;
    }

    try {
      List<IngestionResult> results = ingestionService.ingest(input, output, maxPages);
      results.forEach(IngestCommandRunner::printStats);
    } catch (DocumentProcessingException e) {
      log.error("{}: {}", e.getUserMessage(), e.getMessage());
      exitCode = 1;
    }
  }

  @Override
  public int getExitCode() {
    return exitCode;
  }

  private static String single(ApplicationArguments args, String name, String fallback) {
    List<String> values = args.getOptionValues(name);
    return values == null || values.isEmpty() ? fallback : values.get(values.size() - 1);
  }

  private static void printStats(IngestionResult result) {
    IngestionStats stats = result.stats();
    log.info(
        "{} {}: pages={} bodyStart={} chunks={} indexable={} frontMatter={} glossary={}"
            + " skippedPages={} lowConfidence={} truncated={} byType={}",
        result.getSource(),
        result.getVersion(),
        stats.getTotalPages(),
        stats.getBodyStartPage(),
        stats.getTotalChunks(),
        stats.getIndexableChunks(),
        stats.getFrontMatterChunks(),
        stats.getGlossaryTerms(),
        stats.getSkippedPages(),
        stats.getLowConfidenceClassifications(),
        stats.isTruncated(),
        stats.getChunksByType());
  }
}

package com.flamingo.ai.specchunker.service;

import com.flamingo.ai.specchunker.config.IngestionConfig;
import com.flamingo.ai.specchunker.exception.DocumentProcessingException;
import com.flamingo.ai.specchunker.ingestion.extraction.PdfBoxDocumentSource;
import com.flamingo.ai.specchunker.ingestion.model.IngestionResult;
import com.flamingo.ai.specchunker.ingestion.pipeline.CancellationToken;
import com.flamingo.ai.specchunker.ingestion.pipeline.IngestionPipeline;
import com.flamingo.ai.specchunker.output.IngestionOutputWriter;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Ingests PDF files from disk and writes their outputs.
 *
 * <p>A directory input ingests every {@code *.pdf} in it, in file-name order. A document that
 * fails is logged and counted and the batch moves on; the batch then fails once every document
 * has been tried.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DocumentIngestionService {

  private static final String PDF_EXTENSION = ".pdf";

  private final IngestionPipeline pipeline;
  private final IngestionOutputWriter outputWriter;
  private final IngestionConfig config;
  private final MeterRegistry meterRegistry;

  /**
   * Ingests a PDF file or every PDF in a directory.
   *
   * @param input PDF file or directory
   * @param outputDirectory directory receiving the output files
   * @param maxPages page limit per document; 0 or less reads every page
   * @return results of the documents that were ingested
   * @throws DocumentProcessingException if the input does not exist, holds no PDF, or a document
   *     of the batch failed
   */
  public List<IngestionResult> ingest(Path input, Path outputDirectory, int maxPages) {
    List<Path> pdfs = listInputs(input);
    List<IngestionResult> results = new ArrayList<>();
    List<String> failed = new ArrayList<>();
    for (Path pdf : pdfs) {
      try {
        results.add(ingestFile(pdf, outputDirectory, maxPages));
      } catch (DocumentProcessingException e) {
        if (pdfs.size() == 1) {
          throw e;
        }
        log.error("Failed to ingest {}: {}", pdf, e.getMessage(), e);
        failed.add(pdf.getFileName().toString());
      }
    }
    if (!failed.isEmpty()) {
      throw new DocumentProcessingException(
          input.toString(),
          failed.size() + " of " + pdfs.size() + " documents failed: " + String.join(", ", failed),
          "Some documents could not be ingested");
    }
    return results;
  }

  /** Ingests one PDF file and writes its outputs. */
  public IngestionResult ingestFile(Path pdf, Path outputDirectory, int maxPages) {
    String stem = stem(pdf);
    String label = config.getDocument().getLabel();
    if (label == null || label.isBlank()) {
      label = stem;
    }
    try (PdfBoxDocumentSource source = PdfBoxDocumentSource.open(pdf, config)) {
      IngestionResult result = pipeline.run(source, label, maxPages, CancellationToken.none());
      outputWriter.write(result, stem, label, outputDirectory);
      meterRegistry.counter("ingestion.documents.success").increment();
      return result;
    } catch (DocumentProcessingException e) {
      meterRegistry.counter("ingestion.documents.failure").increment();
      throw e;
    }
  }

  private List<Path> listInputs(Path input) {
    if (Files.isRegularFile(input)) {
      return List.of(input);
    }
    if (!Files.isDirectory(input)) {
      throw new DocumentProcessingException(
          input.toString(), "Input not found: " + input, "The input path does not exist");
    }
    List<Path> pdfs;
    try (Stream<Path> files = Files.list(input)) {
      pdfs =
          files
              .filter(Files::isRegularFile)
              .filter(DocumentIngestionService::isPdf)
              .sorted()
              .toList();
    } catch (IOException e) {
      throw new DocumentProcessingException(
          input.toString(), "Failed to list " + input + ": " + e.getMessage(), e);
    }
    if (pdfs.isEmpty()) {
      throw new DocumentProcessingException(
          input.toString(), "No PDF files in " + input, "The directory holds no PDF files");
    }
    log.info("Found {} PDF files in {}", pdfs.size(), input);
    return pdfs;
  }

  private static boolean isPdf(Path file) {
    return file.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(PDF_EXTENSION);
  }

  static String stem(Path file) {
    String name = file.getFileName().toString();
    int dot = name.lastIndexOf('.');
    return dot > 0 ? name.substring(0, dot) : name;
  }
}

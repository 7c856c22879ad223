package com.flamingo.ai.specchunker.output;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.flamingo.ai.specchunker.exception.DocumentProcessingException;
import com.flamingo.ai.specchunker.ingestion.model.Chunk;
import com.flamingo.ai.specchunker.ingestion.model.IngestionResult;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Writes the outputs of one run: {@code <stem>_chunks.jsonl} with one chunk per line, {@code
 * <stem>_glossary.json} keyed by term and {@code <stem>_manifest.json} with the run statistics.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class IngestionOutputWriter {

  static final String CHUNKS_SUFFIX = "_chunks.jsonl";
  static final String GLOSSARY_SUFFIX = "_glossary.json";
  static final String MANIFEST_SUFFIX = "_manifest.json";

  private final ObjectMapper objectMapper;

  /**
   * Writes every output file for {@code result} into {@code directory}, creating it if needed.
   *
   * @return path of the chunk file
   */
  public Path write(IngestionResult result, String stem, String label, Path directory) {
    Path chunksFile = directory.resolve(stem + CHUNKS_SUFFIX);
    Path glossaryFile = directory.resolve(stem + GLOSSARY_SUFFIX);
    Path manifestFile = directory.resolve(stem + MANIFEST_SUFFIX);
    ObjectWriter pretty = objectMapper.writerWithDefaultPrettyPrinter();
    try {
      Files.createDirectories(directory);
      try (BufferedWriter out = Files.newBufferedWriter(chunksFile, StandardCharsets.UTF_8)) {
        for (Chunk chunk : result.getChunks()) {
          out.write(objectMapper.writeValueAsString(chunk));
          out.newLine();
        }
      }
      pretty.writeValue(glossaryFile.toFile(), result.getGlossary());
      pretty.writeValue(
          manifestFile.toFile(),
          IngestionManifest.of(
              result,
              label,
              chunksFile.getFileName().toString(),
              glossaryFile.getFileName().toString()));
    } catch (IOException e) {
      throw new DocumentProcessingException(
          result.getSource(),
          "Failed to write output to " + directory + ": " + e.getMessage(),
          e);
    }
    log.info(
        "Wrote {} chunks to {} and {} glossary terms to {}",
        result.getChunks().size(),
        chunksFile,
        result.getGlossary().size(),
        glossaryFile);
    return chunksFile;
  }
}

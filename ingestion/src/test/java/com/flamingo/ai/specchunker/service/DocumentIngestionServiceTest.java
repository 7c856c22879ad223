package com.flamingo.ai.specchunker.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.specchunker.config.IngestionConfig;
import com.flamingo.ai.specchunker.exception.DocumentProcessingException;
import com.flamingo.ai.specchunker.ingestion.extraction.DocumentSource;
import com.flamingo.ai.specchunker.ingestion.model.IngestionResult;
import com.flamingo.ai.specchunker.ingestion.pipeline.CancellationToken;
import com.flamingo.ai.specchunker.ingestion.pipeline.IngestionPipeline;
import com.flamingo.ai.specchunker.output.IngestionOutputWriter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("DocumentIngestionService Tests")
class DocumentIngestionServiceTest {

  @TempDir Path tempDir;

  @Mock private IngestionPipeline pipeline;

  @Mock private IngestionOutputWriter outputWriter;

  private IngestionConfig config;
  private SimpleMeterRegistry meterRegistry;
  private DocumentIngestionService service;
  private Path outputDir;

  @BeforeEach
  void setUp() {
    config = new IngestionConfig();
    meterRegistry = new SimpleMeterRegistry();
    service = new DocumentIngestionService(pipeline, outputWriter, config, meterRegistry);
    outputDir = tempDir.resolve("out");

    when(pipeline.run(
            any(DocumentSource.class), anyString(), anyInt(), any(CancellationToken.class)))
        .thenAnswer(
            invocation -> {
              DocumentSource source = invocation.getArgument(0);
              return IngestionResult.builder()
                  .source(source.sourceId())
                  .version(source.version())
                  .totalPages(source.pageCount())
                  .chunks(List.of())
                  .indexableChunks(List.of())
                  .build();
            });
  }

  private Path writePdf(Path file) throws IOException {
    try (PDDocument document = new PDDocument()) {
      document.addPage(new PDPage());
      document.save(file.toFile());
    }
    return file;
  }

  private double counter(String name) {
    return meterRegistry.counter(name).count();
  }

  @Test
  @DisplayName("should ingest a single file using its stem as label")
  void shouldIngestSingleFile_whenLabelNotConfigured() throws IOException {
    Path pdf = writePdf(tempDir.resolve("JESD84-B51.pdf"));

    List<IngestionResult> results = service.ingest(pdf, outputDir, 0);

    assertThat(results).hasSize(1);
    assertThat(results.get(0).getSource()).isEqualTo("JESD84-B51.pdf");
    assertThat(results.get(0).getVersion()).isEqualTo("5.1");
    verify(pipeline).run(any(DocumentSource.class), eq("JESD84-B51"), eq(0), any());
    verify(outputWriter).write(any(), eq("JESD84-B51"), eq("JESD84-B51"), eq(outputDir));
    assertThat(counter("ingestion.documents.success")).isEqualTo(1.0);
  }

  @Test
  @DisplayName("should use the configured label and pass the page limit")
  void shouldUseConfiguredLabel() throws IOException {
    config.getDocument().setLabel("eMMC");
    Path pdf = writePdf(tempDir.resolve("JESD84-B51.pdf"));

    service.ingest(pdf, outputDir, 40);

    verify(pipeline).run(any(DocumentSource.class), eq("eMMC"), eq(40), any());
    verify(outputWriter).write(any(), eq("JESD84-B51"), eq("eMMC"), eq(outputDir));
  }

  @Test
  @DisplayName("should ingest every PDF of a directory in file-name order")
  void shouldIngestDirectoryInOrder() throws IOException {
    Path inputDir = Files.createDirectory(tempDir.resolve("specs"));
    writePdf(inputDir.resolve("b-spec.pdf"));
    writePdf(inputDir.resolve("a-spec.PDF"));
    Files.writeString(inputDir.resolve("notes.txt"), "not a document");

    List<IngestionResult> results = service.ingest(inputDir, outputDir, 0);

    assertThat(results)
        .extracting(IngestionResult::getSource)
        .containsExactly("a-spec.PDF", "b-spec.pdf");
    InOrder order = inOrder(outputWriter);
    order.verify(outputWriter).write(any(), eq("a-spec"), eq("a-spec"), eq(outputDir));
    order.verify(outputWriter).write(any(), eq("b-spec"), eq("b-spec"), eq(outputDir));
    assertThat(counter("ingestion.documents.success")).isEqualTo(2.0);
  }

  @Test
  @DisplayName("should continue a batch past a broken file and fail at the end")
  void shouldContinueBatch_whenOneDocumentFails() throws IOException {
    Path inputDir = Files.createDirectory(tempDir.resolve("specs"));
    Files.writeString(inputDir.resolve("broken.pdf"), "this is not a PDF");
    writePdf(inputDir.resolve("good.pdf"));

    assertThatThrownBy(() -> service.ingest(inputDir, outputDir, 0))
        .isInstanceOf(DocumentProcessingException.class)
        .hasMessage("1 of 2 documents failed: broken.pdf");

    verify(outputWriter).write(any(), eq("good"), eq("good"), eq(outputDir));
    assertThat(counter("ingestion.documents.success")).isEqualTo(1.0);
  }

  @Test
  @DisplayName("should rethrow the failure of a single file")
  void shouldRethrow_whenSingleFileFails() throws IOException {
    Path broken = Files.writeString(tempDir.resolve("broken.pdf"), "this is not a PDF");

    assertThatThrownBy(() -> service.ingest(broken, outputDir, 0))
        .isInstanceOf(DocumentProcessingException.class)
        .extracting("source")
        .isEqualTo("broken.pdf");

    verify(outputWriter, never()).write(any(), anyString(), anyString(), any());
  }

  @Test
  @DisplayName("should count a failure when writing the output fails")
  void shouldCountFailure_whenWriterFails() throws IOException {
    Path pdf = writePdf(tempDir.resolve("spec.pdf"));
    when(outputWriter.write(any(), anyString(), anyString(), any()))
        .thenThrow(new DocumentProcessingException("spec.pdf", "disk full"));

    assertThatThrownBy(() -> service.ingest(pdf, outputDir, 0))
        .isInstanceOf(DocumentProcessingException.class)
        .hasMessage("disk full");

    assertThat(counter("ingestion.documents.failure")).isEqualTo(1.0);
    assertThat(counter("ingestion.documents.success")).isZero();
  }

  @Test
  @DisplayName("should fail when the input does not exist")
  void shouldFail_whenInputMissing() {
    Path missing = tempDir.resolve("missing.pdf");

    assertThatThrownBy(() -> service.ingest(missing, outputDir, 0))
        .isInstanceOf(DocumentProcessingException.class)
        .hasMessageStartingWith("Input not found");
  }

  @Test
  @DisplayName("should fail when a directory holds no PDF")
  void shouldFail_whenDirectoryHasNoPdf() throws IOException {
    Path empty = Files.createDirectory(tempDir.resolve("empty"));
    Files.writeString(empty.resolve("readme.txt"), "nothing to ingest");

    assertThatThrownBy(() -> service.ingest(empty, outputDir, 0))
        .isInstanceOf(DocumentProcessingException.class)
        .hasMessageStartingWith("No PDF files in");
  }

  @Test
  @DisplayName("should strip only the last extension from file names")
  void shouldStripLastExtension() {
    assertThat(DocumentIngestionService.stem(Path.of("specs", "JESD84-B51.v2.pdf")))
        .isEqualTo("JESD84-B51.v2");
    assertThat(DocumentIngestionService.stem(Path.of("README"))).isEqualTo("README");
  }
}

package com.flamingo.ai.specchunker.ingestion.extraction;

import com.flamingo.ai.specchunker.config.IngestionConfig;
import com.flamingo.ai.specchunker.exception.DocumentProcessingException;
import com.flamingo.ai.specchunker.ingestion.model.TocEntry;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.interactive.documentnavigation.outline.PDDocumentOutline;
import org.apache.pdfbox.pdmodel.interactive.documentnavigation.outline.PDOutlineItem;
import org.apache.pdfbox.pdmodel.interactive.documentnavigation.outline.PDOutlineNode;

/**
 * {@link DocumentSource} for a PDF file, read with Apache PDFBox.
 *
 * <p>The file is loaded into memory once; the outline (bookmarks) becomes the table of contents.
 */
@Slf4j
public class PdfBoxDocumentSource implements DocumentSource {

  private static final int MAX_OUTLINE_DEPTH = 16;

  private final String sourceId;
  private final String version;
  private final int pageCount;
  private final List<TocEntry> tableOfContents;
  private final PdfDocumentHandles handles;
  private final PageContentReader pageContentReader;
  private final TableGeometryReader tableGeometryReader;

  private PdfBoxDocumentSource(
      String sourceId,
      String version,
      int pageCount,
      List<TocEntry> tableOfContents,
      PdfDocumentHandles handles,
      IngestionConfig config) {
    this.sourceId = sourceId;
    this.version = version;
    this.pageCount = pageCount;
    this.tableOfContents = List.copyOf(tableOfContents);
    this.handles = handles;
    this.pageContentReader = new PdfBoxPageContentReader(handles);
    this.tableGeometryReader = new PdfBoxTableGeometryReader(handles, config);
  }

  /**
   * Opens a PDF file.
   *
   * @throws DocumentProcessingException if the file cannot be read, is not a PDF or has no pages
   */
  public static PdfBoxDocumentSource open(Path path, IngestionConfig config) {
    String fileName = path.getFileName().toString();
    byte[] bytes;
    try {
      bytes = Files.readAllBytes(path);
    } catch (IOException e) {
      throw new DocumentProcessingException(
          fileName, "Failed to read " + path + ": " + e.getMessage(), e);
    }

    PdfDocumentHandles handles = new PdfDocumentHandles(bytes);
    try {
      PDDocument document = handles.current();
      int pageCount = document.getNumberOfPages();
      if (pageCount == 0) {
        throw new DocumentProcessingException(
            fileName, "PDF has no pages: " + path, "The document is empty");
      }
      List<TocEntry> toc = readOutline(document);
      String version = VersionResolver.resolve(config.getDocument().getVersion(), fileName);
      log.info(
          "Opened {}: {} pages, {} TOC entries, version {}",
          fileName,
          pageCount,
          toc.size(),
          version);
      return new PdfBoxDocumentSource(fileName, version, pageCount, toc, handles, config);
    } catch (IOException e) {
      handles.close();
      throw new DocumentProcessingException(
          fileName, "Failed to parse PDF " + path + ": " + e.getMessage(), e);
    } catch (RuntimeException e) {
      handles.close();
      throw e;
    }
  }

  static List<TocEntry> readOutline(PDDocument document) throws IOException {
    PDDocumentOutline outline = document.getDocumentCatalog().getDocumentOutline();
    List<TocEntry> entries = new ArrayList<>();
    if (outline != null) {
      collect(document, outline, 1, entries);
    }
    return entries;
  }

  private static void collect(
      PDDocument document, PDOutlineNode node, int level, List<TocEntry> entries)
      throws IOException {
    if (level > MAX_OUTLINE_DEPTH) {
      return;
    }
    for (PDOutlineItem item : node.children()) {
      String title = item.getTitle();
      if (title != null && !title.isBlank()) {
        PDPage target = item.findDestinationPage(document);
        int page = target == null ? -1 : document.getPages().indexOf(target) + 1;
        entries.add(new TocEntry(level, title.strip(), page > 0 ? page : -1));
      }
      collect(document, item, level + 1, entries);
    }
  }

  @Override
  public String sourceId() {
    return sourceId;
  }

  @Override
  public String version() {
    return version;
  }

  @Override
  public int pageCount() {
    return pageCount;
  }

  @Override
  public List<TocEntry> tableOfContents() {
    return tableOfContents;
  }

  @Override
  public PageContentReader pageContentReader() {
    return pageContentReader;
  }

  @Override
  public TableGeometryReader tableGeometryReader() {
    return tableGeometryReader;
  }

  @Override
  public void close() {
    handles.close();
  }
}

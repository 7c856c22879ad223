package com.flamingo.ai.specchunker.ingestion.extraction;

import com.flamingo.ai.specchunker.ingestion.model.TocEntry;
import java.util.List;

/** An opened document together with the two readers that extract its pages. */
public interface DocumentSource extends AutoCloseable {

  /** Identifier carried by every chunk, usually the file name. */
  String sourceId();

  /** Version or edition tag of the document. */
  String version();

  int pageCount();

  /** Native table of contents in document order; empty if the document has none. */
  List<TocEntry> tableOfContents();

  PageContentReader pageContentReader();

  TableGeometryReader tableGeometryReader();

  @Override
  void close();
}

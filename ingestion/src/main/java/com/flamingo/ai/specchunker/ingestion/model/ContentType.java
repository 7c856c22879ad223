package com.flamingo.ai.specchunker.ingestion.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Closed set of content types a block or chunk can carry. */
public enum ContentType {
  /** Ordinary prose. */
  TEXT,

  /** Tabular region reported by the table-geometry pass. */
  TABLE,

  /** Clustered vector drawing. */
  FIGURE,

  /** Embedded raster image. */
  BITMAP,

  /** Term or abbreviation definition. */
  DEFINITION,

  /** Bit-field register description; an atomic subtype of text. */
  REGISTER;

  /** Lower-case name used in serialized chunk records. */
  @JsonValue
  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }
}

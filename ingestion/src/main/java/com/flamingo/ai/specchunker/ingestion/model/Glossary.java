package com.flamingo.ai.specchunker.ingestion.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Term lookup derived from definition chunks. Terms match case-insensitively; when the same term
 * is defined twice the later definition replaces the earlier one.
 */
public class Glossary {

  private final Map<String, Chunk> entries = new LinkedHashMap<>();

  /** Registers {@code chunk} under its term. Chunks without a term are ignored. */
  public void put(Chunk chunk) {
    if (chunk.getTerm() == null || chunk.getTerm().isBlank()) {
      return;
    }
    String key = normalize(chunk.getTerm());
    entries.remove(key);
    entries.put(key, chunk);
  }

  public Optional<Chunk> lookup(String term) {
    return Optional.ofNullable(entries.get(normalize(term)));
  }

  public int size() {
    return entries.size();
  }

  public boolean isEmpty() {
    return entries.isEmpty();
  }

  /** Entries keyed by the term as written in the winning definition, in insertion order. */
  @JsonValue
  public Map<String, Chunk> asMap() {
    Map<String, Chunk> view = new LinkedHashMap<>();
    entries.values().forEach(chunk -> view.put(chunk.getTerm().trim(), chunk));
    return Collections.unmodifiableMap(view);
  }

  private static String normalize(String term) {
    return term.trim().toLowerCase(Locale.ROOT);
  }
}

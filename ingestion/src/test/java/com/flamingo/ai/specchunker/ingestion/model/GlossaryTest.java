package com.flamingo.ai.specchunker.ingestion.model;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("Glossary Tests")
class GlossaryTest {

  private static Chunk definition(String term, String body) {
    return Chunk.builder()
        .contentType(ContentType.DEFINITION)
        .term(term)
        .rawText(term + ": " + body)
        .build();
  }

  @Test
  @DisplayName("should look terms up case-insensitively")
  void shouldLookUpIgnoringCase() {
    Glossary glossary = new Glossary();
    glossary.put(definition("RPMB", "Replay Protected Memory Block"));

    assertThat(glossary.lookup("rpmb")).isPresent();
    assertThat(glossary.lookup(" Rpmb ")).isPresent();
    assertThat(glossary.lookup("HS200")).isEmpty();
  }

  @Test
  @DisplayName("should let a later definition replace an earlier one")
  void shouldReplaceEarlierDefinition() {
    Glossary glossary = new Glossary();
    glossary.put(definition("block", "a unit of data"));
    glossary.put(definition("CMD", "command"));
    glossary.put(definition("Block", "512 bytes of data"));

    assertThat(glossary.size()).isEqualTo(2);
    assertThat(glossary.lookup("block").orElseThrow().getRawText())
        .isEqualTo("Block: 512 bytes of data");
    assertThat(glossary.asMap()).containsOnlyKeys("CMD", "Block");
    assertThat(glossary.asMap().keySet()).containsExactly("CMD", "Block");
  }

  @Test
  @DisplayName("should ignore chunks without a term")
  void shouldIgnoreChunksWithoutTerm() {
    Glossary glossary = new Glossary();
    glossary.put(Chunk.builder().contentType(ContentType.TEXT).rawText("plain text").build());
    glossary.put(definition("  ", "blank"));

    assertThat(glossary.isEmpty()).isTrue();
  }
}

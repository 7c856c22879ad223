package com.flamingo.ai.specchunker.ingestion.chunking;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.specchunker.config.IngestionConfig;
import com.flamingo.ai.specchunker.ingestion.model.Chunk;
import com.flamingo.ai.specchunker.ingestion.model.ContentType;
import com.flamingo.ai.specchunker.ingestion.model.TocEntry;
import com.flamingo.ai.specchunker.ingestion.structure.DocumentStructure;
import com.flamingo.ai.specchunker.ingestion.structure.HeadingMatch;
import com.flamingo.ai.specchunker.ingestion.structure.SectionNode;
import com.flamingo.ai.specchunker.ingestion.structure.StructureExtractor;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("DefinitionChunker Tests")
class DefinitionChunkerTest {

  private DefinitionChunker chunker;
  private ChunkFactory factory;
  private SectionNode terms;
  private SectionNode abbreviations;

  @BeforeEach
  void setUp() {
    IngestionConfig config = new IngestionConfig();
    chunker = new DefinitionChunker(config);
    factory = new ChunkFactory("spec.pdf", "5.1", "eMMC", 1);
    DocumentStructure structure =
        new StructureExtractor(config)
            .extract(
                "spec.pdf",
                "5.1",
                20,
                List.of(
                    new TocEntry(1, "3 Terms and definitions", 2),
                    new TocEntry(2, "3.1 Terms", 2),
                    new TocEntry(2, "3.2 Abbreviations", 4)));
    terms = structure.findByNumber("3.1").orElseThrow();
    abbreviations = structure.findByNumber("3.2").orElseThrow();
  }

  private List<Chunk> feed(TextUnit... units) {
    List<Chunk> chunks = new ArrayList<>();
    DefinitionBuilderState state = DefinitionBuilderState.empty();
    for (TextUnit unit : units) {
      BuilderStep<DefinitionBuilderState> step = chunker.accept(state, unit, factory);
      chunks.addAll(step.emitted());
      state = step.state();
    }
    chunks.addAll(chunker.finish(state, factory));
    return chunks;
  }

  @Test
  @DisplayName("should emit one chunk per abbreviation line and join continuation lines")
  void shouldSplitAbbreviationLines() {
    String block =
        "ABC: Abbreviation for a bus clock\n"
            + "CMD - Command token sent by host\n"
            + "on the command line";

    List<Chunk> chunks = feed(TextUnit.of(ContentType.DEFINITION, block, 4, abbreviations));

    assertThat(chunks).hasSize(2);
    assertThat(chunks)
        .allSatisfy(c -> assertThat(c.getContentType()).isEqualTo(ContentType.DEFINITION));
    assertThat(chunks).extracting(Chunk::getTerm).containsExactly("ABC", "CMD");
    assertThat(chunks.get(0).getRawText()).isEqualTo("ABC: Abbreviation for a bus clock");
    assertThat(chunks.get(1).getRawText())
        .isEqualTo("CMD: Command token sent by host on the command line");
    assertThat(chunks.get(0).getText())
        .startsWith("[eMMC 5.1 | 3.2 Abbreviations | Page 4]\nABC: ");
  }

  @Test
  @DisplayName("should read numbered term entries when no line has the abbreviation form")
  void shouldReadNumberedTerms() {
    String block =
        "3.1.1 Block length\n"
            + "Number of bytes in one data block.\n"
            + "3.1.2 Boot partition\n"
            + "Area reserved for the boot image.";

    List<Chunk> chunks = feed(TextUnit.of(ContentType.DEFINITION, block, 2, terms));

    assertThat(chunks).extracting(Chunk::getTerm).containsExactly("Block length", "Boot partition");
    assertThat(chunks.get(1).getRawText())
        .isEqualTo("Boot partition: Area reserved for the boot image.");
  }

  @Test
  @DisplayName("should keep text that defines no term as a text chunk")
  void shouldKeepLeftoverAsText() {
    String block = "The following abbreviations apply.\nABC: Abbreviation for a bus clock";

    List<Chunk> chunks = feed(TextUnit.of(ContentType.DEFINITION, block, 4, abbreviations));

    assertThat(chunks)
        .extracting(Chunk::getContentType)
        .containsExactly(ContentType.DEFINITION, ContentType.TEXT);
    assertThat(chunks.get(1).getRawText()).isEqualTo("The following abbreviations apply.");
  }

  @Test
  @DisplayName("should ignore a single-line heading block")
  void shouldIgnoreHeadingOnlyBlock() {
    TextUnit heading =
        new TextUnit(
            ContentType.DEFINITION,
            "3.2 Abbreviations",
            4,
            abbreviations,
            new HeadingMatch(2, abbreviations, "3.2 Abbreviations"));

    assertThat(feed(heading)).isEmpty();
  }

  @Test
  @DisplayName("should flush the buffered section when a block of another section arrives")
  void shouldFlushOnSectionChange() {
    BuilderStep<DefinitionBuilderState> first =
        chunker.accept(
            DefinitionBuilderState.empty(),
            TextUnit.of(
                ContentType.DEFINITION, "3.1.1 Block length\nBytes in one block.", 3, terms),
            factory);
    BuilderStep<DefinitionBuilderState> second =
        chunker.accept(
            first.state(),
            TextUnit.of(
                ContentType.DEFINITION, "ABC: Abbreviation for a bus clock", 4, abbreviations),
            factory);

    assertThat(first.emitted()).isEmpty();
    assertThat(second.emitted()).extracting(Chunk::getTerm).containsExactly("Block length");
    assertThat(second.state().section()).isSameAs(abbreviations);
    assertThat(chunker.finish(second.state(), factory))
        .extracting(Chunk::getTerm)
        .containsExactly("ABC");
  }
}

package com.flamingo.ai.specchunker.ingestion.chunking;

import com.flamingo.ai.specchunker.config.IngestionConfig;
import com.flamingo.ai.specchunker.ingestion.model.Chunk;
import com.flamingo.ai.specchunker.ingestion.model.ContentType;
import com.flamingo.ai.specchunker.ingestion.structure.HeadingMatch;
import com.flamingo.ai.specchunker.ingestion.structure.SectionNode;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Accumulates prose and register descriptions into chunks.
 *
 * <p>A buffer is flushed when a heading opens a new section or changes the heading level, when the
 * section changes, when the content type switches between {@code TEXT} and {@code REGISTER}, and
 * when a text buffer has reached the high-water mark and the next block starts a new sentence.
 * Register buffers ignore the high-water mark. The end of a physical page is not a boundary; the
 * buffer's end page moves forward instead.
 *
 * <p>Text buffers above the hard ceiling are split at sentence boundaries. Register descriptions
 * stay whole below the ceiling and are otherwise split at bit-field groups, each part carrying a
 * {@code Register <name> (part i/n)} header. Flushed text is scanned for inline definitions.
 */
@Slf4j
@Component
public class TextChunker {

  private static final Pattern SENTENCE_END = Pattern.compile("[.!?:;)]\\s*$");
  private static final Pattern SENTENCE_START = Pattern.compile("^\\s*[A-Z0-9*\\-(\\[]");
  private static final Pattern BIT_GROUP_START =
      Pattern.compile("^\\s*(?:\\[\\d+(?::\\d+)?]|Bit\\s+\\d+)", Pattern.CASE_INSENSITIVE);

  private final IngestionConfig.Chunking config;
  private final InlineDefinitionScanner inlineDefinitions;

  public TextChunker(IngestionConfig config, InlineDefinitionScanner inlineDefinitions) {
    this.config = config.getChunking();
    this.inlineDefinitions = inlineDefinitions;
  }

  public BuilderStep<TextBuilderState> accept(
      TextBuilderState state, TextUnit unit, ChunkFactory factory) {
    int unitTokens = TextSplitter.estimateTokens(unit.text(), config.getCharsPerToken());
    int level = headingLevel(unit);
    if (state.isEmpty()) {
      return BuilderStep.of(TextBuilderState.start(unit, level, unitTokens));
    }
    if (isBoundary(state, unit)) {
      List<Chunk> emitted = flush(state, factory);
      return new BuilderStep<>(TextBuilderState.start(unit, level, unitTokens), emitted);
    }
    return BuilderStep.of(state.append(unit, unitTokens));
  }

  public List<Chunk> finish(TextBuilderState state, ChunkFactory factory) {
    return state.isEmpty() ? List.of() : flush(state, factory);
  }

  private boolean isBoundary(TextBuilderState state, TextUnit unit) {
    if (unit.section() != state.section() || unit.type() != state.type()) {
      return true;
    }
    HeadingMatch heading = unit.heading();
    if (heading != null) {
      boolean opensOtherSection =
          heading.section() != null && heading.section() != state.section();
      if (heading.level() != state.headingLevel() || opensOtherSection) {
        return true;
      }
    }
    if (state.type() == ContentType.REGISTER) {
      return false;
    }
    return state.tokens() >= config.getHighWaterTokens()
        && (SENTENCE_END.matcher(state.lastPart()).find()
            || SENTENCE_START.matcher(unit.text()).find());
  }

  private static int headingLevel(TextUnit unit) {
    if (unit.heading() != null) {
      return unit.heading().level();
    }
    return unit.section() == null ? 0 : unit.section().getLevel();
  }

  private List<Chunk> flush(TextBuilderState state, ChunkFactory factory) {
    String body = state.body().strip();
    if (body.isEmpty()) {
      return List.of();
    }
    boolean overCeiling = state.tokens() > config.getHardCeilingTokens();
    int maxChars = config.getHighWaterTokens() * Math.max(1, config.getCharsPerToken());
    if (state.type() == ContentType.REGISTER) {
      List<String> parts =
          overCeiling ? splitRegister(body, state.section(), maxChars) : List.of(body);
      List<Chunk> chunks = new ArrayList<>(parts.size());
      for (String part : parts) {
        chunks.add(
            factory.create(
                ContentType.REGISTER, state.section(), state.pageStart(), state.pageEnd(), part));
      }
      return chunks;
    }

    List<String> pieces =
        overCeiling ? TextSplitter.splitAtSentences(body, maxChars) : List.of(body);
    List<Chunk> chunks = new ArrayList<>();
    for (String piece : pieces) {
      chunks.addAll(textWithDefinitions(state, piece, factory));
    }
    return chunks;
  }

  private List<Chunk> textWithDefinitions(
      TextBuilderState state, String piece, ChunkFactory factory) {
    SectionNode section = state.section();
    List<TermDefinition> found = inlineDefinitions.scan(piece);
    List<Chunk> chunks = new ArrayList<>(1 + found.size());
    chunks.add(
        factory
            .newChunk(ContentType.TEXT, section, state.pageStart(), state.pageEnd())
            .text(factory.prefix(section, state.pageStart()) + "\n" + piece)
            .rawText(piece)
            .containsInlineDefinition(!found.isEmpty())
            .build());
    for (TermDefinition definition : found) {
      chunks.add(
          factory.definition(
              section,
              state.pageStart(),
              state.pageEnd(),
              definition.term(),
              definition.definition()));
    }
    return chunks;
  }

  /**
   * Splits a register description into parts of at most {@code maxChars}, cutting only where a
   * bit-field group starts. Each part is headed by {@code Register <name> (part i/n)}.
   */
  List<String> splitRegister(String body, SectionNode section, int maxChars) {
    List<String> groups = new ArrayList<>();
    StringBuilder current = new StringBuilder();
    String name = null;
    for (String line : body.split("\n")) {
      if (BIT_GROUP_START.matcher(line).find() && current.length() > 0) {
        groups.add(current.toString().strip());
        current.setLength(0);
      }
      if (name == null && !line.isBlank() && groups.isEmpty()) {
        name = line.strip();
      }
      current.append(line).append('\n');
    }
    if (current.length() > 0) {
      groups.add(current.toString().strip());
    }
    if (groups.size() < 2) {
      groups = TextSplitter.splitAtSentences(body, maxChars);
    }
    if (name == null || BIT_GROUP_START.matcher(name).find()) {
      name = section == null ? "register" : section.getTitle();
    }

    List<String> parts = new ArrayList<>();
    StringBuilder part = new StringBuilder();
    for (String group : groups) {
      if (part.length() > 0 && part.length() + 1 + group.length() > maxChars) {
        parts.add(part.toString());
        part.setLength(0);
      }
      if (part.length() > 0) {
        part.append('\n');
      }
      part.append(group);
    }
    if (part.length() > 0) {
      parts.add(part.toString());
    }
    if (parts.size() == 1) {
      return parts;
    }

    List<String> headed = new ArrayList<>(parts.size());
    for (int i = 0; i < parts.size(); i++) {
      headed.add(
          "Register " + name + " (part " + (i + 1) + "/" + parts.size() + ")\n" + parts.get(i));
    }
    log.debug("Register '{}' split into {} parts", name, parts.size());
    return headed;
  }
}

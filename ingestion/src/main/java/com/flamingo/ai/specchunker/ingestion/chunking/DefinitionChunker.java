package com.flamingo.ai.specchunker.ingestion.chunking;

import com.flamingo.ai.specchunker.config.IngestionConfig;
import com.flamingo.ai.specchunker.ingestion.model.Chunk;
import com.flamingo.ai.specchunker.ingestion.model.ContentType;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Builds one definition chunk per term of a terminology section.
 *
 * <p>Lines of the form {@code TERM: definition} or {@code TERM - definition} are tried first; a
 * following line that matches neither form continues the previous definition. When no line has
 * that form, the numbered form ({@code 3.1.4 Term} followed by its definition) is tried. Text not
 * consumed by a term is emitted as one {@link ContentType#TEXT} chunk.
 */
@Slf4j
@Component
public class DefinitionChunker {

  private static final Pattern NUMBERED =
      Pattern.compile(
          "^\\d+(?:\\.\\d+)+\\s+([A-Za-z][^\\n]{3,60})\\n([^\\n].*?)(?=\\n\\d+(?:\\.\\d+)+\\s|\\z)",
          Pattern.MULTILINE | Pattern.DOTALL);

  private final IngestionConfig.Definition config;
  private final Pattern abbreviation;

  public DefinitionChunker(IngestionConfig config) {
    this.config = config.getDefinition();
    this.abbreviation =
        Pattern.compile(
            "^([A-Z][A-Z0-9_/\\-]{1,20})\\s*[:\\-\\u2013\\u2014]\\s*(.{"
                + Math.max(1, this.config.getMinDefinitionChars())
                + ","
                + this.config.getMaxDefinitionChars()
                + "})$");
  }

  /**
   * Adds a terminology block. A block from a different section flushes the buffered one first; a
   * single-line heading block only opens the section.
   */
  public BuilderStep<DefinitionBuilderState> accept(
      DefinitionBuilderState state, TextUnit unit, ChunkFactory factory) {
    List<Chunk> emitted = new ArrayList<>();
    DefinitionBuilderState current = state;
    if (!current.isEmpty() && current.section() != unit.section()) {
      emitted.addAll(flush(current, factory));
      current = DefinitionBuilderState.empty();
    }
    if (current.isEmpty()) {
      current = new DefinitionBuilderState(unit.section(), unit.page(), unit.page(), List.of());
    }
    boolean headingOnly = unit.heading() != null && unit.text().strip().indexOf('\n') < 0;
    if (!headingOnly) {
      current = current.append(unit.text(), unit.page());
    }
    return new BuilderStep<>(current, emitted);
  }

  public List<Chunk> finish(DefinitionBuilderState state, ChunkFactory factory) {
    return state.isEmpty() ? List.of() : flush(state, factory);
  }

  private List<Chunk> flush(DefinitionBuilderState state, ChunkFactory factory) {
    String text = String.join("\n", state.blocks());
    List<Chunk> chunks = new ArrayList<>();
    StringBuilder leftover = new StringBuilder();

    List<TermDefinition> terms = extractLineTerms(text, leftover);
    if (terms.isEmpty()) {
      leftover.setLength(0);
      terms = extractNumberedTerms(text, leftover);
    }
    for (TermDefinition term : terms) {
      chunks.add(
          factory.definition(
              state.section(), state.pageStart(), state.pageEnd(), term.term(), term.definition()));
    }
    String rest = leftover.toString().strip();
    if (!rest.isEmpty()) {
      chunks.add(
          factory.create(
              ContentType.TEXT, state.section(), state.pageStart(), state.pageEnd(), rest));
    }
    log.debug(
        "Terminology section '{}' pages {}-{}: {} terms",
        state.section() == null ? ChunkFactory.FRONT_MATTER_LABEL : state.section().label(),
        state.pageStart(),
        state.pageEnd(),
        terms.size());
    return chunks;
  }

  private List<TermDefinition> extractLineTerms(String text, StringBuilder leftover) {
    List<TermDefinition> terms = new ArrayList<>();
    String term = null;
    StringBuilder definition = new StringBuilder();
    for (String rawLine : text.split("\n")) {
      String line = rawLine.strip();
      Matcher m = abbreviation.matcher(line);
      if (m.matches()) {
        addTerm(terms, term, definition);
        term = m.group(1).strip();
        definition.setLength(0);
        definition.append(m.group(2).strip());
      } else if (term != null
          && !line.isEmpty()
          && definition.length() + 1 + line.length() <= config.getMaxDefinitionChars()) {
        definition.append(' ').append(line);
      } else {
        addTerm(terms, term, definition);
        term = null;
        if (!line.isEmpty()) {
          leftover.append(line).append('\n');
        }
      }
    }
    addTerm(terms, term, definition);
    return terms;
  }

  private static void addTerm(List<TermDefinition> terms, String term, StringBuilder definition) {
    if (term != null) {
      terms.add(new TermDefinition(term, definition.toString()));
    }
  }

  private List<TermDefinition> extractNumberedTerms(String text, StringBuilder leftover) {
    List<TermDefinition> terms = new ArrayList<>();
    Matcher m = NUMBERED.matcher(text);
    int last = 0;
    while (m.find()) {
      String definition = m.group(2).replaceAll("\\s+", " ").strip();
      if (definition.length() < config.getMinDefinitionChars()
          || definition.length() > config.getMaxDefinitionChars()) {
        continue;
      }
      leftover.append(text, last, m.start());
      terms.add(new TermDefinition(m.group(1).strip(), definition));
      last = m.end();
    }
    leftover.append(text.substring(last));
    return terms;
  }
}

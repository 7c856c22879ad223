package com.flamingo.ai.specchunker.ingestion.chunking;

import com.flamingo.ai.specchunker.config.IngestionConfig;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Finds definitions phrased inline in prose: {@code X means ...}, {@code X is defined as ...},
 * {@code X refers to ...} and {@code Long Name (abbreviated as LN)}.
 */
@Component
public class InlineDefinitionScanner {

  private static final Pattern SENTENCE_BOUNDARY = Pattern.compile("(?<=[.!?])\\s+|\\n");

  private static final Pattern VERB_FORM =
      Pattern.compile(
          "([A-Za-z][A-Za-z0-9_\\-\\s]{1,40}?)\\s+"
              + "(?:means|is\\s+defined\\s+as|refers\\s+to)\\s+(.+)",
          Pattern.CASE_INSENSITIVE);

  private static final Pattern ABBREVIATION_FORM =
      Pattern.compile(
          "([A-Za-z][A-Za-z0-9_\\-\\s]{2,40}?)\\s+"
              + "\\(abbreviated\\s+as\\s+([A-Z][A-Z0-9_\\-]{1,15})\\)",
          Pattern.CASE_INSENSITIVE);

  private static final Set<String> RELATIVE_PRONOUNS = Set.of("which", "that", "who");
  private static final Set<String> LEADING_FILLERS =
      Set.of("the", "a", "an", "this", "term", "word", "phrase", "abbreviation");

  private final IngestionConfig.Definition config;

  public InlineDefinitionScanner(IngestionConfig config) {
    this.config = config.getDefinition();
  }

  /** Returns the definitions found in {@code body}, first occurrence per term. */
  public List<TermDefinition> scan(String body) {
    List<TermDefinition> found = new ArrayList<>();
    Set<String> seen = new HashSet<>();
    for (String sentence : SENTENCE_BOUNDARY.split(body)) {
      Matcher verb = VERB_FORM.matcher(sentence);
      if (verb.find()) {
        String definition = trimDefinition(verb.group(2));
        add(found, seen, cleanTerm(verb.group(1)), definition);
      }
      Matcher abbreviation = ABBREVIATION_FORM.matcher(sentence);
      while (abbreviation.find()) {
        String expansion = cleanTerm(abbreviation.group(1));
        if (expansion != null) {
          add(found, seen, abbreviation.group(2), expansion);
        }
      }
    }
    return found;
  }

  private void add(
      List<TermDefinition> found, Set<String> seen, String term, String definition) {
    if (term == null || definition == null) {
      return;
    }
    int length = definition.length();
    if (length < config.getMinDefinitionChars() || length > config.getMaxDefinitionChars()) {
      return;
    }
    if (seen.add(term.toLowerCase(Locale.ROOT))) {
      found.add(new TermDefinition(term, definition));
    }
  }

  /**
   * Reduces the words before the verb to the term: drops anything before the last clause
   * separator, a trailing relative pronoun and leading articles, and keeps at most the configured
   * number of trailing words.
   */
  String cleanTerm(String raw) {
    List<String> words = new ArrayList<>(List.of(raw.strip().split("\\s+")));
    if (!words.isEmpty()
        && RELATIVE_PRONOUNS.contains(words.get(words.size() - 1).toLowerCase(Locale.ROOT))) {
      words.remove(words.size() - 1);
    }
    int limit = Math.max(1, config.getMaxInlineTermWords());
    if (words.size() > limit) {
      words = new ArrayList<>(words.subList(words.size() - limit, words.size()));
    }
    while (!words.isEmpty() && LEADING_FILLERS.contains(words.get(0).toLowerCase(Locale.ROOT))) {
      words.remove(0);
    }
    if (words.isEmpty()) {
      return null;
    }
    String term = String.join(" ", words).replaceAll("[,;:]+$", "").strip();
    return term.length() < 2 ? null : term;
  }

  private static String trimDefinition(String raw) {
    String definition = raw.strip();
    while (definition.endsWith(".") || definition.endsWith(";")) {
      definition = definition.substring(0, definition.length() - 1).strip();
    }
    return definition;
  }
}

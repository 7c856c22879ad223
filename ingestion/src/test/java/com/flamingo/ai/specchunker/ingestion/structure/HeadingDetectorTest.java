package com.flamingo.ai.specchunker.ingestion.structure;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.specchunker.config.IngestionConfig;
import com.flamingo.ai.specchunker.ingestion.model.BoundingBox;
import com.flamingo.ai.specchunker.ingestion.model.TextBlock;
import com.flamingo.ai.specchunker.ingestion.model.TocEntry;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("HeadingDetector Tests")
class HeadingDetectorTest {

  private static final BoundingBox BOX = new BoundingBox(72, 100, 400, 114);

  private HeadingDetector detector;
  private DocumentStructure structure;

  @BeforeEach
  void setUp() {
    detector = new HeadingDetector();
    structure =
        new StructureExtractor(new IngestionConfig())
            .extract(
                "spec.pdf",
                "5.1",
                40,
                List.of(
                    new TocEntry(1, "6 Commands", 10),
                    new TocEntry(2, "6.10 Command classes", 12),
                    new TocEntry(3, "6.10.4 Detailed command description", 14)));
  }

  @Test
  @DisplayName("should match a block equal to a TOC label")
  void shouldMatchExactLabel() {
    TextBlock block = TextBlock.of(BOX, "6.10.4  Detailed command   description");

    HeadingMatch match = detector.detect(block, structure).orElseThrow();

    assertThat(match.level()).isEqualTo(3);
    assertThat(match.resolvedSection()).get().extracting(SectionNode::getNumber)
        .isEqualTo("6.10.4");
  }

  @Test
  @DisplayName("should match a heading merged with the first paragraph")
  void shouldMatchLabelPrefix() {
    TextBlock block =
        TextBlock.of(BOX, "6.10 Command classes\nThe command set is divided into classes.");

    HeadingMatch match = detector.detect(block, structure).orElseThrow();

    assertThat(match.section().getNumber()).isEqualTo("6.10");
    assertThat(match.text()).isEqualTo("6.10 Command classes");
  }

  @Test
  @DisplayName("should resolve a numbered heading by its number when the title differs")
  void shouldResolveByNumber_whenTitleDiffers() {
    TextBlock block = TextBlock.of(BOX, "6.10.4 Detailed Command Descriptions");

    HeadingMatch match = detector.detect(block, structure).orElseThrow();

    assertThat(match.section().getNumber()).isEqualTo("6.10.4");
  }

  @Test
  @DisplayName("should accept an unknown bold numbered heading without a section")
  void shouldAcceptBoldUnknownHeading() {
    TextBlock block = new TextBlock(BOX, "6.10.5 Reserved commands", 11f, true, 3);

    HeadingMatch match = detector.detect(block, structure).orElseThrow();

    assertThat(match.level()).isEqualTo(3);
    assertThat(match.resolvedSection()).isEmpty();
  }

  @Test
  @DisplayName("should ignore plain prose and unknown regular-weight numbers")
  void shouldIgnoreProse() {
    assertThat(detector.detect(TextBlock.of(BOX, "The host sends CMD1."), structure)).isEmpty();
    assertThat(detector.detect(TextBlock.of(BOX, "6.10.5 Reserved commands"), structure))
        .isEmpty();
    assertThat(detector.detect(TextBlock.of(BOX, "12 MHz"), structure)).isEmpty();
  }
}

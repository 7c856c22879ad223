package com.flamingo.ai.specchunker.ingestion.extraction;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.specchunker.ingestion.model.BoundingBox;
import com.flamingo.ai.specchunker.ingestion.model.TableRegion;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("TableGridBuilder Tests")
class TableGridBuilderTest {

  private final TableGridBuilder builder = new TableGridBuilder(3f, 3f);

  private static Glyph glyph(float x, float baseline, String text) {
    return new Glyph(new BoundingBox(x, baseline - 10, x + 6, baseline), text, 10f, 2.5f, false);
  }

  private static List<Ruling> grid(float[] xs, float[] ys) {
    List<Ruling> rulings = new ArrayList<>();
    for (float y : ys) {
      rulings.add(new Ruling(xs[0], y, xs[xs.length - 1], y));
    }
    for (float x : xs) {
      rulings.add(new Ruling(x, ys[0], x, ys[ys.length - 1]));
    }
    return rulings;
  }

  @Test
  @DisplayName("should fill the cells of a ruled grid with the glyphs inside them")
  void shouldBuildTableFromGrid() {
    List<Ruling> rulings = grid(new float[] {50, 150, 250}, new float[] {100, 120, 140});
    List<Glyph> glyphs =
        List.of(
            glyph(60, 115, "A"),
            glyph(160, 115, "B"),
            glyph(60, 135, "1"),
            glyph(160, 135, "2"));

    List<TableRegion> tables = builder.build(rulings, glyphs);

    assertThat(tables).hasSize(1);
    TableRegion table = tables.get(0);
    assertThat(table.bbox()).isEqualTo(new BoundingBox(50, 100, 250, 140));
    assertThat(table.rows()).containsExactly(List.of("A", "B"), List.of("1", "2"));
  }

  @Test
  @DisplayName("should drop columns without text")
  void shouldDropEmptyColumns() {
    List<Ruling> rulings = grid(new float[] {50, 150, 250, 350}, new float[] {100, 120, 140});
    List<Glyph> glyphs = List.of(glyph(60, 115, "A"), glyph(260, 115, "C"), glyph(60, 135, "1"));

    TableRegion table = builder.build(rulings, glyphs).get(0);

    assertThat(table.columnCount()).isEqualTo(2);
    assertThat(table.rows().get(0)).containsExactly("A", "C");
    assertThat(table.rows().get(1)).containsExactly("1", null);
  }

  @Test
  @DisplayName("should snap nearly coincident rulings onto one edge")
  void shouldSnapNearbyRulings() {
    List<Ruling> rulings =
        new ArrayList<>(grid(new float[] {50, 150, 250}, new float[] {100, 140}));
    rulings.add(new Ruling(50, 101.5f, 250, 101.5f));
    List<Glyph> glyphs = List.of(glyph(60, 130, "A"), glyph(160, 130, "B"));

    List<TableRegion> tables = builder.build(rulings, glyphs);

    assertThat(tables).hasSize(1);
    assertThat(tables.get(0).rows()).containsExactly(List.of("A", "B"));
  }

  @Test
  @DisplayName("should find no table without at least two lines in each direction")
  void shouldIgnoreIncompleteGrids() {
    List<Ruling> rulings =
        List.of(
            new Ruling(50, 100, 250, 100),
            new Ruling(50, 140, 250, 140),
            new Ruling(50, 100, 50, 140));

    assertThat(builder.build(rulings, List.of(glyph(60, 130, "A")))).isEmpty();
  }
}

package com.flamingo.ai.specchunker.ingestion.classify;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("RegisterSignature Tests")
class RegisterSignatureTest {

  @Test
  @DisplayName("should match bit fields with access keywords")
  void shouldMatchBitFieldsWithAccessKeywords() {
    assertThat(RegisterSignature.matches("[7] BUSY R/W\n[6:0] Reserved")).isTrue();
    assertThat(RegisterSignature.matches("[31:16] RCA R/W/E\n[15:0] stuff bits R/W/E")).isTrue();
  }

  @Test
  @DisplayName("should match a bit range with an enumerated value list")
  void shouldMatchEnumeratedValues() {
    assertThat(RegisterSignature.matches("[1:0] BUS_WIDTH\n0h: 1 bit\n1h: 4 bit\n2h: 8 bit"))
        .isTrue();
  }

  @Test
  @DisplayName("should not match prose naming one reserved bit range")
  void shouldNotMatch_whenSingleMarker() {
    assertThat(RegisterSignature.matches("Bits [7:0] are reserved.")).isFalse();
    assertThat(RegisterSignature.matches("Field [3] is R/W after power up.")).isFalse();
  }

  @Test
  @DisplayName("should not match text without a bit range")
  void shouldNotMatch_whenNoBitRange() {
    assertThat(RegisterSignature.matches("The register is R/W and reserved bits read zero."))
        .isFalse();
    assertThat(RegisterSignature.matches(null)).isFalse();
  }
}

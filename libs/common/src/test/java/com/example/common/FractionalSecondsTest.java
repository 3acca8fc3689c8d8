package com.example.common;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class FractionalSecondsTest {

  @Test
  void convertsWholeAndFractionalSeconds() {
    assertThat(FractionalSeconds.toDuration(11d)).isEqualTo(Duration.ofSeconds(11));
    assertThat(FractionalSeconds.toDuration(1.5d)).isEqualTo(Duration.ofMillis(1500));
  }

  @Test
  void roundsSubMillisecondUp() {
    // 0.0001 秒でも 0ms にはならない
    assertThat(FractionalSeconds.toDuration(0.0001d)).isEqualTo(Duration.ofMillis(1));
    assertThat(FractionalSeconds.toDuration(0d)).isEqualTo(Duration.ZERO);
  }

  @Test
  void doesNotRoundDecimalFractionsUpByFloatingPointError() {
    assertThat(FractionalSeconds.toDuration(1.1d)).isEqualTo(Duration.ofMillis(1100));
    assertThat(FractionalSeconds.toDuration(0.29d)).isEqualTo(Duration.ofMillis(290));
    assertThat(FractionalSeconds.toDuration(660.001d)).isEqualTo(Duration.ofMillis(660001));
  }

  @Test
  void rejectsNegativeAndNonFinite() {
    assertThatThrownBy(() -> FractionalSeconds.toDuration(-1d))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> FractionalSeconds.toDuration(Double.NaN))
        .isInstanceOf(IllegalArgumentException.class);
  }
}

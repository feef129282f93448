package com.scholary.slides.detection;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class TimeIntervalTest {

  @Test
  void constructor_shouldRejectNegativeStart() {
    assertThatThrownBy(() -> new TimeInterval(-1.0, 10.0))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("negative");
  }

  @Test
  void constructor_shouldRejectEndBeforeStart() {
    assertThatThrownBy(() -> new TimeInterval(10.0, 5.0))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("End time must be >= start time");
  }

  @Test
  void constructor_shouldAcceptEmptyInterval() {
    TimeInterval interval = new TimeInterval(4.0, 4.0);
    assertThat(interval.midpoint()).isEqualTo(4.0);
  }

  @Test
  void midpoint_shouldBeCenterOfInterval() {
    assertThat(new TimeInterval(5.0, 40.0).midpoint()).isEqualTo(22.5);
  }
}

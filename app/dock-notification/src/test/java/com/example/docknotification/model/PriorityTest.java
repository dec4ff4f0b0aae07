package com.example.docknotification.model;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class PriorityTest {

  @ParameterizedTest
  @ValueSource(strings = {"critical", "urgent", "CRITICAL", " Urgent "})
  void criticalAndUrgentMapToUrgentLane(String urgency) {
    assertThat(Priority.forUrgency(urgency)).isEqualTo(Priority.URGENT);
  }

  @ParameterizedTest
  @ValueSource(strings = {"info", "warning", "normal", "high", ""})
  void everythingElseMapsToNormalLane(String urgency) {
    assertThat(Priority.forUrgency(urgency)).isEqualTo(Priority.NORMAL);
  }

  @Test
  void missingUrgencyIsNormal() {
    assertThat(Priority.forUrgency(null)).isEqualTo(Priority.NORMAL);
  }

  @Test
  void urgentOutweighsNormal() {
    assertThat(Priority.NORMAL.weight()).isEqualTo(5);
    assertThat(Priority.URGENT.weight()).isEqualTo(10);
  }
}

package com.example.docknotification.api;

import com.example.docknotification.queue.QueueCounts;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record QueueCountsResponse(
    String name, long waiting, long delayed, long active, long completed, long failed) {

  static QueueCountsResponse of(String name, QueueCounts counts) {
    return new QueueCountsResponse(
        name,
        counts.waiting(),
        counts.delayed(),
        counts.active(),
        counts.completed(),
        counts.failed());
  }
}

package com.example.docknotification.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record FailedJobsResponse(String queue, List<FailedJobSummary> jobs) {

  public FailedJobsResponse {
    if (jobs != null) {
      jobs = Collections.unmodifiableList(new ArrayList<>(jobs));
    }
  }

  @Override
  public List<FailedJobSummary> jobs() {
    if (jobs == null) {
      return null;
    }
    return Collections.unmodifiableList(new ArrayList<>(jobs));
  }
}

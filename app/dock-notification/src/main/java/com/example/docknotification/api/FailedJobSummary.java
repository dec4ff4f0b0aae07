package com.example.docknotification.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record FailedJobSummary(
    String id, String name, int attempts, String reason, Instant finishedAt, String data) {}

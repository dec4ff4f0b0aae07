package com.example.docknotification.queue;

import java.time.Instant;

/** Dead-lettered job retained for manual inspection. */
public record FailedJob(
    String id, String name, String data, int attemptsMade, String failedReason, Instant finishedAt) {}

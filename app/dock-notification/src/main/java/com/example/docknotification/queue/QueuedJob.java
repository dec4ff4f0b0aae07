package com.example.docknotification.queue;

import java.time.Instant;

/** A job as claimed from a queue: broker metadata plus the encoded job body. */
public record QueuedJob(
    String id,
    String queueName,
    String name,
    String data,
    int priority,
    int attemptsMade,
    Instant enqueuedAt,
    String traceId) {}

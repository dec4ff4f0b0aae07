package com.example.docknotification.queue;

import com.example.docknotification.model.Priority;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/** The normal and urgent lanes, created together or not at all. */
public record QueuePair(NotificationQueue normal, NotificationQueue urgent) {

  public QueuePair {
    Objects.requireNonNull(normal, "normal");
    Objects.requireNonNull(urgent, "urgent");
  }

  public NotificationQueue forPriority(Priority priority) {
    return priority == Priority.URGENT ? urgent : normal;
  }

  public List<NotificationQueue> all() {
    return List.of(normal, urgent);
  }

  public Optional<NotificationQueue> find(String queueName) {
    return all().stream().filter(queue -> queue.name().equals(queueName)).findFirst();
  }
}

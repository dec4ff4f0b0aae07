/*
 * Where: Dock notification domain model
 * What: Priority lanes and their queue weights
 * Why: Urgent work gets its own queue, worker and scheduling preference
 */
package com.example.docknotification.model;

import java.util.Locale;
import java.util.Set;

public enum Priority {
  NORMAL("normal", 5),
  URGENT("urgent", 10);

  private static final Set<String> URGENT_LEVELS = Set.of("critical", "urgent");

  private final String value;
  private final int weight;

  Priority(String value, int weight) {
    this.value = value;
    this.weight = weight;
  }

  public String value() {
    return value;
  }

  /** Queue weight; within one queue a higher weight is claimed first. */
  public int weight() {
    return weight;
  }

  /** Maps a notification urgency to a lane: critical and urgent go urgent, anything else normal. */
  public static Priority forUrgency(String urgency) {
    if (urgency == null) {
      return NORMAL;
    }
    return URGENT_LEVELS.contains(urgency.trim().toLowerCase(Locale.ROOT)) ? URGENT : NORMAL;
  }
}

package com.example.docknotification.service;

import com.example.docknotification.model.NotificationJob;
import com.example.docknotification.model.Priority;

/** How an accepted job reaches its handler. Chosen once at startup. */
public interface DeliveryStrategy {

  DeliveryMode mode();

  /**
   * @return the queue job id, or a synthetic id for inline delivery
   */
  String submit(NotificationJob job, Priority priority);
}

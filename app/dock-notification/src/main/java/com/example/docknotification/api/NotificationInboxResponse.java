package com.example.docknotification.api;

import com.example.docknotification.model.Notification;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record NotificationInboxResponse(long userId, List<Notification> notifications) {

  public NotificationInboxResponse {
    if (notifications != null) {
      notifications = Collections.unmodifiableList(new ArrayList<>(notifications));
    }
  }

  @Override
  public List<Notification> notifications() {
    if (notifications == null) {
      return null;
    }
    return Collections.unmodifiableList(new ArrayList<>(notifications));
  }
}

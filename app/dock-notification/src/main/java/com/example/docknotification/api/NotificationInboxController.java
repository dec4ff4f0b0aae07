package com.example.docknotification.api;

import com.example.docknotification.service.NotificationStore;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** Persisted in-app notifications of one user, newest first. */
@RestController
@RequestMapping("/debug/notification")
@RequiredArgsConstructor
public class NotificationInboxController {

  static final int MAX_LIMIT = 200;

  private final NotificationStore notificationStore;

  @GetMapping("/inbox/{userId}")
  public NotificationInboxResponse inbox(
      @PathVariable("userId") long userId,
      @RequestParam(name = "limit", defaultValue = "50") int limit) {
    final int boundedLimit = Math.max(1, Math.min(limit, MAX_LIMIT));
    return new NotificationInboxResponse(
        userId, notificationStore.findByUserId(userId, boundedLimit));
  }
}

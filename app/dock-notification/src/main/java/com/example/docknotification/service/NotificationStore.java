package com.example.docknotification.service;

import com.example.docknotification.model.NewNotification;
import com.example.docknotification.model.Notification;
import java.util.List;

/** Persistence of in-app notifications. */
public interface NotificationStore {

  Notification createNotification(NewNotification notification);

  List<Notification> findByUserId(long userId, int limit);
}

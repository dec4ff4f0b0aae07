/*
 * Where: Dock notification service layer
 * What: Entry points for producers: enqueue email, realtime and push jobs, create in-app notifications
 * Why: Callers do not know whether delivery is queued or inline
 */
package com.example.docknotification.service;

import com.example.docknotification.model.EmailPayload;
import com.example.docknotification.model.NewNotification;
import com.example.docknotification.model.Notification;
import com.example.docknotification.model.NotificationJob;
import com.example.docknotification.model.Priority;
import com.example.docknotification.model.PushPayload;
import com.example.docknotification.model.RealtimePayload;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class NotificationQueueService {

  private static final Logger logger = LoggerFactory.getLogger(NotificationQueueService.class);

  static final String NOTIFICATION_CREATED_EVENT = "notification_created";

  private final NotificationSubsystem subsystem;
  private final NotificationStore notificationStore;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "ObjectMapper is a shared Spring-managed component and cannot be copied")
  private final ObjectMapper objectMapper;

  public NotificationQueueService(
      NotificationSubsystem subsystem,
      NotificationStore notificationStore,
      ObjectMapper objectMapper) {
    this.subsystem = subsystem;
    this.notificationStore = notificationStore;
    this.objectMapper = objectMapper;
  }

  /**
   * @return the job id; in inline mode the email has already been sent when this returns
   */
  public String enqueueEmail(long tenantId, EmailPayload payload, Priority priority) {
    return submit(NotificationJob.email(tenantId, payload), priority);
  }

  public String enqueueRealtime(long tenantId, String eventType, Object data, Priority priority) {
    return enqueueRealtime(tenantId, eventType, data, priority, null, null);
  }

  public String enqueueRealtime(
      long tenantId,
      String eventType,
      Object data,
      Priority priority,
      Long scheduleId,
      Long userId) {
    final JsonNode tree = data == null ? null : objectMapper.valueToTree(data);
    return submit(
        NotificationJob.realtime(tenantId, scheduleId, userId, new RealtimePayload(eventType, tree)),
        priority);
  }

  public String enqueuePush(long tenantId, Long userId, PushPayload payload, Priority priority) {
    return submit(NotificationJob.push(tenantId, userId, payload), priority);
  }

  /**
   * Persists an in-app notification and fans it out to the tenant. Urgency {@code critical} or
   * {@code urgent} routes the fanout to the urgent lane.
   */
  public Notification createAndQueueNotification(
      long tenantId,
      long userId,
      String title,
      String message,
      String type,
      String urgency,
      Long scheduleId,
      Map<String, Object> metadata) {
    Long notificationId = null;
    try {
      final Notification notification =
          notificationStore.createNotification(
              new NewNotification(userId, title, message, type, scheduleId));
      notificationId = notification.id();

      final Priority priority = Priority.forUrgency(urgency);
      final ObjectNode body = objectMapper.valueToTree(notification);
      body.put("urgency", urgency);
      if (metadata != null) {
        body.set("metadata", objectMapper.valueToTree(metadata));
      }
      final ObjectNode data = objectMapper.createObjectNode();
      data.set("notification", body);

      enqueueRealtime(tenantId, NOTIFICATION_CREATED_EVENT, data, priority, scheduleId, userId);
      logger.info(
          "notification created and queued tenantId={} userId={} notificationId={} urgency={} type={}",
          tenantId,
          userId,
          notificationId,
          urgency,
          type);
      return notification;
    } catch (RuntimeException ex) {
      logger.error(
          "notification create and queue failed tenantId={} userId={} notificationId={} urgency={} type={}",
          tenantId,
          userId,
          notificationId,
          urgency,
          type,
          ex);
      throw ex;
    }
  }

  private String submit(NotificationJob job, Priority priority) {
    return subsystem.deliveryStrategy().submit(job, priority == null ? Priority.NORMAL : priority);
  }
}

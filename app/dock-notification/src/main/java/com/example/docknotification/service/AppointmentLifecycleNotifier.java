/*
 * Where: Dock notification service layer
 * What: Turns appointment lifecycle events into realtime, in-app and email jobs
 * Why: A failing channel must not keep the other channels from being notified
 */
package com.example.docknotification.service;

import com.example.docknotification.model.AppointmentEvent;
import com.example.docknotification.model.AppointmentEventType;
import com.example.docknotification.model.AppointmentSnapshot;
import com.example.docknotification.model.EmailPayload;
import com.example.docknotification.model.Priority;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class AppointmentLifecycleNotifier {

  private static final Logger logger = LoggerFactory.getLogger(AppointmentLifecycleNotifier.class);

  static final String NOTIFICATION_TYPE = "appointment";

  private static final Set<AppointmentEventType> URGENT_EVENTS =
      EnumSet.of(AppointmentEventType.CANCELLED, AppointmentEventType.NO_SHOW);
  private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");

  private final NotificationQueueService notificationQueueService;

  public void publish(AppointmentEvent event) {
    broadcast(event);
    createNotification(event);
    sendEmail(event);
  }

  private void broadcast(AppointmentEvent event) {
    final Priority priority =
        URGENT_EVENTS.contains(event.type()) ? Priority.URGENT : Priority.NORMAL;
    try {
      notificationQueueService.enqueueRealtime(
          event.tenantId(),
          event.type().eventName(),
          eventData(event),
          priority,
          event.schedule().id(),
          event.userId());
    } catch (RuntimeException ex) {
      logger.error(
          "appointment broadcast failed tenantId={} scheduleId={} event={}",
          event.tenantId(),
          event.schedule().id(),
          event.type().value(),
          ex);
    }
  }

  private void createNotification(AppointmentEvent event) {
    if (event.type() == AppointmentEventType.REMINDER_DUE) {
      return;
    }
    final Long userId = event.recipientUserId();
    if (userId == null) {
      logger.debug(
          "appointment notification skipped, no recipient scheduleId={} event={}",
          event.schedule().id(),
          event.type().value());
      return;
    }
    try {
      notificationQueueService.createAndQueueNotification(
          event.tenantId(),
          userId,
          title(event.type()),
          message(event),
          NOTIFICATION_TYPE,
          urgency(event.type()),
          event.schedule().id(),
          metadata(event));
    } catch (RuntimeException ex) {
      logger.error(
          "appointment notification failed tenantId={} userId={} scheduleId={} event={}",
          event.tenantId(),
          userId,
          event.schedule().id(),
          event.type().value(),
          ex);
    }
  }

  private void sendEmail(AppointmentEvent event) {
    final AppointmentSnapshot schedule = event.schedule();
    final String to = schedule.driverEmail();
    if (to == null || to.isBlank()) {
      return;
    }
    final String code =
        event.confirmationCode() == null ? String.valueOf(schedule.id()) : event.confirmationCode();
    try {
      final EmailPayload payload =
          switch (event.type()) {
            case CONFIRMED -> EmailPayload.confirmation(to, code, schedule);
            case RESCHEDULED -> EmailPayload.reschedule(
                to, code, schedule, event.oldStartTime(), event.oldEndTime());
            case CANCELLED -> EmailPayload.cancellation(to, code, schedule);
            case REMINDER_DUE -> EmailPayload.reminder(
                to, code, schedule, event.hoursUntilAppointment());
            default -> null;
          };
      if (payload == null) {
        return;
      }
      notificationQueueService.enqueueEmail(event.tenantId(), payload, Priority.NORMAL);
    } catch (RuntimeException ex) {
      logger.error(
          "appointment email failed tenantId={} to={} confirmationCode={} scheduleId={} event={}",
          event.tenantId(),
          to,
          code,
          schedule.id(),
          event.type().value(),
          ex);
    }
  }

  static String urgency(AppointmentEventType type) {
    return switch (type) {
      case RESCHEDULED -> "warning";
      case CANCELLED, NO_SHOW -> "urgent";
      default -> "info";
    };
  }

  static String title(AppointmentEventType type) {
    return switch (type) {
      case CREATED -> "New Appointment Created";
      case CONFIRMED -> "Appointment Confirmed";
      case CHECKED_IN -> "Vehicle Checked In";
      case RESCHEDULED -> "Appointment Rescheduled";
      case CANCELLED -> "Appointment Cancelled";
      case NO_SHOW -> "Appointment No-Show";
      case REMINDER_DUE -> "Appointment Reminder";
    };
  }

  static String message(AppointmentEvent event) {
    final AppointmentSnapshot schedule = event.schedule();
    return switch (event.type()) {
      case CREATED -> "A new appointment has been created for "
          + orDefault(schedule.customerName(), "customer");
      case CONFIRMED -> "Appointment #"
          + orDefault(event.confirmationCode(), String.valueOf(schedule.id()))
          + " has been confirmed";
      case CHECKED_IN -> orDefault(schedule.truckNumber(), "Vehicle")
          + " has checked in for appointment";
      case RESCHEDULED -> "Appointment has been rescheduled to "
          + formatTime(schedule.startTime(), schedule.timezone());
      case CANCELLED -> "Appointment has been cancelled"
          + (event.reason() == null || event.reason().isBlank() ? "" : ": " + event.reason());
      case NO_SHOW -> orDefault(schedule.truckNumber(), "Vehicle")
          + " did not show up for scheduled appointment";
      case REMINDER_DUE -> "Appointment starts in " + event.hoursUntilAppointment() + " hours";
    };
  }

  private static Map<String, Object> eventData(AppointmentEvent event) {
    final Map<String, Object> data = new LinkedHashMap<>();
    data.put("schedule", event.schedule());
    putIfPresent(data, "confirmationCode", event.confirmationCode());
    putIfPresent(data, "oldStartTime", event.oldStartTime());
    putIfPresent(data, "oldEndTime", event.oldEndTime());
    putIfPresent(data, "hoursUntilAppointment", event.hoursUntilAppointment());
    putIfPresent(data, "reason", event.reason());
    return data;
  }

  private static Map<String, Object> metadata(AppointmentEvent event) {
    final Map<String, Object> metadata = new LinkedHashMap<>();
    metadata.put("event", event.type().eventName());
    putIfPresent(metadata, "confirmationCode", event.confirmationCode());
    putIfPresent(metadata, "reason", event.reason());
    return metadata;
  }

  private static void putIfPresent(Map<String, Object> map, String key, Object value) {
    if (value != null) {
      map.put(key, value);
    }
  }

  private static String orDefault(String value, String fallback) {
    return value == null || value.isBlank() ? fallback : value;
  }

  private static String formatTime(Instant instant, String timezone) {
    if (instant == null) {
      return "a new time";
    }
    ZoneId zone = ZoneOffset.UTC;
    if (timezone != null && !timezone.isBlank()) {
      try {
        zone = ZoneId.of(timezone);
      } catch (DateTimeException ex) {
        logger.debug("unknown appointment timezone={}, using UTC", timezone);
      }
    }
    return TIME_FORMAT.withZone(zone).format(instant);
  }
}

package com.example.docknotification;

import com.example.docknotification.model.AppointmentSnapshot;
import java.time.Instant;

public final class TestAppointments {

  public static final long TENANT_ID = 7L;
  public static final long SCHEDULE_ID = 42L;
  public static final long CREATED_BY = 11L;
  public static final String DRIVER_EMAIL = "driver@example.com";
  public static final Instant START = Instant.parse("2026-03-02T14:00:00Z");
  public static final Instant END = Instant.parse("2026-03-02T15:00:00Z");

  private TestAppointments() {}

  public static AppointmentSnapshot scheduled() {
    return withStatus("scheduled");
  }

  public static AppointmentSnapshot cancelled() {
    return withStatus(AppointmentSnapshot.STATUS_CANCELLED);
  }

  public static AppointmentSnapshot withStatus(String status) {
    return new AppointmentSnapshot(
        SCHEDULE_ID,
        1L,
        2L,
        3L,
        4L,
        "North DC",
        "Dock 4",
        "Live Unload",
        "Acme Freight",
        "Globex",
        "Pat Driver",
        "+1-555-0100",
        DRIVER_EMAIL,
        "TRK-9",
        "TRL-3",
        START,
        END,
        status,
        "America/Chicago",
        CREATED_BY);
  }
}

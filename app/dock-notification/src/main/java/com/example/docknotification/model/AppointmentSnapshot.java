/*
 * Where: Dock notification domain model
 * What: Denormalized appointment view embedded in email jobs
 * Why: Email rendering must not reach back into storage from a worker thread
 */
package com.example.docknotification.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.time.Instant;

public record AppointmentSnapshot(
    long id,
    Long facilityId,
    Long dockId,
    Long carrierId,
    Long appointmentTypeId,
    String facilityName,
    String dockName,
    String appointmentTypeName,
    String carrierName,
    String customerName,
    String driverName,
    String driverPhone,
    String driverEmail,
    String truckNumber,
    String trailerNumber,
    Instant startTime,
    Instant endTime,
    String status,
    String timezone,
    Long createdBy) {

  public static final String STATUS_CANCELLED = "cancelled";

  @JsonIgnore
  public boolean isCancelled() {
    return STATUS_CANCELLED.equalsIgnoreCase(status);
  }
}

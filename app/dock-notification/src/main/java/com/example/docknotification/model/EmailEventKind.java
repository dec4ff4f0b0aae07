/*
 * Where: Dock notification domain model
 * What: Which appointment email variant an email job renders
 * Why: The producer knows which lifecycle event happened; the handler should not guess
 */
package com.example.docknotification.model;

public enum EmailEventKind {
  CONFIRMATION,
  REMINDER,
  RESCHEDULE,
  CANCELLATION
}

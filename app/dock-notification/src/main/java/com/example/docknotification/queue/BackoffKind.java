package com.example.docknotification.queue;

public enum BackoffKind {
  EXPONENTIAL,
  FIXED
}

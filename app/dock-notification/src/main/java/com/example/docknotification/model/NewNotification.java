package com.example.docknotification.model;

public record NewNotification(
    long userId, String title, String message, String type, Long relatedScheduleId) {}

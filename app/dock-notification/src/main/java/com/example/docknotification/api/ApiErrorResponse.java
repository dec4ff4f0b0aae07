package com.example.docknotification.api;

public record ApiErrorResponse(String code, String message) {}

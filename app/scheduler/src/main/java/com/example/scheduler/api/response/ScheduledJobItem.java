package com.example.scheduler.api.response;

public record ScheduledJobItem(String messageId, String nextRun) {}

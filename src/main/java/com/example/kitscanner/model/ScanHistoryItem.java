package com.example.kitscanner.model;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

public record ScanHistoryItem(String id, String value, Instant timestamp, ScanSource scanSource,
        ActivityType activityType) {

    public static ScanHistoryItem of(String value, ScanSource source, ActivityType activityType, Clock clock) {
        return new ScanHistoryItem(UUID.randomUUID().toString(), value, clock.instant(), source, activityType);
    }

    /**
     * @return the value truncated to {@code maxLength} characters with a trailing ellipsis
     */
    public String shortValue(int maxLength) {
        if (value == null || value.length() <= maxLength) {
            return value;
        }
        return value.substring(0, maxLength) + "...";
    }
}

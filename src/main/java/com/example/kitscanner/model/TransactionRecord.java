package com.example.kitscanner.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;

import java.time.Clock;

/**
 * Persisted checkout, check-in or free-form entry. Kit-only check-ins and free-form entries carry no user.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Checkout, check-in or other scan entry")
public record TransactionRecord(
        @JsonProperty("user")
        @Schema(description = "User identifier, absent for kit-only check-ins", example = "USER123")
        String userId,
        @JsonProperty("kit") @Schema(description = "Kit identifier", example = "KIT456") String kitId,
        @Schema(description = "Record type") RecordType type,
        @Schema(description = "Human readable summary or raw value") String value,
        @Schema(description = "ISO-8601 creation instant") String timestamp) implements StoredRecord {

    public static TransactionRecord checkout(String userId, String kitId, Clock clock) {
        return new TransactionRecord(userId, kitId, RecordType.CHECKOUT,
                "User " + userId + " checked out Kit " + kitId, clock.instant().toString());
    }

    /**
     * @param userId the returning user, or {@code null} when the station checks in kits without a user
     */
    public static TransactionRecord checkIn(String userId, String kitId, Clock clock) {
        String value = userId == null
                ? "Kit " + kitId + " checked in"
                : "User " + userId + " checked in Kit " + kitId;
        return new TransactionRecord(userId, kitId, RecordType.CHECKIN, value, clock.instant().toString());
    }

    public static TransactionRecord other(String value, Clock clock) {
        return new TransactionRecord(null, null, RecordType.OTHER, value, clock.instant().toString());
    }
}

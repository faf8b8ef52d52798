package com.example.kitscanner.model;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Observable state of a checkout or check-in station")
public record CheckoutStatus(
        RecordType transactionType,
        CheckoutState state,
        String pendingUserId,
        String pendingKitId,
        String statusMessage,
        boolean accepting,
        boolean undoAvailable,
        boolean reviewEnabled,
        @Schema(description = "False when a single kit scan completes a check-in") boolean userRequired) {
}

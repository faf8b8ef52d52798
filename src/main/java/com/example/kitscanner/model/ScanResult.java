package com.example.kitscanner.model;

import com.example.kitscanner.model.inventory.InventoryRecord;
import com.example.kitscanner.model.kit.ComponentDetectionResult;
import com.example.kitscanner.model.kit.DuplicateComponentConflict;
import com.example.kitscanner.model.kit.KitRecord;
import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;

/**
 * Outcome of every public engine entry point. Engines report through this value instead of throwing.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Result of a scan or a resolution callback")
public record ScanResult(
        Outcome outcome,
        String message,
        TransactionRecord transaction,
        KitRecord kit,
        ComponentDetectionResult detection,
        DuplicateComponentConflict conflict,
        InventoryRecord inventory) {

    public enum Outcome {
        /** State advanced, nothing persisted. */
        ACCEPTED,
        /** Both ids known, waiting for confirm or cancel. */
        REVIEW_PENDING,
        /** A record was persisted. */
        RECORDED,
        /** Sanitization or validation failed; state unchanged. */
        REJECTED,
        /** Engine was not accepting scans; input discarded. */
        DROPPED,
        DUPLICATE_IDENTIFIER,
        SLOT_CONFLICT,
        CONFIRMATION_REQUIRED,
        MANUAL_SELECTION_REQUIRED,
        PERSISTENCE_FAILED,
        UNDONE,
        IGNORED,
        CANCELLED,
        /** Entry point called in a state where it has no effect. */
        NOTHING_TO_DO
    }

    public static ScanResult of(Outcome outcome, String message) {
        return new ScanResult(outcome, message, null, null, null, null, null);
    }

    public static ScanResult recorded(String message, TransactionRecord transaction) {
        return new ScanResult(Outcome.RECORDED, message, transaction, null, null, null, null);
    }

    public static ScanResult recorded(String message, KitRecord kit) {
        return new ScanResult(Outcome.RECORDED, message, null, kit, null, null, null);
    }

    public static ScanResult recorded(String message, InventoryRecord inventory) {
        return new ScanResult(Outcome.RECORDED, message, null, null, null, null, inventory);
    }

    public static ScanResult detection(Outcome outcome, String message, ComponentDetectionResult detection) {
        return new ScanResult(outcome, message, null, null, detection, null, null);
    }

    public static ScanResult conflict(String message, DuplicateComponentConflict conflict) {
        return new ScanResult(Outcome.SLOT_CONFLICT, message, null, null, null, conflict, null);
    }

    public boolean isSuccess() {
        return outcome == Outcome.ACCEPTED
                || outcome == Outcome.REVIEW_PENDING
                || outcome == Outcome.RECORDED
                || outcome == Outcome.UNDONE;
    }
}

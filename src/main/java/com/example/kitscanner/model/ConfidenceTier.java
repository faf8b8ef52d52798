package com.example.kitscanner.model;

/**
 * Bucketed detection confidence. Governs how much human confirmation a detected component needs.
 */
public enum ConfidenceTier {
    /** Auto-assign. */
    HIGH,
    /** Ask the operator to confirm the suggested slot. */
    MEDIUM,
    /** Ask the operator to pick the slot. */
    LOW
}

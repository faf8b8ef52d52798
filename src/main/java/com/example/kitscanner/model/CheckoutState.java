package com.example.kitscanner.model;

/**
 * States of the dual-scan reconciliation.
 */
public enum CheckoutState {
    IDLE,
    USER_SCANNED,
    KIT_SCANNED,
    REVIEW_PENDING
}

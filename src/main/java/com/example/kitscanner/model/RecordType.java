package com.example.kitscanner.model;

/**
 * Type tag stored with every persisted record.
 */
public enum RecordType {
    CHECKOUT,
    CHECKIN,
    OTHER,
    KIT_BUNDLE,
    INVENTORY
}

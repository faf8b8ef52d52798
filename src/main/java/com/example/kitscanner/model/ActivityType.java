package com.example.kitscanner.model;

public enum ActivityType {
    CHECKOUT,
    CHECKIN,
    KIT_BUNDLE,
    INVENTORY
}

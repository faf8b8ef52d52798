package com.example.kitscanner.model.kit;

/**
 * Physical component categories that can be bundled into a kit.
 */
public enum ComponentType {
    GLASSES("Glasses"),
    CONTROLLER("Controller"),
    BATTERY_1("Battery 01"),
    BATTERY_2("Battery 02"),
    BATTERY_3("Battery 03"),
    PADS("Pads"),
    UNUSED_1("Unused 01"),
    UNUSED_2("Unused 02");

    private final String displayName;

    ComponentType(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }

    public boolean isBattery() {
        return this == BATTERY_1 || this == BATTERY_2 || this == BATTERY_3;
    }
}

package com.example.kitscanner.model.inventory;

import com.example.kitscanner.model.kit.ComponentType;

/**
 * Device categories counted by an inventory session.
 */
public enum InventoryComponentType {
    GLASSES("Glasses", "Glasses"),
    CONTROLLER("Controller", "Controllers"),
    BATTERY("Battery", "Batteries");

    private final String displayName;
    private final String pluralName;

    InventoryComponentType(String displayName, String pluralName) {
        this.displayName = displayName;
        this.pluralName = pluralName;
    }

    public String displayName() {
        return displayName;
    }

    public String pluralName() {
        return pluralName;
    }

    /**
     * @return the inventory category of a kit component type, or {@code null} for pads and unused slots
     */
    public static InventoryComponentType of(ComponentType componentType) {
        if (componentType == null) {
            return null;
        }
        if (componentType.isBattery()) {
            return BATTERY;
        }
        return switch (componentType) {
            case GLASSES -> GLASSES;
            case CONTROLLER -> CONTROLLER;
            default -> null;
        };
    }
}

package com.example.kitscanner.model.kit;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;
import java.util.Locale;

/**
 * The eight fixed positions of a kit bundle, in declaration order.
 */
public enum SlotId {
    GLASSES("glasses", "Glasses", ComponentType.GLASSES),
    CONTROLLER("controller", "Controller", ComponentType.CONTROLLER),
    BATTERY_01("battery01", "Battery 01", ComponentType.BATTERY_1),
    BATTERY_02("battery02", "Battery 02", ComponentType.BATTERY_2),
    BATTERY_03("battery03", "Battery 03", ComponentType.BATTERY_3),
    PADS("pads", "Pads", ComponentType.PADS),
    UNUSED_01("unused01", "Unused 01", ComponentType.UNUSED_1),
    UNUSED_02("unused02", "Unused 02", ComponentType.UNUSED_2);

    public static final List<SlotId> BATTERY_SLOTS = List.of(BATTERY_01, BATTERY_02, BATTERY_03);

    private final String id;
    private final String displayName;
    private final ComponentType componentType;

    SlotId(String id, String displayName, ComponentType componentType) {
        this.id = id;
        this.displayName = displayName;
        this.componentType = componentType;
    }

    @JsonValue
    public String id() {
        return id;
    }

    public String displayName() {
        return displayName;
    }

    public ComponentType componentType() {
        return componentType;
    }

    public boolean isBatterySlot() {
        return componentType.isBattery();
    }

    /**
     * Resolves a slot from its wire id ({@code battery01}) or its enum name ({@code BATTERY_01}).
     *
     * @throws IllegalArgumentException when the value names no slot
     */
    @JsonCreator
    public static SlotId fromId(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Slot id is required");
        }
        String trimmed = value.trim();
        for (SlotId slot : values()) {
            if (slot.id.equalsIgnoreCase(trimmed) || slot.name().equals(trimmed.toUpperCase(Locale.ROOT))) {
                return slot;
            }
        }
        throw new IllegalArgumentException("Unknown slot: " + value);
    }
}

package com.example.kitscanner.model.kit;

import java.util.ArrayList;
import java.util.List;

/**
 * Minimum-requirement fulfilment of a kit. Computed from the filled slots, never stored.
 */
public record RequirementStatus(
        boolean hasMinGlasses,
        boolean hasMinController,
        boolean hasMinBatteries,
        boolean complete,
        int glassesCount,
        int controllerCount,
        int batteryCount) {

    public static final int MIN_GLASSES = 1;
    public static final int MIN_CONTROLLER = 1;
    public static final int MIN_BATTERIES = 2;
    public static final int MAX_BATTERIES = 3;

    public static RequirementStatus of(int glassesCount, int controllerCount, int batteryCount) {
        boolean glasses = glassesCount >= MIN_GLASSES;
        boolean controller = controllerCount >= MIN_CONTROLLER;
        boolean batteries = batteryCount >= MIN_BATTERIES;
        return new RequirementStatus(glasses, controller, batteries, glasses && controller && batteries,
                glassesCount, controllerCount, batteryCount);
    }

    public String progressMessage() {
        List<String> parts = new ArrayList<>();
        parts.add("Glasses: " + mark(hasMinGlasses) + " (" + glassesCount + "/" + MIN_GLASSES + ")");
        parts.add("Controller: " + mark(hasMinController) + " (" + controllerCount + "/" + MIN_CONTROLLER + ")");
        parts.add("Batteries: " + batterySymbols() + " (" + batteryCount + "/" + MIN_BATTERIES + " min)");
        return String.join(" | ", parts);
    }

    /**
     * @return a "Still need: ..." line, or {@code null} when every minimum is met
     */
    public String missingComponentsMessage() {
        List<String> missing = new ArrayList<>();
        if (!hasMinGlasses) {
            missing.add((MIN_GLASSES - glassesCount) + " glasses");
        }
        if (!hasMinController) {
            missing.add((MIN_CONTROLLER - controllerCount) + " controller");
        }
        if (!hasMinBatteries) {
            int needed = MIN_BATTERIES - batteryCount;
            missing.add(needed + (needed == 1 ? " battery" : " batteries"));
        }
        return missing.isEmpty() ? null : "Still need: " + String.join(", ", missing);
    }

    private static String mark(boolean met) {
        return met ? "✓" : "⚠";
    }

    private String batterySymbols() {
        StringBuilder symbols = new StringBuilder();
        int shown = Math.min(batteryCount, MAX_BATTERIES);
        symbols.append("✓".repeat(shown));
        if (shown < MIN_BATTERIES) {
            symbols.append("⚠".repeat(MIN_BATTERIES - shown));
        }
        return symbols.toString();
    }
}

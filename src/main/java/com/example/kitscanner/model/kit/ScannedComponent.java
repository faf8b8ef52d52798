package com.example.kitscanner.model.kit;

import java.time.Instant;
import java.util.Objects;

/**
 * A scan that has been assigned to a slot of the kit being assembled.
 */
public record ScannedComponent(String rawIdentifier, ComponentType componentType, SlotId assignedSlot,
        Instant capturedAt) {

    public ScannedComponent {
        Objects.requireNonNull(rawIdentifier, "rawIdentifier");
        Objects.requireNonNull(assignedSlot, "assignedSlot");
        Objects.requireNonNull(capturedAt, "capturedAt");
    }

    /**
     * @return the last eight characters of the identifier, as shown on the scanner display
     */
    public String shortIdentifier() {
        return rawIdentifier.length() > 8 ? rawIdentifier.substring(rawIdentifier.length() - 8) : rawIdentifier;
    }
}

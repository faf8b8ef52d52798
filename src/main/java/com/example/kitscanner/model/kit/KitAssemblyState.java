package com.example.kitscanner.model.kit;

import java.util.Collections;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Mutable state of one kit while it is being assembled. Owned by a single engine instance.
 * <p>
 * A raw identifier is in {@link #scannedRawIdentifiers()} exactly when it occupies a slot, and every
 * slot holds at most one component.
 */
public final class KitAssemblyState {

    private final String baseKitCode;
    private final Map<SlotId, ScannedComponent> scannedComponents = new EnumMap<>(SlotId.class);
    private final Set<String> scannedRawIdentifiers = new HashSet<>();

    public KitAssemblyState(String baseKitCode) {
        this.baseKitCode = Objects.requireNonNull(baseKitCode, "baseKitCode");
    }

    public String baseKitCode() {
        return baseKitCode;
    }

    public Map<SlotId, ScannedComponent> scannedComponents() {
        return Collections.unmodifiableMap(scannedComponents);
    }

    public Set<String> scannedRawIdentifiers() {
        return Collections.unmodifiableSet(scannedRawIdentifiers);
    }

    public boolean isEmpty() {
        return scannedComponents.isEmpty();
    }

    public boolean isOccupied(SlotId slot) {
        return scannedComponents.containsKey(slot);
    }

    public boolean contains(String rawIdentifier) {
        return scannedRawIdentifiers.contains(rawIdentifier);
    }

    public Optional<ScannedComponent> occupant(SlotId slot) {
        return Optional.ofNullable(scannedComponents.get(slot));
    }

    /**
     * @throws IllegalStateException if the slot is taken or the identifier already sits in another slot
     */
    public void install(ScannedComponent component) {
        SlotId slot = component.assignedSlot();
        if (scannedComponents.containsKey(slot)) {
            throw new IllegalStateException("Slot " + slot.id() + " is already occupied");
        }
        if (scannedRawIdentifiers.contains(component.rawIdentifier())) {
            throw new IllegalStateException("Identifier " + component.rawIdentifier() + " is already assigned");
        }
        scannedComponents.put(slot, component);
        scannedRawIdentifiers.add(component.rawIdentifier());
    }

    public Optional<ScannedComponent> evict(SlotId slot) {
        ScannedComponent removed = scannedComponents.remove(slot);
        if (removed != null) {
            scannedRawIdentifiers.remove(removed.rawIdentifier());
        }
        return Optional.ofNullable(removed);
    }

    public RequirementStatus requirementStatus() {
        int glasses = 0;
        int controllers = 0;
        int batteries = 0;
        for (SlotId slot : scannedComponents.keySet()) {
            if (slot == SlotId.GLASSES) {
                glasses++;
            } else if (slot == SlotId.CONTROLLER) {
                controllers++;
            } else if (slot.isBatterySlot()) {
                batteries++;
            }
        }
        return RequirementStatus.of(glasses, controllers, batteries);
    }
}

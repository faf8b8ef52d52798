package com.example.kitscanner.service.kit;

import com.example.kitscanner.model.kit.ComponentType;
import com.example.kitscanner.model.kit.KitAssemblyState;
import com.example.kitscanner.model.kit.SlotId;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Duplicate detection and slot proposals for the kit being assembled. Stateless; every call reads the
 * state it is given.
 */
@Component
public class DuplicateAndSlotResolver {

    private static final List<SlotId> OVERFLOW_SLOTS = List.of(SlotId.UNUSED_01, SlotId.UNUSED_02);

    public boolean isDuplicate(KitAssemblyState state, String rawIdentifier) {
        return state != null && rawIdentifier != null && state.contains(rawIdentifier);
    }

    /**
     * Singleton types map to their fixed slot whether or not it is free, so the caller can detect a slot
     * conflict. Any battery type takes the first free battery slot.
     *
     * @return the proposed slot, or {@code null} when no type was inferred or every battery slot is taken
     */
    public SlotId suggestSlot(ComponentType componentType, KitAssemblyState state) {
        if (componentType == null) {
            return null;
        }
        return switch (componentType) {
            case GLASSES -> SlotId.GLASSES;
            case CONTROLLER -> SlotId.CONTROLLER;
            case PADS -> SlotId.PADS;
            case UNUSED_1 -> SlotId.UNUSED_01;
            case UNUSED_2 -> SlotId.UNUSED_02;
            case BATTERY_1, BATTERY_2, BATTERY_3 -> firstFree(SlotId.BATTERY_SLOTS, state);
        };
    }

    /**
     * @return free slots in declaration order
     */
    public List<SlotId> availableSlots(KitAssemblyState state) {
        List<SlotId> available = new ArrayList<>();
        for (SlotId slot : SlotId.values()) {
            if (state == null || !state.isOccupied(slot)) {
                available.add(slot);
            }
        }
        return available;
    }

    /**
     * Alternate for a scan whose slot is taken: another battery slot for batteries, otherwise the first
     * free unused slot.
     */
    public SlotId suggestAlternate(ComponentType componentType, KitAssemblyState state) {
        if (componentType != null && componentType.isBattery()) {
            SlotId battery = firstFree(SlotId.BATTERY_SLOTS, state);
            if (battery != null) {
                return battery;
            }
        }
        return firstFree(OVERFLOW_SLOTS, state);
    }

    private static SlotId firstFree(List<SlotId> candidates, KitAssemblyState state) {
        for (SlotId slot : candidates) {
            if (state == null || !state.isOccupied(slot)) {
                return slot;
            }
        }
        return null;
    }
}

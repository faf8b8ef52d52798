package com.example.kitscanner.service.kit;

import com.example.kitscanner.model.kit.ComponentType;
import com.example.kitscanner.model.kit.KitAssemblyState;
import com.example.kitscanner.model.kit.ScannedComponent;
import com.example.kitscanner.model.kit.SlotId;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class DuplicateAndSlotResolverTest {

    private final DuplicateAndSlotResolver resolver = new DuplicateAndSlotResolver();
    private KitAssemblyState state;

    @BeforeEach
    void setUp() {
        state = new KitAssemblyState("K100");
    }

    @Test
    void duplicateMeansAlreadyInstalled() {
        install("G0G348025246001", SlotId.GLASSES);

        assertThat(resolver.isDuplicate(state, "G0G348025246001")).isTrue();
        assertThat(resolver.isDuplicate(state, "G0G46K025224001")).isFalse();
    }

    @Test
    void singletonTypesMapToTheirSlotEvenWhenOccupied() {
        install("G0G348025246001", SlotId.GLASSES);

        assertThat(resolver.suggestSlot(ComponentType.GLASSES, state)).isEqualTo(SlotId.GLASSES);
        assertThat(resolver.suggestSlot(ComponentType.CONTROLLER, state)).isEqualTo(SlotId.CONTROLLER);
        assertThat(resolver.suggestSlot(ComponentType.PADS, state)).isEqualTo(SlotId.PADS);
        assertThat(resolver.suggestSlot(ComponentType.UNUSED_2, state)).isEqualTo(SlotId.UNUSED_02);
        assertThat(resolver.suggestSlot(null, state)).isNull();
    }

    @Test
    void batteriesTakeFirstFreeBatterySlotRegardlessOfSubIndex() {
        assertThat(resolver.suggestSlot(ComponentType.BATTERY_3, state)).isEqualTo(SlotId.BATTERY_01);

        install("G0G4NU015166001", SlotId.BATTERY_01);
        install("G0G4NU015166003", SlotId.BATTERY_03);

        assertThat(resolver.suggestSlot(ComponentType.BATTERY_1, state)).isEqualTo(SlotId.BATTERY_02);

        install("G0G4NU015166002", SlotId.BATTERY_02);

        assertThat(resolver.suggestSlot(ComponentType.BATTERY_1, state)).isNull();
    }

    @Test
    void availableSlotsKeepDeclarationOrder() {
        install("G0G46K025224001", SlotId.CONTROLLER);
        install("G0G4NU015166001", SlotId.BATTERY_02);

        assertThat(resolver.availableSlots(state)).containsExactly(
                SlotId.GLASSES, SlotId.BATTERY_01, SlotId.BATTERY_03, SlotId.PADS, SlotId.UNUSED_01, SlotId.UNUSED_02);
        assertThat(resolver.availableSlots(null)).containsExactly(SlotId.values());
    }

    @Test
    void alternateIsAnotherBatteryOrAnUnusedSlot() {
        install("G0G4NU015166001", SlotId.BATTERY_01);

        assertThat(resolver.suggestAlternate(ComponentType.BATTERY_1, state)).isEqualTo(SlotId.BATTERY_02);
        assertThat(resolver.suggestAlternate(ComponentType.GLASSES, state)).isEqualTo(SlotId.UNUSED_01);

        install("UN01-5521", SlotId.UNUSED_01);
        install("UN02-5522", SlotId.UNUSED_02);

        assertThat(resolver.suggestAlternate(ComponentType.GLASSES, state)).isNull();
    }

    private void install(String raw, SlotId slot) {
        state.install(new ScannedComponent(raw, slot.componentType(), slot, Instant.EPOCH));
    }
}

package com.example.kitscanner.model.kit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class KitAssemblyStateTest {

    private KitAssemblyState state;

    @BeforeEach
    void setUp() {
        state = new KitAssemblyState("K100");
    }

    @Test
    void installKeepsIdentifiersAndSlotsInStep() {
        state.install(component("G0G348025246001", SlotId.GLASSES));

        assertThat(state.contains("G0G348025246001")).isTrue();
        assertThat(state.occupant(SlotId.GLASSES)).map(ScannedComponent::rawIdentifier).contains("G0G348025246001");
        assertThat(state.scannedRawIdentifiers()).containsExactly("G0G348025246001");
    }

    @Test
    void refusesSecondComponentInSameSlot() {
        state.install(component("G0G348025246001", SlotId.GLASSES));

        assertThatThrownBy(() -> state.install(component("G0G348025246002", SlotId.GLASSES)))
                .isInstanceOf(IllegalStateException.class);
        assertThat(state.scannedComponents()).hasSize(1);
        assertThat(state.contains("G0G348025246002")).isFalse();
    }

    @Test
    void refusesSameIdentifierInTwoSlots() {
        state.install(component("G0G4NU015166001", SlotId.BATTERY_01));

        assertThatThrownBy(() -> state.install(component("G0G4NU015166001", SlotId.BATTERY_02)))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void evictRemovesIdentifierToo() {
        state.install(component("G0G348025246001", SlotId.GLASSES));

        assertThat(state.evict(SlotId.GLASSES)).isPresent();
        assertThat(state.contains("G0G348025246001")).isFalse();
        assertThat(state.isEmpty()).isTrue();
        assertThat(state.evict(SlotId.GLASSES)).isEmpty();
    }

    @Test
    void requirementsCompleteWithGlassesControllerAndTwoBatteries() {
        state.install(component("G0G348025246001", SlotId.GLASSES));
        state.install(component("G0G46K025224001", SlotId.CONTROLLER));
        state.install(component("G0G4NU015166001", SlotId.BATTERY_01));

        RequirementStatus partial = state.requirementStatus();
        assertThat(partial.complete()).isFalse();
        assertThat(partial.missingComponentsMessage()).isEqualTo("Still need: 1 battery");
        assertThat(partial.progressMessage())
                .isEqualTo("Glasses: ✓ (1/1) | Controller: ✓ (1/1) | Batteries: ✓⚠ (1/2 min)");

        state.install(component("G0G4NU015166002", SlotId.BATTERY_02));

        RequirementStatus complete = state.requirementStatus();
        assertThat(complete.complete()).isTrue();
        assertThat(complete.batteryCount()).isEqualTo(2);
        assertThat(complete.missingComponentsMessage()).isNull();
    }

    @Test
    void addingComponentsNeverUndoesCompletion() {
        state.install(component("G0G348025246001", SlotId.GLASSES));
        state.install(component("G0G46K025224001", SlotId.CONTROLLER));
        state.install(component("G0G4NU015166001", SlotId.BATTERY_01));
        state.install(component("G0G4NU015166002", SlotId.BATTERY_02));

        for (SlotId extra : new SlotId[] {SlotId.BATTERY_03, SlotId.PADS, SlotId.UNUSED_01, SlotId.UNUSED_02}) {
            state.install(component("EXTRA-" + extra.id(), extra));
            assertThat(state.requirementStatus().complete()).isTrue();
        }
        assertThat(state.requirementStatus().progressMessage()).endsWith("Batteries: ✓✓✓ (3/2 min)");
    }

    @Test
    void emptyKitNeedsEverything() {
        assertThat(state.requirementStatus().missingComponentsMessage())
                .isEqualTo("Still need: 1 glasses, 1 controller, 2 batteries");
    }

    private static ScannedComponent component(String raw, SlotId slot) {
        return new ScannedComponent(raw, slot.componentType(), slot, Instant.EPOCH);
    }
}

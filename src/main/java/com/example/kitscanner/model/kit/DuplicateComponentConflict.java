package com.example.kitscanner.model.kit;

import io.swagger.v3.oas.annotations.media.Schema;

/**
 * A new scan whose slot is already held by a different identifier.
 */
@Schema(description = "Slot already occupied by another component")
public record DuplicateComponentConflict(
        @Schema(description = "Identifier that was just scanned") String conflictingRawIdentifier,
        @Schema(description = "Component type inferred for the new scan, absent when no pattern matched")
        ComponentType componentType,
        @Schema(description = "Contested slot") SlotId slot,
        @Schema(description = "Display name of the contested slot") String existingSlotDisplayName,
        @Schema(description = "Identifier currently in the slot") String existingRawIdentifier,
        @Schema(description = "Free slot the new scan could go to instead, if any") SlotId suggestedAlternateSlot) {
}

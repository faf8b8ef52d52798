package com.example.kitscanner.model.kit;

import com.example.kitscanner.model.ConfidenceTier;
import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

/**
 * Detected component awaiting a decision from the confirmation or selection collaborator.
 */
@Schema(description = "Component detection awaiting confirmation or manual slot selection")
public record ComponentDetectionResult(
        @Schema(description = "Identifier as scanned") String rawIdentifier,
        @Schema(description = "Identifier after OCR prefix correction") String correctedIdentifier,
        @Schema(description = "Inferred component type, absent when no pattern matched") ComponentType componentType,
        @Schema(description = "Combined confidence tier") ConfidenceTier confidenceTier,
        @Schema(description = "Whether the operator only has to confirm the suggestion") boolean requiresConfirmation,
        @Schema(description = "Whether the operator has to pick a slot") boolean requiresManualSelection,
        @Schema(description = "Suggested slot, if any") SlotId suggestedSlot,
        @Schema(description = "Slots still free in this kit") List<SlotId> availableSlots) {
}

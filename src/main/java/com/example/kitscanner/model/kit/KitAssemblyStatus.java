package com.example.kitscanner.model.kit;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;
import java.util.Map;

@Schema(description = "Observable state of the kit bundling station")
public record KitAssemblyStatus(
        KitAssemblyPhase phase,
        String baseKitCode,
        @Schema(description = "Filled slots keyed by slot id") Map<String, String> components,
        RequirementStatus requirementStatus,
        @Schema(description = "True exactly when every minimum requirement is met") boolean readyToSave,
        String statusMessage,
        String instruction,
        String requirementProgress,
        String componentSummary,
        boolean accepting,
        boolean undoAvailable,
        ComponentDetectionResult pendingDetection,
        DuplicateComponentConflict pendingConflict,
        List<SlotId> availableSlots) {
}

package com.example.kitscanner.model.api;

import com.example.kitscanner.model.kit.SlotId;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record SlotAssignmentRequest(
        @Schema(description = "Identifier of the pending detection", example = "GL-123456")
        @NotBlank
        String rawIdentifier,
        @Schema(description = "Target slot id", example = "glasses")
        @NotNull
        SlotId slot) {
}

package com.example.kitscanner.model.api;

import io.swagger.v3.oas.annotations.media.Schema;

public record ReviewUpdateRequest(
        @Schema(description = "Replacement user id; omit to keep the pending one", example = "USER123") String userId,
        @Schema(description = "Replacement kit id; omit to keep the pending one", example = "KIT456") String kitId) {
}

package com.example.kitscanner.model.api;

import io.swagger.v3.oas.annotations.media.Schema;

public record ManualEntryRequest(
        @Schema(description = "DSN typed by the operator", example = "g0g348 025246001") String text) {
}

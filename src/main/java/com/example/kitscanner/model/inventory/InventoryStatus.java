package com.example.kitscanner.model.inventory;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Observable state of the inventory station")
public record InventoryStatus(
        @Schema(description = "Category assigned to the next scanned device") InventoryComponentType componentType,
        String statusMessage,
        boolean accepting,
        @Schema(description = "Devices counted in the current session") int scanCount,
        boolean undoAvailable) {
}

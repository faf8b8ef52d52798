package com.example.kitscanner.model.api;

import com.example.kitscanner.model.inventory.InventoryComponentType;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;

public record ComponentTypeRequest(
        @Schema(description = "Category for the devices scanned next", example = "CONTROLLER")
        @NotNull
        InventoryComponentType componentType) {
}

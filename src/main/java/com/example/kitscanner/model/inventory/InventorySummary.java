package com.example.kitscanner.model.inventory;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;
import java.util.Map;

/**
 * Counts of the current inventory session, with the devices ordered by category and then by scan time.
 */
@Schema(description = "Inventory session summary")
public record InventorySummary(
        String locationId,
        int totalDevices,
        @Schema(description = "Device count keyed by category display name") Map<String, Integer> devicesByType,
        List<InventoryRecord> devices,
        @Schema(example = "Inventory Summary:\nGlasses: 2\nControllers: 1\nBatteries: 0\nTotal: 3") String text) {
}

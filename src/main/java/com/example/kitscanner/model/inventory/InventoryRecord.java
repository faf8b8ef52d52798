package com.example.kitscanner.model.inventory;

import com.example.kitscanner.model.RecordType;
import com.example.kitscanner.model.ScanSource;
import com.example.kitscanner.model.StoredRecord;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;

import java.time.Clock;

/**
 * One device counted during an inventory session.
 */
@Schema(description = "Device counted in an inventory session")
public record InventoryRecord(
        @JsonProperty("device_id") @Schema(example = "G0G348025246001") String deviceId,
        @JsonProperty("component_type") InventoryComponentType componentType,
        @JsonProperty("scan_mode") @Schema(description = "How the device id was captured") ScanSource scanMode,
        @Schema(description = "ISO-8601 creation instant") String timestamp) implements StoredRecord {

    public static InventoryRecord create(String deviceId, InventoryComponentType componentType, ScanSource scanMode,
            Clock clock) {
        return new InventoryRecord(deviceId, componentType, scanMode, clock.instant().toString());
    }

    @Override
    @JsonIgnore
    public RecordType type() {
        return RecordType.INVENTORY;
    }
}

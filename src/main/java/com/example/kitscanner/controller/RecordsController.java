package com.example.kitscanner.controller;

import com.example.kitscanner.model.ActivityType;
import com.example.kitscanner.model.ScanHistoryItem;
import com.example.kitscanner.model.StoredRecord;
import com.example.kitscanner.model.TransactionRecord;
import com.example.kitscanner.model.inventory.InventoryRecord;
import com.example.kitscanner.model.kit.KitRecord;
import com.example.kitscanner.service.history.ScanHistory;
import com.example.kitscanner.service.storage.RecordStore;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.time.LocalDate;
import java.util.List;
import java.util.Locale;

import static org.springframework.http.HttpStatus.NOT_FOUND;

@RestController
@RequestMapping("/api")
@Tag(name = "Records", description = "Saved records and recent scan history")
public class RecordsController {

    private final RecordStore<TransactionRecord> checkoutRecordStore;
    private final RecordStore<TransactionRecord> checkInRecordStore;
    private final RecordStore<KitRecord> kitRecordStore;
    private final RecordStore<InventoryRecord> inventoryRecordStore;
    private final ScanHistory scanHistory;

    public RecordsController(@Qualifier("checkoutRecordStore") RecordStore<TransactionRecord> checkoutRecordStore,
            @Qualifier("checkInRecordStore") RecordStore<TransactionRecord> checkInRecordStore,
            @Qualifier("kitRecordStore") RecordStore<KitRecord> kitRecordStore,
            @Qualifier("inventoryRecordStore") RecordStore<InventoryRecord> inventoryRecordStore,
            ScanHistory scanHistory) {
        this.checkoutRecordStore = checkoutRecordStore;
        this.checkInRecordStore = checkInRecordStore;
        this.kitRecordStore = kitRecordStore;
        this.inventoryRecordStore = inventoryRecordStore;
        this.scanHistory = scanHistory;
    }

    @GetMapping("/records/{family}")
    @Operation(summary = "Records saved on a day", description = "Family is checkouts, checkins, kits or inventory. Defaults to today.")
    public ResponseEntity<List<? extends StoredRecord>> records(
            @Parameter(example = "checkouts") @PathVariable String family,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        RecordStore<? extends StoredRecord> store = switch (family) {
            case "checkouts" -> checkoutRecordStore;
            case "checkins" -> checkInRecordStore;
            case "kits" -> kitRecordStore;
            case "inventory" -> inventoryRecordStore;
            default -> throw new ResponseStatusException(NOT_FOUND, "Unknown record family: " + family);
        };
        List<? extends StoredRecord> records = date == null ? store.recordsForToday() : store.recordsForDate(date);
        return ResponseEntity.ok(records);
    }

    @GetMapping("/history/{activity}")
    @Operation(summary = "Recent scans of an activity, most recent first")
    public ResponseEntity<List<ScanHistoryItem>> history(
            @Parameter(example = "kit_bundle") @PathVariable String activity) {
        ActivityType activityType = ActivityType.valueOf(activity.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
        return ResponseEntity.ok(scanHistory.recent(activityType));
    }
}

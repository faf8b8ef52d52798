package com.example.kitscanner.controller;

import com.example.kitscanner.model.ScanResult;
import com.example.kitscanner.model.api.ComponentTypeRequest;
import com.example.kitscanner.model.api.ScanRequest;
import com.example.kitscanner.model.inventory.InventoryStatus;
import com.example.kitscanner.model.inventory.InventorySummary;
import com.example.kitscanner.service.inventory.InventoryEngine;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/inventory")
@Tag(name = "Inventory", description = "Device inventory counting")
public class InventoryController {

    private final InventoryEngine engine;

    public InventoryController(InventoryEngine engine) {
        this.engine = engine;
    }

    @GetMapping
    @Operation(summary = "Selected category and session count")
    public ResponseEntity<InventoryStatus> status() {
        return ResponseEntity.ok(engine.status());
    }

    @PutMapping("/component-type")
    @Operation(summary = "Choose the category of the devices scanned next")
    public ResponseEntity<ScanResult> selectComponentType(@Valid @RequestBody ComponentTypeRequest request) {
        return ResponseEntity.ok(engine.selectComponentType(request.componentType()));
    }

    @PostMapping("/scans")
    @Operation(summary = "Count a scanned device id",
            description = "Devices already counted in this session are reported as duplicates.")
    public ResponseEntity<ScanResult> scan(@Valid @RequestBody ScanRequest request) {
        return ResponseEntity.ok(engine.processScan(request.toCandidate()));
    }

    @PostMapping("/undo")
    @Operation(summary = "Remove the last counted device")
    public ResponseEntity<ScanResult> undo() {
        return ResponseEntity.ok(engine.undoLast());
    }

    @PostMapping("/clear")
    @Operation(summary = "Start a new session; saved records are kept")
    public ResponseEntity<ScanResult> clear() {
        return ResponseEntity.ok(engine.clearInventory());
    }

    @GetMapping("/summary")
    @Operation(summary = "Counts per category and the devices of the session")
    public ResponseEntity<InventorySummary> summary() {
        return ResponseEntity.ok(engine.summary());
    }
}

package com.example.kitscanner.controller;

import com.example.kitscanner.model.ScanResult;
import com.example.kitscanner.model.api.ManualEntryRequest;
import com.example.kitscanner.model.api.ScanRequest;
import com.example.kitscanner.model.api.SlotAssignmentRequest;
import com.example.kitscanner.model.kit.KitAssemblyStatus;
import com.example.kitscanner.service.kit.KitAssemblyEngine;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/kit-bundles")
@Tag(name = "Kit bundles", description = "Kit bundling station")
public class KitBundleController {

    private final KitAssemblyEngine engine;

    public KitBundleController(KitAssemblyEngine engine) {
        this.engine = engine;
    }

    @GetMapping
    @Operation(summary = "Current kit, requirement progress and any pending decision")
    public ResponseEntity<KitAssemblyStatus> status() {
        return ResponseEntity.ok(engine.status());
    }

    @PostMapping("/scans")
    @Operation(summary = "Submit a kit code or component DSN",
            description = "The first scan names the kit, later scans are components.")
    public ResponseEntity<ScanResult> scan(@Valid @RequestBody ScanRequest request) {
        return ResponseEntity.ok(engine.processScan(request.toCandidate()));
    }

    @PostMapping("/manual-entries")
    @Operation(summary = "Enter a component DSN by hand")
    public ResponseEntity<ScanResult> manualEntry(@RequestBody ManualEntryRequest request) {
        return ResponseEntity.ok(engine.submitManualEntry(request.text()));
    }

    @PostMapping("/assignments")
    @Operation(summary = "Assign the pending component to a slot")
    public ResponseEntity<ScanResult> assign(@Valid @RequestBody SlotAssignmentRequest request) {
        return ResponseEntity.ok(engine.confirmComponentAssignment(request.rawIdentifier(), request.slot()));
    }

    @PostMapping("/conflict/ignore")
    @Operation(summary = "Discard the scan that hit an occupied slot")
    public ResponseEntity<ScanResult> ignoreConflict() {
        return ResponseEntity.ok(engine.ignoreDuplicateComponent());
    }

    @PostMapping("/conflict/reassign")
    @Operation(summary = "Replace the occupant of the contested slot with the new scan")
    public ResponseEntity<ScanResult> reassignConflict() {
        return ResponseEntity.ok(engine.reassignDuplicateComponent());
    }

    @PostMapping("/detection/cancel")
    @Operation(summary = "Dismiss the pending detection or conflict")
    public ResponseEntity<ScanResult> cancelDetection() {
        return ResponseEntity.ok(engine.cancelComponentDetection());
    }

    @PostMapping("/save")
    @Operation(summary = "Save the kit bundle")
    public ResponseEntity<ScanResult> save() {
        return ResponseEntity.ok(engine.saveKitBundle());
    }

    @PostMapping("/undo")
    @Operation(summary = "Delete the most recently saved kit bundle while undo is offered")
    public ResponseEntity<ScanResult> undo() {
        return ResponseEntity.ok(engine.undoLastKitBundle());
    }

    @PostMapping("/clear")
    @Operation(summary = "Discard the kit in progress")
    public ResponseEntity<ScanResult> clear() {
        return ResponseEntity.ok(engine.clearState());
    }
}

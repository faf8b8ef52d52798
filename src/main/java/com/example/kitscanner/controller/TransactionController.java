package com.example.kitscanner.controller;

import com.example.kitscanner.model.CheckoutStatus;
import com.example.kitscanner.model.ScanResult;
import com.example.kitscanner.model.api.ReviewUpdateRequest;
import com.example.kitscanner.model.api.ScanRequest;
import com.example.kitscanner.service.transaction.CheckoutReconciler;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import static org.springframework.http.HttpStatus.NOT_FOUND;

@RestController
@RequestMapping("/api/transactions/{mode}")
@Tag(name = "Transactions", description = "Dual-scan checkout and check-in stations")
public class TransactionController {

    private final CheckoutReconciler checkoutReconciler;
    private final CheckoutReconciler checkInReconciler;

    public TransactionController(@Qualifier("checkoutReconciler") CheckoutReconciler checkoutReconciler,
            @Qualifier("checkInReconciler") CheckoutReconciler checkInReconciler) {
        this.checkoutReconciler = checkoutReconciler;
        this.checkInReconciler = checkInReconciler;
    }

    @GetMapping
    @Operation(summary = "Current state of the station")
    public ResponseEntity<CheckoutStatus> status(@Parameter(example = "checkout") @PathVariable String mode) {
        return ResponseEntity.ok(reconciler(mode).status());
    }

    @PostMapping("/scans")
    @Operation(summary = "Submit a scanned user or kit identifier",
            description = "Scans are paired in either order. Rejected or dropped scans are reported in the outcome, not as HTTP errors.")
    public ResponseEntity<ScanResult> scan(@PathVariable String mode, @Valid @RequestBody ScanRequest request) {
        return ResponseEntity.ok(reconciler(mode).processScan(request.toCandidate()));
    }

    @PostMapping("/review")
    @Operation(summary = "Edit the user or kit id of the pair under review")
    public ResponseEntity<ScanResult> updateReview(@PathVariable String mode,
            @RequestBody ReviewUpdateRequest request) {
        return ResponseEntity.ok(reconciler(mode).updateReview(request.userId(), request.kitId()));
    }

    @PostMapping("/review/confirm")
    @Operation(summary = "Save the pair under review")
    public ResponseEntity<ScanResult> confirmReview(@PathVariable String mode) {
        return ResponseEntity.ok(reconciler(mode).confirmReview());
    }

    @PostMapping("/review/cancel")
    @Operation(summary = "Discard the pair under review")
    public ResponseEntity<ScanResult> cancelReview(@PathVariable String mode) {
        return ResponseEntity.ok(reconciler(mode).cancelReview());
    }

    @PostMapping("/undo")
    @Operation(summary = "Delete the most recent record while undo is offered")
    public ResponseEntity<ScanResult> undo(@PathVariable String mode) {
        return ResponseEntity.ok(reconciler(mode).undoLast());
    }

    @PostMapping("/clear")
    @Operation(summary = "Discard pending ids and get ready for a new pair")
    public ResponseEntity<ScanResult> clear(@PathVariable String mode) {
        return ResponseEntity.ok(reconciler(mode).clearState());
    }

    private CheckoutReconciler reconciler(String mode) {
        return switch (mode) {
            case "checkout" -> checkoutReconciler;
            case "checkin" -> checkInReconciler;
            default -> throw new ResponseStatusException(NOT_FOUND, "Unknown transaction mode: " + mode);
        };
    }
}

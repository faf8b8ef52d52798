package com.example.kitscanner.model.api;

import com.example.kitscanner.model.ScanCandidate;
import com.example.kitscanner.model.ScanSource;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;

/**
 * Scan forwarded by the front end. Blank text is passed through so the engine can
 * report it as rejected input.
 */
public record ScanRequest(
        @Schema(description = "Decoded text", example = "USER123")
        String text,
        @Schema(description = "Decoder confidence between 0 and 1; omit for barcode scans", example = "0.97")
        @DecimalMin("0.0") @DecimalMax("1.0")
        Double ocrConfidence,
        @Schema(description = "Decoder reported format tag", example = "QR_CODE")
        String format,
        @Schema(description = "Origin of the text, defaults to BARCODE")
        ScanSource source) {

    public ScanCandidate toCandidate() {
        double confidence = ocrConfidence != null ? ocrConfidence : 1.0;
        return new ScanCandidate(text == null ? "" : text, confidence, format, source);
    }
}

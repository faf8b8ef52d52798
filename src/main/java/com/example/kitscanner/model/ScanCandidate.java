package com.example.kitscanner.model;

import io.swagger.v3.oas.annotations.media.Schema;

/**
 * Decoded text delivered by the frame source, together with the decoder's confidence.
 */
@Schema(description = "A single decoded scan")
public record ScanCandidate(
        @Schema(description = "Decoded text", example = "G0G348025246001") String text,
        @Schema(description = "Decoder confidence, 1.0 for barcodes", example = "1.0") double ocrConfidence,
        @Schema(description = "Format reported by the decoder", example = "CODE_128") String format,
        @Schema(description = "Where the text came from") ScanSource source) {

    public ScanCandidate {
        if (Double.isNaN(ocrConfidence)) {
            ocrConfidence = 0.0;
        }
        ocrConfidence = Math.max(0.0, Math.min(1.0, ocrConfidence));
        if (source == null) {
            source = ScanSource.BARCODE;
        }
    }

    public static ScanCandidate barcode(String text) {
        return new ScanCandidate(text, 1.0, null, ScanSource.BARCODE);
    }

    public static ScanCandidate ocr(String text, double confidence) {
        return new ScanCandidate(text, confidence, null, ScanSource.OCR);
    }
}

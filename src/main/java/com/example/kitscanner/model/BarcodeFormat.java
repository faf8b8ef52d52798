package com.example.kitscanner.model;

import java.util.Locale;

/**
 * Barcode symbology guessed from the content of a scan.
 */
public enum BarcodeFormat {
    QR_CODE("QR"),
    CODE_128("Code 128"),
    CODE_39("Code 39"),
    UPC_A("UPC-A"),
    UPC_E("UPC-E"),
    EAN_13("EAN-13"),
    EAN_8("EAN-8"),
    UNKNOWN("Unknown");

    private final String displayName;

    BarcodeFormat(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }

    /**
     * Maps a decoder's format tag such as {@code QR_CODE}, {@code code-128} or {@code EAN 13} to a format.
     *
     * @return the format, or {@code null} when the tag is absent or not a known symbology
     */
    public static BarcodeFormat fromTag(String tag) {
        if (tag == null || tag.isBlank()) {
            return null;
        }
        String key = tag.trim().toUpperCase(Locale.ROOT).replaceAll("[-_ ]", "");
        if (key.equals("QR")) {
            return QR_CODE;
        }
        for (BarcodeFormat format : values()) {
            if (format != UNKNOWN && format.name().replace("_", "").equals(key)) {
                return format;
            }
        }
        return null;
    }
}

package com.example.kitscanner.util;

import com.example.kitscanner.model.BarcodeFormat;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Security and format gate applied to every scan before it reaches an engine.
 */
public final class ScanInputValidator {

    public static final int MAX_LENGTH = 200;

    private static final List<String> BLOCKED_TOKENS = List.of(
            "script", "javascript", "vbscript", "onload", "onerror",
            "alert", "eval", "document", "window", "location",
            "<%", "%>", "<?", "?>", "{{", "}}", "${", "}",
            "drop", "delete", "insert", "update", "select",
            "union", "exec", "execute", "xp_", "sp_");

    private static final Pattern UPC_A = Pattern.compile("^\\d{12}$");
    private static final Pattern UPC_E = Pattern.compile("^0\\d{7}$");
    private static final Pattern EAN_13 = Pattern.compile("^\\d{13}$");
    private static final Pattern EAN_8 = Pattern.compile("^\\d{8}$");
    private static final Pattern CODE_39 = Pattern.compile("^[A-Z0-9\\-. $/+%]+$");
    private static final Pattern CODE_128 = Pattern.compile("^[A-Za-z0-9._-]+$");
    private static final Pattern QR_SAFE = Pattern.compile("^[A-Za-z0-9._\\-:/?#\\[\\]@!$&'()*+,;= ]+$");
    private static final Pattern RECORD_UNSAFE = Pattern.compile("[\"'`\\\\<>{}\\[\\];:,]");

    private ScanInputValidator() {
    }

    public static ValidationOutcome validate(String rawData) {
        if (rawData == null) {
            return ValidationOutcome.rejected("Empty barcode data");
        }
        String trimmed = rawData.trim();
        if (trimmed.isEmpty()) {
            return ValidationOutcome.rejected("Empty barcode data");
        }
        if (trimmed.length() > MAX_LENGTH) {
            return ValidationOutcome.rejected("Barcode data too long");
        }
        String lower = trimmed.toLowerCase(Locale.ROOT);
        for (String token : BLOCKED_TOKENS) {
            if (lower.contains(token)) {
                return ValidationOutcome.rejected("Suspicious content detected");
            }
        }

        BarcodeFormat format = detectFormat(trimmed);
        return switch (format) {
            case UNKNOWN -> new ValidationOutcome(false, format, "", "Unknown barcode format");
            case QR_CODE -> QR_SAFE.matcher(trimmed).matches()
                    ? ValidationOutcome.accepted(format, trimmed)
                    : new ValidationOutcome(false, format, "", "QR code contains potentially unsafe characters");
            default -> ValidationOutcome.accepted(format, trimmed);
        };
    }

    public static BarcodeFormat detectFormat(String data) {
        if (UPC_A.matcher(data).matches()) {
            return BarcodeFormat.UPC_A;
        }
        if (UPC_E.matcher(data).matches()) {
            return BarcodeFormat.UPC_E;
        }
        if (EAN_13.matcher(data).matches()) {
            return BarcodeFormat.EAN_13;
        }
        if (EAN_8.matcher(data).matches()) {
            return BarcodeFormat.EAN_8;
        }
        if (CODE_39.matcher(data).matches()) {
            return BarcodeFormat.CODE_39;
        }
        if (data.contains("http") || data.contains("://") || data.length() > 50) {
            return BarcodeFormat.QR_CODE;
        }
        if (CODE_128.matcher(data).matches()) {
            return BarcodeFormat.CODE_128;
        }
        return BarcodeFormat.UNKNOWN;
    }

    /**
     * Strips quoting and separator characters from free-form values before they are written to a record.
     */
    public static String sanitizeForRecord(String input) {
        if (input == null) {
            return "";
        }
        String cleaned = RECORD_UNSAFE.matcher(input).replaceAll("")
                .replaceAll("\\s+", " ")
                .trim();
        return cleaned.length() > MAX_LENGTH ? cleaned.substring(0, MAX_LENGTH) : cleaned;
    }

    public record ValidationOutcome(boolean valid, BarcodeFormat format, String sanitized, String error) {

        static ValidationOutcome accepted(BarcodeFormat format, String sanitized) {
            return new ValidationOutcome(true, format, sanitized, null);
        }

        static ValidationOutcome rejected(String error) {
            return new ValidationOutcome(false, BarcodeFormat.UNKNOWN, "", error);
        }
    }
}

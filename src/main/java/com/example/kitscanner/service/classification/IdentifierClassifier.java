package com.example.kitscanner.service.classification;

import com.example.kitscanner.config.KitScannerProperties;
import com.example.kitscanner.model.ConfidenceTier;
import com.example.kitscanner.model.IdentifierClass;
import com.example.kitscanner.model.kit.ComponentType;
import com.example.kitscanner.util.DsnOcrCorrector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Classifies scanned identifiers and infers component types from device serial numbers.
 * <p>
 * None of the methods throw: unmatched input yields {@link IdentifierClass#OTHER}, a {@code null} component
 * type or {@link ConfidenceTier#LOW}, all of which callers treat as "ask the operator".
 */
@Component
public class IdentifierClassifier {

    private static final Logger log = LoggerFactory.getLogger(IdentifierClassifier.class);

    static final double VENDOR_PATTERN_CONFIDENCE = 1.0;
    static final double FAMILY_PATTERN_CONFIDENCE = 0.85;
    static final double HINT_PATTERN_CONFIDENCE = 0.60;

    static final int MIN_MANUAL_LENGTH = 8;
    static final int MAX_MANUAL_LENGTH = 20;

    // Checked in order; the first match wins.
    private static final List<TypePattern> TYPE_PATTERNS = List.of(
            new TypePattern(ComponentType.CONTROLLER, "^G0G46K\\d{9,}$", VENDOR_PATTERN_CONFIDENCE),
            new TypePattern(ComponentType.BATTERY_1, "^G0G4NU\\d{9,}$", VENDOR_PATTERN_CONFIDENCE),
            new TypePattern(ComponentType.GLASSES, "^G0G348\\d{9,}$", VENDOR_PATTERN_CONFIDENCE),

            new TypePattern(ComponentType.GLASSES, "^GL[-_]?.*", FAMILY_PATTERN_CONFIDENCE),
            new TypePattern(ComponentType.GLASSES, ".*GLASS.*", FAMILY_PATTERN_CONFIDENCE),
            new TypePattern(ComponentType.GLASSES, ".*LENS.*", FAMILY_PATTERN_CONFIDENCE),
            new TypePattern(ComponentType.CONTROLLER, "^CTRL[-_]?.*", FAMILY_PATTERN_CONFIDENCE),
            new TypePattern(ComponentType.CONTROLLER, ".*CONTROL.*", FAMILY_PATTERN_CONFIDENCE),
            new TypePattern(ComponentType.CONTROLLER, ".*REMOTE.*", FAMILY_PATTERN_CONFIDENCE),
            new TypePattern(ComponentType.BATTERY_1, "^BAT[-_]?.*", FAMILY_PATTERN_CONFIDENCE),
            new TypePattern(ComponentType.BATTERY_1, ".*BATTERY.*", FAMILY_PATTERN_CONFIDENCE),
            new TypePattern(ComponentType.PADS, "^PAD[-_]?.*", FAMILY_PATTERN_CONFIDENCE),
            new TypePattern(ComponentType.PADS, ".*PADS?.*", FAMILY_PATTERN_CONFIDENCE),

            new TypePattern(ComponentType.UNUSED_1, "^UN[-_]?0?1.*", HINT_PATTERN_CONFIDENCE),
            new TypePattern(ComponentType.UNUSED_1, ".*UNUSED[-_]?0?1.*", HINT_PATTERN_CONFIDENCE),
            new TypePattern(ComponentType.UNUSED_2, "^UN[-_]?0?2.*", HINT_PATTERN_CONFIDENCE),
            new TypePattern(ComponentType.UNUSED_2, ".*UNUSED[-_]?0?2.*", HINT_PATTERN_CONFIDENCE));

    private static final Pattern MANUAL_DSN = Pattern.compile("^[A-Z0-9\\-_/.]+$");
    private static final Pattern MANUAL_DISALLOWED = Pattern.compile("[^A-Z0-9\\-_/.]");

    private final double highThreshold;
    private final double mediumThreshold;

    public IdentifierClassifier(KitScannerProperties properties) {
        this.highThreshold = properties.getDetection().getHighThreshold();
        this.mediumThreshold = properties.getDetection().getMediumThreshold();
    }

    /**
     * Prefix heuristic: {@code U}/{@code USER} is a user, {@code K}/{@code KIT} a kit. Anything starting
     * with those letters for another reason (e.g. {@code Unicorn7}) is classified the same way.
     */
    public IdentifierClass classify(String raw) {
        if (raw == null || raw.isBlank()) {
            return IdentifierClass.OTHER;
        }
        String upper = raw.trim().toUpperCase(Locale.ROOT);
        if (upper.startsWith("U") || upper.startsWith("USER")) {
            return IdentifierClass.USER;
        }
        if (upper.startsWith("K") || upper.startsWith("KIT")) {
            return IdentifierClass.KIT;
        }
        return IdentifierClass.OTHER;
    }

    public ComponentInference inferComponentType(String rawDsn) {
        if (rawDsn == null || rawDsn.isBlank()) {
            return ComponentInference.unmatched(rawDsn);
        }
        String corrected = DsnOcrCorrector.correct(rawDsn);
        for (TypePattern pattern : TYPE_PATTERNS) {
            if (pattern.regex().matcher(corrected).matches()) {
                log.debug("DSN {} (corrected {}) matched {} with confidence {}",
                        rawDsn, corrected, pattern.componentType(), pattern.confidence());
                return new ComponentInference(pattern.componentType(), pattern.confidence(), corrected);
            }
        }
        log.debug("DSN {} did not match any component pattern", rawDsn);
        return ComponentInference.unmatched(corrected);
    }

    /**
     * Combines pattern confidence with decoder confidence by taking the minimum, so a perfect pattern match
     * read by uncertain OCR is still penalised while barcode scans ({@code 1.0}) keep the pattern score.
     */
    public ConfidenceTier getDetectionConfidence(String rawDsn, double ocrConfidence) {
        ComponentInference inference = inferComponentType(rawDsn);
        if (inference.componentType() == null) {
            return ConfidenceTier.LOW;
        }
        double decoder = Double.isNaN(ocrConfidence) ? 0.0 : Math.max(0.0, Math.min(1.0, ocrConfidence));
        return tierFor(Math.min(inference.patternConfidence(), decoder));
    }

    public ConfidenceTier tierFor(double combinedScore) {
        if (combinedScore >= highThreshold) {
            return ConfidenceTier.HIGH;
        }
        if (combinedScore >= mediumThreshold) {
            return ConfidenceTier.MEDIUM;
        }
        return ConfidenceTier.LOW;
    }

    /**
     * Fallback acceptance gate for DSNs typed by the operator.
     */
    public ManualEntryValidation validateManualEntry(String text) {
        if (text == null || text.isBlank()) {
            return ManualEntryValidation.invalid("DSN cannot be empty");
        }
        String normalized = normalizeDsn(text);
        if (normalized.isEmpty()) {
            return ManualEntryValidation.invalid("DSN cannot be empty");
        }
        if (normalized.length() < MIN_MANUAL_LENGTH) {
            return ManualEntryValidation.invalid("DSN must be at least " + MIN_MANUAL_LENGTH + " characters");
        }
        if (normalized.length() > MAX_MANUAL_LENGTH) {
            return ManualEntryValidation.invalid("DSN must be at most " + MAX_MANUAL_LENGTH + " characters");
        }
        if (!MANUAL_DSN.matcher(normalized).matches()) {
            return ManualEntryValidation.invalid("DSN contains invalid characters");
        }
        return new ManualEntryValidation(true, normalized, inferComponentType(normalized).componentType(), null);
    }

    public boolean isSimilar(String left, String right) {
        return DsnOcrCorrector.isSimilar(left, right);
    }

    String normalizeDsn(String text) {
        String corrected = DsnOcrCorrector.correct(text);
        String dashed = corrected.replaceAll("\\s+", "-");
        return MANUAL_DISALLOWED.matcher(dashed).replaceAll("");
    }

    public record ComponentInference(ComponentType componentType, double patternConfidence, String correctedDsn) {

        static ComponentInference unmatched(String correctedDsn) {
            return new ComponentInference(null, 0.0, correctedDsn);
        }
    }

    public record ManualEntryValidation(boolean valid, String normalizedDsn, ComponentType inferredType,
            String error) {

        static ManualEntryValidation invalid(String error) {
            return new ManualEntryValidation(false, null, null, error);
        }
    }

    private record TypePattern(ComponentType componentType, Pattern regex, double confidence) {

        TypePattern(ComponentType componentType, String regex, double confidence) {
            this(componentType, Pattern.compile(regex), confidence);
        }
    }
}

package com.example.kitscanner.util;

import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Repairs OCR glyph confusions in device serial numbers. Corrections are tied to the known vendor
 * prefixes: text that is not a near miss of one of them is only trimmed and uppercased.
 */
public final class DsnOcrCorrector {

    private static final List<PrefixRule> PREFIX_RULES = List.of(
            new PrefixRule(Pattern.compile("^G[O0Q]G46K"), "G0G46K"),
            new PrefixRule(Pattern.compile("^G[O0Q]G4NU"), "G0G4NU"),
            new PrefixRule(Pattern.compile("^G[O0Q]G348"), "G0G348"));

    private static final int VENDOR_PREFIX_LENGTH = 6;
    private static final Pattern VENDOR_SERIAL = Pattern.compile("^G0G(46K|4NU|348)[0-9OQILSZ]+$");

    private DsnOcrCorrector() {
    }

    public static String correct(String text) {
        if (text == null) {
            return null;
        }
        String corrected = text.trim().toUpperCase(Locale.ROOT);

        for (PrefixRule rule : PREFIX_RULES) {
            Matcher matcher = rule.nearMiss().matcher(corrected);
            if (matcher.lookingAt()) {
                corrected = rule.canonical() + corrected.substring(matcher.end());
                break;
            }
        }

        if (VENDOR_SERIAL.matcher(corrected).matches()) {
            String serial = corrected.substring(VENDOR_PREFIX_LENGTH)
                    .replace('O', '0')
                    .replace('Q', '0')
                    .replace('I', '1')
                    .replace('L', '1')
                    .replace('S', '5')
                    .replace('Z', '2');
            corrected = corrected.substring(0, VENDOR_PREFIX_LENGTH) + serial;
        }
        return corrected;
    }

    /**
     * @return whether two readings are likely the same label: equal after normalisation, equal after
     * correction, or at least 85% similar by edit distance
     */
    public static boolean isSimilar(String left, String right) {
        if (left == null || right == null) {
            return false;
        }
        if (left.trim().equalsIgnoreCase(right.trim())) {
            return true;
        }
        String correctedLeft = correct(left);
        String correctedRight = correct(right);
        if (correctedLeft.equals(correctedRight)) {
            return true;
        }
        int maxLength = Math.max(correctedLeft.length(), correctedRight.length());
        if (maxLength == 0) {
            return false;
        }
        int distance = levenshteinDistance(correctedLeft, correctedRight);
        double similarity = 1.0 - ((double) distance / maxLength);
        return similarity >= 0.85;
    }

    static int levenshteinDistance(String left, String right) {
        int leftLength = left.length();
        int rightLength = right.length();
        if (leftLength == 0) {
            return rightLength;
        }
        if (rightLength == 0) {
            return leftLength;
        }

        int[] previous = new int[rightLength + 1];
        int[] current = new int[rightLength + 1];

        for (int j = 0; j <= rightLength; j++) {
            previous[j] = j;
        }

        for (int i = 1; i <= leftLength; i++) {
            current[0] = i;
            for (int j = 1; j <= rightLength; j++) {
                int cost = left.charAt(i - 1) == right.charAt(j - 1) ? 0 : 1;
                current[j] = Math.min(
                        Math.min(current[j - 1] + 1, previous[j] + 1),
                        previous[j - 1] + cost);
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }

        return previous[rightLength];
    }

    private record PrefixRule(Pattern nearMiss, String canonical) {
    }
}

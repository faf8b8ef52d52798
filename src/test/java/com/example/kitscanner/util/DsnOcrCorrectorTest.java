package com.example.kitscanner.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DsnOcrCorrectorTest {

    @Test
    void correctsLetterOInVendorPrefix() {
        assertEquals("G0G46K025224001", DsnOcrCorrector.correct("GOG46K025224001"));
        assertEquals("G0G4NU015166001", DsnOcrCorrector.correct("gQg4nu015166001"));
    }

    @Test
    void correctsGlyphConfusionsInVendorSerial() {
        assertEquals("G0G348025246001", DsnOcrCorrector.correct("G0G348O2524600I"));
        assertEquals("G0G348025246001", DsnOcrCorrector.correct("GOG348Q25246OOL"));
    }

    @Test
    void leavesUnrelatedIdentifiersAlone() {
        assertEquals("GOLD-SOIL", DsnOcrCorrector.correct(" gold-soil "));
        assertEquals("KIT456", DsnOcrCorrector.correct("KIT456"));
        assertNull(DsnOcrCorrector.correct(null));
    }

    @Test
    void similarityToleratesOneMisreadCharacter() {
        assertTrue(DsnOcrCorrector.isSimilar("G0G348025246001", "G0G348025246007"));
        assertTrue(DsnOcrCorrector.isSimilar("GOG348025246001", "G0G348025246001"));
        assertFalse(DsnOcrCorrector.isSimilar("G0G348025246001", "G0G46K025224001"));
        assertFalse(DsnOcrCorrector.isSimilar(null, "G0G348025246001"));
    }

    @Test
    void levenshteinCountsEdits() {
        assertEquals(3, DsnOcrCorrector.levenshteinDistance("kitten", "sitting"));
        assertEquals(4, DsnOcrCorrector.levenshteinDistance("", "abcd"));
    }
}

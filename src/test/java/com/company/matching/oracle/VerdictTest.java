package com.company.matching.oracle;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class VerdictTest {

    @Test
    @DisplayName("A match with medium or high confidence is acceptable")
    void testAcceptable() {
        assertTrue(new Verdict(true, Confidence.HIGH, "same entity").isAcceptable());
        assertTrue(new Verdict(true, Confidence.MEDIUM, "likely same").isAcceptable());
    }

    @Test
    @DisplayName("A low-confidence match stays ambiguous")
    void testLowConfidenceMatch() {
        assertFalse(new Verdict(true, Confidence.LOW, "unsure").isAcceptable());
    }

    @Test
    @DisplayName("A non-match is never acceptable")
    void testNonMatch() {
        assertFalse(new Verdict(false, Confidence.HIGH, "different companies").isAcceptable());
        assertFalse(new Verdict(false, Confidence.LOW, "different companies").isAcceptable());
    }

    @Test
    @DisplayName("Confidence levels are ordered low < medium < high")
    void testConfidenceOrdering() {
        assertTrue(Confidence.HIGH.isAtLeast(Confidence.MEDIUM));
        assertTrue(Confidence.MEDIUM.isAtLeast(Confidence.MEDIUM));
        assertFalse(Confidence.LOW.isAtLeast(Confidence.MEDIUM));
        assertEquals(Confidence.HIGH, Confidence.fromWireValue("HIGH"));
        assertThrows(VerdictParseException.class, () -> Confidence.fromWireValue("certain"));
    }

    @Test
    @DisplayName("Padded confidence values are rejected")
    void testPaddedConfidenceRejected() {
        assertThrows(VerdictParseException.class, () -> Confidence.fromWireValue(" HIGH "));
        assertThrows(VerdictParseException.class, () -> Confidence.fromWireValue("medium\n"));
    }
}

package com.jreinhal.docguard.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class ShannonEntropyTest {

    @Test
    void emptyAndNullHaveZeroEntropy() {
        assertEquals(0.0, ShannonEntropy.bitsPerChar(null));
        assertEquals(0.0, ShannonEntropy.bitsPerChar(""));
    }

    @Test
    void singleRepeatedCharacterHasZeroEntropy() {
        assertEquals(0.0, ShannonEntropy.bitsPerChar("aaaaaaaa"), 1e-9);
    }

    @Test
    void uniformDistributionHasLogTwoOfAlphabet() {
        assertEquals(1.0, ShannonEntropy.bitsPerChar("abababab"), 1e-9);
        assertEquals(3.0, ShannonEntropy.bitsPerChar("abcdefgh"), 1e-9);
    }

    @Test
    void randomLookingTokenIsAboveThreshold() {
        assertTrue(ShannonEntropy.bitsPerChar("Kx9mQ2vLp7RtZ4wN8bYc3HfJ6dGs1AeU5oTiXkWq") > 3.0);
    }
}

package com.jreinhal.docguard.util;

import java.util.HashMap;
import java.util.Map;

public final class ShannonEntropy {
    private static final double LOG_2 = Math.log(2.0);

    private ShannonEntropy() {
    }

    /**
     * Shannon entropy of the character distribution of {@code value}, in bits per character.
     * Returns 0 for null or empty input.
     */
    public static double bitsPerChar(String value) {
        if (value == null || value.isEmpty()) {
            return 0.0;
        }
        Map<Integer, Integer> counts = new HashMap<>();
        value.codePoints().forEach(cp -> counts.merge(cp, 1, Integer::sum));
        int total = value.codePointCount(0, value.length());
        double entropy = 0.0;
        for (int count : counts.values()) {
            double p = (double) count / total;
            entropy -= p * (Math.log(p) / LOG_2);
        }
        return entropy;
    }
}

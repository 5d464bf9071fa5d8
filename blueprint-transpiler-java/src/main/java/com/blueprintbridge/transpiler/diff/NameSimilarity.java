package com.blueprintbridge.transpiler.diff;

import org.apache.commons.lang3.StringUtils;

import java.util.Locale;

/** Normalized edit-distance similarity of two identifiers, case-insensitive, in [0, 1]. */
public final class NameSimilarity {

    private NameSimilarity() {}

    public static double of(String a, String b) {
        String left = a.toLowerCase(Locale.ROOT);
        String right = b.toLowerCase(Locale.ROOT);
        int longest = Math.max(left.length(), right.length());
        if (longest == 0) return 1.0;
        return 1.0 - (double) StringUtils.getLevenshteinDistance(left, right) / longest;
    }
}

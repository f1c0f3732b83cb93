package com.opsos.itemresolution.util;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Builds the deduplication key for vendor display names, e.g. "The Southern Glazer's, LLC"
 * and "southern glazers" both become "southern glazers".
 */
public final class VendorNameNormalizer {

    private static final Pattern LEADING_ARTICLE = Pattern.compile("^the\\s+");
    private static final Pattern APOSTROPHES = Pattern.compile("['’`]");
    private static final Pattern PUNCTUATION = Pattern.compile("[^a-z0-9\\s]");
    private static final Pattern LEGAL_SUFFIXES = Pattern.compile(
            "\\b(?:llc|inc|corp|co|ltd|limited|company|incorporated|dba)\\b");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private VendorNameNormalizer() {
    }

    public static String normalize(String name) {
        if (name == null) {
            return "";
        }
        String key = name.toLowerCase(Locale.ROOT).trim();
        key = LEADING_ARTICLE.matcher(key).replaceFirst("");
        key = APOSTROPHES.matcher(key).replaceAll("");
        key = PUNCTUATION.matcher(key).replaceAll(" ");
        key = LEGAL_SUFFIXES.matcher(key).replaceAll(" ");
        return WHITESPACE.matcher(key).replaceAll(" ").trim();
    }
}

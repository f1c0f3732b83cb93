package com.opsos.itemresolution.util;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Spellings under which a vendor item code may have been stored. OCR and manual entry
 * disagree on case, spacing, delimiters and zero padding ("00123-A" vs "123A").
 */
public final class VendorCodeVariants {

    private static final Pattern SPACES = Pattern.compile("\\s+");
    private static final Pattern DELIMITERS = Pattern.compile("[\\s\\-_/\\\\.]+");
    private static final Pattern LEADING_ZEROS = Pattern.compile("^0+(?=.)");

    private VendorCodeVariants() {
    }

    /**
     * @return the distinct variants in lookup order, raw code first; empty for a blank code
     */
    public static List<String> of(String code) {
        if (code == null || code.isBlank()) {
            return List.of();
        }
        String raw = code.trim();
        String upper = raw.toUpperCase(Locale.ROOT);
        String noSpaces = SPACES.matcher(upper).replaceAll("");
        String noDelimiters = DELIMITERS.matcher(upper).replaceAll("");

        Set<String> variants = new LinkedHashSet<>();
        for (String base : List.of(raw, upper, noSpaces, noDelimiters)) {
            variants.add(base);
        }
        for (String base : List.of(raw, upper, noSpaces, noDelimiters)) {
            variants.add(LEADING_ZEROS.matcher(base).replaceFirst(""));
        }
        variants.removeIf(String::isEmpty);
        return new ArrayList<>(variants);
    }
}

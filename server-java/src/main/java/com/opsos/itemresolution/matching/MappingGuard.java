package com.opsos.itemresolution.matching;

import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Extra checks applied before a guarded bulk map trusts a text match. Each check names the
 * reason it refused, for the job summary.
 */
@Component
public class MappingGuard {

    public static final String SIZE_MISMATCH = "size_mismatch";
    public static final String SWEET_DRY_CONFLICT = "sweet_dry_conflict";
    public static final String LOW_TOKEN_OVERLAP = "low_token_overlap";

    private static final double SIZE_TOLERANCE_ML = 35.0;
    private static final double ML_PER_OZ = 29.5735;
    private static final int MIN_OVERLAP = 2;

    private static final Pattern LIQUID_SIZE = Pattern.compile(
            "(?<![\\w.])(\\d+(?:\\.\\d+)?)\\s*(ml|ltr|lt|l|oz)(?![a-z])");
    private static final Pattern SWEET = Pattern.compile("\\bsweet\\b");
    private static final Pattern DRY = Pattern.compile("\\bdry\\b");
    private static final Pattern TOKEN_SEPARATORS = Pattern.compile("[^a-z0-9]+");
    private static final Pattern HAS_DIGIT = Pattern.compile(".*\\d.*");

    private static final Set<String> NOISE_TOKENS = Set.of(
            "the", "and", "with", "for", "case", "pack", "each", "bottle", "btl", "can", "cans",
            "bag", "box", "keg", "liter", "litre", "oz", "ml", "ltr");

    public Optional<String> check(String description, String itemName) {
        String left = description == null ? "" : description.toLowerCase(Locale.ROOT);
        String right = itemName == null ? "" : itemName.toLowerCase(Locale.ROOT);

        Double leftSize = liquidSizeMl(left);
        Double rightSize = liquidSizeMl(right);
        if (leftSize != null && rightSize != null && Math.abs(leftSize - rightSize) > SIZE_TOLERANCE_ML) {
            return Optional.of(SIZE_MISMATCH);
        }

        boolean conflict = (SWEET.matcher(left).find() && DRY.matcher(right).find())
                || (DRY.matcher(left).find() && SWEET.matcher(right).find());
        if (conflict) {
            return Optional.of(SWEET_DRY_CONFLICT);
        }

        Set<String> leftTokens = meaningfulTokens(left);
        Set<String> rightTokens = meaningfulTokens(right);
        Set<String> overlap = new HashSet<>(leftTokens);
        overlap.retainAll(rightTokens);
        // One-word catalog names can only ever overlap by one token.
        int required = Math.min(MIN_OVERLAP, Math.min(leftTokens.size(), rightTokens.size()));
        if (overlap.isEmpty() || overlap.size() < required) {
            return Optional.of(LOW_TOKEN_OVERLAP);
        }
        return Optional.empty();
    }

    static Double liquidSizeMl(String text) {
        Matcher matcher = LIQUID_SIZE.matcher(text);
        if (!matcher.find()) {
            return null;
        }
        double value = Double.parseDouble(matcher.group(1));
        switch (matcher.group(2)) {
            case "ml":
                return value;
            case "oz":
                return value * ML_PER_OZ;
            default:
                return value * 1000;
        }
    }

    private static Set<String> meaningfulTokens(String text) {
        return Arrays.stream(TOKEN_SEPARATORS.split(text))
                .filter(token -> token.length() >= 3)
                .filter(token -> !HAS_DIGIT.matcher(token).matches())
                .filter(token -> !NOISE_TOKENS.contains(token))
                .collect(Collectors.toSet());
    }
}

package com.opsos.itemresolution.matching;

import com.opsos.itemresolution.config.ResolutionSettings;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Cheap text similarity between a normalized description and a catalog name or SKU.
 * Exact match scores 1.0, containment either way 0.8, anything else the Jaccard ratio of
 * the significant tokens.
 */
@Component
public class SimilarityScorer {

    public static final double EXACT = 1.0;
    public static final double CONTAINMENT = 0.8;

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern TOKEN_SEPARATORS = Pattern.compile("[^\\p{L}\\p{N}]+");

    private final int minTokenLength;

    public SimilarityScorer(ResolutionSettings settings) {
        this.minTokenLength = settings.minTokenLength();
    }

    public double score(String query, String candidate) {
        String left = fold(query);
        String right = fold(candidate);
        if (left.isEmpty() || right.isEmpty()) {
            return 0.0;
        }
        if (left.equals(right)) {
            return EXACT;
        }
        if (left.contains(right) || right.contains(left)) {
            return CONTAINMENT;
        }

        Set<String> leftTokens = tokens(left);
        Set<String> rightTokens = tokens(right);
        Set<String> union = new HashSet<>(leftTokens);
        union.addAll(rightTokens);
        if (union.isEmpty()) {
            return 0.0;
        }
        Set<String> intersection = new HashSet<>(leftTokens);
        intersection.retainAll(rightTokens);
        return (double) intersection.size() / union.size();
    }

    private Set<String> tokens(String folded) {
        return Arrays.stream(TOKEN_SEPARATORS.split(folded))
                .filter(token -> token.length() >= minTokenLength)
                .collect(Collectors.toSet());
    }

    private static String fold(String text) {
        if (text == null) {
            return "";
        }
        return WHITESPACE.matcher(text.toLowerCase(Locale.ROOT)).replaceAll(" ").trim();
    }
}

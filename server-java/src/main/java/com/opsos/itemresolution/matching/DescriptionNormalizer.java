package com.opsos.itemresolution.matching;

import org.springframework.stereotype.Component;

import java.text.Normalizer;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Canonicalizes OCR'd invoice line descriptions such as "Case*GREY GOOSE*Vodka 1LT 80°"
 * into a matching key ("grey goose").
 *
 * <p>The result is idempotent: the pipeline is re-run until the text stops changing, so an
 * OCR repair that expands into a strippable word (e.g. "whisk" into "whiskey") settles in a
 * single call.
 */
@Component
public class DescriptionNormalizer {

    private static final int MAX_PASSES = 5;

    private static final Pattern DELIMITERS = Pattern.compile("[*\\-_/|\\\\\"'`´‘’“”„–—−]");
    private static final Pattern OTHER_PUNCTUATION = Pattern.compile("[^\\p{L}\\p{N}\\s.°%#]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern STRAY_DOT = Pattern.compile("(?<!\\d)\\.|\\.(?!\\d)");

    private static final List<Rule> ANNOTATION_RULES = List.of(
            rule("\\b\\d+(?:\\.\\d+)?\\s*(?:°|%)", " "),
            rule("\\b\\d+(?:\\.\\d+)?\\s*(?:proof|yrs?|years?|abv)\\b", " "),
            rule("\\babv\\b", " "));

    private static final List<Rule> PACK_RULES = List.of(
            rule("\\b\\d+(?:\\.\\d+)?\\s*(?:mls?|ltr|liters?|litres?|lt|l|fl\\.?\\s*oz|floz|oz|gallons?|gal|qt|pt"
                    + "|lbs?|kgs?|kg|gms?|grams?|g|ct|count|pk|pack|ea|cs)\\b", " "),
            rule("\\b\\d+(?:\\.\\d+)?\\s*#", " "),
            rule("\\b(?:cs|case|cases|pk|pack|ea|each|ct|loose)\\b", " "),
            rule("\\b\\d+(?:\\.\\d+)?\\b", " "));

    private static final List<Rule> CATEGORY_RULES = List.of(
            rule("\\b(?:tequila|vodka|whiskey|whisky|gin|rum|bourbon|scotch|cognac|brandy|liqueur|wine|beer"
                    + "|champagne|mezcal|spirits?|ale|ipa|lager|stout|malt)\\b", " "),
            rule("\\b(?:water|juice|syrup|soda)\\b", " "),
            rule("\\b(?:japanese|french|scottish|american|mexican|irish|canadian|london|italian)\\b", " "),
            rule("\\b(?:fresh|organic|natural|pure|premium)\\b", " "));

    private static final List<Rule> OCR_REPAIRS = List.of(
            rule("\\b(?:whis|whisk)\\b", "whiskey"),
            rule("\\b(?:el0|elo)\\b", "oro"),
            rule("\\b(?:bla\\s+ck|blac\\s+k)\\b", "black"),
            rule("\\bvermou\\b", "vermouth"),
            rule("\\bliqueu\\b", "liqueur"),
            rule("\\bchampag\\b", "champagne"),
            rule("\\breposad\\b", "reposado"),
            rule("\\bbergamett\\b", "bergamotto"),
            rule("\\bpelligrino\\b", "pellegrino"));

    /**
     * @return the matching key; never empty while the text carries a letter or digit, since
     * a description that strips down to nothing falls back to its pre-strip form. Text made
     * only of delimiters or punctuation ("/", "-", "'") has no pre-strip form either and
     * yields "", which callers count as unparseable.
     */
    public String normalize(String raw) {
        if (raw == null || raw.isBlank()) {
            return "";
        }
        String current = raw;
        for (int pass = 0; pass < MAX_PASSES; pass++) {
            String next = normalizeOnce(current);
            if (next.equals(current)) {
                return next;
            }
            current = next;
        }
        return current;
    }

    private String normalizeOnce(String input) {
        String text = Normalizer.normalize(input, Normalizer.Form.NFKC).toLowerCase(Locale.ROOT);
        text = DELIMITERS.matcher(text).replaceAll(" ");
        text = OTHER_PUNCTUATION.matcher(text).replaceAll(" ");
        String preStrip = collapse(STRAY_DOT.matcher(text).replaceAll(" "));

        String stripped = apply(text, ANNOTATION_RULES);
        stripped = apply(stripped, PACK_RULES);
        stripped = apply(stripped, CATEGORY_RULES);
        stripped = collapse(STRAY_DOT.matcher(stripped).replaceAll(" "));
        if (stripped.isEmpty()) {
            return preStrip;
        }

        return collapse(apply(stripped, OCR_REPAIRS));
    }

    private static String apply(String text, List<Rule> rules) {
        String result = text;
        for (Rule rule : rules) {
            result = rule.pattern().matcher(result).replaceAll(rule.replacement());
        }
        return result;
    }

    private static String collapse(String text) {
        return WHITESPACE.matcher(text).replaceAll(" ").trim();
    }

    private static Rule rule(String regex, String replacement) {
        return new Rule(Pattern.compile(regex), replacement);
    }

    private record Rule(Pattern pattern, String replacement) {
    }
}

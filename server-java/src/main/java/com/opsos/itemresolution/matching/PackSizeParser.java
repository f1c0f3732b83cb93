package com.opsos.itemresolution.matching;

import com.opsos.itemresolution.model.PackType;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads pack structure out of vendor line text. Three pattern families are tried in order
 * and the first one that matches decides the result:
 * <ol>
 *     <li>split unit: {@code CS/12 ... 750ML} (or {@code 12/CS})</li>
 *     <li>compact: {@code 12/750ML}</li>
 *     <li>single size: {@code 1.75L}, {@code 5 lb}</li>
 * </ol>
 * Text without a recognizable size returns {@code null} and needs manual entry.
 */
@Component
public class PackSizeParser {

    private static final String UOM = "(ml|ltr|liters?|litres?|lt|l|fl\\.?\\s*oz|floz|oz|lbs|lb|kgs?|grams?|gm|g"
            + "|gallons?|gal|qt|pt)";

    private static final Pattern POUND_SIGN = Pattern.compile("(\\d+(?:\\.\\d+)?)\\s*#");
    private static final Pattern CASE_COUNT = Pattern.compile(
            "\\b(?:cs|case)\\s*/\\s*(\\d+)\\b|\\b(\\d+)\\s*/\\s*(?:cs|case)\\b");
    private static final Pattern COMPACT = Pattern.compile(
            "(?<![\\w.])(\\d+)\\s*/\\s*(\\d+(?:\\.\\d+)?)\\s*" + UOM + "(?![a-z])");
    private static final Pattern SIZE = Pattern.compile(
            "(?<![\\w.])(\\d+(?:\\.\\d+)?)\\s*" + UOM + "(?![a-z])");

    private static final Map<String, String> UOM_ALIASES = Map.ofEntries(
            Map.entry("ml", "mL"),
            Map.entry("l", "L"),
            Map.entry("lt", "L"),
            Map.entry("ltr", "L"),
            Map.entry("liter", "L"),
            Map.entry("liters", "L"),
            Map.entry("litre", "L"),
            Map.entry("litres", "L"),
            Map.entry("oz", "oz"),
            Map.entry("floz", "oz"),
            Map.entry("lb", "lb"),
            Map.entry("lbs", "lb"),
            Map.entry("kg", "kg"),
            Map.entry("kgs", "kg"),
            Map.entry("g", "g"),
            Map.entry("gm", "g"),
            Map.entry("gram", "g"),
            Map.entry("grams", "g"),
            Map.entry("gal", "gal"),
            Map.entry("gallon", "gal"),
            Map.entry("gallons", "gal"),
            Map.entry("qt", "qt"),
            Map.entry("pt", "pt"));

    private static final Set<String> LIQUID_VOLUME = Set.of("mL", "L", "oz", "gal", "qt", "pt");
    private static final Set<String> MASS = Set.of("lb", "kg", "g");

    public ParsedPack parsePackSize(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String text = POUND_SIGN.matcher(raw.toLowerCase(Locale.ROOT)).replaceAll("$1 lb");

        Matcher caseCount = CASE_COUNT.matcher(text);
        if (caseCount.find()) {
            Matcher size = SIZE.matcher(text);
            if (size.find()) {
                String count = caseCount.group(1) != null ? caseCount.group(1) : caseCount.group(2);
                return build(PackType.CASE, count, size.group(1), size.group(2));
            }
        }

        Matcher compact = COMPACT.matcher(text);
        if (compact.find()) {
            return build(PackType.CASE, compact.group(1), compact.group(2), compact.group(3));
        }

        Matcher single = SIZE.matcher(text);
        if (single.find()) {
            String uom = canonicalUom(single.group(2));
            return build(packTypeFor(uom), "1", single.group(1), single.group(2));
        }
        return null;
    }

    /**
     * Canonical spelling of a unit of measure, or {@code null} when it is not one we know.
     */
    public static String canonicalUom(String uom) {
        if (uom == null) {
            return null;
        }
        String key = uom.toLowerCase(Locale.ROOT).replaceAll("[\\s.]", "");
        return UOM_ALIASES.get(key);
    }

    static PackType packTypeFor(String canonicalUom) {
        if (LIQUID_VOLUME.contains(canonicalUom)) {
            return PackType.BOTTLE;
        }
        if (MASS.contains(canonicalUom)) {
            return PackType.BAG;
        }
        return PackType.EACH;
    }

    private ParsedPack build(PackType packType, String units, String size, String uom) {
        String canonical = canonicalUom(uom);
        if (canonical == null) {
            return null;
        }
        int unitsPerPack;
        double unitSize;
        try {
            unitsPerPack = Integer.parseInt(units);
            unitSize = Double.parseDouble(size);
        } catch (NumberFormatException e) {
            return null;
        }
        if (unitsPerPack < 1 || unitSize <= 0) {
            return null;
        }
        return new ParsedPack(packType, unitsPerPack, unitSize, canonical);
    }
}

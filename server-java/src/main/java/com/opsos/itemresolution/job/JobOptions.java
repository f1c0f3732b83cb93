package com.opsos.itemresolution.job;

import com.opsos.itemresolution.exception.ResolutionJobException;

import java.util.Set;

/**
 * Parsed batch invocation: {@code <command> [--dry-run|--apply] [--min-score=0.5] [--org=id]
 * [--top=3] [--output=path] [--guarded] [--canonical=vendorId]}. Dry-run is the default.
 * Options containing a dot ({@code --spring.profiles.active=...}) belong to Spring and are ignored.
 */
public record JobOptions(String command,
                         boolean apply,
                         Double minScore,
                         String organizationId,
                         Integer top,
                         String output,
                         boolean guarded,
                         Long canonicalVendorId) {

    public static final String SUGGEST = "suggest";
    public static final String BULK_MAP = "bulk-map";
    public static final String MERGE_VENDORS = "merge-vendors";
    public static final String BACKFILL_PACK_CONFIGS = "backfill-pack-configs";
    public static final String APPLY_ALIASES = "apply-aliases";

    private static final Set<String> COMMANDS =
            Set.of(SUGGEST, BULK_MAP, MERGE_VENDORS, BACKFILL_PACK_CONFIGS, APPLY_ALIASES);

    public static JobOptions parse(String... args) {
        String command = null;
        Boolean apply = null;
        Double minScore = null;
        String organizationId = null;
        Integer top = null;
        String output = null;
        boolean guarded = false;
        Long canonicalVendorId = null;

        for (String arg : args) {
            if (!arg.startsWith("--")) {
                if (command != null) {
                    throw new ResolutionJobException("Unexpected argument '" + arg + "' after command " + command);
                }
                if (!COMMANDS.contains(arg)) {
                    throw new ResolutionJobException("Unknown command '" + arg + "'; expected one of " + COMMANDS);
                }
                command = arg;
                continue;
            }
            int eq = arg.indexOf('=');
            String name = eq >= 0 ? arg.substring(2, eq) : arg.substring(2);
            String value = eq >= 0 ? arg.substring(eq + 1) : null;
            if (name.contains(".")) {
                continue;
            }
            switch (name) {
                case "dry-run" -> apply = setMode(apply, false);
                case "apply" -> apply = setMode(apply, true);
                case "guarded" -> guarded = true;
                case "min-score" -> {
                    minScore = parseDouble(name, value);
                    if (minScore < 0 || minScore > 1) {
                        throw new ResolutionJobException("--min-score must be between 0 and 1, got " + value);
                    }
                }
                case "org" -> organizationId = required(name, value);
                case "top" -> {
                    top = (int) parseLong(name, value);
                    if (top < 1) {
                        throw new ResolutionJobException("--top must be at least 1, got " + value);
                    }
                }
                case "output" -> output = required(name, value);
                case "canonical" -> canonicalVendorId = parseLong(name, value);
                default -> throw new ResolutionJobException("Unknown option --" + name);
            }
        }
        if (command == null) {
            throw new ResolutionJobException("No command given; expected one of " + COMMANDS);
        }
        return new JobOptions(command, Boolean.TRUE.equals(apply), minScore, organizationId, top, output,
                guarded, canonicalVendorId);
    }

    public String mode() {
        return apply ? "apply" : "dry-run";
    }

    private static Boolean setMode(Boolean current, boolean requested) {
        if (current != null && current != requested) {
            throw new ResolutionJobException("--dry-run and --apply are mutually exclusive");
        }
        return requested;
    }

    private static String required(String name, String value) {
        if (value == null || value.isBlank()) {
            throw new ResolutionJobException("--" + name + " needs a value");
        }
        return value;
    }

    private static double parseDouble(String name, String value) {
        try {
            return Double.parseDouble(required(name, value));
        } catch (NumberFormatException e) {
            throw new ResolutionJobException("--" + name + " is not a number: " + value, e);
        }
    }

    private static long parseLong(String name, String value) {
        try {
            return Long.parseLong(required(name, value));
        } catch (NumberFormatException e) {
            throw new ResolutionJobException("--" + name + " is not an integer: " + value, e);
        }
    }
}

package com.opsos.itemresolution.config;

/**
 * Tunables for matching and batch jobs. The thresholds are empirical, so they live in
 * configuration rather than in code.
 *
 * @param likelyThreshold top score at or above which a group is LIKELY
 * @param maybeThreshold  top score at or above which a group is MAYBE
 * @param minTokenLength  shortest token that counts toward token overlap
 * @param topK            suggestions kept per group
 * @param batchSize       lines updated per bulk-map batch
 * @param pageSize        rows read per page from the store
 */
public record ResolutionSettings(double likelyThreshold,
                                 double maybeThreshold,
                                 int minTokenLength,
                                 int topK,
                                 int batchSize,
                                 int pageSize) {

    public static final ResolutionSettings DEFAULTS = new ResolutionSettings(0.5, 0.3, 4, 3, 50, 500);

    public ResolutionSettings {
        if (maybeThreshold < 0 || likelyThreshold > 1 || maybeThreshold > likelyThreshold) {
            throw new IllegalArgumentException("Thresholds must satisfy 0 <= maybe <= likely <= 1");
        }
        if (minTokenLength < 1) {
            throw new IllegalArgumentException("Minimum token length must be at least 1");
        }
        if (topK < 1 || batchSize < 1 || pageSize < 1) {
            throw new IllegalArgumentException("top-k, batch size and page size must be positive");
        }
    }
}

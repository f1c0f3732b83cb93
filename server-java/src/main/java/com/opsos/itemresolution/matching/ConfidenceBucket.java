package com.opsos.itemresolution.matching;

import com.fasterxml.jackson.annotation.JsonValue;
import com.opsos.itemresolution.config.ResolutionSettings;

import java.util.Locale;

public enum ConfidenceBucket {
    LIKELY,
    MAYBE,
    PROBABLE_NEW,
    DEFINITE_NEW;

    public static ConfidenceBucket classify(double topScore, boolean hasCandidates, ResolutionSettings settings) {
        if (!hasCandidates || topScore <= 0) {
            return DEFINITE_NEW;
        }
        if (topScore >= settings.likelyThreshold()) {
            return LIKELY;
        }
        if (topScore >= settings.maybeThreshold()) {
            return MAYBE;
        }
        return PROBABLE_NEW;
    }

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}

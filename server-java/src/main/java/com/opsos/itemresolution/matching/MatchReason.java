package com.opsos.itemresolution.matching;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * What a suggestion matched on.
 */
public enum MatchReason {
    ALIAS,
    PACK_CONFIG,
    NAME,
    SKU;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}

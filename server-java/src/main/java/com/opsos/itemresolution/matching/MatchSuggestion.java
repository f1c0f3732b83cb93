package com.opsos.itemresolution.matching;

import java.util.Comparator;

/**
 * One ranked candidate item for a group of invoice lines.
 */
public record MatchSuggestion(Long itemId,
                              String itemName,
                              double score,
                              MatchReason reason,
                              int aliasConfirmations) {

    /**
     * Best first: score, then the more often confirmed item, then the smaller id.
     */
    public static final Comparator<MatchSuggestion> RANKING = Comparator
            .comparingDouble(MatchSuggestion::score).reversed()
            .thenComparing(Comparator.comparingInt(MatchSuggestion::aliasConfirmations).reversed())
            .thenComparing(MatchSuggestion::itemId, Comparator.nullsLast(Comparator.naturalOrder()));
}

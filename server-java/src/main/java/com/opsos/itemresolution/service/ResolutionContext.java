package com.opsos.itemresolution.service;

import com.opsos.itemresolution.config.ResolutionSettings;

/**
 * Scope of one resolution run. A {@code null} organization means every organization.
 */
public record ResolutionContext(String organizationId, int pageSize) {

    public ResolutionContext {
        if (organizationId != null && organizationId.isBlank()) {
            organizationId = null;
        }
        if (pageSize < 1) {
            throw new IllegalArgumentException("Page size must be positive");
        }
    }

    public static ResolutionContext of(String organizationId, ResolutionSettings settings) {
        return new ResolutionContext(organizationId, settings.pageSize());
    }
}

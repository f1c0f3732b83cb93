package com.opsos.itemresolution.service;

import java.math.BigDecimal;

/**
 * Read-only projection of an invoice line waiting for an item, joined with its invoice.
 */
public record UnmappedLine(Long lineId,
                           Long invoiceId,
                           String organizationId,
                           Long vendorId,
                           String description,
                           String vendorItemCode,
                           BigDecimal qty,
                           BigDecimal unitCost) {

    public boolean hasVendorItemCode() {
        return vendorItemCode != null && !vendorItemCode.isBlank();
    }
}

package com.opsos.itemresolution.exception;

/**
 * The invoice has been approved; its lines can no longer be mapped or unmapped.
 */
public class InvoiceLockedException extends ResolutionException {

    private final Long invoiceId;

    public InvoiceLockedException(Long invoiceId) {
        super("Invoice " + invoiceId + " is approved and locked");
        this.invoiceId = invoiceId;
    }

    public Long getInvoiceId() {
        return invoiceId;
    }
}

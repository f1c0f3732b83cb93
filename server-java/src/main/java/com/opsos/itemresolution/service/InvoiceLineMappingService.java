package com.opsos.itemresolution.service;

import com.opsos.itemresolution.exception.InvoiceLockedException;
import com.opsos.itemresolution.exception.RecordNotFoundException;
import com.opsos.itemresolution.model.CanonicalItem;
import com.opsos.itemresolution.model.Invoice;
import com.opsos.itemresolution.model.InvoiceLine;
import com.opsos.itemresolution.repository.CanonicalItemRepository;
import com.opsos.itemresolution.repository.InvoiceLineRepository;
import com.opsos.itemresolution.repository.InvoiceRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Manual map / unmap of a single invoice line, as done from the review screen.
 */
@Service
public class InvoiceLineMappingService {

    private static final Logger logger = LoggerFactory.getLogger(InvoiceLineMappingService.class);

    private final InvoiceLineRepository invoiceLineRepository;
    private final InvoiceRepository invoiceRepository;
    private final CanonicalItemRepository itemRepository;
    private final VendorAliasService aliasService;

    public InvoiceLineMappingService(InvoiceLineRepository invoiceLineRepository,
                                     InvoiceRepository invoiceRepository,
                                     CanonicalItemRepository itemRepository,
                                     VendorAliasService aliasService) {
        this.invoiceLineRepository = invoiceLineRepository;
        this.invoiceRepository = invoiceRepository;
        this.itemRepository = itemRepository;
        this.aliasService = aliasService;
    }

    @Transactional
    public InvoiceLine mapLine(Long lineId, Long itemId) {
        if (itemId == null) {
            throw new IllegalArgumentException("Item id is required");
        }
        InvoiceLine line = findLine(lineId);
        Invoice invoice = unlockedInvoice(line);
        CanonicalItem item = itemRepository.findById(itemId)
                .orElseThrow(() -> new RecordNotFoundException("Item", itemId));
        if (!Boolean.TRUE.equals(item.getActive())) {
            throw new IllegalArgumentException("Item " + itemId + " is inactive");
        }

        line.setItemId(itemId);
        InvoiceLine saved = invoiceLineRepository.save(line);

        if (invoice.getVendorId() != null && line.getVendorItemCode() != null && !line.getVendorItemCode().isBlank()) {
            aliasService.confirmMapping(invoice.getVendorId(), line.getVendorItemCode(), itemId,
                    line.getDescription(), null, line.getUnitCost(), invoice.getInvoiceDate(), line.getId());
        }
        logger.info("[InvoiceLineMappingService] Line {} mapped to item {}", lineId, itemId);
        return saved;
    }

    /**
     * Clears the line's item. Learned aliases stay: unmapping one line says nothing about the code.
     */
    @Transactional
    public InvoiceLine unmapLine(Long lineId) {
        InvoiceLine line = findLine(lineId);
        unlockedInvoice(line);
        line.setItemId(null);
        logger.info("[InvoiceLineMappingService] Line {} unmapped", lineId);
        return invoiceLineRepository.save(line);
    }

    private InvoiceLine findLine(Long lineId) {
        return invoiceLineRepository.findById(lineId)
                .orElseThrow(() -> new RecordNotFoundException("Invoice line", lineId));
    }

    private Invoice unlockedInvoice(InvoiceLine line) {
        Invoice invoice = invoiceRepository.findById(line.getInvoiceId())
                .orElseThrow(() -> new RecordNotFoundException("Invoice", line.getInvoiceId()));
        if (invoice.isLocked()) {
            throw new InvoiceLockedException(invoice.getId());
        }
        return invoice;
    }
}

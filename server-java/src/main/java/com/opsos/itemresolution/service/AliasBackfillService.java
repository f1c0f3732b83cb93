package com.opsos.itemresolution.service;

import com.opsos.itemresolution.model.Invoice;
import com.opsos.itemresolution.model.VendorItemAlias;
import com.opsos.itemresolution.repository.InvoiceLineRepository;
import com.opsos.itemresolution.repository.InvoiceRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Slice;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Maps unresolved lines straight from their vendor code's alias, no text matching involved.
 * Only lines whose item is still null are touched, so a re-run is a no-op.
 */
@Service
public class AliasBackfillService {

    private static final Logger logger = LoggerFactory.getLogger(AliasBackfillService.class);

    private final InvoiceLineRepository invoiceLineRepository;
    private final InvoiceRepository invoiceRepository;
    private final VendorAliasService aliasService;

    public AliasBackfillService(InvoiceLineRepository invoiceLineRepository,
                                InvoiceRepository invoiceRepository,
                                VendorAliasService aliasService) {
        this.invoiceLineRepository = invoiceLineRepository;
        this.invoiceRepository = invoiceRepository;
        this.aliasService = aliasService;
    }

    public AliasApplyResult applyAliases(ResolutionContext context, boolean apply) {
        // Collected up front: applying shrinks the unmapped set under a live cursor.
        List<UnmappedLine> lines = new ArrayList<>();
        Pageable page = PageRequest.of(0, context.pageSize());
        while (true) {
            Slice<UnmappedLine> slice = invoiceLineRepository.findUnmappedLines(context.organizationId(), page);
            lines.addAll(slice.getContent());
            if (!slice.hasNext()) {
                break;
            }
            page = slice.nextPageable();
        }

        Map<String, Optional<VendorItemAlias>> aliases = new HashMap<>();
        int matched = 0;
        int updated = 0;
        int skipped = 0;
        int noCode = 0;
        int noAlias = 0;
        int failed = 0;
        for (UnmappedLine line : lines) {
            if (line.vendorId() == null || !line.hasVendorItemCode()) {
                noCode++;
                continue;
            }
            String code = line.vendorItemCode().trim();
            Optional<VendorItemAlias> alias = aliases.computeIfAbsent(line.vendorId() + "\u0000" + code,
                    ignored -> aliasService.lookup(line.vendorId(), code));
            if (alias.isEmpty()) {
                noAlias++;
                continue;
            }
            matched++;
            if (!apply) {
                continue;
            }
            Long itemId = alias.get().getItemId();
            try {
                Invoice invoice = invoiceRepository.findById(line.invoiceId()).orElse(null);
                if (invoice == null || invoice.isLocked()) {
                    skipped++;
                    continue;
                }
                if (invoiceLineRepository.assignItemIfUnmapped(line.lineId(), itemId) == 0) {
                    skipped++;
                    continue;
                }
                updated++;
            } catch (RuntimeException e) {
                failed++;
                logger.error("[AliasBackfillService] Line {} could not be mapped to item {} via code {}: {}",
                        line.lineId(), itemId, code, e.getMessage());
            }
        }

        logger.info("[AliasBackfillService] scanned={} matched={} updated={} skipped={} noCode={} noAlias={} failed={} apply={}",
                lines.size(), matched, updated, skipped, noCode, noAlias, failed, apply);
        return new AliasApplyResult(apply, lines.size(), matched, updated, skipped, noCode, noAlias, failed);
    }

    public record AliasApplyResult(boolean applied,
                                   int scanned,
                                   int matched,
                                   int updated,
                                   int skipped,
                                   int withoutCode,
                                   int withoutAlias,
                                   int failed) {
    }
}

package com.opsos.itemresolution.service;

import com.opsos.itemresolution.config.ResolutionSettings;
import com.opsos.itemresolution.matching.MappingGuard;
import com.opsos.itemresolution.matching.MatchReason;
import com.opsos.itemresolution.matching.MatchSuggestion;
import com.opsos.itemresolution.model.Invoice;
import com.opsos.itemresolution.repository.InvoiceLineRepository;
import com.opsos.itemresolution.repository.InvoiceRepository;
import com.opsos.itemresolution.service.SuggestionService.SuggestionGroup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Applies the top suggestion of every group that clears a score threshold. Dry-run builds
 * the exact same plan and writes nothing.
 */
@Service
public class BulkMappingService {

    private static final Logger logger = LoggerFactory.getLogger(BulkMappingService.class);

    private final InvoiceLineRepository invoiceLineRepository;
    private final InvoiceRepository invoiceRepository;
    private final VendorAliasService aliasService;
    private final MappingGuard mappingGuard;
    private final int batchSize;

    public BulkMappingService(InvoiceLineRepository invoiceLineRepository,
                              InvoiceRepository invoiceRepository,
                              VendorAliasService aliasService,
                              MappingGuard mappingGuard,
                              ResolutionSettings settings) {
        this.invoiceLineRepository = invoiceLineRepository;
        this.invoiceRepository = invoiceRepository;
        this.aliasService = aliasService;
        this.mappingGuard = mappingGuard;
        this.batchSize = settings.batchSize();
    }

    public BulkMapResult bulkMap(List<SuggestionGroup> groups, double minScore, boolean apply) {
        return bulkMap(groups, minScore, apply, false);
    }

    public BulkMapResult bulkMap(List<SuggestionGroup> groups, double minScore, boolean apply, boolean guarded) {
        if (Double.isNaN(minScore) || minScore < 0 || minScore > 1) {
            throw new IllegalArgumentException("Minimum score must be between 0 and 1: " + minScore);
        }

        List<PlannedMapping> planned = new ArrayList<>();
        Map<String, Integer> guardRejections = new LinkedHashMap<>();
        int eligibleGroups = 0;
        int skipped = 0;
        for (SuggestionGroup group : groups) {
            Optional<MatchSuggestion> top = group.topSuggestion();
            if (top.isEmpty() || top.get().score() < minScore) {
                continue;
            }
            MatchSuggestion target = top.get();
            if (guarded && isTextMatch(target)) {
                Optional<String> rejection = mappingGuard.check(group.sampleDescription(), target.itemName());
                if (rejection.isPresent()) {
                    guardRejections.merge(rejection.get(), 1, Integer::sum);
                    skipped += group.lineCount();
                    logger.debug("[BulkMappingService] Group '{}' -> item {} refused: {}",
                            group.normalizedDescription(), target.itemId(), rejection.get());
                    continue;
                }
            }
            eligibleGroups++;
            for (UnmappedLine line : group.lines()) {
                planned.add(new PlannedMapping(line.lineId(), line.invoiceId(), line.vendorId(),
                        line.vendorItemCode(), line.description(), line.unitCost(),
                        target.itemId(), target.itemName(), target.score(), target.reason()));
            }
        }

        if (!apply) {
            logger.info("[BulkMappingService] Dry run: {} groups, {} lines planned, {} skipped",
                    eligibleGroups, planned.size(), skipped);
            return new BulkMapResult(false, eligibleGroups, 0, 0, skipped, 0, guardRejections, planned);
        }

        int updated = 0;
        int failed = 0;
        int aliasesLearned = 0;
        int batches = (planned.size() + batchSize - 1) / batchSize;
        for (int start = 0, batch = 1; start < planned.size(); start += batchSize, batch++) {
            List<PlannedMapping> slice = planned.subList(start, Math.min(start + batchSize, planned.size()));
            for (PlannedMapping mapping : slice) {
                LineOutcome outcome = applyOne(mapping);
                switch (outcome) {
                    case UPDATED -> updated++;
                    case UPDATED_AND_LEARNED -> {
                        updated++;
                        aliasesLearned++;
                    }
                    case SKIPPED -> skipped++;
                    case FAILED -> failed++;
                }
            }
            logger.info("[BulkMappingService] Batch {}/{} done: updated={} skipped={} failed={}",
                    batch, batches, updated, skipped, failed);
        }
        return new BulkMapResult(true, eligibleGroups, updated, failed, skipped, aliasesLearned, guardRejections, planned);
    }

    private LineOutcome applyOne(PlannedMapping mapping) {
        Invoice invoice;
        try {
            invoice = invoiceRepository.findById(mapping.invoiceId()).orElse(null);
            if (invoice == null || invoice.isLocked()) {
                logger.debug("[BulkMappingService] Line {} skipped: invoice {} missing or approved",
                        mapping.lineId(), mapping.invoiceId());
                return LineOutcome.SKIPPED;
            }
            if (invoiceLineRepository.assignItemIfUnmapped(mapping.lineId(), mapping.itemId()) == 0) {
                return LineOutcome.SKIPPED;
            }
        } catch (RuntimeException e) {
            logger.error("[BulkMappingService] Line {} could not be mapped to item {}: {}",
                    mapping.lineId(), mapping.itemId(), e.getMessage());
            return LineOutcome.FAILED;
        }

        if (mapping.vendorId() == null || mapping.vendorItemCode() == null || mapping.vendorItemCode().isBlank()) {
            return LineOutcome.UPDATED;
        }
        try {
            LocalDate effectiveDate = invoice.getInvoiceDate();
            aliasService.confirmMapping(mapping.vendorId(), mapping.vendorItemCode(), mapping.itemId(),
                    mapping.description(), null, mapping.unitCost(), effectiveDate, mapping.lineId());
            return LineOutcome.UPDATED_AND_LEARNED;
        } catch (RuntimeException e) {
            logger.warn("[BulkMappingService] Line {} mapped but alias for code {} not learned: {}",
                    mapping.lineId(), mapping.vendorItemCode(), e.getMessage());
            return LineOutcome.UPDATED;
        }
    }

    private static boolean isTextMatch(MatchSuggestion suggestion) {
        return suggestion.reason() == MatchReason.NAME || suggestion.reason() == MatchReason.SKU;
    }

    private enum LineOutcome {
        UPDATED,
        UPDATED_AND_LEARNED,
        SKIPPED,
        FAILED
    }

    public record PlannedMapping(Long lineId,
                                 Long invoiceId,
                                 Long vendorId,
                                 String vendorItemCode,
                                 String description,
                                 BigDecimal unitCost,
                                 Long itemId,
                                 String itemName,
                                 double score,
                                 MatchReason reason) {
    }

    public record BulkMapResult(boolean applied,
                                int eligibleGroups,
                                int updated,
                                int failed,
                                int skipped,
                                int aliasesLearned,
                                Map<String, Integer> guardRejections,
                                List<PlannedMapping> plannedMappings) {
    }
}

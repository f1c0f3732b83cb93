package com.opsos.itemresolution.service;

import com.opsos.itemresolution.config.ResolutionSettings;
import com.opsos.itemresolution.matching.ConfidenceBucket;
import com.opsos.itemresolution.matching.MappingGuard;
import com.opsos.itemresolution.matching.MatchReason;
import com.opsos.itemresolution.matching.MatchSuggestion;
import com.opsos.itemresolution.model.Invoice;
import com.opsos.itemresolution.repository.InvoiceLineRepository;
import com.opsos.itemresolution.repository.InvoiceRepository;
import com.opsos.itemresolution.service.BulkMappingService.BulkMapResult;
import com.opsos.itemresolution.service.SuggestionService.SuggestionGroup;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.dao.DataAccessResourceFailureException;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class BulkMappingServiceTest {

    private static final Long VENDOR = 5L;
    private static final Long INVOICE = 10L;
    private static final LocalDate INVOICE_DATE = LocalDate.of(2025, 3, 14);

    @Mock
    private InvoiceLineRepository invoiceLineRepository;

    @Mock
    private InvoiceRepository invoiceRepository;

    @Mock
    private VendorAliasService aliasService;

    private BulkMappingService bulkMappingService;
    private Invoice invoice;

    @BeforeEach
    void setup() {
        ResolutionSettings settings = new ResolutionSettings(0.5, 0.3, 4, 3, 2, 500);
        bulkMappingService = new BulkMappingService(invoiceLineRepository, invoiceRepository, aliasService,
                new MappingGuard(), settings);

        invoice = new Invoice();
        invoice.setId(INVOICE);
        invoice.setVendorId(VENDOR);
        invoice.setInvoiceDate(INVOICE_DATE);
        invoice.setStatus("draft");
        when(invoiceRepository.findById(INVOICE)).thenReturn(Optional.of(invoice));
    }

    @Test
    void dryRunPlansEligibleGroupsWithoutWriting() {
        List<SuggestionGroup> groups = List.of(
                group("grey goose", "CS/12 750ML Grey Goose", suggestion(100L, "Grey Goose Vodka", 0.8, MatchReason.NAME),
                        line(1L, "CS/12 750ML Grey Goose", "GG-750"), line(2L, "Grey Goose 750ml", null)),
                group("goose island", "Goose Island", suggestion(102L, "Goose Island IPA", 0.4, MatchReason.NAME),
                        line(3L, "Goose Island", null)),
                group("mystery widget", "Mystery Widget", null, line(4L, "Mystery Widget", null)));

        BulkMapResult result = bulkMappingService.bulkMap(groups, 0.5, false);

        assertThat(result.applied()).isFalse();
        assertThat(result.eligibleGroups()).isEqualTo(1);
        assertThat(result.plannedMappings()).extracting(BulkMappingService.PlannedMapping::lineId).containsExactly(1L, 2L);
        assertThat(result.plannedMappings()).allMatch(mapping -> mapping.itemId().equals(100L));
        assertThat(result.updated()).isZero();
        verify(invoiceLineRepository, never()).assignItemIfUnmapped(anyLong(), anyLong());
        verifyNoInteractions(aliasService);
    }

    @Test
    void applyUpdatesUnclaimedLinesAndLearnsAliases() {
        when(invoiceLineRepository.assignItemIfUnmapped(1L, 100L)).thenReturn(1);
        when(invoiceLineRepository.assignItemIfUnmapped(2L, 100L)).thenReturn(0);
        when(invoiceLineRepository.assignItemIfUnmapped(3L, 100L)).thenReturn(1);
        List<SuggestionGroup> groups = List.of(
                group("grey goose", "CS/12 750ML Grey Goose", suggestion(100L, "Grey Goose Vodka", 0.8, MatchReason.NAME),
                        line(1L, "CS/12 750ML Grey Goose", "GG-750"), line(2L, "Grey Goose 750ml", null),
                        line(3L, "Grey Goose", null)));

        BulkMapResult result = bulkMappingService.bulkMap(groups, 0.5, true);

        assertThat(result.applied()).isTrue();
        assertThat(result.updated()).isEqualTo(2);
        assertThat(result.skipped()).isEqualTo(1);
        assertThat(result.failed()).isZero();
        assertThat(result.aliasesLearned()).isEqualTo(1);
        verify(aliasService).confirmMapping(eq(VENDOR), eq("GG-750"), eq(100L), eq("CS/12 750ML Grey Goose"),
                isNull(), eq(new BigDecimal("30.00")), eq(INVOICE_DATE), eq(1L));
    }

    @Test
    void linesOnApprovedInvoicesAreSkipped() {
        invoice.setStatus(Invoice.STATUS_APPROVED);
        List<SuggestionGroup> groups = List.of(
                group("grey goose", "Grey Goose", suggestion(100L, "Grey Goose Vodka", 0.8, MatchReason.NAME),
                        line(1L, "Grey Goose", "GG-750")));

        BulkMapResult result = bulkMappingService.bulkMap(groups, 0.5, true);

        assertThat(result.skipped()).isEqualTo(1);
        assertThat(result.updated()).isZero();
        verify(invoiceLineRepository, never()).assignItemIfUnmapped(anyLong(), anyLong());
    }

    @Test
    void writeFailureIsCountedAndProcessingContinues() {
        when(invoiceLineRepository.assignItemIfUnmapped(1L, 100L))
                .thenThrow(new DataAccessResourceFailureException("database is locked"));
        when(invoiceLineRepository.assignItemIfUnmapped(2L, 100L)).thenReturn(1);
        when(invoiceLineRepository.assignItemIfUnmapped(3L, 100L)).thenReturn(1);
        List<SuggestionGroup> groups = List.of(
                group("grey goose", "Grey Goose", suggestion(100L, "Grey Goose Vodka", 0.8, MatchReason.NAME),
                        line(1L, "Grey Goose", null), line(2L, "Grey Goose", null), line(3L, "Grey Goose", null)));

        BulkMapResult result = bulkMappingService.bulkMap(groups, 0.5, true);

        assertThat(result.failed()).isEqualTo(1);
        assertThat(result.updated()).isEqualTo(2);
    }

    @Test
    void aliasFailureDoesNotUndoTheMapping() {
        when(invoiceLineRepository.assignItemIfUnmapped(1L, 100L)).thenReturn(1);
        when(aliasService.confirmMapping(any(), any(), any(), any(), any(), any(), any(), any()))
                .thenThrow(new DataAccessResourceFailureException("database is locked"));
        List<SuggestionGroup> groups = List.of(
                group("grey goose", "Grey Goose", suggestion(100L, "Grey Goose Vodka", 0.8, MatchReason.NAME),
                        line(1L, "Grey Goose", "GG-750")));

        BulkMapResult result = bulkMappingService.bulkMap(groups, 0.5, true);

        assertThat(result.updated()).isEqualTo(1);
        assertThat(result.failed()).isZero();
        assertThat(result.aliasesLearned()).isZero();
    }

    @Test
    void guardedRunSkipsConflictingTextMatchesInBothModes() {
        List<SuggestionGroup> groups = List.of(
                group("martini rossi sweet vermouth", "Martini Sweet Vermouth 1L",
                        suggestion(200L, "Martini Dry Vermouth", 0.6, MatchReason.NAME),
                        line(1L, "Martini Sweet Vermouth 1L", null), line(2L, "Martini Sweet Vermouth 1L", null)));

        BulkMapResult dryRun = bulkMappingService.bulkMap(groups, 0.5, false, true);
        BulkMapResult applied = bulkMappingService.bulkMap(groups, 0.5, true, true);

        assertThat(dryRun.skipped()).isEqualTo(2);
        assertThat(dryRun.plannedMappings()).isEmpty();
        assertThat(dryRun.guardRejections()).containsEntry(MappingGuard.SWEET_DRY_CONFLICT, 1);
        assertThat(applied.skipped()).isEqualTo(2);
        verify(invoiceLineRepository, never()).assignItemIfUnmapped(anyLong(), anyLong());
    }

    @Test
    void guardDoesNotApplyToAliasMatches() {
        List<SuggestionGroup> groups = List.of(
                group("martini rossi sweet vermouth", "Martini Sweet Vermouth 1L",
                        suggestion(200L, "Martini Dry Vermouth", 1.0, MatchReason.ALIAS),
                        line(1L, "Martini Sweet Vermouth 1L", "MR-1")));

        BulkMapResult result = bulkMappingService.bulkMap(groups, 0.5, false, true);

        assertThat(result.plannedMappings()).hasSize(1);
        assertThat(result.skipped()).isZero();
    }

    @Test
    void rejectsScoreOutsideUnitInterval() {
        assertThrows(IllegalArgumentException.class, () -> bulkMappingService.bulkMap(List.of(), 1.5, false));
    }

    private static SuggestionGroup group(String normalized, String sample, MatchSuggestion top, UnmappedLine... lines) {
        List<MatchSuggestion> suggestions = top == null ? List.of() : List.of(top);
        ConfidenceBucket bucket = ConfidenceBucket.classify(top == null ? 0 : top.score(), top != null,
                ResolutionSettings.DEFAULTS);
        return new SuggestionGroup("org-1", VENDOR, normalized, sample, null, List.of(lines), suggestions, bucket);
    }

    private static MatchSuggestion suggestion(Long itemId, String name, double score, MatchReason reason) {
        return new MatchSuggestion(itemId, name, score, reason, 0);
    }

    private static UnmappedLine line(Long id, String description, String code) {
        return new UnmappedLine(id, INVOICE, "org-1", VENDOR, description, code, BigDecimal.ONE, new BigDecimal("30.00"));
    }
}

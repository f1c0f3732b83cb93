package com.opsos.itemresolution.job;

import com.opsos.itemresolution.config.ResolutionSettings;
import com.opsos.itemresolution.exception.ResolutionJobException;
import com.opsos.itemresolution.service.AliasBackfillService;
import com.opsos.itemresolution.service.AliasBackfillService.AliasApplyResult;
import com.opsos.itemresolution.service.BulkMappingService;
import com.opsos.itemresolution.service.BulkMappingService.BulkMapResult;
import com.opsos.itemresolution.service.PackConfigBackfillService;
import com.opsos.itemresolution.service.PackConfigBackfillService.BackfillResult;
import com.opsos.itemresolution.service.ResolutionContext;
import com.opsos.itemresolution.service.SuggestionService;
import com.opsos.itemresolution.service.SuggestionService.SuggestionReport;
import com.opsos.itemresolution.service.VendorDeduplicationService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class ResolutionCommandRunnerTest {

    @Mock
    private SuggestionService suggestionService;

    @Mock
    private BulkMappingService bulkMappingService;

    @Mock
    private VendorDeduplicationService deduplicationService;

    @Mock
    private PackConfigBackfillService backfillService;

    @Mock
    private AliasBackfillService aliasBackfillService;

    @Mock
    private ReviewFileWriter reviewFileWriter;

    private ResolutionCommandRunner runner;
    private final SuggestionReport emptyReport = new SuggestionReport(List.of(), 0, 0, 0);

    @BeforeEach
    void setup() {
        runner = new ResolutionCommandRunner(suggestionService, bulkMappingService, deduplicationService,
                backfillService, aliasBackfillService, reviewFileWriter, ResolutionSettings.DEFAULTS, "review/suggestions.json");
        when(suggestionService.generateSuggestions(any(ResolutionContext.class), anyInt())).thenReturn(emptyReport);
        when(bulkMappingService.bulkMap(anyList(), anyDouble(), anyBoolean(), anyBoolean()))
                .thenReturn(new BulkMapResult(false, 0, 0, 0, 0, 0, Map.of(), List.of()));
        when(backfillService.backfill(any(ResolutionContext.class), anyBoolean()))
                .thenReturn(new BackfillResult(false, 0, 0, 0, 0, 0, 0));
        when(aliasBackfillService.applyAliases(any(ResolutionContext.class), anyBoolean()))
                .thenReturn(new AliasApplyResult(false, 0, 0, 0, 0, 0, 0, 0));
    }

    @Test
    void noCommandStartsNothing() {
        runner.run();
        runner.run("--server.port=8081");

        verifyNoInteractions(suggestionService, bulkMappingService, deduplicationService, backfillService,
                aliasBackfillService);
    }

    @Test
    void suggestWritesReviewFileToRequestedPath() {
        runner.run("suggest", "--org=org-1", "--top=5", "--output=target/review.json");

        verify(suggestionService).generateSuggestions(new ResolutionContext("org-1", 500), 5);
        verify(reviewFileWriter).write(emptyReport, Path.of("target/review.json"));
    }

    @Test
    void bulkMapDefaultsToDryRunAtLikelyThreshold() {
        runner.run("bulk-map");

        verify(bulkMappingService).bulkMap(List.of(), 0.5, false, false);
    }

    @Test
    void bulkMapPassesApplyAndGuards() {
        runner.run("bulk-map", "--apply", "--min-score=0.8", "--guarded");

        verify(bulkMappingService).bulkMap(eq(List.of()), eq(0.8), eq(true), eq(true));
    }

    @Test
    void backfillRunsInRequestedMode() {
        runner.run("backfill-pack-configs", "--apply");

        verify(backfillService).backfill(new ResolutionContext(null, 500), true);
    }

    @Test
    void applyAliasesHonorsOrgAndDefaultsToDryRun() {
        runner.run("apply-aliases", "--org=org-1");
        runner.run("apply-aliases", "--apply");

        verify(aliasBackfillService).applyAliases(new ResolutionContext("org-1", 500), false);
        verify(aliasBackfillService).applyAliases(new ResolutionContext(null, 500), true);
    }

    @Test
    void malformedInvocationFails() {
        assertThrows(ResolutionJobException.class, () -> runner.run("bulk-map", "--min-score=abc"));
    }
}

package com.opsos.itemresolution.job;

import com.opsos.itemresolution.config.ResolutionSettings;
import com.opsos.itemresolution.matching.ConfidenceBucket;
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
import com.opsos.itemresolution.service.VendorDeduplicationService.DuplicateVendorGroup;
import com.opsos.itemresolution.service.VendorDeduplicationService.VendorMergeResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Batch entry point: {@code java -jar item-resolution.jar <command> [options]}. Without a
 * command the application just serves the review API.
 */
@Component
public class ResolutionCommandRunner implements CommandLineRunner {

    private static final Logger logger = LoggerFactory.getLogger(ResolutionCommandRunner.class);

    private final SuggestionService suggestionService;
    private final BulkMappingService bulkMappingService;
    private final VendorDeduplicationService deduplicationService;
    private final PackConfigBackfillService backfillService;
    private final AliasBackfillService aliasBackfillService;
    private final ReviewFileWriter reviewFileWriter;
    private final ResolutionSettings settings;
    private final String defaultReviewOutput;

    public ResolutionCommandRunner(SuggestionService suggestionService,
                                   BulkMappingService bulkMappingService,
                                   VendorDeduplicationService deduplicationService,
                                   PackConfigBackfillService backfillService,
                                   AliasBackfillService aliasBackfillService,
                                   ReviewFileWriter reviewFileWriter,
                                   ResolutionSettings settings,
                                   @Value("${resolution.review.output:review/suggestions.json}") String defaultReviewOutput) {
        this.suggestionService = suggestionService;
        this.bulkMappingService = bulkMappingService;
        this.deduplicationService = deduplicationService;
        this.backfillService = backfillService;
        this.aliasBackfillService = aliasBackfillService;
        this.reviewFileWriter = reviewFileWriter;
        this.settings = settings;
        this.defaultReviewOutput = defaultReviewOutput;
    }

    @Override
    public void run(String... args) {
        boolean hasCommand = false;
        for (String arg : args) {
            if (!arg.startsWith("--")) {
                hasCommand = true;
                break;
            }
        }
        if (!hasCommand) {
            return;
        }
        execute(JobOptions.parse(args));
    }

    public void execute(JobOptions options) {
        logger.info("[ResolutionCommandRunner] {} ({})", options.command(), options.mode());
        switch (options.command()) {
            case JobOptions.SUGGEST -> suggest(options);
            case JobOptions.BULK_MAP -> bulkMap(options);
            case JobOptions.MERGE_VENDORS -> mergeVendors(options);
            case JobOptions.BACKFILL_PACK_CONFIGS -> backfill(options);
            case JobOptions.APPLY_ALIASES -> applyAliases(options);
            default -> throw new IllegalStateException("Unhandled command " + options.command());
        }
    }

    private SuggestionReport generate(JobOptions options) {
        ResolutionContext context = ResolutionContext.of(options.organizationId(), settings);
        int topK = options.top() != null ? options.top() : settings.topK();
        return suggestionService.generateSuggestions(context, topK);
    }

    private void suggest(JobOptions options) {
        SuggestionReport report = generate(options);
        Path output = Path.of(options.output() != null ? options.output() : defaultReviewOutput);
        reviewFileWriter.write(report, output);

        Map<ConfidenceBucket, Long> buckets = report.groupsByBucket();
        System.out.println("[suggest] processed=" + report.linesScanned()
                + " groups=" + report.groups().size()
                + " likely=" + buckets.get(ConfidenceBucket.LIKELY)
                + " maybe=" + buckets.get(ConfidenceBucket.MAYBE)
                + " probable_new=" + buckets.get(ConfidenceBucket.PROBABLE_NEW)
                + " definite_new=" + buckets.get(ConfidenceBucket.DEFINITE_NEW)
                + " skipped=" + report.parseFailures());
        System.out.println("[suggest] review file written to " + output.toAbsolutePath());
    }

    private void bulkMap(JobOptions options) {
        SuggestionReport report = generate(options);
        double minScore = options.minScore() != null ? options.minScore() : settings.likelyThreshold();
        BulkMapResult result = bulkMappingService.bulkMap(report.groups(), minScore, options.apply(), options.guarded());

        System.out.println("[bulk-map] mode=" + options.mode()
                + " min_score=" + minScore
                + " processed=" + report.linesScanned()
                + " matched=" + result.plannedMappings().size()
                + " groups=" + result.eligibleGroups()
                + " updated=" + result.updated()
                + " skipped=" + result.skipped()
                + " failed=" + result.failed()
                + " aliases_learned=" + result.aliasesLearned());
        if (!result.guardRejections().isEmpty()) {
            System.out.println("[bulk-map] guard rejections " + result.guardRejections());
        }
        if (!options.apply()) {
            result.plannedMappings().forEach(mapping -> System.out.println("[bulk-map]   line " + mapping.lineId()
                    + " '" + mapping.description() + "' -> item " + mapping.itemId()
                    + " '" + mapping.itemName() + "' (" + String.format("%.2f", mapping.score())
                    + ", " + mapping.reason().code() + ")"));
        }
    }

    private void mergeVendors(JobOptions options) {
        ResolutionContext context = ResolutionContext.of(options.organizationId(), settings);
        List<DuplicateVendorGroup> groups = deduplicationService.findDuplicateVendors(context);
        if (options.canonicalVendorId() != null) {
            Long canonical = options.canonicalVendorId();
            groups = groups.stream()
                    .filter(group -> group.members().stream().anyMatch(vendor -> canonical.equals(vendor.getId())))
                    .toList();
            if (groups.isEmpty()) {
                throw new IllegalArgumentException("Vendor " + canonical + " has no duplicates to merge");
            }
        }

        int deleted = 0;
        int retained = 0;
        for (DuplicateVendorGroup group : groups) {
            VendorMergeResult result = deduplicationService.mergeGroup(group, options.canonicalVendorId(), options.apply());
            deleted += result.deletedVendorIds().size();
            retained += options.apply() ? result.retainedVendorIds().size() : 0;
            System.out.println("[merge-vendors] '" + group.normalizedName() + "' -> vendor " + result.canonicalVendorId()
                    + " duplicates=" + (group.members().size() - 1)
                    + " pack_configs=" + result.packConfigsReassigned()
                    + " invoices=" + result.invoicesReassigned()
                    + " aliases=" + result.aliasesReassigned()
                    + " aliases_folded=" + result.aliasesFolded()
                    + " deleted=" + result.deletedVendorIds());
        }
        System.out.println("[merge-vendors] mode=" + options.mode()
                + " processed=" + groups.size()
                + " updated=" + deleted
                + " skipped=" + retained);
    }

    private void backfill(JobOptions options) {
        ResolutionContext context = ResolutionContext.of(options.organizationId(), settings);
        BackfillResult result = backfillService.backfill(context, options.apply());
        System.out.println("[backfill-pack-configs] mode=" + options.mode()
                + " processed=" + result.scanned()
                + " matched=" + result.created()
                + " updated=" + (result.applied() ? result.created() : 0)
                + " superseded=" + result.superseded()
                + " skipped=" + (result.alreadyConfigured() + result.unparseable())
                + " unparseable=" + result.unparseable()
                + " failed=" + result.failed());
    }

    private void applyAliases(JobOptions options) {
        ResolutionContext context = ResolutionContext.of(options.organizationId(), settings);
        AliasApplyResult result = aliasBackfillService.applyAliases(context, options.apply());
        System.out.println("[apply-aliases] mode=" + options.mode()
                + " processed=" + result.scanned()
                + " matched=" + result.matched()
                + " updated=" + result.updated()
                + " skipped=" + (result.skipped() + result.withoutCode() + result.withoutAlias())
                + " no_code=" + result.withoutCode()
                + " no_alias=" + result.withoutAlias()
                + " failed=" + result.failed());
    }
}

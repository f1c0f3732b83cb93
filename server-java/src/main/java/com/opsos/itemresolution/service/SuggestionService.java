package com.opsos.itemresolution.service;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.opsos.itemresolution.config.ResolutionSettings;
import com.opsos.itemresolution.matching.ConfidenceBucket;
import com.opsos.itemresolution.matching.DescriptionNormalizer;
import com.opsos.itemresolution.matching.MatchReason;
import com.opsos.itemresolution.matching.MatchSuggestion;
import com.opsos.itemresolution.matching.PackSizeParser;
import com.opsos.itemresolution.matching.ParsedPack;
import com.opsos.itemresolution.matching.SimilarityScorer;
import com.opsos.itemresolution.model.CanonicalItem;
import com.opsos.itemresolution.model.PackConfiguration;
import com.opsos.itemresolution.model.VendorItemAlias;
import com.opsos.itemresolution.repository.CanonicalItemRepository;
import com.opsos.itemresolution.repository.InvoiceLineRepository;
import com.opsos.itemresolution.repository.PackConfigurationRepository;
import com.opsos.itemresolution.util.VendorCodeVariants;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Slice;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Groups unresolved invoice lines by vendor and normalized description and ranks catalog
 * items for each group. A group is what a reviewer (or the bulk mapper) acts on. An alias
 * hit on a line's vendor code short-circuits text scoring for that line.
 */
@Service
public class SuggestionService {

    private static final Logger logger = LoggerFactory.getLogger(SuggestionService.class);

    static final double PACK_CONFIG_SINGLE_ITEM = 0.95;
    static final double PACK_CONFIG_MULTIPLE_ITEMS = 0.85;

    private final InvoiceLineRepository invoiceLineRepository;
    private final CanonicalItemRepository itemRepository;
    private final PackConfigurationRepository packConfigurationRepository;
    private final VendorAliasService aliasService;
    private final DescriptionNormalizer normalizer;
    private final PackSizeParser packSizeParser;
    private final SimilarityScorer scorer;
    private final ResolutionSettings settings;

    public SuggestionService(InvoiceLineRepository invoiceLineRepository,
                             CanonicalItemRepository itemRepository,
                             PackConfigurationRepository packConfigurationRepository,
                             VendorAliasService aliasService,
                             DescriptionNormalizer normalizer,
                             PackSizeParser packSizeParser,
                             SimilarityScorer scorer,
                             ResolutionSettings settings) {
        this.invoiceLineRepository = invoiceLineRepository;
        this.itemRepository = itemRepository;
        this.packConfigurationRepository = packConfigurationRepository;
        this.aliasService = aliasService;
        this.normalizer = normalizer;
        this.packSizeParser = packSizeParser;
        this.scorer = scorer;
        this.settings = settings;
    }

    public SuggestionReport generateSuggestions(ResolutionContext context) {
        return generateSuggestions(context, settings.topK());
    }

    public SuggestionReport generateSuggestions(ResolutionContext context, int topK) {
        if (topK < 1) {
            throw new IllegalArgumentException("top-k must be at least 1");
        }
        List<UnmappedLine> lines = loadUnmappedLines(context);

        // A vendor code with a confirmed alias decides its line outright; only the rest is scored.
        Map<String, Optional<Long>> aliasCache = new HashMap<>();
        Map<GroupKey, List<UnmappedLine>> partitions = new LinkedHashMap<>();
        int parseFailures = 0;
        int aliasResolved = 0;
        for (UnmappedLine line : lines) {
            if (line.description() == null || line.description().isBlank()) {
                parseFailures++;
                continue;
            }
            String normalized = normalizer.normalize(line.description());
            if (normalized.isEmpty()) {
                parseFailures++;
                continue;
            }
            Long aliasItemId = aliasItemFor(line, aliasCache).orElse(null);
            if (aliasItemId != null) {
                aliasResolved++;
            }
            GroupKey key = new GroupKey(line.organizationId(), line.vendorId(), normalized, aliasItemId);
            partitions.computeIfAbsent(key, ignored -> new ArrayList<>()).add(line);
        }

        Map<String, List<CanonicalItem>> catalog = loadCatalog(context);
        Map<Long, CanonicalItem> itemsById = new HashMap<>();
        catalog.values().forEach(items -> items.forEach(item -> itemsById.put(item.getId(), item)));

        List<SuggestionGroup> groups = new ArrayList<>();
        for (Map.Entry<GroupKey, List<UnmappedLine>> entry : partitions.entrySet()) {
            GroupKey key = entry.getKey();
            List<UnmappedLine> groupLines = entry.getValue();

            List<MatchSuggestion> ranked;
            if (key.aliasItemId() != null) {
                Long itemId = key.aliasItemId();
                ranked = List.of(new MatchSuggestion(itemId, itemName(itemId, itemsById), SimilarityScorer.EXACT,
                        MatchReason.ALIAS, confirmations(itemId, itemsById)));
            } else {
                Map<Long, MatchSuggestion> best = new HashMap<>();
                for (CanonicalItem item : catalog.getOrDefault(key.organizationId(), List.of())) {
                    offer(best, scoreItem(key.normalizedDescription(), item));
                }
                addPackConfigMatches(best, key.vendorId(), groupLines, itemsById);
                ranked = best.values().stream()
                        .filter(suggestion -> suggestion.score() > 0)
                        .sorted(MatchSuggestion.RANKING)
                        .limit(topK)
                        .collect(Collectors.toList());
            }
            double topScore = ranked.isEmpty() ? 0.0 : ranked.get(0).score();

            String sample = groupLines.get(0).description();
            groups.add(new SuggestionGroup(
                    key.organizationId(),
                    key.vendorId(),
                    key.normalizedDescription(),
                    sample,
                    packSizeParser.parsePackSize(sample),
                    List.copyOf(groupLines),
                    ranked,
                    ConfidenceBucket.classify(topScore, !ranked.isEmpty(), settings)));
        }

        logger.info("[SuggestionService] {} lines -> {} groups ({} by alias, {} unparseable, {} catalog items)",
                lines.size(), groups.size(), aliasResolved, parseFailures, itemsById.size());
        return new SuggestionReport(groups, lines.size(), parseFailures, itemsById.size());
    }

    MatchSuggestion scoreItem(String normalizedDescription, CanonicalItem item) {
        double nameScore = scorer.score(normalizedDescription, item.getName());
        double skuScore = scorer.score(normalizedDescription, item.getSku());
        if (skuScore > nameScore) {
            return new MatchSuggestion(item.getId(), item.getName(), skuScore, MatchReason.SKU, item.confirmationCount());
        }
        return new MatchSuggestion(item.getId(), item.getName(), nameScore, MatchReason.NAME, item.confirmationCount());
    }

    private Optional<Long> aliasItemFor(UnmappedLine line, Map<String, Optional<Long>> cache) {
        if (line.vendorId() == null || !line.hasVendorItemCode()) {
            return Optional.empty();
        }
        String code = line.vendorItemCode().trim();
        return cache.computeIfAbsent(line.vendorId() + "\u0000" + code,
                ignored -> aliasService.lookup(line.vendorId(), code).map(VendorItemAlias::getItemId));
    }

    private void addPackConfigMatches(Map<Long, MatchSuggestion> best,
                                      Long vendorId,
                                      List<UnmappedLine> groupLines,
                                      Map<Long, CanonicalItem> itemsById) {
        if (vendorId == null) {
            return;
        }
        Set<String> codes = groupLines.stream()
                .filter(UnmappedLine::hasVendorItemCode)
                .map(line -> line.vendorItemCode().trim())
                .collect(Collectors.toCollection(LinkedHashSet::new));

        for (String code : codes) {
            List<Long> packItems = packConfigurationRepository
                    .findByVendorIdAndVendorItemCodeInAndActiveTrue(vendorId, VendorCodeVariants.of(code))
                    .stream()
                    .map(PackConfiguration::getItemId)
                    .distinct()
                    .collect(Collectors.toList());
            double score = packItems.size() == 1 ? PACK_CONFIG_SINGLE_ITEM : PACK_CONFIG_MULTIPLE_ITEMS;
            for (Long itemId : packItems) {
                offer(best, new MatchSuggestion(itemId, itemName(itemId, itemsById), score,
                        MatchReason.PACK_CONFIG, confirmations(itemId, itemsById)));
            }
        }
    }

    private static void offer(Map<Long, MatchSuggestion> best, MatchSuggestion candidate) {
        // Per item keep the highest score; on a tie a code match beats a text match.
        best.merge(candidate.itemId(), candidate, (current, offered) -> {
            if (offered.score() != current.score()) {
                return offered.score() > current.score() ? offered : current;
            }
            return offered.reason().ordinal() < current.reason().ordinal() ? offered : current;
        });
    }

    private String itemName(Long itemId, Map<Long, CanonicalItem> itemsById) {
        CanonicalItem item = itemsById.get(itemId);
        if (item != null) {
            return item.getName();
        }
        return itemRepository.findById(itemId).map(CanonicalItem::getName).orElse(null);
    }

    private static int confirmations(Long itemId, Map<Long, CanonicalItem> itemsById) {
        CanonicalItem item = itemsById.get(itemId);
        return item != null ? item.confirmationCount() : 0;
    }

    private List<UnmappedLine> loadUnmappedLines(ResolutionContext context) {
        List<UnmappedLine> lines = new ArrayList<>();
        Pageable page = PageRequest.of(0, context.pageSize());
        while (true) {
            Slice<UnmappedLine> slice = invoiceLineRepository.findUnmappedLines(context.organizationId(), page);
            lines.addAll(slice.getContent());
            if (!slice.hasNext()) {
                return lines;
            }
            page = slice.nextPageable();
        }
    }

    private Map<String, List<CanonicalItem>> loadCatalog(ResolutionContext context) {
        Map<String, List<CanonicalItem>> catalog = new HashMap<>();
        Pageable page = PageRequest.of(0, context.pageSize());
        while (true) {
            Slice<CanonicalItem> slice = context.organizationId() == null
                    ? itemRepository.findByActiveTrueOrderByIdAsc(page)
                    : itemRepository.findByOrganizationIdAndActiveTrueOrderByIdAsc(context.organizationId(), page);
            for (CanonicalItem item : slice.getContent()) {
                catalog.computeIfAbsent(item.getOrganizationId(), ignored -> new ArrayList<>()).add(item);
            }
            if (!slice.hasNext()) {
                return catalog;
            }
            page = slice.nextPageable();
        }
    }

    private record GroupKey(String organizationId, Long vendorId, String normalizedDescription, Long aliasItemId) {
    }

    /**
     * Lines sharing a vendor and a normalized description, with their ranked candidates.
     * Lines whose vendor code has an alias form their own group with the aliased item as the
     * only suggestion.
     */
    public record SuggestionGroup(String organizationId,
                                  Long vendorId,
                                  String normalizedDescription,
                                  String sampleDescription,
                                  ParsedPack parsedPack,
                                  List<UnmappedLine> lines,
                                  List<MatchSuggestion> suggestions,
                                  ConfidenceBucket bucket) {

        @JsonProperty("topScore")
        public double topScore() {
            return suggestions.isEmpty() ? 0.0 : suggestions.get(0).score();
        }

        @JsonProperty("lineCount")
        public int lineCount() {
            return lines.size();
        }

        public Optional<MatchSuggestion> topSuggestion() {
            return suggestions.isEmpty() ? Optional.empty() : Optional.of(suggestions.get(0));
        }
    }

    public record SuggestionReport(List<SuggestionGroup> groups,
                                   int linesScanned,
                                   int parseFailures,
                                   int catalogSize) {

        public Map<ConfidenceBucket, Long> groupsByBucket() {
            Map<ConfidenceBucket, Long> counts = new EnumMap<>(ConfidenceBucket.class);
            for (ConfidenceBucket bucket : ConfidenceBucket.values()) {
                counts.put(bucket, 0L);
            }
            groups.forEach(group -> counts.merge(group.bucket(), 1L, Long::sum));
            return counts;
        }
    }
}

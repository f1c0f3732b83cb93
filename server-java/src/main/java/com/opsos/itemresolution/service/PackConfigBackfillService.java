package com.opsos.itemresolution.service;

import com.opsos.itemresolution.matching.PackSizeParser;
import com.opsos.itemresolution.matching.ParsedPack;
import com.opsos.itemresolution.model.PackConfiguration;
import com.opsos.itemresolution.model.VendorItemAlias;
import com.opsos.itemresolution.repository.PackConfigurationRepository;
import com.opsos.itemresolution.repository.VendorItemAliasRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Slice;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Gives aliases learned before pack parsing existed a pack configuration of their own.
 * A vendor code keeps a single active configuration: one left over from the item the alias
 * used to point at is superseded, not joined.
 */
@Service
public class PackConfigBackfillService {

    private static final Logger logger = LoggerFactory.getLogger(PackConfigBackfillService.class);

    private final VendorItemAliasRepository aliasRepository;
    private final PackConfigurationRepository packConfigurationRepository;
    private final VendorAliasService aliasService;
    private final PackSizeParser packSizeParser;

    public PackConfigBackfillService(VendorItemAliasRepository aliasRepository,
                                     PackConfigurationRepository packConfigurationRepository,
                                     VendorAliasService aliasService,
                                     PackSizeParser packSizeParser) {
        this.aliasRepository = aliasRepository;
        this.packConfigurationRepository = packConfigurationRepository;
        this.aliasService = aliasService;
        this.packSizeParser = packSizeParser;
    }

    public BackfillResult backfill(ResolutionContext context, boolean apply) {
        int scanned = 0;
        int created = 0;
        int superseded = 0;
        int alreadyConfigured = 0;
        int unparseable = 0;
        int failed = 0;

        Pageable page = PageRequest.of(0, context.pageSize());
        while (true) {
            Slice<VendorItemAlias> slice = aliasRepository.findByActiveTrueOrderByIdAsc(page);
            for (VendorItemAlias alias : slice.getContent()) {
                scanned++;
                String code = alias.getVendorItemCode();
                if (code == null || code.isBlank()) {
                    continue;
                }
                List<PackConfiguration> current = packConfigurationRepository
                        .findByVendorIdAndVendorItemCodeAndActiveTrue(alias.getVendorId(), code);
                if (current.stream().anyMatch(configuration -> alias.getItemId().equals(configuration.getItemId()))) {
                    alreadyConfigured++;
                    continue;
                }
                ParsedPack parsed = packSizeParser.parsePackSize(alias.getPackSize());
                if (parsed == null) {
                    parsed = packSizeParser.parsePackSize(alias.getVendorDescription());
                }
                if (parsed == null) {
                    unparseable++;
                    continue;
                }
                if (!apply) {
                    created++;
                    superseded += current.isEmpty() ? 0 : 1;
                    continue;
                }
                try {
                    if (aliasService.learnPackConfiguration(alias.getItemId(), alias.getVendorId(), code,
                            alias.getPackSize(), alias.getVendorDescription()).isPresent()) {
                        created++;
                        superseded += current.isEmpty() ? 0 : 1;
                    }
                } catch (RuntimeException e) {
                    failed++;
                    logger.error("[PackConfigBackfillService] Alias {} ({}): pack {} not saved: {}",
                            alias.getId(), code, parsed.describe(), e.getMessage());
                }
            }
            if (!slice.hasNext()) {
                break;
            }
            page = slice.nextPageable();
        }

        logger.info("[PackConfigBackfillService] scanned={} created={} superseded={} existing={} unparseable={} failed={} apply={}",
                scanned, created, superseded, alreadyConfigured, unparseable, failed, apply);
        return new BackfillResult(apply, scanned, created, superseded, alreadyConfigured, unparseable, failed);
    }

    /**
     * {@code superseded} counts created configurations that replaced one left on another item.
     */
    public record BackfillResult(boolean applied,
                                 int scanned,
                                 int created,
                                 int superseded,
                                 int alreadyConfigured,
                                 int unparseable,
                                 int failed) {
    }
}

package com.opsos.itemresolution.service;

import com.opsos.itemresolution.matching.PackSizeParser;
import com.opsos.itemresolution.matching.ParsedPack;
import com.opsos.itemresolution.model.ItemCostHistory;
import com.opsos.itemresolution.model.PackConfiguration;
import com.opsos.itemresolution.model.VendorItemAlias;
import com.opsos.itemresolution.repository.CanonicalItemRepository;
import com.opsos.itemresolution.repository.ItemCostHistoryRepository;
import com.opsos.itemresolution.repository.PackConfigurationRepository;
import com.opsos.itemresolution.repository.VendorItemAliasRepository;
import com.opsos.itemresolution.util.VendorCodeVariants;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Durable vendor code to item mappings. Every confirmed mapping lands here, and a hit on
 * (vendor, code) skips text matching entirely the next time the code shows up.
 */
@Service
public class VendorAliasService {

    private static final Logger logger = LoggerFactory.getLogger(VendorAliasService.class);

    private final VendorItemAliasRepository aliasRepository;
    private final CanonicalItemRepository itemRepository;
    private final ItemCostHistoryRepository costHistoryRepository;
    private final PackConfigurationRepository packConfigurationRepository;
    private final PackSizeParser packSizeParser;

    public VendorAliasService(VendorItemAliasRepository aliasRepository,
                              CanonicalItemRepository itemRepository,
                              ItemCostHistoryRepository costHistoryRepository,
                              PackConfigurationRepository packConfigurationRepository,
                              PackSizeParser packSizeParser) {
        this.aliasRepository = aliasRepository;
        this.itemRepository = itemRepository;
        this.costHistoryRepository = costHistoryRepository;
        this.packConfigurationRepository = packConfigurationRepository;
        this.packSizeParser = packSizeParser;
    }

    /**
     * Active alias for the code, trying its spelling variants in order.
     */
    public Optional<VendorItemAlias> lookup(Long vendorId, String vendorItemCode) {
        List<String> variants = VendorCodeVariants.of(vendorItemCode);
        if (vendorId == null || variants.isEmpty()) {
            return Optional.empty();
        }
        Map<String, VendorItemAlias> byCode = aliasRepository
                .findByVendorIdAndVendorItemCodeInAndActiveTrue(vendorId, variants)
                .stream()
                .collect(Collectors.toMap(VendorItemAlias::getVendorItemCode, Function.identity(), (a, b) -> a));
        for (String variant : variants) {
            VendorItemAlias alias = byCode.get(variant);
            if (alias != null) {
                return Optional.of(alias);
            }
        }
        return Optional.empty();
    }

    /**
     * Records that {@code vendorItemCode} from this vendor is {@code itemId}. The latest
     * confirmation wins: an existing alias for the code, or for a spelling variant of it,
     * is repointed, never duplicated.
     */
    @Transactional
    public VendorItemAlias confirmMapping(Long vendorId,
                                          String vendorItemCode,
                                          Long itemId,
                                          String description,
                                          String packSizeText,
                                          BigDecimal unitCost,
                                          LocalDate effectiveDate,
                                          Long sourceInvoiceLineId) {
        if (vendorId == null || itemId == null) {
            throw new IllegalArgumentException("Vendor and item are required to confirm a mapping");
        }
        if (vendorItemCode == null || vendorItemCode.isBlank()) {
            throw new IllegalArgumentException("Vendor item code is required to confirm a mapping");
        }
        String code = vendorItemCode.trim();

        // Runs first: the bulk update clears the persistence context.
        itemRepository.incrementAliasConfirmations(itemId);

        VendorItemAlias alias = findStored(vendorId, code)
                .orElseGet(() -> {
                    VendorItemAlias created = new VendorItemAlias();
                    created.setVendorId(vendorId);
                    created.setVendorItemCode(code);
                    return created;
                });
        Long previousItemId = alias.getItemId();
        alias.setItemId(itemId);
        if (description != null && !description.isBlank()) {
            alias.setVendorDescription(description);
        }
        if (packSizeText != null && !packSizeText.isBlank()) {
            alias.setPackSize(packSizeText);
        }
        alias.setActive(true);
        alias.setConfirmations((alias.getConfirmations() != null ? alias.getConfirmations() : 0) + 1);
        VendorItemAlias saved = aliasRepository.save(alias);

        if (previousItemId != null && !previousItemId.equals(itemId)) {
            logger.info("[VendorAliasService] Alias vendor={} code={} repointed from item {} to {}",
                    vendorId, code, previousItemId, itemId);
        }

        if (unitCost != null) {
            ItemCostHistory history = new ItemCostHistory();
            history.setItemId(itemId);
            history.setVendorId(vendorId);
            history.setUnitCost(unitCost);
            history.setEffectiveDate(effectiveDate != null ? effectiveDate : LocalDate.now());
            history.setSourceInvoiceLineId(sourceInvoiceLineId);
            costHistoryRepository.save(history);
        }

        learnPackConfiguration(itemId, vendorId, saved.getVendorItemCode(), packSizeText, description);
        return saved;
    }

    /**
     * The alias row for the code, active or not: stored under the exact code, else under
     * the first of its spelling variants ("00123-A" confirms onto a stored "123A").
     */
    private Optional<VendorItemAlias> findStored(Long vendorId, String code) {
        Optional<VendorItemAlias> exact = aliasRepository.findByVendorIdAndVendorItemCode(vendorId, code);
        if (exact.isPresent()) {
            return exact;
        }
        List<String> variants = VendorCodeVariants.of(code);
        Map<String, VendorItemAlias> byCode = aliasRepository
                .findByVendorIdAndVendorItemCodeIn(vendorId, variants)
                .stream()
                .collect(Collectors.toMap(VendorItemAlias::getVendorItemCode, Function.identity(), (a, b) -> a));
        for (String variant : variants) {
            VendorItemAlias alias = byCode.get(variant);
            if (alias != null) {
                return Optional.of(alias);
            }
        }
        return Optional.empty();
    }

    /**
     * Parses pack text (falling back to the description) and stores it as the active
     * configuration for the vendor code. An identical active configuration is left alone;
     * a different one is deactivated and superseded.
     *
     * @return the new configuration, or empty when nothing was parsed or nothing changed
     */
    @Transactional
    public Optional<PackConfiguration> learnPackConfiguration(Long itemId,
                                                              Long vendorId,
                                                              String vendorItemCode,
                                                              String packSizeText,
                                                              String description) {
        ParsedPack parsed = packSizeParser.parsePackSize(packSizeText);
        if (parsed == null) {
            parsed = packSizeParser.parsePackSize(description);
        }
        if (parsed == null) {
            return Optional.empty();
        }

        List<PackConfiguration> current = packConfigurationRepository
                .findByVendorIdAndVendorItemCodeAndActiveTrue(vendorId, vendorItemCode);
        for (PackConfiguration configuration : current) {
            if (itemId.equals(configuration.getItemId()) && parsed.sameAs(configuration)) {
                return Optional.empty();
            }
        }
        for (PackConfiguration configuration : current) {
            configuration.setActive(false);
        }
        if (!current.isEmpty()) {
            packConfigurationRepository.saveAll(current);
        }

        PackConfiguration saved = packConfigurationRepository.save(parsed.toConfiguration(itemId, vendorId, vendorItemCode));
        logger.debug("[VendorAliasService] Pack {} learned for vendor={} code={} item={}",
                parsed.describe(), vendorId, vendorItemCode, itemId);
        return Optional.of(saved);
    }
}

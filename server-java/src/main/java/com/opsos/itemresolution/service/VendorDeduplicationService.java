package com.opsos.itemresolution.service;

import com.opsos.itemresolution.exception.RecordNotFoundException;
import com.opsos.itemresolution.model.Vendor;
import com.opsos.itemresolution.model.VendorItemAlias;
import com.opsos.itemresolution.repository.InvoiceRepository;
import com.opsos.itemresolution.repository.PackConfigurationRepository;
import com.opsos.itemresolution.repository.VendorItemAliasRepository;
import com.opsos.itemresolution.repository.VendorRepository;
import com.opsos.itemresolution.util.VendorNameNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.*;

/**
 * Collapses vendor rows that differ only in spelling ("Southern Glazer's LLC" vs
 * "southern glazers"). References move first; a duplicate row is deleted only once a
 * re-count shows nothing points at it anymore.
 */
@Service
public class VendorDeduplicationService {

    private static final Logger logger = LoggerFactory.getLogger(VendorDeduplicationService.class);

    private final VendorRepository vendorRepository;
    private final PackConfigurationRepository packConfigurationRepository;
    private final InvoiceRepository invoiceRepository;
    private final VendorItemAliasRepository aliasRepository;

    public VendorDeduplicationService(VendorRepository vendorRepository,
                                      PackConfigurationRepository packConfigurationRepository,
                                      InvoiceRepository invoiceRepository,
                                      VendorItemAliasRepository aliasRepository) {
        this.vendorRepository = vendorRepository;
        this.packConfigurationRepository = packConfigurationRepository;
        this.invoiceRepository = invoiceRepository;
        this.aliasRepository = aliasRepository;
    }

    /**
     * Active vendors sharing an organization and a normalized name. The earliest-created
     * member of each group is its default canonical vendor.
     */
    public List<DuplicateVendorGroup> findDuplicateVendors(ResolutionContext context) {
        List<Vendor> vendors = context.organizationId() == null
                ? vendorRepository.findByActiveTrueOrderByCreatedAtAscIdAsc()
                : vendorRepository.findByOrganizationIdAndActiveTrueOrderByCreatedAtAscIdAsc(context.organizationId());

        Map<String, List<Vendor>> byKey = new LinkedHashMap<>();
        for (Vendor vendor : vendors) {
            String normalized = VendorNameNormalizer.normalize(vendor.getName());
            if (normalized.isEmpty()) {
                continue;
            }
            byKey.computeIfAbsent(vendor.getOrganizationId() + "\u0000" + normalized, ignored -> new ArrayList<>())
                    .add(vendor);
        }

        List<DuplicateVendorGroup> groups = new ArrayList<>();
        for (List<Vendor> members : byKey.values()) {
            if (members.size() < 2) {
                continue;
            }
            Vendor canonical = members.get(0);
            groups.add(new DuplicateVendorGroup(
                    canonical.getOrganizationId(),
                    VendorNameNormalizer.normalize(canonical.getName()),
                    canonical,
                    List.copyOf(members.subList(1, members.size()))));
        }
        return groups;
    }

    /**
     * Merges one group, honoring an explicit canonical vendor when it belongs to the group.
     */
    public VendorMergeResult mergeGroup(DuplicateVendorGroup group, Long canonicalOverride, boolean apply) {
        List<Vendor> members = group.members();
        Long canonicalId = group.canonical().getId();
        if (canonicalOverride != null) {
            boolean inGroup = members.stream().anyMatch(vendor -> canonicalOverride.equals(vendor.getId()));
            if (!inGroup) {
                throw new IllegalArgumentException("Vendor " + canonicalOverride + " is not part of group '"
                        + group.normalizedName() + "'");
            }
            canonicalId = canonicalOverride;
        }
        List<Long> duplicateIds = new ArrayList<>();
        for (Vendor vendor : members) {
            if (!vendor.getId().equals(canonicalId)) {
                duplicateIds.add(vendor.getId());
            }
        }
        return mergeGroup(canonicalId, duplicateIds, apply);
    }

    public VendorMergeResult mergeGroup(Long canonicalId, List<Long> duplicateIds, boolean apply) {
        Vendor canonical = vendorRepository.findById(canonicalId)
                .orElseThrow(() -> new RecordNotFoundException("Vendor", canonicalId));
        for (Long duplicateId : duplicateIds) {
            if (canonicalId.equals(duplicateId)) {
                throw new IllegalArgumentException("Canonical vendor " + canonicalId + " cannot also be a duplicate");
            }
            Vendor duplicate = vendorRepository.findById(duplicateId)
                    .orElseThrow(() -> new RecordNotFoundException("Vendor", duplicateId));
            if (!Objects.equals(duplicate.getOrganizationId(), canonical.getOrganizationId())) {
                throw new IllegalArgumentException("Vendor " + duplicateId + " belongs to another organization");
            }
        }

        if (!apply) {
            return planMerge(canonicalId, duplicateIds);
        }

        int packConfigs = 0;
        int invoices = 0;
        int aliases = 0;
        int folded = 0;
        List<Long> deleted = new ArrayList<>();
        List<Long> retained = new ArrayList<>();
        for (Long duplicateId : duplicateIds) {
            try {
                packConfigs += packConfigurationRepository.reassignVendor(duplicateId, canonicalId);
                invoices += invoiceRepository.reassignVendor(duplicateId, canonicalId);
                AliasMove move = moveAliases(duplicateId, canonicalId);
                aliases += move.reassigned();
                folded += move.folded();
            } catch (RuntimeException e) {
                logger.error("[VendorDeduplicationService] Reassigning vendor {} to {} failed: {}",
                        duplicateId, canonicalId, e.getMessage());
                retained.add(duplicateId);
                continue;
            }

            long remaining = countReferences(duplicateId);
            if (remaining == 0) {
                vendorRepository.deleteById(duplicateId);
                deleted.add(duplicateId);
            } else {
                logger.warn("[VendorDeduplicationService] Vendor {} still has {} references after merge into {}; not deleted",
                        duplicateId, remaining, canonicalId);
                retained.add(duplicateId);
            }
        }

        Vendor refreshed = vendorRepository.findById(canonicalId).orElse(canonical);
        refreshed.setNormalizedName(VendorNameNormalizer.normalize(refreshed.getName()));
        vendorRepository.save(refreshed);

        logger.info("[VendorDeduplicationService] Merged into vendor {}: packConfigs={} invoices={} aliases={} folded={} deleted={}",
                canonicalId, packConfigs, invoices, aliases, folded, deleted);
        return new VendorMergeResult(true, canonicalId, packConfigs, invoices, aliases, folded, deleted, retained);
    }

    public long countReferences(Long vendorId) {
        return packConfigurationRepository.countByVendorId(vendorId)
                + invoiceRepository.countByVendorId(vendorId)
                + aliasRepository.countByVendorId(vendorId);
    }

    private VendorMergeResult planMerge(Long canonicalId, List<Long> duplicateIds) {
        int packConfigs = 0;
        int invoices = 0;
        int aliases = 0;
        int folded = 0;
        for (Long duplicateId : duplicateIds) {
            packConfigs += (int) packConfigurationRepository.countByVendorId(duplicateId);
            invoices += (int) invoiceRepository.countByVendorId(duplicateId);
            for (VendorItemAlias alias : aliasRepository.findByVendorId(duplicateId)) {
                if (aliasRepository.findByVendorIdAndVendorItemCode(canonicalId, alias.getVendorItemCode()).isPresent()) {
                    folded++;
                } else {
                    aliases++;
                }
            }
        }
        return new VendorMergeResult(false, canonicalId, packConfigs, invoices, aliases, folded,
                List.of(), List.copyOf(duplicateIds));
    }

    private AliasMove moveAliases(Long duplicateId, Long canonicalId) {
        int reassigned = 0;
        int folded = 0;
        for (VendorItemAlias alias : aliasRepository.findByVendorId(duplicateId)) {
            Optional<VendorItemAlias> existing = aliasRepository.findByVendorIdAndVendorItemCode(canonicalId, alias.getVendorItemCode());
            if (existing.isEmpty()) {
                alias.setVendorId(canonicalId);
                aliasRepository.save(alias);
                reassigned++;
                continue;
            }
            // Same code already known under the canonical vendor: keep that row, newest confirmation wins.
            VendorItemAlias keeper = existing.get();
            if (isNewer(alias.getUpdatedAt(), keeper.getUpdatedAt())) {
                keeper.setItemId(alias.getItemId());
                keeper.setVendorDescription(alias.getVendorDescription());
                keeper.setPackSize(alias.getPackSize());
                keeper.setActive(alias.getActive());
            }
            keeper.setConfirmations(count(keeper.getConfirmations()) + count(alias.getConfirmations()));
            aliasRepository.save(keeper);
            aliasRepository.delete(alias);
            folded++;
        }
        return new AliasMove(reassigned, folded);
    }

    private static boolean isNewer(LocalDateTime candidate, LocalDateTime current) {
        if (candidate == null) {
            return false;
        }
        return current == null || candidate.isAfter(current);
    }

    private static int count(Integer value) {
        return value != null ? value : 0;
    }

    private record AliasMove(int reassigned, int folded) {
    }

    public record DuplicateVendorGroup(String organizationId,
                                       String normalizedName,
                                       Vendor canonical,
                                       List<Vendor> duplicates) {

        public List<Vendor> members() {
            List<Vendor> members = new ArrayList<>();
            members.add(canonical);
            members.addAll(duplicates);
            return members;
        }
    }

    public record VendorMergeResult(boolean applied,
                                    Long canonicalVendorId,
                                    int packConfigsReassigned,
                                    int invoicesReassigned,
                                    int aliasesReassigned,
                                    int aliasesFolded,
                                    List<Long> deletedVendorIds,
                                    List<Long> retainedVendorIds) {
    }
}

package com.opsos.itemresolution.repository;

import com.opsos.itemresolution.model.PackConfiguration;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.List;

@Repository
public interface PackConfigurationRepository extends JpaRepository<PackConfiguration, Long> {

    List<PackConfiguration> findByVendorIdAndVendorItemCodeAndActiveTrue(Long vendorId, String vendorItemCode);

    List<PackConfiguration> findByVendorIdAndVendorItemCodeInAndActiveTrue(Long vendorId, Collection<String> vendorItemCodes);

    long countByVendorId(Long vendorId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Transactional
    @Query(value = "UPDATE item_pack_configurations SET vendor_id = :canonicalVendorId WHERE vendor_id = :duplicateVendorId", nativeQuery = true)
    int reassignVendor(@Param("duplicateVendorId") Long duplicateVendorId,
                       @Param("canonicalVendorId") Long canonicalVendorId);
}

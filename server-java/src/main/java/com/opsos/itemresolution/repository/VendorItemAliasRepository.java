package com.opsos.itemresolution.repository;

import com.opsos.itemresolution.model.VendorItemAlias;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Slice;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface VendorItemAliasRepository extends JpaRepository<VendorItemAlias, Long> {

    Optional<VendorItemAlias> findByVendorIdAndVendorItemCode(Long vendorId, String vendorItemCode);

    List<VendorItemAlias> findByVendorIdAndVendorItemCodeInAndActiveTrue(Long vendorId, Collection<String> vendorItemCodes);

    List<VendorItemAlias> findByVendorIdAndVendorItemCodeIn(Long vendorId, Collection<String> vendorItemCodes);

    List<VendorItemAlias> findByVendorId(Long vendorId);

    Slice<VendorItemAlias> findByActiveTrueOrderByIdAsc(Pageable pageable);

    long countByVendorId(Long vendorId);
}

package com.opsos.itemresolution.repository;

import com.opsos.itemresolution.model.Invoice;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

@Repository
public interface InvoiceRepository extends JpaRepository<Invoice, Long> {

    long countByVendorId(Long vendorId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Transactional
    @Query(value = "UPDATE invoices SET vendor_id = :canonicalVendorId WHERE vendor_id = :duplicateVendorId", nativeQuery = true)
    int reassignVendor(@Param("duplicateVendorId") Long duplicateVendorId,
                       @Param("canonicalVendorId") Long canonicalVendorId);
}

package com.opsos.itemresolution.repository;

import com.opsos.itemresolution.model.InvoiceLine;
import com.opsos.itemresolution.service.UnmappedLine;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Slice;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

@Repository
public interface InvoiceLineRepository extends JpaRepository<InvoiceLine, Long> {

    // Lines still waiting for review: unmapped, not ignored, positive or unknown qty, invoice not yet approved.
    @Query("SELECT new com.opsos.itemresolution.service.UnmappedLine(" +
            "l.id, l.invoiceId, i.organizationId, i.vendorId, l.description, l.vendorItemCode, l.qty, l.unitCost) " +
            "FROM InvoiceLine l, Invoice i " +
            "WHERE i.id = l.invoiceId " +
            "AND l.itemId IS NULL " +
            "AND l.ignored = false " +
            "AND (l.qty IS NULL OR l.qty > 0) " +
            "AND LOWER(i.status) <> 'approved' " +
            "AND (:organizationId IS NULL OR i.organizationId = :organizationId) " +
            "ORDER BY l.id")
    Slice<UnmappedLine> findUnmappedLines(@Param("organizationId") String organizationId, Pageable pageable);

    /**
     * Sets the item only while the line is still unmapped.
     *
     * @return 1 when this call claimed the line, 0 when someone else mapped it first
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Transactional
    @Query(value = "UPDATE invoice_lines SET item_id = :itemId WHERE id = :lineId AND item_id IS NULL", nativeQuery = true)
    int assignItemIfUnmapped(@Param("lineId") Long lineId, @Param("itemId") Long itemId);
}

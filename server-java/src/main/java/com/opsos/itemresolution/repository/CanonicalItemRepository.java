package com.opsos.itemresolution.repository;

import com.opsos.itemresolution.model.CanonicalItem;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Slice;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

@Repository
public interface CanonicalItemRepository extends JpaRepository<CanonicalItem, Long> {

    Slice<CanonicalItem> findByActiveTrueOrderByIdAsc(Pageable pageable);

    Slice<CanonicalItem> findByOrganizationIdAndActiveTrueOrderByIdAsc(String organizationId, Pageable pageable);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Transactional
    @Query(value = "UPDATE items SET alias_confirmations = COALESCE(alias_confirmations, 0) + 1 WHERE id = :itemId", nativeQuery = true)
    int incrementAliasConfirmations(@Param("itemId") Long itemId);
}

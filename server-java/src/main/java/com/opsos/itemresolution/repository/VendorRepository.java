package com.opsos.itemresolution.repository;

import com.opsos.itemresolution.model.Vendor;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface VendorRepository extends JpaRepository<Vendor, Long> {

    List<Vendor> findByActiveTrueOrderByCreatedAtAscIdAsc();

    List<Vendor> findByOrganizationIdAndActiveTrueOrderByCreatedAtAscIdAsc(String organizationId);
}

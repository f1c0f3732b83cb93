package com.opsos.itemresolution.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Catalog item that vendor line text resolves to. The catalog owns it; the
 * resolution engine only bumps {@code aliasConfirmations}.
 */
@Entity
@Table(name = "items", indexes = {
        @Index(name = "idx_items_org_active", columnList = "organization_id, is_active")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CanonicalItem {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "organization_id", nullable = false)
    private String organizationId;

    @Column(nullable = false)
    private String name;

    @Column
    private String sku;

    @Column
    private String category;

    @Column
    private String subcategory;

    @Column(name = "base_uom")
    private String baseUom;

    @Column(name = "is_active", nullable = false)
    private Boolean active = true;

    @Column(name = "alias_confirmations", nullable = false)
    private Integer aliasConfirmations = 0;

    public int confirmationCount() {
        return aliasConfirmations != null ? aliasConfirmations : 0;
    }
}

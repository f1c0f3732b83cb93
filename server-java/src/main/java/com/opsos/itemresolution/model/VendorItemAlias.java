package com.opsos.itemresolution.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Learned mapping from a vendor's own item code to a canonical item.
 * (vendor_id, vendor_item_code) is the identity; a second confirmation rewrites this row.
 */
@Entity
@Table(name = "vendor_item_aliases", uniqueConstraints = {
        @UniqueConstraint(name = "uq_alias_vendor_code", columnNames = {"vendor_id", "vendor_item_code"})
})
@Data
@NoArgsConstructor
@AllArgsConstructor
public class VendorItemAlias {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "vendor_id", nullable = false)
    private Long vendorId;

    @Column(name = "vendor_item_code", nullable = false)
    private String vendorItemCode;

    @Column(name = "item_id", nullable = false)
    private Long itemId;

    @Column(name = "vendor_description")
    private String vendorDescription;

    @Column(name = "pack_size")
    private String packSize;

    @Column(name = "is_active", nullable = false)
    private Boolean active = true;

    @Column(name = "confirmations", nullable = false)
    private Integer confirmations = 0;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @PrePersist
    public void onCreate() {
        LocalDateTime now = LocalDateTime.now();
        if (createdAt == null) {
            createdAt = now;
        }
        if (updatedAt == null) {
            updatedAt = now;
        }
    }

    @PreUpdate
    public void onUpdate() {
        updatedAt = LocalDateTime.now();
    }
}

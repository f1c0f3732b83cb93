package com.opsos.itemresolution.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Entity
@Table(name = "item_pack_configurations", indexes = {
        @Index(name = "idx_pack_config_vendor_code", columnList = "vendor_id, vendor_item_code"),
        @Index(name = "idx_pack_config_item", columnList = "item_id")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PackConfiguration {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "item_id", nullable = false)
    private Long itemId;

    @Column(name = "vendor_id")
    private Long vendorId;

    @Column(name = "vendor_item_code")
    private String vendorItemCode;

    @Enumerated(EnumType.STRING)
    @Column(name = "pack_type", nullable = false)
    private PackType packType;

    @Column(name = "units_per_pack", nullable = false)
    private Integer unitsPerPack;

    @Column(name = "unit_size", nullable = false)
    private Double unitSize;

    @Column(name = "unit_size_uom", nullable = false)
    private String unitSizeUom;

    @Column(name = "is_active", nullable = false)
    private Boolean active = true;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @PrePersist
    public void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
        if (active == null) {
            active = true;
        }
    }
}

package com.opsos.itemresolution.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Entity
@Table(name = "invoice_lines", indexes = {
        @Index(name = "idx_invoice_lines_invoice", columnList = "invoice_id"),
        @Index(name = "idx_invoice_lines_item", columnList = "item_id")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
public class InvoiceLine {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "invoice_id", nullable = false)
    private Long invoiceId;

    @Column(nullable = false)
    private String description;

    @Column(name = "vendor_item_code")
    private String vendorItemCode;

    @Column
    private BigDecimal qty;

    @Column(name = "unit_cost")
    private BigDecimal unitCost;

    @Column(name = "item_id")
    private Long itemId;

    @Column(name = "is_ignored", nullable = false)
    private Boolean ignored = false;

    @Column(name = "created_at")
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
        if (ignored == null) {
            ignored = false;
        }
    }

    public boolean isMapped() {
        return itemId != null;
    }
}

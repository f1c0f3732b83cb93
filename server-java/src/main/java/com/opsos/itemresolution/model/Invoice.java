package com.opsos.itemresolution.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalDateTime;

@Entity
@Table(name = "invoices", indexes = {
        @Index(name = "idx_invoices_vendor", columnList = "vendor_id")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Invoice {

    public static final String STATUS_APPROVED = "approved";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "organization_id", nullable = false)
    private String organizationId;

    @Column(name = "vendor_id")
    private Long vendorId;

    @Column(name = "venue_id")
    private Long venueId;

    @Column(name = "invoice_number")
    private String invoiceNumber;

    @Column(name = "invoice_date")
    private LocalDate invoiceDate;

    @Column(nullable = false)
    private String status = "draft";

    @Column(name = "created_at")
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
    }

    public boolean isLocked() {
        return STATUS_APPROVED.equalsIgnoreCase(status);
    }
}

package com.skillq.subject;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

@Entity
@Table(name = "invoice_data")
public class Invoice {

    @Id
    private UUID id;

    @Column(name = "project_id", nullable = false)
    private UUID projectId;

    @Column(name = "invoice_number")
    private String invoiceNumber;

    @Column(name = "invoice_date", nullable = false)
    private LocalDate invoiceDate;

    @Column(name = "vendor_name", nullable = false)
    private String vendorName;

    @Column(name = "total_amount", nullable = false)
    private BigDecimal totalAmount;

    private BigDecimal tonnage;

    private Integer hauls;

    /**
     * Charge breakdown, e.g. {@code {"disposal": 850.0, "contamination": 50.0, "bulk_service": 100.0}}.
     */
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(columnDefinition = "jsonb")
    private JsonNode charges;

    public Invoice() {
    }

    public Invoice(UUID id, UUID projectId, LocalDate invoiceDate, String vendorName, BigDecimal totalAmount,
            BigDecimal tonnage, Integer hauls) {
        this.id = id;
        this.projectId = projectId;
        this.invoiceDate = invoiceDate;
        this.vendorName = vendorName;
        this.totalAmount = totalAmount;
        this.tonnage = tonnage;
        this.hauls = hauls;
    }

    public double chargeOf(String name) {
        if (charges == null || !charges.has(name)) {
            return 0.0;
        }
        return charges.get(name).asDouble(0.0);
    }

    public UUID getId() {
        return id;
    }

    public void setId(UUID id) {
        this.id = id;
    }

    public UUID getProjectId() {
        return projectId;
    }

    public void setProjectId(UUID projectId) {
        this.projectId = projectId;
    }

    public String getInvoiceNumber() {
        return invoiceNumber;
    }

    public void setInvoiceNumber(String invoiceNumber) {
        this.invoiceNumber = invoiceNumber;
    }

    public LocalDate getInvoiceDate() {
        return invoiceDate;
    }

    public void setInvoiceDate(LocalDate invoiceDate) {
        this.invoiceDate = invoiceDate;
    }

    public String getVendorName() {
        return vendorName;
    }

    public void setVendorName(String vendorName) {
        this.vendorName = vendorName;
    }

    public BigDecimal getTotalAmount() {
        return totalAmount;
    }

    public void setTotalAmount(BigDecimal totalAmount) {
        this.totalAmount = totalAmount;
    }

    public BigDecimal getTonnage() {
        return tonnage;
    }

    public void setTonnage(BigDecimal tonnage) {
        this.tonnage = tonnage;
    }

    public Integer getHauls() {
        return hauls;
    }

    public void setHauls(Integer hauls) {
        this.hauls = hauls;
    }

    public JsonNode getCharges() {
        return charges;
    }

    public void setCharges(JsonNode charges) {
        this.charges = charges;
    }
}

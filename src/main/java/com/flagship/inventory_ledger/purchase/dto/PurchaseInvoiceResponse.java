package com.flagship.inventory_ledger.purchase.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.inventory_ledger.payment.Payment;
import com.flagship.inventory_ledger.payment.dto.PaymentResponse;
import com.flagship.inventory_ledger.purchase.InvoiceStatus;
import com.flagship.inventory_ledger.purchase.PurchaseInvoice;
import com.flagship.inventory_ledger.purchase.PurchaseLine;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PurchaseInvoiceResponse {

    @JsonProperty("id")
    String id;

    @JsonProperty("supplier_id")
    String supplierId;

    @JsonProperty("total_amount")
    BigDecimal totalAmount;

    @JsonProperty("paid_amount")
    BigDecimal paidAmount;

    @JsonProperty("balance_due")
    BigDecimal balanceDue;

    @JsonProperty("payment_status")
    InvoiceStatus paymentStatus;

    @JsonProperty("items")
    List<Line> items;

    @JsonProperty("payments")
    List<PaymentResponse> payments;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static PurchaseInvoiceResponse from(PurchaseInvoice invoice) {
        return from(invoice, null);
    }

    public static PurchaseInvoiceResponse from(PurchaseInvoice invoice, List<Payment> payments) {
        return PurchaseInvoiceResponse.builder()
            .id(invoice.getId())
            .supplierId(invoice.getSupplierId())
            .totalAmount(invoice.getTotalAmount())
            .paidAmount(invoice.getPaidAmount())
            .balanceDue(invoice.getBalanceDue())
            .paymentStatus(invoice.getPaymentStatus())
            .items(invoice.getLines().stream().map(Line::from).toList())
            .payments(payments == null ? null : payments.stream().map(PaymentResponse::from).toList())
            .createdAt(invoice.getCreatedAt())
            .updatedAt(invoice.getUpdatedAt())
            .build();
    }

    @Value
    public static class Line {

        @JsonProperty("item_id")
        String itemId;

        @JsonProperty("quantity")
        int quantity;

        @JsonProperty("unit_price")
        BigDecimal unitPrice;

        @JsonProperty("line_total")
        BigDecimal lineTotal;

        static Line from(PurchaseLine line) {
            return new Line(line.getItemId(), line.getQuantity(), line.getUnitPrice(), line.lineTotal());
        }
    }
}

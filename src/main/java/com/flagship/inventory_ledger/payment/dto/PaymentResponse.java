package com.flagship.inventory_ledger.payment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.inventory_ledger.payment.Payment;
import com.flagship.inventory_ledger.payment.PaymentType;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

@Value
@Builder
public class PaymentResponse {

    @JsonProperty("id")
    String id;

    @JsonProperty("counterparty_id")
    String counterpartyId;

    @JsonProperty("invoice_id")
    String invoiceId;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("account_id")
    String accountId;

    @JsonProperty("payment_type")
    PaymentType paymentType;

    @JsonProperty("direct_payment_ref")
    String directPaymentRef;

    @JsonProperty("created_at")
    Instant createdAt;

    public static PaymentResponse from(Payment payment) {
        return PaymentResponse.builder()
            .id(payment.getId())
            .counterpartyId(payment.getCounterpartyId())
            .invoiceId(payment.getInvoiceId())
            .amount(payment.getAmount())
            .accountId(payment.getAccountId())
            .paymentType(payment.getPaymentType())
            .directPaymentRef(payment.getDirectPaymentRef())
            .createdAt(payment.getCreatedAt())
            .build();
    }
}

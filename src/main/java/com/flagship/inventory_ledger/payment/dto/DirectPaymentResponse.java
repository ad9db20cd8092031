package com.flagship.inventory_ledger.payment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.inventory_ledger.payment.AllocationMethod;
import com.flagship.inventory_ledger.payment.DirectPaymentResult;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

@Value
@Builder
public class DirectPaymentResponse {

    @JsonProperty("direct_payment_ref")
    String directPaymentRef;

    @JsonProperty("supplier_id")
    String supplierId;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("allocation_method")
    AllocationMethod allocationMethod;

    @JsonProperty("invoices_affected")
    int invoicesAffected;

    @JsonProperty("payments")
    List<PaymentResponse> payments;

    @JsonProperty("replayed")
    boolean replayed;

    public static DirectPaymentResponse from(DirectPaymentResult result) {
        return DirectPaymentResponse.builder()
            .directPaymentRef(result.getDirectPaymentRef())
            .supplierId(result.getSupplierId())
            .amount(result.getAmount())
            .allocationMethod(result.getMethod())
            .invoicesAffected(result.getPayments().size())
            .payments(result.getPayments().stream().map(PaymentResponse::from).toList())
            .replayed(result.isReplayed())
            .build();
    }
}

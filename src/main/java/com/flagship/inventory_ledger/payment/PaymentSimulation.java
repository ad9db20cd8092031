package com.flagship.inventory_ledger.payment;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

@Value
public class PaymentSimulation {

    @JsonProperty("supplier_id")
    String supplierId;

    @JsonProperty("payment_amount")
    BigDecimal amount;

    @JsonProperty("allocation_method")
    AllocationMethod method;

    @JsonProperty("total_outstanding")
    BigDecimal totalOutstanding;

    @JsonProperty("message")
    String message;

    @JsonProperty("allocations")
    List<Allocation> allocations;

    @JsonProperty("invoices_affected")
    public int getInvoicesAffected() {
        return allocations.size();
    }
}

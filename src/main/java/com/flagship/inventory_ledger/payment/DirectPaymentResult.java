package com.flagship.inventory_ledger.payment;

import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * Outcome of a direct supplier payment. {@code replayed} is true when an
 * earlier request with the same idempotency key produced it.
 */
@Value
public class DirectPaymentResult {
    String directPaymentRef;
    String supplierId;
    BigDecimal amount;
    AllocationMethod method;
    List<Payment> payments;
    boolean replayed;
}

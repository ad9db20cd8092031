package com.flagship.inventory_ledger.payment;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

@Value
public class Payment {
    String id;
    String counterpartyId;
    String invoiceId;
    BigDecimal amount;
    String accountId;
    PaymentType paymentType;
    String directPaymentRef;
    Instant createdAt;

    /**
     * True when the payment is one slice of a multi-invoice supplier payment.
     */
    public boolean isDirect() {
        return directPaymentRef != null;
    }
}

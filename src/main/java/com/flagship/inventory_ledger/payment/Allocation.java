package com.flagship.inventory_ledger.payment;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.inventory_ledger.purchase.InvoiceStatus;
import lombok.Value;

import java.math.BigDecimal;

/**
 * The share of a supplier payment one invoice receives.
 */
@Value
public class Allocation {

    @JsonProperty("invoice_id")
    String invoiceId;

    @JsonProperty("current_due")
    BigDecimal currentDue;

    @JsonProperty("will_pay")
    BigDecimal amount;

    @JsonProperty("remaining_due")
    BigDecimal remainingDue;

    @JsonProperty("resulting_status")
    InvoiceStatus resultingStatus;

    static Allocation of(OpenInvoice invoice, BigDecimal amount) {
        return new Allocation(invoice.getInvoiceId(), invoice.getBalanceDue(), amount,
                invoice.getBalanceDue().subtract(amount),
                InvoiceStatus.of(invoice.getTotalAmount(), invoice.getPaidAmount().add(amount)));
    }

    public boolean isEmpty() {
        return amount.signum() == 0;
    }
}

package com.flagship.inventory_ledger.payment;

import com.flagship.inventory_ledger.common.Money;
import com.flagship.inventory_ledger.exception.InsufficientBalanceException;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Splits a supplier payment over open invoices. Pure arithmetic, shared by
 * the real payment and its simulation.
 *
 * Allocations always sum exactly to the amount and never exceed an invoice's
 * balance due. Invoices that receive nothing are still listed so a simulation
 * can show them.
 */
public final class PaymentAllocator {

    private PaymentAllocator() {
    }

    /**
     * @param oldestFirst open invoices ordered by creation, oldest first
     * @throws InsufficientBalanceException if the amount exceeds the total outstanding
     */
    public static List<Allocation> allocate(List<OpenInvoice> oldestFirst, BigDecimal amount, AllocationMethod method) {
        BigDecimal value = Money.requirePositive(amount, "Payment amount");
        BigDecimal outstanding = totalDue(oldestFirst);
        if (value.compareTo(outstanding) > 0) {
            throw new InsufficientBalanceException(String.format(
                    "Payment amount %s exceeds total outstanding %s", value, outstanding), value, outstanding);
        }
        return switch (method) {
            case FIFO -> sequential(oldestFirst, value);
            case LIFO -> sequential(reversed(oldestFirst), value);
            case PROPORTIONAL -> proportional(oldestFirst, value);
        };
    }

    public static BigDecimal totalDue(List<OpenInvoice> invoices) {
        return invoices.stream().map(OpenInvoice::getBalanceDue).reduce(Money.ZERO, BigDecimal::add);
    }

    private static List<Allocation> sequential(List<OpenInvoice> ordered, BigDecimal amount) {
        List<Allocation> allocations = new ArrayList<>();
        BigDecimal remaining = amount;
        for (OpenInvoice invoice : ordered) {
            BigDecimal share = remaining.min(invoice.getBalanceDue());
            allocations.add(Allocation.of(invoice, share));
            remaining = remaining.subtract(share);
        }
        return allocations;
    }

    private static List<Allocation> proportional(List<OpenInvoice> ordered, BigDecimal amount) {
        BigDecimal outstanding = totalDue(ordered);
        BigDecimal[] shares = new BigDecimal[ordered.size()];
        BigDecimal allocated = Money.ZERO;
        for (int i = 0; i < ordered.size(); i++) {
            BigDecimal due = ordered.get(i).getBalanceDue();
            BigDecimal share = Money.of(Money.divide(amount.multiply(due), outstanding)).min(due);
            shares[i] = share;
            allocated = allocated.add(share);
        }

        // Rounding leftovers: top up in order while balances allow, or trim from the newest.
        BigDecimal remainder = amount.subtract(allocated);
        for (int i = 0; i < shares.length && remainder.signum() > 0; i++) {
            BigDecimal room = ordered.get(i).getBalanceDue().subtract(shares[i]);
            BigDecimal extra = remainder.min(room);
            shares[i] = shares[i].add(extra);
            remainder = remainder.subtract(extra);
        }
        for (int i = shares.length - 1; i >= 0 && remainder.signum() < 0; i--) {
            BigDecimal cut = remainder.negate().min(shares[i]);
            shares[i] = shares[i].subtract(cut);
            remainder = remainder.add(cut);
        }

        List<Allocation> allocations = new ArrayList<>();
        for (int i = 0; i < shares.length; i++) {
            allocations.add(Allocation.of(ordered.get(i), shares[i]));
        }
        return allocations;
    }

    private static List<OpenInvoice> reversed(List<OpenInvoice> invoices) {
        List<OpenInvoice> copy = new ArrayList<>(invoices);
        Collections.reverse(copy);
        return copy;
    }
}

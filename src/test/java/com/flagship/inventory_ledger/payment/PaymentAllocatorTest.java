package com.flagship.inventory_ledger.payment;

import com.flagship.inventory_ledger.exception.InsufficientBalanceException;
import com.flagship.inventory_ledger.purchase.InvoiceStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Allocation arithmetic for supplier payments.
 */
class PaymentAllocatorTest {

    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    private static OpenInvoice open(String id, String total, String paid, int dayOffset) {
        BigDecimal t = new BigDecimal(total);
        BigDecimal p = new BigDecimal(paid);
        return new OpenInvoice(id, t, p, t.subtract(p), T0.plusSeconds(86400L * dayOffset));
    }

    private static BigDecimal sum(List<Allocation> allocations) {
        return allocations.stream().map(Allocation::getAmount).reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    @Test
    @DisplayName("FIFO pays the oldest invoice in full before the next one")
    void testFifo_OldestFirst() {
        List<OpenInvoice> invoices = List.of(
                open("PINV-A", "200000.00", "0.00", 0),
                open("PINV-B", "300000.00", "0.00", 1));

        List<Allocation> allocations = PaymentAllocator.allocate(invoices, new BigDecimal("350000.00"),
                AllocationMethod.FIFO);

        assertEquals(2, allocations.size());
        assertEquals("PINV-A", allocations.get(0).getInvoiceId());
        assertEquals(0, new BigDecimal("200000.00").compareTo(allocations.get(0).getAmount()));
        assertEquals(InvoiceStatus.PAID, allocations.get(0).getResultingStatus());
        assertEquals(0, new BigDecimal("150000.00").compareTo(allocations.get(1).getAmount()));
        assertEquals(0, new BigDecimal("150000.00").compareTo(allocations.get(1).getRemainingDue()));
        assertEquals(InvoiceStatus.PARTIAL, allocations.get(1).getResultingStatus());
    }

    @Test
    @DisplayName("LIFO pays the newest invoice first")
    void testLifo_NewestFirst() {
        List<OpenInvoice> invoices = List.of(
                open("PINV-A", "100.00", "0.00", 0),
                open("PINV-B", "50.00", "10.00", 1));

        List<Allocation> allocations = PaymentAllocator.allocate(invoices, new BigDecimal("60.00"),
                AllocationMethod.LIFO);

        assertEquals("PINV-B", allocations.get(0).getInvoiceId());
        assertEquals(0, new BigDecimal("40.00").compareTo(allocations.get(0).getAmount()));
        assertEquals("PINV-A", allocations.get(1).getInvoiceId());
        assertEquals(0, new BigDecimal("20.00").compareTo(allocations.get(1).getAmount()));
    }

    @Test
    @DisplayName("Invoices that receive nothing are still listed with a zero share")
    void testFifo_UntouchedInvoicesListed() {
        List<OpenInvoice> invoices = List.of(
                open("PINV-A", "100.00", "0.00", 0),
                open("PINV-B", "100.00", "0.00", 1));

        List<Allocation> allocations = PaymentAllocator.allocate(invoices, new BigDecimal("40.00"),
                AllocationMethod.FIFO);

        assertEquals(2, allocations.size());
        assertTrue(allocations.get(1).isEmpty());
        assertEquals(InvoiceStatus.UNPAID, allocations.get(1).getResultingStatus());
    }

    @Test
    @DisplayName("Proportional shares follow the balances and sum to the amount exactly")
    void testProportional_SumsExactly() {
        List<OpenInvoice> invoices = List.of(
                open("PINV-A", "100.00", "0.00", 0),
                open("PINV-B", "100.00", "0.00", 1),
                open("PINV-C", "100.00", "0.00", 2));

        List<Allocation> allocations = PaymentAllocator.allocate(invoices, new BigDecimal("100.00"),
                AllocationMethod.PROPORTIONAL);

        assertEquals(0, new BigDecimal("100.00").compareTo(sum(allocations)));
        for (Allocation allocation : allocations) {
            assertTrue(allocation.getAmount().compareTo(allocation.getCurrentDue()) <= 0);
            assertTrue(allocation.getAmount().compareTo(new BigDecimal("33.33")) >= 0);
        }
    }

    @Test
    @DisplayName("Proportional split weights by balance due")
    void testProportional_Weighted() {
        List<OpenInvoice> invoices = List.of(
                open("PINV-A", "300.00", "0.00", 0),
                open("PINV-B", "100.00", "0.00", 1));

        List<Allocation> allocations = PaymentAllocator.allocate(invoices, new BigDecimal("200.00"),
                AllocationMethod.PROPORTIONAL);

        assertEquals(0, new BigDecimal("150.00").compareTo(allocations.get(0).getAmount()));
        assertEquals(0, new BigDecimal("50.00").compareTo(allocations.get(1).getAmount()));
    }

    @Test
    @DisplayName("Paying exactly the outstanding total settles every invoice")
    void testProportional_FullSettlement() {
        List<OpenInvoice> invoices = List.of(
                open("PINV-A", "33.33", "0.00", 0),
                open("PINV-B", "66.67", "0.00", 1),
                open("PINV-C", "0.03", "0.00", 2));

        List<Allocation> allocations = PaymentAllocator.allocate(invoices, new BigDecimal("100.03"),
                AllocationMethod.PROPORTIONAL);

        assertEquals(0, new BigDecimal("100.03").compareTo(sum(allocations)));
        allocations.forEach(a -> assertEquals(InvoiceStatus.PAID, a.getResultingStatus()));
    }

    @Test
    @DisplayName("An amount above the total outstanding is rejected")
    void testAllocate_ExceedsOutstanding() {
        List<OpenInvoice> invoices = List.of(open("PINV-A", "100.00", "40.00", 0));

        InsufficientBalanceException e = assertThrows(InsufficientBalanceException.class,
                () -> PaymentAllocator.allocate(invoices, new BigDecimal("60.01"), AllocationMethod.FIFO));
        assertTrue(e.getMessage().contains("60.00"));
    }

    @Test
    @DisplayName("Non-positive amounts are rejected")
    void testAllocate_NonPositive() {
        List<OpenInvoice> invoices = List.of(open("PINV-A", "100.00", "0.00", 0));

        assertThrows(IllegalArgumentException.class,
                () -> PaymentAllocator.allocate(invoices, BigDecimal.ZERO, AllocationMethod.FIFO));
    }
}

package com.flagship.inventory_ledger.payment;

import com.flagship.inventory_ledger.common.CodeGenerator;
import com.flagship.inventory_ledger.common.CodePrefix;
import com.flagship.inventory_ledger.common.Money;
import com.flagship.inventory_ledger.event.DirectPaymentAppliedEvent;
import com.flagship.inventory_ledger.exception.InsufficientBalanceException;
import com.flagship.inventory_ledger.ledger.FinancialLedgerEntry;
import com.flagship.inventory_ledger.ledger.FinancialLedgerService;
import com.flagship.inventory_ledger.ledger.FinancialReferenceType;
import com.flagship.inventory_ledger.ledger.LedgerBalance;
import com.flagship.inventory_ledger.observability.CorrelationContext;
import com.flagship.inventory_ledger.observability.InventoryMetrics;
import com.flagship.inventory_ledger.outbox.OutboxService;
import com.flagship.inventory_ledger.party.Counterparty;
import com.flagship.inventory_ledger.party.PartyService;
import com.flagship.inventory_ledger.purchase.PurchaseInvoiceEntity;
import com.flagship.inventory_ledger.purchase.PurchaseInvoiceRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Lump-sum supplier payments spread over the supplier's open invoices.
 *
 * All open invoices are locked before anything is allocated, so two payments
 * to the same supplier serialize. One Payment row is written per invoice that
 * receives money, all sharing a DPAY reference, plus a single DIRECT_PAYMENT
 * credit for the whole amount.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DirectPaymentService {

    private final PurchaseInvoiceRepository invoiceRepository;
    private final PaymentRepository paymentRepository;
    private final PaymentService paymentService;
    private final FinancialLedgerService financialLedgerService;
    private final PartyService partyService;
    private final IdempotencyService idempotencyService;
    private final OutboxService outboxService;
    private final CodeGenerator codeGenerator;
    private final InventoryMetrics metrics;

    /**
     * Pays a supplier and allocates the amount over open invoices.
     *
     * @param idempotencyKey optional; a repeated key returns the earlier result
     * @throws InsufficientBalanceException if the amount exceeds what the supplier is owed
     */
    @Transactional
    public DirectPaymentResult paySupplier(String supplierId, BigDecimal amount, String accountId,
                                           AllocationMethod method, String idempotencyKey) {
        long startTime = System.currentTimeMillis();
        try (MDC.MDCCloseable ignored = CorrelationContext.scope(CorrelationContext.SUPPLIER_ID_MDC_KEY, supplierId)) {
            BigDecimal value = Money.requirePositive(amount, "Payment amount");
            AllocationMethod allocationMethod = method != null ? method : AllocationMethod.FIFO;
            partyService.requireSupplier(supplierId);
            partyService.requireAccount(accountId);

            if (idempotencyKey != null) {
                Optional<DirectPaymentResult> earlier = replay(idempotencyKey, supplierId);
                if (earlier.isPresent()) {
                    return earlier.get();
                }
            }

            List<PurchaseInvoiceEntity> locked = invoiceRepository.findOutstandingBySupplierForUpdate(supplierId);

            // A concurrent request with the same key may have committed while we waited for the locks.
            if (idempotencyKey != null) {
                Optional<DirectPaymentResult> earlier = replay(idempotencyKey, supplierId);
                if (earlier.isPresent()) {
                    return earlier.get();
                }
                metrics.recordIdempotencyMiss();
            }

            List<Allocation> allocations = PaymentAllocator.allocate(toOpenInvoices(locked), value, allocationMethod);

            String directPaymentRef = codeGenerator.generate(CodePrefix.DIRECT_PAYMENT,
                    paymentRepository::existsByDirectPaymentRef);
            Map<String, PurchaseInvoiceEntity> byId = locked.stream()
                    .collect(Collectors.toMap(PurchaseInvoiceEntity::getId, Function.identity()));

            List<Payment> payments = new ArrayList<>();
            for (Allocation allocation : allocations) {
                if (allocation.isEmpty()) {
                    continue;
                }
                payments.add(paymentService.applyDirectSlice(byId.get(allocation.getInvoiceId()),
                        allocation.getAmount(), accountId, directPaymentRef, idempotencyKey, allocationMethod));
            }

            financialLedgerService.credit(supplierId, FinancialReferenceType.DIRECT_PAYMENT, directPaymentRef, value);
            outboxService.saveEvent(DirectPaymentAppliedEvent.of(directPaymentRef, supplierId, value,
                    allocationMethod.name(), payments.stream().map(Payment::getId).toList()));
            if (idempotencyKey != null) {
                idempotencyService.remember(idempotencyKey, directPaymentRef);
            }

            long duration = System.currentTimeMillis() - startTime;
            metrics.recordPayment("direct", value);
            metrics.recordAllocation(allocationMethod.name(), payments.size());
            metrics.recordOperationLatency("pay_supplier", "success", duration);
            log.info("Direct payment {} of {} allocated {} over {} invoice(s), duration={}ms",
                    directPaymentRef, value, allocationMethod, payments.size(), duration);

            return new DirectPaymentResult(directPaymentRef, supplierId, value, allocationMethod, payments, false);
        } catch (RuntimeException e) {
            metrics.recordOperationLatency("pay_supplier", "error", System.currentTimeMillis() - startTime);
            log.error("Direct payment to supplier {} failed: {}", supplierId, e.getMessage());
            throw e;
        }
    }

    /**
     * Runs the allocation without persisting anything. An amount above the
     * outstanding total is reported in the message, not thrown.
     */
    @Transactional(readOnly = true)
    public PaymentSimulation simulate(String supplierId, BigDecimal amount, AllocationMethod method) {
        BigDecimal value = Money.requirePositive(amount, "Payment amount");
        AllocationMethod allocationMethod = method != null ? method : AllocationMethod.FIFO;
        partyService.requireSupplier(supplierId);

        List<OpenInvoice> open = toOpenInvoices(invoiceRepository.findOutstandingBySupplier(supplierId));
        BigDecimal outstanding = PaymentAllocator.totalDue(open);

        if (open.isEmpty()) {
            return new PaymentSimulation(supplierId, value, allocationMethod, outstanding,
                    "No outstanding invoices", List.of());
        }
        if (value.compareTo(outstanding) > 0) {
            return new PaymentSimulation(supplierId, value, allocationMethod, outstanding,
                    String.format("Payment amount exceeds supplier outstanding balance (%s). "
                            + "Please reduce the payment amount.", outstanding),
                    List.of());
        }
        List<Allocation> allocations = PaymentAllocator.allocate(open, value, allocationMethod).stream()
                .filter(allocation -> !allocation.isEmpty())
                .toList();
        return new PaymentSimulation(supplierId, value, allocationMethod, outstanding,
                "Payment simulation successful", allocations);
    }

    @Transactional(readOnly = true)
    public SupplierOutstanding outstanding(String supplierId) {
        Counterparty supplier = partyService.requireSupplier(supplierId);
        LedgerBalance balance = financialLedgerService.getBalance(supplierId);
        Instant now = Instant.now();

        List<SupplierOutstanding.OutstandingInvoice> invoices = invoiceRepository.findOutstandingBySupplier(supplierId)
                .stream()
                .map(invoice -> new SupplierOutstanding.OutstandingInvoice(invoice.getId(), invoice.getCreatedAt(),
                        invoice.getTotalAmount(), invoice.getPaidAmount(), invoice.getBalanceDue(),
                        invoice.getPaymentStatus(), Duration.between(invoice.getCreatedAt(), now).toDays()))
                .toList();
        BigDecimal outstanding = invoices.stream()
                .map(SupplierOutstanding.OutstandingInvoice::getBalanceDue)
                .reduce(Money.ZERO, BigDecimal::add);

        return new SupplierOutstanding(supplierId, supplier.getName(), balance.getTotalDebit(),
                balance.getTotalCredit(), balance.getBalance(), outstanding, invoices);
    }

    /**
     * Rebuilds the result of an earlier request from its stored slices. Amount
     * and method are the original request's, taken from the DIRECT_PAYMENT
     * credit and the slices, whatever the repeated request asks for.
     */
    private Optional<DirectPaymentResult> replay(String idempotencyKey, String supplierId) {
        Optional<String> ref = idempotencyService.lookup(idempotencyKey);
        if (ref.isEmpty()) {
            return Optional.empty();
        }
        List<PaymentEntity> slices = paymentRepository.findByDirectPaymentRefOrderByCreatedAtAscIdAsc(ref.get());
        if (slices.isEmpty()) {
            // Cached key for a payment that was rolled back or deleted since.
            idempotencyService.evict(idempotencyKey);
            return Optional.empty();
        }
        if (!slices.get(0).getCounterpartyId().equals(supplierId)) {
            throw new IllegalArgumentException(
                    "Idempotency key " + idempotencyKey + " was already used for another supplier");
        }
        metrics.recordIdempotencyHit();
        List<Payment> payments = slices.stream().map(PaymentEntity::toDomain).toList();
        BigDecimal amount = originalAmount(ref.get(), payments);
        log.info("Idempotent replay of direct payment {} for key {}", ref.get(), idempotencyKey);
        return Optional.of(new DirectPaymentResult(ref.get(), supplierId, amount,
                slices.get(0).getAllocationMethod(), payments, true));
    }

    private BigDecimal originalAmount(String directPaymentRef, List<Payment> payments) {
        return financialLedgerService.findByReference(directPaymentRef).stream()
                .filter(entry -> entry.getReferenceType() == FinancialReferenceType.DIRECT_PAYMENT)
                .map(FinancialLedgerEntry::getCredit)
                .reduce(BigDecimal::add)
                .orElseGet(() -> payments.stream().map(Payment::getAmount).reduce(Money.ZERO, BigDecimal::add));
    }

    private static List<OpenInvoice> toOpenInvoices(List<PurchaseInvoiceEntity> invoices) {
        return invoices.stream()
                .map(invoice -> new OpenInvoice(invoice.getId(), invoice.getTotalAmount(),
                        invoice.getPaidAmount(), invoice.getBalanceDue(), invoice.getCreatedAt()))
                .toList();
    }
}

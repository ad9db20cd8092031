package com.flagship.inventory_ledger.payment;

import com.flagship.inventory_ledger.common.CodeGenerator;
import com.flagship.inventory_ledger.common.CodePrefix;
import com.flagship.inventory_ledger.common.Money;
import com.flagship.inventory_ledger.event.PaymentAppliedEvent;
import com.flagship.inventory_ledger.exception.InsufficientBalanceException;
import com.flagship.inventory_ledger.exception.ResourceNotFoundException;
import com.flagship.inventory_ledger.ledger.FinancialLedgerService;
import com.flagship.inventory_ledger.ledger.FinancialReferenceType;
import com.flagship.inventory_ledger.observability.CorrelationContext;
import com.flagship.inventory_ledger.observability.InventoryMetrics;
import com.flagship.inventory_ledger.outbox.OutboxService;
import com.flagship.inventory_ledger.party.PartyService;
import com.flagship.inventory_ledger.purchase.PurchaseInvoiceEntity;
import com.flagship.inventory_ledger.purchase.PurchaseInvoiceRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;

/**
 * Payments against single purchase invoices, and their reversal.
 *
 * Every change locks the invoice row first. A single-invoice payment gets its
 * own PAYMENT credit row; a slice of a direct payment shares the aggregate
 * DIRECT_PAYMENT row written by {@link DirectPaymentService}, so removing one
 * posts a PAYMENT_REVERSAL debit instead of deleting anything.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PaymentService {

    private final PaymentRepository paymentRepository;
    private final PurchaseInvoiceRepository invoiceRepository;
    private final FinancialLedgerService financialLedgerService;
    private final PartyService partyService;
    private final OutboxService outboxService;
    private final CodeGenerator codeGenerator;
    private final InventoryMetrics metrics;

    /**
     * Pays part or all of one invoice's balance.
     *
     * @throws InsufficientBalanceException if the amount exceeds the balance due
     */
    @Transactional
    public Payment addPayment(String invoiceId, BigDecimal amount, String accountId) {
        long startTime = System.currentTimeMillis();
        try (MDC.MDCCloseable ignored = CorrelationContext.scope(CorrelationContext.INVOICE_ID_MDC_KEY, invoiceId)) {
            BigDecimal value = Money.requirePositive(amount, "Payment amount");
            partyService.requireAccount(accountId);
            PurchaseInvoiceEntity invoice = lockInvoice(invoiceId);

            Payment payment = applyToInvoice(invoice, value, accountId);

            metrics.recordOperationLatency("add_payment", "success", System.currentTimeMillis() - startTime);
            return payment;
        } catch (RuntimeException e) {
            metrics.recordOperationLatency("add_payment", "error", System.currentTimeMillis() - startTime);
            log.error("Payment on invoice {} failed: {}", invoiceId, e.getMessage());
            throw e;
        }
    }

    /**
     * Records a single-invoice payment on an invoice the caller already holds
     * locked, with its own PAYMENT credit row.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Payment applyToInvoice(PurchaseInvoiceEntity invoice, BigDecimal amount, String accountId) {
        Payment payment = record(invoice, amount, accountId, null, null, null);
        financialLedgerService.credit(invoice.getSupplierId(), FinancialReferenceType.PAYMENT, payment.getId(),
                payment.getAmount());
        metrics.recordPayment("single", payment.getAmount());
        return payment;
    }

    /**
     * Records one slice of a direct payment. The caller posts the shared
     * DIRECT_PAYMENT credit row.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Payment applyDirectSlice(PurchaseInvoiceEntity invoice, BigDecimal amount, String accountId,
                                    String directPaymentRef, String idempotencyKey,
                                    AllocationMethod allocationMethod) {
        return record(invoice, amount, accountId, directPaymentRef, idempotencyKey, allocationMethod);
    }

    private Payment record(PurchaseInvoiceEntity invoice, BigDecimal amount, String accountId,
                           String directPaymentRef, String idempotencyKey, AllocationMethod allocationMethod) {
        BigDecimal value = Money.requirePositive(amount, "Payment amount");
        BigDecimal due = invoice.getBalanceDue();
        if (value.compareTo(due) > 0) {
            throw new InsufficientBalanceException(String.format(
                    "Payment amount %s exceeds balance due %s on invoice %s", value, due, invoice.getId()),
                    value, due);
        }
        PaymentType type = PaymentType.of(value, due);
        invoice.applyPayment(value);

        String paymentId = codeGenerator.generate(CodePrefix.PAYMENT, paymentRepository::existsById);
        Payment payment = paymentRepository.save(PaymentEntity.create(paymentId, invoice.getSupplierId(),
                invoice.getId(), value, accountId, type, directPaymentRef, idempotencyKey,
                allocationMethod)).toDomain();

        outboxService.saveEvent(PaymentAppliedEvent.applied(paymentId, invoice.getId(), invoice.getSupplierId(),
                value, invoice.getBalanceDue(), invoice.getPaymentStatus().name(), directPaymentRef));

        log.info("Payment {} of {} applied to invoice {} ({}): balance {} -> {}, status {}",
                paymentId, value, invoice.getId(), type, due, invoice.getBalanceDue(), invoice.getPaymentStatus());
        return payment;
    }

    /**
     * Removes a payment and restores the invoice balance it settled.
     */
    @Transactional
    public Payment deletePayment(String paymentId) {
        PaymentEntity entity = paymentRepository.findById(paymentId)
                .orElseThrow(() -> new ResourceNotFoundException("Payment", paymentId));
        try (MDC.MDCCloseable ignored = CorrelationContext.scope(CorrelationContext.INVOICE_ID_MDC_KEY, entity.getInvoiceId())) {
            PurchaseInvoiceEntity invoice = lockInvoice(entity.getInvoiceId());
            return reverse(invoice, entity);
        }
    }

    /**
     * Removes every payment of an invoice the caller holds locked.
     *
     * @return the number of payments removed
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public int deleteAllForInvoice(PurchaseInvoiceEntity invoice) {
        List<PaymentEntity> payments = paymentRepository.findByInvoiceIdOrderByCreatedAtAscIdAsc(invoice.getId());
        for (PaymentEntity payment : payments) {
            reverse(invoice, payment);
        }
        paymentRepository.flush();
        return payments.size();
    }

    private Payment reverse(PurchaseInvoiceEntity invoice, PaymentEntity entity) {
        Payment payment = entity.toDomain();
        invoice.revertPayment(payment.getAmount());

        if (payment.isDirect()) {
            financialLedgerService.debit(payment.getCounterpartyId(), FinancialReferenceType.PAYMENT_REVERSAL,
                    payment.getId(), payment.getAmount());
        } else {
            financialLedgerService.deleteByReference(FinancialReferenceType.PAYMENT, payment.getId());
        }
        paymentRepository.delete(entity);

        outboxService.saveEvent(PaymentAppliedEvent.reversed(payment.getId(), invoice.getId(),
                invoice.getSupplierId(), payment.getAmount(), invoice.getBalanceDue(),
                invoice.getPaymentStatus().name(), payment.getDirectPaymentRef()));
        metrics.recordPayment("reversal", payment.getAmount());

        log.info("Payment {} of {} removed from invoice {}: balance now {}, status {}",
                payment.getId(), payment.getAmount(), invoice.getId(), invoice.getBalanceDue(),
                invoice.getPaymentStatus());
        return payment;
    }

    @Transactional(readOnly = true)
    public Payment getPayment(String paymentId) {
        return paymentRepository.findById(paymentId)
                .map(PaymentEntity::toDomain)
                .orElseThrow(() -> new ResourceNotFoundException("Payment", paymentId));
    }

    @Transactional(readOnly = true)
    public List<Payment> findByInvoice(String invoiceId) {
        return paymentRepository.findByInvoiceIdOrderByCreatedAtAscIdAsc(invoiceId).stream()
                .map(PaymentEntity::toDomain)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<Payment> findByDirectPaymentRef(String directPaymentRef) {
        return paymentRepository.findByDirectPaymentRefOrderByCreatedAtAscIdAsc(directPaymentRef).stream()
                .map(PaymentEntity::toDomain)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<Payment> findBySupplier(String supplierId) {
        return paymentRepository.findByCounterpartyIdOrderByCreatedAtDescIdDesc(supplierId).stream()
                .map(PaymentEntity::toDomain)
                .toList();
    }

    private PurchaseInvoiceEntity lockInvoice(String invoiceId) {
        return invoiceRepository.findByIdForUpdate(invoiceId)
                .orElseThrow(() -> new ResourceNotFoundException("Purchase invoice", invoiceId));
    }
}

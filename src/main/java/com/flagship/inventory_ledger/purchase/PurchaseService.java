package com.flagship.inventory_ledger.purchase;

import com.flagship.inventory_ledger.common.CodeGenerator;
import com.flagship.inventory_ledger.common.CodePrefix;
import com.flagship.inventory_ledger.common.Money;
import com.flagship.inventory_ledger.common.PageRequests;
import com.flagship.inventory_ledger.common.PagedResult;
import com.flagship.inventory_ledger.event.PurchaseDeletedEvent;
import com.flagship.inventory_ledger.event.PurchaseRecordedEvent;
import com.flagship.inventory_ledger.exception.InsufficientBalanceException;
import com.flagship.inventory_ledger.exception.ResourceNotFoundException;
import com.flagship.inventory_ledger.inventory.InventoryValuationService;
import com.flagship.inventory_ledger.ledger.FinancialLedgerService;
import com.flagship.inventory_ledger.ledger.FinancialReferenceType;
import com.flagship.inventory_ledger.observability.CorrelationContext;
import com.flagship.inventory_ledger.observability.InventoryMetrics;
import com.flagship.inventory_ledger.outbox.OutboxService;
import com.flagship.inventory_ledger.party.PartyService;
import com.flagship.inventory_ledger.payment.PaymentService;
import com.flagship.inventory_ledger.stock.StockLedgerService;
import com.flagship.inventory_ledger.stock.StockReferenceType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Purchase invoices and their effect on stock and on the supplier ledger.
 *
 * Creating an invoice receives every line into stock at the line price and
 * debits the supplier with the total. Updating reverses the old lines and
 * applies the new ones, posting only the difference to the ledger. Deleting
 * undoes payments, stock and ledger rows, then removes the invoice.
 *
 * Item rows are locked in id order before any of them is touched.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PurchaseService {

    private final PurchaseInvoiceRepository invoiceRepository;
    private final InventoryValuationService valuationService;
    private final StockLedgerService stockLedgerService;
    private final FinancialLedgerService financialLedgerService;
    private final PaymentService paymentService;
    private final PartyService partyService;
    private final OutboxService outboxService;
    private final CodeGenerator codeGenerator;
    private final InventoryMetrics metrics;

    /**
     * Records a purchase, optionally with an initial payment.
     *
     * @param paymentAmount optional; when positive, {@code paymentAccountId} is required
     * @throws InsufficientBalanceException if the initial payment exceeds the invoice total
     */
    @Transactional
    public PurchaseInvoice createPurchase(String supplierId, List<PurchaseLine> lines,
                                          BigDecimal paymentAmount, String paymentAccountId) {
        long startTime = System.currentTimeMillis();
        partyService.requireSupplier(supplierId);
        List<PurchaseLine> normalized = normalizeLines(lines);
        boolean withPayment = paymentAmount != null && paymentAmount.signum() != 0;
        if (withPayment) {
            Money.requirePositive(paymentAmount, "Payment amount");
            if (paymentAccountId == null || paymentAccountId.isBlank()) {
                throw new IllegalArgumentException("Payment account is required when a payment amount is given");
            }
            partyService.requireAccount(paymentAccountId);
        }

        String invoiceId = codeGenerator.generate(CodePrefix.PURCHASE_INVOICE, invoiceRepository::existsById);
        try (MDC.MDCCloseable ignored = CorrelationContext.scope(CorrelationContext.INVOICE_ID_MDC_KEY, invoiceId)) {
            log.info("Creating purchase for supplier {} with {} line(s)", supplierId, normalized.size());

            PurchaseInvoiceEntity invoice = invoiceRepository.save(PurchaseInvoiceEntity.create(invoiceId, supplierId));
            valuationService.lockAll(itemIds(normalized));
            receiveLines(invoice, normalized);
            invoice.retotal();

            financialLedgerService.debit(supplierId, FinancialReferenceType.PURCHASE, invoiceId, invoice.getTotalAmount());

            if (withPayment) {
                paymentService.applyToInvoice(invoice, paymentAmount, paymentAccountId);
            }

            outboxService.saveEvent(PurchaseRecordedEvent.of(invoiceId, supplierId, invoice.getTotalAmount(),
                    invoice.getPaidAmount(), invoice.getPaymentStatus().name(), normalized.size(), false));

            long duration = System.currentTimeMillis() - startTime;
            metrics.recordPurchase("create", invoice.getPaymentStatus().name());
            metrics.recordOperationLatency("create_purchase", "success", duration);
            log.info("Purchase created: total={}, paid={}, status={}, duration={}ms",
                    invoice.getTotalAmount(), invoice.getPaidAmount(), invoice.getPaymentStatus(), duration);
            return invoice.toDomain();
        }
    }

    /**
     * Replaces the lines of an invoice that is not fully paid. Payments are
     * kept; a null or empty line list leaves the invoice unchanged.
     *
     * @throws IllegalStateException if the invoice is already paid
     * @throws IllegalArgumentException if the new total is below the amount paid
     */
    @Transactional
    public PurchaseInvoice updatePurchase(String invoiceId, List<PurchaseLine> newLines) {
        try (MDC.MDCCloseable ignored = CorrelationContext.scope(CorrelationContext.INVOICE_ID_MDC_KEY, invoiceId)) {
            PurchaseInvoiceEntity invoice = lockInvoice(invoiceId);
            if (invoice.getPaymentStatus() == InvoiceStatus.PAID) {
                throw new IllegalStateException("Cannot update fully paid invoice " + invoiceId);
            }
            if (newLines == null || newLines.isEmpty()) {
                log.debug("No lines given, invoice left unchanged");
                return invoice.toDomain();
            }
            List<PurchaseLine> normalized = normalizeLines(newLines);
            BigDecimal newTotal = normalized.stream().map(PurchaseLine::lineTotal).reduce(Money.ZERO, BigDecimal::add);
            if (newTotal.compareTo(invoice.getPaidAmount()) < 0) {
                throw new IllegalArgumentException(String.format(
                        "New total %s is below the amount already paid %s", newTotal, invoice.getPaidAmount()));
            }

            BigDecimal oldTotal = invoice.getTotalAmount();
            List<PurchaseLine> oldLines = invoice.lines();
            Set<String> touched = new HashSet<>(itemIds(oldLines));
            touched.addAll(itemIds(normalized));
            valuationService.lockAll(touched);

            reverseLines(invoice, oldLines);
            invoice.clearLines();
            receiveLines(invoice, normalized);
            invoice.retotal();

            BigDecimal delta = invoice.getTotalAmount().subtract(oldTotal);
            if (delta.signum() > 0) {
                financialLedgerService.debit(invoice.getSupplierId(), FinancialReferenceType.PURCHASE_UPDATE,
                        invoiceId, delta);
            } else if (delta.signum() < 0) {
                financialLedgerService.credit(invoice.getSupplierId(), FinancialReferenceType.PURCHASE_UPDATE,
                        invoiceId, delta.negate());
            }

            outboxService.saveEvent(PurchaseRecordedEvent.of(invoiceId, invoice.getSupplierId(),
                    invoice.getTotalAmount(), invoice.getPaidAmount(), invoice.getPaymentStatus().name(),
                    normalized.size(), true));
            metrics.recordPurchase("update", invoice.getPaymentStatus().name());
            log.info("Purchase updated: total {} -> {}, balance={}, status={}",
                    oldTotal, invoice.getTotalAmount(), invoice.getBalanceDue(), invoice.getPaymentStatus());
            return invoice.toDomain();
        }
    }

    /**
     * Deletes an invoice with everything it caused. Fails without changing
     * anything if purchased stock has since been consumed.
     */
    @Transactional
    public void deletePurchase(String invoiceId) {
        try (MDC.MDCCloseable ignored = CorrelationContext.scope(CorrelationContext.INVOICE_ID_MDC_KEY, invoiceId)) {
            PurchaseInvoiceEntity invoice = lockInvoice(invoiceId);
            BigDecimal total = invoice.getTotalAmount();
            InvoiceStatus statusBefore = invoice.getPaymentStatus();

            int paymentsReversed = paymentService.deleteAllForInvoice(invoice);

            List<PurchaseLine> lines = invoice.lines();
            valuationService.lockAll(itemIds(lines));
            reverseLines(invoice, lines);
            int ledgerRows = financialLedgerService.deleteByReference(invoiceId);

            invoiceRepository.delete(invoice);

            outboxService.saveEvent(PurchaseDeletedEvent.of(invoiceId, invoice.getSupplierId(), total, paymentsReversed));
            metrics.recordPurchase("delete", statusBefore.name());
            log.info("Purchase deleted: total={}, lines={}, payments reversed={}, ledger rows removed={}",
                    total, lines.size(), paymentsReversed, ledgerRows);
        }
    }

    @Transactional(readOnly = true)
    public PurchaseInvoice getInvoice(String invoiceId) {
        return invoiceRepository.findById(invoiceId)
                .map(PurchaseInvoiceEntity::toDomain)
                .orElseThrow(() -> new ResourceNotFoundException("Purchase invoice", invoiceId));
    }

    @Transactional(readOnly = true)
    public PagedResult<PurchaseInvoice> listInvoices(String supplierId, InvoiceStatus status,
                                                     LocalDate fromDate, LocalDate toDate, int offset, int limit) {
        return PageRequests.toResult(
                invoiceRepository.findAll(
                        PurchaseInvoiceSpecifications.filter(supplierId, status, fromDate, toDate),
                        PageRequests.of(offset, limit, Sort.by(Sort.Direction.DESC, "createdAt", "id")))
                    .map(PurchaseInvoiceEntity::toDomain),
                offset, limit);
    }

    @Transactional(readOnly = true)
    public PurchaseSummary supplierSummary(String supplierId) {
        partyService.requireSupplier(supplierId);
        List<PurchaseInvoiceEntity> invoices = invoiceRepository.findBySupplierIdOrderByCreatedAtAsc(supplierId);
        int unpaid = 0;
        int partial = 0;
        int paid = 0;
        BigDecimal purchased = Money.ZERO;
        BigDecimal paidAmount = Money.ZERO;
        BigDecimal due = Money.ZERO;
        for (PurchaseInvoiceEntity invoice : invoices) {
            switch (invoice.getPaymentStatus()) {
                case UNPAID -> unpaid++;
                case PARTIAL -> partial++;
                case PAID -> paid++;
            }
            purchased = purchased.add(invoice.getTotalAmount());
            paidAmount = paidAmount.add(invoice.getPaidAmount());
            due = due.add(invoice.getBalanceDue());
        }
        return new PurchaseSummary(supplierId, invoices.size(), unpaid, partial, paid, purchased, paidAmount, due);
    }

    private void receiveLines(PurchaseInvoiceEntity invoice, List<PurchaseLine> lines) {
        for (PurchaseLine line : lines) {
            valuationService.receive(line.getItemId(), line.getQuantity(), line.getUnitPrice());
            stockLedgerService.recordIn(line.getItemId(), StockReferenceType.PURCHASE, invoice.getId(),
                    line.getQuantity(), line.getUnitPrice());
            invoice.addLine(line);
        }
    }

    private void reverseLines(PurchaseInvoiceEntity invoice, List<PurchaseLine> lines) {
        for (PurchaseLine line : lines) {
            valuationService.reverseReceipt(line.getItemId(), line.getQuantity(), line.getUnitPrice());
        }
        int removed = stockLedgerService.deleteByReference(StockReferenceType.PURCHASE, invoice.getId());
        log.debug("Reversed {} line(s), removed {} stock row(s)", lines.size(), removed);
    }

    private static List<PurchaseLine> normalizeLines(List<PurchaseLine> lines) {
        if (lines == null || lines.isEmpty()) {
            throw new IllegalArgumentException("At least one purchase line is required");
        }
        List<PurchaseLine> normalized = new ArrayList<>();
        for (PurchaseLine line : lines) {
            if (line.getItemId() == null || line.getItemId().isBlank()) {
                throw new IllegalArgumentException("Item id is required on every purchase line");
            }
            if (line.getQuantity() <= 0) {
                throw new IllegalArgumentException("Quantity must be greater than 0 for item " + line.getItemId());
            }
            BigDecimal price = Money.requirePositive(line.getUnitPrice(), "Unit price for item " + line.getItemId());
            normalized.add(PurchaseLine.of(line.getItemId(), line.getQuantity(), price));
        }
        return normalized;
    }

    private static List<String> itemIds(List<PurchaseLine> lines) {
        return lines.stream().map(PurchaseLine::getItemId).distinct().toList();
    }

    private PurchaseInvoiceEntity lockInvoice(String invoiceId) {
        return invoiceRepository.findByIdForUpdate(invoiceId)
                .orElseThrow(() -> new ResourceNotFoundException("Purchase invoice", invoiceId));
    }
}

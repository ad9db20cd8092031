package com.flagship.inventory_ledger.stock;

import com.flagship.inventory_ledger.common.CodeGenerator;
import com.flagship.inventory_ledger.common.CodePrefix;
import com.flagship.inventory_ledger.common.Money;
import com.flagship.inventory_ledger.event.StockAdjustedEvent;
import com.flagship.inventory_ledger.inventory.InventoryValuationService;
import com.flagship.inventory_ledger.inventory.Item;
import com.flagship.inventory_ledger.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;

/**
 * Manual corrections after a stock count.
 *
 * A positive delta is received at the given unit price, or at the current
 * average when none is given, so the average only moves when a price is
 * supplied. A negative delta is issued at the current average.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StockAdjustmentService {

    private static final int MAX_REASON_LENGTH = 255;

    private final InventoryValuationService valuationService;
    private final StockLedgerService stockLedgerService;
    private final CodeGenerator codeGenerator;
    private final OutboxService outboxService;

    @Transactional
    public StockLedgerEntry adjust(String itemId, int quantityDelta, BigDecimal unitPrice, String reason) {
        if (quantityDelta == 0) {
            throw new IllegalArgumentException("Adjustment quantity must not be zero");
        }
        if (unitPrice != null && unitPrice.signum() < 0) {
            throw new IllegalArgumentException("Unit price cannot be negative");
        }
        String note = normalizeReason(reason);
        String adjustmentId = codeGenerator.generate(CodePrefix.STOCK_ADJUSTMENT,
                id -> !stockLedgerService.findByReference(StockReferenceType.ADJUSTMENT, id).isEmpty());

        Item current = valuationService.lockAll(List.of(itemId)).get(itemId);
        StockLedgerEntry entry;
        Item after;
        if (quantityDelta > 0) {
            BigDecimal price = unitPrice != null ? Money.of(unitPrice) : current.getAvgPrice();
            after = valuationService.receive(itemId, quantityDelta, price);
            entry = stockLedgerService.record(itemId, StockReferenceType.ADJUSTMENT, adjustmentId,
                    quantityDelta, 0, price, note);
        } else {
            after = valuationService.issue(itemId, -quantityDelta);
            entry = stockLedgerService.record(itemId, StockReferenceType.ADJUSTMENT, adjustmentId,
                    0, -quantityDelta, after.getAvgPrice(), note);
        }

        outboxService.saveEvent(StockAdjustedEvent.of(adjustmentId, itemId, quantityDelta,
                after.getTotalQuantity(), after.getAvgPrice(), note));

        log.info("Stock adjusted: adjustment={}, item={}, delta={}, qty {} -> {}, reason={}",
                adjustmentId, itemId, quantityDelta, current.getTotalQuantity(), after.getTotalQuantity(), note);
        return entry;
    }

    private static String normalizeReason(String reason) {
        if (reason == null || reason.isBlank()) {
            return null;
        }
        String trimmed = reason.trim();
        return trimmed.length() > MAX_REASON_LENGTH ? trimmed.substring(0, MAX_REASON_LENGTH) : trimmed;
    }
}

package com.flagship.inventory_ledger.stock;

import com.flagship.inventory_ledger.IntegrationTestBase;
import com.flagship.inventory_ledger.exception.InsufficientStockException;
import com.flagship.inventory_ledger.inventory.InventoryValuation;
import com.flagship.inventory_ledger.inventory.Item;
import com.flagship.inventory_ledger.inventory.ItemStockSummary;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Manual stock adjustments, the stock ledger listing and item summaries.
 */
class StockAdjustmentServiceTest extends IntegrationTestBase {

    @Autowired
    private StockAdjustmentService adjustmentService;

    @Autowired
    private StockLedgerService stockLedgerService;

    private String supplierId;
    private String itemId;

    @BeforeEach
    void setUp() {
        supplierId = newSupplier();
        itemId = newRawMaterial();
        purchase(supplierId, itemId, 10, "2.00");
    }

    @Test
    @DisplayName("A positive adjustment at a price moves the average")
    void testAdjust_IncreaseAtPrice() {
        printTestHeader("Adjust Up");

        StockLedgerEntry entry = adjustmentService.adjust(itemId, 10, new BigDecimal("4.00"), "  found in store  ");
        Item item = item(itemId);
        printOutput("Item", item.getTotalQuantity() + " @ " + item.getAvgPrice());

        assertEquals(StockReferenceType.ADJUSTMENT, entry.getReferenceType());
        assertEquals(10, entry.getQtyIn());
        assertEquals("found in store", entry.getNote());
        assertEquals(20, item.getTotalQuantity());
        assertAmount("3.00", item.getAvgPrice());
        printSuccess("(10*2.00 + 10*4.00) / 20 = 3.00");
    }

    @Test
    @DisplayName("A positive adjustment without a price keeps the average")
    void testAdjust_IncreaseAtAverage() {
        adjustmentService.adjust(itemId, 5, null, null);

        Item item = item(itemId);
        assertEquals(15, item.getTotalQuantity());
        assertAmount("2.00", item.getAvgPrice());
    }

    @Test
    @DisplayName("A negative adjustment issues at the average and cannot overdraw")
    void testAdjust_Decrease() {
        StockLedgerEntry entry = adjustmentService.adjust(itemId, -4, null, "damaged");

        assertEquals(4, entry.getQtyOut());
        assertAmount("2.00", entry.getUnitPrice());
        assertEquals(6, item(itemId).getTotalQuantity());

        InsufficientStockException e = assertThrows(InsufficientStockException.class,
                () -> adjustmentService.adjust(itemId, -7, null, null));
        assertEquals(1, e.getShortfalls().get(0).getShortfall());
        assertEquals(6, item(itemId).getTotalQuantity());
    }

    @Test
    @DisplayName("Zero and negative-price adjustments are rejected")
    void testAdjust_Validation() {
        assertThrows(IllegalArgumentException.class, () -> adjustmentService.adjust(itemId, 0, null, null));
        assertThrows(IllegalArgumentException.class,
                () -> adjustmentService.adjust(itemId, 1, new BigDecimal("-1.00"), null));
    }

    @Test
    @DisplayName("The stock ledger query filters by item and totals movements")
    void testQuery_ByItem() {
        printTestHeader("Stock Ledger Query");
        adjustmentService.adjust(itemId, -3, null, null);
        adjustmentService.adjust(itemId, 2, null, null);

        StockLedgerPage page = stockLedgerService.query(StockLedgerQuery.builder().itemId(itemId).build());
        printOutput("Rows", page.getTotal());

        assertEquals(3, page.getTotal());
        assertEquals(12, page.getTotalQtyIn());
        assertEquals(3, page.getTotalQtyOut());
        assertEquals(StockReferenceType.ADJUSTMENT, page.getEntries().get(0).getReferenceType());
        assertEquals(2, page.getEntries().get(0).getQtyIn());

        StockLedgerPage adjustments = stockLedgerService.query(StockLedgerQuery.builder()
                .itemId(itemId).referenceType(StockReferenceType.ADJUSTMENT).limit(1).build());
        assertEquals(2, adjustments.getTotal());
        assertEquals(1, adjustments.getEntries().size());

        assertThrows(IllegalArgumentException.class,
                () -> stockLedgerService.query(StockLedgerQuery.builder().limit(0).build()));
        printSuccess("Newest first, totals over the whole filter");
    }

    @Test
    @DisplayName("The stock summary matches the ledger totals")
    void testStockSummary() {
        adjustmentService.adjust(itemId, -3, null, null);

        ItemStockSummary summary = itemService.getStockSummary(itemId);

        assertEquals(10, summary.getTotalQtyIn());
        assertEquals(3, summary.getTotalQtyOut());
        assertEquals(7, summary.getCurrentQuantity());
        assertAmount("14.00", summary.getTotalValue());
    }

    @Test
    @DisplayName("Low stock uses the threshold given")
    void testValuation_LowStock() {
        adjustmentService.adjust(itemId, -9, null, null);

        InventoryValuation valuation = itemService.getValuation(2);

        assertEquals(2, valuation.getLowStockThreshold());
        assertTrue(valuation.getLowStockItems().stream().anyMatch(low -> low.getItemId().equals(itemId)));
        assertTrue(valuation.getRawMaterialValue().signum() >= 0);
        assertThrows(IllegalArgumentException.class, () -> itemService.getValuation(-1));
    }
}

package com.flagship.inventory_ledger.ledger;

import com.flagship.inventory_ledger.IntegrationTestBase;
import com.flagship.inventory_ledger.purchase.PurchaseInvoice;
import com.flagship.inventory_ledger.purchase.PurchaseLine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.transaction.IllegalTransactionStateException;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Counterparty balances and filtered ledger listings.
 */
class FinancialLedgerServiceTest extends IntegrationTestBase {

    @Autowired
    private FinancialLedgerService ledgerService;

    private String supplierId;
    private String itemId;

    @BeforeEach
    void setUp() {
        supplierId = newSupplier();
        itemId = newRawMaterial();
    }

    @Test
    @DisplayName("Balance is debits minus credits for the counterparty")
    void testGetBalance() {
        printTestHeader("Counterparty Balance");
        purchase(supplierId, itemId, 2, "50.00");
        PurchaseInvoice second = purchase(supplierId, itemId, 1, "25.00");
        purchaseService.updatePurchase(second.getId(),
                List.of(PurchaseLine.of(itemId, 1, new BigDecimal("20.00"))));

        LedgerBalance balance = ledgerService.getBalance(supplierId);
        printOutput("Debit", balance.getTotalDebit());
        printOutput("Credit", balance.getTotalCredit());

        assertAmount("125.00", balance.getTotalDebit());
        assertAmount("5.00", balance.getTotalCredit());
        assertAmount("120.00", balance.getBalance());
        printSuccess("125.00 - 5.00 = 120.00");
    }

    @Test
    @DisplayName("Unknown counterparties have a zero balance")
    void testGetBalance_Empty() {
        LedgerBalance balance = ledgerService.getBalance("SUP-" + shortId());

        assertAmount("0.00", balance.getBalance());
    }

    @Test
    @DisplayName("Query filters by type and date and totals the whole filter")
    void testQuery() {
        purchase(supplierId, itemId, 1, "10.00");
        purchase(supplierId, itemId, 1, "30.00");
        LocalDate today = LocalDate.now(ZoneOffset.UTC);

        FinancialLedgerPage page = ledgerService.query(FinancialLedgerQuery.builder()
                .counterpartyId(supplierId)
                .referenceType(FinancialReferenceType.PURCHASE)
                .fromDate(today.minusDays(1))
                .toDate(today.plusDays(1))
                .limit(1)
                .build());

        assertEquals(2, page.getTotal());
        assertEquals(1, page.getEntries().size());
        assertAmount("30.00", page.getEntries().get(0).getDebit());
        assertAmount("40.00", page.getTotalDebit());
        assertAmount("0.00", page.getTotalCredit());

        FinancialLedgerPage none = ledgerService.query(FinancialLedgerQuery.builder()
                .counterpartyId(supplierId)
                .fromDate(today.plusDays(2))
                .build());
        assertEquals(0, none.getTotal());
    }

    @Test
    @DisplayName("Search matches reference ids case-insensitively")
    void testQuery_Search() {
        PurchaseInvoice invoice = purchase(supplierId, itemId, 1, "10.00");

        FinancialLedgerPage page = ledgerService.query(FinancialLedgerQuery.builder()
                .search(invoice.getId().toLowerCase())
                .build());

        assertEquals(1, page.getTotal());
        assertEquals(invoice.getId(), page.getEntries().get(0).getReferenceId());
    }

    @Test
    @DisplayName("Ledger rows are only written inside a business transaction")
    void testDebit_RequiresTransaction() {
        assertThrows(IllegalTransactionStateException.class,
                () -> ledgerService.debit(supplierId, FinancialReferenceType.PURCHASE, "PINV-X", BigDecimal.ONE));
    }
}

package com.flagship.inventory_ledger;

import com.flagship.inventory_ledger.inventory.Item;
import com.flagship.inventory_ledger.inventory.ItemService;
import com.flagship.inventory_ledger.inventory.ItemType;
import com.flagship.inventory_ledger.inventory.UnitType;
import com.flagship.inventory_ledger.party.AccountType;
import com.flagship.inventory_ledger.party.CounterpartyRole;
import com.flagship.inventory_ledger.party.PartyService;
import com.flagship.inventory_ledger.purchase.PurchaseInvoice;
import com.flagship.inventory_ledger.purchase.PurchaseLine;
import com.flagship.inventory_ledger.purchase.PurchaseService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Shared PostgreSQL container and fixtures for engine tests.
 *
 * Kafka and the outbox publisher are switched off; events stay in the outbox
 * table where tests can inspect them. Redis is not started, so idempotency
 * lookups go to the database.
 */
@SpringBootTest
@Testcontainers
public abstract class IntegrationTestBase {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("inventory_ledger_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.kafka.bootstrap-servers", () -> "localhost:9999");
        registry.add("spring.data.redis.port", () -> "6390");
        registry.add("spring.data.redis.timeout", () -> "200ms");
        registry.add("spring.data.redis.connect-timeout", () -> "200ms");
        registry.add("outbox.publisher.enabled", () -> "false");
        registry.add("management.health.redis.enabled", () -> "false");
    }

    @Autowired
    protected PartyService partyService;

    @Autowired
    protected ItemService itemService;

    @Autowired
    protected PurchaseService purchaseService;

    protected String newSupplier() {
        return partyService.createCounterparty("Supplier " + shortId(), CounterpartyRole.SUPPLIER).getId();
    }

    protected String newAccount() {
        return partyService.createAccount("Cash " + shortId(), AccountType.CASH).getId();
    }

    protected String newRawMaterial() {
        return itemService.createItem("Raw " + shortId(), ItemType.RAW_MATERIAL, UnitType.PCS).getId();
    }

    protected String newFinalProduct() {
        return itemService.createItem("Product " + shortId(), ItemType.FINAL_PRODUCT, UnitType.SET).getId();
    }

    /**
     * Buys stock through a purchase invoice, the normal way stock enters.
     */
    protected PurchaseInvoice purchase(String supplierId, String itemId, int quantity, String unitPrice) {
        return purchaseService.createPurchase(supplierId,
                List.of(PurchaseLine.of(itemId, quantity, new BigDecimal(unitPrice))), null, null);
    }

    protected Item item(String itemId) {
        return itemService.getItem(itemId);
    }

    protected static void assertAmount(String expected, BigDecimal actual) {
        assertEquals(0, new BigDecimal(expected).compareTo(actual),
                "expected " + expected + " but was " + actual);
    }

    protected static String shortId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }

    // Helper methods for test output
    protected void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    protected void printInput(String label, Object value) {
        System.out.println("INPUT  - " + label + ": " + value);
    }

    protected void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    protected void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    protected void printExpectedException(String exceptionType, String reason) {
        System.out.println("⚠ EXPECTED EXCEPTION: " + exceptionType);
        System.out.println("  Reason: " + reason);
    }
}

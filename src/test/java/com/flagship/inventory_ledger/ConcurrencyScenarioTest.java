package com.flagship.inventory_ledger;

import com.flagship.inventory_ledger.exception.InsufficientStockException;
import com.flagship.inventory_ledger.payment.AllocationMethod;
import com.flagship.inventory_ledger.payment.DirectPaymentResult;
import com.flagship.inventory_ledger.payment.DirectPaymentService;
import com.flagship.inventory_ledger.payment.PaymentService;
import com.flagship.inventory_ledger.production.ProductionBatch;
import com.flagship.inventory_ledger.production.ProductionService;
import com.flagship.inventory_ledger.production.ProductionStage;
import com.flagship.inventory_ledger.production.Recipe;
import com.flagship.inventory_ledger.production.RecipeLine;
import com.flagship.inventory_ledger.production.RecipeService;
import com.flagship.inventory_ledger.purchase.InvoiceStatus;
import com.flagship.inventory_ledger.purchase.PurchaseInvoice;
import com.flagship.inventory_ledger.stock.StockLedgerService;
import com.flagship.inventory_ledger.stock.StockReferenceType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Races and rollbacks: whatever the interleaving, stock and money move once.
 */
@DisplayName("Concurrency and Rollback Scenarios")
class ConcurrencyScenarioTest extends IntegrationTestBase {

    private static final int THREADS = 5;

    @Autowired
    private ProductionService productionService;

    @Autowired
    private RecipeService recipeService;

    @Autowired
    private StockLedgerService stockLedgerService;

    @Autowired
    private PaymentService paymentService;

    @Autowired
    private DirectPaymentService directPaymentService;

    @Autowired
    private PlatformTransactionManager transactionManager;

    @Nested
    @DisplayName("1. Production")
    class ProductionScenarios {

        @Test
        @DisplayName("1.1 Concurrent executes of one draft issue stock once")
        void testConcurrentExecute_IssuesOnce() throws InterruptedException {
            printTestHeader("Concurrent Execute");
            String supplierId = newSupplier();
            String rawId = newRawMaterial();
            String productId = newFinalProduct();
            purchase(supplierId, rawId, 50, "3.00");
            recipeService.createRecipe(productId, null, List.of(RecipeLine.of(rawId, new BigDecimal("2"))));
            ProductionBatch draft = productionService.createDraft(productId, 3,
                    List.of(shortId(), shortId(), shortId()));

            Outcome outcome = race(() -> productionService.executeDraft(draft.getId()));
            printOutput("Succeeded", outcome.successes.get());
            printOutput("Rejected", outcome.failures.get());

            assertEquals(1, outcome.successes.get());
            assertEquals(THREADS - 1, outcome.failures.get());
            assertEquals(44, item(rawId).getTotalQuantity());
            assertEquals(1, stockLedgerService.findByReference(StockReferenceType.PRODUCTION, draft.getId()).size());
            assertEquals(ProductionStage.IN_PROCESS, productionService.getBatch(draft.getId()).getStage());
            printSuccess("Raw stock issued exactly once");
        }

        @Test
        @DisplayName("1.2 A shortfall on one raw item leaves every item untouched")
        void testExecute_ShortfallRollsBackAll() {
            String supplierId = newSupplier();
            String plenty = newRawMaterial();
            String scarce = newRawMaterial();
            String productId = newFinalProduct();
            purchase(supplierId, plenty, 100, "1.00");
            purchase(supplierId, scarce, 1, "1.00");
            recipeService.createRecipe(productId, null, List.of(
                    RecipeLine.of(plenty, BigDecimal.ONE),
                    RecipeLine.of(scarce, BigDecimal.ONE)));
            ProductionBatch draft = productionService.createDraft(productId, 2, List.of(shortId(), shortId()));

            assertThrows(InsufficientStockException.class, () -> productionService.executeDraft(draft.getId()));

            assertEquals(100, item(plenty).getTotalQuantity());
            assertEquals(1, item(scarce).getTotalQuantity());
            assertTrue(stockLedgerService.findByReference(StockReferenceType.PRODUCTION, draft.getId()).isEmpty());
        }

        @Test
        @DisplayName("1.3 A recipe edit waiting on an in-flight completion is rejected once it commits")
        void testRecipeEdit_BlockedByCompletion() throws Exception {
            printTestHeader("Recipe Edit vs Completion");
            String supplierId = newSupplier();
            String rawId = newRawMaterial();
            String productId = newFinalProduct();
            purchase(supplierId, rawId, 10, "3.00");
            Recipe recipe = recipeService.createRecipe(productId, "Original",
                    List.of(RecipeLine.of(rawId, new BigDecimal("2"))));
            ProductionBatch draft = productionService.createDraft(productId, 1, List.of(shortId()));
            productionService.executeDraft(draft.getId());

            CountDownLatch completed = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            TransactionTemplate tx = new TransactionTemplate(transactionManager);
            ExecutorService executor = Executors.newFixedThreadPool(2);
            try {
                Future<?> completion = executor.submit(() -> tx.executeWithoutResult(status -> {
                    productionService.completeBatch(draft.getId());
                    completed.countDown();
                    try {
                        release.await(10, TimeUnit.SECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        throw new IllegalStateException(e);
                    }
                }));
                assertTrue(completed.await(10, TimeUnit.SECONDS), "completion did not start");

                Future<Recipe> edit = executor.submit(() -> recipeService.updateRecipe(recipe.getId(), "Edited", null));
                Thread.sleep(500);
                assertFalse(edit.isDone(), "recipe edit should wait for the product lock");

                release.countDown();
                completion.get(10, TimeUnit.SECONDS);
                ExecutionException e = assertThrows(ExecutionException.class, () -> edit.get(10, TimeUnit.SECONDS));
                printOutput("Edit rejected with", e.getCause().getMessage());

                assertInstanceOf(IllegalStateException.class, e.getCause());
                assertEquals(ProductionStage.DONE, productionService.getBatch(draft.getId()).getStage());
                assertEquals("Original", recipeService.getRecipe(recipe.getId()).getName());
                printSuccess("Recipe frozen by the completed batch");
            } finally {
                release.countDown();
                executor.shutdown();
            }
        }
    }

    @Nested
    @DisplayName("2. Payments")
    class PaymentScenarios {

        @Test
        @DisplayName("2.1 Concurrent payments never take an invoice past its total")
        void testConcurrentInvoicePayments_NeverOverpay() throws InterruptedException {
            printTestHeader("Concurrent Invoice Payments");
            String supplierId = newSupplier();
            String accountId = newAccount();
            PurchaseInvoice invoice = purchase(supplierId, newRawMaterial(), 1, "100.00");

            Outcome outcome = race(() -> paymentService.addPayment(invoice.getId(), new BigDecimal("40.00"), accountId));

            PurchaseInvoice after = purchaseService.getInvoice(invoice.getId());
            printOutput("Paid", after.getPaidAmount());
            assertEquals(2, outcome.successes.get());
            assertAmount("80.00", after.getPaidAmount());
            assertAmount("20.00", after.getBalanceDue());
            assertEquals(InvoiceStatus.PARTIAL, after.getPaymentStatus());
            printSuccess("Third and later payments rejected");
        }

        @Test
        @DisplayName("2.2 Concurrent direct payments with one key pay once")
        void testConcurrentDirectPayments_SameKey() throws InterruptedException {
            printTestHeader("Concurrent Idempotent Direct Payments");
            String supplierId = newSupplier();
            String accountId = newAccount();
            purchase(supplierId, newRawMaterial(), 1, "500.00");
            String key = "race-" + shortId();
            List<DirectPaymentResult> results = Collections.synchronizedList(new ArrayList<>());

            Outcome outcome = race(() -> results.add(directPaymentService.paySupplier(supplierId,
                    new BigDecimal("50.00"), accountId, AllocationMethod.FIFO, key)));

            assertEquals(THREADS, outcome.successes.get());
            assertEquals(1, results.stream().filter(r -> !r.isReplayed()).count());
            assertEquals(1, results.stream().map(DirectPaymentResult::getDirectPaymentRef).distinct().count());
            assertEquals(1, paymentService.findBySupplier(supplierId).size());
            printSuccess("One payment, every other request replayed it");
        }
    }

    private Outcome race(Callable<?> task) throws InterruptedException {
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch doneLatch = new CountDownLatch(THREADS);
        Outcome outcome = new Outcome();
        ExecutorService executor = Executors.newFixedThreadPool(THREADS);
        for (int i = 0; i < THREADS; i++) {
            executor.submit(() -> {
                try {
                    startLatch.await();
                    task.call();
                    outcome.successes.incrementAndGet();
                } catch (Exception e) {
                    System.out.println("Rejected: " + e.getClass().getSimpleName() + " - " + e.getMessage());
                    outcome.failures.incrementAndGet();
                } finally {
                    doneLatch.countDown();
                }
            });
        }
        startLatch.countDown();
        assertTrue(doneLatch.await(30, TimeUnit.SECONDS), "threads did not finish");
        executor.shutdown();
        return outcome;
    }

    private static final class Outcome {
        final AtomicInteger successes = new AtomicInteger();
        final AtomicInteger failures = new AtomicInteger();
    }
}

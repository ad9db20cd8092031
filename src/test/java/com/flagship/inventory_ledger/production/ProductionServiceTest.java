package com.flagship.inventory_ledger.production;

import com.flagship.inventory_ledger.IntegrationTestBase;
import com.flagship.inventory_ledger.common.PagedResult;
import com.flagship.inventory_ledger.exception.InsufficientStockException;
import com.flagship.inventory_ledger.exception.ResourceNotFoundException;
import com.flagship.inventory_ledger.inventory.Item;
import com.flagship.inventory_ledger.outbox.OutboxEvent;
import com.flagship.inventory_ledger.outbox.OutboxService;
import com.flagship.inventory_ledger.stock.StockLedgerEntry;
import com.flagship.inventory_ledger.stock.StockLedgerService;
import com.flagship.inventory_ledger.stock.StockReferenceType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Production batches from draft through execution to completion.
 */
class ProductionServiceTest extends IntegrationTestBase {

    @Autowired
    private ProductionService productionService;

    @Autowired
    private RecipeService recipeService;

    @Autowired
    private StockLedgerService stockLedgerService;

    @Autowired
    private OutboxService outboxService;

    private String supplierId;
    private String rawId;
    private String productId;

    @BeforeEach
    void setUp() {
        supplierId = newSupplier();
        rawId = newRawMaterial();
        productId = newFinalProduct();
        recipeService.createRecipe(productId, "Standard build",
                List.of(RecipeLine.of(rawId, new BigDecimal("4"))));
    }

    @Test
    @DisplayName("Feasibility reports the largest producible quantity and the shortfall")
    void testFeasibility_Insufficient() {
        printTestHeader("Production Feasibility");
        purchase(supplierId, rawId, 10, "90.00");
        printInput("Requested", 3);

        ProductionFeasibility result = productionService.feasibility(productId, 3);
        printOutput("Max producible", result.getMaxProducibleQuantity());
        printOutput("Message", result.getMessage());

        assertFalse(result.isFeasible());
        assertEquals(2, result.getMaxProducibleQuantity());
        assertEquals(1, result.getInsufficientItems().size());
        ProductionFeasibility.InsufficientItem shortItem = result.getInsufficientItems().get(0);
        assertEquals(rawId, shortItem.getRawItemId());
        assertAmount("12", shortItem.getRequiredQuantity());
        assertEquals(10, shortItem.getAvailableQuantity());
        assertAmount("2", shortItem.getShortfall());
        assertEquals("You requested 3 unit(s). Based on available stock, you can only produce 2 unit(s).",
                result.getMessage());
        printSuccess("max = floor(10 / 4) = 2, short by 2");
    }

    @Test
    @DisplayName("Feasibility succeeds when stock covers the request")
    void testFeasibility_Sufficient() {
        purchase(supplierId, rawId, 10, "90.00");

        ProductionFeasibility result = productionService.feasibility(productId, 2);

        assertTrue(result.isFeasible());
        assertTrue(result.getInsufficientItems().isEmpty());
        assertEquals("You can produce 2 unit(s).", result.getMessage());
    }

    @Test
    @DisplayName("Preview lists exact requirements and the estimated cost")
    void testPreview() {
        purchase(supplierId, rawId, 10, "90.00");

        ProductionPreview preview = productionService.preview(productId, 3);

        assertEquals(1, preview.getRawRequirements().size());
        ProductionPreview.RawRequirement requirement = preview.getRawRequirements().get(0);
        assertAmount("12", requirement.getQuantityRequired());
        assertAmount("90.00", requirement.getAvgPrice());
        assertFalse(requirement.isSufficient());
        assertAmount("1080.00", preview.getTotalEstimatedCost());
    }

    @Test
    @DisplayName("A draft copies the recipe, prefixes serials and moves no stock")
    void testCreateDraft() {
        printTestHeader("Create Draft Batch");
        purchase(supplierId, rawId, 20, "90.00");
        List<String> serials = serials(2);

        ProductionBatch batch = productionService.createDraft(productId, 2, serials);
        printOutput("Batch", batch.getId());
        printOutput("Serials", batch.getSerialNumbers());

        assertTrue(batch.getId().startsWith("PROD-"));
        assertEquals(ProductionStage.DRAFT, batch.getStage());
        assertEquals(2, batch.getSerialNumbers().size());
        assertTrue(batch.getSerialNumbers().stream().allMatch(s -> s.startsWith("LEH-")));
        assertEquals(1, batch.getRecipeLines().size());
        assertEquals(20, item(rawId).getTotalQuantity());
        assertTrue(stockLedgerService.findByReference(StockReferenceType.PRODUCTION, batch.getId()).isEmpty());
        printSuccess("Draft holds the recipe snapshot, stock untouched");
    }

    @Test
    @DisplayName("Drafts need a recipe, a serial per unit and unused serials")
    void testCreateDraft_Validation() {
        String bare = newFinalProduct();
        assertThrows(IllegalArgumentException.class, () -> productionService.createDraft(bare, 1, serials(1)));
        assertThrows(IllegalArgumentException.class, () -> productionService.createDraft(productId, 2, serials(1)));
        assertThrows(IllegalArgumentException.class, () -> productionService.createDraft(productId, 0, List.of()));

        List<String> taken = serials(1);
        productionService.createDraft(productId, 1, taken);
        String lowerCase = "leh-" + taken.get(0).toLowerCase();
        IllegalArgumentException conflict = assertThrows(IllegalArgumentException.class,
                () -> productionService.createDraft(productId, 1, List.of(lowerCase)));
        assertTrue(conflict.getMessage().startsWith("Serial numbers already exist"));
    }

    @Test
    @DisplayName("Executing a draft issues raw stock once; a second execute fails")
    void testExecuteDraft_Once() {
        printTestHeader("Execute Draft Batch");
        purchase(supplierId, rawId, 30, "90.00");
        ProductionBatch draft = productionService.createDraft(productId, 5, serials(5));

        ProductionBatch running = productionService.executeDraft(draft.getId());
        printOutput("Stage", running.getStage());
        printOutput("Raw left", item(rawId).getTotalQuantity());

        assertEquals(ProductionStage.IN_PROCESS, running.getStage());
        assertEquals(10, item(rawId).getTotalQuantity());
        List<StockLedgerEntry> out = stockLedgerService.findByReference(StockReferenceType.PRODUCTION, draft.getId());
        assertEquals(1, out.size());
        assertEquals(20, out.get(0).getQtyOut());
        assertAmount("90.00", out.get(0).getUnitPrice());

        assertThrows(IllegalStateException.class, () -> productionService.executeDraft(draft.getId()));
        assertEquals(10, item(rawId).getTotalQuantity());
        printExpectedException("IllegalStateException", "batch already IN_PROCESS");
    }

    @Test
    @DisplayName("Executing without enough raw stock fails and leaves the draft")
    void testExecuteDraft_InsufficientStock() {
        purchase(supplierId, rawId, 10, "90.00");
        ProductionBatch draft = productionService.createDraft(productId, 3, serials(3));

        InsufficientStockException e = assertThrows(InsufficientStockException.class,
                () -> productionService.executeDraft(draft.getId()));

        assertEquals(1, e.getShortfalls().size());
        assertEquals(2, e.getShortfalls().get(0).getShortfall());
        assertEquals(ProductionStage.DRAFT, productionService.getBatch(draft.getId()).getStage());
        assertEquals(10, item(rawId).getTotalQuantity());
    }

    @Test
    @DisplayName("Feasibility caps max producible when stock dwarfs a tiny per-unit requirement")
    void testFeasibility_LargeStockSmallRequirement() {
        String finePart = newRawMaterial();
        String fineProduct = newFinalProduct();
        recipeService.createRecipe(fineProduct, "Fine build",
                List.of(RecipeLine.of(finePart, new BigDecimal("0.0001"))));
        purchase(supplierId, finePart, 300_000, "0.01");

        ProductionFeasibility result = productionService.feasibility(fineProduct, 5);
        printOutput("Max producible", result.getMaxProducibleQuantity());

        assertTrue(result.isFeasible());
        assertEquals(Integer.MAX_VALUE, result.getMaxProducibleQuantity());
        assertTrue(result.getInsufficientItems().isEmpty());
    }

    @Test
    @DisplayName("A requirement beyond int range is reported as a shortfall on execute")
    void testExecuteDraft_RequirementBeyondIntRange() {
        String bulkPart = newRawMaterial();
        String bulkProduct = newFinalProduct();
        purchase(supplierId, bulkPart, 10, "1.00");
        recipeService.createRecipe(bulkProduct, "Bulk build",
                List.of(RecipeLine.of(bulkPart, new BigDecimal("5000000000"))));
        ProductionBatch draft = productionService.createDraft(bulkProduct, 1, serials(1));

        InsufficientStockException e = assertThrows(InsufficientStockException.class,
                () -> productionService.executeDraft(draft.getId()));

        assertEquals(1, e.getShortfalls().size());
        assertEquals(5_000_000_000L, e.getShortfalls().get(0).getRequired());
        assertEquals(4_999_999_990L, e.getShortfalls().get(0).getShortfall());
        assertEquals(ProductionStage.DRAFT, productionService.getBatch(draft.getId()).getStage());
        assertEquals(10, item(bulkPart).getTotalQuantity());
        printExpectedException("InsufficientStockException", e.getMessage());
    }

    @Test
    @DisplayName("Completing a batch receives the product at its standard cost")
    void testCompleteBatch() {
        printTestHeader("Complete Batch");
        purchase(supplierId, rawId, 8, "90.00");
        recipeService.updateRecipe(recipeService.getRecipeForProduct(productId).getId(), null, null);
        ProductionBatch draft = productionService.createDraft(productId, 2, serials(2));

        assertThrows(IllegalStateException.class, () -> productionService.completeBatch(draft.getId()));
        productionService.executeDraft(draft.getId());
        ProductionBatch done = productionService.completeBatch(draft.getId());

        Item product = item(productId);
        printOutput("Product", product.getTotalQuantity() + " @ " + product.getAvgPrice());
        assertEquals(ProductionStage.DONE, done.getStage());
        assertEquals(2, product.getTotalQuantity());
        assertAmount("360.00", product.getStandardCost());
        assertAmount("360.00", product.getAvgPrice());

        List<StockLedgerEntry> rows = stockLedgerService.findByReference(StockReferenceType.PRODUCTION, draft.getId());
        assertEquals(2, rows.size());
        assertTrue(rows.get(1).isIncoming());
        assertEquals(2, rows.get(1).getQtyIn());

        assertThrows(IllegalStateException.class, () -> productionService.completeBatch(draft.getId()));
        assertThrows(IllegalStateException.class, () -> productionService.deleteBatch(draft.getId()));

        List<String> stages = new ArrayList<>();
        for (OutboxEvent event : outboxService.getEventsForAggregate("ProductionBatch", draft.getId())) {
            stages.add(event.getEventType());
        }
        assertEquals(3, stages.size());
        printSuccess("DRAFT -> IN_PROCESS -> DONE");
    }

    @Test
    @DisplayName("Updating a draft replaces quantity, serials and snapshot")
    void testUpdateDraft() {
        String otherRaw = newRawMaterial();
        ProductionBatch draft = productionService.createDraft(productId, 1, serials(1));

        assertThrows(IllegalArgumentException.class,
                () -> productionService.updateDraft(draft.getId(), 2, null, null));

        List<String> replacement = serials(2);
        ProductionBatch updated = productionService.updateDraft(draft.getId(), 2, replacement,
                List.of(RecipeLine.of(otherRaw, new BigDecimal("1.5"))));

        assertEquals(2, updated.getQuantityProduced());
        assertEquals(2, updated.getSerialNumbers().size());
        assertEquals(1, updated.getRecipeLines().size());
        assertEquals(otherRaw, updated.getRecipeLines().get(0).getRawItemId());
        assertEquals(rawId, recipeService.getRecipeForProduct(productId).getLines().get(0).getRawItemId());

        ProductionBatch sameSerials = productionService.updateDraft(draft.getId(), null, updated.getSerialNumbers(),
                null);
        assertEquals(updated.getSerialNumbers(), sameSerials.getSerialNumbers());
    }

    @Test
    @DisplayName("Only drafts can be updated or deleted")
    void testDeleteBatch_DraftOnly() {
        purchase(supplierId, rawId, 4, "90.00");
        ProductionBatch draft = productionService.createDraft(productId, 1, serials(1));
        ProductionBatch running = productionService.createDraft(productId, 1, serials(1));
        productionService.executeDraft(running.getId());

        assertThrows(IllegalStateException.class, () -> productionService.deleteBatch(running.getId()));
        assertThrows(IllegalStateException.class,
                () -> productionService.updateDraft(running.getId(), null, null, null));

        productionService.deleteBatch(draft.getId());
        assertThrows(ResourceNotFoundException.class, () -> productionService.getBatch(draft.getId()));
    }

    @Test
    @DisplayName("Batch detail costs the snapshot at current averages")
    void testBatchDetail() {
        purchase(supplierId, rawId, 10, "90.00");
        ProductionBatch draft = productionService.createDraft(productId, 2, serials(2));

        BatchDetail detail = productionService.getBatchDetail(draft.getId());

        assertEquals(1, detail.getRecipeItems().size());
        assertAmount("720.00", detail.getRecipeItems().get(0).getLineCost());
        assertAmount("720.00", detail.getTotalEstimatedCost());
        assertAmount("360.00", detail.getCostPerUnit());
    }

    @Test
    @DisplayName("Batches can be listed by product and stage")
    void testListBatches() {
        purchase(supplierId, rawId, 4, "90.00");
        ProductionBatch first = productionService.createDraft(productId, 1, serials(1));
        ProductionBatch second = productionService.createDraft(productId, 1, serials(1));
        productionService.executeDraft(second.getId());

        PagedResult<ProductionBatch> all = productionService.listBatches(productId, null, 0, 10);
        PagedResult<ProductionBatch> drafts = productionService.listBatches(productId, ProductionStage.DRAFT, 0, 10);

        assertEquals(2, all.getTotal());
        assertEquals(second.getId(), all.getItems().get(0).getId());
        assertEquals(1, drafts.getTotal());
        assertEquals(first.getId(), drafts.getItems().get(0).getId());
    }

    private static List<String> serials(int count) {
        List<String> serials = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            serials.add(shortId().toUpperCase() + "-" + i);
        }
        return serials;
    }
}

package com.flagship.inventory_ledger.production;

import com.flagship.inventory_ledger.common.CodeGenerator;
import com.flagship.inventory_ledger.common.CodePrefix;
import com.flagship.inventory_ledger.common.Money;
import com.flagship.inventory_ledger.common.PageRequests;
import com.flagship.inventory_ledger.common.PagedResult;
import com.flagship.inventory_ledger.config.InventoryProperties;
import com.flagship.inventory_ledger.event.ProductionStageChangedEvent;
import com.flagship.inventory_ledger.exception.InsufficientStockException;
import com.flagship.inventory_ledger.exception.ResourceNotFoundException;
import com.flagship.inventory_ledger.inventory.InventoryValuationService;
import com.flagship.inventory_ledger.inventory.Item;
import com.flagship.inventory_ledger.inventory.ItemService;
import com.flagship.inventory_ledger.observability.CorrelationContext;
import com.flagship.inventory_ledger.observability.InventoryMetrics;
import com.flagship.inventory_ledger.outbox.OutboxService;
import com.flagship.inventory_ledger.stock.StockLedgerService;
import com.flagship.inventory_ledger.stock.StockReferenceType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Production batches through DRAFT, IN_PROCESS and DONE.
 *
 * A draft copies the master recipe and reserves its serial numbers but moves
 * no stock. Executing a draft issues the raw materials, completing it
 * receives the finished units into the final product. Each step checks the
 * stage machine under a row lock on the batch.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ProductionService {

    private final ProductionBatchRepository batchRepository;
    private final ProductionSerialRepository serialRepository;
    private final RecipeRepository recipeRepository;
    private final RecipeLineValidator validator;
    private final ItemService itemService;
    private final InventoryValuationService valuationService;
    private final StockLedgerService stockLedgerService;
    private final OutboxService outboxService;
    private final CodeGenerator codeGenerator;
    private final InventoryProperties properties;
    private final InventoryMetrics metrics;

    /**
     * Drafts a batch from the product's master recipe.
     *
     * @param serialNumbers one per unit; the serial prefix is added where missing
     * @throws IllegalArgumentException on a count mismatch, a reused serial or a product without recipe
     */
    @Transactional
    public ProductionBatch createDraft(String finalProductId, int quantity, List<String> serialNumbers) {
        requirePositive(quantity);
        validator.requireFinalProduct(finalProductId);
        RecipeEntity recipe = recipeRepository.findByFinalProductId(finalProductId)
                .orElseThrow(() -> new IllegalArgumentException("No recipe found for final product " + finalProductId));
        List<RecipeLine> snapshot = recipe.lines();
        if (snapshot.isEmpty()) {
            throw new IllegalArgumentException("Recipe for final product " + finalProductId + " has no items");
        }
        List<String> serials = normalizeSerials(serialNumbers, quantity);
        requireUnused(serials, null);

        String batchId = codeGenerator.generate(CodePrefix.PRODUCTION_BATCH, batchRepository::existsById);
        try (MDC.MDCCloseable ignored = CorrelationContext.scope(CorrelationContext.BATCH_ID_MDC_KEY, batchId)) {
            ProductionBatchEntity batch = batchRepository.save(
                    ProductionBatchEntity.createDraft(batchId, finalProductId, quantity));
            batch.addSerials(serials);
            batch.addRecipeLines(snapshot);
            ProductionBatch saved = batchRepository.save(batch).toDomain();

            outboxService.saveEvent(ProductionStageChangedEvent.of(batchId, finalProductId, quantity,
                    null, ProductionStage.DRAFT.name()));
            metrics.recordStageTransition(null, ProductionStage.DRAFT.name());
            log.info("Drafted batch of {} x {} with {} recipe item(s)", quantity, finalProductId, snapshot.size());
            return saved;
        }
    }

    /**
     * Changes quantity, serials or recipe snapshot of a draft. The master
     * recipe is not touched.
     *
     * @param quantity      optional; a different quantity needs a matching serial list
     * @param serialNumbers optional; replaces all serials
     * @param recipeLines   optional; replaces the snapshot
     */
    @Transactional
    public ProductionBatch updateDraft(String batchId, Integer quantity, List<String> serialNumbers,
                                       List<RecipeLine> recipeLines) {
        try (MDC.MDCCloseable ignored = CorrelationContext.scope(CorrelationContext.BATCH_ID_MDC_KEY, batchId)) {
            ProductionBatchEntity batch = lockBatch(batchId);
            requireDraft(batch, "updated");

            int newQuantity = batch.getQuantityProduced();
            if (quantity != null) {
                requirePositive(quantity);
                newQuantity = quantity;
            }
            if (serialNumbers == null && newQuantity != batch.getQuantityProduced()) {
                throw new IllegalArgumentException(
                        "Serial numbers must be provided when quantity changes (need " + newQuantity + ")");
            }

            List<String> serials = null;
            if (serialNumbers != null) {
                serials = normalizeSerials(serialNumbers, newQuantity);
                requireUnused(serials, batchId);
            }
            List<RecipeLine> snapshot = recipeLines != null ? validator.validate(recipeLines) : null;

            batch.changeQuantity(newQuantity);
            if (serials != null) {
                batch.clearSerials();
            }
            if (snapshot != null) {
                batch.clearRecipe();
            }
            // Old rows must be deleted before rows under the same unique keys are inserted.
            batchRepository.flush();
            if (serials != null) {
                batch.addSerials(serials);
            }
            if (snapshot != null) {
                batch.addRecipeLines(snapshot);
            }

            ProductionBatch updated = batchRepository.save(batch).toDomain();
            log.info("Draft updated: quantity={}, serials replaced={}, recipe replaced={}",
                    newQuantity, serials != null, snapshot != null);
            return updated;
        }
    }

    /**
     * Issues the raw materials for a draft and moves it to IN_PROCESS.
     *
     * @throws InsufficientStockException listing every raw item that is short
     */
    @Transactional
    public ProductionBatch executeDraft(String batchId) {
        long startTime = System.currentTimeMillis();
        try (MDC.MDCCloseable ignored = CorrelationContext.scope(CorrelationContext.BATCH_ID_MDC_KEY, batchId)) {
            ProductionBatchEntity batch = lockBatch(batchId);
            batch.getStage().requireTransitionTo(ProductionStage.IN_PROCESS);
            List<RecipeLine> snapshot = batch.recipeLines();
            if (snapshot.isEmpty()) {
                throw new IllegalStateException("Batch " + batchId + " has no recipe items");
            }
            if (batch.serialNumbers().size() != batch.getQuantityProduced()) {
                throw new IllegalStateException(String.format("Batch %s has %d serial number(s) for quantity %d",
                        batchId, batch.serialNumbers().size(), batch.getQuantityProduced()));
            }

            Map<String, Long> required = new LinkedHashMap<>();
            for (RecipeLine line : snapshot) {
                required.put(line.getRawItemId(),
                        RequirementCalculator.issued(line.getQuantityPerUnit(), batch.getQuantityProduced()));
            }

            List<Item> issued = valuationService.issueAll(required);
            for (Item raw : issued) {
                stockLedgerService.recordOut(raw.getId(), StockReferenceType.PRODUCTION, batchId,
                        Math.toIntExact(required.get(raw.getId())), raw.getAvgPrice());
            }

            ProductionStage from = batch.advanceTo(ProductionStage.IN_PROCESS);
            ProductionBatch result = batchRepository.save(batch).toDomain();
            publishTransition(result, from);

            long duration = System.currentTimeMillis() - startTime;
            metrics.recordOperationLatency("execute_batch", "success", duration);
            log.info("Batch executed: {} raw item(s) issued, duration={}ms", issued.size(), duration);
            return result;
        } catch (RuntimeException e) {
            metrics.recordOperationLatency("execute_batch", "error", System.currentTimeMillis() - startTime);
            log.error("Executing batch {} failed: {}", batchId, e.getMessage());
            throw e;
        }
    }

    /**
     * Receives the produced units into the final product at its unit cost and
     * moves the batch to DONE.
     */
    @Transactional
    public ProductionBatch completeBatch(String batchId) {
        long startTime = System.currentTimeMillis();
        try (MDC.MDCCloseable ignored = CorrelationContext.scope(CorrelationContext.BATCH_ID_MDC_KEY, batchId)) {
            ProductionBatchEntity batch = lockBatch(batchId);
            batch.getStage().requireTransitionTo(ProductionStage.DONE);

            String productId = batch.getFinalProductId();
            Item product = valuationService.lockAll(List.of(productId)).get(productId);
            BigDecimal unitCost = valuationService.unitCost(product);
            valuationService.receive(productId, batch.getQuantityProduced(), unitCost);
            stockLedgerService.recordIn(productId, StockReferenceType.PRODUCTION, batchId,
                    batch.getQuantityProduced(), unitCost);

            ProductionStage from = batch.advanceTo(ProductionStage.DONE);
            ProductionBatch result = batchRepository.save(batch).toDomain();
            publishTransition(result, from);

            long duration = System.currentTimeMillis() - startTime;
            metrics.recordOperationLatency("complete_batch", "success", duration);
            log.info("Batch completed: {} x {} received at {}, duration={}ms",
                    batch.getQuantityProduced(), productId, unitCost, duration);
            return result;
        } catch (RuntimeException e) {
            metrics.recordOperationLatency("complete_batch", "error", System.currentTimeMillis() - startTime);
            log.error("Completing batch {} failed: {}", batchId, e.getMessage());
            throw e;
        }
    }

    @Transactional
    public void deleteBatch(String batchId) {
        try (MDC.MDCCloseable ignored = CorrelationContext.scope(CorrelationContext.BATCH_ID_MDC_KEY, batchId)) {
            ProductionBatchEntity batch = lockBatch(batchId);
            requireDraft(batch, "deleted");
            batchRepository.delete(batch);
            outboxService.saveEvent(ProductionStageChangedEvent.of(batchId, batch.getFinalProductId(),
                    batch.getQuantityProduced(), ProductionStage.DRAFT.name(), null));
            metrics.recordStageTransition(ProductionStage.DRAFT.name(), null);
            log.info("Draft batch deleted");
        }
    }

    @Transactional(readOnly = true)
    public ProductionBatch getBatch(String batchId) {
        return requireBatch(batchId).toDomain();
    }

    @Transactional(readOnly = true)
    public BatchDetail getBatchDetail(String batchId) {
        ProductionBatch batch = requireBatch(batchId).toDomain();
        Item product = itemService.getItem(batch.getFinalProductId());
        BigDecimal quantity = BigDecimal.valueOf(batch.getQuantityProduced());

        List<BatchDetail.Line> lines = new ArrayList<>();
        BigDecimal total = BigDecimal.ZERO;
        for (RecipeLine line : batch.getRecipeLines()) {
            Item raw = itemService.getItem(line.getRawItemId());
            BigDecimal lineCost = line.getQuantityPerUnit().multiply(raw.getAvgPrice()).multiply(quantity);
            total = total.add(lineCost);
            lines.add(new BatchDetail.Line(raw.getId(), raw.getName(), line.getQuantityPerUnit(),
                    raw.getAvgPrice(), raw.getTotalQuantity(), Money.of(lineCost)));
        }
        BigDecimal costPerUnit = Money.of(Money.divide(total, quantity));
        return new BatchDetail(batch, product.getName(), lines, Money.of(total), costPerUnit);
    }

    @Transactional(readOnly = true)
    public PagedResult<ProductionBatch> listBatches(String finalProductId, ProductionStage stage,
                                                    int offset, int limit) {
        Pageable pageable = PageRequests.of(offset, limit, Sort.by(Sort.Direction.DESC, "createdAt", "id"));
        Page<ProductionBatchEntity> page;
        if (finalProductId != null && stage != null) {
            page = batchRepository.findByFinalProductIdAndStage(finalProductId, stage, pageable);
        } else if (finalProductId != null) {
            page = batchRepository.findByFinalProductId(finalProductId, pageable);
        } else if (stage != null) {
            page = batchRepository.findByStage(stage, pageable);
        } else {
            page = batchRepository.findAll(pageable);
        }
        return PageRequests.toResult(page.map(ProductionBatchEntity::toDomain), offset, limit);
    }

    /**
     * Exact raw requirements for {@code quantity} units from the master recipe.
     */
    @Transactional(readOnly = true)
    public ProductionPreview preview(String finalProductId, int quantity) {
        requirePositive(quantity);
        Item product = validator.requireFinalProduct(finalProductId);
        List<ProductionPreview.RawRequirement> requirements = new ArrayList<>();
        BigDecimal total = BigDecimal.ZERO;
        for (RecipeLine line : masterRecipe(finalProductId)) {
            Item raw = itemService.getItem(line.getRawItemId());
            BigDecimal required = RequirementCalculator.exact(line.getQuantityPerUnit(), quantity);
            total = total.add(raw.getAvgPrice().multiply(required));
            requirements.add(new ProductionPreview.RawRequirement(raw.getId(), raw.getName(),
                    line.getQuantityPerUnit(), required, raw.getAvgPrice(), raw.getTotalQuantity(),
                    BigDecimal.valueOf(raw.getTotalQuantity()).compareTo(required) >= 0));
        }
        return new ProductionPreview(finalProductId, product.getName(), quantity, requirements, Money.of(total));
    }

    /**
     * Whether current stock covers {@code quantity} units and, if not, how many it does cover.
     */
    @Transactional(readOnly = true)
    public ProductionFeasibility feasibility(String finalProductId, int quantity) {
        requirePositive(quantity);
        validator.requireFinalProduct(finalProductId);
        Integer maxUnits = null;
        List<ProductionFeasibility.InsufficientItem> insufficient = new ArrayList<>();
        for (RecipeLine line : masterRecipe(finalProductId)) {
            Item raw = itemService.getItem(line.getRawItemId());
            int supported = RequirementCalculator.maxProducible(raw.getTotalQuantity(), line.getQuantityPerUnit());
            maxUnits = maxUnits == null ? supported : Math.min(maxUnits, supported);

            BigDecimal required = RequirementCalculator.exact(line.getQuantityPerUnit(), quantity);
            BigDecimal available = BigDecimal.valueOf(raw.getTotalQuantity());
            if (available.compareTo(required) < 0) {
                insufficient.add(new ProductionFeasibility.InsufficientItem(raw.getId(), raw.getName(),
                        required, raw.getTotalQuantity(), required.subtract(available)));
            }
        }
        int max = maxUnits == null ? quantity : maxUnits;
        boolean feasible = quantity <= max && insufficient.isEmpty();
        String message = feasible
                ? String.format("You can produce %d unit(s).", quantity)
                : String.format("You requested %d unit(s). Based on available stock, you can only produce %d unit(s).",
                        quantity, max);
        return new ProductionFeasibility(finalProductId, feasible, quantity, max, insufficient, message);
    }

    private List<RecipeLine> masterRecipe(String finalProductId) {
        return recipeRepository.findByFinalProductId(finalProductId)
                .map(RecipeEntity::lines)
                .orElseThrow(() -> new IllegalArgumentException("No recipe found for final product " + finalProductId));
    }

    private List<String> normalizeSerials(List<String> serialNumbers, int quantity) {
        List<String> serials = SerialNumbers.normalize(serialNumbers, properties.getSerialPrefix());
        if (serials.size() != quantity) {
            throw new IllegalArgumentException(String.format(
                    "Number of serial numbers (%d) must equal quantity (%d)", serials.size(), quantity));
        }
        return serials;
    }

    private void requireUnused(List<String> serials, String ownBatchId) {
        List<String> keys = serials.stream().map(SerialNumbers::key).toList();
        List<String> taken = ownBatchId == null
                ? serialRepository.findExisting(keys)
                : serialRepository.findExistingOutsideBatch(keys, ownBatchId);
        if (!taken.isEmpty()) {
            throw new IllegalArgumentException("Serial numbers already exist: " + String.join(", ", taken));
        }
    }

    private void publishTransition(ProductionBatch batch, ProductionStage from) {
        outboxService.saveEvent(ProductionStageChangedEvent.of(batch.getId(), batch.getFinalProductId(),
                batch.getQuantityProduced(), from.name(), batch.getStage().name()));
        metrics.recordStageTransition(from.name(), batch.getStage().name());
    }

    private static void requireDraft(ProductionBatchEntity batch, String action) {
        if (batch.getStage() != ProductionStage.DRAFT) {
            throw new IllegalStateException(String.format(
                    "Only DRAFT batches can be %s; batch %s is %s", action, batch.getId(), batch.getStage()));
        }
    }

    private static void requirePositive(int quantity) {
        if (quantity <= 0) {
            throw new IllegalArgumentException("Quantity must be greater than 0: " + quantity);
        }
    }

    private ProductionBatchEntity lockBatch(String batchId) {
        return batchRepository.findByIdForUpdate(batchId)
                .orElseThrow(() -> new ResourceNotFoundException("Production batch", batchId));
    }

    private ProductionBatchEntity requireBatch(String batchId) {
        return batchRepository.findById(batchId)
                .orElseThrow(() -> new ResourceNotFoundException("Production batch", batchId));
    }
}

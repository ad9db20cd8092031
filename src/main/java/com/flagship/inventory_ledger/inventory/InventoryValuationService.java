package com.flagship.inventory_ledger.inventory;

import com.flagship.inventory_ledger.config.InventoryProperties;
import com.flagship.inventory_ledger.exception.InsufficientStockException;
import com.flagship.inventory_ledger.exception.ResourceNotFoundException;
import com.flagship.inventory_ledger.exception.Shortfall;
import com.flagship.inventory_ledger.observability.InventoryMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * The only writer of item stock aggregates.
 *
 * Each method locks the item row, runs the {@link CostingEngine} step and
 * writes the rounded result back. Methods require an enclosing transaction so
 * the aggregate update commits together with the ledger rows that explain it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class InventoryValuationService {

    private final ItemRepository itemRepository;
    private final InventoryProperties properties;
    private final InventoryMetrics metrics;

    @Transactional(propagation = Propagation.MANDATORY)
    public Item receive(String itemId, int quantity, BigDecimal unitPrice) {
        requirePositive(quantity);
        ItemEntity item = lock(itemId);
        StockPosition before = item.position();
        item.applyPosition(CostingEngine.applyIncoming(before, quantity, unitPrice));
        metrics.recordStockMovement("in", quantity);
        log.debug("Received {} x {} @ {}: qty {} -> {}, avg {} -> {}", quantity, itemId, unitPrice,
                before.getQuantity(), item.getTotalQuantity(), before.getAvgPrice(), item.getAvgPrice());
        return item.toDomain();
    }

    /**
     * Issues stock at the current average.
     *
     * @throws InsufficientStockException if fewer units are on hand
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Item issue(String itemId, int quantity) {
        requirePositive(quantity);
        ItemEntity item = lock(itemId);
        if (quantity > item.getTotalQuantity()) {
            metrics.recordShortfall("issue");
            throw InsufficientStockException.single(item.getId(), item.getName(), quantity, item.getTotalQuantity());
        }
        item.applyPosition(CostingEngine.applyOutgoing(item.position(), quantity));
        metrics.recordStockMovement("out", quantity);
        log.debug("Issued {} x {}: qty now {}", quantity, itemId, item.getTotalQuantity());
        return item.toDomain();
    }

    /**
     * Undoes an earlier receipt.
     *
     * @throws InsufficientStockException if the received units were already consumed
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Item reverseReceipt(String itemId, int quantity, BigDecimal unitPrice) {
        requirePositive(quantity);
        ItemEntity item = lock(itemId);
        if (quantity > item.getTotalQuantity()) {
            metrics.recordShortfall("reversal");
            log.warn("Reversal of {} x {} rejected, only {} on hand", quantity, itemId, item.getTotalQuantity());
            throw InsufficientStockException.single(item.getId(), item.getName(), quantity, item.getTotalQuantity());
        }
        StockPosition before = item.position();
        item.applyPosition(CostingEngine.reverseIncoming(before, quantity, unitPrice));
        metrics.recordStockMovement("reversal", quantity);
        log.debug("Reversed receipt {} x {} @ {}: qty {} -> {}, avg {} -> {}", quantity, itemId, unitPrice,
                before.getQuantity(), item.getTotalQuantity(), before.getAvgPrice(), item.getAvgPrice());
        return item.toDomain();
    }

    /**
     * Locks the given items in id order and returns their current snapshots.
     * Later {@link #issue} calls in the same transaction see the same rows.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Map<String, Item> lockAll(Collection<String> itemIds) {
        TreeSet<String> ordered = new TreeSet<>(itemIds);
        List<ItemEntity> locked = itemRepository.findAllByIdForUpdate(ordered);
        Map<String, Item> result = new LinkedHashMap<>();
        for (ItemEntity entity : locked) {
            result.put(entity.getId(), entity.toDomain());
        }
        for (String id : ordered) {
            if (!result.containsKey(id)) {
                throw new ResourceNotFoundException("Item", id);
            }
        }
        return result;
    }

    /**
     * Issues several items after checking all of them, so a failure reports
     * every short item rather than the first one.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public List<Item> issueAll(Map<String, Long> quantities) {
        Map<String, Item> locked = lockAll(quantities.keySet());
        List<Shortfall> shortfalls = new ArrayList<>();
        for (Map.Entry<String, Long> entry : quantities.entrySet()) {
            Item item = locked.get(entry.getKey());
            if (entry.getValue() > item.getTotalQuantity()) {
                shortfalls.add(Shortfall.of(item.getId(), item.getName(), entry.getValue(), item.getTotalQuantity()));
            }
        }
        if (!shortfalls.isEmpty()) {
            metrics.recordShortfall("issue");
            throw new InsufficientStockException(shortfalls);
        }
        List<Item> issued = new ArrayList<>();
        for (Map.Entry<String, Long> entry : quantities.entrySet()) {
            if (entry.getValue() > 0) {
                issued.add(issue(entry.getKey(), Math.toIntExact(entry.getValue())));
            }
        }
        return issued;
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public Item applyStandardCost(String itemId, BigDecimal standardCost) {
        ItemEntity item = lock(itemId);
        item.applyStandardCost(standardCost);
        log.debug("Standard cost of {} set to {}", itemId, item.getStandardCost());
        return item.toDomain();
    }

    /**
     * Unit cost an item reports externally and is credited at when produced.
     * Raw materials always use the running average.
     */
    public BigDecimal unitCost(Item item) {
        if (item.isFinalProduct()
                && properties.getFinalProductCostBasis() == InventoryProperties.CostBasis.STANDARD
                && item.getStandardCost() != null) {
            return item.getStandardCost();
        }
        return item.getAvgPrice();
    }

    private ItemEntity lock(String itemId) {
        return itemRepository.findByIdForUpdate(itemId)
                .orElseThrow(() -> new ResourceNotFoundException("Item", itemId));
    }

    private static void requirePositive(int quantity) {
        if (quantity <= 0) {
            throw new IllegalArgumentException("Quantity must be greater than 0: " + quantity);
        }
    }
}

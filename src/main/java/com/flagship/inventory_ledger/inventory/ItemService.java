package com.flagship.inventory_ledger.inventory;

import com.flagship.inventory_ledger.common.CodeGenerator;
import com.flagship.inventory_ledger.common.CodePrefix;
import com.flagship.inventory_ledger.common.Money;
import com.flagship.inventory_ledger.common.PageRequests;
import com.flagship.inventory_ledger.common.PagedResult;
import com.flagship.inventory_ledger.config.InventoryProperties;
import com.flagship.inventory_ledger.exception.ResourceNotFoundException;
import com.flagship.inventory_ledger.stock.MovementTotals;
import com.flagship.inventory_ledger.stock.StockLedgerService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;

/**
 * Item registration and read-side views over item stock.
 *
 * Stock aggregates are never written here; see {@link InventoryValuationService}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ItemService {

    private final ItemRepository itemRepository;
    private final InventoryValuationService valuationService;
    private final StockLedgerService stockLedgerService;
    private final CodeGenerator codeGenerator;
    private final InventoryProperties properties;

    @Transactional
    public Item createItem(String name, ItemType itemType, UnitType unitType) {
        String trimmed = requireName(name);
        if (itemType == null) {
            throw new IllegalArgumentException("Item type is required");
        }
        UnitType unit = unitType != null ? unitType : UnitType.PCS;
        String id = codeGenerator.generate(CodePrefix.ITEM, itemRepository::existsById);
        Item created = itemRepository.save(ItemEntity.create(id, trimmed, itemType, unit)).toDomain();
        log.info("Registered {} {} ({})", itemType, id, created.getName());
        return created;
    }

    @Transactional
    public Item updateItem(String itemId, String name, UnitType unitType) {
        ItemEntity entity = itemRepository.findById(itemId)
                .orElseThrow(() -> new ResourceNotFoundException("Item", itemId));
        entity.rename(name != null ? requireName(name) : entity.getName(),
                unitType != null ? unitType : entity.getUnitType());
        return itemRepository.save(entity).toDomain();
    }

    @Transactional(readOnly = true)
    public Item getItem(String itemId) {
        return itemRepository.findById(itemId)
                .map(ItemEntity::toDomain)
                .orElseThrow(() -> new ResourceNotFoundException("Item", itemId));
    }

    @Transactional(readOnly = true)
    public PagedResult<Item> listItems(ItemType itemType, int offset, int limit) {
        Pageable pageable = PageRequests.of(offset, limit, Sort.by("name").ascending().and(Sort.by("id")));
        Page<ItemEntity> page = itemType == null
                ? itemRepository.findAll(pageable)
                : itemRepository.findByItemType(itemType, pageable);
        return PageRequests.toResult(page.map(ItemEntity::toDomain), offset, limit);
    }

    public BigDecimal unitCost(Item item) {
        return valuationService.unitCost(item);
    }

    @Transactional(readOnly = true)
    public ItemStockSummary getStockSummary(String itemId) {
        Item item = getItem(itemId);
        MovementTotals totals = stockLedgerService.totalsForItem(itemId);
        BigDecimal unitCost = valuationService.unitCost(item);
        BigDecimal value = Money.of(unitCost.multiply(BigDecimal.valueOf(item.getTotalQuantity())));
        return new ItemStockSummary(item.getId(), item.getName(), item.getItemType(), item.getUnitType(),
                totals.getQtyIn(), totals.getQtyOut(), item.getTotalQuantity(),
                item.getAvgPrice(), unitCost, value);
    }

    /**
     * Values stock at each item's reported unit cost.
     *
     * @param lowStockThreshold overrides the configured threshold when not null
     */
    @Transactional(readOnly = true)
    public InventoryValuation getValuation(Integer lowStockThreshold) {
        int threshold = lowStockThreshold != null ? lowStockThreshold : properties.getLowStockThreshold();
        if (threshold < 0) {
            throw new IllegalArgumentException("Low stock threshold must not be negative");
        }
        BigDecimal rawValue = Money.of(itemRepository.sumStockValueByItemType(ItemType.RAW_MATERIAL));
        BigDecimal finalValue = Money.of(
                properties.getFinalProductCostBasis() == InventoryProperties.CostBasis.STANDARD
                        ? itemRepository.sumStandardStockValueByItemType(ItemType.FINAL_PRODUCT)
                        : itemRepository.sumStockValueByItemType(ItemType.FINAL_PRODUCT));

        return InventoryValuation.builder()
                .rawMaterialValue(rawValue)
                .finalProductValue(finalValue)
                .totalValue(rawValue.add(finalValue))
                .rawMaterialCount(itemRepository.countByItemType(ItemType.RAW_MATERIAL))
                .finalProductCount(itemRepository.countByItemType(ItemType.FINAL_PRODUCT))
                .rawMaterialQuantity(itemRepository.sumQuantityByItemType(ItemType.RAW_MATERIAL))
                .finalProductQuantity(itemRepository.sumQuantityByItemType(ItemType.FINAL_PRODUCT))
                .lowStockThreshold(threshold)
                .lowStockItems(lowStock(threshold).stream().map(InventoryValuation.LowStockItem::from).toList())
                .build();
    }

    @Transactional(readOnly = true)
    public List<Item> lowStock(int threshold) {
        return itemRepository.findByTotalQuantityLessThanOrderByTotalQuantityAscNameAsc(threshold).stream()
                .map(ItemEntity::toDomain)
                .toList();
    }

    private static String requireName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Item name is required");
        }
        return name.trim();
    }
}

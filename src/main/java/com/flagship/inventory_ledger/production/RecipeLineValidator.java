package com.flagship.inventory_ledger.production;

import com.flagship.inventory_ledger.inventory.Item;
import com.flagship.inventory_ledger.inventory.ItemService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Shared checks for master recipes and batch snapshots.
 */
@Component
@RequiredArgsConstructor
class RecipeLineValidator {

    private final ItemService itemService;

    /**
     * Returns the lines with quantities rounded to the recipe scale.
     *
     * @throws IllegalArgumentException on an empty list, a non-positive quantity,
     *                                  a repeated raw item or an item that is not a raw material
     */
    List<RecipeLine> validate(List<RecipeLine> lines) {
        if (lines == null || lines.isEmpty()) {
            throw new IllegalArgumentException("At least one recipe item is required");
        }
        List<RecipeLine> normalized = new ArrayList<>(lines.size());
        Set<String> seen = new HashSet<>();
        for (RecipeLine line : lines) {
            if (line.getRawItemId() == null || line.getRawItemId().isBlank()) {
                throw new IllegalArgumentException("Raw item id is required on every recipe item");
            }
            RecipeLine rounded = RecipeLine.of(line.getRawItemId(), line.getQuantityPerUnit());
            if (rounded.getQuantityPerUnit() == null || rounded.getQuantityPerUnit().signum() <= 0) {
                throw new IllegalArgumentException(
                        "Quantity per unit must be greater than 0 for item " + line.getRawItemId());
            }
            if (!seen.add(line.getRawItemId())) {
                throw new IllegalArgumentException("Raw item listed more than once: " + line.getRawItemId());
            }
            Item item = itemService.getItem(line.getRawItemId());
            if (!item.isRawMaterial()) {
                throw new IllegalArgumentException(String.format(
                        "Item %s (%s) is not a raw material", item.getName(), item.getId()));
            }
            normalized.add(rounded);
        }
        return normalized;
    }

    /**
     * @throws IllegalArgumentException unless the item is a final product
     */
    Item requireFinalProduct(String finalProductId) {
        if (finalProductId == null || finalProductId.isBlank()) {
            throw new IllegalArgumentException("Final product id is required");
        }
        Item product = itemService.getItem(finalProductId);
        if (!product.isFinalProduct()) {
            throw new IllegalArgumentException(String.format(
                    "Item %s (%s) is not a final product", product.getName(), product.getId()));
        }
        return product;
    }
}

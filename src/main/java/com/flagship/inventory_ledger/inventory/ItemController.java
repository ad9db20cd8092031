package com.flagship.inventory_ledger.inventory;

import com.flagship.inventory_ledger.common.PagedResult;
import com.flagship.inventory_ledger.inventory.dto.CreateItemRequest;
import com.flagship.inventory_ledger.inventory.dto.ItemResponse;
import com.flagship.inventory_ledger.inventory.dto.UpdateItemRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/items")
@RequiredArgsConstructor
public class ItemController {

    private final ItemService itemService;

    @PostMapping
    public ResponseEntity<ItemResponse> createItem(@Valid @RequestBody CreateItemRequest request) {
        Item created = itemService.createItem(request.getName(), request.getItemType(), request.getUnitType());
        return ResponseEntity.status(HttpStatus.CREATED).body(toResponse(created));
    }

    @GetMapping
    public PagedResult<ItemResponse> listItems(
            @RequestParam(name = "item_type", required = false) ItemType itemType,
            @RequestParam(name = "offset", defaultValue = "0") int offset,
            @RequestParam(name = "limit", defaultValue = "50") int limit) {
        return itemService.listItems(itemType, offset, limit).map(this::toResponse);
    }

    @GetMapping("/valuation")
    public InventoryValuation getValuation(
            @RequestParam(name = "low_stock_threshold", required = false) Integer lowStockThreshold) {
        return itemService.getValuation(lowStockThreshold);
    }

    @GetMapping("/{id}")
    public ItemResponse getItem(@PathVariable("id") String id) {
        return toResponse(itemService.getItem(id));
    }

    @PutMapping("/{id}")
    public ItemResponse updateItem(@PathVariable("id") String id, @Valid @RequestBody UpdateItemRequest request) {
        return toResponse(itemService.updateItem(id, request.getName(), request.getUnitType()));
    }

    @GetMapping("/{id}/stock-summary")
    public ItemStockSummary getStockSummary(@PathVariable("id") String id) {
        return itemService.getStockSummary(id);
    }

    private ItemResponse toResponse(Item item) {
        return ItemResponse.from(item, itemService.unitCost(item));
    }
}

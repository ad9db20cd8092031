package com.flagship.inventory_ledger.production;

import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Master bill of materials for one final product.
 */
@Value
public class Recipe {
    String id;
    String finalProductId;
    String name;
    List<RecipeLine> lines;
    Instant createdAt;
    Instant updatedAt;
}

package com.flagship.inventory_ledger.exception;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

/**
 * Missing quantity of one item for a requested outgoing movement.
 */
@Value
public class Shortfall {

    @JsonProperty("item_id")
    String itemId;

    @JsonProperty("item_name")
    String itemName;

    @JsonProperty("required")
    long required;

    @JsonProperty("available")
    int available;

    public static Shortfall of(String itemId, String itemName, long required, int available) {
        return new Shortfall(itemId, itemName, required, available);
    }

    @JsonProperty("shortfall")
    public long getShortfall() {
        return Math.max(0, required - available);
    }
}

package com.flagship.inventory_ledger.production;

import lombok.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Raw material needed per unit of a final product.
 */
@Value
public class RecipeLine {

    public static final int QUANTITY_SCALE = 4;

    String rawItemId;
    BigDecimal quantityPerUnit;

    public static RecipeLine of(String rawItemId, BigDecimal quantityPerUnit) {
        return new RecipeLine(rawItemId,
                quantityPerUnit == null ? null : quantityPerUnit.setScale(QUANTITY_SCALE, RoundingMode.HALF_UP));
    }
}

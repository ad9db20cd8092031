package com.flagship.inventory_ledger.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Engine settings bound from the {@code inventory.*} namespace.
 */
@ConfigurationProperties(prefix = "inventory")
@Getter
@Setter
public class InventoryProperties {

    /**
     * Prefix every production serial number must carry.
     */
    private String serialPrefix = "LEH-";

    /**
     * Items with fewer units than this are reported as low stock.
     */
    private int lowStockThreshold = 10;

    /**
     * How many random codes to try before giving up on identifier generation.
     */
    private int codeMaxAttempts = 15;

    /**
     * Which unit cost final products report and are credited at on batch completion.
     */
    private CostBasis finalProductCostBasis = CostBasis.STANDARD;

    private int defaultPageSize = 50;

    public enum CostBasis {
        /** Recipe standard cost when one has been computed, otherwise the running average. */
        STANDARD,
        /** Always the running weighted average. */
        AVERAGE
    }
}

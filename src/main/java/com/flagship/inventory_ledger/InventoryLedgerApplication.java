package com.flagship.inventory_ledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class InventoryLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(InventoryLedgerApplication.class, args);
    }
}

package com.example.inventory;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Main application class for the Inventory Ledger service.
 */
@SpringBootApplication
@EnableScheduling
public class InventoryLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(InventoryLedgerApplication.class, args);
    }
}

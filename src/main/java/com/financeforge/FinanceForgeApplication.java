package com.financeforge;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.retry.annotation.EnableRetry;

/**
 * Main application class for FinanceForge.
 *
 * FinanceForge keeps an append-only, event-sourced ledger of credit account
 * balances and derives from it balance projections, reconciliation against
 * external statements, interest-arbitrage and payment-allocation plans,
 * financial phase classification and user-facing alerts.
 */
@SpringBootApplication
@EnableRetry
public class FinanceForgeApplication {

    public static void main(String[] args) {
        SpringApplication.run(FinanceForgeApplication.class, args);
    }
}

package com.flagship.procurement_ledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ProcurementLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(ProcurementLedgerApplication.class, args);
    }
}

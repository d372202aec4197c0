package com.trustledger.ledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = {"com.trustledger.ledger", "com.trustledger.common"})
public class TrustLedgerServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(TrustLedgerServiceApplication.class, args);
    }
}

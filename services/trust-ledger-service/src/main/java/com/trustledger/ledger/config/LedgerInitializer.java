package com.trustledger.ledger.config;

import com.trustledger.ledger.execution.LedgerExecutor;
import com.trustledger.ledger.execution.NativeValueLedger;
import com.trustledger.ledger.service.AccessControlService;
import com.trustledger.ledger.service.FeeTreasuryService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Writes the initial owner, treasury settings and genesis balances on first start, as one unit:
 * if any step fails nothing is written and the next start tries again.
 * A ledger that already has an owner is left as it is.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LedgerInitializer implements ApplicationRunner {

    private final LedgerProperties properties;
    private final AccessControlService accessControlService;
    private final FeeTreasuryService feeTreasuryService;
    private final NativeValueLedger nativeValueLedger;
    private final LedgerExecutor executor;

    @Override
    public void run(ApplicationArguments args) {
        initialize();
    }

    public void initialize() {
        executor.run("initialize", () -> {
            if (!accessControlService.initializeOwner(properties.getInitialOwner())) {
                log.info("Ledger already initialized, owner={}", accessControlService.owner());
                return;
            }
            feeTreasuryService.initialize(properties.getTreasuryAccount(), properties.getInitialStorageFee());
            properties.getGenesisBalances().forEach(nativeValueLedger::credit);
            log.info("Ledger initialized: owner={} treasury={} storageFee={} genesisAccounts={}",
                    properties.getInitialOwner(), properties.getTreasuryAccount(),
                    properties.getInitialStorageFee(), properties.getGenesisBalances().size());
        });
    }
}

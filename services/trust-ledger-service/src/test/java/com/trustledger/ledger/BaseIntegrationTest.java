package com.trustledger.ledger;

import com.trustledger.ledger.config.LedgerInitializer;
import com.trustledger.ledger.execution.NativeValueLedger;
import com.trustledger.ledger.repository.*;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.math.BigInteger;

/**
 * Base class for tests that run ledger operations against the in-memory database.
 *
 * <p>Not transactional: every operation commits or rolls back on its own, as it does in
 * production. Each test starts from a freshly initialized ledger.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.NONE)
@ActiveProfiles("test")
public abstract class BaseIntegrationTest {

    protected static final String OWNER = "0x00000000000000000000000000000000000000a1";
    protected static final String TREASURY = "0x00000000000000000000000000000000000000f1";
    protected static final String ALICE = "0x00000000000000000000000000000000000000c1";
    protected static final String BOB = "0x00000000000000000000000000000000000000c2";
    protected static final String CAROL = "0x00000000000000000000000000000000000000c3";
    protected static final BigInteger STORAGE_FEE = BigInteger.valueOf(100);
    protected static final BigInteger GENESIS_BALANCE = BigInteger.valueOf(10_000);

    @Autowired protected LedgerEventRecordRepository eventRecordRepository;
    @Autowired protected AccountIndexEntryRepository accountIndexEntryRepository;
    @Autowired protected AttestationDocumentRepository documentRepository;
    @Autowired protected RegistryItemRepository itemRepository;
    @Autowired protected RoleGrantRepository roleGrantRepository;
    @Autowired protected LedgerOwnershipRepository ownershipRepository;
    @Autowired protected TreasurySettingsRepository settingsRepository;
    @Autowired protected LedgerSequenceRepository sequenceRepository;
    @Autowired protected NativeBalanceRepository balanceRepository;
    @Autowired protected NativeValueLedger nativeValueLedger;
    @Autowired protected LedgerInitializer ledgerInitializer;

    @BeforeEach
    void resetLedger() {
        nativeValueLedger.clearHooks();

        eventRecordRepository.deleteAllInBatch();
        accountIndexEntryRepository.deleteAllInBatch();
        documentRepository.deleteAll();
        itemRepository.deleteAllInBatch();
        roleGrantRepository.deleteAllInBatch();
        ownershipRepository.deleteAllInBatch();
        settingsRepository.deleteAllInBatch();
        sequenceRepository.deleteAllInBatch();
        balanceRepository.deleteAllInBatch();

        ledgerInitializer.initialize();
    }

    protected long eventCount(String eventType) {
        return eventRecordRepository.findByEventTypeOrderBySequenceAsc(eventType).size();
    }
}

package com.trustledger.ledger.service;

import com.trustledger.ledger.domain.AccountIndexEntry;
import com.trustledger.ledger.domain.AccountIndexType;
import com.trustledger.ledger.repository.AccountIndexEntryRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

@Component
@RequiredArgsConstructor
class AccountIndexService {

    private final AccountIndexEntryRepository entryRepository;
    private final Clock clock;

    void append(AccountIndexType type, String account, long targetId) {
        entryRepository.save(AccountIndexEntry.builder()
                .indexType(type)
                .account(account)
                .targetId(targetId)
                .recordedAt(Instant.now(clock))
                .build());
    }

    List<Long> idsFor(AccountIndexType type, String account) {
        return entryRepository.findTargetIds(type, account);
    }
}

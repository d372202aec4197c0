package com.trustledger.ledger.service;

import com.trustledger.ledger.domain.LedgerSequence;
import com.trustledger.ledger.domain.SequenceName;
import com.trustledger.ledger.repository.LedgerSequenceRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Hands out item and document ids. Allocation happens inside the running ledger operation,
 * so a rolled back operation also gives its id back.
 */
@Component
@RequiredArgsConstructor
class SequenceAllocator {

    private final LedgerSequenceRepository sequenceRepository;

    long next(SequenceName name) {
        LedgerSequence sequence = sequenceRepository.findById(name)
                .orElseGet(() -> new LedgerSequence(name));
        long value = sequence.allocate();
        sequenceRepository.save(sequence);
        return value;
    }

    long peek(SequenceName name) {
        return sequenceRepository.findById(name)
                .map(LedgerSequence::getNextValue)
                .orElse(name.getFirstValue());
    }
}

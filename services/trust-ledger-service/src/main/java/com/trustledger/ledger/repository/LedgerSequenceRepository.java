package com.trustledger.ledger.repository;

import com.trustledger.ledger.domain.LedgerSequence;
import com.trustledger.ledger.domain.SequenceName;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface LedgerSequenceRepository extends JpaRepository<LedgerSequence, SequenceName> {
}

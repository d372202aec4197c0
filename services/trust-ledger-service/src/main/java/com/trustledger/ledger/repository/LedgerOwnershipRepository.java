package com.trustledger.ledger.repository;

import com.trustledger.ledger.domain.LedgerOwnership;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface LedgerOwnershipRepository extends JpaRepository<LedgerOwnership, Long> {
}

package com.trustledger.ledger.repository;

import com.trustledger.ledger.domain.TreasurySettings;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface TreasurySettingsRepository extends JpaRepository<TreasurySettings, Long> {
}

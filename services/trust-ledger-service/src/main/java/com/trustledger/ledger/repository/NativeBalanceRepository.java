package com.trustledger.ledger.repository;

import com.trustledger.ledger.domain.NativeBalance;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface NativeBalanceRepository extends JpaRepository<NativeBalance, String> {
}

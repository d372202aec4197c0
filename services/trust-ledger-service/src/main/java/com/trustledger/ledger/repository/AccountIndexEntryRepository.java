package com.trustledger.ledger.repository;

import com.trustledger.ledger.domain.AccountIndexEntry;
import com.trustledger.ledger.domain.AccountIndexType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface AccountIndexEntryRepository extends JpaRepository<AccountIndexEntry, Long> {

    @Query("SELECT e.targetId FROM AccountIndexEntry e " +
           "WHERE e.indexType = :indexType AND e.account = :account ORDER BY e.id ASC")
    List<Long> findTargetIds(@Param("indexType") AccountIndexType indexType, @Param("account") String account);
}

package com.trustledger.ledger.repository;

import com.trustledger.ledger.domain.RegistryItem;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface RegistryItemRepository extends JpaRepository<RegistryItem, Long> {
}

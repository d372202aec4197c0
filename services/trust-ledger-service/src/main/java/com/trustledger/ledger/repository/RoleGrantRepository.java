package com.trustledger.ledger.repository;

import com.trustledger.ledger.domain.LedgerRole;
import com.trustledger.ledger.domain.RoleGrant;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface RoleGrantRepository extends JpaRepository<RoleGrant, Long> {

    Optional<RoleGrant> findByAccountAndRole(String account, LedgerRole role);

    boolean existsByAccountAndRoleAndGrantedTrue(String account, LedgerRole role);

    List<RoleGrant> findByAccountAndGrantedTrue(String account);
}

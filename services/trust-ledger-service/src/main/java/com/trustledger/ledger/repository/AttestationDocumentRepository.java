package com.trustledger.ledger.repository;

import com.trustledger.ledger.domain.AttestationDocument;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface AttestationDocumentRepository extends JpaRepository<AttestationDocument, Long> {
}

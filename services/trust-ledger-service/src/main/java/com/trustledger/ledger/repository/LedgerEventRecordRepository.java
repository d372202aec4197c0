package com.trustledger.ledger.repository;

import com.trustledger.ledger.domain.LedgerEventRecord;
import com.trustledger.ledger.domain.LedgerSubject;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface LedgerEventRecordRepository extends JpaRepository<LedgerEventRecord, Long> {

    List<LedgerEventRecord> findBySubjectTypeAndSubjectIdOrderBySequenceAsc(LedgerSubject subjectType, String subjectId);

    List<LedgerEventRecord> findByEventTypeOrderBySequenceAsc(String eventType);

    List<LedgerEventRecord> findAllByOrderBySequenceAsc();
}

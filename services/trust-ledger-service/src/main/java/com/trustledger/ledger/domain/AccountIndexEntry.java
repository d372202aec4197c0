package com.trustledger.ledger.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Append-only reverse index row: an account is associated with an item or document id.
 * Discovery only; the entity tables stay authoritative.
 */
@Entity
@Table(name = "account_index_entries", indexes = {
        @Index(name = "idx_account_index_lookup", columnList = "index_type, account")
})
@Getter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AccountIndexEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "index_type", nullable = false, updatable = false, length = 30)
    @Enumerated(EnumType.STRING)
    private AccountIndexType indexType;

    @Column(name = "account", nullable = false, updatable = false, length = 128)
    private String account;

    @Column(name = "target_id", nullable = false, updatable = false)
    private Long targetId;

    @Column(name = "recorded_at", nullable = false, updatable = false)
    private Instant recordedAt;
}

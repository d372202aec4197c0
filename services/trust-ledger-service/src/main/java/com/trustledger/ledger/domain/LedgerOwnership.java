package com.trustledger.ledger.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

/**
 * Single-row record of the ledger owner. Kept apart from {@link RoleGrant} so ownership
 * transfer and role administration never touch each other's state.
 */
@Entity
@Table(name = "ledger_ownership")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class LedgerOwnership {

    public static final long SINGLETON_ID = 1L;

    @Id
    private Long id;

    @Column(name = "owner", nullable = false, length = 128)
    private String owner;

    @Column(name = "transferred_at", nullable = false)
    private Instant transferredAt;

    @Version
    private Long version;
}

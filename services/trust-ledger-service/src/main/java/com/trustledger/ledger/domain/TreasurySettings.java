package com.trustledger.ledger.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigInteger;
import java.time.Instant;

/**
 * Fee parameters of the treasury. The accumulated balance itself lives in the native value
 * ledger under {@link #treasuryAccount}.
 */
@Entity
@Table(name = "treasury_settings")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TreasurySettings {

    public static final long SINGLETON_ID = 1L;

    @Id
    private Long id;

    @Column(name = "treasury_account", nullable = false, length = 128)
    private String treasuryAccount;

    @Column(name = "storage_fee", nullable = false, precision = 38, scale = 0)
    private BigInteger storageFee;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    private Long version;
}

package com.trustledger.ledger.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

@Entity
@Table(name = "role_grants",
        uniqueConstraints = @UniqueConstraint(name = "uk_role_grants_account_role", columnNames = {"account", "role"}),
        indexes = @Index(name = "idx_role_grants_account", columnList = "account"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RoleGrant {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "account", nullable = false, length = 128)
    private String account;

    @Column(name = "role", nullable = false, length = 20)
    @Enumerated(EnumType.STRING)
    private LedgerRole role;

    @Column(name = "granted", nullable = false)
    private boolean granted;

    @Column(name = "changed_by", nullable = false, length = 128)
    private String changedBy;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    private Long version;
}

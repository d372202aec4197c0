package com.trustledger.ledger.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Entity
@Table(name = "registry_items", indexes = {
        @Index(name = "idx_registry_items_submitter", columnList = "submitter"),
        @Index(name = "idx_registry_items_category", columnList = "category")
})
@Getter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RegistryItem {

    public static final int MAX_URI_LENGTH = 2048;
    public static final int MAX_CATEGORY_LENGTH = 256;

    @Id
    private Long id;

    @Column(name = "submitter", nullable = false, updatable = false, length = 128)
    private String submitter;

    @Column(name = "uri", nullable = false, updatable = false, length = MAX_URI_LENGTH)
    private String uri;

    @Column(name = "category", nullable = false, updatable = false, length = MAX_CATEGORY_LENGTH)
    private String category;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "verified", nullable = false)
    @Builder.Default
    private boolean verified = false;

    @Column(name = "active", nullable = false)
    @Builder.Default
    private boolean active = true;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @Version
    private Long version;

    /**
     * Curator moderation overwrites both flags, whatever they held before.
     */
    public void moderate(boolean verified, boolean active, Instant at) {
        this.verified = verified;
        this.active = active;
        this.updatedAt = at;
    }

    public void deactivate(Instant at) {
        this.active = false;
        this.updatedAt = at;
    }

    public boolean isSubmittedBy(String account) {
        return submitter.equals(account);
    }
}

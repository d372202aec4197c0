package com.trustledger.ledger.domain;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Entity
@Table(name = "ledger_sequences")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class LedgerSequence {

    @Id
    @Column(name = "name", length = 40)
    @Enumerated(EnumType.STRING)
    private SequenceName name;

    @Column(name = "next_value", nullable = false)
    private long nextValue;

    @Version
    private Long version;

    public LedgerSequence(SequenceName name) {
        this.name = name;
        this.nextValue = name.getFirstValue();
    }

    /**
     * Hands out the current value and advances. Values are never handed out twice.
     */
    public long allocate() {
        return nextValue++;
    }
}

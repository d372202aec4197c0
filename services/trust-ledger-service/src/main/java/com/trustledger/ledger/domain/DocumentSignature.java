package com.trustledger.ledger.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Embeddable
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class DocumentSignature {

    @Column(name = "signer", nullable = false, length = 128)
    private String signer;

    @Column(name = "signed_at", nullable = false)
    private Instant signedAt;
}

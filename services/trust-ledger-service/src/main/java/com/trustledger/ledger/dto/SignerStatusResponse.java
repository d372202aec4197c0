package com.trustledger.ledger.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SignerStatusResponse {
    private long documentId;
    private String account;
    private boolean requiredSigner;
    private boolean signed;
}

package com.trustledger.ledger.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TreasuryResponse {
    private String treasuryAccount;
    private BigInteger storageFee;
    private BigInteger balance;
}

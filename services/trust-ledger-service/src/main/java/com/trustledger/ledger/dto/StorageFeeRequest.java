package com.trustledger.ledger.dto;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class StorageFeeRequest {

    @NotNull(message = "storageFee is required")
    private BigInteger storageFee;
}

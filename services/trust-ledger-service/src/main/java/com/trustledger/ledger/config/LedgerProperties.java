package com.trustledger.ledger.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Initial ledger state, applied once when the ledger database is empty.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "trust-ledger")
public class LedgerProperties {

    /**
     * Account that becomes owner and first ADMIN.
     */
    @NotBlank
    private String initialOwner;

    /**
     * Native account that holds collected storage fees.
     */
    @NotBlank
    private String treasuryAccount;

    @NotNull
    @PositiveOrZero
    private BigInteger initialStorageFee = BigInteger.ZERO;

    /**
     * Native balances credited at initialization, keyed by account.
     */
    private Map<String, @PositiveOrZero BigInteger> genesisBalances = new LinkedHashMap<>();
}

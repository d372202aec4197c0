package com.trustledger.ledger.domain;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigInteger;

/**
 * Native value held by an account in the execution environment.
 */
@Entity
@Table(name = "native_balances")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class NativeBalance {

    @Id
    @Column(name = "account", length = 128)
    private String account;

    @Column(name = "balance", nullable = false, precision = 38, scale = 0)
    private BigInteger balance;

    @Version
    private Long version;

    public NativeBalance(String account) {
        this.account = account;
        this.balance = BigInteger.ZERO;
    }

    public void credit(BigInteger amount) {
        balance = balance.add(amount);
    }

    public void debit(BigInteger amount) {
        balance = balance.subtract(amount);
    }

    public boolean covers(BigInteger amount) {
        return balance.compareTo(amount) >= 0;
    }
}

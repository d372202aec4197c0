package com.trustledger.ledger.service;

import com.trustledger.common.exception.ErrorCode;
import com.trustledger.common.exception.ValidationException;
import com.trustledger.ledger.domain.LedgerOwnership;
import com.trustledger.ledger.domain.TreasurySettings;
import com.trustledger.ledger.dto.TreasuryResponse;
import com.trustledger.ledger.dto.WithdrawalResponse;
import com.trustledger.ledger.execution.Accounts;
import com.trustledger.ledger.execution.LedgerExecutor;
import com.trustledger.ledger.execution.ReentrancyGuard;
import com.trustledger.ledger.execution.ValueTransferGateway;
import com.trustledger.ledger.repository.TreasurySettingsRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;

/**
 * Storage fee parameter and the value collected from document creators.
 *
 * <p>The collected balance is held by the value gateway under the treasury account; this
 * service keeps no separate counter of it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FeeTreasuryService {

    private final TreasurySettingsRepository settingsRepository;
    private final AccessControlService accessControlService;
    private final ValueTransferGateway valueTransferGateway;
    private final ReentrancyGuard reentrancyGuard;
    private final LedgerExecutor executor;
    private final Clock clock;

    /**
     * Creates the treasury settings. Has no effect once they exist.
     */
    public boolean initialize(String treasuryAccount, BigInteger initialStorageFee) {
        return executor.execute("initializeTreasury", () -> {
            if (settingsRepository.existsById(TreasurySettings.SINGLETON_ID)) {
                return false;
            }
            if (!Accounts.isValid(treasuryAccount)) {
                throw new ValidationException(ErrorCode.ACCESS_INVALID_ACCOUNT, "Treasury account must be set");
            }
            BigInteger fee = requireFee(initialStorageFee);
            settingsRepository.save(TreasurySettings.builder()
                    .id(TreasurySettings.SINGLETON_ID)
                    .treasuryAccount(treasuryAccount.trim())
                    .storageFee(fee)
                    .updatedAt(Instant.now(clock))
                    .build());
            log.info("Treasury initialized: account={} storageFee={}", treasuryAccount, fee);
            return true;
        });
    }

    /**
     * Sets the fee for documents created from now on.
     */
    public void setStorageFee(String caller, BigInteger newFee) {
        String sender = Accounts.requireCaller(caller);
        executor.run("setStorageFee", () -> {
            accessControlService.requireOwner(sender);
            BigInteger fee = requireFee(newFee);

            TreasurySettings settings = settings();
            BigInteger previousFee = settings.getStorageFee();
            settings.setStorageFee(fee);
            settings.setUpdatedAt(Instant.now(clock));
            settingsRepository.save(settings);

            log.info("Storage fee updated: previousFee={} newFee={} owner={}", previousFee, fee, sender);
        });
    }

    /**
     * Sends the whole treasury balance to the owner. If the owner refuses the transfer the call
     * fails and the balance stays in the treasury.
     */
    public WithdrawalResponse withdrawFees(String caller) {
        String sender = Accounts.requireCaller(caller);
        return executor.execute("withdrawFees", () -> reentrancyGuard.guard("withdrawFees", () -> {
            LedgerOwnership ownership = accessControlService.requireOwner(sender);
            String treasuryAccount = settings().getTreasuryAccount();
            BigInteger amount = valueTransferGateway.balanceOf(treasuryAccount);

            valueTransferGateway.transfer(treasuryAccount, ownership.getOwner(), amount);

            log.info("Fees withdrawn: owner={} amount={}", ownership.getOwner(), amount);
            return WithdrawalResponse.builder()
                    .recipient(ownership.getOwner())
                    .amount(amount)
                    .build();
        }));
    }

    /**
     * Moves a creation fee from the payer into the treasury. Runs inside the caller's operation.
     */
    public void collect(String payer, BigInteger amount) {
        valueTransferGateway.transfer(payer, settings().getTreasuryAccount(), amount);
        log.debug("Fee collected: payer={} amount={}", payer, amount);
    }

    @Transactional(readOnly = true)
    public BigInteger storageFee() {
        return settings().getStorageFee();
    }

    @Transactional(readOnly = true)
    public BigInteger balance() {
        return valueTransferGateway.balanceOf(settings().getTreasuryAccount());
    }

    @Transactional(readOnly = true)
    public TreasuryResponse treasury() {
        TreasurySettings settings = settings();
        return TreasuryResponse.builder()
                .treasuryAccount(settings.getTreasuryAccount())
                .storageFee(settings.getStorageFee())
                .balance(valueTransferGateway.balanceOf(settings.getTreasuryAccount()))
                .build();
    }

    private TreasurySettings settings() {
        return settingsRepository.findById(TreasurySettings.SINGLETON_ID)
                .orElseThrow(() -> new IllegalStateException("Treasury has not been initialized"));
    }

    private static BigInteger requireFee(BigInteger fee) {
        if (fee == null || fee.signum() < 0) {
            throw new ValidationException(ErrorCode.FEE_INVALID_AMOUNT, "Storage fee must not be negative: " + fee);
        }
        return fee;
    }
}

package com.trustledger.ledger.execution;

import com.trustledger.common.exception.ErrorCode;
import com.trustledger.common.exception.ValidationException;
import com.trustledger.ledger.domain.NativeBalance;
import com.trustledger.ledger.exception.TransferRejectedException;
import com.trustledger.ledger.repository.NativeBalanceRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigInteger;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Account balances of the execution environment. Balances are rows in the ledger database, so
 * a transfer made inside a ledger operation rolls back with it.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class NativeValueLedger implements ValueTransferGateway {

    private final NativeBalanceRepository balanceRepository;
    private final List<TransferRecipientHook> recipientHooks = new CopyOnWriteArrayList<>();

    @Override
    @Transactional(readOnly = true)
    public BigInteger balanceOf(String account) {
        return balanceRepository.findById(account)
                .map(NativeBalance::getBalance)
                .orElse(BigInteger.ZERO);
    }

    @Override
    public void transfer(String from, String to, BigInteger amount) {
        requireNonNegative(amount);

        NativeBalance sender = balanceRepository.findById(from).orElseGet(() -> new NativeBalance(from));
        if (!sender.covers(amount)) {
            throw new TransferRejectedException(ErrorCode.EXEC_INSUFFICIENT_BALANCE,
                    String.format("Account %s holds %s, cannot transfer %s", from, sender.getBalance(), amount));
        }
        sender.debit(amount);
        balanceRepository.save(sender);

        NativeBalance recipient = balanceRepository.findById(to).orElseGet(() -> new NativeBalance(to));
        recipient.credit(amount);
        balanceRepository.save(recipient);

        log.debug("Native transfer: from={} to={} amount={}", from, to, amount);

        for (TransferRecipientHook hook : recipientHooks) {
            hook.onValueReceived(from, to, amount);
        }
    }

    /**
     * Credits newly issued value to an account, as the environment does for genesis balances.
     */
    @Transactional
    public void credit(String account, BigInteger amount) {
        requireNonNegative(amount);
        NativeBalance balance = balanceRepository.findById(account).orElseGet(() -> new NativeBalance(account));
        balance.credit(amount);
        balanceRepository.save(balance);
        log.info("Native value credited: account={} amount={}", account, amount);
    }

    public void registerHook(TransferRecipientHook hook) {
        recipientHooks.add(hook);
    }

    public void clearHooks() {
        recipientHooks.clear();
    }

    private static void requireNonNegative(BigInteger amount) {
        if (amount == null || amount.signum() < 0) {
            throw new ValidationException(ErrorCode.FEE_INVALID_AMOUNT, "Amount must not be negative: " + amount);
        }
    }
}

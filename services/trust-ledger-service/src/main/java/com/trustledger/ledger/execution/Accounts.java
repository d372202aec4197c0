package com.trustledger.ledger.execution;

import com.trustledger.common.exception.ErrorCode;
import com.trustledger.common.exception.ValidationException;

import java.util.regex.Pattern;

/**
 * Account identity helpers.
 */
public final class Accounts {

    /** The all-zero address; never a valid owner, grantee or signer. */
    public static final String NULL_IDENTITY = "0x0000000000000000000000000000000000000000";

    /** Longest identity the ledger stores. */
    public static final int MAX_LENGTH = 128;

    private static final Pattern ZERO_ADDRESS = Pattern.compile("^0[xX]0+$");

    private Accounts() {
    }

    public static boolean isNullIdentity(String account) {
        return account == null || account.isBlank() || ZERO_ADDRESS.matcher(account.trim()).matches();
    }

    /**
     * @return true if the account is a non-null identity that fits in storage
     */
    public static boolean isValid(String account) {
        return !isNullIdentity(account) && account.trim().length() <= MAX_LENGTH;
    }

    /**
     * @return the account trimmed, or null for null
     */
    public static String normalize(String account) {
        return account != null ? account.trim() : null;
    }

    /**
     * @return the caller identity, trimmed
     * @throws ValidationException if the environment supplied no usable identity
     */
    public static String requireCaller(String caller) {
        if (isNullIdentity(caller)) {
            throw new ValidationException(ErrorCode.EXEC_MISSING_CALLER);
        }
        String trimmed = caller.trim();
        if (trimmed.length() > MAX_LENGTH) {
            throw new ValidationException(ErrorCode.EXEC_INVALID_CALLER);
        }
        return trimmed;
    }
}

package com.trustledger.ledger.execution;

import com.trustledger.common.exception.ErrorCode;
import com.trustledger.common.exception.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.*;

@DisplayName("Accounts Tests")
class AccountsTest {

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"  ", "0x0", "0X0000", Accounts.NULL_IDENTITY})
    @DisplayName("Should treat blank and all-zero identities as null")
    void shouldDetectNullIdentity(String account) {
        assertThat(Accounts.isNullIdentity(account)).isTrue();
    }

    @Test
    @DisplayName("Should accept a regular identity")
    void shouldAcceptRegularIdentity() {
        assertThat(Accounts.isNullIdentity("0x5aaeb6053f3e94c9b9a09f33669435e7ef1beaed")).isFalse();
        assertThat(Accounts.requireCaller(" 0x01 ")).isEqualTo("0x01");
    }

    @Test
    @DisplayName("Should reject a missing caller")
    void shouldRejectMissingCaller() {
        assertThatThrownBy(() -> Accounts.requireCaller(null))
                .isInstanceOf(ValidationException.class)
                .extracting(e -> ((ValidationException) e).getErrorCode())
                .isEqualTo(ErrorCode.EXEC_MISSING_CALLER);
    }

    @Test
    @DisplayName("Should bound identities by length after trimming")
    void shouldBoundIdentityLength() {
        String atLimit = "0x" + "a".repeat(Accounts.MAX_LENGTH - 2);

        assertThat(Accounts.isValid(" " + atLimit + " ")).isTrue();
        assertThat(Accounts.isValid(atLimit + "a")).isFalse();
        assertThat(Accounts.requireCaller(atLimit)).isEqualTo(atLimit);
        assertThatThrownBy(() -> Accounts.requireCaller(atLimit + "a"))
                .isInstanceOf(ValidationException.class)
                .extracting(e -> ((ValidationException) e).getErrorCode())
                .isEqualTo(ErrorCode.EXEC_INVALID_CALLER);
    }
}

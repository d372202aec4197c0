package com.trustledger.ledger.service;

import com.trustledger.common.exception.BusinessException;
import com.trustledger.common.exception.ErrorCode;
import com.trustledger.common.exception.FailureCategory;
import com.trustledger.ledger.BaseIntegrationTest;
import com.trustledger.ledger.domain.LedgerRole;
import com.trustledger.ledger.domain.LedgerSubject;
import com.trustledger.ledger.dto.LedgerEventResponse;
import com.trustledger.ledger.event.LedgerEventLog;
import com.trustledger.ledger.execution.Accounts;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("AccessControlService Tests")
class AccessControlServiceTest extends BaseIntegrationTest {

    @Autowired
    private AccessControlService accessControlService;

    @Autowired
    private LedgerEventLog eventLog;

    @Nested
    @DisplayName("Initialization")
    class InitializationTests {

        @Test
        @DisplayName("Should install owner holding ADMIN and record both events")
        void shouldInstallOwnerWithAdmin() {
            assertThat(accessControlService.owner()).isEqualTo(OWNER);
            assertThat(accessControlService.hasRole(OWNER, LedgerRole.ADMIN)).isTrue();
            assertThat(accessControlService.hasRole(OWNER, LedgerRole.CURATOR)).isFalse();

            List<LedgerEventResponse> events = eventLog.eventsFor(LedgerSubject.ACCOUNT, OWNER);
            assertThat(events).extracting(LedgerEventResponse::getEventType)
                    .containsExactly("OwnershipTransferredEvent", "RoleGrantedEvent");
            assertThat(events.get(0).getPayload()).contains(Accounts.NULL_IDENTITY);
        }

        @Test
        @DisplayName("Should leave an initialized ledger untouched")
        void shouldNotReinitialize() {
            accessControlService.transferOwnership(OWNER, ALICE);

            boolean installed = accessControlService.initializeOwner(BOB);

            assertThat(installed).isFalse();
            assertThat(accessControlService.owner()).isEqualTo(ALICE);
        }
    }

    @Nested
    @DisplayName("Role Administration")
    class RoleTests {

        @Test
        @DisplayName("Should grant and revoke a role as ADMIN")
        void shouldGrantAndRevoke() {
            // Act
            accessControlService.grantRole(OWNER, ALICE, LedgerRole.CURATOR);

            // Assert
            assertThat(accessControlService.hasRole(ALICE, LedgerRole.CURATOR)).isTrue();
            assertThat(accessControlService.rolesOf(ALICE)).containsExactly(LedgerRole.CURATOR);

            accessControlService.revokeRole(OWNER, ALICE, LedgerRole.CURATOR);

            assertThat(accessControlService.hasRole(ALICE, LedgerRole.CURATOR)).isFalse();
            assertThat(eventCount("RoleGrantedEvent")).isEqualTo(2);
            assertThat(eventCount("RoleRevokedEvent")).isEqualTo(1);
        }

        @Test
        @DisplayName("Should reject role changes by a non-ADMIN")
        void shouldRejectNonAdmin() {
            assertThatThrownBy(() -> accessControlService.grantRole(ALICE, BOB, LedgerRole.CURATOR))
                    .isInstanceOf(BusinessException.class)
                    .satisfies(e -> {
                        BusinessException be = (BusinessException) e;
                        assertThat(be.getErrorCode()).isEqualTo(ErrorCode.ACCESS_NOT_ADMIN);
                        assertThat(be.getCategory()).isEqualTo(FailureCategory.UNAUTHORIZED);
                    });
            assertThat(accessControlService.hasRole(BOB, LedgerRole.CURATOR)).isFalse();
        }

        @Test
        @DisplayName("Should reject granting a held role")
        void shouldRejectDuplicateGrant() {
            accessControlService.grantRole(OWNER, ALICE, LedgerRole.CURATOR);

            assertThatThrownBy(() -> accessControlService.grantRole(OWNER, ALICE, LedgerRole.CURATOR))
                    .isInstanceOf(BusinessException.class)
                    .extracting(e -> ((BusinessException) e).getErrorCode())
                    .isEqualTo(ErrorCode.ACCESS_ROLE_ALREADY_GRANTED);
            assertThat(eventCount("RoleGrantedEvent")).isEqualTo(2);
        }

        @Test
        @DisplayName("Should reject revoking a role that is not held")
        void shouldRejectRevokeOfUnsetRole() {
            assertThatThrownBy(() -> accessControlService.revokeRole(OWNER, ALICE, LedgerRole.CURATOR))
                    .isInstanceOf(BusinessException.class)
                    .extracting(e -> ((BusinessException) e).getErrorCode())
                    .isEqualTo(ErrorCode.ACCESS_ROLE_NOT_GRANTED);
        }

        @Test
        @DisplayName("Should store grants under the trimmed account")
        void shouldTrimGrantee() {
            accessControlService.grantRole(OWNER, "  " + ALICE + " ", LedgerRole.CURATOR);

            assertThat(accessControlService.hasRole(ALICE, LedgerRole.CURATOR)).isTrue();
            assertThat(accessControlService.rolesOf(ALICE)).containsExactly(LedgerRole.CURATOR);
            assertThatThrownBy(() -> accessControlService.grantRole(OWNER, ALICE, LedgerRole.CURATOR))
                    .isInstanceOf(BusinessException.class)
                    .extracting(e -> ((BusinessException) e).getErrorCode())
                    .isEqualTo(ErrorCode.ACCESS_ROLE_ALREADY_GRANTED);

            accessControlService.revokeRole(OWNER, " " + ALICE, LedgerRole.CURATOR);

            assertThat(accessControlService.hasRole(ALICE, LedgerRole.CURATOR)).isFalse();
        }

        @Test
        @DisplayName("Should reject an account or caller longer than an identity")
        void shouldRejectOverLongIdentity() {
            String longAccount = "0x" + "c".repeat(Accounts.MAX_LENGTH);

            assertThatThrownBy(() -> accessControlService.grantRole(OWNER, longAccount, LedgerRole.CURATOR))
                    .isInstanceOf(BusinessException.class)
                    .extracting(e -> ((BusinessException) e).getErrorCode())
                    .isEqualTo(ErrorCode.ACCESS_INVALID_ACCOUNT);
            assertThatThrownBy(() -> accessControlService.grantRole(longAccount, ALICE, LedgerRole.CURATOR))
                    .isInstanceOf(BusinessException.class)
                    .extracting(e -> ((BusinessException) e).getErrorCode())
                    .isEqualTo(ErrorCode.EXEC_INVALID_CALLER);
            assertThat(eventCount("RoleGrantedEvent")).isEqualTo(1);
        }

        @Test
        @DisplayName("Should reject granting to the null identity")
        void shouldRejectNullAccount() {
            assertThatThrownBy(() -> accessControlService.grantRole(OWNER, Accounts.NULL_IDENTITY, LedgerRole.ADMIN))
                    .isInstanceOf(BusinessException.class)
                    .extracting(e -> ((BusinessException) e).getErrorCode())
                    .isEqualTo(ErrorCode.ACCESS_INVALID_ACCOUNT);
        }

        @Test
        @DisplayName("Should keep ownership when the owner loses ADMIN")
        void shouldKeepOwnershipOnAdminRevoke() {
            accessControlService.revokeRole(OWNER, OWNER, LedgerRole.ADMIN);

            assertThat(accessControlService.owner()).isEqualTo(OWNER);
            assertThatThrownBy(() -> accessControlService.grantRole(OWNER, ALICE, LedgerRole.CURATOR))
                    .isInstanceOf(BusinessException.class)
                    .extracting(e -> ((BusinessException) e).getErrorCode())
                    .isEqualTo(ErrorCode.ACCESS_NOT_ADMIN);
        }
    }

    @Nested
    @DisplayName("Ownership")
    class OwnershipTests {

        @Test
        @DisplayName("Should transfer ownership without touching role grants")
        void shouldTransferOwnership() {
            accessControlService.transferOwnership(OWNER, ALICE);

            assertThat(accessControlService.owner()).isEqualTo(ALICE);
            assertThat(accessControlService.hasRole(OWNER, LedgerRole.ADMIN)).isTrue();
            assertThat(accessControlService.hasRole(ALICE, LedgerRole.ADMIN)).isFalse();
            assertThat(eventCount("OwnershipTransferredEvent")).isEqualTo(2);
        }

        @Test
        @DisplayName("Should store the new owner trimmed")
        void shouldTrimNewOwner() {
            accessControlService.transferOwnership(OWNER, " " + ALICE + "\t");

            assertThat(accessControlService.owner()).isEqualTo(ALICE);
            accessControlService.transferOwnership(ALICE, BOB);
            assertThat(accessControlService.owner()).isEqualTo(BOB);
        }

        @Test
        @DisplayName("Should reject transfer by a non-owner")
        void shouldRejectNonOwner() {
            assertThatThrownBy(() -> accessControlService.transferOwnership(ALICE, BOB))
                    .isInstanceOf(BusinessException.class)
                    .extracting(e -> ((BusinessException) e).getErrorCode())
                    .isEqualTo(ErrorCode.ACCESS_NOT_OWNER);
        }

        @Test
        @DisplayName("Should reject transfer to the null identity")
        void shouldRejectNullOwner() {
            assertThatThrownBy(() -> accessControlService.transferOwnership(OWNER, null))
                    .isInstanceOf(BusinessException.class)
                    .extracting(e -> ((BusinessException) e).getErrorCode())
                    .isEqualTo(ErrorCode.ACCESS_INVALID_ACCOUNT);
            assertThat(accessControlService.owner()).isEqualTo(OWNER);
        }

        @Test
        @DisplayName("Should reject a call without caller identity")
        void shouldRejectMissingCaller() {
            assertThatThrownBy(() -> accessControlService.transferOwnership(" ", ALICE))
                    .isInstanceOf(BusinessException.class)
                    .extracting(e -> ((BusinessException) e).getErrorCode())
                    .isEqualTo(ErrorCode.EXEC_MISSING_CALLER);
        }
    }
}

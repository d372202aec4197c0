package com.trustledger.ledger.service;

import com.trustledger.common.exception.BusinessException;
import com.trustledger.common.exception.ErrorCode;
import com.trustledger.common.exception.FailureCategory;
import com.trustledger.ledger.BaseIntegrationTest;
import com.trustledger.ledger.domain.LedgerRole;
import com.trustledger.ledger.domain.RegistryItem;
import com.trustledger.ledger.domain.LedgerSubject;
import com.trustledger.ledger.dto.LedgerEventResponse;
import com.trustledger.ledger.dto.RegistryItemResponse;
import com.trustledger.ledger.event.LedgerEventLog;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("RegistryService Tests")
class RegistryServiceTest extends BaseIntegrationTest {

    private static final String URI = "ipfs://bafybeigdyrzt5sfp7udm7hu76uh7y26nf3efuylqabf3oclgtqy55fbzdi";

    @Autowired
    private RegistryService registryService;

    @Autowired
    private AccessControlService accessControlService;

    @Autowired
    private LedgerEventLog eventLog;

    @BeforeEach
    void grantCurator() {
        accessControlService.grantRole(OWNER, BOB, LedgerRole.CURATOR);
    }

    @Nested
    @DisplayName("Registration")
    class RegistrationTests {

        @Test
        @DisplayName("Should assign ids from zero in registration order")
        void shouldAssignSequentialIds() {
            long first = registryService.registerItem(ALICE, URI, "dataset");
            long second = registryService.registerItem(CAROL, URI + "/2", "model");
            long third = registryService.registerItem(ALICE, URI + "/3", null);

            assertThat(List.of(first, second, third)).containsExactly(0L, 1L, 2L);
            assertThat(registryService.getItemsOf(ALICE)).containsExactly(0L, 2L);
            assertThat(registryService.getItemsOf(CAROL)).containsExactly(1L);
            assertThat(registryService.getItemsOf(BOB)).isEmpty();
            assertThat(registryService.itemCount()).isEqualTo(3);
        }

        @Test
        @DisplayName("Should store a new item unverified and active")
        void shouldStoreDefaults() {
            long id = registryService.registerItem(ALICE, URI, "dataset");

            RegistryItemResponse item = registryService.getItem(id);
            assertThat(item.getSubmitter()).isEqualTo(ALICE);
            assertThat(item.getUri()).isEqualTo(URI);
            assertThat(item.getCategory()).isEqualTo("dataset");
            assertThat(item.isVerified()).isFalse();
            assertThat(item.isActive()).isTrue();
            assertThat(item.getCreatedAt()).isNotNull();

            List<LedgerEventResponse> events = eventLog.eventsFor(LedgerSubject.ITEM, String.valueOf(id));
            assertThat(events).singleElement()
                    .satisfies(event -> {
                        assertThat(event.getEventType()).isEqualTo("ItemRegisteredEvent");
                        assertThat(event.getActor()).isEqualTo(ALICE);
                        assertThat(event.getPayload()).contains(URI);
                    });
        }

        @Test
        @DisplayName("Should reject an empty URI without consuming an id")
        void shouldRejectEmptyUri() {
            assertThatThrownBy(() -> registryService.registerItem(ALICE, "", "dataset"))
                    .isInstanceOf(BusinessException.class)
                    .extracting(e -> ((BusinessException) e).getErrorCode())
                    .isEqualTo(ErrorCode.ITEM_EMPTY_URI);

            assertThat(registryService.getItemsOf(ALICE)).isEmpty();
            assertThat(eventCount("ItemRegisteredEvent")).isZero();
            assertThat(registryService.registerItem(ALICE, URI, "dataset")).isZero();
        }

        @Test
        @DisplayName("Should reject an over-long URI or category without consuming an id")
        void shouldRejectOverLongInput() {
            String longUri = "ipfs://" + "a".repeat(3000);
            String longCategory = "c".repeat(RegistryItem.MAX_CATEGORY_LENGTH + 1);

            assertThatThrownBy(() -> registryService.registerItem(ALICE, longUri, "dataset"))
                    .isInstanceOf(BusinessException.class)
                    .satisfies(e -> {
                        BusinessException be = (BusinessException) e;
                        assertThat(be.getErrorCode()).isEqualTo(ErrorCode.ITEM_INVALID_URI);
                        assertThat(be.getCategory()).isEqualTo(FailureCategory.INVALID_INPUT);
                    });
            assertThatThrownBy(() -> registryService.registerItem(ALICE, URI, longCategory))
                    .isInstanceOf(BusinessException.class)
                    .extracting(e -> ((BusinessException) e).getErrorCode())
                    .isEqualTo(ErrorCode.ITEM_INVALID_CATEGORY);

            assertThat(registryService.itemCount()).isZero();
            assertThat(eventCount("ItemRegisteredEvent")).isZero();
            assertThat(registryService.registerItem(ALICE, URI, "dataset")).isZero();
        }

        @Test
        @DisplayName("Should accept a URI at the length limit")
        void shouldAcceptUriAtLimit() {
            String uri = "ipfs://" + "a".repeat(RegistryItem.MAX_URI_LENGTH - 7);

            long id = registryService.registerItem(ALICE, uri, "dataset");

            assertThat(registryService.getItem(id).getUri()).hasSize(RegistryItem.MAX_URI_LENGTH);
        }

        @Test
        @DisplayName("Should report unknown items as not found")
        void shouldRejectUnknownItem() {
            assertThatThrownBy(() -> registryService.getItem(42))
                    .isInstanceOf(BusinessException.class)
                    .extracting(e -> ((BusinessException) e).getCategory())
                    .isEqualTo(FailureCategory.NOT_FOUND);
        }
    }

    @Nested
    @DisplayName("Moderation")
    class ModerationTests {

        @Test
        @DisplayName("Should overwrite both flags as the curator decides")
        void shouldModerate() {
            long id = registryService.registerItem(ALICE, URI, "dataset");

            registryService.moderateItem(BOB, id, true, false);

            RegistryItemResponse item = registryService.getItem(id);
            assertThat(item.isVerified()).isTrue();
            assertThat(item.isActive()).isFalse();
            assertThat(eventCount("ItemStatusUpdatedEvent")).isEqualTo(1);
        }

        @Test
        @DisplayName("Should let a curator re-activate an item the submitter deactivated")
        void shouldReactivateAfterSubmitterDeactivation() {
            long id = registryService.registerItem(ALICE, URI, "dataset");
            registryService.deactivateOwnItem(ALICE, id);

            registryService.moderateItem(BOB, id, false, true);

            assertThat(registryService.getItem(id).isActive()).isTrue();
        }

        @Test
        @DisplayName("Should reject moderation by a non-curator")
        void shouldRejectNonCurator() {
            long id = registryService.registerItem(ALICE, URI, "dataset");

            assertThatThrownBy(() -> registryService.moderateItem(ALICE, id, true, true))
                    .isInstanceOf(BusinessException.class)
                    .extracting(e -> ((BusinessException) e).getErrorCode())
                    .isEqualTo(ErrorCode.ACCESS_NOT_CURATOR);
            assertThat(registryService.getItem(id).isVerified()).isFalse();
        }

        @Test
        @DisplayName("Should check the curator role before the item id")
        void shouldCheckRoleFirst() {
            assertThatThrownBy(() -> registryService.moderateItem(ALICE, 99, true, true))
                    .isInstanceOf(BusinessException.class)
                    .extracting(e -> ((BusinessException) e).getErrorCode())
                    .isEqualTo(ErrorCode.ACCESS_NOT_CURATOR);
            assertThatThrownBy(() -> registryService.moderateItem(BOB, 99, true, true))
                    .isInstanceOf(BusinessException.class)
                    .extracting(e -> ((BusinessException) e).getErrorCode())
                    .isEqualTo(ErrorCode.ITEM_NOT_FOUND);
        }
    }

    @Nested
    @DisplayName("Self Deactivation")
    class DeactivationTests {

        @Test
        @DisplayName("Should deactivate and keep the verified flag")
        void shouldDeactivate() {
            long id = registryService.registerItem(ALICE, URI, "dataset");
            registryService.moderateItem(BOB, id, true, true);

            registryService.deactivateOwnItem(ALICE, id);

            RegistryItemResponse item = registryService.getItem(id);
            assertThat(item.isActive()).isFalse();
            assertThat(item.isVerified()).isTrue();
            assertThat(eventLog.eventsFor(LedgerSubject.ITEM, String.valueOf(id)))
                    .last()
                    .satisfies(event -> assertThat(event.getPayload())
                            .contains("\"verified\":true")
                            .contains("\"active\":false"));
        }

        @Test
        @DisplayName("Should reject deactivation by anyone but the submitter")
        void shouldRejectNonSubmitter() {
            long id = registryService.registerItem(ALICE, URI, "dataset");

            assertThatThrownBy(() -> registryService.deactivateOwnItem(CAROL, id))
                    .isInstanceOf(BusinessException.class)
                    .extracting(e -> ((BusinessException) e).getErrorCode())
                    .isEqualTo(ErrorCode.ITEM_NOT_SUBMITTER);
        }

        @Test
        @DisplayName("Should reject deactivating an inactive item")
        void shouldRejectAlreadyInactive() {
            long id = registryService.registerItem(ALICE, URI, "dataset");
            registryService.deactivateOwnItem(ALICE, id);

            assertThatThrownBy(() -> registryService.deactivateOwnItem(ALICE, id))
                    .isInstanceOf(BusinessException.class)
                    .extracting(e -> ((BusinessException) e).getErrorCode())
                    .isEqualTo(ErrorCode.ITEM_ALREADY_INACTIVE);
        }

        @Test
        @DisplayName("Should report an unknown item before checking the submitter")
        void shouldRejectUnknown() {
            assertThatThrownBy(() -> registryService.deactivateOwnItem(ALICE, 7))
                    .isInstanceOf(BusinessException.class)
                    .extracting(e -> ((BusinessException) e).getErrorCode())
                    .isEqualTo(ErrorCode.ITEM_NOT_FOUND);
        }
    }
}

package com.trustledger.ledger.domain;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("AttestationDocument Entity Tests")
class AttestationDocumentTest {

    private static final Instant CREATED = Instant.parse("2024-05-01T10:00:00Z");

    private AttestationDocument document;

    @BeforeEach
    void setUp() {
        document = AttestationDocument.builder()
                .id(1L)
                .documentHash("0xfeed")
                .creator("creator")
                .createdAt(CREATED)
                .feePaid(BigInteger.TEN)
                .requiredSigners(new ArrayList<>(List.of("alice", "bob")))
                .build();
    }

    @Test
    @DisplayName("Should start active, incomplete and unsigned")
    void shouldStartActive() {
        assertThat(document.isActive()).isTrue();
        assertThat(document.isCompleted()).isFalse();
        assertThat(document.getSignatureCount()).isZero();
        assertThat(document.isCreatedBy("creator")).isTrue();
        assertThat(document.isRequiredSigner("creator")).isFalse();
    }

    @Nested
    @DisplayName("Signature Recording")
    class SignatureTests {

        @Test
        @DisplayName("Should complete on the signature that fills the set")
        void shouldCompleteWhenAllSigned() {
            Instant first = CREATED.plusSeconds(60);
            Instant second = CREATED.plusSeconds(120);

            assertThat(document.recordSignature("alice", first)).isFalse();
            assertThat(document.hasSigned("alice")).isTrue();
            assertThat(document.isCompleted()).isFalse();

            assertThat(document.recordSignature("bob", second)).isTrue();
            assertThat(document.isCompleted()).isTrue();
            assertThat(document.getCompletedAt()).isEqualTo(second);
            assertThat(document.isActive()).isTrue();
            assertThat(document.getSignatures()).extracting(DocumentSignature::getSigner)
                    .containsExactly("alice", "bob");
        }

        @Test
        @DisplayName("Should expose read-only collections")
        void shouldExposeReadOnlyCollections() {
            assertThatThrownBy(() -> document.getRequiredSigners().add("mallory"))
                    .isInstanceOf(UnsupportedOperationException.class);
            assertThatThrownBy(() -> document.getSignatures().clear())
                    .isInstanceOf(UnsupportedOperationException.class);
        }
    }

    @Test
    @DisplayName("Should record revocation time")
    void shouldRevoke() {
        Instant at = CREATED.plusSeconds(30);

        document.revoke(at);

        assertThat(document.isActive()).isFalse();
        assertThat(document.getRevokedAt()).isEqualTo(at);
    }
}

package com.trustledger.ledger.service;

import com.trustledger.common.exception.ErrorCode;
import com.trustledger.common.exception.InvalidResourceStateException;
import com.trustledger.common.exception.ResourceNotFoundException;
import com.trustledger.common.exception.UnauthorizedException;
import com.trustledger.common.exception.ValidationException;
import com.trustledger.ledger.domain.AccountIndexType;
import com.trustledger.ledger.domain.AttestationDocument;
import com.trustledger.ledger.domain.SequenceName;
import com.trustledger.ledger.dto.DocumentDetailsResponse;
import com.trustledger.ledger.dto.SignerStatusResponse;
import com.trustledger.ledger.event.DocumentCompletedEvent;
import com.trustledger.ledger.event.DocumentCreatedEvent;
import com.trustledger.ledger.event.DocumentRevokedEvent;
import com.trustledger.ledger.event.DocumentSignedEvent;
import com.trustledger.ledger.event.LedgerEventLog;
import com.trustledger.ledger.exception.InsufficientFeeException;
import com.trustledger.ledger.execution.Accounts;
import com.trustledger.ledger.execution.LedgerExecutor;
import com.trustledger.ledger.execution.ReentrancyGuard;
import com.trustledger.ledger.repository.AttestationDocumentRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Multi-party document attestation.
 *
 * <p>A creator pays the storage fee and names the required signers. Each of them signs once,
 * and the signature that completes the set marks the document completed. Until then the creator
 * may revoke it. No fee is refunded on revocation.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AttestationService {

    private static final String DOCUMENT = "AttestationDocument";

    private final AttestationDocumentRepository documentRepository;
    private final FeeTreasuryService feeTreasuryService;
    private final SequenceAllocator sequenceAllocator;
    private final AccountIndexService accountIndexService;
    private final LedgerEventLog eventLog;
    private final ReentrancyGuard reentrancyGuard;
    private final LedgerExecutor executor;
    private final Clock clock;

    /**
     * Creates a document and moves the attached value into the treasury.
     *
     * @param attachedValue value sent with the call; null counts as zero
     * @param requiredSigners signers in order; repeated entries count once
     * @return the new document id; ids start at 1
     */
    public long createDocument(String caller, BigInteger attachedValue, String documentHash, List<String> requiredSigners) {
        String creator = Accounts.requireCaller(caller);
        return executor.execute("createDocument", () -> reentrancyGuard.guard("createDocument", () -> {
            BigInteger value = attachedValue != null ? attachedValue : BigInteger.ZERO;
            if (value.signum() < 0) {
                throw new ValidationException(ErrorCode.FEE_INVALID_AMOUNT, "Attached value must not be negative: " + value);
            }
            BigInteger storageFee = feeTreasuryService.storageFee();
            if (value.compareTo(storageFee) < 0) {
                throw new InsufficientFeeException(storageFee, value);
            }
            if (documentHash == null || documentHash.isEmpty()) {
                throw new ValidationException(ErrorCode.DOC_EMPTY_HASH);
            }
            if (documentHash.length() > AttestationDocument.MAX_HASH_LENGTH) {
                throw new ValidationException(ErrorCode.DOC_INVALID_HASH,
                        String.format("Document hash has %d characters, at most %d allowed",
                                documentHash.length(), AttestationDocument.MAX_HASH_LENGTH));
            }
            List<String> signers = distinctSigners(requiredSigners);

            Instant now = Instant.now(clock);
            long id = sequenceAllocator.next(SequenceName.ATTESTATION_DOCUMENT);
            documentRepository.save(AttestationDocument.builder()
                    .id(id)
                    .documentHash(documentHash)
                    .creator(creator)
                    .createdAt(now)
                    .feePaid(value)
                    .requiredSigners(new ArrayList<>(signers))
                    .build());

            accountIndexService.append(AccountIndexType.CREATED_DOCUMENTS, creator, id);
            for (String signer : signers) {
                accountIndexService.append(AccountIndexType.SIGNER_DOCUMENTS, signer, id);
            }

            if (value.signum() > 0) {
                feeTreasuryService.collect(creator, value);
            }

            eventLog.emit(new DocumentCreatedEvent(id, creator, documentHash, now), creator);
            log.info("Document created: id={} creator={} signers={} feePaid={}", id, creator, signers.size(), value);
            return id;
        }));
    }

    public void signDocument(String caller, long documentId) {
        String signer = Accounts.requireCaller(caller);
        executor.run("signDocument", () -> {
            AttestationDocument document = findDocument(documentId);
            if (!document.isActive()) {
                throw new ResourceNotFoundException(ErrorCode.DOC_NOT_ACTIVE,
                        String.format("Document %d is not active", documentId));
            }
            if (document.isCompleted()) {
                throw new InvalidResourceStateException(ErrorCode.DOC_ALREADY_COMPLETED, DOCUMENT, "COMPLETED");
            }
            if (document.hasSigned(signer)) {
                throw new InvalidResourceStateException(ErrorCode.DOC_ALREADY_SIGNED, DOCUMENT, "SIGNED_BY_" + signer);
            }
            if (!document.isRequiredSigner(signer)) {
                throw new UnauthorizedException(ErrorCode.DOC_NOT_REQUIRED_SIGNER,
                        String.format("Account %s is not a required signer of document %d", signer, documentId));
            }

            Instant now = Instant.now(clock);
            boolean completed = document.recordSignature(signer, now);
            documentRepository.save(document);

            eventLog.emit(new DocumentSignedEvent(documentId, signer, now), signer);
            log.info("Document signed: id={} signer={} signatures={}/{}",
                    documentId, signer, document.getSignatureCount(), document.getRequiredSigners().size());
            if (completed) {
                eventLog.emit(new DocumentCompletedEvent(documentId, now), signer);
                log.info("Document completed: id={}", documentId);
            }
        });
    }

    public void revokeDocument(String caller, long documentId) {
        String sender = Accounts.requireCaller(caller);
        executor.run("revokeDocument", () -> {
            AttestationDocument document = findDocument(documentId);
            if (!document.isCreatedBy(sender)) {
                throw new UnauthorizedException(ErrorCode.DOC_NOT_CREATOR,
                        String.format("Account %s did not create document %d", sender, documentId));
            }
            if (!document.isActive()) {
                throw new InvalidResourceStateException(ErrorCode.DOC_ALREADY_INACTIVE, DOCUMENT, "INACTIVE");
            }
            if (document.isCompleted()) {
                throw new InvalidResourceStateException(ErrorCode.DOC_ALREADY_COMPLETED, DOCUMENT, "COMPLETED");
            }

            Instant now = Instant.now(clock);
            document.revoke(now);
            documentRepository.save(document);

            eventLog.emit(new DocumentRevokedEvent(documentId, now), sender);
            log.info("Document revoked: id={} creator={}", documentId, sender);
        });
    }

    @Transactional(readOnly = true)
    public boolean hasUserSigned(long documentId, String account) {
        return findDocument(documentId).hasSigned(account);
    }

    @Transactional(readOnly = true)
    public boolean isRequiredSigner(long documentId, String account) {
        return findDocument(documentId).isRequiredSigner(account);
    }

    @Transactional(readOnly = true)
    public SignerStatusResponse signerStatus(long documentId, String account) {
        AttestationDocument document = findDocument(documentId);
        return SignerStatusResponse.builder()
                .documentId(documentId)
                .account(account)
                .requiredSigner(document.isRequiredSigner(account))
                .signed(document.hasSigned(account))
                .build();
    }

    @Transactional(readOnly = true)
    public DocumentDetailsResponse getDocumentDetails(long documentId) {
        log.debug("Fetching document: id={}", documentId);
        return DocumentDetailsResponse.from(findDocument(documentId));
    }

    /**
     * @return ids of documents the account created, in creation order
     */
    @Transactional(readOnly = true)
    public List<Long> getUserDocuments(String account) {
        return accountIndexService.idsFor(AccountIndexType.CREATED_DOCUMENTS, Accounts.normalize(account));
    }

    /**
     * @return ids of documents naming the account as a required signer, in creation order
     */
    @Transactional(readOnly = true)
    public List<Long> getSignerDocuments(String account) {
        return accountIndexService.idsFor(AccountIndexType.SIGNER_DOCUMENTS, Accounts.normalize(account));
    }

    @Transactional(readOnly = true)
    public long documentCount() {
        return sequenceAllocator.peek(SequenceName.ATTESTATION_DOCUMENT) - SequenceName.ATTESTATION_DOCUMENT.getFirstValue();
    }

    private AttestationDocument findDocument(long documentId) {
        return documentRepository.findById(documentId)
                .orElseThrow(() -> new ResourceNotFoundException(ErrorCode.DOC_NOT_FOUND, DOCUMENT, documentId));
    }

    private static List<String> distinctSigners(List<String> requiredSigners) {
        if (requiredSigners == null || requiredSigners.isEmpty()) {
            throw new ValidationException(ErrorCode.DOC_NO_SIGNERS);
        }
        Set<String> distinct = new LinkedHashSet<>();
        for (String signer : requiredSigners) {
            if (!Accounts.isValid(signer)) {
                throw new ValidationException(ErrorCode.DOC_INVALID_SIGNER);
            }
            distinct.add(signer.trim());
        }
        return List.copyOf(distinct);
    }
}

package com.trustledger.ledger.service;

import com.trustledger.common.exception.ErrorCode;
import com.trustledger.common.exception.InvalidResourceStateException;
import com.trustledger.common.exception.ResourceNotFoundException;
import com.trustledger.common.exception.UnauthorizedException;
import com.trustledger.common.exception.ValidationException;
import com.trustledger.ledger.domain.AccountIndexType;
import com.trustledger.ledger.domain.LedgerRole;
import com.trustledger.ledger.domain.RegistryItem;
import com.trustledger.ledger.domain.SequenceName;
import com.trustledger.ledger.dto.RegistryItemResponse;
import com.trustledger.ledger.event.ItemRegisteredEvent;
import com.trustledger.ledger.event.ItemStatusUpdatedEvent;
import com.trustledger.ledger.event.LedgerEventLog;
import com.trustledger.ledger.execution.Accounts;
import com.trustledger.ledger.execution.LedgerExecutor;
import com.trustledger.ledger.repository.RegistryItemRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Registry of submitted items and their curation.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RegistryService {

    private static final String ITEM = "RegistryItem";

    private final RegistryItemRepository itemRepository;
    private final AccessControlService accessControlService;
    private final SequenceAllocator sequenceAllocator;
    private final AccountIndexService accountIndexService;
    private final LedgerEventLog eventLog;
    private final LedgerExecutor executor;
    private final Clock clock;

    /**
     * Registers an item submitted by the caller.
     *
     * @return the new item id; ids start at 0 and are never reused
     */
    public long registerItem(String caller, String uri, String category) {
        String submitter = Accounts.requireCaller(caller);
        return executor.execute("registerItem", () -> {
            if (uri == null || uri.isEmpty()) {
                throw new ValidationException(ErrorCode.ITEM_EMPTY_URI);
            }
            if (uri.length() > RegistryItem.MAX_URI_LENGTH) {
                throw new ValidationException(ErrorCode.ITEM_INVALID_URI,
                        String.format("Item URI has %d characters, at most %d allowed", uri.length(), RegistryItem.MAX_URI_LENGTH));
            }
            String itemCategory = category != null ? category : "";
            if (itemCategory.length() > RegistryItem.MAX_CATEGORY_LENGTH) {
                throw new ValidationException(ErrorCode.ITEM_INVALID_CATEGORY,
                        String.format("Item category has %d characters, at most %d allowed",
                                itemCategory.length(), RegistryItem.MAX_CATEGORY_LENGTH));
            }
            Instant now = Instant.now(clock);

            long id = sequenceAllocator.next(SequenceName.REGISTRY_ITEM);
            itemRepository.save(RegistryItem.builder()
                    .id(id)
                    .submitter(submitter)
                    .uri(uri)
                    .category(itemCategory)
                    .createdAt(now)
                    .build());
            accountIndexService.append(AccountIndexType.SUBMITTED_ITEMS, submitter, id);

            eventLog.emit(new ItemRegisteredEvent(id, submitter, uri, itemCategory, now), submitter);
            log.info("Item registered: id={} submitter={} category={}", id, submitter, itemCategory);
            return id;
        });
    }

    /**
     * Curator decision on an item. Both flags are overwritten as given, which lets a curator
     * re-activate an item its submitter deactivated.
     */
    public void moderateItem(String caller, long itemId, boolean verified, boolean active) {
        String curator = Accounts.requireCaller(caller);
        executor.run("moderateItem", () -> {
            accessControlService.requireRole(curator, LedgerRole.CURATOR, ErrorCode.ACCESS_NOT_CURATOR);
            RegistryItem item = findItem(itemId);

            Instant now = Instant.now(clock);
            item.moderate(verified, active, now);
            itemRepository.save(item);

            eventLog.emit(new ItemStatusUpdatedEvent(itemId, verified, active, now), curator);
            log.info("Item moderated: id={} verified={} active={} curator={}", itemId, verified, active, curator);
        });
    }

    public void deactivateOwnItem(String caller, long itemId) {
        String sender = Accounts.requireCaller(caller);
        executor.run("deactivateOwnItem", () -> {
            RegistryItem item = findItem(itemId);
            if (!item.isSubmittedBy(sender)) {
                throw new UnauthorizedException(ErrorCode.ITEM_NOT_SUBMITTER,
                        String.format("Account %s did not submit item %d", sender, itemId));
            }
            if (!item.isActive()) {
                throw new InvalidResourceStateException(ErrorCode.ITEM_ALREADY_INACTIVE, ITEM, "INACTIVE");
            }

            Instant now = Instant.now(clock);
            item.deactivate(now);
            itemRepository.save(item);

            eventLog.emit(new ItemStatusUpdatedEvent(itemId, item.isVerified(), false, now), sender);
            log.info("Item deactivated by submitter: id={} submitter={}", itemId, sender);
        });
    }

    @Transactional(readOnly = true)
    public RegistryItemResponse getItem(long itemId) {
        log.debug("Fetching item: id={}", itemId);
        return RegistryItemResponse.from(findItem(itemId));
    }

    /**
     * @return ids of the items the account submitted, in registration order
     */
    @Transactional(readOnly = true)
    public List<Long> getItemsOf(String account) {
        return accountIndexService.idsFor(AccountIndexType.SUBMITTED_ITEMS, Accounts.normalize(account));
    }

    @Transactional(readOnly = true)
    public long itemCount() {
        return sequenceAllocator.peek(SequenceName.REGISTRY_ITEM) - SequenceName.REGISTRY_ITEM.getFirstValue();
    }

    private RegistryItem findItem(long itemId) {
        return itemRepository.findById(itemId)
                .orElseThrow(() -> new ResourceNotFoundException(ErrorCode.ITEM_NOT_FOUND, ITEM, itemId));
    }
}

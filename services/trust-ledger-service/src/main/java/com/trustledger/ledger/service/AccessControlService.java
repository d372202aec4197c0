package com.trustledger.ledger.service;

import com.trustledger.common.exception.ErrorCode;
import com.trustledger.common.exception.InvalidResourceStateException;
import com.trustledger.common.exception.UnauthorizedException;
import com.trustledger.common.exception.ValidationException;
import com.trustledger.ledger.domain.LedgerOwnership;
import com.trustledger.ledger.domain.LedgerRole;
import com.trustledger.ledger.domain.RoleGrant;
import com.trustledger.ledger.event.LedgerEventLog;
import com.trustledger.ledger.event.OwnershipTransferredEvent;
import com.trustledger.ledger.event.RoleGrantedEvent;
import com.trustledger.ledger.event.RoleRevokedEvent;
import com.trustledger.ledger.execution.Accounts;
import com.trustledger.ledger.execution.LedgerExecutor;
import com.trustledger.ledger.repository.LedgerOwnershipRepository;
import com.trustledger.ledger.repository.RoleGrantRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Role grants and ledger ownership.
 *
 * <p>Ownership and the ADMIN role are separate records: role administration requires ADMIN,
 * while ownership transfer and the fee treasury answer to the owner. Changing one never touches
 * the other.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AccessControlService {

    private final RoleGrantRepository roleGrantRepository;
    private final LedgerOwnershipRepository ownershipRepository;
    private final LedgerEventLog eventLog;
    private final LedgerExecutor executor;
    private final Clock clock;

    /**
     * Installs the first owner and grants it ADMIN. Has no effect once an owner exists.
     *
     * @return true if the owner was installed by this call
     */
    public boolean initializeOwner(String initialOwner) {
        return executor.execute("initializeOwner", () -> {
            if (ownershipRepository.existsById(LedgerOwnership.SINGLETON_ID)) {
                return false;
            }
            String owner = requireAccount(initialOwner);
            Instant now = Instant.now(clock);

            ownershipRepository.save(LedgerOwnership.builder()
                    .id(LedgerOwnership.SINGLETON_ID)
                    .owner(owner)
                    .transferredAt(now)
                    .build());
            eventLog.emit(new OwnershipTransferredEvent(Accounts.NULL_IDENTITY, owner, now), owner);

            writeGrant(owner, LedgerRole.ADMIN, true, owner, now);
            eventLog.emit(new RoleGrantedEvent(owner, LedgerRole.ADMIN.name(), owner, now), owner);

            log.info("Ledger owner initialized: owner={}", owner);
            return true;
        });
    }

    public void grantRole(String caller, String account, LedgerRole role) {
        String sender = Accounts.requireCaller(caller);
        executor.run("grantRole", () -> {
            requireRole(sender, LedgerRole.ADMIN, ErrorCode.ACCESS_NOT_ADMIN);
            requireKnownRole(role);
            String grantee = requireAccount(account);
            if (roleGrantRepository.existsByAccountAndRoleAndGrantedTrue(grantee, role)) {
                throw new InvalidResourceStateException(ErrorCode.ACCESS_ROLE_ALREADY_GRANTED,
                        "RoleGrant", role + " already granted to " + grantee);
            }

            Instant now = Instant.now(clock);
            writeGrant(grantee, role, true, sender, now);
            eventLog.emit(new RoleGrantedEvent(grantee, role.name(), sender, now), sender);
            log.info("Role granted: account={} role={} grantedBy={}", grantee, role, sender);
        });
    }

    public void revokeRole(String caller, String account, LedgerRole role) {
        String sender = Accounts.requireCaller(caller);
        executor.run("revokeRole", () -> {
            requireRole(sender, LedgerRole.ADMIN, ErrorCode.ACCESS_NOT_ADMIN);
            requireKnownRole(role);
            String holder = Accounts.normalize(account);
            RoleGrant grant = roleGrantRepository.findByAccountAndRole(holder, role)
                    .filter(RoleGrant::isGranted)
                    .orElseThrow(() -> new InvalidResourceStateException(ErrorCode.ACCESS_ROLE_NOT_GRANTED,
                            "RoleGrant", role + " not granted to " + holder));

            Instant now = Instant.now(clock);
            grant.setGranted(false);
            grant.setChangedBy(sender);
            grant.setUpdatedAt(now);
            roleGrantRepository.save(grant);

            eventLog.emit(new RoleRevokedEvent(holder, role.name(), sender, now), sender);
            log.info("Role revoked: account={} role={} revokedBy={}", holder, role, sender);
        });
    }

    public void transferOwnership(String caller, String newOwner) {
        String sender = Accounts.requireCaller(caller);
        executor.run("transferOwnership", () -> {
            LedgerOwnership ownership = requireOwner(sender);
            String nextOwner = requireAccount(newOwner);

            String previousOwner = ownership.getOwner();
            Instant now = Instant.now(clock);
            ownership.setOwner(nextOwner);
            ownership.setTransferredAt(now);
            ownershipRepository.save(ownership);

            eventLog.emit(new OwnershipTransferredEvent(previousOwner, nextOwner, now), sender);
            log.info("Ownership transferred: previousOwner={} newOwner={}", previousOwner, nextOwner);
        });
    }

    @Transactional(readOnly = true)
    public boolean hasRole(String account, LedgerRole role) {
        requireKnownRole(role);
        return account != null && roleGrantRepository.existsByAccountAndRoleAndGrantedTrue(account.trim(), role);
    }

    @Transactional(readOnly = true)
    public List<LedgerRole> rolesOf(String account) {
        return roleGrantRepository.findByAccountAndGrantedTrue(Accounts.normalize(account)).stream()
                .map(RoleGrant::getRole)
                .sorted()
                .toList();
    }

    /**
     * @return the current owner, or the null identity before initialization
     */
    @Transactional(readOnly = true)
    public String owner() {
        return ownershipRepository.findById(LedgerOwnership.SINGLETON_ID)
                .map(LedgerOwnership::getOwner)
                .orElse(Accounts.NULL_IDENTITY);
    }

    public void requireRole(String account, LedgerRole role, ErrorCode errorCode) {
        if (!roleGrantRepository.existsByAccountAndRoleAndGrantedTrue(account, role)) {
            throw new UnauthorizedException(errorCode,
                    String.format("Account %s does not hold %s", account, role));
        }
    }

    public LedgerOwnership requireOwner(String account) {
        Optional<LedgerOwnership> ownership = ownershipRepository.findById(LedgerOwnership.SINGLETON_ID);
        if (ownership.isEmpty() || !ownership.get().getOwner().equals(account)) {
            throw new UnauthorizedException(ErrorCode.ACCESS_NOT_OWNER,
                    String.format("Account %s is not the ledger owner", account));
        }
        return ownership.get();
    }

    private void writeGrant(String account, LedgerRole role, boolean granted, String changedBy, Instant at) {
        RoleGrant grant = roleGrantRepository.findByAccountAndRole(account, role)
                .orElseGet(() -> RoleGrant.builder().account(account).role(role).build());
        grant.setGranted(granted);
        grant.setChangedBy(changedBy);
        grant.setUpdatedAt(at);
        roleGrantRepository.save(grant);
    }

    /**
     * @return the account trimmed, as it is stored and compared
     */
    private static String requireAccount(String account) {
        if (!Accounts.isValid(account)) {
            throw new ValidationException(ErrorCode.ACCESS_INVALID_ACCOUNT);
        }
        return account.trim();
    }

    private static void requireKnownRole(LedgerRole role) {
        if (role == null) {
            throw new ValidationException(ErrorCode.ACCESS_UNKNOWN_ROLE);
        }
    }
}

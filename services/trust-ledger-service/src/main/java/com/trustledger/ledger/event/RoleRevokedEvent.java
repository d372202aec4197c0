package com.trustledger.ledger.event;

import com.trustledger.ledger.domain.LedgerSubject;
import lombok.Getter;

import java.time.Instant;

/**
 * A role was revoked from an account.
 */
@Getter
public class RoleRevokedEvent extends LedgerEvent {

    private final String account;
    private final String role;
    private final String revokedBy;

    public RoleRevokedEvent(String account, String role, String revokedBy, Instant timestamp) {
        super(timestamp);
        this.account = account;
        this.role = role;
        this.revokedBy = revokedBy;
    }

    @Override
    public String getTopic() {
        return ACCESS_TOPIC;
    }

    @Override
    public LedgerSubject getSubjectType() {
        return LedgerSubject.ACCOUNT;
    }

    @Override
    public String getSubjectId() {
        return account;
    }
}

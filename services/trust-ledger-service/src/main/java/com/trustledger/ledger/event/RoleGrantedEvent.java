package com.trustledger.ledger.event;

import com.trustledger.ledger.domain.LedgerSubject;
import lombok.Getter;

import java.time.Instant;

/**
 * A role was granted to an account.
 */
@Getter
public class RoleGrantedEvent extends LedgerEvent {

    private final String account;
    private final String role;
    private final String grantedBy;

    public RoleGrantedEvent(String account, String role, String grantedBy, Instant timestamp) {
        super(timestamp);
        this.account = account;
        this.role = role;
        this.grantedBy = grantedBy;
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

package com.trustledger.ledger.dto;

import com.trustledger.ledger.domain.LedgerRole;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RoleStatusResponse {
    private String account;
    private LedgerRole role;
    private boolean granted;
}

package com.trustledger.ledger.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Names a single account: the grantee of a role or the next owner.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class AccountRequest {

    @Schema(description = "Account identity", example = "0x5aAeb6053F3E94C9b9A09f33669435E7Ef1BeAed", requiredMode = Schema.RequiredMode.REQUIRED)
    private String account;
}

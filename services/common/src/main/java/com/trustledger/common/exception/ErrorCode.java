package com.trustledger.common.exception;

import org.springframework.http.HttpStatus;

/**
 * Error codes for the trust ledger.
 * Format: MODULE_NNN, one code per violated precondition.
 */
public enum ErrorCode {

    // ===== ACCESS CONTROL (ACCESS_XXX) =====
    ACCESS_NOT_ADMIN("ACCESS_001", "Caller does not hold the ADMIN role", FailureCategory.UNAUTHORIZED),
    ACCESS_NOT_OWNER("ACCESS_002", "Caller is not the ledger owner", FailureCategory.UNAUTHORIZED),
    ACCESS_NOT_CURATOR("ACCESS_003", "Caller does not hold the CURATOR role", FailureCategory.UNAUTHORIZED),
    ACCESS_INVALID_ACCOUNT("ACCESS_004", "Account must be a non-null identity of at most 128 characters", FailureCategory.INVALID_INPUT),
    ACCESS_ROLE_ALREADY_GRANTED("ACCESS_005", "Role is already granted to the account", FailureCategory.INVALID_STATE),
    ACCESS_ROLE_NOT_GRANTED("ACCESS_006", "Role is not granted to the account", FailureCategory.INVALID_STATE),
    ACCESS_UNKNOWN_ROLE("ACCESS_007", "Unknown role", FailureCategory.INVALID_INPUT),

    // ===== REGISTRY (ITEM_XXX) =====
    ITEM_NOT_FOUND("ITEM_001", "Item not found", FailureCategory.NOT_FOUND),
    ITEM_EMPTY_URI("ITEM_002", "Item URI must not be empty", FailureCategory.INVALID_INPUT),
    ITEM_NOT_SUBMITTER("ITEM_003", "Caller is not the item submitter", FailureCategory.UNAUTHORIZED),
    ITEM_ALREADY_INACTIVE("ITEM_004", "Item is already inactive", FailureCategory.INVALID_STATE),
    ITEM_INVALID_URI("ITEM_005", "Item URI exceeds the maximum length", FailureCategory.INVALID_INPUT),
    ITEM_INVALID_CATEGORY("ITEM_006", "Item category exceeds the maximum length", FailureCategory.INVALID_INPUT),

    // ===== ATTESTATION (DOC_XXX) =====
    DOC_NOT_FOUND("DOC_001", "Document not found", FailureCategory.NOT_FOUND),
    DOC_NOT_ACTIVE("DOC_002", "Document is not active", FailureCategory.NOT_FOUND),
    DOC_EMPTY_HASH("DOC_003", "Document hash must not be empty", FailureCategory.INVALID_INPUT),
    DOC_NO_SIGNERS("DOC_004", "At least one required signer must be named", FailureCategory.INVALID_INPUT),
    DOC_INVALID_SIGNER("DOC_005", "Required signer must not be the null identity", FailureCategory.INVALID_INPUT),
    DOC_ALREADY_COMPLETED("DOC_006", "Document is already completed", FailureCategory.INVALID_STATE),
    DOC_ALREADY_SIGNED("DOC_007", "Caller has already signed the document", FailureCategory.INVALID_STATE),
    DOC_NOT_REQUIRED_SIGNER("DOC_008", "Caller is not a required signer", FailureCategory.UNAUTHORIZED),
    DOC_NOT_CREATOR("DOC_009", "Caller is not the document creator", FailureCategory.UNAUTHORIZED),
    DOC_ALREADY_INACTIVE("DOC_010", "Document is already inactive", FailureCategory.INVALID_STATE),
    DOC_INVALID_HASH("DOC_011", "Document hash exceeds the maximum length", FailureCategory.INVALID_INPUT),

    // ===== FEE TREASURY (FEE_XXX) =====
    FEE_INSUFFICIENT("FEE_001", "Attached value is below the storage fee", FailureCategory.INSUFFICIENT_FEE),
    FEE_INVALID_AMOUNT("FEE_002", "Amount must not be negative", FailureCategory.INVALID_INPUT),

    // ===== EXECUTION ENVIRONMENT (EXEC_XXX) =====
    EXEC_REENTRANT_CALL("EXEC_001", "Re-entrant call rejected", FailureCategory.REENTRANT),
    EXEC_INSUFFICIENT_BALANCE("EXEC_002", "Sender balance is below the transfer amount", FailureCategory.TRANSFER_REJECTED),
    EXEC_TRANSFER_REJECTED("EXEC_003", "Value transfer rejected by recipient", FailureCategory.TRANSFER_REJECTED),
    EXEC_MISSING_CALLER("EXEC_004", "Caller identity is required", FailureCategory.INVALID_INPUT),
    EXEC_INVALID_CALLER("EXEC_005", "Caller identity exceeds the maximum length", FailureCategory.INVALID_INPUT);

    private final String code;
    private final String defaultMessage;
    private final FailureCategory category;

    ErrorCode(String code, String defaultMessage, FailureCategory category) {
        this.code = code;
        this.defaultMessage = defaultMessage;
        this.category = category;
    }

    public String getCode() {
        return code;
    }

    public String getDefaultMessage() {
        return defaultMessage;
    }

    public FailureCategory getCategory() {
        return category;
    }

    public HttpStatus getStatus() {
        return category.getStatus();
    }
}

package com.trustledger.ledger.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Request to register a registry item")
public class RegisterItemRequest {

    @Size(max = 2048, message = "URI must not exceed 2048 characters")
    @Schema(description = "Reference to the off-chain content", example = "ipfs://bafybeigdyrzt5sfp7udm7hu76uh7y26nf3efuylqabf3oclgtqy55fbzdi", requiredMode = Schema.RequiredMode.REQUIRED)
    private String uri;

    @Size(max = 256, message = "Category must not exceed 256 characters")
    @Schema(description = "Classification of the item", example = "dataset")
    private String category;
}

package com.trustledger.ledger.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Request to create a document for attestation")
public class CreateDocumentRequest {

    @Size(max = 512, message = "Document hash must not exceed 512 characters")
    @Schema(description = "Reference to the document content", example = "0x9f86d081884c7d659a2feaa0c55ad015a3bf4f1b2b0b822cd15d6c15b0f00a08", requiredMode = Schema.RequiredMode.REQUIRED)
    private String documentHash;

    @Size(max = 256, message = "At most 256 required signers")
    @Schema(description = "Accounts whose signatures complete the document; duplicates are ignored", requiredMode = Schema.RequiredMode.REQUIRED)
    private List<String> requiredSigners;
}

package com.trustledger.ledger.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Curator moderation decision; both flags are written as given")
public class ModerateItemRequest {

    @NotNull(message = "verified is required")
    private Boolean verified;

    @NotNull(message = "active is required")
    private Boolean active;
}

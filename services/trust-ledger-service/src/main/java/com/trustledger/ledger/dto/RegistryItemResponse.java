package com.trustledger.ledger.dto;

import com.trustledger.ledger.domain.RegistryItem;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Registry item state")
public class RegistryItemResponse {

    private long id;
    private String submitter;
    private String uri;
    private String category;
    private Instant createdAt;
    private boolean verified;
    private boolean active;

    public static RegistryItemResponse from(RegistryItem item) {
        return RegistryItemResponse.builder()
                .id(item.getId())
                .submitter(item.getSubmitter())
                .uri(item.getUri())
                .category(item.getCategory())
                .createdAt(item.getCreatedAt())
                .verified(item.isVerified())
                .active(item.isActive())
                .build();
    }
}

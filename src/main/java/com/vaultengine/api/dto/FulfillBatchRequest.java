package com.vaultengine.api.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Operator request to fulfill several redemptions priced from one snapshot.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FulfillBatchRequest {

    @NotEmpty
    private List<@Valid FulfillBatchEntry> entries;
}

package com.vaultengine.api.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Proposed fee rates in basis points.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FeeRatesRequest {

    @NotNull
    @PositiveOrZero
    private Integer performanceFeeRate;

    @NotNull
    @PositiveOrZero
    private Integer managementFeeRate;

    @NotNull
    @PositiveOrZero
    private Integer withdrawalFeeRate;
}

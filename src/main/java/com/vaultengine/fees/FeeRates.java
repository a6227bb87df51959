package com.vaultengine.fees;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Proposed fee rates, in basis points.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FeeRates {

    private int performanceFeeRate;

    private int managementFeeRate;

    private int withdrawalFeeRate;
}

package com.vaultengine.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;

/**
 * Request to cancel a pending redemption, fully or partially.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CancelRedeemRequest {

    @NotBlank
    private String controller;

    @NotBlank
    private String receiver;

    /**
     * Shares to cancel; {@code null} cancels the whole pending amount.
     */
    @PositiveOrZero
    private BigInteger shares;
}

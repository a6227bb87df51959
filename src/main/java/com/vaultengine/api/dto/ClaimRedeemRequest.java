package com.vaultengine.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;

/**
 * Request to withdraw claimable assets by share amount.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ClaimRedeemRequest {

    @NotNull
    @PositiveOrZero
    private BigInteger shares;

    @NotBlank
    private String receiver;

    @NotBlank
    private String controller;
}

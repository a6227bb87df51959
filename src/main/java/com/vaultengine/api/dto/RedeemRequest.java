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
 * Request to escrow shares for a future redemption.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RedeemRequest {

    @NotNull
    @PositiveOrZero
    private BigInteger shares;

    @NotBlank
    private String controller;

    @NotBlank
    private String owner;
}

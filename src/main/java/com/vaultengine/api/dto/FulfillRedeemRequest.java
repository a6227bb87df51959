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
 * Operator request to fulfill pending shares of one controller.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FulfillRedeemRequest {

    @NotBlank
    private String controller;

    @NotNull
    @PositiveOrZero
    private BigInteger shares;
}

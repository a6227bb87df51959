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
 * One entry of a batch fulfillment.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FulfillBatchEntry {

    @NotBlank
    private String asset;

    @NotBlank
    private String controller;

    @NotNull
    @PositiveOrZero
    private BigInteger shares;
}

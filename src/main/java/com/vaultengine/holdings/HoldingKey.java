package com.vaultengine.holdings;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * Composite key of an asset balance: who holds it and which asset.
 */
@Embeddable
@Data
@NoArgsConstructor
@AllArgsConstructor
public class HoldingKey implements Serializable {

    @Column(name = "holder", nullable = false)
    private String holder;

    @Column(name = "asset", nullable = false)
    private String asset;
}

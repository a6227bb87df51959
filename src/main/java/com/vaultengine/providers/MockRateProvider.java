package com.vaultengine.providers;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Rate provider with configured fixed rates.
 *
 * A rate is the number of underlying units one unit of the asset is worth, e.g.
 * {@code DAI:0.000001} for an 18-decimal asset against a 12-decimal-lower underlying.
 * Configured as {@code vault-engine.rates=ASSET:RATE,...}.
 *
 * In production, this would read live per-asset rates from an oracle.
 */
@Component
@Slf4j
public class MockRateProvider implements RateProvider {

    private final Map<String, BigDecimal> rates = new ConcurrentHashMap<>();

    public MockRateProvider(@Value("${vault-engine.rates:}") List<String> rateEntries) {
        for (String entry : rateEntries) {
            if (entry == null || entry.isBlank()) {
                continue;
            }
            String[] parts = entry.split(":");
            if (parts.length != 2) {
                throw new IllegalArgumentException("Invalid rate entry, expected ASSET:RATE: " + entry);
            }
            setRate(parts[0].trim(), new BigDecimal(parts[1].trim()));
        }
    }

    public void setRate(String asset, BigDecimal rate) {
        if (rate.signum() <= 0) {
            throw new IllegalArgumentException("Rate must be positive for " + asset);
        }
        rates.put(asset, rate);
        log.info("Rate for {} set to {}", asset, rate);
    }

    @Override
    public boolean isSupported(String asset) {
        return asset != null && rates.containsKey(asset);
    }

    @Override
    public BigInteger convertToUnderlying(String asset, BigInteger amount) {
        BigInteger result = new BigDecimal(amount)
            .multiply(rateOf(asset))
            .setScale(0, RoundingMode.DOWN)
            .toBigIntegerExact();
        log.debug("Rate {} -> underlying: {} -> {}", asset, amount, result);
        return result;
    }

    @Override
    public BigInteger convertFromUnderlying(String asset, BigInteger amount) {
        BigInteger result = new BigDecimal(amount)
            .divide(rateOf(asset), 0, RoundingMode.DOWN)
            .toBigIntegerExact();
        log.debug("Rate underlying -> {}: {} -> {}", asset, amount, result);
        return result;
    }

    private BigDecimal rateOf(String asset) {
        BigDecimal rate = rates.get(asset);
        if (rate == null) {
            throw new IllegalStateException("No rate configured for " + asset);
        }
        return rate;
    }
}

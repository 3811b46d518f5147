package com.acdm.market.acdm_market.engine;

import com.acdm.market.acdm_market.entity.Units;

import java.math.BigInteger;

/**
 * Sale price escalation and token/native conversions.
 *
 * Prices are native base units per whole token (10^decimals token base units).
 * Every division truncates, so conversions never create value: callers treat a
 * zero result as "input too small", never as something free.
 */
public class PricingEngine {

    private static final BigInteger PRICE_GROWTH_NUMERATOR = BigInteger.valueOf(103);
    private static final BigInteger PRICE_GROWTH_DENOMINATOR = BigInteger.valueOf(100);

    private final int tokenDecimals;
    private final BigInteger tokenScale;
    private final BigInteger seedPrice;
    private final BigInteger priceIncrement;

    public PricingEngine(int tokenDecimals, BigInteger seedPrice, BigInteger priceIncrement) {
        if (seedPrice == null || seedPrice.signum() <= 0) {
            throw new IllegalArgumentException("Seed price must be positive");
        }
        if (priceIncrement == null || priceIncrement.signum() < 0) {
            throw new IllegalArgumentException("Price increment cannot be negative");
        }
        this.tokenDecimals = tokenDecimals;
        this.tokenScale = Units.scale(tokenDecimals);
        this.seedPrice = seedPrice;
        this.priceIncrement = priceIncrement;
    }

    // floor(nativeAmount * tokenScale / pricePerToken)
    public BigInteger tokensFor(BigInteger nativeAmount, BigInteger pricePerToken) {
        requirePositivePrice(pricePerToken);
        return nativeAmount.multiply(tokenScale).divide(pricePerToken);
    }

    // floor(tokenAmount * pricePerToken / tokenScale)
    public BigInteger costFor(BigInteger tokenAmount, BigInteger pricePerToken) {
        requirePositivePrice(pricePerToken);
        return tokenAmount.multiply(pricePerToken).divide(tokenScale);
    }

    // floor(previous * 103 / 100) + increment
    public BigInteger nextPrice(BigInteger previous) {
        return previous.multiply(PRICE_GROWTH_NUMERATOR).divide(PRICE_GROWTH_DENOMINATOR).add(priceIncrement);
    }

    /**
     * Price of the next sale round.
     *
     * @param saleRoundCount number of sale rounds already started
     * @param lastPrice price of the previous sale round (ignored for the first one)
     */
    public BigInteger salePrice(long saleRoundCount, BigInteger lastPrice) {
        return saleRoundCount == 0 ? seedPrice : nextPrice(lastPrice);
    }

    public int getTokenDecimals() {
        return tokenDecimals;
    }

    public BigInteger getSeedPrice() {
        return seedPrice;
    }

    private static void requirePositivePrice(BigInteger pricePerToken) {
        if (pricePerToken == null || pricePerToken.signum() <= 0) {
            throw new ArithmeticException("Price per token must be positive");
        }
    }
}

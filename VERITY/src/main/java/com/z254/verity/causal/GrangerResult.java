package com.z254.verity.causal;

/**
 * Outcome of testing whether one series' history improves prediction of another.
 *
 * @param lag      lag in steps of the best-scoring model
 * @param strength {@code (SSR_restricted - SSR_full) / SSR_restricted}, in {@code [0, 1]}
 * @param pValue   F-test p-value of the added lagged terms
 */
public record GrangerResult(int lag, double strength, double pValue) {

    public boolean isCredible(double pValueThreshold, double minStrength) {
        return pValue <= pValueThreshold && strength >= minStrength;
    }
}

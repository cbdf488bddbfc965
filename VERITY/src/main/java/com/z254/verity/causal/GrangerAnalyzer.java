package com.z254.verity.causal;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.distribution.FDistribution;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.stat.regression.OLSMultipleLinearRegression;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Granger-style lead test between two aligned series.
 * <p>
 * For each lag {@code L} in {@code 1..maxLag} the effect is regressed on its own {@code L}
 * lagged values (restricted model) and on those plus {@code L} lagged values of the cause
 * (full model), both with an intercept. The F statistic of the added terms gives the
 * p-value; the relative drop in residual sum of squares gives the strength. The lag with the
 * lowest p-value wins, ties going to the higher strength and then the shorter lag.
 */
@Slf4j
@Component
public class GrangerAnalyzer {

    private static final double SINGULARITY_THRESHOLD = 1e-10;

    /**
     * Test whether {@code cause} leads {@code effect}.
     *
     * @return empty when no lag can be tested (too few points, constant or collinear data)
     */
    public Optional<GrangerResult> test(double[] cause, double[] effect, int maxLag) {
        int n = Math.min(cause.length, effect.length);
        GrangerResult best = null;
        for (int lag = 1; lag <= maxLag; lag++) {
            Optional<GrangerResult> result = testLag(cause, effect, n, lag);
            if (result.isEmpty()) {
                continue;
            }
            GrangerResult candidate = result.get();
            if (best == null || better(candidate, best)) {
                best = candidate;
            }
        }
        return Optional.ofNullable(best);
    }

    private Optional<GrangerResult> testLag(double[] cause, double[] effect, int n, int lag) {
        int observations = n - lag;
        int denominatorDf = observations - 2 * lag - 1;
        if (denominatorDf <= 0) {
            return Optional.empty();
        }

        double[] y = new double[observations];
        double[][] restricted = new double[observations][lag];
        double[][] full = new double[observations][2 * lag];
        for (int t = lag; t < n; t++) {
            int row = t - lag;
            y[row] = effect[t];
            for (int k = 1; k <= lag; k++) {
                restricted[row][k - 1] = effect[t - k];
                full[row][k - 1] = effect[t - k];
                full[row][lag + k - 1] = cause[t - k];
            }
        }

        double ssrRestricted;
        double ssrFull;
        try {
            ssrRestricted = residualSumOfSquares(y, restricted);
            ssrFull = residualSumOfSquares(y, full);
        } catch (MathIllegalArgumentException e) {
            log.trace("Granger lag {} skipped: {}", lag, e.getMessage());
            return Optional.empty();
        }
        if (!(ssrRestricted > 0) || !Double.isFinite(ssrFull)) {
            return Optional.empty();
        }

        ssrFull = Math.max(0.0, Math.min(ssrFull, ssrRestricted));
        double strength = (ssrRestricted - ssrFull) / ssrRestricted;
        double pValue;
        if (ssrFull == 0.0) {
            pValue = 0.0;
        } else {
            double f = ((ssrRestricted - ssrFull) / lag) / (ssrFull / denominatorDf);
            pValue = 1.0 - new FDistribution(lag, denominatorDf).cumulativeProbability(f);
        }
        return Optional.of(new GrangerResult(lag, strength, Math.max(0.0, Math.min(1.0, pValue))));
    }

    private static double residualSumOfSquares(double[] y, double[][] x) {
        OLSMultipleLinearRegression regression = new OLSMultipleLinearRegression(SINGULARITY_THRESHOLD);
        regression.newSampleData(y, x);
        return regression.calculateResidualSumOfSquares();
    }

    private static boolean better(GrangerResult candidate, GrangerResult incumbent) {
        if (candidate.pValue() != incumbent.pValue()) {
            return candidate.pValue() < incumbent.pValue();
        }
        if (candidate.strength() != incumbent.strength()) {
            return candidate.strength() > incumbent.strength();
        }
        return candidate.lag() < incumbent.lag();
    }
}

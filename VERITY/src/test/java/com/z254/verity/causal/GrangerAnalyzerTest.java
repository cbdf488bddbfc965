package com.z254.verity.causal;

import org.junit.jupiter.api.Test;

import java.util.Optional;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link GrangerAnalyzer}.
 */
class GrangerAnalyzerTest {

    private final GrangerAnalyzer analyzer = new GrangerAnalyzer();

    @Test
    void detectsLaggedDependency() {
        double[][] pair = laggedPair(200, 42L);

        Optional<GrangerResult> result = analyzer.test(pair[0], pair[1], 3);

        assertThat(result).isPresent();
        assertThat(result.get().lag()).isEqualTo(1);
        assertThat(result.get().pValue()).isLessThan(0.01);
        assertThat(result.get().strength()).isGreaterThan(0.5);
        assertThat(result.get().isCredible(0.05, 0.1)).isTrue();
    }

    @Test
    void reverseDirectionIsWeak() {
        double[][] pair = laggedPair(200, 42L);

        Optional<GrangerResult> result = analyzer.test(pair[1], pair[0], 3);

        assertThat(result).isPresent();
        assertThat(result.get().strength()).isLessThan(0.1);
        assertThat(result.get().isCredible(0.05, 0.1)).isFalse();
    }

    @Test
    void skipsWhenTooFewPoints() {
        assertThat(analyzer.test(new double[]{1, 2, 3}, new double[]{2, 3, 4}, 3)).isEmpty();
    }

    @Test
    void skipsConstantEffect() {
        double[] cause = new double[50];
        double[] effect = new double[50];
        Random random = new Random(7L);
        for (int i = 0; i < 50; i++) {
            cause[i] = random.nextGaussian();
            effect[i] = 5.0;
        }

        assertThat(analyzer.test(cause, effect, 2)).isEmpty();
    }

    private static double[][] laggedPair(int n, long seed) {
        Random random = new Random(seed);
        double[] cause = new double[n];
        double[] effect = new double[n];
        for (int t = 0; t < n; t++) {
            cause[t] = random.nextGaussian();
            effect[t] = (t > 0 ? 0.8 * cause[t - 1] : 0.0) + 0.1 * random.nextGaussian();
        }
        return new double[][]{cause, effect};
    }
}

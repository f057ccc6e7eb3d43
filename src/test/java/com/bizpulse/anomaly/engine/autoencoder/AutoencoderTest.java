package com.bizpulse.anomaly.engine.autoencoder;

import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AutoencoderTest {

    private static double[][] diagonal(int n, long seed) {
        Random random = new Random(seed);
        double[][] data = new double[n][];
        for (int i = 0; i < n; i++) {
            double t = random.nextDouble() * 2;
            data[i] = new double[]{t, t};
        }
        return data;
    }

    private static double meanError(Autoencoder network, double[][] data) {
        double sum = 0;
        for (double[] row : data) sum += network.reconstructionError(row);
        return sum / data.length;
    }

    @Test
    void training_reducesReconstructionError() {
        double[][] data = diagonal(200, 1L);

        Autoencoder untrained = Autoencoder.train(data, 1, 0, 32, 0.01, 5L);
        Autoencoder trained = Autoencoder.train(data, 1, 200, 32, 0.01, 5L);

        assertThat(meanError(trained, data)).isLessThan(meanError(untrained, data));
    }

    @Test
    void reconstruct_keepsDimension() {
        Autoencoder network = Autoencoder.train(diagonal(20, 2L), 1, 5, 8, 0.01, 5L);

        assertThat(network.reconstruct(new double[]{0.5, 0.5})).hasSize(2);
        assertThatThrownBy(() -> network.reconstruct(new double[]{1, 2, 3}))
                .isInstanceOf(IllegalArgumentException.class);
    }
}

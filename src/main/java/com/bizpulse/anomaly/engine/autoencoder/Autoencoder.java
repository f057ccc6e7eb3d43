package com.bizpulse.anomaly.engine.autoencoder;

import java.util.Random;

/**
 * Single-hidden-layer autoencoder: {@code d -> h (ReLU) -> d (linear)}, trained on mean squared
 * reconstruction error with Adam. Weights are row-major flat arrays. Instances are immutable once
 * {@link #train} returns.
 */
public final class Autoencoder {

    private static final double BETA1 = 0.9;
    private static final double BETA2 = 0.999;
    private static final double ADAM_EPSILON = 1e-7;

    private final int inputDim;
    private final int hiddenDim;
    private final double[] w1; // hidden x input
    private final double[] b1;
    private final double[] w2; // input x hidden
    private final double[] b2;

    private Autoencoder(int inputDim, int hiddenDim, double[] w1, double[] b1, double[] w2, double[] b2) {
        this.inputDim = inputDim;
        this.hiddenDim = hiddenDim;
        this.w1 = w1;
        this.b1 = b1;
        this.w2 = w2;
        this.b2 = b2;
    }

    /**
     * Train on already-scaled data.
     *
     * @param data         training rows, all of the same width
     * @param hiddenDim    width of the bottleneck layer
     * @param epochs       passes over the data
     * @param batchSize    rows per gradient step
     * @param learningRate Adam step size
     * @param seed         seed for weight init and shuffling
     */
    public static Autoencoder train(double[][] data, int hiddenDim, int epochs, int batchSize,
                                    double learningRate, long seed) {
        if (data.length == 0) {
            throw new IllegalArgumentException("Cannot train an autoencoder on no data");
        }
        int d = data[0].length;
        int h = Math.max(1, hiddenDim);
        Random random = new Random(seed);

        double[] w1 = glorotUniform(h, d, random);
        double[] b1 = new double[h];
        double[] w2 = glorotUniform(d, h, random);
        double[] b2 = new double[d];

        Adam adamW1 = new Adam(w1.length);
        Adam adamB1 = new Adam(b1.length);
        Adam adamW2 = new Adam(w2.length);
        Adam adamB2 = new Adam(b2.length);

        int[] order = new int[data.length];
        for (int i = 0; i < order.length; i++) order[i] = i;

        double[] z1 = new double[h];
        double[] a1 = new double[h];
        double[] y = new double[d];
        double[] dy = new double[d];
        double[] dz1 = new double[h];

        int effectiveBatch = Math.max(1, batchSize);
        for (int epoch = 0; epoch < epochs; epoch++) {
            shuffle(order, random);
            for (int start = 0; start < order.length; start += effectiveBatch) {
                int end = Math.min(order.length, start + effectiveBatch);
                int n = end - start;

                double[] gw1 = new double[w1.length];
                double[] gb1 = new double[h];
                double[] gw2 = new double[w2.length];
                double[] gb2 = new double[d];

                for (int k = start; k < end; k++) {
                    double[] x = data[order[k]];
                    forward(x, w1, b1, w2, b2, d, h, z1, a1, y);

                    for (int j = 0; j < d; j++) {
                        dy[j] = 2.0 * (y[j] - x[j]) / d / n;
                        gb2[j] += dy[j];
                        for (int i = 0; i < h; i++) {
                            gw2[j * h + i] += dy[j] * a1[i];
                        }
                    }
                    for (int i = 0; i < h; i++) {
                        double da = 0.0;
                        for (int j = 0; j < d; j++) {
                            da += w2[j * h + i] * dy[j];
                        }
                        dz1[i] = z1[i] > 0 ? da : 0.0;
                        gb1[i] += dz1[i];
                        for (int j = 0; j < d; j++) {
                            gw1[i * d + j] += dz1[i] * x[j];
                        }
                    }
                }

                adamW1.step(w1, gw1, learningRate);
                adamB1.step(b1, gb1, learningRate);
                adamW2.step(w2, gw2, learningRate);
                adamB2.step(b2, gb2, learningRate);
            }
        }
        return new Autoencoder(d, h, w1, b1, w2, b2);
    }

    public double[] reconstruct(double[] x) {
        if (x.length != inputDim) {
            throw new IllegalArgumentException("Expected " + inputDim + " features, got " + x.length);
        }
        double[] z1 = new double[hiddenDim];
        double[] a1 = new double[hiddenDim];
        double[] y = new double[inputDim];
        forward(x, w1, b1, w2, b2, inputDim, hiddenDim, z1, a1, y);
        return y;
    }

    /**
     * Mean squared difference between a row and its reconstruction.
     */
    public double reconstructionError(double[] x) {
        double[] y = reconstruct(x);
        double sum = 0.0;
        for (int j = 0; j < inputDim; j++) {
            double diff = x[j] - y[j];
            sum += diff * diff;
        }
        return sum / inputDim;
    }

    public int getHiddenDim() {
        return hiddenDim;
    }

    private static void forward(double[] x, double[] w1, double[] b1, double[] w2, double[] b2,
                                int d, int h, double[] z1, double[] a1, double[] y) {
        for (int i = 0; i < h; i++) {
            double sum = b1[i];
            for (int j = 0; j < d; j++) {
                sum += w1[i * d + j] * x[j];
            }
            z1[i] = sum;
            a1[i] = Math.max(0.0, sum);
        }
        for (int j = 0; j < d; j++) {
            double sum = b2[j];
            for (int i = 0; i < h; i++) {
                sum += w2[j * h + i] * a1[i];
            }
            y[j] = sum;
        }
    }

    private static double[] glorotUniform(int rows, int cols, Random random) {
        double limit = Math.sqrt(6.0 / (rows + cols));
        double[] w = new double[rows * cols];
        for (int i = 0; i < w.length; i++) {
            w[i] = (random.nextDouble() * 2 - 1) * limit;
        }
        return w;
    }

    private static void shuffle(int[] order, Random random) {
        for (int i = order.length - 1; i > 0; i--) {
            int j = random.nextInt(i + 1);
            int tmp = order[i];
            order[i] = order[j];
            order[j] = tmp;
        }
    }

    private static final class Adam {
        private final double[] m;
        private final double[] v;
        private int t;

        Adam(int size) {
            this.m = new double[size];
            this.v = new double[size];
        }

        void step(double[] params, double[] grads, double learningRate) {
            t++;
            double correction1 = 1 - Math.pow(BETA1, t);
            double correction2 = 1 - Math.pow(BETA2, t);
            for (int i = 0; i < params.length; i++) {
                m[i] = BETA1 * m[i] + (1 - BETA1) * grads[i];
                v[i] = BETA2 * v[i] + (1 - BETA2) * grads[i] * grads[i];
                double mHat = m[i] / correction1;
                double vHat = v[i] / correction2;
                params[i] -= learningRate * mHat / (Math.sqrt(vHat) + ADAM_EPSILON);
            }
        }
    }
}

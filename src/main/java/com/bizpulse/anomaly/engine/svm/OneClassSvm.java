package com.bizpulse.anomaly.engine.svm;

/**
 * One-class SVM with an RBF kernel, solved by sequential minimal optimization.
 *
 * <p>Dual problem: minimize {@code 1/2 a'Ka} subject to {@code 0 <= a_i <= 1} and
 * {@code sum(a) = nu * l}. Each step picks the maximal violating pair and moves mass between
 * them. Only support vectors ({@code a_i > 0}) are retained after training.</p>
 *
 * <p>{@link #decisionValue} is positive inside the learned boundary and negative outside.</p>
 */
public final class OneClassSvm {

    private static final double TAU = 1e-12;

    private final double[][] supportVectors;
    private final double[] coefficients;
    private final double rho;
    private final double gamma;
    private final int iterations;

    private OneClassSvm(double[][] supportVectors, double[] coefficients, double rho, double gamma, int iterations) {
        this.supportVectors = supportVectors;
        this.coefficients = coefficients;
        this.rho = rho;
        this.gamma = gamma;
        this.iterations = iterations;
    }

    /**
     * @param data          training rows, already scaled
     * @param nu            upper bound on the training outlier fraction, in (0, 1]
     * @param gamma         RBF kernel width
     * @param tolerance     stopping tolerance on the KKT violation
     * @param maxIterations hard cap on SMO steps
     */
    public static OneClassSvm train(double[][] data, double nu, double gamma, double tolerance, int maxIterations) {
        int l = data.length;
        if (l == 0) {
            throw new IllegalArgumentException("Cannot train a one-class SVM on no data");
        }
        if (nu <= 0 || nu > 1) {
            throw new IllegalArgumentException("nu must be in (0, 1], got: " + nu);
        }
        if (gamma <= 0) {
            throw new IllegalArgumentException("gamma must be > 0, got: " + gamma);
        }

        double[][] k = new double[l][l];
        for (int i = 0; i < l; i++) {
            k[i][i] = 1.0;
            for (int j = i + 1; j < l; j++) {
                double v = rbf(data[i], data[j], gamma);
                k[i][j] = v;
                k[j][i] = v;
            }
        }

        double[] alpha = new double[l];
        double total = nu * l;
        int full = (int) total;
        for (int i = 0; i < Math.min(full, l); i++) {
            alpha[i] = 1.0;
        }
        if (full < l) {
            alpha[full] = total - full;
        }

        double[] grad = new double[l];
        for (int i = 0; i < l; i++) {
            if (alpha[i] == 0) continue;
            for (int t = 0; t < l; t++) {
                grad[t] += alpha[i] * k[t][i];
            }
        }

        int iter = 0;
        while (iter < maxIterations) {
            int up = -1;
            int down = -1;
            double gMin = Double.POSITIVE_INFINITY;
            double gMax = Double.NEGATIVE_INFINITY;
            for (int t = 0; t < l; t++) {
                if (alpha[t] < 1.0 && grad[t] < gMin) {
                    gMin = grad[t];
                    up = t;
                }
                if (alpha[t] > 0.0 && grad[t] > gMax) {
                    gMax = grad[t];
                    down = t;
                }
            }
            if (up < 0 || down < 0 || gMax - gMin < tolerance) {
                break;
            }

            double eta = k[up][up] + k[down][down] - 2 * k[up][down];
            if (eta <= 0) {
                eta = TAU;
            }
            double delta = (gMax - gMin) / eta;
            delta = Math.min(delta, 1.0 - alpha[up]);
            delta = Math.min(delta, alpha[down]);

            alpha[up] += delta;
            alpha[down] -= delta;
            for (int t = 0; t < l; t++) {
                grad[t] += delta * (k[t][up] - k[t][down]);
            }
            iter++;
        }

        double rho = computeRho(alpha, grad);

        int svCount = 0;
        for (double a : alpha) {
            if (a > 0) svCount++;
        }
        double[][] sv = new double[svCount][];
        double[] coef = new double[svCount];
        int s = 0;
        for (int i = 0; i < l; i++) {
            if (alpha[i] > 0) {
                sv[s] = data[i].clone();
                coef[s] = alpha[i];
                s++;
            }
        }
        return new OneClassSvm(sv, coef, rho, gamma, iter);
    }

    private static double computeRho(double[] alpha, double[] grad) {
        double ub = Double.POSITIVE_INFINITY;
        double lb = Double.NEGATIVE_INFINITY;
        double freeSum = 0.0;
        int freeCount = 0;
        for (int i = 0; i < alpha.length; i++) {
            if (alpha[i] >= 1.0) {
                lb = Math.max(lb, grad[i]);
            } else if (alpha[i] <= 0.0) {
                ub = Math.min(ub, grad[i]);
            } else {
                freeSum += grad[i];
                freeCount++;
            }
        }
        if (freeCount > 0) {
            return freeSum / freeCount;
        }
        if (Double.isInfinite(ub)) return lb;
        if (Double.isInfinite(lb)) return ub;
        return (ub + lb) / 2;
    }

    /**
     * {@code sum(a_i * K(sv_i, x)) - rho}; negative outside the boundary.
     */
    public double decisionValue(double[] x) {
        double sum = 0.0;
        for (int i = 0; i < supportVectors.length; i++) {
            sum += coefficients[i] * rbf(supportVectors[i], x, gamma);
        }
        return sum - rho;
    }

    public int getSupportVectorCount() {
        return supportVectors.length;
    }

    public double getGamma() {
        return gamma;
    }

    public int getIterations() {
        return iterations;
    }

    static double rbf(double[] a, double[] b, double gamma) {
        if (a.length != b.length) {
            throw new IllegalArgumentException("Expected " + a.length + " features, got " + b.length);
        }
        double sq = 0.0;
        for (int i = 0; i < a.length; i++) {
            double d = a[i] - b[i];
            sq += d * d;
        }
        return Math.exp(-gamma * sq);
    }
}

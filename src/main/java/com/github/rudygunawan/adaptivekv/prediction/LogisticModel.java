package com.github.rudygunawan.adaptivekv.prediction;

import java.util.List;

/**
 * Logistic regression over the five access features. Instances are immutable; training produces
 * a new model.
 */
final class LogisticModel {
    static final int FEATURE_COUNT = 5;

    private static final double LEARNING_RATE = 0.05;
    private static final int EPOCHS = 100;

    private final double[] weights;
    private final double bias;

    private LogisticModel(double[] weights, double bias) {
        this.weights = weights;
        this.bias = bias;
    }

    /**
     * Fits a model by stochastic gradient descent, starting from zero weights.
     *
     * @throws IllegalStateException if the fit diverges to non-finite weights
     */
    static LogisticModel fit(List<TrainingSample> samples) {
        double[] w = new double[FEATURE_COUNT];
        double b = 0;
        for (int epoch = 0; epoch < EPOCHS; epoch++) {
            for (TrainingSample sample : samples) {
                double[] x = sample.features();
                double error = (sample.isHit() ? 1.0 : 0.0) - sigmoid(dot(w, x) + b);
                for (int i = 0; i < FEATURE_COUNT; i++) {
                    w[i] += LEARNING_RATE * error * x[i];
                }
                b += LEARNING_RATE * error;
            }
        }
        for (double weight : w) {
            if (!Double.isFinite(weight)) {
                throw new IllegalStateException("training diverged");
            }
        }
        if (!Double.isFinite(b)) {
            throw new IllegalStateException("training diverged");
        }
        return new LogisticModel(w, b);
    }

    double predict(double[] features) {
        return sigmoid(dot(weights, features) + bias);
    }

    private static double dot(double[] w, double[] x) {
        double sum = 0;
        for (int i = 0; i < FEATURE_COUNT; i++) {
            sum += w[i] * x[i];
        }
        return sum;
    }

    private static double sigmoid(double z) {
        return 1.0 / (1.0 + Math.exp(-z));
    }
}

package com.kotsin.forecast.adapter.sequence;

/**
 * AdamOptimizer - Adam update over a flat parameter vector.
 */
final class AdamOptimizer {

    private static final double BETA1 = 0.9;
    private static final double BETA2 = 0.999;
    private static final double EPS = 1e-8;

    private final double learningRate;
    private final double[] firstMoment;
    private final double[] secondMoment;
    private int step;

    AdamOptimizer(int size, double learningRate) {
        this.learningRate = learningRate;
        this.firstMoment = new double[size];
        this.secondMoment = new double[size];
    }

    void step(double[] parameters, double[] gradients) {
        step++;
        double correction1 = 1.0 - Math.pow(BETA1, step);
        double correction2 = 1.0 - Math.pow(BETA2, step);
        for (int i = 0; i < parameters.length; i++) {
            double g = gradients[i];
            firstMoment[i] = BETA1 * firstMoment[i] + (1 - BETA1) * g;
            secondMoment[i] = BETA2 * secondMoment[i] + (1 - BETA2) * g * g;
            double mHat = firstMoment[i] / correction1;
            double vHat = secondMoment[i] / correction2;
            parameters[i] -= learningRate * mHat / (Math.sqrt(vHat) + EPS);
        }
    }
}

package com.kotsin.forecast.adapter.decomposition;

import com.kotsin.forecast.util.LinearAlgebra;
import lombok.Builder;
import lombok.Getter;

import java.time.Instant;
import java.util.List;

/**
 * DecompositionModel - Fitted additive model
 * {@code y = trend(t) + sum(seasonality(t)) + sum(beta * regressor)}.
 *
 * Trend is piecewise linear in scaled time with changepoints. All coefficients act on
 * {@code y / yScale}; components are returned in original units.
 */
@Getter
@Builder
public class DecompositionModel {

    private final long originEpochSecond;
    private final double timeScaleSeconds;
    private final double yScale;

    /**
     * Changepoint locations in scaled time
     */
    private final double[] changepoints;

    /**
     * [offset, slope, changepoint deltas..., seasonal terms..., regressor betas...]
     */
    private final double[] coefficients;

    private final List<Seasonality> seasonalities;

    private final List<String> regressorNames;
    private final double[] regressorMeans;
    private final double[] regressorStds;

    /**
     * Standard deviation of training residuals, original units
     */
    private final double residualSigma;

    public int width() {
        int width = 2 + changepoints.length;
        for (Seasonality seasonality : seasonalities) {
            width += seasonality.width();
        }
        return width + regressorNames.size();
    }

    double scaledTime(Instant timestamp) {
        return (timestamp.getEpochSecond() - originEpochSecond) / timeScaleSeconds;
    }

    /**
     * Trend at a timestamp, original units
     */
    public double trend(Instant timestamp) {
        double t = scaledTime(timestamp);
        double value = coefficients[0] + coefficients[1] * t;
        for (int j = 0; j < changepoints.length; j++) {
            if (t > changepoints[j]) {
                value += coefficients[2 + j] * (t - changepoints[j]);
            }
        }
        return value * yScale;
    }

    /**
     * One seasonal component at a timestamp, original units
     */
    public double seasonal(String name, Instant timestamp) {
        int offset = 2 + changepoints.length;
        for (Seasonality seasonality : seasonalities) {
            if (seasonality.getName().equals(name)) {
                double[] terms = new double[seasonality.width()];
                seasonality.fill(timestamp, terms, 0);
                double value = 0.0;
                for (int i = 0; i < terms.length; i++) {
                    value += coefficients[offset + i] * terms[i];
                }
                return value * yScale;
            }
            offset += seasonality.width();
        }
        return 0.0;
    }

    public boolean hasSeasonality(String name) {
        return seasonalities.stream().anyMatch(s -> s.getName().equals(name));
    }

    /**
     * Regressor contribution for raw (unstandardized) regressor values, original units
     */
    public double regressorEffect(double[] rawValues) {
        int offset = width() - regressorNames.size();
        double[] standardized = new double[rawValues.length];
        for (int i = 0; i < rawValues.length; i++) {
            standardized[i] = (rawValues[i] - regressorMeans[i]) / regressorStds[i];
        }
        double[] betas = new double[regressorNames.size()];
        System.arraycopy(coefficients, offset, betas, 0, betas.length);
        return LinearAlgebra.dot(betas, standardized) * yScale;
    }
}

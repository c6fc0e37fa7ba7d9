package com.kotsin.forecast.adapter.decomposition;

import com.kotsin.forecast.adapter.ModelAdapter;
import com.kotsin.forecast.adapter.ModelFamily;
import com.kotsin.forecast.adapter.ModelRun;
import com.kotsin.forecast.config.ForecastConfig;
import com.kotsin.forecast.config.ProcessingConstants;
import com.kotsin.forecast.exception.DataException;
import com.kotsin.forecast.exception.ModelException;
import com.kotsin.forecast.feature.FeatureEngineer;
import com.kotsin.forecast.feature.RegressorFrame;
import com.kotsin.forecast.logging.PipelineTraceLogger;
import com.kotsin.forecast.model.ForecastResult;
import com.kotsin.forecast.model.RunConfig;
import com.kotsin.forecast.model.TimeSeriesPoint;
import com.kotsin.forecast.model.TrainTestSplit;
import com.kotsin.forecast.model.Utility;
import com.kotsin.forecast.model.UtilitySeries;
import com.kotsin.forecast.split.DatasetSplitter;
import com.kotsin.forecast.util.LinearAlgebra;
import com.kotsin.forecast.util.MathUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * DecompositionAdapter - Additive trend + seasonality model with linear regressors.
 *
 * Trend: piecewise linear with changepoints over the first part of the training history.
 * Seasonalities: Fourier series for yearly, weekly and daily cycles.
 * Fit: penalized least squares; the changepoint penalty {@code 1 / changepointPriorScale^2}
 * controls trend rigidity.
 *
 * Forecasts carry trend/weekly/yearly/daily components and an uncertainty interval, and
 * can be requested at any (irregular) set of future timestamps.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DecompositionAdapter implements ModelAdapter {

    private static final double TREND_SLOPE_PENALTY = 1.0 / 25.0;

    private final ForecastConfig config;
    private final FeatureEngineer featureEngineer;
    private final DatasetSplitter splitter;
    private final PipelineTraceLogger trace;

    @Override
    public ModelFamily family() {
        return ModelFamily.DECOMPOSITION;
    }

    @Override
    public String modelName() {
        return config.getDecomposition().getModelName();
    }

    @Override
    public boolean isEnabled() {
        return config.getDecomposition().isEnabled();
    }

    // ======================== EVALUATION ========================

    @Override
    public ModelRun evaluate(UtilitySeries series, RunConfig runConfig) {
        ForecastConfig.DecompositionConfig settings = config.getDecomposition();
        List<TimeSeriesPoint> points = featureEngineer.valuedPoints(series);
        RegressorFrame frame = featureEngineer.regressors(points, settings.getRegressors());
        trace.logFeatures(modelName(), series.describe(), points.size(), points.size(),
                frame.width() + 1);

        TrainTestSplit<TimeSeriesPoint> split = splitter.split(points, settings.getSplit().toPolicy());
        trace.logSplit(modelName(), split.getPolicy(), split.trainSize(), split.testSize());
        int boundary = split.trainSize();

        long started = System.currentTimeMillis();
        DecompositionModel model = train(
                timestamps(split.getTrain()),
                values(split.getTrain()),
                slice(frame, 0, boundary));
        long elapsed = System.currentTimeMillis() - started;
        trace.logModelTrained(modelName(), boundary, elapsed, String.format("changepoints=%d sigma=%.3f",
                model.getChangepoints().length, model.getResidualSigma()));

        List<ForecastResult> predicted = predict(model, timestamps(split.getTest()),
                slice(frame, boundary, points.size()), series.getUtility());
        List<ForecastResult> withActuals = new ArrayList<>(predicted.size());
        for (int i = 0; i < predicted.size(); i++) {
            withActuals.add(predicted.get(i).toBuilder().actual(split.getTest().get(i).getValue()).build());
        }

        return ModelRun.builder()
                .modelName(modelName())
                .family(family())
                .forecasts(withActuals)
                .trainSize(boundary)
                .testSize(split.testSize())
                .trainingMillis(elapsed)
                .build();
    }

    // ======================== TRAINING ========================

    /**
     * Fit the additive model.
     *
     * @param timestamps training timestamps, strictly increasing
     * @param y          training targets
     * @param regressors regressor columns aligned with {@code timestamps}
     */
    public DecompositionModel train(List<Instant> timestamps, double[] y, Map<String, double[]> regressors) {
        ForecastConfig.DecompositionConfig settings = config.getDecomposition();
        int n = timestamps.size();
        if (n < 2) {
            throw DataException.insufficientHistory(2, n);
        }

        long origin = timestamps.get(0).getEpochSecond();
        double timeScale = Math.max(1.0, timestamps.get(n - 1).getEpochSecond() - origin);
        double yScale = 0.0;
        for (double v : y) {
            yScale = Math.max(yScale, Math.abs(v));
        }
        if (yScale == 0.0) {
            yScale = 1.0;
        }

        double[] changepoints = placeChangepoints(timestamps, origin, timeScale, settings);
        List<Seasonality> seasonalities = seasonalities(settings);

        List<String> regressorNames = new ArrayList<>(regressors.keySet());
        double[] means = new double[regressorNames.size()];
        double[] stds = new double[regressorNames.size()];
        for (int r = 0; r < regressorNames.size(); r++) {
            double[] column = regressors.get(regressorNames.get(r));
            means[r] = MathUtils.mean(column, 0.0);
            double std = MathUtils.populationStdDev(column);
            stds[r] = std > ProcessingConstants.EPSILON ? std : 1.0;
        }

        DecompositionModel.DecompositionModelBuilder shape = DecompositionModel.builder()
                .originEpochSecond(origin)
                .timeScaleSeconds(timeScale)
                .yScale(yScale)
                .changepoints(changepoints)
                .seasonalities(seasonalities)
                .regressorNames(regressorNames)
                .regressorMeans(means)
                .regressorStds(stds);
        DecompositionModel skeleton = shape.coefficients(new double[0]).residualSigma(0.0).build();
        int width = skeleton.width();

        double[][] design = new double[n][];
        double[] scaledY = new double[n];
        for (int i = 0; i < n; i++) {
            design[i] = designRow(skeleton, timestamps.get(i), rawRegressors(regressorNames, regressors, i));
            scaledY[i] = y[i] / yScale;
        }

        double[] coefficients = LinearAlgebra.ridge(design, scaledY, penalties(skeleton, width, settings));
        if (!MathUtils.allFinite(coefficients)) {
            throw new ModelException(modelName() + ": least-squares solution is not finite");
        }

        double sse = 0.0;
        for (int i = 0; i < n; i++) {
            double residual = (scaledY[i] - LinearAlgebra.dot(design[i], coefficients)) * yScale;
            sse += residual * residual;
        }
        double sigma = Math.sqrt(sse / n);

        return shape.coefficients(coefficients).residualSigma(sigma).build();
    }

    private double[] placeChangepoints(List<Instant> timestamps, long origin, double timeScale,
                                       ForecastConfig.DecompositionConfig settings) {
        int historySize = (int) Math.floor(timestamps.size() * settings.getChangepointRange());
        int count = Math.min(settings.getChangepoints(), historySize - 1);
        if (count <= 0) {
            return new double[0];
        }
        double[] changepoints = new double[count];
        // evenly spaced over the history, first point excluded
        for (int j = 1; j <= count; j++) {
            int index = (int) Math.round((double) j * (historySize - 1) / count);
            changepoints[j - 1] = (timestamps.get(index).getEpochSecond() - origin) / timeScale;
        }
        return changepoints;
    }

    private static List<Seasonality> seasonalities(ForecastConfig.DecompositionConfig settings) {
        List<Seasonality> seasonalities = new ArrayList<>();
        if (settings.isYearlySeasonality() && settings.getYearlyOrder() > 0) {
            seasonalities.add(new Seasonality("yearly", ProcessingConstants.YEAR_PERIOD_DAYS, settings.getYearlyOrder()));
        }
        if (settings.isWeeklySeasonality() && settings.getWeeklyOrder() > 0) {
            seasonalities.add(new Seasonality("weekly", ProcessingConstants.WEEK_PERIOD_DAYS, settings.getWeeklyOrder()));
        }
        if (settings.isDailySeasonality() && settings.getDailyOrder() > 0) {
            seasonalities.add(new Seasonality("daily", ProcessingConstants.DAY_PERIOD_DAYS, settings.getDailyOrder()));
        }
        return seasonalities;
    }

    private static double[] penalties(DecompositionModel skeleton, int width,
                                      ForecastConfig.DecompositionConfig settings) {
        double[] penalty = new double[width];
        penalty[0] = ProcessingConstants.MIN_RIDGE;
        penalty[1] = TREND_SLOPE_PENALTY;
        int column = 2;
        double changepointPenalty = 1.0 / (settings.getChangepointPriorScale() * settings.getChangepointPriorScale());
        for (int j = 0; j < skeleton.getChangepoints().length; j++) {
            penalty[column++] = changepointPenalty;
        }
        double seasonalPenalty = 1.0 / (settings.getSeasonalityPriorScale() * settings.getSeasonalityPriorScale());
        for (Seasonality seasonality : skeleton.getSeasonalities()) {
            for (int k = 0; k < seasonality.width(); k++) {
                penalty[column++] = seasonalPenalty;
            }
        }
        double regressorPenalty = 1.0 / (settings.getRegressorPriorScale() * settings.getRegressorPriorScale());
        while (column < width) {
            penalty[column++] = regressorPenalty;
        }
        return penalty;
    }

    private static double[] designRow(DecompositionModel skeleton, Instant timestamp, double[] rawRegressors) {
        double[] row = new double[skeleton.width()];
        double t = skeleton.scaledTime(timestamp);
        row[0] = 1.0;
        row[1] = t;
        int column = 2;
        for (double changepoint : skeleton.getChangepoints()) {
            row[column++] = Math.max(0.0, t - changepoint);
        }
        for (Seasonality seasonality : skeleton.getSeasonalities()) {
            seasonality.fill(timestamp, row, column);
            column += seasonality.width();
        }
        for (int r = 0; r < rawRegressors.length; r++) {
            row[column++] = (rawRegressors[r] - skeleton.getRegressorMeans()[r]) / skeleton.getRegressorStds()[r];
        }
        return row;
    }

    // ======================== PREDICTION ========================

    /**
     * Forecast at arbitrary timestamps. Regressor columns the model was trained with but that
     * are absent here, or NaN entries, take the training mean.
     */
    public List<ForecastResult> predict(DecompositionModel model, List<Instant> timestamps,
                                        Map<String, double[]> regressors, Utility utility) {
        double z = MathUtils.normalQuantile(0.5 + config.getDecomposition().getIntervalWidth() / 2.0);
        double halfWidth = z * model.getResidualSigma();
        List<ForecastResult> results = new ArrayList<>(timestamps.size());

        for (int i = 0; i < timestamps.size(); i++) {
            Instant ts = timestamps.get(i);
            double[] raw = new double[model.getRegressorNames().size()];
            for (int r = 0; r < raw.length; r++) {
                double[] column = regressors.get(model.getRegressorNames().get(r));
                double value = column == null || i >= column.length ? Double.NaN : column[i];
                raw[r] = MathUtils.isValidNumber(value) ? value : model.getRegressorMeans()[r];
            }

            double trend = model.trend(ts);
            double yearly = model.seasonal("yearly", ts);
            double weekly = model.seasonal("weekly", ts);
            double daily = model.seasonal("daily", ts);
            double estimate = trend + yearly + weekly + daily + model.regressorEffect(raw);

            results.add(ForecastResult.builder()
                    .modelName(modelName())
                    .utility(utility)
                    .timestamp(ts)
                    .pointEstimate(estimate)
                    .lowerBound(estimate - halfWidth)
                    .upperBound(estimate + halfWidth)
                    .trend(trend)
                    .yearly(model.hasSeasonality("yearly") ? yearly : null)
                    .weekly(model.hasSeasonality("weekly") ? weekly : null)
                    .daily(model.hasSeasonality("daily") ? daily : null)
                    .build());
        }
        return results;
    }

    // ======================== HELPERS ========================

    private static List<Instant> timestamps(List<TimeSeriesPoint> points) {
        List<Instant> timestamps = new ArrayList<>(points.size());
        for (TimeSeriesPoint point : points) {
            timestamps.add(point.getTimestamp());
        }
        return timestamps;
    }

    private static double[] values(List<TimeSeriesPoint> points) {
        double[] values = new double[points.size()];
        for (int i = 0; i < points.size(); i++) {
            values[i] = points.get(i).getValue();
        }
        return values;
    }

    private static Map<String, double[]> slice(RegressorFrame frame, int from, int to) {
        Map<String, double[]> columns = new LinkedHashMap<>();
        for (String name : frame.names()) {
            columns.put(name, Arrays.copyOfRange(frame.column(name), from, to));
        }
        return columns;
    }

    private static double[] rawRegressors(List<String> names, Map<String, double[]> regressors, int row) {
        double[] raw = new double[names.size()];
        for (int r = 0; r < names.size(); r++) {
            raw[r] = regressors.get(names.get(r))[row];
        }
        return raw;
    }
}

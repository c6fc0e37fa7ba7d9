package com.kotsin.forecast.adapter.boosting;

import com.kotsin.forecast.adapter.ModelAdapter;
import com.kotsin.forecast.adapter.ModelFamily;
import com.kotsin.forecast.adapter.ModelRun;
import com.kotsin.forecast.config.ForecastConfig;
import com.kotsin.forecast.exception.ModelException;
import com.kotsin.forecast.feature.FeatureEngineer;
import com.kotsin.forecast.logging.PipelineTraceLogger;
import com.kotsin.forecast.model.FeatureTable;
import com.kotsin.forecast.model.FeatureVector;
import com.kotsin.forecast.model.ForecastResult;
import com.kotsin.forecast.model.RunConfig;
import com.kotsin.forecast.model.TrainTestSplit;
import com.kotsin.forecast.model.UtilitySeries;
import com.kotsin.forecast.split.DatasetSplitter;
import com.kotsin.forecast.util.MathUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

/**
 * GradientBoostedAdapter - Squared-error gradient boosting over the flat feature table.
 *
 * Each round: gradients from the current prediction, a row sample and a column sample
 * (seeded), one histogram-split tree, prediction update scaled by the learning rate.
 * The base score is the training mean.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GradientBoostedAdapter implements ModelAdapter {

    private final ForecastConfig config;
    private final FeatureEngineer featureEngineer;
    private final DatasetSplitter splitter;
    private final PipelineTraceLogger trace;

    @Override
    public ModelFamily family() {
        return ModelFamily.GRADIENT_BOOSTED;
    }

    @Override
    public String modelName() {
        return config.getBoosting().getModelName();
    }

    @Override
    public boolean isEnabled() {
        return config.getBoosting().isEnabled();
    }

    // ======================== EVALUATION ========================

    @Override
    public ModelRun evaluate(UtilitySeries series, RunConfig runConfig) {
        ForecastConfig.BoostingConfig settings = config.getBoosting();
        FeatureTable table = featureEngineer.buildTabular(series, settings.getRegressors());
        trace.logFeatures(modelName(), series.describe(), series.size(), table.size(),
                table.getFeatureNames().size());

        TrainTestSplit<FeatureVector> split = splitter.split(table.getRows(), settings.getSplit().toPolicy());
        trace.logSplit(modelName(), split.getPolicy(), split.trainSize(), split.testSize());

        long started = System.currentTimeMillis();
        BoostedEnsemble ensemble = train(table.getFeatureNames(), split.getTrain(), runConfig.getSeed());
        long elapsed = System.currentTimeMillis() - started;
        trace.logModelTrained(modelName(), split.trainSize(), elapsed,
                String.format("trees=%d base=%.3f", ensemble.treeCount(), ensemble.getBaseScore()));

        List<ForecastResult> forecasts = new ArrayList<>(split.testSize());
        for (FeatureVector row : split.getTest()) {
            forecasts.add(ForecastResult.builder()
                    .modelName(modelName())
                    .utility(series.getUtility())
                    .timestamp(row.getTimestamp())
                    .pointEstimate(ensemble.predict(row.toArray()))
                    .actual(row.getTarget())
                    .build());
        }

        return ModelRun.builder()
                .modelName(modelName())
                .family(family())
                .forecasts(forecasts)
                .importances(ensemble.importances())
                .trainSize(split.trainSize())
                .testSize(split.testSize())
                .trainingMillis(elapsed)
                .build();
    }

    // ======================== TRAINING ========================

    /**
     * Fit an ensemble on the given rows.
     *
     * @throws ModelException if predictions stop being finite
     */
    public BoostedEnsemble train(List<String> featureNames, List<FeatureVector> rows, long seed) {
        ForecastConfig.BoostingConfig settings = config.getBoosting();
        int n = rows.size();
        int width = featureNames.size();
        Random random = new Random(seed);

        double[][] matrix = new double[n][];
        double[][] columns = new double[width][n];
        double[] y = new double[n];
        for (int r = 0; r < n; r++) {
            FeatureVector row = rows.get(r);
            matrix[r] = row.toArray();
            y[r] = row.getTarget();
            for (int f = 0; f < width; f++) {
                columns[f][r] = matrix[r][f];
            }
        }
        FeatureBinner binner = FeatureBinner.fit(columns, settings.getMaxBins());
        int[][] binned = binner.transform(columns);

        double baseScore = MathUtils.mean(y, 0.0);
        double[] predictions = new double[n];
        Arrays.fill(predictions, baseScore);
        double[] gradients = new double[n];
        double[] hessians = new double[n];
        Arrays.fill(hessians, 1.0);
        double[] gains = new double[width];

        RegressionTree.GrowthParams params = new RegressionTree.GrowthParams(settings.getMaxDepth(),
                settings.getLambda(), settings.getMinChildWeight(), settings.getLearningRate());
        List<RegressionTree> trees = new ArrayList<>(settings.getTrees());
        for (int round = 0; round < settings.getTrees(); round++) {
            for (int r = 0; r < n; r++) {
                gradients[r] = predictions[r] - y[r];
            }
            int[] sampledRows = sampleRows(n, settings.getSubsample(), random);
            int[] sampledColumns = sampleColumns(width, settings.getColsampleByTree(), random);

            RegressionTree tree = RegressionTree.grow(binned, binner, gradients, hessians,
                    sampledRows, sampledColumns, params, gains);
            trees.add(tree);

            for (int r = 0; r < n; r++) {
                predictions[r] += tree.predict(matrix[r]);
                if (!MathUtils.isValidNumber(predictions[r])) {
                    throw new ModelException(modelName() + ": predictions diverged at round " + round + " (row " + r + ")");
                }
            }
        }
        log.debug("[MODEL] {} grown {} trees over {} rows x {} features", modelName(), trees.size(), n, width);
        return new BoostedEnsemble(featureNames, baseScore, trees, gains);
    }

    private static int[] sampleRows(int n, double fraction, Random random) {
        if (fraction >= 1.0) {
            int[] all = new int[n];
            for (int i = 0; i < n; i++) {
                all[i] = i;
            }
            return all;
        }
        int[] picked = new int[n];
        int count = 0;
        for (int i = 0; i < n; i++) {
            if (random.nextDouble() < fraction) {
                picked[count++] = i;
            }
        }
        if (count == 0) {
            picked[count++] = random.nextInt(n);
        }
        return Arrays.copyOf(picked, count);
    }

    private static int[] sampleColumns(int width, double fraction, Random random) {
        int[] order = new int[width];
        for (int i = 0; i < width; i++) {
            order[i] = i;
        }
        int keep = Math.max(1, (int) Math.round(width * Math.min(1.0, fraction)));
        for (int i = width - 1; i > 0; i--) {
            int j = random.nextInt(i + 1);
            int tmp = order[i];
            order[i] = order[j];
            order[j] = tmp;
        }
        int[] chosen = Arrays.copyOf(order, keep);
        Arrays.sort(chosen);
        return chosen;
    }
}

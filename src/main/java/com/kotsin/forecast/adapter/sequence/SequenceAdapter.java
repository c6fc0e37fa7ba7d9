package com.kotsin.forecast.adapter.sequence;

import com.kotsin.forecast.adapter.ModelAdapter;
import com.kotsin.forecast.adapter.ModelFamily;
import com.kotsin.forecast.adapter.ModelRun;
import com.kotsin.forecast.config.ForecastConfig;
import com.kotsin.forecast.exception.DataException;
import com.kotsin.forecast.exception.ModelException;
import com.kotsin.forecast.feature.FeatureEngineer;
import com.kotsin.forecast.feature.MinMaxScaler;
import com.kotsin.forecast.feature.SequenceBuffer;
import com.kotsin.forecast.feature.SlidingWindows;
import com.kotsin.forecast.logging.PipelineTraceLogger;
import com.kotsin.forecast.model.ForecastResult;
import com.kotsin.forecast.model.RunConfig;
import com.kotsin.forecast.model.Timestamped;
import com.kotsin.forecast.model.TrainTestSplit;
import com.kotsin.forecast.model.UtilitySeries;
import com.kotsin.forecast.split.DatasetSplitter;
import com.kotsin.forecast.util.MathUtils;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.AbstractList;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * SequenceAdapter - Stacked recurrent network over fixed-length sliding windows.
 *
 * Flow:
 * 1. Per-reading rows {energy, hour, day_of_week, is_weekend, regressors}
 * 2. Temporal split over windows (by target timestamp)
 * 3. Min-max scaling fit on the rows training windows can see, then one scaled copy
 * 4. Mini-batch Adam on MSE with early stopping on training loss
 * 5. Test predictions inverse-transformed to original units
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SequenceAdapter implements ModelAdapter {

    private final ForecastConfig config;
    private final FeatureEngineer featureEngineer;
    private final DatasetSplitter splitter;
    private final PipelineTraceLogger trace;

    @Override
    public ModelFamily family() {
        return ModelFamily.SEQUENCE;
    }

    @Override
    public String modelName() {
        return config.getSequence().getModelName();
    }

    @Override
    public boolean isEnabled() {
        return config.getSequence().isEnabled();
    }

    /**
     * Trained network plus the scaler needed to read its output in original units.
     */
    @Getter
    public static final class FittedSequenceModel {
        private final LstmNetwork network;
        private final MinMaxScaler scaler;
        private final int epochsRun;
        private final double finalLoss;

        FittedSequenceModel(LstmNetwork network, MinMaxScaler scaler, int epochsRun, double finalLoss) {
            this.network = network;
            this.scaler = scaler;
            this.epochsRun = epochsRun;
            this.finalLoss = finalLoss;
        }
    }

    // ======================== EVALUATION ========================

    @Override
    public ModelRun evaluate(UtilitySeries series, RunConfig runConfig) {
        ForecastConfig.SequenceConfig settings = config.getSequence();
        int windowLength = settings.getWindowLength();

        SequenceBuffer raw = featureEngineer.buildSequence(series, settings.getRegressors());
        if (raw.rows() < windowLength + 2) {
            throw DataException.insufficientHistory(windowLength + 2, raw.rows());
        }
        SlidingWindows rawWindows = raw.windows(windowLength);
        trace.logFeatures(modelName(), series.describe(), raw.rows(), rawWindows.count(), raw.columns());

        TrainTestSplit<Timestamped> split = splitter.split(timeline(rawWindows), settings.getSplit().toPolicy());
        int boundary = split.trainSize();
        trace.logSplit(modelName(), split.getPolicy(), boundary, split.testSize());

        // statistics only from rows the training windows read, targets included
        MinMaxScaler scaler = MinMaxScaler.fit(raw, rawWindows.lastRowOf(boundary - 1) + 1);
        SlidingWindows windows = raw.scaled(scaler).windows(windowLength);

        long started = System.currentTimeMillis();
        FittedSequenceModel model = train(windows, boundary, scaler, runConfig.getSeed());
        long elapsed = System.currentTimeMillis() - started;
        trace.logModelTrained(modelName(), boundary, elapsed,
                String.format("epochs=%d loss=%.6f", model.getEpochsRun(), model.getFinalLoss()));

        List<ForecastResult> forecasts = predict(model, raw, windows, boundary, windows.count(), series);
        return ModelRun.builder()
                .modelName(modelName())
                .family(family())
                .forecasts(forecasts)
                .trainSize(boundary)
                .testSize(split.testSize())
                .trainingMillis(elapsed)
                .build();
    }

    // ======================== TRAINING ========================

    /**
     * Train on windows {@code [0, trainCount)} of an already scaled view.
     *
     * @throws ModelException if the loss stops being finite
     */
    public FittedSequenceModel train(SlidingWindows windows, int trainCount, MinMaxScaler scaler, long seed) {
        ForecastConfig.SequenceConfig settings = config.getSequence();
        Random random = new Random(seed);
        LstmNetwork network = new LstmNetwork(windows.features(), settings.getHiddenSize(), settings.getLayers(),
                settings.getHeadSize(), settings.getDropout(), windows.length(), random);
        AdamOptimizer optimizer = new AdamOptimizer(network.parameterCount(), settings.getLearningRate());

        int[] order = new int[trainCount];
        for (int i = 0; i < trainCount; i++) {
            order[i] = i;
        }

        double bestLoss = Double.POSITIVE_INFINITY;
        double lastLoss = Double.NaN;
        int stale = 0;
        int epoch = 0;
        while (epoch < settings.getEpochs()) {
            shuffle(order, random);
            double lossSum = 0.0;
            int batches = 0;
            for (int start = 0; start < trainCount; start += settings.getBatchSize()) {
                int end = Math.min(trainCount, start + settings.getBatchSize());
                int size = end - start;
                network.zeroGradients();
                double batchLoss = 0.0;
                for (int b = start; b < end; b++) {
                    int window = order[b];
                    double predicted = network.forward(windows, window, true, random);
                    double error = predicted - windows.target(window);
                    batchLoss += error * error;
                    network.backward(2.0 * error / size);
                }
                optimizer.step(network.parameters(), network.gradients());
                lossSum += batchLoss / size;
                batches++;
            }
            epoch++;
            lastLoss = lossSum / batches;
            if (!MathUtils.isValidNumber(lastLoss)) {
                throw new ModelException(modelName() + ": training loss diverged at epoch " + epoch);
            }
            log.debug("[MODEL] {} epoch {}/{} loss={}", modelName(), epoch, settings.getEpochs(), lastLoss);

            if (lastLoss < bestLoss) {
                bestLoss = lastLoss;
                stale = 0;
            } else if (++stale >= settings.getPatience()) {
                log.info("[MODEL] {} early stopping at epoch {}", modelName(), epoch);
                break;
            }
        }
        return new FittedSequenceModel(network, scaler, epoch, lastLoss);
    }

    private static void shuffle(int[] order, Random random) {
        for (int i = order.length - 1; i > 0; i--) {
            int j = random.nextInt(i + 1);
            int tmp = order[i];
            order[i] = order[j];
            order[j] = tmp;
        }
    }

    // ======================== PREDICTION ========================

    /**
     * Predict windows {@code [from, to)} and return them in original units. Actuals are read from the
     * unscaled buffer so they match the recorded readings exactly.
     */
    public List<ForecastResult> predict(FittedSequenceModel model, SequenceBuffer raw, SlidingWindows windows,
                                        int from, int to, UtilitySeries series) {
        MinMaxScaler scaler = model.getScaler();
        List<ForecastResult> results = new ArrayList<>(Math.max(0, to - from));
        for (int w = from; w < to; w++) {
            double scaled = model.getNetwork().forward(windows, w, false, null);
            results.add(ForecastResult.builder()
                    .modelName(modelName())
                    .utility(series.getUtility())
                    .timestamp(windows.targetTimestamp(w))
                    .pointEstimate(scaler.inverse(SequenceBuffer.TARGET_COLUMN, scaled))
                    .actual(raw.get(windows.lastRowOf(w), SequenceBuffer.TARGET_COLUMN))
                    .build());
        }
        return results;
    }

    /**
     * Windows seen as a timeline of their target timestamps, for the splitter.
     */
    private static List<Timestamped> timeline(SlidingWindows windows) {
        return new AbstractList<>() {
            @Override
            public Timestamped get(int index) {
                Instant ts = windows.targetTimestamp(index);
                return () -> ts;
            }

            @Override
            public int size() {
                return windows.count();
            }
        };
    }
}

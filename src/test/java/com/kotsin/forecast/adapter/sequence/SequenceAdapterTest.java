package com.kotsin.forecast.adapter.sequence;

import com.kotsin.forecast.ForecastFixtures;
import com.kotsin.forecast.adapter.ModelFamily;
import com.kotsin.forecast.adapter.ModelRun;
import com.kotsin.forecast.config.ForecastConfig;
import com.kotsin.forecast.exception.DataException;
import com.kotsin.forecast.logging.PipelineTraceLogger;
import com.kotsin.forecast.metrics.MetricsCalculator;
import com.kotsin.forecast.model.AccuracyMetrics;
import com.kotsin.forecast.model.ForecastResult;
import com.kotsin.forecast.model.RunConfig;
import com.kotsin.forecast.model.Utility;
import com.kotsin.forecast.split.DatasetSplitter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SequenceAdapter - Recurrent network over sliding windows")
class SequenceAdapterTest {

    private ForecastConfig config;
    private SequenceAdapter adapter;
    private final RunConfig runConfig = RunConfig.builder().utility(Utility.ELECTRICITY).seed(7L).build();

    @BeforeEach
    void setUp() {
        config = new ForecastConfig();
        // small network so the test stays fast
        ForecastConfig.SequenceConfig sequence = config.getSequence();
        sequence.setWindowLength(24);
        sequence.setHiddenSize(8);
        sequence.setHeadSize(4);
        sequence.setEpochs(3);
        sequence.setLearningRate(0.01);
        adapter = new SequenceAdapter(config, ForecastFixtures.featureEngineer(config),
                new DatasetSplitter(), new PipelineTraceLogger());
    }

    @Test
    @DisplayName("Forecast count equals the test windows, in original units")
    void testEvaluate_Shape() {
        ModelRun run = adapter.evaluate(ForecastFixtures.dailySine(600), runConfig);

        // 576 windows, train = floor(576 * 0.85)
        assertEquals(ModelFamily.SEQUENCE, run.getFamily());
        assertEquals(489, run.getTrainSize());
        assertEquals(87, run.getTestSize());
        assertEquals(87, run.getForecasts().size());

        for (ForecastResult forecast : run.getForecasts()) {
            assertTrue(Double.isFinite(forecast.getPointEstimate()));
            // a scaled output far outside [0, 1] would mean the inverse transform was skipped
            assertTrue(forecast.getPointEstimate() > -100 && forecast.getPointEstimate() < 300,
                    "Prediction " + forecast.getPointEstimate() + " not in original units");
            assertEquals(100.0 + 50.0 * Math.sin(2 * Math.PI * hourOf(forecast.getTimestamp()) / 24.0),
                    forecast.getActual(), 1e-9, "Actual is reported in original units");
        }
    }

    @Test
    @DisplayName("Zero readings in the test suffix are reported as exactly zero")
    void testEvaluate_ZeroActualsStayExact() {
        // training rows span roughly [62, 113]; the outage only appears after the split
        ModelRun run = adapter.evaluate(ForecastFixtures.hourly(600,
                h -> h >= 570 ? 0.0 : 87.5 + 25.4 * Math.sin(2 * Math.PI * h / 24.0)), runConfig);

        int zeros = 0;
        for (ForecastResult forecast : run.getForecasts()) {
            if (!forecast.getTimestamp().isBefore(ForecastFixtures.hour(570))) {
                assertEquals(0.0, forecast.getActual(), "Outage reading at " + forecast.getTimestamp());
                zeros++;
            }
        }
        assertEquals(30, zeros);

        AccuracyMetrics metrics = new MetricsCalculator().score(run.getModelName(), run.getForecasts());
        assertTrue(Double.isFinite(metrics.getMape()));
        assertTrue(metrics.getMape() < 1e6, "MAPE " + metrics.getMape() + " blew up on zero actuals");
    }

    @Test
    @DisplayName("First test target follows the last training target")
    void testEvaluate_TemporalOrder() {
        ModelRun run = adapter.evaluate(ForecastFixtures.dailySine(600), runConfig);

        // window w targets reading w + 24
        assertEquals(ForecastFixtures.hour(489 + 24), run.getForecasts().get(0).getTimestamp());
    }

    @Test
    @DisplayName("Same seed gives identical forecasts")
    void testEvaluate_Idempotent() {
        config.getSequence().setEpochs(1);

        ModelRun first = adapter.evaluate(ForecastFixtures.dailySine(300), runConfig);
        ModelRun second = adapter.evaluate(ForecastFixtures.dailySine(300), runConfig);

        assertEquals(first.getForecasts(), second.getForecasts());
    }

    @Test
    @DisplayName("Series not longer than one window fails with INSUFFICIENT_HISTORY")
    void testEvaluate_ShortSeries() {
        DataException e = assertThrows(DataException.class,
                () -> adapter.evaluate(ForecastFixtures.dailySine(25), runConfig));
        assertEquals(DataException.Reason.INSUFFICIENT_HISTORY, e.getReason());
    }

    @Test
    @DisplayName("Training lowers the loss on a learnable pattern")
    void testTrain_LossDecreases() {
        config.getSequence().setEpochs(1);
        ModelRun oneEpoch = adapter.evaluate(ForecastFixtures.dailySine(600), runConfig);
        config.getSequence().setEpochs(15);
        ModelRun manyEpochs = adapter.evaluate(ForecastFixtures.dailySine(600), runConfig);

        assertTrue(mae(manyEpochs) < mae(oneEpoch),
                "MAE after 15 epochs " + mae(manyEpochs) + " vs after 1 epoch " + mae(oneEpoch));
    }

    private static double mae(ModelRun run) {
        double sum = 0.0;
        for (ForecastResult forecast : run.getForecasts()) {
            sum += Math.abs(forecast.getActual() - forecast.getPointEstimate());
        }
        return sum / run.getForecasts().size();
    }

    private static long hourOf(Instant ts) {
        return java.time.Duration.between(ForecastFixtures.START, ts).toHours();
    }
}

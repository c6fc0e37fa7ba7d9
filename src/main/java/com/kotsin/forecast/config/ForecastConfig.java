package com.kotsin.forecast.config;

import com.kotsin.forecast.model.RunConfig;
import com.kotsin.forecast.model.SplitPolicy;
import com.kotsin.forecast.model.Utility;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

/**
 * Centralized configuration for feature engineering, the three model families,
 * anomaly detection and reporting.
 */
@Configuration
@ConfigurationProperties(prefix = "forecast")
@Data
public class ForecastConfig {

    /**
     * Utility evaluated by the batch runner
     */
    private Utility utility = Utility.ELECTRICITY;

    /**
     * Seed for every random source of a run (shuffling, subsampling, isolation trees)
     */
    private long seed = 42L;

    /**
     * Share of the most recent hourly history to use (1.0 = full dataset)
     */
    private double sampleFraction = 1.0;

    /**
     * Zone used for calendar features
     */
    private String zone = "UTC";

    private FeatureConfig features = new FeatureConfig();

    private DecompositionConfig decomposition = new DecompositionConfig();

    private SequenceConfig sequence = new SequenceConfig();

    private BoostingConfig boosting = new BoostingConfig();

    private AnomalyConfig anomaly = new AnomalyConfig();

    private ReportConfig report = new ReportConfig();

    private RunnerConfig runner = new RunnerConfig();

    private ExecutorConfig executor = new ExecutorConfig();

    public ZoneId zoneId() {
        return ZoneId.of(zone);
    }

    public RunConfig toRunConfig(Utility target) {
        return RunConfig.builder()
                .utility(target)
                .seed(seed)
                .sampleFraction(sampleFraction)
                .build();
    }

    public enum Imputation {
        MEAN,
        FORWARD_FILL
    }

    public enum PrimaryMetric {
        MAE,
        MAPE,
        RMSE
    }

    @Data
    public static class SplitConfig {
        private SplitPolicy.Type type = SplitPolicy.Type.TRAILING_FRACTION;

        /**
         * Test window for TRAILING_DURATION
         */
        private Duration duration = Duration.ofDays(30);

        /**
         * Test share for TRAILING_FRACTION
         */
        private double fraction = 0.15;

        public static SplitConfig trailingDuration(Duration duration) {
            SplitConfig config = new SplitConfig();
            config.setType(SplitPolicy.Type.TRAILING_DURATION);
            config.setDuration(duration);
            return config;
        }

        public static SplitConfig trailingFraction(double fraction) {
            SplitConfig config = new SplitConfig();
            config.setType(SplitPolicy.Type.TRAILING_FRACTION);
            config.setFraction(fraction);
            return config;
        }

        public SplitPolicy toPolicy() {
            return type == SplitPolicy.Type.TRAILING_DURATION
                    ? SplitPolicy.trailingDuration(duration)
                    : SplitPolicy.trailingFraction(fraction);
        }
    }

    @Data
    public static class FeatureConfig {
        /**
         * Lag offsets in resolution steps: persistence, diurnal, weekly
         */
        private List<Integer> lagHours = new ArrayList<>(List.of(1, 24, 168));

        /**
         * Trailing rolling-mean windows in resolution steps
         */
        private List<Integer> rollingWindowHours = new ArrayList<>(List.of(24, 168));

        private Duration resolution = Duration.ofHours(1);

        private Imputation imputation = Imputation.MEAN;

        /**
         * Regressor columns missing in more rows than this are dropped for the run
         */
        private double maxMissingFraction = 0.5;

        private boolean deriveDegreeDays = true;

        /**
         * Reference temperature (F) for heating/cooling degree measures
         */
        private double degreeDayBase = 65.0;

        private String temperatureColumn = "temperature_2m";

        public int maxLag() {
            int max = 0;
            for (int lag : lagHours) {
                max = Math.max(max, lag);
            }
            for (int window : rollingWindowHours) {
                max = Math.max(max, window);
            }
            return max;
        }
    }

    @Data
    public static class DecompositionConfig {
        private boolean enabled = true;

        private String modelName = "prophet";

        private SplitConfig split = SplitConfig.trailingDuration(Duration.ofDays(30));

        /**
         * Trend flexibility; smaller values give a more rigid trend
         */
        private double changepointPriorScale = 0.1;

        private int changepoints = 25;

        /**
         * Share of the training history where changepoints may be placed
         */
        private double changepointRange = 0.8;

        private boolean yearlySeasonality = true;
        private int yearlyOrder = 10;

        private boolean weeklySeasonality = true;
        private int weeklyOrder = 3;

        private boolean dailySeasonality = true;
        private int dailyOrder = 4;

        private double seasonalityPriorScale = 10.0;

        private double regressorPriorScale = 10.0;

        private double intervalWidth = 0.8;

        private List<String> regressors = new ArrayList<>(List.of("temperature_2m"));
    }

    @Data
    public static class SequenceConfig {
        private boolean enabled = true;

        private String modelName = "lstm";

        private SplitConfig split = SplitConfig.trailingFraction(0.15);

        /**
         * Window length in readings (one week of hours)
         */
        private int windowLength = 168;

        private int hiddenSize = 64;

        private int layers = 2;

        private int headSize = 16;

        private double dropout = 0.2;

        private double learningRate = 0.001;

        private int batchSize = 32;

        private int epochs = 30;

        /**
         * Epochs without training-loss improvement before stopping
         */
        private int patience = 5;

        private List<String> regressors = new ArrayList<>(List.of("temperature_2m"));
    }

    @Data
    public static class BoostingConfig {
        private boolean enabled = true;

        private String modelName = "xgboost";

        private SplitConfig split = SplitConfig.trailingFraction(0.15);

        private int trees = 200;

        private int maxDepth = 8;

        private double learningRate = 0.1;

        private double subsample = 0.8;

        private double colsampleByTree = 0.8;

        /**
         * L2 regularization on leaf weights
         */
        private double lambda = 1.0;

        private double minChildWeight = 1.0;

        private int maxBins = 256;

        private List<String> regressors = new ArrayList<>(List.of(
                "temperature_2m", "apparent_temperature", "relative_humidity_2m",
                "shortwave_radiation", "hdd", "cdd"));
    }

    @Data
    public static class AnomalyConfig {
        private boolean enabled = true;

        private int trees = 100;

        private int maxSamples = 256;

        /**
         * Prior fraction of anomalous rows
         */
        private double contamination = 0.05;
    }

    @Data
    public static class ReportConfig {
        private PrimaryMetric primaryMetric = PrimaryMetric.MAPE;

        private int topFeatures = 10;

        private Duration cacheTtl = Duration.ofHours(6);

        private int cacheMaxSize = 32;
    }

    @Data
    public static class RunnerConfig {
        /**
         * Run one batch evaluation on startup
         */
        private boolean enabled = false;

        private String hourlyPath = "data/hourly_campus.csv";

        private String dailyPath = "data/daily_energy.csv";
    }

    @Data
    public static class ExecutorConfig {
        private int poolSize = 3;

        private int queueCapacity = 16;

        private String threadPrefix = "model-";
    }
}

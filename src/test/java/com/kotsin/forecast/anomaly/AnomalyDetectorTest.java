package com.kotsin.forecast.anomaly;

import com.kotsin.forecast.ForecastFixtures;
import com.kotsin.forecast.config.ForecastConfig;
import com.kotsin.forecast.exception.DataException;
import com.kotsin.forecast.logging.PipelineTraceLogger;
import com.kotsin.forecast.model.AnomalyRecord;
import com.kotsin.forecast.model.AnomalyReport;
import com.kotsin.forecast.model.AnomalySummary;
import com.kotsin.forecast.model.DailyRecord;
import com.kotsin.forecast.model.RunConfig;
import com.kotsin.forecast.model.Utility;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("AnomalyDetector - Isolation forest over the daily table")
class AnomalyDetectorTest {

    private static final String[] ENTITIES = {"B1", "B2", "B3", "B4", "B5"};

    private ForecastConfig config;
    private AnomalyDetector detector;
    private final RunConfig runConfig = RunConfig.builder().utility(Utility.ELECTRICITY).build();

    @BeforeEach
    void setUp() {
        config = new ForecastConfig();
        detector = new AnomalyDetector(config, new PipelineTraceLogger());
    }

    /**
     * 5 buildings x 20 days of ordinary consumption; B3 reads 100x its normal load on days 5-9.
     */
    private static List<DailyRecord> campusWithSpikes() {
        List<DailyRecord> rows = new ArrayList<>();
        for (int e = 0; e < ENTITIES.length; e++) {
            for (int day = 0; day < 20; day++) {
                double energy = 1000.0 + 50.0 * Math.sin(day * 1.3 + e);
                if (e == 2 && day >= 5 && day < 10) {
                    energy = 100_000.0 + day * 10.0;
                }
                rows.add(ForecastFixtures.daily(ENTITIES[e], day, energy, 10_000.0, 40.0 + (day % 10) * 2.0));
            }
        }
        return rows;
    }

    @Test
    @DisplayName("Injected spikes are exactly the flagged rows")
    void testDetect_InjectedSpikes() {
        AnomalyReport report = detector.detect(campusWithSpikes(), runConfig);

        assertEquals(100, report.getRecords().size());
        assertEquals(5, report.anomalyCount(), "contamination 0.05 of 100 rows");
        for (AnomalyRecord record : report.getRecords()) {
            boolean spike = record.getObservedValue() >= 100_000.0;
            assertEquals(spike, record.isAnomaly(), "row " + record.getEntityId() + " " + record.getDate());
            assertEquals(record.isAnomaly(), record.getAnomalyScore() < 0.0);
        }

        assertEquals(1, report.getSummary().size());
        AnomalySummary top = report.getSummary().get(0);
        assertEquals("B3", top.getEntityId());
        assertEquals(5, top.getAnomalyCount());
        assertEquals(100_070.0, top.getMeanAnomalousValue(), 1e-9);
    }

    @Test
    @DisplayName("Same input and seed give an identical report")
    void testDetect_Idempotent() {
        assertEquals(detector.detect(campusWithSpikes(), runConfig),
                detector.detect(campusWithSpikes(), runConfig));
    }

    @Test
    @DisplayName("Rows of another utility are ignored")
    void testDetect_FiltersUtility() {
        List<DailyRecord> rows = new ArrayList<>(campusWithSpikes());
        rows.add(ForecastFixtures.daily("B1", 30, 5.0, 10_000.0, 40.0).toBuilder().utility(Utility.GAS).build());

        AnomalyReport report = detector.detect(rows, runConfig);

        assertEquals(100, report.getRecords().size());
    }

    @Test
    @DisplayName("Rows missing a used feature are dropped, not zero-filled")
    void testDetect_DropsIncompleteRows() {
        List<DailyRecord> rows = new ArrayList<>(campusWithSpikes());
        rows.add(ForecastFixtures.daily("B9", 0, 1000.0, 10_000.0, 40.0).toBuilder().meanTemperature(null).build());

        AnomalyReport report = detector.detect(rows, runConfig);

        assertTrue(report.getRecords().stream().noneMatch(r -> "B9".equals(r.getEntityId())));
    }

    @Test
    @DisplayName("Energy alone is not enough: INSUFFICIENT_FEATURES")
    void testDetect_InsufficientFeatures() {
        List<DailyRecord> rows = new ArrayList<>();
        for (int day = 0; day < 20; day++) {
            rows.add(DailyRecord.builder()
                    .entityId("B1")
                    .utility(Utility.ELECTRICITY)
                    .date(LocalDate.of(2023, 1, 1).plusDays(day))
                    .energyValue(1000.0 + day)
                    .build());
        }

        DataException e = assertThrows(DataException.class, () -> detector.detect(rows, runConfig));
        assertEquals(DataException.Reason.INSUFFICIENT_FEATURES, e.getReason());
    }

    @Test
    @DisplayName("Summary ranks by count, then entity id")
    void testSummarize_Ordering() {
        List<AnomalyRecord> records = List.of(
                flagged("B2", 10.0, true),
                flagged("B1", 20.0, true),
                flagged("B3", 30.0, true),
                flagged("B3", 50.0, true),
                flagged("B4", 99.0, false));

        List<AnomalySummary> summary = AnomalyDetector.summarize(records);

        assertEquals(List.of("B3", "B1", "B2"), summary.stream().map(AnomalySummary::getEntityId).toList());
        assertEquals(40.0, summary.get(0).getMeanAnomalousValue(), 1e-9);
    }

    private static AnomalyRecord flagged(String entity, double value, boolean anomaly) {
        return AnomalyRecord.builder()
                .entityId(entity)
                .date(LocalDate.of(2023, 1, 1))
                .observedValue(value)
                .anomalyScore(anomaly ? -0.1 : 0.1)
                .anomaly(anomaly)
                .build();
    }
}

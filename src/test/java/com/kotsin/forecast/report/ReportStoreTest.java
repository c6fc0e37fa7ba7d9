package com.kotsin.forecast.report;

import com.kotsin.forecast.config.ForecastConfig;
import com.kotsin.forecast.model.AccuracyMetrics;
import com.kotsin.forecast.model.AnomalyReport;
import com.kotsin.forecast.model.PipelineReport;
import com.kotsin.forecast.model.Utility;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ReportStore - Latest report per utility")
class ReportStoreTest {

    private ReportStore store;

    @BeforeEach
    void setUp() {
        store = new ReportStore(new ForecastConfig());
    }

    @Test
    @DisplayName("Empty store has no report")
    void testLatest_Missing() {
        assertTrue(store.latest(Utility.GAS).isEmpty());
        assertEquals(1, store.stats().missCount());
    }

    @Test
    @DisplayName("Newer report replaces older one for the same utility")
    void testPut_Replaces() {
        store.put(report(Utility.ELECTRICITY, "prophet"));
        store.put(report(Utility.ELECTRICITY, "xgboost"));
        store.put(report(Utility.GAS, "lstm"));

        assertEquals("xgboost", store.latest(Utility.ELECTRICITY).orElseThrow().bestModel());
        assertEquals("lstm", store.latest(Utility.GAS).orElseThrow().bestModel());
    }

    private static PipelineReport report(Utility utility, String best) {
        return PipelineReport.builder()
                .utility(utility)
                .comparisonRow(AccuracyMetrics.builder().modelName(best).sampleCount(1).build())
                .anomalies(AnomalyReport.empty())
                .generatedAt(Instant.now())
                .build();
    }
}

package com.kotsin.forecast.feature;

import com.kotsin.forecast.ForecastFixtures;
import com.kotsin.forecast.config.ForecastConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MinMaxScaler - Statistics from a row prefix")
class MinMaxScalerTest {

    private final FeatureEngineer engineer = ForecastFixtures.featureEngineer(new ForecastConfig());

    @Test
    @DisplayName("Fit uses only the given prefix; later rows may leave [0, 1]")
    void testFit_PrefixOnly() {
        SequenceBuffer buffer = engineer.buildSequence(ForecastFixtures.hourly(20, h -> h), List.of());

        MinMaxScaler scaler = MinMaxScaler.fit(buffer, 11);

        assertEquals(0.0, scaler.transform(SequenceBuffer.TARGET_COLUMN, 0.0), 1e-12);
        assertEquals(1.0, scaler.transform(SequenceBuffer.TARGET_COLUMN, 10.0), 1e-12);
        assertEquals(1.9, scaler.transform(SequenceBuffer.TARGET_COLUMN, 19.0), 1e-12);
    }

    @Test
    @DisplayName("Inverse restores original units")
    void testInverse() {
        SequenceBuffer buffer = engineer.buildSequence(ForecastFixtures.hourly(20, h -> 100 + 3 * h), List.of());
        MinMaxScaler scaler = MinMaxScaler.fit(buffer, 20);
        SequenceBuffer scaled = buffer.scaled(scaler);

        for (int row = 0; row < 20; row++) {
            assertEquals(buffer.get(row, 0), scaler.inverse(0, scaled.get(row, 0)), 1e-9);
        }
    }

    @Test
    @DisplayName("Constant column gets a unit range instead of dividing by zero")
    void testFit_ConstantColumn() {
        SequenceBuffer buffer = engineer.buildSequence(ForecastFixtures.hourly(5, h -> 7.0), List.of());

        MinMaxScaler scaler = MinMaxScaler.fit(buffer, 5);

        assertEquals(0.0, scaler.transform(SequenceBuffer.TARGET_COLUMN, 7.0), 1e-12);
        assertEquals(7.0, scaler.inverse(SequenceBuffer.TARGET_COLUMN, 0.0), 1e-12);
    }

    @Test
    @DisplayName("Empty prefix is rejected")
    void testFit_EmptyPrefix() {
        SequenceBuffer buffer = engineer.buildSequence(ForecastFixtures.hourly(5, h -> h), List.of());
        assertThrows(IllegalArgumentException.class, () -> MinMaxScaler.fit(buffer, 0));
    }
}

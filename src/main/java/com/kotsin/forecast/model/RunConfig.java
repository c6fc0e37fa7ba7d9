package com.kotsin.forecast.model;

import lombok.Builder;
import lombok.Value;

/**
 * RunConfig - Immutable settings of one pipeline run.
 *
 * Passed explicitly to every stage, so two runs with equal configs and inputs
 * produce identical outputs.
 */
@Value
@Builder(toBuilder = true)
public class RunConfig {

    Utility utility;

    @Builder.Default
    long seed = 42L;

    /**
     * Share of the most recent hourly history to use; 1.0 = full dataset.
     */
    @Builder.Default
    double sampleFraction = 1.0;
}

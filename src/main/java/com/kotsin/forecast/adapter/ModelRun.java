package com.kotsin.forecast.adapter;

import com.kotsin.forecast.model.FeatureImportance;
import com.kotsin.forecast.model.ForecastResult;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * ModelRun - What one adapter produced: held-out forecasts (with actual values attached)
 * and, for families that expose it, ranked feature importances.
 */
@Value
@Builder
public class ModelRun {

    String modelName;
    ModelFamily family;

    @Singular
    List<ForecastResult> forecasts;

    @Singular
    List<FeatureImportance> importances;

    int trainSize;
    int testSize;
    long trainingMillis;
}

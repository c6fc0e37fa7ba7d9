package com.kotsin.forecast.adapter;

import com.kotsin.forecast.model.RunConfig;
import com.kotsin.forecast.model.UtilitySeries;

/**
 * ModelAdapter - Uniform evaluation protocol over heterogeneous model families.
 *
 * Every variant owns its view construction, its temporal split and its fitted state;
 * {@link #evaluate} runs view → split → train → predict over the held-out window.
 * Implementations hold no mutable state between calls, so one adapter instance may
 * evaluate different series concurrently.
 */
public interface ModelAdapter {

    ModelFamily family();

    String modelName();

    boolean isEnabled();

    /**
     * Train on the series' training prefix and forecast its test suffix.
     *
     * @throws com.kotsin.forecast.exception.DataException  if the series cannot feed this model
     * @throws com.kotsin.forecast.exception.ModelException if training fails
     */
    ModelRun evaluate(UtilitySeries series, RunConfig runConfig);
}

package com.kotsin.forecast.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.kotsin.forecast.adapter.ModelFamily;
import com.kotsin.forecast.adapter.ModelRun;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * ModelOutcome - Result of one adapter attempt: its run, or why it failed.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ModelOutcome {

    @JsonProperty("model_name")
    String modelName;

    ModelFamily family;

    @JsonIgnore
    ModelRun run;

    @JsonProperty("error_type")
    String errorType;

    @JsonProperty("error_message")
    String errorMessage;

    public static ModelOutcome success(ModelRun run) {
        return new ModelOutcome(run.getModelName(), run.getFamily(), run, null, null);
    }

    public static ModelOutcome failure(String modelName, ModelFamily family, Throwable error) {
        return new ModelOutcome(modelName, family, null, error.getClass().getSimpleName(), error.getMessage());
    }

    @JsonProperty("succeeded")
    public boolean isSucceeded() {
        return run != null;
    }
}

package com.kotsin.forecast.exception;

/**
 * ModelException - A model's optimization failed or its capability is unavailable.
 *
 * Caught at the adapter boundary; the model is left out of the comparison.
 */
public class ModelException extends ForecastException {

    public ModelException(String message) {
        super(message);
    }

    public ModelException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.kotsin.forecast.exception;

/**
 * Root of the pipeline's unchecked exception hierarchy.
 */
public class ForecastException extends RuntimeException {

    public ForecastException(String message) {
        super(message);
    }

    public ForecastException(String message, Throwable cause) {
        super(message, cause);
    }
}

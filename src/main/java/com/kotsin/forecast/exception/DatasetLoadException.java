package com.kotsin.forecast.exception;

/**
 * DatasetLoadException - The contract table could not be read.
 */
public class DatasetLoadException extends ForecastException {

    public DatasetLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}

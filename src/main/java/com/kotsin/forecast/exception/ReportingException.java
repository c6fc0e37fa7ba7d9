package com.kotsin.forecast.exception;

/**
 * ReportingException - No model produced a result, so there is nothing to report.
 */
public class ReportingException extends ForecastException {

    public ReportingException(String message) {
        super(message);
    }
}

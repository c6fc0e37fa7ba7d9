package com.kotsin.forecast.model;

import java.time.Instant;

/**
 * Anything that sits on a time axis and can be split temporally.
 */
public interface Timestamped {

    Instant getTimestamp();
}

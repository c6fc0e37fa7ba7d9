package com.kotsin.forecast.adapter.decomposition;

import com.kotsin.forecast.config.ProcessingConstants;
import lombok.Value;

import java.time.Instant;

/**
 * Seasonality - Fourier block of the decomposition model.
 *
 * Time is measured in days since the epoch, so the block phase does not depend on
 * where the training window starts.
 */
@Value
public class Seasonality {

    String name;
    double periodDays;
    int order;

    public int width() {
        return 2 * order;
    }

    /**
     * Writes {@code sin, cos} pairs for orders 1..N into {@code row} from {@code offset}.
     */
    public void fill(Instant timestamp, double[] row, int offset) {
        double days = timestamp.getEpochSecond() / ProcessingConstants.SECONDS_PER_DAY
                + timestamp.getNano() / 1e9 / ProcessingConstants.SECONDS_PER_DAY;
        for (int n = 1; n <= order; n++) {
            double angle = 2 * Math.PI * n * days / periodDays;
            row[offset + 2 * (n - 1)] = Math.sin(angle);
            row[offset + 2 * (n - 1) + 1] = Math.cos(angle);
        }
    }
}

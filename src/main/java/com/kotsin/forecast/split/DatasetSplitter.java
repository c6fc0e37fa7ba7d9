package com.kotsin.forecast.split;

import com.kotsin.forecast.exception.DataException;
import com.kotsin.forecast.model.SplitPolicy;
import com.kotsin.forecast.model.Timestamped;
import com.kotsin.forecast.model.TrainTestSplit;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;

/**
 * DatasetSplitter - Temporal train/test partitioning.
 *
 * No shuffling: the test set is always a suffix, so every training timestamp precedes
 * every test timestamp.
 */
@Component
public class DatasetSplitter {

    /**
     * @throws DataException UNORDERED_SERIES if rows are not strictly increasing in time,
     *                       EMPTY_SPLIT if either partition would be empty
     */
    public <T extends Timestamped> TrainTestSplit<T> split(List<T> rows, SplitPolicy policy) {
        verifyOrdered(rows);
        int boundary = policy.getType() == SplitPolicy.Type.TRAILING_DURATION
                ? durationBoundary(rows, policy)
                : fractionBoundary(rows.size(), policy.getFraction());

        if (boundary <= 0 || boundary >= rows.size()) {
            throw DataException.emptySplit(Math.max(0, boundary), rows.size() - Math.max(0, boundary));
        }
        return new TrainTestSplit<>(rows.subList(0, boundary), rows.subList(boundary, rows.size()), policy);
    }

    /**
     * Number of training rows for a trailing-fraction policy over {@code size} rows.
     */
    public static int fractionBoundary(int size, double testFraction) {
        return (int) Math.floor(size * (1.0 - testFraction));
    }

    private static <T extends Timestamped> int durationBoundary(List<T> rows, SplitPolicy policy) {
        if (rows.isEmpty()) {
            return 0;
        }
        Instant trainEnd = rows.get(rows.size() - 1).getTimestamp().minus(policy.getDuration());
        int boundary = 0;
        // training rows: timestamp <= max - duration
        while (boundary < rows.size() && !rows.get(boundary).getTimestamp().isAfter(trainEnd)) {
            boundary++;
        }
        return boundary;
    }

    private static <T extends Timestamped> void verifyOrdered(List<T> rows) {
        for (int i = 1; i < rows.size(); i++) {
            if (!rows.get(i).getTimestamp().isAfter(rows.get(i - 1).getTimestamp())) {
                throw new DataException(DataException.Reason.UNORDERED_SERIES,
                        "row " + i + " at " + rows.get(i).getTimestamp() + " does not follow " + rows.get(i - 1).getTimestamp());
            }
        }
    }
}

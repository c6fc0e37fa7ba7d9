package com.kotsin.forecast.model;

import com.kotsin.forecast.exception.DataException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * UtilitySeries - Ordered readings of one (entity scope, utility) series.
 *
 * Timestamps are strictly increasing and unique. Gaps are kept as gaps.
 */
public final class UtilitySeries {

    private final String entityScope;
    private final Utility utility;
    private final List<TimeSeriesPoint> points;

    private UtilitySeries(String entityScope, Utility utility, List<TimeSeriesPoint> points) {
        this.entityScope = entityScope;
        this.utility = utility;
        this.points = List.copyOf(points);
    }

    /**
     * Build a series from readings in any order.
     *
     * @throws DataException DUPLICATE_TIMESTAMP when two readings share a timestamp
     */
    public static UtilitySeries of(String entityScope, Utility utility, List<TimeSeriesPoint> readings) {
        List<TimeSeriesPoint> sorted = new ArrayList<>(readings);
        sorted.sort(Comparator.comparing(TimeSeriesPoint::getTimestamp));
        for (int i = 1; i < sorted.size(); i++) {
            Instant previous = sorted.get(i - 1).getTimestamp();
            if (!sorted.get(i).getTimestamp().isAfter(previous)) {
                throw new DataException(DataException.Reason.DUPLICATE_TIMESTAMP,
                        entityScope + "/" + utility + " has two readings at " + previous);
            }
        }
        return new UtilitySeries(entityScope, utility, sorted);
    }

    public String getEntityScope() {
        return entityScope;
    }

    public Utility getUtility() {
        return utility;
    }

    public List<TimeSeriesPoint> getPoints() {
        return points;
    }

    public int size() {
        return points.size();
    }

    public boolean isEmpty() {
        return points.isEmpty();
    }

    /**
     * Names of every regressor seen on any reading, in first-seen order.
     */
    public Set<String> regressorNames() {
        Set<String> names = new LinkedHashSet<>();
        for (TimeSeriesPoint point : points) {
            names.addAll(point.getRegressors().keySet());
        }
        return names;
    }

    /**
     * Most recent {@code fraction} of the readings. Keeps the series contiguous so lag
     * windows stay meaningful.
     */
    public UtilitySeries tail(double fraction) {
        if (fraction >= 1.0 || points.isEmpty()) {
            return this;
        }
        int keep = Math.max(1, (int) Math.ceil(points.size() * fraction));
        return new UtilitySeries(entityScope, utility, points.subList(points.size() - keep, points.size()));
    }

    public String describe() {
        return entityScope + "/" + utility;
    }
}

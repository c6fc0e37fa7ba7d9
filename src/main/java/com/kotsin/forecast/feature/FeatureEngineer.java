package com.kotsin.forecast.feature;

import com.kotsin.forecast.config.ForecastConfig;
import com.kotsin.forecast.config.ProcessingConstants;
import com.kotsin.forecast.exception.DataException;
import com.kotsin.forecast.model.FeatureTable;
import com.kotsin.forecast.model.FeatureVector;
import com.kotsin.forecast.model.TimeSeriesPoint;
import com.kotsin.forecast.model.UtilitySeries;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * FeatureEngineer - Turns an hourly series into model-ready feature views.
 *
 * Tabular view (tree models): calendar encodings, lags, trailing rolling means, regressors.
 * Sequence view (recurrent models): per-reading energy, calendar fields and regressors.
 *
 * A row is only emitted when every lag and rolling window behind it is populated.
 * Missing history is never imputed, so at least the first max(lag) readings are dropped.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FeatureEngineer {

    private static final List<String> SEQUENCE_BASE_COLUMNS = List.of(
            ProcessingConstants.TARGET_COLUMN, "hour", "day_of_week", "is_weekend");

    private final ForecastConfig config;
    private final RegressorImputer imputer;

    // ======================== TABULAR VIEW ========================

    /**
     * Flat feature vectors for every reading with full lag and rolling history.
     *
     * @throws DataException MISSING_TARGET_COLUMN when no reading carries a value,
     *                       INSUFFICIENT_HISTORY when the series is shorter than the longest window
     */
    public FeatureTable buildTabular(UtilitySeries series, List<String> regressors) {
        ForecastConfig.FeatureConfig features = config.getFeatures();
        List<TimeSeriesPoint> points = valuedPoints(series);
        int maxLag = features.maxLag();
        if (points.size() < maxLag + 1) {
            throw DataException.insufficientHistory(maxLag + 1, points.size());
        }

        RegressorFrame frame = imputer.impute(points, regressors);
        List<String> names = tabularNames(frame);
        ZoneId zone = config.zoneId();
        long step = features.getResolution().getSeconds();

        Map<Long, Integer> indexByEpoch = new HashMap<>(points.size() * 2);
        for (int i = 0; i < points.size(); i++) {
            indexByEpoch.put(points.get(i).getTimestamp().getEpochSecond(), i);
        }

        List<FeatureVector> rows = new ArrayList<>();
        double[] values = new double[names.size()];
        for (int i = 0; i < points.size(); i++) {
            TimeSeriesPoint point = points.get(i);
            long epoch = point.getTimestamp().getEpochSecond();
            if (!fillHistory(points, indexByEpoch, epoch, step, values)) {
                continue;
            }
            double[] calendar = CalendarFeatures.encode(point.getTimestamp(), zone);
            System.arraycopy(calendar, 0, values, 0, calendar.length);
            int offset = calendar.length + features.getLagHours().size() + features.getRollingWindowHours().size();
            for (String regressor : frame.names()) {
                values[offset++] = frame.value(regressor, i);
            }
            rows.add(new FeatureVector(point.getTimestamp(), values, point.getValue()));
        }

        log.debug("[FEATURES] {} -> {} tabular rows from {} readings", series.describe(), rows.size(), points.size());
        return new FeatureTable(names, rows);
    }

    /**
     * Fills lag and rolling slots of {@code values}; false when any referenced reading is missing.
     */
    private boolean fillHistory(List<TimeSeriesPoint> points, Map<Long, Integer> indexByEpoch,
                                long epoch, long step, double[] values) {
        ForecastConfig.FeatureConfig features = config.getFeatures();
        int slot = CalendarFeatures.NAMES.size();
        for (int lag : features.getLagHours()) {
            Integer index = indexByEpoch.get(epoch - lag * step);
            if (index == null) {
                return false;
            }
            values[slot++] = points.get(index).getValue();
        }
        for (int window : features.getRollingWindowHours()) {
            double sum = 0.0;
            // trailing window [t - window, t): strictly past readings
            for (int k = 1; k <= window; k++) {
                Integer index = indexByEpoch.get(epoch - k * step);
                if (index == null) {
                    return false;
                }
                sum += points.get(index).getValue();
            }
            values[slot++] = sum / window;
        }
        return true;
    }

    private List<String> tabularNames(RegressorFrame frame) {
        ForecastConfig.FeatureConfig features = config.getFeatures();
        List<String> names = new ArrayList<>(CalendarFeatures.NAMES);
        for (int lag : features.getLagHours()) {
            names.add("lag_" + lag + "h");
        }
        for (int window : features.getRollingWindowHours()) {
            names.add("rolling_" + window + "h_mean");
        }
        names.addAll(frame.names());
        return names;
    }

    // ======================== SEQUENCE VIEW ========================

    /**
     * Unscaled per-reading rows {energy, hour, day_of_week, is_weekend, regressors...}.
     * Scaling is left to the caller so statistics can be fit on training rows only.
     */
    public SequenceBuffer buildSequence(UtilitySeries series, List<String> regressors) {
        List<TimeSeriesPoint> points = valuedPoints(series);
        RegressorFrame frame = imputer.impute(points, regressors);
        ZoneId zone = config.zoneId();

        List<String> columns = new ArrayList<>(SEQUENCE_BASE_COLUMNS);
        columns.addAll(frame.names());
        int width = columns.size();

        double[] data = new double[points.size() * width];
        List<Instant> timestamps = new ArrayList<>(points.size());
        for (int i = 0; i < points.size(); i++) {
            TimeSeriesPoint point = points.get(i);
            Instant ts = point.getTimestamp();
            int base = i * width;
            data[base] = point.getValue();
            data[base + 1] = CalendarFeatures.hour(ts, zone);
            data[base + 2] = CalendarFeatures.dayOfWeek(ts, zone);
            data[base + 3] = CalendarFeatures.isWeekend(ts, zone) ? 1.0 : 0.0;
            int col = SEQUENCE_BASE_COLUMNS.size();
            for (String regressor : frame.names()) {
                data[base + col++] = frame.value(regressor, i);
            }
            timestamps.add(ts);
        }
        return new SequenceBuffer(columns, timestamps, data);
    }

    // ======================== SHARED ========================

    /**
     * Readings that carry an energy value, in time order.
     *
     * @throws DataException MISSING_TARGET_COLUMN when none does
     */
    public List<TimeSeriesPoint> valuedPoints(UtilitySeries series) {
        List<TimeSeriesPoint> valued = new ArrayList<>(series.size());
        for (TimeSeriesPoint point : series.getPoints()) {
            if (point.hasValue()) {
                valued.add(point);
            }
        }
        if (valued.isEmpty()) {
            throw DataException.missingTargetColumn(series.describe());
        }
        return valued;
    }

    public RegressorFrame regressors(List<TimeSeriesPoint> points, List<String> requested) {
        return imputer.impute(points, requested);
    }
}

package com.kotsin.forecast.data;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.kotsin.forecast.config.ForecastConfig;
import com.kotsin.forecast.config.ProcessingConstants;
import com.kotsin.forecast.exception.DataException;
import com.kotsin.forecast.exception.DatasetLoadException;
import com.kotsin.forecast.model.DailyRecord;
import com.kotsin.forecast.model.TimeSeriesPoint;
import com.kotsin.forecast.model.Utility;
import com.kotsin.forecast.model.UtilitySeries;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * CsvDatasetSource - Reads the two contract tables from CSV files with headers.
 *
 * Hourly columns: {@code entity_scope, utility, timestamp, energy_kwh}; every further
 * column is a numeric regressor. When several entity scopes are present, readings are
 * combined into one campus series: energy summed per timestamp, regressors averaged.
 *
 * Daily columns: {@code entity_id, entity_name, utility, date, energy_kwh}, optional
 * {@code gross_area, eui, weather_temperature_2m}.
 *
 * Blank cells and unparseable numbers are read as missing, never as zero.
 */
@Slf4j
@Component
public class CsvDatasetSource implements DatasetSource {

    static final String CAMPUS_SCOPE = "campus";

    private static final Set<String> HOURLY_KEY_COLUMNS =
            Set.of("entity_scope", "utility", "timestamp", ProcessingConstants.TARGET_COLUMN);

    private final CsvMapper mapper = new CsvMapper();
    private final Path hourlyPath;
    private final Path dailyPath;
    private final ZoneId zone;

    @Autowired
    public CsvDatasetSource(ForecastConfig config) {
        this(Path.of(config.getRunner().getHourlyPath()), Path.of(config.getRunner().getDailyPath()),
                config.zoneId());
    }

    public CsvDatasetSource(Path hourlyPath, Path dailyPath, ZoneId zone) {
        this.hourlyPath = hourlyPath;
        this.dailyPath = dailyPath;
        this.zone = zone;
        mapper.enable(CsvParser.Feature.TRIM_SPACES);
    }

    // ======================== HOURLY ========================

    @Override
    public UtilitySeries hourly(Utility utility) {
        Map<String, List<TimeSeriesPoint>> byScope = new LinkedHashMap<>();
        for (Map<String, String> row : readRows(hourlyPath)) {
            Utility rowUtility = utilityOf(row, hourlyPath);
            if (rowUtility != utility) {
                continue;
            }
            String scope = row.get("entity_scope");
            if (scope == null || scope.isBlank()) {
                scope = CAMPUS_SCOPE;
            }
            TimeSeriesPoint.TimeSeriesPointBuilder point = TimeSeriesPoint.builder()
                    .entityScope(scope)
                    .utility(rowUtility)
                    .timestamp(parseTimestamp(required(row, "timestamp", hourlyPath)))
                    .value(parseNumber(row.get(ProcessingConstants.TARGET_COLUMN)));
            for (Map.Entry<String, String> cell : row.entrySet()) {
                if (!HOURLY_KEY_COLUMNS.contains(cell.getKey())) {
                    point.regressor(cell.getKey(), parseNumber(cell.getValue()));
                }
            }
            byScope.computeIfAbsent(scope, k -> new ArrayList<>()).add(point.build());
        }

        if (byScope.isEmpty()) {
            log.warn("[DATA] no hourly {} readings in {}", utility, hourlyPath);
            return UtilitySeries.of(CAMPUS_SCOPE, utility, List.of());
        }
        if (byScope.size() == 1) {
            Map.Entry<String, List<TimeSeriesPoint>> only = byScope.entrySet().iterator().next();
            log.info("[DATA] hourly {} | scope={} readings={}", utility, only.getKey(), only.getValue().size());
            return series(only.getKey(), utility, only.getValue());
        }
        List<TimeSeriesPoint> combined = combine(utility, byScope);
        log.info("[DATA] hourly {} | combined {} scopes into {} readings", utility, byScope.size(), combined.size());
        return series(CAMPUS_SCOPE, utility, combined);
    }

    /**
     * Duplicate timestamps within one scope are a defect of the input file.
     */
    private UtilitySeries series(String scope, Utility utility, List<TimeSeriesPoint> points) {
        try {
            return UtilitySeries.of(scope, utility, points);
        } catch (DataException e) {
            throw new DatasetLoadException("Invalid hourly series in " + hourlyPath + ": " + e.getMessage(), e);
        }
    }

    private static List<TimeSeriesPoint> combine(Utility utility, Map<String, List<TimeSeriesPoint>> byScope) {
        Map<Instant, List<TimeSeriesPoint>> byTimestamp = new TreeMap<>();
        for (List<TimeSeriesPoint> points : byScope.values()) {
            for (TimeSeriesPoint point : points) {
                byTimestamp.computeIfAbsent(point.getTimestamp(), k -> new ArrayList<>()).add(point);
            }
        }
        List<TimeSeriesPoint> combined = new ArrayList<>(byTimestamp.size());
        for (Map.Entry<Instant, List<TimeSeriesPoint>> entry : byTimestamp.entrySet()) {
            Double total = null;
            Set<String> names = new LinkedHashSet<>();
            for (TimeSeriesPoint point : entry.getValue()) {
                if (point.hasValue()) {
                    total = (total == null ? 0.0 : total) + point.getValue();
                }
                names.addAll(point.getRegressors().keySet());
            }
            TimeSeriesPoint.TimeSeriesPointBuilder builder = TimeSeriesPoint.builder()
                    .entityScope(CAMPUS_SCOPE)
                    .utility(utility)
                    .timestamp(entry.getKey())
                    .value(total);
            for (String name : names) {
                double sum = 0.0;
                int count = 0;
                for (TimeSeriesPoint point : entry.getValue()) {
                    Double v = point.regressor(name);
                    if (v != null && !v.isNaN()) {
                        sum += v;
                        count++;
                    }
                }
                builder.regressor(name, count == 0 ? null : sum / count);
            }
            combined.add(builder.build());
        }
        return combined;
    }

    // ======================== DAILY ========================

    @Override
    public List<DailyRecord> daily(Utility utility) {
        List<DailyRecord> records = new ArrayList<>();
        for (Map<String, String> row : readRows(dailyPath)) {
            Utility rowUtility = utilityOf(row, dailyPath);
            if (rowUtility != utility) {
                continue;
            }
            String entityId = required(row, "entity_id", dailyPath);
            records.add(DailyRecord.builder()
                    .entityId(entityId)
                    .entityName(row.getOrDefault("entity_name", entityId))
                    .utility(rowUtility)
                    .date(parseDate(required(row, "date", dailyPath)))
                    .energyValue(parseNumber(row.get(ProcessingConstants.TARGET_COLUMN)))
                    .grossArea(parseNumber(row.get("gross_area")))
                    .eui(parseNumber(row.get("eui")))
                    .meanTemperature(parseNumber(row.get("weather_temperature_2m")))
                    .build());
        }
        log.info("[DATA] daily {} | rows={}", utility, records.size());
        return records;
    }

    // ======================== PARSING ========================

    private List<Map<String, String>> readRows(Path path) {
        CsvSchema schema = CsvSchema.emptySchema().withHeader();
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
             MappingIterator<Map<String, String>> rows = mapper.readerForMapOf(String.class)
                     .with(schema)
                     .readValues(reader)) {
            return rows.readAll();
        } catch (IOException | RuntimeException e) {
            throw new DatasetLoadException("Failed to read " + path + ": " + e.getMessage(), e);
        }
    }

    private static String required(Map<String, String> row, String column, Path path) {
        String value = row.get(column);
        if (value == null || value.isBlank()) {
            throw new DatasetLoadException("Missing required column '" + column + "' in " + path, null);
        }
        return value;
    }

    private static Utility utilityOf(Map<String, String> row, Path path) {
        String code = required(row, "utility", path);
        try {
            return Utility.fromCode(code);
        } catch (IllegalArgumentException e) {
            throw new DatasetLoadException("Unknown utility '" + code + "' in " + path, e);
        }
    }

    static Double parseNumber(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            double parsed = Double.parseDouble(raw.trim());
            return Double.isNaN(parsed) ? null : parsed;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * ISO-8601 instant or offset date-time; a local date-time is read in the configured zone.
     */
    Instant parseTimestamp(String raw) {
        String text = raw.trim().replace(' ', 'T');
        try {
            return OffsetDateTime.parse(text).toInstant();
        } catch (DateTimeParseException notOffset) {
            try {
                return LocalDateTime.parse(text).atZone(zone).toInstant();
            } catch (DateTimeParseException e) {
                throw new DatasetLoadException("Unparseable timestamp '" + raw + "'", e);
            }
        }
    }

    private static LocalDate parseDate(String raw) {
        String text = raw.trim();
        try {
            return LocalDate.parse(text.length() > 10 ? text.substring(0, 10) : text);
        } catch (DateTimeParseException e) {
            throw new DatasetLoadException("Unparseable date '" + raw + "'", e);
        }
    }
}

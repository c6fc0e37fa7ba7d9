package com.kotsin.forecast.anomaly;

import com.kotsin.forecast.config.ForecastConfig;
import com.kotsin.forecast.exception.DataException;
import com.kotsin.forecast.logging.PipelineTraceLogger;
import com.kotsin.forecast.model.AnomalyRecord;
import com.kotsin.forecast.model.AnomalyReport;
import com.kotsin.forecast.model.AnomalySummary;
import com.kotsin.forecast.model.DailyRecord;
import com.kotsin.forecast.model.RunConfig;
import com.kotsin.forecast.util.MathUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.function.Function;

/**
 * AnomalyDetector - Unsupervised outlier flagging over the daily table of one utility.
 *
 * Features: energy value, energy use intensity and, when present, mean temperature.
 * The forest is fit once on every complete row (no split) and each row gets
 * {@code anomaly_score = score - offset}, where the offset is the contamination
 * percentile of all scores. Negative means outlier.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AnomalyDetector {

    private static final int MIN_FEATURES = 2;

    private static final List<Column> COLUMNS = List.of(
            new Column("energy_value", DailyRecord::getEnergyValue),
            new Column("eui", DailyRecord::resolvedEui),
            new Column("mean_temperature", DailyRecord::getMeanTemperature));

    private final ForecastConfig config;
    private final PipelineTraceLogger trace;

    private static final class Column {
        final String name;
        final Function<DailyRecord, Double> accessor;

        Column(String name, Function<DailyRecord, Double> accessor) {
            this.name = name;
            this.accessor = accessor;
        }
    }

    /**
     * @throws DataException INSUFFICIENT_FEATURES when fewer than two feature columns carry
     *                       values or no complete row remains
     */
    public AnomalyReport detect(List<DailyRecord> daily, RunConfig runConfig) {
        ForecastConfig.AnomalyConfig settings = config.getAnomaly();
        List<DailyRecord> records = new ArrayList<>();
        for (DailyRecord record : daily) {
            if (runConfig.getUtility() == null || runConfig.getUtility() == record.getUtility()) {
                records.add(record);
            }
        }

        List<Column> used = new ArrayList<>();
        for (Column column : COLUMNS) {
            if (records.stream().anyMatch(r -> MathUtils.isValidNumber(column.accessor.apply(r)))) {
                used.add(column);
            }
        }
        if (used.size() < MIN_FEATURES) {
            throw new DataException(DataException.Reason.INSUFFICIENT_FEATURES,
                    "need at least " + MIN_FEATURES + " populated feature columns, found " + used.size());
        }

        List<DailyRecord> complete = new ArrayList<>();
        List<double[]> matrix = new ArrayList<>();
        for (DailyRecord record : records) {
            double[] row = new double[used.size()];
            boolean ok = true;
            for (int f = 0; f < used.size() && ok; f++) {
                Double v = used.get(f).accessor.apply(record);
                ok = MathUtils.isValidNumber(v);
                row[f] = ok ? v : Double.NaN;
            }
            if (ok) {
                complete.add(record);
                matrix.add(row);
            }
        }
        if (complete.isEmpty()) {
            throw new DataException(DataException.Reason.INSUFFICIENT_FEATURES,
                    "no daily row has every feature of " + names(used));
        }
        log.debug("[ANOMALY] features={} rows={} dropped={}", names(used), complete.size(),
                records.size() - complete.size());

        double[][] rows = matrix.toArray(new double[0][]);
        IsolationForest forest = IsolationForest.fit(rows, settings.getTrees(), settings.getMaxSamples(),
                new Random(runConfig.getSeed()));

        double[] scores = new double[rows.length];
        for (int i = 0; i < rows.length; i++) {
            scores[i] = forest.score(rows[i]);
        }
        double[] sorted = scores.clone();
        Arrays.sort(sorted);
        double offset = MathUtils.percentile(sorted, 100.0 * settings.getContamination());

        List<AnomalyRecord> scored = new ArrayList<>(rows.length);
        for (int i = 0; i < rows.length; i++) {
            DailyRecord record = complete.get(i);
            double decision = scores[i] - offset;
            scored.add(AnomalyRecord.builder()
                    .entityId(record.getEntityId())
                    .entityName(record.getEntityName())
                    .date(record.getDate())
                    .observedValue(record.getEnergyValue() != null ? record.getEnergyValue() : Double.NaN)
                    .anomalyScore(decision)
                    .anomaly(decision < 0.0)
                    .build());
        }

        List<AnomalySummary> summary = summarize(scored);
        AnomalyReport report = new AnomalyReport(scored, summary);
        trace.logAnomalies(scored.size(), report.anomalyCount(), summary.size());
        return report;
    }

    /**
     * Entities with at least one anomaly, by count descending then entity id.
     */
    static List<AnomalySummary> summarize(List<AnomalyRecord> records) {
        Map<String, List<AnomalyRecord>> byEntity = new LinkedHashMap<>();
        for (AnomalyRecord record : records) {
            if (record.isAnomaly()) {
                byEntity.computeIfAbsent(record.getEntityId(), k -> new ArrayList<>()).add(record);
            }
        }
        List<AnomalySummary> summary = new ArrayList<>(byEntity.size());
        for (Map.Entry<String, List<AnomalyRecord>> entry : byEntity.entrySet()) {
            List<AnomalyRecord> flagged = entry.getValue();
            double total = 0.0;
            for (AnomalyRecord record : flagged) {
                total += record.getObservedValue();
            }
            summary.add(AnomalySummary.builder()
                    .entityId(entry.getKey())
                    .entityName(flagged.get(0).getEntityName())
                    .anomalyCount(flagged.size())
                    .meanAnomalousValue(total / flagged.size())
                    .build());
        }
        summary.sort(Comparator.comparingInt(AnomalySummary::getAnomalyCount).reversed()
                .thenComparing(AnomalySummary::getEntityId));
        return summary;
    }

    private static List<String> names(List<Column> columns) {
        List<String> names = new ArrayList<>(columns.size());
        for (Column column : columns) {
            names.add(column.name);
        }
        return names;
    }
}

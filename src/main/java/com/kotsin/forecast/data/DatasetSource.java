package com.kotsin.forecast.data;

import com.kotsin.forecast.model.DailyRecord;
import com.kotsin.forecast.model.Utility;
import com.kotsin.forecast.model.UtilitySeries;

import java.util.List;

/**
 * DatasetSource - Contract for the cleaned input tables the pipeline consumes.
 */
public interface DatasetSource {

    /**
     * Campus-level hourly series of one utility.
     *
     * @throws com.kotsin.forecast.exception.DatasetLoadException if the table cannot be read
     */
    UtilitySeries hourly(Utility utility);

    /**
     * Daily per-building rows of one utility.
     *
     * @throws com.kotsin.forecast.exception.DatasetLoadException if the table cannot be read
     */
    List<DailyRecord> daily(Utility utility);
}

package com.kotsin.forecast.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * DailyRecord - One row of the daily contract table (building x utility x day).
 */
@Value
@Builder(toBuilder = true)
public class DailyRecord {

    String entityId;
    String entityName;
    Utility utility;
    LocalDate date;
    Double energyValue;
    Double grossArea;
    Double eui;                  // energy use intensity, energy / gross area
    Double meanTemperature;

    /**
     * EUI as given, or derived from energy and a positive gross area.
     */
    public Double resolvedEui() {
        if (eui != null && !eui.isNaN()) {
            return eui;
        }
        if (energyValue == null || grossArea == null || grossArea <= 0) {
            return null;
        }
        return energyValue / grossArea;
    }
}

package com.kotsin.forecast.data;

import com.kotsin.forecast.exception.DataException;
import com.kotsin.forecast.exception.DatasetLoadException;
import com.kotsin.forecast.model.DailyRecord;
import com.kotsin.forecast.model.TimeSeriesPoint;
import com.kotsin.forecast.model.Utility;
import com.kotsin.forecast.model.UtilitySeries;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CsvDatasetSource - Contract table loading")
class CsvDatasetSourceTest {

    @TempDir
    Path dir;

    private CsvDatasetSource source(String hourly, String daily) throws IOException {
        Path hourlyFile = dir.resolve("hourly.csv");
        Path dailyFile = dir.resolve("daily.csv");
        Files.writeString(hourlyFile, hourly);
        Files.writeString(dailyFile, daily);
        return new CsvDatasetSource(hourlyFile, dailyFile, ZoneId.of("UTC"));
    }

    @Test
    @DisplayName("Single scope: readings and regressors, blanks stay missing")
    void testHourly_SingleScope() throws IOException {
        CsvDatasetSource source = source(
                "entity_scope,utility,timestamp,energy_kwh,temperature_2m\n"
                        + "campus,electricity,2023-01-02T01:00:00Z,120.5,31.0\n"
                        + "campus,electricity,2023-01-02T00:00:00Z,110.0,\n"
                        + "campus,gas,2023-01-02T00:00:00Z,9.0,30.0\n"
                        + "campus,electricity,2023-01-02 02:00:00,,32.0\n",
                "entity_id,utility,date,energy_kwh\n");

        UtilitySeries series = source.hourly(Utility.ELECTRICITY);

        assertEquals(3, series.size());
        List<TimeSeriesPoint> points = series.getPoints();
        assertEquals(Instant.parse("2023-01-02T00:00:00Z"), points.get(0).getTimestamp(), "sorted by time");
        assertEquals(110.0, points.get(0).getValue());
        assertNull(points.get(0).regressor("temperature_2m"), "blank regressor is missing, not zero");
        assertEquals(31.0, points.get(1).regressor("temperature_2m"));
        assertNull(points.get(2).getValue(), "blank energy is missing, not zero");
        assertEquals(Instant.parse("2023-01-02T02:00:00Z"), points.get(2).getTimestamp(), "local time read in UTC");
    }

    @Test
    @DisplayName("Several scopes combine into campus: energy summed, regressors averaged")
    void testHourly_CombinedScopes() throws IOException {
        CsvDatasetSource source = source(
                "entity_scope,utility,timestamp,energy_kwh,temperature_2m\n"
                        + "north,electricity,2023-01-02T00:00:00Z,100.0,30.0\n"
                        + "south,electricity,2023-01-02T00:00:00Z,50.0,34.0\n"
                        + "north,electricity,2023-01-02T01:00:00Z,80.0,31.0\n",
                "entity_id,utility,date,energy_kwh\n");

        UtilitySeries series = source.hourly(Utility.ELECTRICITY);

        assertEquals(CsvDatasetSource.CAMPUS_SCOPE, series.getEntityScope());
        assertEquals(2, series.size());
        assertEquals(150.0, series.getPoints().get(0).getValue());
        assertEquals(32.0, series.getPoints().get(0).regressor("temperature_2m"));
        assertEquals(80.0, series.getPoints().get(1).getValue());
    }

    @Test
    @DisplayName("Daily rows: filtered by utility, optional columns parsed")
    void testDaily() throws IOException {
        CsvDatasetSource source = source(
                "entity_scope,utility,timestamp,energy_kwh\n",
                "entity_id,entity_name,utility,date,energy_kwh,gross_area,eui,weather_temperature_2m\n"
                        + "B1,Library,electricity,2023-01-01,2400,12000,,41.5\n"
                        + "B2,Gym,Chilled Water,2023-01-01,800,5000,0.16,41.5\n"
                        + "B3,Lab,electricity,2023-01-01,n/a,8000,,41.5\n");

        List<DailyRecord> rows = source.daily(Utility.ELECTRICITY);

        assertEquals(2, rows.size());
        DailyRecord library = rows.get(0);
        assertEquals("Library", library.getEntityName());
        assertEquals(LocalDate.of(2023, 1, 1), library.getDate());
        assertEquals(0.2, library.resolvedEui(), 1e-12);
        assertEquals(41.5, library.getMeanTemperature());
        assertNull(rows.get(1).getEnergyValue(), "unparseable number is missing");
        assertEquals(1, source.daily(Utility.CHILLED_WATER).size());
    }

    @Test
    @DisplayName("Missing file raises DatasetLoadException")
    void testMissingFile() {
        CsvDatasetSource source = new CsvDatasetSource(dir.resolve("absent.csv"), dir.resolve("absent.csv"),
                ZoneId.of("UTC"));

        assertThrows(DatasetLoadException.class, () -> source.hourly(Utility.ELECTRICITY));
    }

    @Test
    @DisplayName("Two readings at one timestamp raise DatasetLoadException")
    void testHourly_DuplicateTimestamp() throws IOException {
        CsvDatasetSource source = source(
                "entity_scope,utility,timestamp,energy_kwh\n"
                        + "campus,electricity,2023-01-02T00:00:00Z,110.0\n"
                        + "campus,electricity,2023-01-02T00:00:00Z,112.0\n",
                "entity_id,utility,date,energy_kwh\n");

        DatasetLoadException e = assertThrows(DatasetLoadException.class, () -> source.hourly(Utility.ELECTRICITY));
        assertInstanceOf(DataException.class, e.getCause());
        assertEquals(DataException.Reason.DUPLICATE_TIMESTAMP, ((DataException) e.getCause()).getReason());
    }

    @Test
    @DisplayName("Unknown utility code raises DatasetLoadException")
    void testUnknownUtility() throws IOException {
        CsvDatasetSource source = source(
                "entity_scope,utility,timestamp,energy_kwh\n"
                        + "campus,plasma,2023-01-02T00:00:00Z,1.0\n",
                "entity_id,utility,date,energy_kwh\n");

        assertThrows(DatasetLoadException.class, () -> source.hourly(Utility.ELECTRICITY));
    }

    @Test
    @DisplayName("Number parsing")
    void testParseNumber() {
        assertEquals(12.5, CsvDatasetSource.parseNumber(" 12.5 "));
        assertNull(CsvDatasetSource.parseNumber(""));
        assertNull(CsvDatasetSource.parseNumber("NaN"));
        assertNull(CsvDatasetSource.parseNumber("abc"));
    }
}

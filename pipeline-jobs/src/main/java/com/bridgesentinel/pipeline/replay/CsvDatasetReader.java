package com.bridgesentinel.pipeline.replay;

import com.bridgesentinel.core.model.SensorReading;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Reads the historical bridge dataset CSV into {@link SensorReading}s.
 *
 * <p>
 * The first line is the header. Column names are lower-cased, empty cells
 * become {@code null} and numeric cells become {@link Double}. The timestamp
 * column is parsed into the reading's observation time; timestamps without
 * an offset are taken in the configured zone.
 * </p>
 *
 * @since 1.0.0
 */
public class CsvDatasetReader {

    private static final Logger LOG = LoggerFactory.getLogger(CsvDatasetReader.class);

    private final CsvMapper mapper = new CsvMapper();
    private final String timestampColumn;
    private final ZoneId zone;

    public CsvDatasetReader(String timestampColumn) {
        this(timestampColumn, ZoneId.systemDefault());
    }

    public CsvDatasetReader(String timestampColumn, ZoneId zone) {
        this.timestampColumn = Objects.requireNonNull(timestampColumn, "timestampColumn must not be null");
        this.zone = Objects.requireNonNull(zone, "zone must not be null");
        mapper.enable(CsvParser.Feature.TRIM_SPACES);
    }

    /**
     * Read every row in source order.
     *
     * @throws IllegalArgumentException if the file does not exist
     * @throws IllegalStateException    if the file cannot be read or parsed
     */
    public List<SensorReading> read(Path path) {
        Objects.requireNonNull(path, "path must not be null");
        LOG.info("Reading {}...", path);
        try (InputStream in = Files.newInputStream(path)) {
            List<SensorReading> readings = read(in);
            LOG.info("Loaded {} row(s) from {}", readings.size(), path);
            return readings;
        } catch (NoSuchFileException e) {
            throw new IllegalArgumentException("Dataset file not found: " + path, e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read dataset " + path + ": " + e.getMessage(), e);
        }
    }

    /**
     * Read every row from a stream. The stream is not closed.
     *
     * @throws IOException if the stream cannot be read
     */
    public List<SensorReading> read(InputStream in) throws IOException {
        CsvSchema schema = CsvSchema.emptySchema().withHeader();
        List<SensorReading> readings = new ArrayList<>();
        int unparsedTimestamps = 0;
        try (MappingIterator<Map<String, String>> it = mapper.readerForMapOf(String.class)
                .with(schema)
                .readValues(in)) {
            while (it.hasNext()) {
                Map<String, String> row = it.next();
                SensorReading reading = new SensorReading();
                for (Map.Entry<String, String> cell : row.entrySet()) {
                    String column = cell.getKey().trim().toLowerCase(Locale.ROOT);
                    String value = cell.getValue();
                    if (column.equals(timestampColumn)) {
                        Instant observedAt = parseTimestamp(value);
                        if (observedAt == null && value != null && !value.isEmpty()) {
                            unparsedTimestamps++;
                        }
                        reading.setObservedAt(observedAt);
                    } else {
                        reading.setField(column, convert(value));
                    }
                }
                readings.add(reading);
            }
        } catch (RuntimeException e) {
            // Jackson wraps parse failures raised from hasNext()/next()
            throw new IllegalStateException("Malformed CSV: " + e.getMessage(), e);
        }
        if (unparsedTimestamps > 0) {
            LOG.warn("{} row(s) had an unparseable '{}' value and carry no timestamp",
                    unparsedTimestamps, timestampColumn);
        }
        return readings;
    }

    static Object convert(String value) {
        if (value == null || value.isEmpty()) {
            return null;
        }
        try {
            return Double.valueOf(value);
        } catch (NumberFormatException e) {
            return value;
        }
    }

    Instant parseTimestamp(String value) {
        if (value == null || value.isEmpty()) {
            return null;
        }
        String iso = value.replace(' ', 'T');
        try {
            return LocalDateTime.parse(iso).atZone(zone).toInstant();
        } catch (DateTimeParseException notLocal) {
            try {
                return OffsetDateTime.parse(iso).toInstant();
            } catch (DateTimeParseException notOffset) {
                return null;
            }
        }
    }
}

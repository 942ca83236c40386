package com.quantflow.cli;

import com.quantflow.core.error.MarketDataException;
import com.quantflow.core.model.Bar;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads bars from {@code timestamp,open,high,low,close,volume} CSV.
 *
 * <p>The timestamp is an ISO instant ({@code 2024-01-02T21:00:00Z}) or an ISO date, which is taken
 * as the start of that day in the configured zone. A header row is skipped. Any malformed row
 * fails the whole load with its line number.
 */
public final class CsvBarLoader {
    private static final Logger logger = LoggerFactory.getLogger(CsvBarLoader.class);
    private static final int COLUMNS = 6;

    private final ZoneId zone;

    public CsvBarLoader(ZoneId zone) {
        this.zone = zone;
    }

    public List<Bar> load(Path file) {
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            List<Bar> bars = new ArrayList<>();
            String line;
            int lineNumber = 0;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                String trimmed = line.strip();
                if (trimmed.isEmpty() || (bars.isEmpty() && isHeader(trimmed))) {
                    continue;
                }
                bars.add(parse(trimmed, lineNumber));
            }
            logger.info("Read {} bars from {}", bars.size(), file);
            return bars;
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + file, e);
        }
    }

    private Bar parse(String line, int lineNumber) {
        String[] fields = line.split(",");
        if (fields.length != COLUMNS) {
            throw new MarketDataException("Line " + lineNumber + ": expected " + COLUMNS + " columns, got " + fields.length);
        }
        try {
            return new Bar(timestamp(fields[0].strip()),
                new BigDecimal(fields[1].strip()),
                new BigDecimal(fields[2].strip()),
                new BigDecimal(fields[3].strip()),
                new BigDecimal(fields[4].strip()),
                Long.parseLong(fields[5].strip()));
        } catch (NumberFormatException | DateTimeParseException e) {
            throw new MarketDataException("Line " + lineNumber + ": " + e.getMessage(), e);
        } catch (MarketDataException e) {
            throw new MarketDataException("Line " + lineNumber + ": " + e.getMessage(), e);
        }
    }

    private Instant timestamp(String value) {
        if (value.length() == 10) {
            return LocalDate.parse(value).atStartOfDay(zone).toInstant();
        }
        return Instant.parse(value);
    }

    private static boolean isHeader(String line) {
        return Character.isLetter(line.charAt(0));
    }
}

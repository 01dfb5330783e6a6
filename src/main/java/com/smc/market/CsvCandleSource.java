package com.smc.market;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.smc.config.MarketProperties;

/**
 * Reads closed candles from {@code {dataDir}/{interval}/{filePattern}}.
 */
public class CsvCandleSource implements CandleSource {
    private static final Logger LOGGER = LoggerFactory.getLogger(CsvCandleSource.class);

    private final MarketProperties.CsvSource csvConfig;

    public CsvCandleSource(MarketProperties properties) {
        this.csvConfig = properties.csv();
    }

    @Override
    public List<Candle> getCandles(String brokerSymbol, Horizon horizon, int count) {
        Path path = resolveCsvPath(brokerSymbol, horizon);
        if (path == null || !Files.exists(path)) {
            LOGGER.warn("EVENT=CSV_MISSING symbol={} tf={} path={}", brokerSymbol, horizon, path);
            return List.of();
        }

        List<Candle> candles = new ArrayList<>();
        try (BufferedReader reader = Files.newBufferedReader(path)) {
            String line;
            boolean headerProcessed = false;
            Map<String, Integer> headerIndex = new HashMap<>();
            while ((line = reader.readLine()) != null) {
                if (line.isBlank()) {
                    continue;
                }
                String[] parts = line.split(Pattern.quote(csvConfig.delimiter()));
                if (!headerProcessed && csvConfig.hasHeader()) {
                    headerIndex = parseHeader(parts);
                    headerProcessed = true;
                    continue;
                }
                headerProcessed = true;
                Candle candle = parseCandle(parts, headerIndex);
                if (candle != null) {
                    candles.add(candle);
                }
            }
        } catch (IOException e) {
            throw new CandleSourceException("Failed to read " + path + ": " + e.getMessage(), e);
        }

        candles.sort(Comparator.comparingLong(Candle::closeTime));
        if (count > 0 && candles.size() > count) {
            candles = new ArrayList<>(candles.subList(candles.size() - count, candles.size()));
        }
        LOGGER.debug("EVENT=CSV_LOADED symbol={} tf={} candles={} path={}", brokerSymbol, horizon, candles.size(), path);
        return candles;
    }

    private Path resolveCsvPath(String symbol, Horizon horizon) {
        Path dir = Path.of(csvConfig.dataDir(), horizon.interval());
        String filePattern = csvConfig.filePattern()
                .replace("{symbol}", symbol)
                .replace("{interval}", horizon.interval());
        if (filePattern.contains("*")) {
            return resolveMatchingFile(dir, filePattern);
        }
        return dir.resolve(filePattern);
    }

    private Path resolveMatchingFile(Path dir, String pattern) {
        if (!Files.exists(dir)) {
            return null;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, pattern)) {
            var iterator = stream.iterator();
            return iterator.hasNext() ? iterator.next() : null;
        } catch (IOException e) {
            LOGGER.warn("EVENT=CSV_SCAN_FAILED dir={} reason={}", dir, e.getMessage());
            return null;
        }
    }

    private Map<String, Integer> parseHeader(String[] header) {
        Map<String, Integer> indexMap = new HashMap<>();
        for (int i = 0; i < header.length; i++) {
            indexMap.put(normalize(header[i]), i);
        }
        return indexMap;
    }

    private Candle parseCandle(String[] parts, Map<String, Integer> headerIndex) {
        try {
            int openIdx = resolveIndex(headerIndex, csvConfig.openColumn(), csvConfig.openIndex());
            int highIdx = resolveIndex(headerIndex, csvConfig.highColumn(), csvConfig.highIndex());
            int lowIdx = resolveIndex(headerIndex, csvConfig.lowColumn(), csvConfig.lowIndex());
            int closeIdx = resolveIndex(headerIndex, csvConfig.closeColumn(), csvConfig.closeIndex());
            int volumeIdx = resolveIndex(headerIndex, csvConfig.volumeColumn(), csvConfig.volumeIndex());
            int closeTimeIdx = resolveIndex(headerIndex, csvConfig.closeTimeColumn(), csvConfig.closeTimeIndex());

            double open = Double.parseDouble(parts[openIdx].trim());
            double high = Double.parseDouble(parts[highIdx].trim());
            double low = Double.parseDouble(parts[lowIdx].trim());
            double close = Double.parseDouble(parts[closeIdx].trim());
            double volume = Double.parseDouble(parts[volumeIdx].trim());
            long closeTime = parseCloseTime(parts[closeTimeIdx], csvConfig.closeTimeUnit());

            return new Candle(open, high, low, close, volume, closeTime);
        } catch (RuntimeException e) {
            LOGGER.debug("EVENT=CSV_ROW_SKIPPED reason={}", e.getMessage());
            return null;
        }
    }

    private long parseCloseTime(String value, String unit) {
        long timeValue = Long.parseLong(value.trim());
        String normalizedUnit = unit == null ? "MILLIS" : unit.toUpperCase(Locale.ROOT);
        return switch (normalizedUnit) {
            case "SECONDS" -> Instant.EPOCH.plus(timeValue, ChronoUnit.SECONDS).toEpochMilli();
            case "MICROS" -> Instant.EPOCH.plus(timeValue, ChronoUnit.MICROS).toEpochMilli();
            case "NANOS" -> Instant.EPOCH.plus(timeValue, ChronoUnit.NANOS).toEpochMilli();
            default -> timeValue;
        };
    }

    private int resolveIndex(Map<String, Integer> headerIndex, String column, int fallbackIndex) {
        if (headerIndex == null || headerIndex.isEmpty()) {
            return fallbackIndex;
        }
        Integer index = headerIndex.get(normalize(column));
        return index == null ? fallbackIndex : index;
    }

    private String normalize(String raw) {
        if (raw == null) {
            return "";
        }
        return raw.trim()
                .toLowerCase(Locale.ROOT)
                .replace(" ", "")
                .replace("_", "");
    }
}

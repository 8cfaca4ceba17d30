package com.agenttrader.data;

import com.agenttrader.core.data.BarSource;
import com.agenttrader.core.exception.InvalidSymbolException;
import com.agenttrader.core.model.Bar;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Daily bars from {@code <dataDir>/<SYMBOL>.csv}.
 * <p>
 * Expected header: {@code Date,Open,High,Low,Close[,Volume][,PreMarket][,AfterHours]}, matched
 * case-insensitively; {@code Ticker}/{@code Symbol} columns are ignored and {@code Timestamp} is
 * accepted for the date. Rows come back sorted by date. Unparsable rows are skipped with a warning.
 */
public final class CsvBarSource implements BarSource {
    private static final Logger logger = LoggerFactory.getLogger(CsvBarSource.class);
    private static final String EXTENSION = ".csv";

    private final Path dataDir;

    public CsvBarSource(Path dataDir) {
        this.dataDir = dataDir;
    }

    @Override
    public List<Bar> history(String symbol) throws InvalidSymbolException, IOException {
        if (symbol == null || symbol.isBlank() || !symbol.matches("[A-Za-z0-9.\\-^=]+")) {
            throw new InvalidSymbolException(String.valueOf(symbol), "not a ticker");
        }
        Path file = dataDir.resolve(symbol.toUpperCase(Locale.ROOT) + EXTENSION);
        if (!Files.isRegularFile(file)) {
            throw new InvalidSymbolException(symbol, "no data file " + file.getFileName());
        }
        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        if (lines.isEmpty()) {
            return List.of();
        }

        Map<String, Integer> columns = header(lines.get(0));
        int date = column(columns, file, "date", "timestamp", "datetime");
        int open = column(columns, file, "open");
        int high = column(columns, file, "high");
        int low = column(columns, file, "low");
        int close = column(columns, file, "close", "adj close", "adj_close");
        Integer volume = columns.get("volume");
        Integer preMarket = columns.get("premarket");
        Integer afterHours = columns.get("afterhours");

        List<Bar> bars = new ArrayList<>(lines.size());
        int missingVolume = 0;
        for (int i = 1; i < lines.size(); i++) {
            String line = lines.get(i);
            if (line.isBlank()) {
                continue;
            }
            String[] cells = line.split(",", -1);
            try {
                String volumeCell = cell(cells, volume);
                if (volumeCell == null) {
                    missingVolume++;
                }
                bars.add(new Bar(symbol.toUpperCase(Locale.ROOT),
                    parseDate(required(cells, date)),
                    Double.parseDouble(required(cells, open)),
                    Double.parseDouble(required(cells, high)),
                    Double.parseDouble(required(cells, low)),
                    Double.parseDouble(required(cells, close)),
                    volumeCell == null ? 0.0 : Double.parseDouble(volumeCell),
                    optional(cell(cells, preMarket)),
                    optional(cell(cells, afterHours))));
            } catch (DateTimeParseException | IllegalArgumentException e) {
                logger.warn("{}: skipping row {}: {}", file.getFileName(), i + 1, e.getMessage());
            }
        }
        if (missingVolume > 0) {
            logger.warn("⚠️ {}: {} rows without volume, treated as 0", symbol, missingVolume);
        }

        bars.sort(Comparator.comparing(Bar::date));
        logger.debug("Loaded {} bars for {} from {}", bars.size(), symbol, file);
        return bars;
    }

    /** Tickers with a CSV file in the data directory, sorted. */
    @Override
    public List<String> symbols() throws IOException {
        if (!Files.isDirectory(dataDir)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(dataDir)) {
            return files
                .map(p -> p.getFileName().toString())
                .filter(name -> name.toLowerCase(Locale.ROOT).endsWith(EXTENSION))
                .map(name -> name.substring(0, name.length() - EXTENSION.length()).toUpperCase(Locale.ROOT))
                .sorted()
                .toList();
        }
    }

    private static Map<String, Integer> header(String line) {
        Map<String, Integer> columns = new HashMap<>();
        String[] names = line.replace("\uFEFF", "").split(",", -1);
        for (int i = 0; i < names.length; i++) {
            columns.putIfAbsent(names[i].trim().toLowerCase(Locale.ROOT), i);
        }
        return columns;
    }

    private static int column(Map<String, Integer> columns, Path file, String... names) throws IOException {
        for (String name : names) {
            Integer index = columns.get(name);
            if (index != null) {
                return index;
            }
        }
        throw new IOException(file.getFileName() + " has no '" + names[0] + "' column");
    }

    /** Trimmed cell, {@code null} when the column is absent or the cell empty. */
    private static String cell(String[] cells, Integer index) {
        if (index == null || index >= cells.length) {
            return null;
        }
        String value = cells[index].trim();
        return value.isEmpty() ? null : value;
    }

    private static String required(String[] cells, int index) {
        String value = cell(cells, index);
        if (value == null) {
            throw new IllegalArgumentException("empty cell in column " + (index + 1));
        }
        return value;
    }

    private static Double optional(String value) {
        return value == null ? null : Double.valueOf(value);
    }

    private static LocalDate parseDate(String value) {
        // "2024-01-02" or "2024-01-02 00:00:00" / "2024-01-02T00:00:00Z"
        return LocalDate.parse(value.length() > 10 ? value.substring(0, 10) : value);
    }
}

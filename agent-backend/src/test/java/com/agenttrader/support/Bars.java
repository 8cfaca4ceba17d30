package com.agenttrader.support;

import com.agenttrader.core.model.Bar;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Synthetic daily bars and CSV fixtures for backend tests.
 */
public final class Bars {

    public static final LocalDate START = LocalDate.of(2023, 1, 2);

    private Bars() {
    }

    /** Seeded random walk with daily moves of up to about ±2%. */
    public static List<Bar> randomWalk(String symbol, int count, double start, long seed) {
        Random rng = new Random(seed);
        List<Bar> bars = new ArrayList<>(count);
        double c = start;
        for (int i = 0; i < count; i++) {
            double open = c;
            c = c * (1.0 + (rng.nextDouble() - 0.5) * 0.04);
            bars.add(new Bar(symbol, START.plusDays(i), open, Math.max(open, c) * 1.005,
                Math.min(open, c) * 0.995, c, 5_000 + rng.nextInt(5_000)));
        }
        return bars;
    }

    /** Write {@code bars} as {@code <dir>/<SYMBOL>.csv} with a standard header. */
    public static Path writeCsv(Path dir, String symbol, List<Bar> bars) throws IOException {
        StringBuilder sb = new StringBuilder("Date,Open,High,Low,Close,Volume\n");
        for (Bar b : bars) {
            sb.append(b.date()).append(',')
                .append(b.open()).append(',')
                .append(b.high()).append(',')
                .append(b.low()).append(',')
                .append(b.close()).append(',')
                .append((long) b.volume()).append('\n');
        }
        Path file = dir.resolve(symbol + ".csv");
        Files.writeString(file, sb.toString());
        return file;
    }
}

package com.agenttrader.config;

import com.agenttrader.core.config.PipelineConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Properties;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runtime settings of the bot process, loaded from {@code config.properties}.
 * <p>
 * The same properties carry the pipeline tunables; {@link #pipelineConfig()} hands them to
 * {@link PipelineConfig}, which validates them.
 */
public final class TradingConfig {
    private static final Logger logger = LoggerFactory.getLogger(TradingConfig.class);

    private static final AtomicReference<TradingConfig> instanceRef = new AtomicReference<>();
    private final Properties properties;

    private final Path dataDir;
    private final Path journalDbPath;
    private final Path modelPath;
    private final double initialCash;
    private final List<String> symbols;
    private final String defaultUser;
    private final double riskTolerance;
    private final long cycleIntervalSeconds;
    private final boolean dashboardEnabled;
    private final int dashboardPort;

    private TradingConfig(Properties props) {
        this.properties = props;

        this.dataDir = Path.of(properties.getProperty("DATA_DIR", "data").trim());
        this.journalDbPath = Path.of(properties.getProperty("JOURNAL_DB_PATH", "journal.db").trim());
        this.modelPath = Path.of(properties.getProperty("MODEL_PATH", "model.json").trim());
        this.initialCash = parseDouble("INITIAL_CASH", 100_000.0);
        this.symbols = parseSymbols("SYMBOLS");
        this.defaultUser = properties.getProperty("DEFAULT_USER", "default").trim();
        this.riskTolerance = parseDouble("RISK_TOLERANCE", 0.5);
        this.cycleIntervalSeconds = parseLong("CYCLE_INTERVAL_SECONDS", 0L);
        this.dashboardEnabled = parseBoolean("DASHBOARD_ENABLED", false);
        this.dashboardPort = (int) parseLong("DASHBOARD_PORT", 8080L);

        logger.info("📊 Trading Configuration Loaded:");
        logger.info("   Data dir: {}", dataDir.toAbsolutePath());
        logger.info("   Symbols: {}", symbols.isEmpty() ? "(all CSV files)" : String.join(",", symbols));
        logger.info("   Initial cash: ${}", String.format("%.2f", initialCash));
        logger.info("   Risk tolerance: {}", String.format("%.2f", riskTolerance));
        logger.info("   Cycle interval: {}", cycleIntervalSeconds > 0 ? cycleIntervalSeconds + "s" : "run once");
    }

    private double parseDouble(String key, double defaultValue) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid {} value '{}', using default {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    private long parseLong(String key, long defaultValue) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid {} value '{}', using default {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    private boolean parseBoolean(String key, boolean defaultValue) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        return Boolean.parseBoolean(value.trim());
    }

    /** Comma-separated tickers, upper-cased; empty means "every CSV in DATA_DIR". */
    private List<String> parseSymbols(String key) {
        String value = properties.getProperty(key, "");
        return Arrays.stream(value.split(","))
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .map(s -> s.toUpperCase(Locale.ROOT))
            .distinct()
            .toList();
    }

    public static TradingConfig getInstance() {
        return instanceRef.updateAndGet(existing ->
            existing != null ? existing : load()
        );
    }

    /**
     * Load from {@code config.properties} in the working directory, then from the classpath,
     * falling back to defaults.
     */
    public static TradingConfig load() {
        return load(Path.of("config.properties"));
    }

    public static TradingConfig load(Path configPath) {
        Properties props = new Properties();

        if (Files.exists(configPath)) {
            try (InputStream is = Files.newInputStream(configPath)) {
                props.load(is);
                logger.info("Loaded config from: {}", configPath.toAbsolutePath());
                return new TradingConfig(props);
            } catch (IOException e) {
                logger.warn("Failed to load {} from filesystem: {}", configPath, e.getMessage());
            }
        }

        try (InputStream is = TradingConfig.class.getClassLoader().getResourceAsStream("config.properties")) {
            if (is != null) {
                props.load(is);
                logger.info("Loaded config from classpath");
                return new TradingConfig(props);
            }
        } catch (IOException e) {
            logger.warn("Failed to load config.properties from classpath: {}", e.getMessage());
        }

        logger.warn("No config.properties found, using defaults");
        return new TradingConfig(props);
    }

    public static TradingConfig forTest(Properties testProps) {
        return new TradingConfig(testProps);
    }

    public static void reset() {
        instanceRef.set(null);
    }

    /**
     * Pipeline tunables from the same properties.
     *
     * @throws com.agenttrader.core.exception.ConfigurationException when a tunable is out of range
     */
    public PipelineConfig pipelineConfig() {
        return PipelineConfig.fromProperties(properties);
    }

    // ========== Getters ==========

    public Path getDataDir() {
        return dataDir;
    }

    public Path getJournalDbPath() {
        return journalDbPath;
    }

    public Path getModelPath() {
        return modelPath;
    }

    public double getInitialCash() {
        return initialCash;
    }

    public List<String> getSymbols() {
        return symbols;
    }

    public String getDefaultUser() {
        return defaultUser;
    }

    /** Risk tolerance used for scheduled cycles, in [0, 1]. */
    public double getRiskTolerance() {
        return riskTolerance;
    }

    /** Seconds between scheduled cycles; 0 runs a single cycle and exits. */
    public long getCycleIntervalSeconds() {
        return cycleIntervalSeconds;
    }

    public boolean isDashboardEnabled() {
        return dashboardEnabled;
    }

    public int getDashboardPort() {
        return dashboardPort;
    }
}

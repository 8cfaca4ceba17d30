package com.agenttrader.bot;

import com.agenttrader.config.TradingConfig;
import com.agenttrader.core.data.BarSource;
import com.agenttrader.core.ledger.PortfolioLedger;
import com.agenttrader.core.model.Transaction;
import com.agenttrader.core.model.TransactionType;
import com.agenttrader.data.CsvBarSource;
import com.agenttrader.metrics.MetricsService;
import com.agenttrader.persistence.TradeJournal;
import com.agenttrader.support.Bars;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.assertj.core.api.Assertions.within;

/**
 * Wires the bot against CSV files, a SQLite journal and a model file in a temp directory.
 */
@DisplayName("TradingBot Integration Tests")
class TradingBotTest {

    @TempDir
    Path workDir;

    private TradingConfig config;
    private BarSource bars;
    private final List<TradingBot> opened = new ArrayList<>();

    @BeforeEach
    void setUp() throws Exception {
        Path dataDir = Files.createDirectories(workDir.resolve("data"));
        Bars.writeCsv(dataDir, "AAA", Bars.randomWalk("AAA", 150, 100.0, 7L));
        Bars.writeCsv(dataDir, "BBB", Bars.randomWalk("BBB", 150, 40.0, 8L));

        Properties props = new Properties();
        props.setProperty("DATA_DIR", dataDir.toString());
        props.setProperty("JOURNAL_DB_PATH", workDir.resolve("journal.db").toString());
        props.setProperty("MODEL_PATH", workDir.resolve("models/forecaster.json").toString());
        props.setProperty("INITIAL_CASH", "10000");
        props.setProperty("DEFAULT_USER", "tester");
        props.setProperty("FORECAST_TREES", "5");
        props.setProperty("FORECAST_MAX_DEPTH", "4");
        config = TradingConfig.forTest(props);
        bars = new CsvBarSource(dataDir);
    }

    @AfterEach
    void tearDown() {
        opened.forEach(TradingBot::close);
    }

    private TradingBot newBot() {
        TradingBot bot = new TradingBot(config, config.pipelineConfig(), bars, MetricsService.getInstance());
        opened.add(bot);
        return bot;
    }

    @Test
    @DisplayName("Empty SYMBOLS trades every CSV in the data directory")
    void testUniverse() throws Exception {
        assertThat(newBot().universe(bars)).containsExactly("AAA", "BBB");
    }

    @Test
    @DisplayName("First start trains and saves the model, the next start restores it")
    void testModelPersistence() throws Exception {
        TradingBot first = newBot();
        assertThat(first.ensureModel(List.of("AAA", "BBB"))).isTrue();
        assertThat(config.getModelPath()).exists();

        TradingBot second = newBot();
        assertThat(second.coordinator().forecaster().isTrained()).isFalse();
        assertThat(second.ensureModel(List.of())).isTrue();
        assertThat(second.coordinator().forecaster().isTrained()).isTrue();
    }

    @Test
    @DisplayName("A cycle completes and its trades survive a restart")
    void testCycleAndRestart() throws Exception {
        TradingBot first = newBot();
        first.ensureModel(List.of("AAA", "BBB"));

        assertThat(first.runOnce(List.of("AAA", "BBB"))).isZero();
        PortfolioLedger before = first.coordinator().ledgers().find("tester").orElseThrow();

        TradingBot second = newBot();
        PortfolioLedger after = second.coordinator().ledgers().find("tester").orElse(null);
        if (before.transactions().isEmpty()) {
            assertThat(after).isNull();
        } else {
            assertThat(after).isNotNull();
            assertThat(after.cash()).isCloseTo(before.cash(), within(1e-6));
            assertThat(after.transactions())
                .extracting(Transaction::symbol, Transaction::type, Transaction::quantity)
                .containsExactlyElementsOf(before.transactions().stream()
                    .map(t -> tuple(t.symbol(), t.type(), t.quantity()))
                    .toList());
        }
    }

    @Test
    @DisplayName("Journaled transactions rebuild the user's ledger")
    void testRestoreLedgers() {
        try (TradeJournal journal = new TradeJournal(config.getJournalDbPath().toString())) {
            journal.recordTransaction(new Transaction("carol", "AAA", TransactionType.BUY, 10, 100.0, 1000.0, null,
                Instant.parse("2024-03-01T15:00:00Z")));
        }

        PortfolioLedger carol = newBot().coordinator().ledgers().find("carol").orElseThrow();

        assertThat(carol.cash()).isCloseTo(9_000.0, within(1e-9));
        assertThat(carol.snapshot().positions()).hasSize(1);
    }
}

package com.simtrader.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.simtrader.core.config.SimulationConfig;
import com.simtrader.core.model.Deal;
import com.simtrader.core.model.OrderType;
import com.simtrader.core.model.TradeRequest;
import com.simtrader.core.model.TradeResult;
import com.simtrader.engine.clock.ClockException;
import com.simtrader.engine.clock.Cursor;
import com.simtrader.engine.clock.RangeExhaustedException;
import com.simtrader.engine.market.MarketData;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static com.simtrader.engine.Markets.*;
import static org.junit.jupiter.api.Assertions.*;

class BacktestEngineTest {

    private static final double EPS = 1e-9;
    private static final long LENGTH = 20_000;

    private SimulationConfig config;
    private MarketData market;
    private BacktestEngine engine;

    @BeforeEach
    void setUp() {
        config = config(100, LENGTH);
        market = flat(LENGTH, 10);
        engine = new BacktestEngine(config, market);
    }

    private TradeResult send(OrderType type, double volume) {
        TradeResult result = engine.orderSend(TradeRequest.market(SYMBOL, type, volume));
        assertTrue(result.isDone(), result::comment);
        return result;
    }

    @Nested
    @DisplayName("Deal history over a run")
    class DealHistory {

        @Test
        void dealsAreQueryableByWindowAndPosition() throws ClockException {
            engine.reset();
            engine.fastForward(100);
            send(OrderType.SELL, 0.01);
            send(OrderType.BUY, 0.01);

            assertEquals(2, engine.getDeals().historyGet(START, engine.time()).size());

            engine.fastForward(10_000);
            TradeResult bo2 = send(OrderType.BUY, 0.01);
            long filledAt = engine.time();
            engine.fastForward(50);

            List<Deal> window = engine.getDeals().historyGet(filledAt - 10, engine.time());
            assertEquals(1, window.size());
            assertEquals(bo2.order(), window.get(0).order());

            assertTrue(engine.closePosition(bo2.order()).isDone());
            assertTrue(engine.getDeals().getByPosition(bo2.order()).size() <= 2);
            assertEquals(0, engine.getPositions().openPositionsTotal());

            long end = START + LENGTH;
            assertEquals(engine.getDeals().total(START, end), engine.getDeals().getRange(START, end).size());
            assertEquals(engine.getDeals().size(), engine.getDeals().total(START, end));
            assertEquals(4, engine.getDeals().size());
            assertEquals(engine.getOrders().size(), engine.getOrders().total(START, end));
        }

        @Test
        void runStopsAtSpanEnd() throws ClockException {
            engine.fastForward(LENGTH - 1);
            assertThrows(RangeExhaustedException.class, () -> engine.next());
            assertEquals(START + LENGTH - 1, engine.time());
        }

        @Test
        void resetClearsHistory() throws ClockException {
            engine.fastForward(10);
            send(OrderType.BUY, 0.01);
            engine.reset();

            assertEquals(new Cursor(0, START), engine.cursor());
            assertEquals(0, engine.getDeals().size());
            assertEquals(0, engine.getPositions().size());
            assertEquals(100, engine.getAccount().getBalance(), EPS);
        }
    }

    @Nested
    @DisplayName("Report")
    class Report {

        @Test
        void summarizesClosedPositions() throws ClockException {
            send(OrderType.BUY, 0.01);
            send(OrderType.SELL, 0.01);
            engine.fastForward(100);
            send(OrderType.SELL, 0.01);
            engine.closeAll();

            BacktestReport report = engine.report();
            assertEquals(2, report.total());
            assertEquals(0, report.wins());
            assertEquals(2, report.losses());
            assertEquals(-0.2, report.loss(), EPS);
            assertEquals(-0.2, report.netProfit(), EPS);
            assertEquals(0, report.profitFactor(), EPS);
            assertEquals(99.8, report.balance(), EPS);
            assertEquals(-0.2, report.profitability(), EPS);
        }

        @Test
        void wrapUpClosesAndWritesResults(@TempDir Path dir) throws IOException {
            config.setResultsDir(dir.toString());
            send(OrderType.BUY, 0.01);

            BacktestReport report = engine.wrapUp();

            assertEquals(0, engine.getPositions().openPositionsTotal());
            assertEquals(1, report.total());
            Path json = dir.resolve("test-run.json");
            assertTrue(Files.exists(json));
            JsonNode node = new ObjectMapper().readTree(json.toFile());
            assertEquals(-0.1, node.get("net_profit").asDouble(), EPS);
            assertEquals(0.0, node.get("win_percentage").asDouble(), EPS);
            assertTrue(Files.exists(dir.resolve("test-run.snapshot.json")));
        }
    }

    @Nested
    @DisplayName("Snapshots")
    class Snapshots {

        @Test
        void restoreResumesWhereSnapshotWasTaken() throws Exception {
            engine.fastForward(30);
            TradeResult open = send(OrderType.BUY, 0.02);
            engine.fastForward(30);
            byte[] blob = engine.snapshot().toBytes();

            BacktestEngine resumed = new BacktestEngine(config, market);
            resumed.restore(EngineSnapshot.fromBytes(blob));

            assertEquals(engine.cursor(), resumed.cursor());
            assertEquals(1, resumed.getPositions().openPositionsTotal());
            assertEquals(engine.getPositions().get(open.order()), resumed.getPositions().get(open.order()));
            assertEquals(engine.getDeals().values(), resumed.getDeals().values());
            assertEquals(engine.getAccount().info(), resumed.getAccount().info());

            TradeResult close = resumed.closePosition(open.order());
            assertTrue(close.isDone());
            assertTrue(close.order() > open.deal(), "tickets continue after the restored ones");
        }
    }
}

package com.simtrader.engine;

import com.simtrader.core.concurrent.EventLoop;
import com.simtrader.core.model.AccountInfo;
import com.simtrader.core.model.OrderType;
import com.simtrader.core.model.TradeRequest;
import com.simtrader.core.model.TradeResult;
import com.simtrader.core.terminal.TerminalException;
import com.simtrader.core.terminal.TradingTerminal;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static com.simtrader.engine.Markets.*;
import static org.junit.jupiter.api.Assertions.*;

class SimulatedTerminalTest {

    private EventLoop loop;
    private BacktestEngine engine;
    private TradingTerminal terminal;

    @BeforeEach
    void setUp() {
        loop = new EventLoop();
        engine = new BacktestEngine(config(10_000, 1000), flat(1000, 1));
        terminal = new SimulatedTerminal(engine, loop);
    }

    @AfterEach
    void tearDown() {
        loop.close();
    }

    @Test
    void tradesAndQueriesThroughLoop() throws TerminalException {
        TradeResult result = terminal.orderSend(TradeRequest.market(SYMBOL, OrderType.BUY, 0.1));

        assertTrue(result.isDone());
        assertEquals(1, terminal.positionsTotal());
        assertEquals(1, terminal.positionsGet(SYMBOL).size());
        assertTrue(terminal.positionGet(result.order()).isPresent());
        assertEquals(1, terminal.historyDealsGet(START, START + 1000).size());
        assertEquals(1, terminal.historyDealsTotal(START, START + 1000));
        assertEquals(1, terminal.historyOrdersTotal(START, START));
        assertEquals(1, terminal.historyDealsGet(result.order()).size());
        assertEquals(BID, terminal.symbolInfoTick(SYMBOL).orElseThrow().bid(), 1e-9);
        assertEquals(START, terminal.time());
        assertTrue(terminal.symbolInfo(SYMBOL).isPresent());
        assertTrue(terminal.ordersGet().isEmpty());
    }

    @Test
    void concurrentCallersSeeConsistentLedgers() throws Exception {
        ExecutorService callers = Executors.newFixedThreadPool(4);
        try {
            List<Future<TradeResult>> futures = new ArrayList<>();
            for (int i = 0; i < 40; i++) {
                OrderType side = i % 2 == 0 ? OrderType.BUY : OrderType.SELL;
                futures.add(callers.submit(() -> terminal.orderSend(TradeRequest.market(SYMBOL, side, 0.01))));
            }
            for (Future<TradeResult> future : futures) {
                assertTrue(future.get().isDone());
            }
        } finally {
            callers.shutdownNow();
        }

        assertEquals(40, terminal.historyDealsTotal(START, START));
        assertEquals(40, terminal.historyOrdersGet(START, START).size());
        double net = terminal.historyDealsGet(START, START).stream().mapToDouble(d -> d.signedVolume()).sum();
        assertEquals(0, net, 1e-9);
        assertEquals(0, terminal.positionsTotal());
    }

    @Test
    void engineRejectsWritesFromOutsideTheLoop() throws TerminalException {
        assertThrows(IllegalStateException.class,
                () -> engine.orderSend(TradeRequest.market(SYMBOL, OrderType.BUY, 0.1)));
        assertEquals(0, terminal.positionsTotal());
        assertEquals(0, terminal.historyOrdersTotal(START, START + 1000));
        assertTrue(terminal.orderSend(TradeRequest.market(SYMBOL, OrderType.BUY, 0.1)).isDone());
    }

    @Test
    void closedLoopSurfacesAsTerminalException() {
        loop.close();
        assertThrows(TerminalException.class, terminal::accountInfo);
    }

    @Test
    void accountInfoMatchesEngine() throws TerminalException {
        AccountInfo info = terminal.accountInfo();
        assertEquals(10_000, info.balance(), 1e-9);
        assertEquals(100, info.leverage());
    }
}

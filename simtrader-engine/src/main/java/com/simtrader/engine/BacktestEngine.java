package com.simtrader.engine;

import com.simtrader.core.concurrent.EventLoop;
import com.simtrader.core.config.SimulationConfig;
import com.simtrader.core.model.Deal;
import com.simtrader.core.model.TradeRequest;
import com.simtrader.core.model.TradeResult;
import com.simtrader.engine.account.BacktestAccount;
import com.simtrader.engine.clock.ClockException;
import com.simtrader.engine.clock.Cursor;
import com.simtrader.engine.clock.SimulationClock;
import com.simtrader.engine.clock.TimeSpan;
import com.simtrader.engine.ledger.LedgerView;
import com.simtrader.engine.ledger.OrdersView;
import com.simtrader.engine.ledger.PositionsView;
import com.simtrader.engine.ledger.TicketSequence;
import com.simtrader.engine.market.MarketData;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

/**
 * Backtest over pre-loaded market data. Owns the clock, the ledgers, the
 * account and the matching engine; every clock movement is followed by an
 * evaluation of the tick the cursor arrives at.
 * <p>
 * Not thread-safe. In a concurrent run all calls go through the engine loop
 * (see {@link SimulatedTerminal}), and {@link #confineTo} makes ledger writes
 * from other threads fail.
 */
public class BacktestEngine {

    private static final Logger log = LoggerFactory.getLogger(BacktestEngine.class);

    private final SimulationConfig config;
    private final MarketData market;
    private final SimulationClock clock;
    private final BacktestAccount account;
    private final TicketSequence tickets;
    private final MatchingEngine matching;

    public BacktestEngine(SimulationConfig config, MarketData market) {
        this.config = config;
        this.market = market;
        SimulationConfig.ClockConfig clockConfig = config.getClock();
        this.clock = new SimulationClock(
                new TimeSpan(clockConfig.getStart(), clockConfig.getEnd(), clockConfig.getStep()),
                clockConfig.getStopTime());
        this.account = new BacktestAccount(config.getAccount());
        this.tickets = new TicketSequence();
        this.matching = new MatchingEngine(market, clock, account, tickets);
        log.info("Backtest {} over [{}, {}) step {}s, balance {} {}", config.getName(),
                clockConfig.getStart(), clockConfig.getEnd(), clockConfig.getStep(),
                account.getBalance(), account.getCurrency());
    }

    public Cursor next() throws ClockException {
        Cursor cursor = clock.next();
        matching.onTick();
        return cursor;
    }

    /**
     * Jump ahead. Only the tick the cursor lands on is evaluated; stop levels
     * crossed and recovered in between are not seen.
     */
    public Cursor fastForward(long steps) throws ClockException {
        Cursor cursor = clock.fastForward(steps);
        matching.onTick();
        return cursor;
    }

    public Cursor goTo(long time) throws ClockException {
        Cursor cursor = clock.goTo(time);
        matching.onTick();
        return cursor;
    }

    public Cursor cursor() {
        return clock.cursor();
    }

    public long time() {
        return clock.time();
    }

    public TradeResult orderSend(TradeRequest request) {
        return matching.orderSend(request);
    }

    public TradeResult orderCheck(TradeRequest request) {
        return matching.orderCheck(request);
    }

    public TradeResult closePosition(long ticket) {
        return matching.closePosition(ticket);
    }

    public List<TradeResult> closeAll() {
        return matching.closeAll();
    }

    public boolean isStoppedOut() {
        return matching.isStoppedOut();
    }

    public void confineTo(EventLoop loop) {
        matching.confineTo(loop);
    }

    /**
     * Back to the start of the span with an empty history and the configured balance.
     */
    public void reset() {
        clock.reset();
        matching.reset();
        tickets.resetTo(1);
        account.reset(config.getAccount().getBalance());
        log.info("Backtest {} reset", config.getName());
    }

    public BacktestReport report() {
        return BacktestReport.from(config.getName(), account.info(), matching.getPositions().values());
    }

    public EngineSnapshot snapshot() {
        PositionsView positions = matching.getPositions();
        return new EngineSnapshot(config.getName(), Instant.now(), clock.cursor(), account.info(),
                matching.getOrders().values(), matching.getDeals().values(), positions.values(),
                positions.margins(), tickets.peek());
    }

    /**
     * Resume from a snapshot taken on an engine with the same span and market data.
     */
    public void restore(EngineSnapshot snapshot) throws ClockException {
        clock.restore(snapshot.cursor());
        tickets.resetTo(snapshot.nextTicket());
        account.restore(snapshot.account());
        matching.restore(snapshot.orders(), snapshot.deals(), snapshot.positions(), snapshot.openMargins());
        log.info("Backtest {} restored at {}", config.getName(), snapshot.cursor());
    }

    /**
     * Finish the run: optionally close what is still open, then write the
     * report and a snapshot to the results directory.
     */
    public BacktestReport wrapUp() throws IOException {
        if (config.isCloseAllOnExit()) {
            closeAll();
        }
        BacktestReport report = report();
        Path dir = Path.of(config.getResultsDir());
        report.save(dir.resolve(config.getName() + ".json"));
        snapshot().save(dir.resolve(config.getName() + ".snapshot.json"));
        log.info("Backtest {} finished: {} positions, net profit {}, balance {}", config.getName(),
                report.total(), report.netProfit(), report.balance());
        return report;
    }

    // Getters
    public SimulationConfig getConfig() { return config; }
    public MarketData getMarket() { return market; }
    public SimulationClock getClock() { return clock; }
    public BacktestAccount getAccount() { return account; }
    public MatchingEngine getMatching() { return matching; }
    public OrdersView getOrders() { return matching.getOrders(); }
    public LedgerView<Deal> getDeals() { return matching.getDeals(); }
    public PositionsView getPositions() { return matching.getPositions(); }
}

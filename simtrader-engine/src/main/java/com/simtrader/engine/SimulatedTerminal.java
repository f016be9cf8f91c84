package com.simtrader.engine;

import com.simtrader.core.concurrent.EventLoop;
import com.simtrader.core.model.AccountInfo;
import com.simtrader.core.model.Deal;
import com.simtrader.core.model.Order;
import com.simtrader.core.model.Position;
import com.simtrader.core.model.SymbolSpec;
import com.simtrader.core.model.Tick;
import com.simtrader.core.model.TradeRequest;
import com.simtrader.core.model.TradeResult;
import com.simtrader.core.terminal.TerminalException;
import com.simtrader.core.terminal.TradingTerminal;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;

/**
 * Terminal backed by a {@link BacktestEngine}. Every call runs on the event
 * loop that owns the engine, so strategies on worker threads never observe a
 * half-applied tick.
 */
public class SimulatedTerminal implements TradingTerminal {

    private final BacktestEngine engine;
    private final EventLoop loop;

    public SimulatedTerminal(BacktestEngine engine, EventLoop loop) {
        this.engine = engine;
        this.loop = loop;
        engine.confineTo(loop);
    }

    @Override
    public long time() throws TerminalException {
        return call(engine::time);
    }

    @Override
    public TradeResult orderSend(TradeRequest request) throws TerminalException {
        return call(() -> engine.orderSend(request));
    }

    @Override
    public TradeResult orderCheck(TradeRequest request) throws TerminalException {
        return call(() -> engine.orderCheck(request));
    }

    @Override
    public List<Position> positionsGet() throws TerminalException {
        return call(() -> engine.getPositions().openPositions());
    }

    @Override
    public List<Position> positionsGet(String symbol) throws TerminalException {
        return call(() -> engine.getPositions().positionsGet(symbol));
    }

    @Override
    public Optional<Position> positionGet(long ticket) throws TerminalException {
        return call(() -> engine.getPositions().find(ticket).filter(p -> engine.getPositions().isOpen(ticket)));
    }

    @Override
    public int positionsTotal() throws TerminalException {
        return call(() -> engine.getPositions().openPositionsTotal());
    }

    @Override
    public List<Order> ordersGet() throws TerminalException {
        return call(() -> engine.getOrders().pendingOrders());
    }

    @Override
    public List<Order> historyOrdersGet(long dateFrom, long dateTo) throws TerminalException {
        return call(() -> engine.getOrders().historyGet(dateFrom, dateTo));
    }

    @Override
    public int historyOrdersTotal(long dateFrom, long dateTo) throws TerminalException {
        return call(() -> engine.getOrders().total(dateFrom, dateTo));
    }

    @Override
    public List<Deal> historyDealsGet(long dateFrom, long dateTo) throws TerminalException {
        return call(() -> engine.getDeals().historyGet(dateFrom, dateTo));
    }

    @Override
    public List<Deal> historyDealsGet(long positionTicket) throws TerminalException {
        return call(() -> engine.getDeals().getByPosition(positionTicket));
    }

    @Override
    public int historyDealsTotal(long dateFrom, long dateTo) throws TerminalException {
        return call(() -> engine.getDeals().total(dateFrom, dateTo));
    }

    @Override
    public Optional<Tick> symbolInfoTick(String symbol) throws TerminalException {
        return call(() -> engine.getMarket().tickAt(symbol, engine.time()));
    }

    @Override
    public Optional<SymbolSpec> symbolInfo(String symbol) throws TerminalException {
        return engine.getMarket().symbol(symbol);
    }

    @Override
    public AccountInfo accountInfo() throws TerminalException {
        return call(() -> engine.getAccount().info());
    }

    private <T> T call(Callable<T> task) throws TerminalException {
        try {
            return loop.invoke(task);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TerminalException("Interrupted while waiting for the engine loop", e);
        } catch (ExecutionException e) {
            throw new TerminalException("Engine call failed: " + e.getCause().getMessage(), e.getCause());
        } catch (RejectedExecutionException e) {
            throw new TerminalException("Engine loop is shut down", e);
        }
    }
}

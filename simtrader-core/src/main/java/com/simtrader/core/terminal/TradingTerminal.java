package com.simtrader.core.terminal;

import com.simtrader.core.model.AccountInfo;
import com.simtrader.core.model.Deal;
import com.simtrader.core.model.Order;
import com.simtrader.core.model.Position;
import com.simtrader.core.model.SymbolSpec;
import com.simtrader.core.model.Tick;
import com.simtrader.core.model.TradeRequest;
import com.simtrader.core.model.TradeResult;

import java.util.List;
import java.util.Optional;

/**
 * Broker terminal as seen by a strategy. A live implementation talks to a
 * brokerage, the simulated one is backed by the backtest engine, so strategy
 * code runs unchanged in both modes.
 * <p>
 * Time arguments are epoch seconds (UTC); ranges are inclusive.
 */
public interface TradingTerminal {

    /**
     * Current server time in epoch seconds.
     */
    long time() throws TerminalException;

    TradeResult orderSend(TradeRequest request) throws TerminalException;

    /**
     * Validates a request without executing it. Retcode {@code OK} means it would be accepted.
     */
    TradeResult orderCheck(TradeRequest request) throws TerminalException;

    List<Position> positionsGet() throws TerminalException;

    List<Position> positionsGet(String symbol) throws TerminalException;

    Optional<Position> positionGet(long ticket) throws TerminalException;

    int positionsTotal() throws TerminalException;

    /**
     * Pending orders that have not been filled or removed.
     */
    List<Order> ordersGet() throws TerminalException;

    List<Order> historyOrdersGet(long dateFrom, long dateTo) throws TerminalException;

    int historyOrdersTotal(long dateFrom, long dateTo) throws TerminalException;

    List<Deal> historyDealsGet(long dateFrom, long dateTo) throws TerminalException;

    /**
     * All deals of one position, in time order.
     */
    List<Deal> historyDealsGet(long positionTicket) throws TerminalException;

    int historyDealsTotal(long dateFrom, long dateTo) throws TerminalException;

    Optional<Tick> symbolInfoTick(String symbol) throws TerminalException;

    Optional<SymbolSpec> symbolInfo(String symbol) throws TerminalException;

    AccountInfo accountInfo() throws TerminalException;
}

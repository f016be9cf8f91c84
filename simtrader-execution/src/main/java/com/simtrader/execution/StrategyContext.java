package com.simtrader.execution;

import com.simtrader.core.terminal.TradingTerminal;

/**
 * What a strategy gets to work with: a terminal for trading, the shared stop
 * signal, and the pacer that spaces its cycles.
 */
public record StrategyContext(TradingTerminal terminal, ShutdownSignal shutdown, Pacer pacer) {

    public boolean isShutdown() {
        return shutdown.isShutdown();
    }
}

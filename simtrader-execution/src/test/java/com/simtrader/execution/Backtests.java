package com.simtrader.execution;

import com.simtrader.core.config.SimulationConfig;
import com.simtrader.core.model.SymbolSpec;
import com.simtrader.core.model.Tick;
import com.simtrader.engine.market.MarketData;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * One-symbol flat market for driving strategies through a short backtest.
 */
final class Backtests {

    static final long START = 1_700_000_000L;
    static final String SYMBOL = "EURUSD";

    private Backtests() {
    }

    static SimulationConfig config(long length, Path resultsDir) {
        SimulationConfig config = new SimulationConfig();
        config.setName("executor-run");
        config.setResultsDir(resultsDir.toString());
        config.getAccount().setBalance(10_000);
        config.getClock().setStart(START);
        config.getClock().setEnd(START + length);
        config.getClock().setStep(1);
        return config;
    }

    static MarketData market(long length) {
        List<Tick> ticks = new ArrayList<>();
        for (long t = START; t < START + length; t++) {
            ticks.add(Tick.of(t, 1.10000, 1.10010));
        }
        return MarketData.builder()
                .symbol(SymbolSpec.builder(SYMBOL).build())
                .ticks(SYMBOL, ticks)
                .build();
    }
}

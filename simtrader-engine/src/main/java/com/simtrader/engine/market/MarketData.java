package com.simtrader.engine.market;

import com.simtrader.core.model.SymbolSpec;
import com.simtrader.core.model.Tick;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Pre-loaded, read-only market data for a backtest: symbol specifications and
 * historical ticks. Loading and caching the raw history happens elsewhere.
 */
public class MarketData {

    private final Map<String, SymbolSpec> specs;
    private final Map<String, TickSeries> series;
    private final long tolerance;

    private MarketData(Map<String, SymbolSpec> specs, Map<String, TickSeries> series, long tolerance) {
        this.specs = Collections.unmodifiableMap(specs);
        this.series = Collections.unmodifiableMap(series);
        this.tolerance = tolerance;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<SymbolSpec> symbol(String name) {
        return Optional.ofNullable(specs.get(name));
    }

    public Set<String> symbols() {
        return specs.keySet();
    }

    /**
     * Quote in effect at {@code time}, taken from the nearest historical tick.
     */
    public Optional<Tick> tickAt(String symbol, long time) {
        TickSeries ticks = series.get(symbol);
        return ticks == null ? Optional.empty() : ticks.nearest(time, tolerance);
    }

    public static class Builder {
        private final Map<String, SymbolSpec> specs = new LinkedHashMap<>();
        private final Map<String, TickSeries> series = new LinkedHashMap<>();
        private long tolerance;

        public Builder symbol(SymbolSpec spec) {
            specs.put(spec.name(), spec);
            return this;
        }

        public Builder ticks(String symbol, List<Tick> ticks) {
            series.put(symbol, new TickSeries(ticks));
            return this;
        }

        /**
         * Maximum distance in seconds between a requested time and the tick
         * used for it. Beyond it the market is treated as closed. 0 disables the check.
         */
        public Builder tolerance(long seconds) {
            this.tolerance = seconds;
            return this;
        }

        public MarketData build() {
            for (String symbol : series.keySet()) {
                if (!specs.containsKey(symbol)) {
                    throw new IllegalArgumentException("Ticks for unknown symbol " + symbol);
                }
            }
            return new MarketData(new LinkedHashMap<>(specs), new LinkedHashMap<>(series), tolerance);
        }
    }
}

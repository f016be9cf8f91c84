package com.simtrader.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Settings for a simulation run, loaded from YAML.
 * Passed explicitly to the engine, the queue and the executor.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class SimulationConfig {

    private String name = "backtest";
    private AccountConfig account = new AccountConfig();
    private ClockConfig clock = new ClockConfig();
    private QueueConfig queue = new QueueConfig();
    private boolean closeAllOnExit = true;
    private String resultsDir = "backtests";

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public AccountConfig getAccount() { return account; }
    public void setAccount(AccountConfig account) { this.account = account; }

    public ClockConfig getClock() { return clock; }
    public void setClock(ClockConfig clock) { this.clock = clock; }

    public QueueConfig getQueue() { return queue; }
    public void setQueue(QueueConfig queue) { this.queue = queue; }

    public boolean isCloseAllOnExit() { return closeAllOnExit; }
    public void setCloseAllOnExit(boolean closeAllOnExit) { this.closeAllOnExit = closeAllOnExit; }

    public String getResultsDir() { return resultsDir; }
    public void setResultsDir(String resultsDir) { this.resultsDir = resultsDir; }

    public static SimulationConfig load(Path path) throws IOException {
        if (!Files.exists(path)) {
            return new SimulationConfig();
        }
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        return mapper.readValue(path.toFile(), SimulationConfig.class);
    }

    public void save(Path path) throws IOException {
        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        mapper.writeValue(path.toFile(), this);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class AccountConfig {
        private double balance = 1000;
        private int leverage = 100;
        private String currency = "USD";
        private int currencyDigits = 2;
        private double marginStopOut;

        public double getBalance() { return balance; }
        public void setBalance(double balance) { this.balance = balance; }

        public int getLeverage() { return leverage; }
        public void setLeverage(int leverage) { this.leverage = leverage; }

        public String getCurrency() { return currency; }
        public void setCurrency(String currency) { this.currency = currency; }

        public int getCurrencyDigits() { return currencyDigits; }
        public void setCurrencyDigits(int currencyDigits) { this.currencyDigits = currencyDigits; }

        /** Margin level percentage at or below which the account is stopped out; 0 disables. */
        public double getMarginStopOut() { return marginStopOut; }
        public void setMarginStopOut(double marginStopOut) { this.marginStopOut = marginStopOut; }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ClockConfig {
        private long start;
        private long end;
        private long step = 1;
        private long stopTime;

        /** Epoch seconds, inclusive. */
        public long getStart() { return start; }
        public void setStart(long start) { this.start = start; }

        /** Epoch seconds, exclusive. */
        public long getEnd() { return end; }
        public void setEnd(long end) { this.end = end; }

        public long getStep() { return step; }
        public void setStep(long step) { this.step = step; }

        /** Optional earlier end for the run; 0 means the span end. */
        public long getStopTime() { return stopTime; }
        public void setStopTime(long stopTime) { this.stopTime = stopTime; }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class QueueConfig {
        private double timeoutSeconds;
        private double itemTimeoutSeconds;
        private double cancelGraceSeconds = 1;
        private int maxWorkers;
        private QueueMode mode = QueueMode.FINITE;
        private ExitPolicy onExit = ExitPolicy.COMPLETE_PRIORITY;

        /** Aggregate run timeout; 0 runs without one. */
        public double getTimeoutSeconds() { return timeoutSeconds; }
        public void setTimeoutSeconds(double timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }

        /** Bound on a single item; 0 runs without one. */
        public double getItemTimeoutSeconds() { return itemTimeoutSeconds; }
        public void setItemTimeoutSeconds(double itemTimeoutSeconds) { this.itemTimeoutSeconds = itemTimeoutSeconds; }

        public double getCancelGraceSeconds() { return cancelGraceSeconds; }
        public void setCancelGraceSeconds(double cancelGraceSeconds) { this.cancelGraceSeconds = cancelGraceSeconds; }

        /** Worker pool bound; 0 sizes the pool dynamically. */
        public int getMaxWorkers() { return maxWorkers; }
        public void setMaxWorkers(int maxWorkers) { this.maxWorkers = maxWorkers; }

        public QueueMode getMode() { return mode; }
        public void setMode(QueueMode mode) { this.mode = mode; }

        public ExitPolicy getOnExit() { return onExit; }
        public void setOnExit(ExitPolicy onExit) { this.onExit = onExit; }

        public Duration timeout() {
            return toDuration(timeoutSeconds);
        }

        public Duration itemTimeout() {
            return toDuration(itemTimeoutSeconds);
        }

        public Duration cancelGrace() {
            return toDuration(cancelGraceSeconds);
        }

        private static Duration toDuration(double seconds) {
            return seconds > 0 ? Duration.ofMillis(Math.round(seconds * 1000)) : null;
        }
    }
}

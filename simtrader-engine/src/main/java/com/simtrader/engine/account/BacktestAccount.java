package com.simtrader.engine.account;

import com.simtrader.core.config.SimulationConfig;
import com.simtrader.core.model.AccountInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Balance, equity and margin of the simulated account. Mutated only by the
 * matching engine as deals are created and ticks are evaluated.
 */
public class BacktestAccount {

    private static final Logger log = LoggerFactory.getLogger(BacktestAccount.class);

    private final int leverage;
    private final String currency;
    private final int currencyDigits;
    private final double marginStopOut;

    private double balance;
    private double profit;
    private double equity;
    private double margin;
    private double marginFree;
    private double marginLevel;

    public BacktestAccount(SimulationConfig.AccountConfig config) {
        this(config.getBalance(), config.getLeverage(), config.getCurrency(),
                config.getCurrencyDigits(), config.getMarginStopOut());
    }

    public BacktestAccount(double balance, int leverage, String currency, int currencyDigits, double marginStopOut) {
        if (leverage <= 0) {
            throw new IllegalArgumentException("leverage must be positive: " + leverage);
        }
        this.leverage = leverage;
        this.currency = currency;
        this.currencyDigits = currencyDigits;
        this.marginStopOut = marginStopOut;
        this.balance = round(balance);
        refresh(0, 0);
    }

    /**
     * Start over with a fresh balance and nothing in use.
     */
    public void reset(double newBalance) {
        balance = round(newBalance);
        refresh(0, 0);
    }

    public void deposit(double amount) {
        if (amount <= 0) throw new IllegalArgumentException("deposit must be positive");
        balance = round(balance + amount);
        refresh(profit, margin);
    }

    public void withdraw(double amount) {
        if (amount <= 0) throw new IllegalArgumentException("withdrawal must be positive");
        if (amount > marginFree) {
            throw new IllegalArgumentException(String.format(
                    "Cannot withdraw %.2f, free margin is %.2f", amount, marginFree));
        }
        balance = round(balance - amount);
        refresh(profit, margin);
    }

    /**
     * Book realized profit or loss of a closing deal.
     */
    public void realize(double gain) {
        balance = round(balance + gain);
    }

    /**
     * Recompute the derived figures from floating profit and margin in use.
     */
    public void refresh(double floatingProfit, double usedMargin) {
        profit = round(floatingProfit);
        equity = round(balance + profit);
        margin = round(usedMargin);
        marginFree = round(equity - margin);
        marginLevel = margin == 0 ? 0 : round(equity / margin * 100);
    }

    /**
     * Equity wiped out, or margin level at or below the stop-out level, while margin is in use.
     */
    public boolean isStoppedOut() {
        if (margin <= 0) {
            return false;
        }
        boolean stoppedOut = equity <= 0 || (marginStopOut > 0 && marginLevel <= marginStopOut);
        if (stoppedOut) {
            log.warn("Account stopped out: equity {} margin {} level {}%", equity, margin, marginLevel);
        }
        return stoppedOut;
    }

    public double round(double value) {
        double scale = Math.pow(10, currencyDigits);
        return Math.round(value * scale) / scale;
    }

    public AccountInfo info() {
        return new AccountInfo(balance, equity, profit, margin, marginFree, marginLevel,
                leverage, currency, currencyDigits);
    }

    public void restore(AccountInfo info) {
        balance = info.balance();
        refresh(info.profit(), info.margin());
    }

    // Getters
    public double getBalance() { return balance; }
    public double getProfit() { return profit; }
    public double getEquity() { return equity; }
    public double getMargin() { return margin; }
    public double getMarginFree() { return marginFree; }
    public double getMarginLevel() { return marginLevel; }
    public int getLeverage() { return leverage; }
    public String getCurrency() { return currency; }
    public int getCurrencyDigits() { return currencyDigits; }
}

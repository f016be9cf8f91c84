package com.simtrader.engine;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.simtrader.core.model.AccountInfo;
import com.simtrader.core.model.Position;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * End-of-run summary: final account figures and win/loss statistics over all
 * positions of the run (realized profit for closed ones, floating for open ones).
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record BacktestReport(
    String name,
    double balance,
    double profit,
    double equity,
    double margin,
    double marginFree,
    double marginLevel,
    int wins,
    int losses,
    int total,
    double winPercentage,
    double win,
    double loss,
    double netProfit,
    double profitFactor,
    double profitability
) {
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    public static BacktestReport from(String name, AccountInfo account, List<Position> positions) {
        double scale = Math.pow(10, account.currencyDigits());
        int wins = 0;
        int losses = 0;
        double win = 0;
        double loss = 0;
        for (Position position : positions) {
            if (position.profit() > 0) {
                wins++;
                win += position.profit();
            } else {
                losses++;
                loss += position.profit();
            }
        }
        win = round(win, scale);
        loss = round(loss, scale);
        int total = positions.size();
        double profitFactor = loss != 0 ? round(Math.abs(win / loss), 100) : 0;
        double winPercentage = total > 0 ? round((double) wins / total * 100, 100) : 0;
        double netProfit = round(win - Math.abs(loss), scale);
        double profitability = netProfit != 0
                ? round(netProfit / (account.balance() - netProfit) * 100, 100)
                : 0;
        return new BacktestReport(name, account.balance(), account.profit(), account.equity(),
                account.margin(), account.marginFree(), account.marginLevel(),
                wins, losses, total, winPercentage, win, loss, netProfit, profitFactor, profitability);
    }

    public String toJson() throws IOException {
        return MAPPER.writeValueAsString(this);
    }

    public void save(Path path) throws IOException {
        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }
        MAPPER.writeValue(path.toFile(), this);
    }

    private static double round(double value, double scale) {
        return Math.round(value * scale) / scale;
    }
}

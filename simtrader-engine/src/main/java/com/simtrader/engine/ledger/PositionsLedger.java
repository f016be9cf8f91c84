package com.simtrader.engine.ledger;

import com.simtrader.core.model.Position;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * All positions ever opened, plus the open set and the margin each open
 * position holds. Closed positions stay in the ledger as history.
 */
public class PositionsLedger extends TradeLedger<Position> implements PositionsView {

    private final Set<Long> open = new LinkedHashSet<>();
    private final Map<Long, Double> margins = new LinkedHashMap<>();

    public PositionsLedger() {
        super("position");
    }

    public synchronized void open(Position position, double margin) {
        put(position);
        open.add(position.ticket());
        margins.put(position.ticket(), margin);
    }

    public synchronized void setMargin(long ticket, double margin) {
        checkWriter();
        if (!open.contains(ticket)) {
            throw new IllegalStateException("Position " + ticket + " is not open");
        }
        margins.put(ticket, margin);
    }

    /**
     * Store the final state of a position and drop it from the open set.
     */
    public synchronized void close(Position position) {
        put(position);
        open.remove(position.ticket());
        margins.remove(position.ticket());
    }

    @Override
    public synchronized boolean isOpen(long ticket) {
        return open.contains(ticket);
    }

    @Override
    public synchronized List<Position> openPositions() {
        List<Position> result = new ArrayList<>(open.size());
        for (Long ticket : open) {
            result.add(get(ticket));
        }
        return result;
    }

    @Override
    public synchronized int openPositionsTotal() {
        return open.size();
    }

    @Override
    public synchronized Optional<Position> openPositionFor(String symbol) {
        return openPositions().stream()
                .filter(p -> p.symbol().equals(symbol))
                .findFirst();
    }

    @Override
    public synchronized List<Position> positionsGet(String symbol) {
        return openPositions().stream()
                .filter(p -> p.symbol().equals(symbol))
                .toList();
    }

    @Override
    public synchronized double margin(long ticket) {
        return margins.getOrDefault(ticket, 0.0);
    }

    @Override
    public synchronized double totalMargin() {
        return margins.values().stream().mapToDouble(Double::doubleValue).sum();
    }

    @Override
    public synchronized Map<Long, Double> margins() {
        return Map.copyOf(margins);
    }

    @Override
    public synchronized void clear() {
        super.clear();
        open.clear();
        margins.clear();
    }
}

package com.simtrader.engine.ledger;

import com.simtrader.core.model.Position;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read side of the positions ledger: history plus the open set and its margin book.
 */
public interface PositionsView extends LedgerView<Position> {

    boolean isOpen(long ticket);

    List<Position> openPositions();

    int openPositionsTotal();

    /**
     * The single open position of a symbol; positions net per symbol.
     */
    Optional<Position> openPositionFor(String symbol);

    List<Position> positionsGet(String symbol);

    double margin(long ticket);

    double totalMargin();

    Map<Long, Double> margins();
}

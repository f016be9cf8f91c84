package com.simtrader.engine;

import com.simtrader.core.concurrent.EventLoop;
import com.simtrader.core.model.Deal;
import com.simtrader.core.model.DealEntry;
import com.simtrader.core.model.Order;
import com.simtrader.core.model.OrderState;
import com.simtrader.core.model.OrderType;
import com.simtrader.core.model.Position;
import com.simtrader.core.model.SymbolSpec;
import com.simtrader.core.model.Tick;
import com.simtrader.core.model.TradeAction;
import com.simtrader.core.model.TradeReason;
import com.simtrader.core.model.TradeRequest;
import com.simtrader.core.model.TradeResult;
import com.simtrader.core.model.TradeRetcode;
import com.simtrader.engine.account.BacktestAccount;
import com.simtrader.engine.clock.SimulationClock;
import com.simtrader.engine.ledger.DealsLedger;
import com.simtrader.engine.ledger.LedgerView;
import com.simtrader.engine.ledger.OrdersLedger;
import com.simtrader.engine.ledger.OrdersView;
import com.simtrader.engine.ledger.PositionsLedger;
import com.simtrader.engine.ledger.PositionsView;
import com.simtrader.engine.ledger.TicketSequence;
import com.simtrader.engine.market.MarketData;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Validates trade requests and fills them against the tick at the clock
 * cursor. Positions net per symbol: an opposite fill reduces, closes or
 * reverses the open position of that symbol.
 * <p>
 * The only writer of the ledgers and the account.
 */
public class MatchingEngine {

    private static final Logger log = LoggerFactory.getLogger(MatchingEngine.class);
    private static final double VOLUME_EPSILON = 1e-8;

    private final MarketData market;
    private final SimulationClock clock;
    private final BacktestAccount account;
    private final TicketSequence tickets;

    private final OrdersLedger orders = new OrdersLedger();
    private final DealsLedger deals = new DealsLedger();
    private final PositionsLedger positions = new PositionsLedger();

    private boolean stoppedOut;

    private record DealPlan(SymbolSpec spec, Tick tick, OrderType side, double volume, double price, Position target) {}

    private record PendingPlan(SymbolSpec spec, Tick tick, OrderType type, double volume, double price, Order base) {}

    private record Fill(Order order, Deal deal) {}

    public MatchingEngine(MarketData market, SimulationClock clock, BacktestAccount account, TicketSequence tickets) {
        this.market = market;
        this.clock = clock;
        this.account = account;
        this.tickets = tickets;
    }

    /**
     * Execute a trade request. Never throws for a bad request; the retcode says what went wrong.
     */
    public TradeResult orderSend(TradeRequest request) {
        try {
            Optional<String> violation = request.validate();
            if (violation.isPresent()) {
                throw new TradeRejectedException(TradeRetcode.INVALID, violation.get());
            }
            TradeResult result = switch (request.action()) {
                case DEAL -> executeDeal(request);
                case PENDING -> placePending(request);
                case SLTP -> modifyStops(request);
                case MODIFY -> modifyPending(request);
                case REMOVE -> removePending(request);
                case CLOSE_BY -> throw new TradeRejectedException(TradeRetcode.INVALID,
                        "Close-by is not available on a netting account");
            };
            refreshAccount();
            return result;
        } catch (TradeRejectedException e) {
            log.debug("Rejected {} {} {}: {} ({})", request.action(), request.type(), request.symbol(),
                    e.getMessage(), e.getRetcode().getCode());
            return TradeResult.rejected(e.getRetcode(), e.getMessage(), request);
        }
    }

    /**
     * Run all checks of {@link #orderSend} without executing anything.
     *
     * @return retcode {@code OK} if the request would be accepted
     */
    public TradeResult orderCheck(TradeRequest request) {
        try {
            Optional<String> violation = request.validate();
            if (violation.isPresent()) {
                throw new TradeRejectedException(TradeRetcode.INVALID, violation.get());
            }
            return switch (request.action()) {
                case DEAL -> {
                    DealPlan plan = checkDeal(request);
                    yield checked(request, plan.tick(), plan.volume(), plan.price());
                }
                case PENDING, MODIFY -> {
                    PendingPlan plan = checkPending(request);
                    yield checked(request, plan.tick(), plan.volume(), plan.price());
                }
                case SLTP -> {
                    Position position = requireOpenPosition(request.position());
                    Tick tick = requireTick(position.symbol());
                    double price = closePrice(position, tick);
                    checkStops(requireSymbol(position.symbol()), position.type(), price,
                            request.sl(), request.tp(), tick);
                    yield checked(request, tick, position.volume(), price);
                }
                case REMOVE -> {
                    Order order = requirePendingOrder(request.order());
                    yield checked(request, requireTick(order.symbol()), order.volumeInitial(), order.priceOpen());
                }
                case CLOSE_BY -> throw new TradeRejectedException(TradeRetcode.INVALID,
                        "Close-by is not available on a netting account");
            };
        } catch (TradeRejectedException e) {
            return TradeResult.rejected(e.getRetcode(), e.getMessage(), request);
        }
    }

    /**
     * Evaluate the tick at the current cursor: trigger pending orders, close
     * positions whose stop loss or take profit was reached, then mark the
     * account to market.
     */
    public void onTick() {
        long now = clock.time();
        for (Order order : orders.pendingOrders()) {
            Optional<SymbolSpec> spec = market.symbol(order.symbol());
            Optional<Tick> tick = market.tickAt(order.symbol(), now);
            if (spec.isPresent() && tick.isPresent() && isTriggered(order, tick.get())) {
                fillPending(order, spec.get(), tick.get());
            }
        }
        for (Position position : positions.openPositions()) {
            checkStopLevels(position);
        }
        refreshAccount();
        if (!stoppedOut && account.isStoppedOut()) {
            stopOut();
        }
    }

    public TradeResult closePosition(long ticket) {
        Optional<Position> position = positions.find(ticket).filter(p -> positions.isOpen(p.ticket()));
        if (position.isEmpty()) {
            return TradeResult.rejected(TradeRetcode.POSITION_CLOSED,
                    "Position " + ticket + " is not open", null);
        }
        return orderSend(TradeRequest.close(position.get()));
    }

    public List<TradeResult> closeAll() {
        List<TradeResult> results = new ArrayList<>();
        for (Position position : positions.openPositions()) {
            TradeResult result = closePosition(position.ticket());
            if (!result.isDone()) {
                log.warn("Could not close position {}: {}", position.ticket(), result.comment());
            }
            results.add(result);
        }
        return results;
    }

    /**
     * Profit of a round trip in account currency.
     */
    public double orderCalcProfit(OrderType type, String symbol, double volume, double priceOpen, double priceClose) {
        SymbolSpec spec = market.symbol(symbol)
                .orElseThrow(() -> new IllegalArgumentException("Unknown symbol " + symbol));
        return profit(spec, type, volume, priceOpen, priceClose);
    }

    /**
     * Margin required to open {@code volume} at {@code price}.
     */
    public double orderCalcMargin(OrderType type, String symbol, double volume, double price) {
        SymbolSpec spec = market.symbol(symbol)
                .orElseThrow(() -> new IllegalArgumentException("Unknown symbol " + symbol));
        return margin(spec, volume, price);
    }

    public boolean isStoppedOut() {
        return stoppedOut;
    }

    /**
     * Reject ledger writes made outside {@code loop} from now on.
     */
    public void confineTo(EventLoop loop) {
        orders.confineTo(loop);
        deals.confineTo(loop);
        positions.confineTo(loop);
    }

    public void reset() {
        orders.clear();
        deals.clear();
        positions.clear();
        stoppedOut = false;
    }

    /**
     * Replace all ledger content, e.g. from a snapshot.
     */
    public void restore(List<Order> orderRecords, List<Deal> dealRecords, List<Position> positionRecords,
                        Map<Long, Double> openMargins) {
        reset();
        orderRecords.forEach(orders::put);
        dealRecords.forEach(deals::put);
        for (Position position : positionRecords) {
            Double margin = openMargins.get(position.ticket());
            if (margin != null) {
                positions.open(position, margin);
            } else {
                positions.put(position);
            }
        }
        refreshAccount();
    }

    // Getters
    public OrdersView getOrders() { return orders; }
    public LedgerView<Deal> getDeals() { return deals; }
    public PositionsView getPositions() { return positions; }
    public BacktestAccount getAccount() { return account; }
    public MarketData getMarket() { return market; }

    // ---- market orders ----

    private TradeResult executeDeal(TradeRequest request) throws TradeRejectedException {
        DealPlan plan = checkDeal(request);
        Fill fill;
        if (plan.target() != null) {
            fill = reduce(plan.target(), plan.spec(), plan.volume(), plan.price(), TradeReason.EXPERT,
                    request.magic(), request.comment());
        } else {
            Order order = newOrder(plan.spec().name(), plan.side(), plan.volume(), plan.price(),
                    request.sl(), request.tp(), TradeReason.EXPERT, request.magic(), request.comment());
            fill = applyFill(order, plan.spec(), plan.side(), plan.volume(), plan.price(), request.sl(), request.tp());
        }
        return done(fill, plan.tick(), request);
    }

    private DealPlan checkDeal(TradeRequest request) throws TradeRejectedException {
        SymbolSpec spec = requireSymbol(request.symbol());
        Tick tick = requireTick(spec.name());
        OrderType side = request.type();
        double volume = request.volume();
        if (!spec.isValidVolume(volume)) {
            throw new TradeRejectedException(TradeRetcode.INVALID_VOLUME,
                    String.format("Volume %s outside %s..%s step %s", volume, spec.volumeMin(),
                            spec.volumeMax(), spec.volumeStep()));
        }
        double price = side.isBuy() ? tick.ask() : tick.bid();

        if (request.position() > 0) {
            Position target = requireOpenPosition(request.position());
            if (!target.symbol().equals(spec.name())) {
                throw new TradeRejectedException(TradeRetcode.INVALID,
                        "Position " + target.ticket() + " is on " + target.symbol());
            }
            if (target.type().isBuy() == side.isBuy()) {
                throw new TradeRejectedException(TradeRetcode.INVALID,
                        "Closing order must be opposite to position " + target.ticket());
            }
            if (volume > target.volume() + VOLUME_EPSILON) {
                throw new TradeRejectedException(TradeRetcode.INVALID_CLOSE_VOLUME);
            }
            return new DealPlan(spec, tick, side, volume, price, target);
        }

        checkStops(spec, side, price, request.sl(), request.tp(), tick);
        double required = requiredMargin(spec, side, volume, price);
        if (required > account.getMarginFree()) {
            throw new TradeRejectedException(TradeRetcode.NO_MONEY, String.format(
                    "Margin %.2f exceeds free margin %.2f", required, account.getMarginFree()));
        }
        return new DealPlan(spec, tick, side, volume, price, null);
    }

    private double requiredMargin(SymbolSpec spec, OrderType side, double volume, double price) {
        Optional<Position> existing = positions.openPositionFor(spec.name());
        if (existing.isEmpty() || existing.get().type() == side) {
            return margin(spec, volume, price);
        }
        Position position = existing.get();
        double excess = volume - position.volume();
        if (excess <= VOLUME_EPSILON) {
            return 0;
        }
        return margin(spec, excess, price) - positions.margin(position.ticket());
    }

    /**
     * Net a fill into the open position of its symbol, or open one.
     */
    private Fill applyFill(Order order, SymbolSpec spec, OrderType side, double volume, double price,
                           double sl, double tp) {
        long now = clock.time();
        Optional<Position> existing = positions.openPositionFor(spec.name());

        if (existing.isEmpty()) {
            Position position = new Position(order.ticket(), spec.name(), side, volume, price, price,
                    sl, tp, 0, now, now, order.reason(), order.magic(), order.comment());
            positions.open(position, margin(spec, volume, price));
            return book(order, position.ticket(), side, DealEntry.IN, volume, price, 0, now);
        }

        Position position = existing.get();
        if (position.type() == side) {
            double total = roundVolume(position.volume() + volume);
            double average = spec.normalizePrice(
                    (position.priceOpen() * position.volume() + price * volume) / total);
            positions.put(position.withVolume(side, total, average,
                    sl > 0 ? sl : position.sl(), tp > 0 ? tp : position.tp(), now));
            positions.setMargin(position.ticket(), positions.margin(position.ticket()) + margin(spec, volume, price));
            return book(order, position.ticket(), side, DealEntry.IN, volume, price, 0, now);
        }

        if (volume <= position.volume() + VOLUME_EPSILON) {
            return reduce(position, spec, order, volume, price);
        }

        // Reversal: one deal closes the old direction and opens the remainder the other way.
        double remainder = roundVolume(volume - position.volume());
        double realized = profit(spec, position.type(), position.volume(), position.priceOpen(), price);
        positions.put(position.withVolume(side, remainder, price, sl, tp, now));
        positions.setMargin(position.ticket(), margin(spec, remainder, price));
        account.realize(realized);
        log.info("Position {} reversed to {} {} {} @ {}", position.ticket(), side, remainder, spec.name(), price);
        return book(order, position.ticket(), side, DealEntry.INOUT, volume, price, realized, now);
    }

    /**
     * Close {@code volume} of a position with a new market order.
     */
    private Fill reduce(Position position, SymbolSpec spec, double volume, double price,
                        TradeReason reason, long magic, String comment) {
        Order order = newOrder(spec.name(), position.type().opposite(), volume, price, 0, 0, reason, magic, comment);
        return reduce(position, spec, order, volume, price);
    }

    private Fill reduce(Position position, SymbolSpec spec, Order order, double volume, double price) {
        long now = clock.time();
        double realized = profit(spec, position.type(), volume, position.priceOpen(), price);
        double remaining = roundVolume(position.volume() - volume);
        Fill fill = book(order, position.ticket(), position.type().opposite(), DealEntry.OUT, volume, price, realized, now);
        account.realize(realized);

        if (remaining <= VOLUME_EPSILON) {
            double total = deals.getByPosition(position.ticket()).stream().mapToDouble(Deal::profit).sum();
            positions.close(position.closed(price, account.round(total), now));
            log.info("Position {} closed @ {} profit {}", position.ticket(), price, account.round(total));
        } else {
            double margin = positions.margin(position.ticket()) * remaining / position.volume();
            positions.put(position.withVolume(position.type(), remaining, position.priceOpen(),
                    position.sl(), position.tp(), now));
            positions.setMargin(position.ticket(), margin);
        }
        return fill;
    }

    private Fill book(Order order, long positionTicket, OrderType side, DealEntry entry,
                      double volume, double price, double profit, long now) {
        Order filled = order.filled(price, now, positionTicket);
        orders.put(filled);
        Deal deal = new Deal(tickets.next(), filled.ticket(), positionTicket, filled.symbol(), side, entry,
                volume, price, profit, now, filled.reason(), filled.magic(), filled.comment());
        deals.put(deal);
        log.info("Deal {} {} {} {} {} @ {} (order {}, position {})", deal.ticket(), entry, side,
                volume, deal.symbol(), price, filled.ticket(), positionTicket);
        return new Fill(filled, deal);
    }

    private Order newOrder(String symbol, OrderType type, double volume, double price,
                           double sl, double tp, TradeReason reason, long magic, String comment) {
        long now = clock.time();
        return new Order(tickets.next(), symbol, type, OrderState.PLACED, volume, volume, price, price,
                sl, tp, now, 0, 0, reason, magic, comment);
    }

    // ---- pending orders ----

    private TradeResult placePending(TradeRequest request) throws TradeRejectedException {
        PendingPlan plan = checkPending(request);
        Order order = new Order(tickets.next(), plan.spec().name(), plan.type(), OrderState.PLACED,
                plan.volume(), plan.volume(), plan.price(), plan.price(), request.sl(), request.tp(),
                clock.time(), 0, 0, TradeReason.EXPERT, request.magic(), request.comment());
        orders.put(order);
        log.info("Pending order {} {} {} {} @ {}", order.ticket(), order.type(), order.volumeInitial(),
                order.symbol(), order.priceOpen());
        return new TradeResult(TradeRetcode.DONE, order.ticket(), 0, order.volumeInitial(), order.priceOpen(),
                plan.tick().bid(), plan.tick().ask(), TradeRetcode.DONE.getDescription(), request);
    }

    private TradeResult modifyPending(TradeRequest request) throws TradeRejectedException {
        PendingPlan plan = checkPending(request);
        Order current = plan.base();
        if (plan.price() == current.priceOpen() && request.sl() == current.sl() && request.tp() == current.tp()) {
            throw new TradeRejectedException(TradeRetcode.NO_CHANGES);
        }
        Order modified = current.withLevels(plan.price(), request.sl(), request.tp());
        orders.put(modified);
        return new TradeResult(TradeRetcode.DONE, modified.ticket(), 0, modified.volumeInitial(),
                modified.priceOpen(), plan.tick().bid(), plan.tick().ask(),
                TradeRetcode.DONE.getDescription(), request);
    }

    private TradeResult removePending(TradeRequest request) throws TradeRejectedException {
        Order order = requirePendingOrder(request.order());
        orders.put(order.withState(OrderState.CANCELLED, clock.time()));
        log.info("Pending order {} removed", order.ticket());
        return new TradeResult(TradeRetcode.DONE, order.ticket(), 0, order.volumeInitial(), order.priceOpen(),
                0, 0, TradeRetcode.DONE.getDescription(), request);
    }

    /**
     * Validates a new pending order, or new levels for an existing one.
     */
    private PendingPlan checkPending(TradeRequest request) throws TradeRejectedException {
        Order base = null;
        String symbol = request.symbol();
        OrderType type = request.type();
        double volume = request.volume();
        if (request.action() == TradeAction.MODIFY) {
            base = requirePendingOrder(request.order());
            symbol = base.symbol();
            type = base.type();
            volume = base.volumeInitial();
        }
        SymbolSpec spec = requireSymbol(symbol);
        Tick tick = requireTick(symbol);
        if (!spec.isValidVolume(volume)) {
            throw new TradeRejectedException(TradeRetcode.INVALID_VOLUME);
        }
        double price = spec.normalizePrice(request.price());
        boolean validPrice = switch (type) {
            case BUY_LIMIT -> price < tick.ask();
            case SELL_LIMIT -> price > tick.bid();
            case BUY_STOP -> price > tick.ask();
            case SELL_STOP -> price < tick.bid();
            default -> false;
        };
        if (!validPrice) {
            throw new TradeRejectedException(TradeRetcode.INVALID_PRICE, String.format(
                    "%s price %s on the wrong side of %s/%s", type, price, tick.bid(), tick.ask()));
        }
        checkStops(spec, type, price, request.sl(), request.tp(), tick);
        return new PendingPlan(spec, tick, type, volume, price, base);
    }

    private boolean isTriggered(Order order, Tick tick) {
        return switch (order.type()) {
            case BUY_LIMIT -> tick.ask() <= order.priceOpen();
            case SELL_LIMIT -> tick.bid() >= order.priceOpen();
            case BUY_STOP -> tick.ask() >= order.priceOpen();
            case SELL_STOP -> tick.bid() <= order.priceOpen();
            default -> false;
        };
    }

    private void fillPending(Order order, SymbolSpec spec, Tick tick) {
        OrderType side = order.type().marketType();
        double price = side.isBuy() ? tick.ask() : tick.bid();
        double required = requiredMargin(spec, side, order.volumeInitial(), price);
        if (required > account.getMarginFree()) {
            orders.put(order.withState(OrderState.REJECTED, clock.time()));
            log.warn("Pending order {} rejected on trigger: margin {} exceeds free margin {}",
                    order.ticket(), required, account.getMarginFree());
            return;
        }
        applyFill(order, spec, side, order.volumeInitial(), price, order.sl(), order.tp());
        refreshAccount();
    }

    // ---- stops ----

    private TradeResult modifyStops(TradeRequest request) throws TradeRejectedException {
        Position position = requireOpenPosition(request.position());
        SymbolSpec spec = requireSymbol(position.symbol());
        Tick tick = requireTick(position.symbol());
        checkStops(spec, position.type(), closePrice(position, tick), request.sl(), request.tp(), tick);
        if (request.sl() == position.sl() && request.tp() == position.tp()) {
            throw new TradeRejectedException(TradeRetcode.NO_CHANGES);
        }
        positions.put(position.withStops(request.sl(), request.tp(), clock.time()));
        log.info("Position {} stops set to sl {} tp {}", position.ticket(), request.sl(), request.tp());
        return new TradeResult(TradeRetcode.DONE, 0, 0, position.volume(), position.priceCurrent(),
                tick.bid(), tick.ask(), TradeRetcode.DONE.getDescription(), request);
    }

    /**
     * Stops must sit on the loss/profit side of the reference price and at
     * least stops level plus spread away from it. Zero means unset.
     */
    private void checkStops(SymbolSpec spec, OrderType type, double price, double sl, double tp, Tick tick)
            throws TradeRejectedException {
        boolean buy = type.isBuy();
        if (sl > 0 && (buy ? sl >= price : sl <= price)) {
            throw new TradeRejectedException(TradeRetcode.INVALID_STOPS,
                    String.format("Stop loss %s on the wrong side of %s", sl, price));
        }
        if (tp > 0 && (buy ? tp <= price : tp >= price)) {
            throw new TradeRejectedException(TradeRetcode.INVALID_STOPS,
                    String.format("Take profit %s on the wrong side of %s", tp, price));
        }
        double minDistance = spec.stopsLevel() + Math.round(spec.points(tick.spread()));
        for (double level : new double[]{sl, tp}) {
            if (level > 0 && spec.points(price - level) < minDistance) {
                throw new TradeRejectedException(TradeRetcode.INVALID_STOPS,
                        String.format("Level %s closer than %s points to %s", level, minDistance, price));
            }
        }
    }

    private void checkStopLevels(Position position) {
        Optional<SymbolSpec> spec = market.symbol(position.symbol());
        Optional<Tick> tick = market.tickAt(position.symbol(), clock.time());
        if (spec.isEmpty() || tick.isEmpty()) {
            return;
        }
        double price = closePrice(position, tick.get());
        boolean buy = position.type().isBuy();
        if (position.sl() > 0 && (buy ? price <= position.sl() : price >= position.sl())) {
            log.info("Stop loss hit on position {} at {}", position.ticket(), price);
            reduce(position, spec.get(), position.volume(), price, TradeReason.SL, position.magic(), "sl");
        } else if (position.tp() > 0 && (buy ? price >= position.tp() : price <= position.tp())) {
            log.info("Take profit hit on position {} at {}", position.ticket(), price);
            reduce(position, spec.get(), position.volume(), price, TradeReason.TP, position.magic(), "tp");
        }
    }

    private void stopOut() {
        stoppedOut = true;
        for (Position position : positions.openPositions()) {
            Optional<SymbolSpec> spec = market.symbol(position.symbol());
            Optional<Tick> tick = market.tickAt(position.symbol(), clock.time());
            if (spec.isPresent() && tick.isPresent()) {
                reduce(position, spec.get(), position.volume(), closePrice(position, tick.get()),
                        TradeReason.SO, position.magic(), "so");
            } else {
                log.error("Cannot stop out position {}: no quote for {}", position.ticket(), position.symbol());
            }
        }
        refreshAccount();
    }

    // ---- account ----

    /**
     * Mark open positions to market and recompute equity and margin.
     */
    private void refreshAccount() {
        long now = clock.time();
        double floating = 0;
        for (Position position : positions.openPositions()) {
            Optional<SymbolSpec> spec = market.symbol(position.symbol());
            Optional<Tick> tick = market.tickAt(position.symbol(), now);
            if (spec.isPresent() && tick.isPresent()) {
                double price = closePrice(position, tick.get());
                double profit = profit(spec.get(), position.type(), position.volume(), position.priceOpen(), price);
                positions.put(position.withMark(price, profit));
                floating += profit;
            } else {
                floating += position.profit();
            }
        }
        account.refresh(floating, positions.totalMargin());
    }

    private double profit(SymbolSpec spec, OrderType type, double volume, double priceOpen, double priceClose) {
        double raw = volume * spec.contractSize() * (priceClose - priceOpen);
        return account.round(type.isBuy() ? raw : -raw);
    }

    private double margin(SymbolSpec spec, double volume, double price) {
        double rate = spec.marginRate() > 0 ? spec.marginRate() : 1;
        return account.round(volume * spec.contractSize() * price / (account.getLeverage() / rate));
    }

    // ---- lookups ----

    private static double closePrice(Position position, Tick tick) {
        return position.type().isBuy() ? tick.bid() : tick.ask();
    }

    private static double roundVolume(double volume) {
        return Math.round(volume * 1e8) / 1e8;
    }

    private SymbolSpec requireSymbol(String symbol) throws TradeRejectedException {
        return market.symbol(symbol)
                .orElseThrow(() -> new TradeRejectedException(TradeRetcode.INVALID, "Unknown symbol " + symbol));
    }

    private Tick requireTick(String symbol) throws TradeRejectedException {
        return market.tickAt(symbol, clock.time())
                .orElseThrow(() -> new TradeRejectedException(TradeRetcode.MARKET_CLOSED,
                        "No quote for " + symbol + " at " + clock.time()));
    }

    private Position requireOpenPosition(long ticket) throws TradeRejectedException {
        return positions.find(ticket)
                .filter(p -> positions.isOpen(p.ticket()))
                .orElseThrow(() -> new TradeRejectedException(TradeRetcode.POSITION_CLOSED,
                        "Position " + ticket + " is not open"));
    }

    private Order requirePendingOrder(long ticket) throws TradeRejectedException {
        return orders.find(ticket)
                .filter(o -> o.state() == OrderState.PLACED)
                .orElseThrow(() -> new TradeRejectedException(TradeRetcode.INVALID_ORDER,
                        "No pending order " + ticket));
    }

    private static TradeResult checked(TradeRequest request, Tick tick, double volume, double price) {
        return new TradeResult(TradeRetcode.OK, 0, 0, volume, price, tick.bid(), tick.ask(),
                TradeRetcode.OK.getDescription(), request);
    }

    private TradeResult done(Fill fill, Tick tick, TradeRequest request) {
        return new TradeResult(TradeRetcode.DONE, fill.order().ticket(), fill.deal().ticket(),
                fill.deal().volume(), fill.deal().price(), tick.bid(), tick.ask(),
                TradeRetcode.DONE.getDescription(), request);
    }
}

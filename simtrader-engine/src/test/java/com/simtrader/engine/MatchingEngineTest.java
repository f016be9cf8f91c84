package com.simtrader.engine;

import com.simtrader.core.config.SimulationConfig;
import com.simtrader.core.model.Deal;
import com.simtrader.core.model.DealEntry;
import com.simtrader.core.model.Order;
import com.simtrader.core.model.OrderState;
import com.simtrader.core.model.OrderType;
import com.simtrader.core.model.Position;
import com.simtrader.core.model.Tick;
import com.simtrader.core.model.TradeAction;
import com.simtrader.core.model.TradeReason;
import com.simtrader.core.model.TradeRequest;
import com.simtrader.core.model.TradeResult;
import com.simtrader.core.model.TradeRetcode;
import com.simtrader.engine.clock.ClockException;
import com.simtrader.engine.market.MarketData;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.simtrader.engine.Markets.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Order execution, netting and tick evaluation against synthetic EURUSD quotes.
 */
class MatchingEngineTest {

    private static final double EPS = 1e-9;

    private BacktestEngine engine;

    @BeforeEach
    void setUp() {
        engine = new BacktestEngine(config(1000, 200), flat(200, 1));
    }

    private TradeResult send(TradeRequest request) {
        TradeResult result = engine.orderSend(request);
        assertTrue(result.isDone(), () -> "expected DONE but got " + result.retcode() + ": " + result.comment());
        return result;
    }

    private TradeResult market(OrderType type, double volume) {
        return send(TradeRequest.market(SYMBOL, type, volume));
    }

    private Position position(long ticket) {
        return engine.getPositions().get(ticket);
    }

    private double netOfDeals(long positionTicket) {
        return engine.getDeals().getByPosition(positionTicket).stream().mapToDouble(Deal::signedVolume).sum();
    }

    @Nested
    @DisplayName("Market orders")
    class MarketOrders {

        @Test
        void buyOpensPositionAtAsk() {
            TradeResult result = market(OrderType.BUY, 0.01);

            assertEquals(ASK, result.price(), EPS);
            Position position = position(result.order());
            assertEquals(result.order(), position.ticket(), "position ticket is the opening order ticket");
            assertEquals(OrderType.BUY, position.type());
            assertEquals(0.01, position.volume(), EPS);
            assertEquals(ASK, position.priceOpen(), EPS);

            Deal deal = engine.getDeals().get(result.deal());
            assertEquals(DealEntry.IN, deal.entry());
            assertEquals(result.order(), deal.order());
            assertEquals(OrderState.FILLED, engine.getOrders().get(result.order()).state());
        }

        @Test
        void accountReflectsMarginAndSpread() {
            market(OrderType.BUY, 0.01);

            assertEquals(1000, engine.getAccount().getBalance(), EPS);
            assertEquals(11.0, engine.getAccount().getMargin(), EPS);
            assertEquals(-0.1, engine.getAccount().getProfit(), EPS);
            assertEquals(999.9, engine.getAccount().getEquity(), EPS);
            assertEquals(988.9, engine.getAccount().getMarginFree(), EPS);
        }

        @Test
        void sellOpensAtBid() {
            TradeResult result = market(OrderType.SELL, 0.02);
            assertEquals(BID, result.price(), EPS);
            assertEquals(-0.02, position(result.order()).netVolume(), EPS);
        }

        @Test
        void ticketsGrowAcrossOrdersAndDeals() {
            TradeResult first = market(OrderType.BUY, 0.01);
            TradeResult second = market(OrderType.BUY, 0.01);
            assertTrue(first.order() < first.deal());
            assertTrue(first.deal() < second.order());
            assertTrue(second.order() < second.deal());
        }
    }

    @Nested
    @DisplayName("Netting")
    class Netting {

        @Test
        void exactOppositeClosesPosition() {
            TradeResult open = market(OrderType.BUY, 0.01);
            market(OrderType.SELL, 0.01);

            assertEquals(0, engine.getPositions().openPositionsTotal());
            List<Deal> deals = engine.getDeals().getByPosition(open.order());
            assertEquals(2, deals.size());
            assertEquals(DealEntry.IN, deals.get(0).entry());
            assertEquals(DealEntry.OUT, deals.get(1).entry());
            assertEquals(0, netOfDeals(open.order()), EPS);

            Position closed = position(open.order());
            assertEquals(0, closed.volume(), EPS);
            assertEquals(-0.1, closed.profit(), EPS);
            assertEquals(999.9, engine.getAccount().getBalance(), EPS);
            assertEquals(0, engine.getAccount().getMargin(), EPS);
        }

        @Test
        void sameSideAddsVolume() {
            TradeResult open = market(OrderType.BUY, 0.01);
            TradeResult add = market(OrderType.BUY, 0.02);

            assertEquals(1, engine.getPositions().openPositionsTotal());
            Position position = position(open.order());
            assertEquals(0.03, position.volume(), EPS);
            assertEquals(ASK, position.priceOpen(), EPS);
            assertEquals(open.order(), engine.getDeals().get(add.deal()).positionId());
            assertEquals(DealEntry.IN, engine.getDeals().get(add.deal()).entry());
            assertEquals(position.netVolume(), netOfDeals(open.order()), EPS);
        }

        @Test
        void smallerOppositeReduces() {
            TradeResult open = market(OrderType.BUY, 0.05);
            TradeResult reduce = market(OrderType.SELL, 0.02);

            Position position = position(open.order());
            assertTrue(engine.getPositions().isOpen(open.order()));
            assertEquals(0.03, position.volume(), EPS);
            Deal deal = engine.getDeals().get(reduce.deal());
            assertEquals(DealEntry.OUT, deal.entry());
            assertEquals(-0.2, deal.profit(), EPS);
            assertEquals(999.8, engine.getAccount().getBalance(), EPS);
        }

        @Test
        void largerOppositeReversesInOneDeal() {
            TradeResult open = market(OrderType.BUY, 0.01);
            TradeResult reverse = market(OrderType.SELL, 0.03);

            Position position = position(open.order());
            assertEquals(OrderType.SELL, position.type());
            assertEquals(0.02, position.volume(), EPS);
            assertEquals(BID, position.priceOpen(), EPS);
            assertTrue(engine.getPositions().isOpen(open.order()));

            Deal deal = engine.getDeals().get(reverse.deal());
            assertEquals(DealEntry.INOUT, deal.entry());
            assertEquals(0.03, deal.volume(), EPS);
            assertEquals(-0.1, deal.profit(), EPS);
            assertEquals(position.netVolume(), netOfDeals(open.order()), EPS);
        }

        @Test
        void closeByTicketAllowsPartialVolume() {
            TradeResult open = market(OrderType.SELL, 0.04);
            send(TradeRequest.close(position(open.order()), 0.01));

            assertEquals(0.03, position(open.order()).volume(), EPS);
            assertTrue(engine.closePosition(open.order()).isDone());
            assertFalse(engine.getPositions().isOpen(open.order()));
            assertEquals(3, engine.getDeals().getByPosition(open.order()).size());
        }
    }

    @Nested
    @DisplayName("Rejections")
    class Rejections {

        private void assertRejected(TradeRetcode expected, TradeRequest request) {
            TradeResult result = engine.orderSend(request);
            assertEquals(expected, result.retcode(), result.comment());
            assertFalse(result.isDone());
        }

        @Test
        void malformedRequest() {
            assertRejected(TradeRetcode.INVALID, TradeRequest.market(SYMBOL, OrderType.BUY, 0));
            assertRejected(TradeRetcode.INVALID, TradeRequest.market("GBPUSD", OrderType.BUY, 0.01));
        }

        @Test
        void volumeOffGrid() {
            assertRejected(TradeRetcode.INVALID_VOLUME, TradeRequest.market(SYMBOL, OrderType.BUY, 0.015));
            assertRejected(TradeRetcode.INVALID_VOLUME, TradeRequest.market(SYMBOL, OrderType.BUY, 500));
        }

        @Test
        void stopsOnWrongSideOrTooClose() {
            assertRejected(TradeRetcode.INVALID_STOPS, TradeRequest.market(SYMBOL, OrderType.BUY, 0.01, 1.2, 0));
            assertRejected(TradeRetcode.INVALID_STOPS, TradeRequest.market(SYMBOL, OrderType.SELL, 0.01, 0, 1.2));
            assertRejected(TradeRetcode.INVALID_STOPS, TradeRequest.market(SYMBOL, OrderType.BUY, 0.01, 1.10005, 0));
        }

        @Test
        void notEnoughMargin() {
            assertRejected(TradeRetcode.NO_MONEY, TradeRequest.market(SYMBOL, OrderType.BUY, 10));
        }

        @Test
        void closeVolumeAbovePosition() {
            TradeResult open = market(OrderType.BUY, 0.01);
            assertRejected(TradeRetcode.INVALID_CLOSE_VOLUME, TradeRequest.close(position(open.order()), 0.02));
        }

        @Test
        void closingAClosedPosition() {
            TradeResult open = market(OrderType.BUY, 0.01);
            Position position = position(open.order());
            send(TradeRequest.close(position));

            assertRejected(TradeRetcode.POSITION_CLOSED, TradeRequest.close(position));
            assertEquals(TradeRetcode.POSITION_CLOSED, engine.closePosition(open.order()).retcode());
        }

        @Test
        void closeByUnsupported() {
            TradeRequest request = TradeRequest.builder().action(TradeAction.CLOSE_BY).position(1).build();
            assertRejected(TradeRetcode.INVALID, request);
        }

        @Test
        void noQuoteMeansMarketClosed() throws ClockException {
            List<Tick> ticks = new ArrayList<>();
            for (long t = START; t < START + 10; t++) {
                ticks.add(Tick.of(t, BID, ASK));
            }
            MarketData sparse = MarketData.builder().symbol(eurusd()).ticks(SYMBOL, ticks).tolerance(5).build();
            engine = new BacktestEngine(config(1000, 200), sparse);
            engine.fastForward(100);

            assertRejected(TradeRetcode.MARKET_CLOSED, TradeRequest.market(SYMBOL, OrderType.BUY, 0.01));
        }

        @Test
        void rejectionsLeaveNoTrace() {
            engine.orderSend(TradeRequest.market(SYMBOL, OrderType.BUY, 0.015));
            engine.orderSend(TradeRequest.market(SYMBOL, OrderType.BUY, 10));
            assertEquals(0, engine.getOrders().size());
            assertEquals(0, engine.getDeals().size());
        }

        @Test
        void orderCheckDoesNotExecute() {
            assertEquals(TradeRetcode.OK, engine.orderCheck(TradeRequest.market(SYMBOL, OrderType.BUY, 0.01)).retcode());
            assertEquals(TradeRetcode.INVALID_VOLUME,
                    engine.orderCheck(TradeRequest.market(SYMBOL, OrderType.BUY, 0.015)).retcode());
            assertEquals(0, engine.getOrders().size());
        }
    }

    @Nested
    @DisplayName("Stop levels")
    class StopLevels {

        @BeforeEach
        void dropAfterFiftySeconds() {
            engine = new BacktestEngine(config(1000, 200), step(200, 50, -0.01));
        }

        @Test
        void stopLossClosesAtBid() throws ClockException {
            TradeResult open = send(TradeRequest.market(SYMBOL, OrderType.BUY, 0.01, 1.095, 0));

            engine.fastForward(49);
            assertTrue(engine.getPositions().isOpen(open.order()));

            engine.next();
            assertFalse(engine.getPositions().isOpen(open.order()));
            List<Deal> deals = engine.getDeals().getByPosition(open.order());
            Deal exit = deals.get(deals.size() - 1);
            assertEquals(TradeReason.SL, exit.reason());
            assertEquals(1.09, exit.price(), EPS);
            assertEquals(-10.1, exit.profit(), EPS);
            assertEquals(989.9, engine.getAccount().getBalance(), EPS);
        }

        @Test
        void takeProfitClosesSellAtAsk() throws ClockException {
            TradeResult open = send(TradeRequest.market(SYMBOL, OrderType.SELL, 0.01, 0, 1.095));

            engine.goTo(START + 50);

            assertFalse(engine.getPositions().isOpen(open.order()));
            Deal exit = engine.getDeals().getByPosition(open.order()).get(1);
            assertEquals(TradeReason.TP, exit.reason());
            assertEquals(1.0901, exit.price(), EPS);
            assertEquals(9.9, exit.profit(), EPS);
        }

        @Test
        void modifyStops() {
            TradeResult open = market(OrderType.BUY, 0.01);

            send(TradeRequest.modifyStops(open.order(), SYMBOL, 1.09, 1.11));
            Position position = position(open.order());
            assertEquals(1.09, position.sl(), EPS);
            assertEquals(1.11, position.tp(), EPS);

            assertEquals(TradeRetcode.NO_CHANGES,
                    engine.orderSend(TradeRequest.modifyStops(open.order(), SYMBOL, 1.09, 1.11)).retcode());
            assertEquals(TradeRetcode.INVALID_STOPS,
                    engine.orderSend(TradeRequest.modifyStops(open.order(), SYMBOL, 1.1, 0)).retcode());
        }

        @Test
        void stopOutClosesEverything() throws ClockException {
            SimulationConfig config = config(100, 200);
            config.getAccount().setMarginStopOut(50);
            engine = new BacktestEngine(config, step(200, 50, -0.01));

            TradeResult open = market(OrderType.BUY, 0.09);
            engine.fastForward(49);
            assertFalse(engine.isStoppedOut());

            engine.next();
            assertTrue(engine.isStoppedOut());
            assertEquals(0, engine.getPositions().openPositionsTotal());
            Deal exit = engine.getDeals().getByPosition(open.order()).get(1);
            assertEquals(TradeReason.SO, exit.reason());
            assertEquals(9.1, engine.getAccount().getBalance(), EPS);
        }
    }

    @Nested
    @DisplayName("Pending orders")
    class PendingOrders {

        @BeforeEach
        void dropAfterFiftySeconds() {
            engine = new BacktestEngine(config(1000, 200), step(200, 50, -0.01));
        }

        @Test
        void buyLimitFillsWhenAskReachesPrice() throws ClockException {
            TradeResult placed = send(TradeRequest.pending(SYMBOL, OrderType.BUY_LIMIT, 0.01, 1.095));
            assertEquals(1, engine.getOrders().pendingTotal());
            assertEquals(0, engine.getPositions().openPositionsTotal());

            engine.fastForward(50);

            Order order = engine.getOrders().get(placed.order());
            assertEquals(OrderState.FILLED, order.state());
            assertEquals(START, order.timeSetup());
            assertEquals(START + 50, order.timeDone());
            Position position = position(placed.order());
            assertEquals(1.0901, position.priceOpen(), EPS);
            assertEquals(1, engine.getDeals().getByPosition(placed.order()).size());
        }

        @Test
        void priceOnWrongSideRejected() {
            assertEquals(TradeRetcode.INVALID_PRICE,
                    engine.orderSend(TradeRequest.pending(SYMBOL, OrderType.BUY_LIMIT, 0.01, 1.2)).retcode());
            assertEquals(TradeRetcode.INVALID_PRICE,
                    engine.orderSend(TradeRequest.pending(SYMBOL, OrderType.SELL_STOP, 0.01, 1.2)).retcode());
        }

        @Test
        void removeCancels() throws ClockException {
            TradeResult placed = send(TradeRequest.pending(SYMBOL, OrderType.SELL_STOP, 0.01, 1.09));
            send(TradeRequest.remove(placed.order()));

            assertEquals(OrderState.CANCELLED, engine.getOrders().get(placed.order()).state());
            engine.fastForward(60);
            assertEquals(0, engine.getPositions().openPositionsTotal());
            assertEquals(TradeRetcode.INVALID_ORDER, engine.orderSend(TradeRequest.remove(placed.order())).retcode());
        }

        @Test
        void modifyMovesPrice() {
            TradeResult placed = send(TradeRequest.pending(SYMBOL, OrderType.BUY_LIMIT, 0.01, 1.095));
            send(TradeRequest.modifyPending(placed.order(), 1.096, 0, 0));

            assertEquals(1.096, engine.getOrders().get(placed.order()).priceOpen(), EPS);
            assertEquals(TradeRetcode.NO_CHANGES,
                    engine.orderSend(TradeRequest.modifyPending(placed.order(), 1.096, 0, 0)).retcode());
        }
    }

    @Test
    void calculators() {
        MatchingEngine matching = engine.getMatching();
        assertEquals(10000, matching.orderCalcProfit(OrderType.BUY, SYMBOL, 1, 1.1, 1.2), EPS);
        assertEquals(-10000, matching.orderCalcProfit(OrderType.SELL, SYMBOL, 1, 1.1, 1.2), EPS);
        assertEquals(1100, matching.orderCalcMargin(OrderType.BUY, SYMBOL, 1, 1.1), EPS);
        assertThrows(IllegalArgumentException.class,
                () -> matching.orderCalcMargin(OrderType.BUY, "GBPUSD", 1, 1.1));
    }
}

package com.simtrader.engine.ledger;

import com.simtrader.core.concurrent.EventLoop;
import com.simtrader.core.model.TradeRecord;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Keyed, time-indexed store of trade records. Records are replaced, never
 * edited: an update stores a new immutable instance under the same ticket.
 * <p>
 * Only the matching engine writes; everybody else reads through {@link LedgerView}.
 * Once {@linkplain #confineTo confined}, writes from any other thread than the
 * loop's fail with {@link IllegalStateException}.
 */
public class TradeLedger<T extends TradeRecord> implements LedgerView<T> {

    private record TimeKey(long time, long ticket) implements Comparable<TimeKey> {
        @Override
        public int compareTo(TimeKey other) {
            int c = Long.compare(time, other.time);
            return c != 0 ? c : Long.compare(ticket, other.ticket);
        }
    }

    private final String name;
    private final Map<Long, T> byTicket = new HashMap<>();
    private final NavigableMap<TimeKey, T> byTime = new TreeMap<>();
    private volatile EventLoop owner;

    public TradeLedger(String name) {
        this.name = name;
    }

    public void confineTo(EventLoop loop) {
        this.owner = loop;
    }

    protected void checkWriter() {
        EventLoop loop = owner;
        if (loop != null) {
            loop.checkLoopThread();
        }
    }

    /**
     * Insert or replace a record.
     */
    public synchronized void put(T record) {
        checkWriter();
        T previous = byTicket.put(record.ticket(), record);
        if (previous != null) {
            byTime.remove(new TimeKey(previous.time(), previous.ticket()));
        }
        byTime.put(new TimeKey(record.time(), record.ticket()), record);
    }

    public synchronized void clear() {
        checkWriter();
        byTicket.clear();
        byTime.clear();
    }

    @Override
    public synchronized T get(long ticket) {
        T record = byTicket.get(ticket);
        if (record == null) {
            throw new UnknownTicketException(name, ticket);
        }
        return record;
    }

    @Override
    public synchronized Optional<T> find(long ticket) {
        return Optional.ofNullable(byTicket.get(ticket));
    }

    @Override
    public synchronized List<T> getByPosition(long positionTicket) {
        List<T> result = new ArrayList<>();
        for (T record : byTime.values()) {
            if (record.positionId() == positionTicket) {
                result.add(record);
            }
        }
        return result;
    }

    @Override
    public List<T> historyGet(long dateFrom, long dateTo) {
        return getRange(dateFrom, dateTo);
    }

    @Override
    public int total(long dateFrom, long dateTo) {
        return getRange(dateFrom, dateTo).size();
    }

    @Override
    public synchronized List<T> getRange(long dateFrom, long dateTo) {
        if (dateTo < dateFrom) {
            return List.of();
        }
        TimeKey from = new TimeKey(dateFrom, Long.MIN_VALUE);
        TimeKey to = new TimeKey(dateTo, Long.MAX_VALUE);
        return List.copyOf(byTime.subMap(from, true, to, true).values());
    }

    @Override
    public synchronized List<T> values() {
        return List.copyOf(byTime.values());
    }

    @Override
    public synchronized int size() {
        return byTicket.size();
    }

    @Override
    public synchronized Map<Long, Map<String, Object>> toMap() {
        Map<Long, Map<String, Object>> map = new LinkedHashMap<>();
        for (T record : byTime.values()) {
            map.put(record.ticket(), record.toMap());
        }
        return map;
    }
}

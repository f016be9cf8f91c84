package com.simtrader.engine;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.simtrader.core.model.AccountInfo;
import com.simtrader.core.model.Deal;
import com.simtrader.core.model.Order;
import com.simtrader.core.model.Position;
import com.simtrader.engine.clock.Cursor;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Complete engine state at one cursor position: enough to resume a stopped
 * backtest. The byte form is opaque to callers.
 */
public record EngineSnapshot(
    String name,
    Instant takenAt,
    Cursor cursor,
    AccountInfo account,
    List<Order> orders,
    List<Deal> deals,
    List<Position> positions,
    Map<Long, Double> openMargins,
    long nextTicket
) {
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule());

    public byte[] toBytes() {
        try {
            return MAPPER.writeValueAsBytes(this);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to serialize snapshot " + name, e);
        }
    }

    public static EngineSnapshot fromBytes(byte[] bytes) throws IOException {
        return MAPPER.readValue(bytes, EngineSnapshot.class);
    }

    public void save(Path path) throws IOException {
        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }
        Files.write(path, toBytes());
    }

    public static EngineSnapshot load(Path path) throws IOException {
        return fromBytes(Files.readAllBytes(path));
    }
}

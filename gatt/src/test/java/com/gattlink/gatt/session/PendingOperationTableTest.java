package com.gattlink.gatt.session;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for PendingOperationTable.
 */
class PendingOperationTableTest {

    private final PendingOperationTable<UUID, byte[]> table = new PendingOperationTable<>();
    private final UUID key = UUID.randomUUID();

    @Test
    void put_returnsDisplacedFuture() {
        CompletableFuture<byte[]> first = new CompletableFuture<>();
        CompletableFuture<byte[]> second = new CompletableFuture<>();

        assertNull(table.put(key, first));
        assertSame(first, table.put(key, second));
        assertEquals(1, table.size());
        assertFalse(first.isDone(), "Table must not complete futures itself");
    }

    @Test
    void take_removesEntryOnce() {
        CompletableFuture<byte[]> future = new CompletableFuture<>();
        table.put(key, future);

        assertSame(future, table.take(key));
        assertNull(table.take(key));
        assertTrue(table.isEmpty());
    }

    @Test
    void remove_onlyRemovesMatchingFuture() {
        CompletableFuture<byte[]> stale = new CompletableFuture<>();
        CompletableFuture<byte[]> current = new CompletableFuture<>();
        table.put(key, current);

        assertFalse(table.remove(key, stale));
        assertTrue(table.contains(key));
        assertTrue(table.remove(key, current));
        assertFalse(table.contains(key));
    }

    @Test
    void drain_returnsEverythingAndEmpties() {
        CompletableFuture<byte[]> a = new CompletableFuture<>();
        CompletableFuture<byte[]> b = new CompletableFuture<>();
        table.put(UUID.randomUUID(), a);
        table.put(UUID.randomUUID(), b);

        List<CompletableFuture<byte[]>> drained = table.drain();

        assertEquals(2, drained.size());
        assertTrue(drained.contains(a));
        assertTrue(drained.contains(b));
        assertTrue(table.isEmpty());
        assertTrue(table.drain().isEmpty());
    }
}

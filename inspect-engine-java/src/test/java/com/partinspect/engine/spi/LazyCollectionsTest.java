package com.partinspect.engine.spi;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

class LazyCollectionsTest {

    @Test
    void countAndFetchAdapters() {
        AtomicInteger requested = new AtomicInteger();
        LazyCollection<String> lazy = LazyCollections.of(() -> 250L, n -> {
            requested.set(n);
            return List.of("a", "b", "c", "d");
        });
        assertEquals(250L, lazy.count());
        assertEquals(List.of("a", "b"), lazy.take(2));
        assertEquals(2, requested.get());
    }

    @Test
    void streamSourceIsReopenedPerCall() {
        AtomicInteger opened = new AtomicInteger();
        LazyCollection<Integer> lazy = LazyCollections.fromStream(() -> {
            opened.incrementAndGet();
            return IntStream.range(0, 100).boxed();
        });
        assertEquals(100L, lazy.count());
        assertEquals(List.of(0, 1, 2), lazy.take(3));
        assertEquals(2, opened.get());
    }

    @Test
    void streamFetchIsBounded() {
        AtomicInteger pulled = new AtomicInteger();
        LazyCollection<Integer> lazy = LazyCollections.fromStream(
            () -> IntStream.iterate(0, i -> i + 1).boxed().peek(i -> pulled.incrementAndGet()));
        assertEquals(List.of(0, 1, 2, 3, 4), lazy.take(5));
        assertTrue(pulled.get() <= 5, "pulled " + pulled.get());
    }
}

package com.partinspect.engine.spi;

import java.util.List;
import java.util.Objects;
import java.util.function.IntFunction;
import java.util.function.LongSupplier;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Adapters from common deferred sources to {@link LazyCollection}.
 */
public final class LazyCollections {

    private LazyCollections() {}

    /**
     * Adapts a count query and a bounded fetch.
     * The fetch function receives the number of elements wanted and may return fewer.
     */
    public static <T> LazyCollection<T> of(LongSupplier counter,
                                           IntFunction<? extends List<? extends T>> fetcher) {
        Objects.requireNonNull(counter, "counter");
        Objects.requireNonNull(fetcher, "fetcher");
        return new LazyCollection<>() {
            @Override
            public long count() {
                return counter.getAsLong();
            }

            @Override
            public List<T> take(int n) {
                List<? extends T> fetched = fetcher.apply(n);
                return fetched.stream().limit(n).collect(Collectors.toList());
            }

            @Override
            public String toString() {
                return "LazyCollection";
            }
        };
    }

    /**
     * Adapts a re-openable stream source. Every call opens a fresh stream, so a single-use stream
     * cannot be passed directly.
     */
    public static <T> LazyCollection<T> fromStream(Supplier<? extends Stream<? extends T>> source) {
        Objects.requireNonNull(source, "source");
        return of(
            () -> {
                try (Stream<? extends T> s = source.get()) {
                    return s.count();
                }
            },
            n -> {
                try (Stream<? extends T> s = source.get()) {
                    return s.limit(n).collect(Collectors.toList());
                }
            });
    }
}

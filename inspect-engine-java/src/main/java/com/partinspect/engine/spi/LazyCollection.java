package com.partinspect.engine.spi;

import java.util.List;

/**
 * A collection whose size is known without materializing it and whose elements are fetched on
 * demand, such as a query against a backing store.
 *
 * Implementations must not mutate the backing store from either operation.
 */
public interface LazyCollection<T> {

    /** Total number of elements. */
    long count();

    /** The first {@code n} elements, in collection order. Never fetches more than {@code n}. */
    List<T> take(int n);
}

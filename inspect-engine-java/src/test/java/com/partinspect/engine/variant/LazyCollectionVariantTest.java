package com.partinspect.engine.variant;

import com.partinspect.engine.NodeKind;
import com.partinspect.engine.spi.LazyCollection;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

class LazyCollectionVariantTest {

    /** Simulated query: records how it is used. */
    static class StockQuery implements LazyCollection<String> {
        final int size;
        int countCalls;
        final List<Integer> takeRequests = new ArrayList<>();

        StockQuery(int size) { this.size = size; }

        @Override
        public long count() {
            countCalls++;
            return size;
        }

        @Override
        public List<String> take(int n) {
            takeRequests.add(n);
            return IntStream.range(0, Math.min(n, size)).mapToObj(i -> "item-" + i).toList();
        }
    }

    private static List<String> names(Variant v, int maxItems) {
        List<String> names = new ArrayList<>();
        v.expand(new ChildSink() {
            @Override public void child(String name, Object value) { names.add(name + ":" + value); }
            @Override public void failed(String name, Throwable error) { fail(error); }
        }, maxItems);
        return names;
    }

    @Test
    void fetchesOnlyTheBudget() {
        StockQuery query = new StockQuery(1000);
        LazyCollectionVariant v = new LazyCollectionVariant("stock", query);

        assertEquals(List.of("0:item-0", "1:item-1", "2:item-2"), names(v, 3));
        assertEquals(1000, v.declaredChildCount());
        assertEquals(List.of(3), query.takeRequests);
        assertEquals(1, query.countCalls);
    }

    @Test
    void emptyCollectionIsNeverFetched() {
        StockQuery query = new StockQuery(0);
        LazyCollectionVariant v = new LazyCollectionVariant("stock", query);
        assertTrue(names(v, 5).isEmpty());
        assertEquals(0, v.declaredChildCount());
        assertTrue(query.takeRequests.isEmpty());
    }

    @Test
    void zeroBudgetIsNeverFetched() {
        StockQuery query = new StockQuery(4);
        LazyCollectionVariant v = new LazyCollectionVariant("stock", query);
        assertTrue(names(v, 0).isEmpty());
        assertTrue(query.takeRequests.isEmpty());
    }

    @Test
    void declaredCountWithoutExpansionQueriesOnlyCount() {
        StockQuery query = new StockQuery(7);
        LazyCollectionVariant v = new LazyCollectionVariant("stock", query);
        assertEquals(7, v.declaredChildCount());
        assertTrue(query.takeRequests.isEmpty());
        assertEquals(NodeKind.LAZY_COLLECTION, v.kind());
        assertEquals("[", v.prefix());
        assertEquals("]", v.postfix());
    }

    @Test
    void oversizedFetchIsCutToBudget() {
        LazyCollection<Integer> sloppy = new LazyCollection<>() {
            @Override public long count() { return 10; }
            @Override public List<Integer> take(int n) { return List.of(1, 2, 3, 4, 5); }
        };
        assertEquals(2, names(new LazyCollectionVariant("s", sloppy), 2).size());
    }
}

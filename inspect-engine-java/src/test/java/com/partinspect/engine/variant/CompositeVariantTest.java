package com.partinspect.engine.variant;

import com.partinspect.engine.spi.AttributeCollector;
import com.partinspect.engine.spi.BoundMethod;
import com.partinspect.engine.spi.DoNotInvoke;
import com.partinspect.engine.spi.Inspectable;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CompositeVariantTest {

    /** Expands {@code obj} and returns its children by name; failures are stored as Throwables. */
    private static Map<String, Object> expand(Object obj) {
        Map<String, Object> out = new LinkedHashMap<>();
        new CompositeVariant("obj", obj).expand(new ChildSink() {
            @Override public void child(String name, Object value) { out.put(name, value); }
            @Override public void failed(String name, Throwable error) { out.put(name, error); }
        }, 1);
        return out;
    }

    @DoNotInvoke
    static class QueryManager {
    }

    public static class StockItem {
        public static final String TABLE = "stock_item";

        public String serial = "SN-001";
        public int quantity = 4;
        public String _cache = "hidden";
        public Class<?> modelClass = StockItem.class;
        public Object objects = new QueryManager();

        public String getLocation() { return "Shelf A"; }
        public boolean isAllocated() { return true; }
        public String getURL() { return "/stock/1/"; }

        @DoNotInvoke
        public String getDelete() { throw new AssertionError("must not be read"); }

        public String split(int quantity, String location) { return "split"; }
        public static StockItem create() { return new StockItem(); }

        @Override
        public String toString() { return "StockItem"; }
    }

    @Test
    void publicFieldsAndAccessorsAreAttributes() {
        Map<String, Object> attrs = expand(new StockItem());
        assertEquals("SN-001", attrs.get("serial"));
        assertEquals(4, attrs.get("quantity"));
        assertEquals("Shelf A", attrs.get("location"));
        assertEquals(true, attrs.get("allocated"));
        assertEquals("/stock/1/", attrs.get("URL"));
    }

    @Test
    void otherPublicMethodsAreBoundMethods() {
        Object split = expand(new StockItem()).get("split");
        BoundMethod bound = assertInstanceOf(BoundMethod.class, split);
        assertEquals(List.of("quantity", "location"), bound.parameterNames());
    }

    @Test
    void filteredAttributes() {
        Map<String, Object> attrs = expand(new StockItem());
        assertFalse(attrs.containsKey("_cache"), "privacy marker");
        assertFalse(attrs.containsKey("TABLE"), "static field");
        assertFalse(attrs.containsKey("create"), "static method");
        assertFalse(attrs.containsKey("modelClass"), "type object");
        assertFalse(attrs.containsKey("class"), "getClass is built in");
        assertFalse(attrs.containsKey("toString"), "Object method override");
        assertFalse(attrs.containsKey("hashCode"));
        assertFalse(attrs.containsKey("wait"));
        assertFalse(attrs.containsKey("delete"), "member marked DoNotInvoke");
        assertFalse(attrs.containsKey("objects"), "value type marked DoNotInvoke");
    }

    @Test
    void attributesAreOrderedByName() {
        List<String> names = List.copyOf(expand(new StockItem()).keySet());
        assertEquals(List.of("URL", "allocated", "location", "quantity", "serial", "split"), names);
    }

    @Test
    void declaredCountBeforeAndAfterExpansion() {
        CompositeVariant v = new CompositeVariant("item", new StockItem());
        // "objects" is only recognised as hidden once its value is read
        assertEquals(7, v.declaredChildCount());
        v.expand(new ChildSink() {
            @Override public void child(String name, Object value) { }
            @Override public void failed(String name, Throwable error) { }
        }, 0);
        assertEquals(6, v.declaredChildCount());
    }

    record Footprint(String name, double pitch) {
        public String describe() { return name + "@" + pitch; }
    }

    @Test
    void recordComponents() {
        Map<String, Object> attrs = expand(new Footprint("SOT-23", 0.95));
        assertEquals("SOT-23", attrs.get("name"));
        assertEquals(0.95, attrs.get("pitch"));
        assertInstanceOf(BoundMethod.class, attrs.get("describe"));
        assertEquals(3, attrs.size());
    }

    static class Supplier implements Inspectable {
        @Override
        public AttributeCollector exposeAttributes(AttributeCollector c) {
            return c.add("name", "Mouser")
                .add("_token", "secret")
                .add("kind", Supplier.class)
                .addComputed("leadTime", () -> 14)
                .addComputed("rating", () -> { throw new IllegalStateException("no rating"); });
        }
    }

    @Test
    void inspectableSuppliesItsOwnAttributes() {
        Map<String, Object> attrs = expand(new Supplier());
        assertEquals(List.of("name", "leadTime", "rating"), List.copyOf(attrs.keySet()));
        assertEquals("Mouser", attrs.get("name"));
        assertEquals(14, attrs.get("leadTime"));
        IllegalStateException failure = assertInstanceOf(IllegalStateException.class, attrs.get("rating"));
        assertEquals("no rating", failure.getMessage());
    }

    static class Broken {
        public String getName() { throw new UnsupportedOperationException("lazy relation not loaded"); }
        public String getIpn() { return "IPN-7"; }
    }

    @Test
    void failingAccessorIsReportedAndSiblingsContinue() {
        Map<String, Object> attrs = expand(new Broken());
        assertInstanceOf(UnsupportedOperationException.class, attrs.get("name"));
        assertEquals("IPN-7", attrs.get("ipn"));
    }

    @Test
    void propertyNames() throws NoSuchMethodException {
        assertEquals("location", CompositeAttributes.propertyName(StockItem.class.getMethod("getLocation")));
        assertEquals("allocated", CompositeAttributes.propertyName(StockItem.class.getMethod("isAllocated")));
        assertEquals("URL", CompositeAttributes.propertyName(StockItem.class.getMethod("getURL")));
        assertNull(CompositeAttributes.propertyName(
            StockItem.class.getMethod("split", int.class, String.class)));
    }
}

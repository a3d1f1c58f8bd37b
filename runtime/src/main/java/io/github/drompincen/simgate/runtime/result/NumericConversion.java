package io.github.drompincen.simgate.runtime.result;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.lang.reflect.Array;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Map;
import java.util.Optional;

/**
 * Turns engine-native numeric containers into plain JSON scalars and arrays.
 * <p>
 * Primitive arrays of any element type, boxed numbers, {@link Iterable}s, object arrays (nested
 * to any depth) and maps are supported. Non-finite floating point values become {@code null}
 * because JSON has no representation for them.
 */
public final class NumericConversion {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private NumericConversion() {}

    public static JsonNode toJson(Object value) {
        if (value == null) return NODES.nullNode();
        if (value instanceof JsonNode node) return node;
        if (value instanceof Optional<?> opt) return toJson(opt.orElse(null));
        if (value instanceof Number n) return number(n);
        if (value instanceof Boolean b) return NODES.booleanNode(b);
        if (value instanceof CharSequence || value instanceof Character) return NODES.textNode(value.toString());
        if (value instanceof Enum<?> e) return NODES.textNode(e.name());
        if (value instanceof Map<?, ?> map) {
            ObjectNode obj = NODES.objectNode();
            map.forEach((k, v) -> obj.set(String.valueOf(k), toJson(v)));
            return obj;
        }
        if (value instanceof Iterable<?> items) {
            ArrayNode arr = NODES.arrayNode();
            items.forEach(item -> arr.add(toJson(item)));
            return arr;
        }
        if (value.getClass().isArray()) {
            return array(value);
        }
        throw new IllegalArgumentException("Unsupported engine value type: " + value.getClass().getName());
    }

    /**
     * Same as {@link #toJson(Object)} but requires a sequence. {@code null} becomes an empty array.
     */
    public static ArrayNode toJsonArray(Object value) {
        if (value == null) return NODES.arrayNode();
        JsonNode node = toJson(value);
        if (!(node instanceof ArrayNode arr)) {
            throw new IllegalArgumentException("Expected a sequence but got " + value.getClass().getName());
        }
        return arr;
    }

    private static JsonNode number(Number n) {
        if (n instanceof Double || n instanceof Float) {
            double d = n.doubleValue();
            return Double.isFinite(d) ? NODES.numberNode(d) : NODES.nullNode();
        }
        if (n instanceof BigDecimal bd) return NODES.numberNode(bd);
        if (n instanceof BigInteger bi) return NODES.numberNode(bi);
        if (n instanceof Integer || n instanceof Short || n instanceof Byte) return NODES.numberNode(n.intValue());
        if (n instanceof Long) return NODES.numberNode(n.longValue());
        // AtomicLong, DoubleAdder and friends
        double d = n.doubleValue();
        if (d == Math.rint(d) && Math.abs(d) < Long.MAX_VALUE) return NODES.numberNode(n.longValue());
        return Double.isFinite(d) ? NODES.numberNode(d) : NODES.nullNode();
    }

    private static ArrayNode array(Object array) {
        ArrayNode arr = NODES.arrayNode();
        if (array instanceof double[] values) {
            for (double v : values) arr.add(Double.isFinite(v) ? NODES.numberNode(v) : NODES.nullNode());
        } else if (array instanceof float[] values) {
            for (float v : values) arr.add(Float.isFinite(v) ? NODES.numberNode((double) v) : NODES.nullNode());
        } else if (array instanceof int[] values) {
            for (int v : values) arr.add(v);
        } else if (array instanceof long[] values) {
            for (long v : values) arr.add(v);
        } else if (array instanceof boolean[] values) {
            for (boolean v : values) arr.add(v);
        } else if (array instanceof char[] values) {
            for (char v : values) arr.add(String.valueOf(v));
        } else if (array instanceof short[] || array instanceof byte[]) {
            int len = Array.getLength(array);
            for (int i = 0; i < len; i++) arr.add(((Number) Array.get(array, i)).intValue());
        } else {
            for (Object item : (Object[]) array) arr.add(toJson(item));
        }
        return arr;
    }
}

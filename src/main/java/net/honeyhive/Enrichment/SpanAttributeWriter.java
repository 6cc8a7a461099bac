package net.honeyhive.Enrichment;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.opentelemetry.api.trace.Span;
import org.springframework.lang.Nullable;

import java.lang.reflect.Array;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Map;

/**
 * Writes arbitrary values onto a span as flat attributes.
 *
 * Maps are flattened with {@code .} between keys and lists or arrays by index.
 * Strings, booleans and numbers are written natively. Anything else is serialised
 * to JSON.
 */
public class SpanAttributeWriter {

    static final int MAX_DEPTH = 10;

    private final ObjectMapper objectMapper;

    public SpanAttributeWriter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public void write(Span span, String key, @Nullable Object value) {
        write(span, key, value, 0);
    }

    public void writeAll(Span span, String prefix, @Nullable Map<String, ?> values) {
        if (values == null) {
            return;
        }
        values.forEach((key, value) -> write(span, prefix + "." + key, value, 1));
    }

    private void write(Span span, String key, @Nullable Object value, int depth) {
        if (value == null) {
            return;
        }
        if (depth >= MAX_DEPTH) {
            span.setAttribute(key, toJson(value));
            return;
        }
        if (value instanceof String s) {
            span.setAttribute(key, s);
        } else if (value instanceof Boolean b) {
            span.setAttribute(key, b);
        } else if (value instanceof Integer || value instanceof Long
                || value instanceof Short || value instanceof Byte) {
            span.setAttribute(key, ((Number) value).longValue());
        } else if (value instanceof Float || value instanceof Double) {
            span.setAttribute(key, ((Number) value).doubleValue());
        } else if (value instanceof BigDecimal || value instanceof BigInteger) {
            span.setAttribute(key, value.toString());
        } else if (value instanceof CharSequence || value instanceof Character || value instanceof Enum<?>) {
            span.setAttribute(key, value.toString());
        } else if (value instanceof Map<?, ?> map) {
            map.forEach((k, v) -> write(span, key + "." + k, v, depth + 1));
        } else if (value instanceof Iterable<?> iterable) {
            int index = 0;
            for (Object item : iterable) {
                write(span, key + "." + index++, item, depth + 1);
            }
        } else if (value.getClass().isArray()) {
            int length = Array.getLength(value);
            for (int i = 0; i < length; i++) {
                write(span, key + "." + i, Array.get(value, i), depth + 1);
            }
        } else {
            span.setAttribute(key, toJson(value));
        }
    }

    String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            return String.valueOf(value);
        }
    }
}

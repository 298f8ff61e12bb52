package com.enterprise.securedb.param;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One template parameter, classified once so the processors never probe raw objects.
 * Build instances with {@link Params#of(Object)}.
 */
public sealed interface Param {

    static Param skip() {
        return Skip.INSTANCE;
    }

    default boolean isSkip() {
        return this instanceof Skip;
    }

    /** Any plain value, {@code null} included. */
    record Scalar(Object value) implements Param {}

    /** A list or array: rendered as {@code ?, ?, ?} by {@code ?a}. */
    record Sequence(List<Param> elements) implements Param {
        public Sequence {
            elements = List.copyOf(elements);
        }

        public int size() {
            return elements.size();
        }
    }

    /**
     * A keyed collection in iteration order. Rendered as an IN list when its keys are exactly
     * the integers {@code 0..n-1} in order, otherwise as {@code `key` = ?} assignments.
     */
    record Mapping(Map<Object, Param> entries) implements Param {
        public Mapping {
            entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
        }

        public int size() {
            return entries.size();
        }

        public boolean isAssociative() {
            long expected = 0;
            for (Object key : entries.keySet()) {
                if (!(key instanceof Integer || key instanceof Long || key instanceof Short
                        || key instanceof Byte)) {
                    return true;
                }
                if (((Number) key).longValue() != expected++) {
                    return true;
                }
            }
            return false;
        }
    }

    record Extractable(NativeExtractable wrapped) implements Param {
        public Extractable {
            Objects.requireNonNull(wrapped, "wrapped");
        }
    }

    /** The skip marker. Equal to every other {@code Skip}. */
    record Skip() implements Param {
        static final Skip INSTANCE = new Skip();
    }
}

package com.enterprise.securedb.param;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts caller-supplied Java objects into {@link Param} values.
 *
 * <ul>
 *   <li>{@link MacroControl#SKIP} → {@link Param.Skip}</li>
 *   <li>{@link NativeExtractable} → {@link Param.Extractable}</li>
 *   <li>{@link Collection} and non-byte arrays → {@link Param.Sequence}</li>
 *   <li>{@link Map} → {@link Param.Mapping}</li>
 *   <li>an existing {@link Param} is kept; anything else (including {@code null}
 *       and {@code byte[]}) → {@link Param.Scalar}</li>
 * </ul>
 */
public final class Params {

    private Params() {}

    public static Param of(Object value) {
        if (value instanceof Param p) {
            return p;
        }
        if (value == MacroControl.SKIP) {
            return Param.skip();
        }
        if (value instanceof NativeExtractable ne) {
            return new Param.Extractable(ne);
        }
        if (value instanceof Map<?, ?> map) {
            Map<Object, Param> entries = new LinkedHashMap<>();
            map.forEach((k, v) -> entries.put(k, of(v)));
            return new Param.Mapping(entries);
        }
        if (value instanceof Collection<?> collection) {
            List<Param> elements = new ArrayList<>(collection.size());
            for (Object element : collection) {
                elements.add(of(element));
            }
            return new Param.Sequence(elements);
        }
        // byte[] binds as a single BLOB/VARBINARY value
        if (value != null && value.getClass().isArray() && !(value instanceof byte[])) {
            int length = Array.getLength(value);
            List<Param> elements = new ArrayList<>(length);
            for (int i = 0; i < length; i++) {
                elements.add(of(Array.get(value, i)));
            }
            return new Param.Sequence(elements);
        }
        return new Param.Scalar(value);
    }

    public static List<Param> list(Object... values) {
        if (values == null) {
            // a lone null vararg arrives as a null array
            return List.of(new Param.Scalar(null));
        }
        List<Param> params = new ArrayList<>(values.length);
        for (Object value : values) {
            params.add(of(value));
        }
        return params;
    }

    public static List<Param> fromList(List<?> values) {
        List<Param> params = new ArrayList<>(values.size());
        for (Object value : values) {
            params.add(of(value));
        }
        return params;
    }

    /**
     * Resolves a wrapper to its native value; any other scalar is returned as-is.
     */
    public static Object unwrap(Object value) {
        if (value instanceof NativeExtractable ne) {
            return ne.toNative();
        }
        return value;
    }
}

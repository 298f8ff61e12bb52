package com.enterprise.securedb.param;

/**
 * A domain value object that can hand the driver its plain Java value.
 *
 * <p>Wrappers are never bound as-is: wherever a value is consumed (bare {@code ?},
 * {@code ?#}, each element or map value of {@code ?a}) the engine binds
 * {@link #toNative()} instead.
 */
@FunctionalInterface
public interface NativeExtractable {

    Object toNative();
}

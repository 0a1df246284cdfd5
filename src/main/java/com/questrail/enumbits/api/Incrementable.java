package com.questrail.enumbits.api;

/**
 * Incrementable
 * -----------------------------------------------------------------------------
 * Marker interface by which an {@code enum} opts in to stepping: prefix and
 * postfix increment and decrement.
 *
 * Stepping operations are declared with the bound
 * {@code <E extends Enum<E> & Incrementable>}, so calling them on an enum that
 * does not implement this interface does not compile.
 *
 * <h2>Range</h2>
 * Stepping is unchecked. Moving past the first or last declared constant is the
 * caller's error and is not clamped.
 *
 * Example:
 * <pre>{@code
 * enum Track implements Incrementable {
 *     MAIN_1, MAIN_2, SIDING
 * }
 * }</pre>
 */
public interface Incrementable
{
    // No methods; the bound is the capability
}

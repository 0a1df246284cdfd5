package com.questrail.enumbits.api;

/**
 * BitFlag
 * -----------------------------------------------------------------------------
 * Opt-in interface for enums whose constants are used as flag masks and
 * combined with bitwise operators.
 *
 * <h2>Underlying Value</h2>
 * A flag enum declares the underlying integer of each constant explicitly.
 * Typical flag constants are single bits ({@code 1 << n}), but a constant may
 * also name a combination (e.g. {@code ALL}) or zero (e.g. {@code NONE}).
 *
 * Combination results are not enum constants; they are carried by
 * {@code FlagMask}, which can be converted back with
 * {@code FlagMask#asConstant()} when the bits match a declared constant.
 *
 * Example:
 * <pre>{@code
 * enum Aspect implements BitFlag {
 *     NONE(0), RED(1), YELLOW(1 << 1), GREEN(1 << 2);
 *     private final int value;
 *     Aspect(int value) { this.value = value; }
 *     @Override public int value() { return value; }
 * }
 * }</pre>
 */
public interface BitFlag
{
    /**
     * Returns the underlying integer of this flag constant.
     *
     * @return the flag bits
     */
    int value();
}

package com.questrail.enumbits.arith;

import com.questrail.enumbits.api.BitFlag;

import java.util.Objects;

/**
 * Flags
 * -----------------------------------------------------------------------------
 * Test and toggle helpers for {@link BitFlag} combinations.
 */
public final class Flags
{
    private Flags() {}

    /**
     * Checks whether flag {@code y} is present in combination {@code x}.
     *
     * @param x the combination to check
     * @param y the flag (or flags) to look for
     * @return {@code true} iff {@code (x & y) == y}
     */
    public static <E extends Enum<E> & BitFlag> boolean hasFlag(FlagMask<E> x, FlagMask<E> y) {
        Objects.requireNonNull(y, "y");
        return x.and(y).value() == y.value();
    }

    public static <E extends Enum<E> & BitFlag> boolean hasFlag(FlagMask<E> x, E y) {
        return hasFlag(x, FlagMask.of(y));
    }

    /**
     * Toggles flag {@code y} in {@code x}: clears it when present, sets it
     * otherwise.
     * <p>
     * The current value of {@code x} is tested exactly once.
     *
     * @param x the variable to change
     * @param y the flag (or flags) to toggle
     */
    public static <E extends Enum<E> & BitFlag> void toggleFlag(FlagVariable<E> x, FlagMask<E> y) {
        Objects.requireNonNull(x, "x");
        if (hasFlag(x.get(), y)) {
            x.andAssign(y.not());
        } else {
            x.orAssign(y);
        }
    }

    public static <E extends Enum<E> & BitFlag> void toggleFlag(FlagVariable<E> x, E y) {
        toggleFlag(x, FlagMask.of(y));
    }
}

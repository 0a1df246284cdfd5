package com.questrail.enumbits.api;

/**
 * Addable
 * -----------------------------------------------------------------------------
 * Opt-in interface for an enum whose constants may be added, as numeric
 * offsets, to constants of any other enum.
 *
 * The offset is the constant's ordinal. Enums satisfy {@link #ordinal()}
 * through {@link Enum#ordinal()} and need not implement anything.
 *
 * Example: a {@code Kind} enum offsetting an index-style {@code Slot} enum,
 * {@code EnumArithmetic.add(Slot.FIRST, Kind.SECONDARY)}.
 */
public interface Addable
{
    /**
     * Returns the offset carried by this constant.
     *
     * @return the 0-based ordinal
     */
    int ordinal();
}

package com.questrail.enumbits.mapping;

import com.questrail.enumbits.api.StorageType;

import java.util.Objects;

/**
 * BitLayout
 * -----------------------------------------------------------------------------
 * {@code BitLayout} defines how the constants of one enum map onto the bits of
 * a single fixed-width storage word.
 *
 * <h2>Why this exists</h2>
 * An enum bit-set is parameterised by three things: the enum it ranges over,
 * the storage word that holds it, and the exclusive upper bound of the values
 * it may hold. Gathering them into one immutable object lets every bit-set
 * over the same universe share them, and keeps the enum-to-bit mapping in one
 * place.
 *
 * <h2>Position Semantics</h2>
 * The position returned by {@link #positionOf(Enum)} is always:
 * <ul>
 *   <li>the constant's ordinal (its underlying value)</li>
 *   <li>strictly below {@link #endValue()}</li>
 *   <li>stable for the lifetime of the layout</li>
 * </ul>
 *
 * Every operation that touches a bit for an enum constant must obtain the bit
 * position here and nowhere else.
 *
 * <h2>Mask</h2>
 * {@link #mask()} has exactly the low {@link #endValue()} bits set. A raw word
 * is valid for the layout iff it has no bit outside the mask.
 */
public interface BitLayout<E extends Enum<E>>
{
    /**
     * Returns the enum type this layout ranges over.
     */
    Class<E> enumType();

    /**
     * Returns the storage word that holds bit-sets of this layout.
     */
    StorageType storage();

    /**
     * Returns the exclusive upper bound of storable positions.
     *
     * @return a value in {@code 0..storage().digits()}
     */
    int endValue();

    /**
     * Returns the mask of valid bits.
     *
     * @return {@code storage().max() >>> (digits - endValue())}
     */
    long mask();

    /**
     * Returns the bit position of the given constant.
     *
     * @param value enum constant
     * @return 0-based bit position
     * @throws IllegalArgumentException if the constant lies at or beyond the
     *         end value
     */
    int positionOf(E value);

    /**
     * Returns the number of declared constants that are storable, i.e. the
     * smaller of {@link #endValue()} and the number of declared constants.
     */
    int size();

    /**
     * Reverse lookup: returns the constant stored at the given position.
     *
     * @param position 0-based bit position
     * @return the enum constant
     * @throws IndexOutOfBoundsException if {@code position} is not below {@link #size()}
     */
    E constantAt(int position);

    /**
     * Returns {@code true} if the given raw word has no bits outside
     * {@link #mask()}.
     * <p>
     * Intended for words read from untrusted storage before they are turned
     * into bit-sets, since construction from a raw word silently drops
     * out-of-range bits.
     */
    default boolean isValid(long raw) {
        return (raw & mask()) == raw;
    }

    /**
     * Returns {@code true} if the given constant can be stored in this layout.
     */
    default boolean contains(E value) {
        Objects.requireNonNull(value, "value");
        return value.ordinal() < size();
    }
}

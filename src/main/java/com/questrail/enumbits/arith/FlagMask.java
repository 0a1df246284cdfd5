package com.questrail.enumbits.arith;

import com.questrail.enumbits.api.BitFlag;

import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

/**
 * FlagMask
 * -----------------------------------------------------------------------------
 * An immutable combination of {@link BitFlag} constants, held as the integer
 * that bitwise operators on the constants' underlying values produce.
 *
 * <h2>Why this type exists</h2>
 * A Java enum cannot hold a value that is not one of its declared constants,
 * so {@code RED | GREEN} has no enum representation. {@code FlagMask} is that
 * value: typed by the flag enum, so masks of different flag enums cannot be
 * mixed, and convertible back with {@link #asConstant()} whenever the bits
 * match a declared constant.
 *
 * <h2>Operators</h2>
 * <pre>
 *   a | b   → a.or(b)
 *   a &amp; b   → a.and(b)
 *   a ^ b   → a.xor(b)
 *   ~a      → a.not()
 * </pre>
 * Each converts both operands to their underlying integers, applies the
 * integer operator and wraps the result. {@link #not()} complements all 32
 * bits, as the integer operator does.
 */
public final class FlagMask<E extends Enum<E> & BitFlag>
{
    private final Class<E> flagType;
    private final int value;

    private FlagMask(Class<E> flagType, int value) {
        this.flagType = flagType;
        this.value = value;
    }

    /**
     * Returns the empty combination of the given flag enum.
     */
    public static <E extends Enum<E> & BitFlag> FlagMask<E> none(Class<E> flagType) {
        return new FlagMask<>(Objects.requireNonNull(flagType, "flagType"), 0);
    }

    /**
     * Wraps a raw underlying value as a combination of the given flag enum.
     * <p>
     * The value is taken as-is; bits that no declared constant uses are kept.
     */
    public static <E extends Enum<E> & BitFlag> FlagMask<E> ofValue(Class<E> flagType, int value) {
        return new FlagMask<>(Objects.requireNonNull(flagType, "flagType"), value);
    }

    public static <E extends Enum<E> & BitFlag> FlagMask<E> of(E flag) {
        Objects.requireNonNull(flag, "flag");
        return new FlagMask<>(flag.getDeclaringClass(), flag.value());
    }

    @SafeVarargs
    public static <E extends Enum<E> & BitFlag> FlagMask<E> of(E first, E... rest) {
        Objects.requireNonNull(rest, "rest");
        FlagMask<E> mask = of(first);
        for (E flag : rest) {
            mask = mask.or(flag);
        }
        return mask;
    }

    public FlagMask<E> or(FlagMask<E> other) {
        return withValue(value | requireSameType(other).value);
    }

    public FlagMask<E> or(E flag) {
        return or(of(flag));
    }

    public FlagMask<E> and(FlagMask<E> other) {
        return withValue(value & requireSameType(other).value);
    }

    public FlagMask<E> and(E flag) {
        return and(of(flag));
    }

    public FlagMask<E> xor(FlagMask<E> other) {
        return withValue(value ^ requireSameType(other).value);
    }

    public FlagMask<E> xor(E flag) {
        return xor(of(flag));
    }

    public FlagMask<E> not() {
        return withValue(~value);
    }

    /**
     * Returns {@code true} if every bit of {@code flag} is present in this
     * combination.
     *
     * @see Flags#hasFlag(FlagMask, FlagMask)
     */
    public boolean contains(E flag) {
        return Flags.hasFlag(this, of(flag));
    }

    public boolean isEmpty() {
        return value == 0;
    }

    /**
     * Converts this combination back to a declared constant.
     *
     * @return the first declared constant whose {@link BitFlag#value()} equals
     *         these bits, or {@link Optional#empty()} if none does
     */
    public Optional<E> asConstant() {
        return Arrays.stream(flagType.getEnumConstants())
                .filter(c -> c.value() == value)
                .findFirst();
    }

    /**
     * Returns the underlying integer of this combination.
     */
    public int value() {
        return value;
    }

    public Class<E> flagType() {
        return flagType;
    }

    private FlagMask<E> withValue(int newValue) {
        return newValue == value ? this : new FlagMask<>(flagType, newValue);
    }

    private FlagMask<E> requireSameType(FlagMask<E> other) {
        Objects.requireNonNull(other, "other");
        if (other.flagType != flagType) {
            throw new IllegalArgumentException(
                    "Cannot combine " + flagType.getSimpleName()
                            + " flags with " + other.flagType.getSimpleName() + " flags");
        }
        return other;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FlagMask<?> that)) return false;
        return value == that.value && flagType == that.flagType;
    }

    @Override
    public int hashCode() {
        return Objects.hash(flagType, value);
    }

    @Override
    public String toString() {
        return flagType.getSimpleName() + "[0x" + Integer.toHexString(value) + "]";
    }
}

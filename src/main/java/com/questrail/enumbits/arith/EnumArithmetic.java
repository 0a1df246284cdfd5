package com.questrail.enumbits.arith;

import com.questrail.enumbits.api.Addable;
import com.questrail.enumbits.api.BitFlag;
import com.questrail.enumbits.api.Incrementable;

import java.util.Objects;

/**
 * EnumArithmetic
 * -----------------------------------------------------------------------------
 * Static helpers that let enum constants stand in for small integers:
 * conversion to the underlying value, stepping, and cross-enum offsets.
 *
 * <h2>Underlying Value</h2>
 * The underlying value of an enum constant is its ordinal, except for
 * {@link BitFlag} constants, whose underlying value is the declared
 * {@link BitFlag#value()}. Flag combinations carry their own underlying value,
 * see {@link FlagMask}.
 *
 * Stepping and offsets always move by declaration position (ordinal), which is
 * contiguous and starts at 0.
 *
 * <h2>Capability Gates</h2>
 * <ul>
 *   <li>{@link #next(Enum)} / {@link #previous(Enum)} require {@link Incrementable}</li>
 *   <li>{@link #add(Enum, Enum)} requires the offset enum to be {@link Addable}</li>
 * </ul>
 * An enum that has not opted in is rejected by the compiler.
 *
 * <h2>Range</h2>
 * None of these helpers check the result against the enum's range. A result
 * outside the declared constants is not representable in Java and surfaces as
 * an {@link ArrayIndexOutOfBoundsException} from the constant table. It is
 * never clamped.
 */
public final class EnumArithmetic
{
    private EnumArithmetic() {}

    /**
     * Returns the underlying value of an enum constant.
     *
     * @param value enum constant
     * @return {@link BitFlag#value()} for a flag constant, otherwise the
     *         0-based ordinal
     */
    public static int toUnderlying(Enum<?> value) {
        Objects.requireNonNull(value, "value");
        if (value instanceof BitFlag flag) {
            return flag.value();
        }
        return value.ordinal();
    }

    /**
     * Returns the underlying value of a flag combination.
     *
     * @param mask flag combination
     * @return the combined flag bits
     */
    public static <E extends Enum<E> & BitFlag> int toUnderlying(FlagMask<E> mask) {
        Objects.requireNonNull(mask, "mask");
        return mask.value();
    }

    /**
     * Converts an underlying value back to an enum constant.
     * <p>
     * For a {@link BitFlag} enum this is the first declared constant whose
     * {@link BitFlag#value()} equals {@code value}; otherwise it is the constant
     * at ordinal {@code value}.
     *
     * @param type  enum type
     * @param value underlying value
     * @return the matching constant
     * @throws IllegalArgumentException if no flag constant declares {@code value}
     * @throws ArrayIndexOutOfBoundsException if no constant has that ordinal
     */
    public static <E extends Enum<E>> E fromUnderlying(Class<E> type, int value) {
        Objects.requireNonNull(type, "type");
        E[] constants = type.getEnumConstants();
        if (!BitFlag.class.isAssignableFrom(type)) {
            return constants[value];
        }
        for (E constant : constants) {
            if (((BitFlag) constant).value() == value) {
                return constant;
            }
        }
        throw new IllegalArgumentException(
                type.getSimpleName() + " declares no flag with value 0x" + Integer.toHexString(value));
    }

    /**
     * Returns the constant following {@code value}.
     */
    public static <E extends Enum<E> & Incrementable> E next(E value) {
        return step(value, 1);
    }

    /**
     * Returns the constant preceding {@code value}.
     */
    public static <E extends Enum<E> & Incrementable> E previous(E value) {
        return step(value, -1);
    }

    /**
     * Offsets a constant of any enum by the ordinal of an {@link Addable}
     * constant.
     *
     * @param base   constant to offset
     * @param offset offset constant
     * @return the constant of {@code base}'s type at {@code base + offset}
     */
    public static <E extends Enum<E>, A extends Enum<A> & Addable> E add(E base, A offset) {
        Objects.requireNonNull(base, "base");
        Objects.requireNonNull(offset, "offset");
        return constantAt(base.getDeclaringClass(), base.ordinal() + offset.ordinal());
    }

    private static <E extends Enum<E>> E step(E value, int delta) {
        Objects.requireNonNull(value, "value");
        return constantAt(value.getDeclaringClass(), value.ordinal() + delta);
    }

    private static <E extends Enum<E>> E constantAt(Class<E> type, int ordinal) {
        return type.getEnumConstants()[ordinal];
    }
}

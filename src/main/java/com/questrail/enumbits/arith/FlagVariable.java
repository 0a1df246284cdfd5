package com.questrail.enumbits.arith;

import com.questrail.enumbits.api.BitFlag;

import java.util.Objects;

/**
 * FlagVariable
 * -----------------------------------------------------------------------------
 * A mutable cell holding a {@link FlagMask}, providing the compound assignment
 * forms {@code |=}, {@code &=} and {@code ^=}.
 *
 * Each compound form is {@code value = value.op(other)} and nothing more, so it
 * always agrees with the corresponding binary operator on {@link FlagMask}.
 * Each returns the value now held.
 *
 * This class makes no thread-safety guarantees.
 */
public final class FlagVariable<E extends Enum<E> & BitFlag>
{
    private FlagMask<E> value;

    public FlagVariable(FlagMask<E> initial) {
        this.value = Objects.requireNonNull(initial, "initial");
    }

    public static <E extends Enum<E> & BitFlag> FlagVariable<E> none(Class<E> flagType) {
        return new FlagVariable<>(FlagMask.none(flagType));
    }

    public static <E extends Enum<E> & BitFlag> FlagVariable<E> of(E flag) {
        return new FlagVariable<>(FlagMask.of(flag));
    }

    public FlagMask<E> get() {
        return value;
    }

    public void set(FlagMask<E> value) {
        this.value = Objects.requireNonNull(value, "value");
    }

    public FlagMask<E> orAssign(FlagMask<E> other) {
        value = value.or(other);
        return value;
    }

    public FlagMask<E> orAssign(E flag) {
        return orAssign(FlagMask.of(flag));
    }

    public FlagMask<E> andAssign(FlagMask<E> other) {
        value = value.and(other);
        return value;
    }

    public FlagMask<E> andAssign(E flag) {
        return andAssign(FlagMask.of(flag));
    }

    public FlagMask<E> xorAssign(FlagMask<E> other) {
        value = value.xor(other);
        return value;
    }

    public FlagMask<E> xorAssign(E flag) {
        return xorAssign(FlagMask.of(flag));
    }

    @Override
    public String toString() {
        return "FlagVariable[" + value + "]";
    }
}

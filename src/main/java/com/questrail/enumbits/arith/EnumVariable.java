package com.questrail.enumbits.arith;

import com.questrail.enumbits.api.Incrementable;

import java.util.Objects;

/**
 * EnumVariable
 * -----------------------------------------------------------------------------
 * A mutable cell holding one constant of an {@link Incrementable} enum, giving
 * it the prefix and postfix increment/decrement forms of an integer variable.
 *
 * <ul>
 *   <li>Prefix forms update the cell and return the new value</li>
 *   <li>Postfix forms update the cell and return the old value</li>
 * </ul>
 *
 * Postfix forms are written in terms of the prefix forms. Stepping past either
 * end of the enum throws from {@link EnumArithmetic} and leaves the cell
 * unchanged.
 *
 * This class makes no thread-safety guarantees.
 */
public final class EnumVariable<E extends Enum<E> & Incrementable>
{
    private E value;

    public EnumVariable(E initial) {
        this.value = Objects.requireNonNull(initial, "initial");
    }

    public E get() {
        return value;
    }

    public void set(E value) {
        this.value = Objects.requireNonNull(value, "value");
    }

    public E preIncrement() {
        value = EnumArithmetic.next(value);
        return value;
    }

    public E postIncrement() {
        E original = value;
        preIncrement();
        return original;
    }

    public E preDecrement() {
        value = EnumArithmetic.previous(value);
        return value;
    }

    public E postDecrement() {
        E original = value;
        preDecrement();
        return original;
    }

    @Override
    public String toString() {
        return "EnumVariable[" + value + "]";
    }
}

package com.questrail.enumbits.arith;

import com.questrail.enumbits.api.Addable;
import com.questrail.enumbits.api.Incrementable;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class EnumArithmeticTests
{
    enum Direction implements Incrementable {
        NORTH, EAST, SOUTH, WEST
    }

    enum Slot {
        BASE_0, BASE_1, SPECIAL_0, SPECIAL_1, SPECIAL_2
    }

    enum SlotKind implements Addable {
        BASE, UNUSED, SPECIAL
    }

    @Test
    void underlyingValueIsOrdinal() {
        assertEquals(0, EnumArithmetic.toUnderlying(Direction.NORTH));
        assertEquals(3, EnumArithmetic.toUnderlying(Direction.WEST));
        assertEquals(Direction.SOUTH, EnumArithmetic.fromUnderlying(Direction.class, 2));
    }

    @Test
    void nextAndPreviousStepByOne() {
        assertEquals(Direction.EAST, EnumArithmetic.next(Direction.NORTH));
        assertEquals(Direction.SOUTH, EnumArithmetic.previous(Direction.WEST));
    }

    @Test
    void incrementThenDecrementRestoresInteriorValues() {
        for (Direction d : new Direction[] { Direction.EAST, Direction.SOUTH }) {
            assertEquals(d, EnumArithmetic.previous(EnumArithmetic.next(d)));
            assertEquals(d, EnumArithmetic.next(EnumArithmetic.previous(d)));
        }
    }

    @Test
    void steppingPastEitherEndIsNotClamped() {
        assertThrows(ArrayIndexOutOfBoundsException.class, () -> EnumArithmetic.next(Direction.WEST));
        assertThrows(ArrayIndexOutOfBoundsException.class, () -> EnumArithmetic.previous(Direction.NORTH));
    }

    @Test
    void addableEnumOffsetsAnotherEnum() {
        assertEquals(Slot.BASE_1, EnumArithmetic.add(Slot.BASE_1, SlotKind.BASE));
        assertEquals(Slot.SPECIAL_0, EnumArithmetic.add(Slot.BASE_0, SlotKind.SPECIAL));
        assertEquals(Slot.SPECIAL_2, EnumArithmetic.add(Slot.SPECIAL_1, SlotKind.UNUSED));
        assertThrows(ArrayIndexOutOfBoundsException.class,
                () -> EnumArithmetic.add(Slot.SPECIAL_2, SlotKind.SPECIAL));
    }

    @Test
    void prefixFormsReturnUpdatedValue() {
        EnumVariable<Direction> v = new EnumVariable<>(Direction.NORTH);

        assertEquals(Direction.EAST, v.preIncrement());
        assertEquals(Direction.EAST, v.get());

        assertEquals(Direction.NORTH, v.preDecrement());
        assertEquals(Direction.NORTH, v.get());
    }

    @Test
    void postfixFormsReturnOriginalValue() {
        EnumVariable<Direction> v = new EnumVariable<>(Direction.EAST);

        assertEquals(Direction.EAST, v.postIncrement());
        assertEquals(Direction.SOUTH, v.get());

        assertEquals(Direction.SOUTH, v.postDecrement());
        assertEquals(Direction.EAST, v.get());
    }

    @Test
    void failedStepLeavesVariableUnchanged() {
        EnumVariable<Direction> v = new EnumVariable<>(Direction.WEST);

        assertThrows(ArrayIndexOutOfBoundsException.class, v::postIncrement);
        assertEquals(Direction.WEST, v.get());
    }

    @Test
    void walkingAllValuesWithIncrement() {
        EnumVariable<Direction> v = new EnumVariable<>(Direction.NORTH);
        StringBuilder seen = new StringBuilder();
        for (int i = 0; i < Direction.values().length - 1; i++) {
            seen.append(v.postIncrement()).append(' ');
        }
        seen.append(v.get());

        assertEquals("NORTH EAST SOUTH WEST", seen.toString());
    }
}

package com.questrail.enumbits.core;

import com.questrail.enumbits.mapping.BitLayout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumSet;
import java.util.Iterator;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import java.util.stream.Stream;

/**
 * EnumBitSet
 * -----------------------------------------------------------------------------
 * A type-safe subset of an enum's constants, packed into a single storage word
 * described by a {@link BitLayout}. Methods are loosely modelled on
 * {@code std::bitset}.
 *
 * <h2>Internal Representation</h2>
 * One {@code long} holds the storage word. Constant {@code v} is present iff
 * bit {@code layout.positionOf(v)} is set. Words of narrower storage types use
 * only their low {@code digits} bits.
 *
 * <h2>Validity</h2>
 * No bit outside {@link BitLayout#mask()} is ever set through this API:
 * <ul>
 *   <li>constants at or beyond the end value are rejected by the layout</li>
 *   <li>{@link #fromBase(BitLayout, long)} masks the raw word on entry</li>
 *   <li>{@link #union} and {@link #intersection} mask their results</li>
 * </ul>
 *
 * <h2>Set Algebra</h2>
 * Only union and intersection are offered. A complement would depend on the
 * mask and is left to the caller.
 *
 * <h2>Ordering</h2>
 * Bit-sets compare by storage word as unsigned integers. The order has no
 * meaning beyond making bit-sets usable in sorted collections; it is not the
 * subset order.
 *
 * <h2>Mutability</h2>
 * This class is a mutable value and makes no thread-safety guarantees. Use
 * {@link #copy()} to hand out an independent value.
 */
public final class EnumBitSet<E extends Enum<E>> implements Comparable<EnumBitSet<E>>, Iterable<E>
{
    private static final Logger log = LoggerFactory.getLogger(EnumBitSet.class);

    private final BitLayout<E> layout;
    private long data;

    private EnumBitSet(BitLayout<E> layout, long data) {
        this.layout = layout;
        this.data = data;
    }

    /**
     * Creates an empty bit-set.
     */
    public static <E extends Enum<E>> EnumBitSet<E> empty(BitLayout<E> layout) {
        return new EnumBitSet<>(Objects.requireNonNull(layout, "layout"), 0L);
    }

    /**
     * Creates a bit-set holding exactly one constant.
     */
    public static <E extends Enum<E>> EnumBitSet<E> of(BitLayout<E> layout, E value) {
        return empty(layout).set(value);
    }

    /**
     * Creates a bit-set holding every listed constant. Duplicates are harmless.
     */
    @SafeVarargs
    public static <E extends Enum<E>> EnumBitSet<E> of(BitLayout<E> layout, E... values) {
        Objects.requireNonNull(values, "values");
        EnumBitSet<E> set = empty(layout);
        for (E value : values) {
            set.set(value);
        }
        return set;
    }

    public static <E extends Enum<E>> EnumBitSet<E> of(BitLayout<E> layout, Iterable<E> values) {
        Objects.requireNonNull(values, "values");
        EnumBitSet<E> set = empty(layout);
        for (E value : values) {
            set.set(value);
        }
        return set;
    }

    public static <E extends Enum<E>> EnumBitSet<E> fromEnumSet(BitLayout<E> layout, Set<E> values) {
        return of(layout, values);
    }

    /**
     * Creates a bit-set from a raw storage word.
     * <p>
     * Bits outside the layout's mask are dropped, not rejected. Callers reading
     * words from untrusted storage that need to know about such bits should
     * check {@link BitLayout#isValid(long)} first.
     *
     * @param layout bit layout
     * @param raw    raw storage word
     * @return a bit-set holding {@code raw & mask}
     */
    public static <E extends Enum<E>> EnumBitSet<E> fromBase(BitLayout<E> layout, long raw) {
        Objects.requireNonNull(layout, "layout");
        long masked = raw & layout.mask();
        if (masked != raw && log.isDebugEnabled()) {
            log.debug("Dropped bits 0x{} outside {} from raw word 0x{}",
                    Long.toHexString(raw & ~layout.mask()), layout, Long.toHexString(raw));
        }
        return new EnumBitSet<>(layout, masked);
    }

    /**
     * Adds a constant.
     *
     * @throws IllegalArgumentException if the constant is outside the layout
     */
    public EnumBitSet<E> set(E value) {
        data |= bit(value);
        return this;
    }

    /**
     * Removes a constant.
     *
     * @throws IllegalArgumentException if the constant is outside the layout
     */
    public EnumBitSet<E> reset(E value) {
        data &= ~bit(value);
        return this;
    }

    /**
     * Adds the constant if absent, removes it if present.
     */
    public EnumBitSet<E> flip(E value) {
        if (test(value)) {
            return reset(value);
        } else {
            return set(value);
        }
    }

    /**
     * Returns {@code true} iff the constant is present.
     */
    public boolean test(E value) {
        return (data & bit(value)) != 0;
    }

    /**
     * Returns {@code true} iff every constant present in {@code other} is also
     * present here. Vacuously true for an empty {@code other}.
     */
    public boolean all(EnumBitSet<E> other) {
        requireSameLayout(other);
        return (data & other.data) == other.data;
    }

    /**
     * Returns {@code true} iff this and {@code other} share at least one
     * constant. Always false for an empty {@code other}.
     */
    public boolean any(EnumBitSet<E> other) {
        requireSameLayout(other);
        return (data & other.data) != 0;
    }

    public boolean any() {
        return data != 0;
    }

    public boolean none() {
        return data == 0;
    }

    /**
     * Returns the number of set bits in the storage word.
     */
    public int count() {
        return Long.bitCount(data);
    }

    /**
     * Returns a new bit-set holding the constants of either operand.
     */
    public EnumBitSet<E> union(EnumBitSet<E> other) {
        requireSameLayout(other);
        return new EnumBitSet<>(layout, (data | other.data) & layout.mask());
    }

    /**
     * Returns a new bit-set holding the constants of both operands.
     */
    public EnumBitSet<E> intersection(EnumBitSet<E> other) {
        requireSameLayout(other);
        return new EnumBitSet<>(layout, (data & other.data) & layout.mask());
    }

    /**
     * Returns {@code true} iff no bit outside the layout's mask is set.
     */
    public boolean isValid() {
        return layout.isValid(data);
    }

    /**
     * Returns the raw storage word, for serialization and logging.
     */
    public long base() {
        return data;
    }

    public BitLayout<E> layout() {
        return layout;
    }

    public EnumBitSet<E> copy() {
        return new EnumBitSet<>(layout, data);
    }

    /**
     * Returns the present constants in position order.
     */
    public Stream<E> stream() {
        final long snapshot = data;
        return IntStream.range(0, layout.size())
                .filter(position -> (snapshot & (1L << position)) != 0)
                .mapToObj(layout::constantAt);
    }

    @Override
    public Iterator<E> iterator() {
        return stream().iterator();
    }

    public EnumSet<E> toEnumSet() {
        return stream().collect(Collectors.toCollection(() -> EnumSet.noneOf(layout.enumType())));
    }

    private long bit(E value) {
        return 1L << layout.positionOf(value);
    }

    private void requireSameLayout(EnumBitSet<E> other) {
        Objects.requireNonNull(other, "other");
        if (!layout.equals(other.layout)) {
            throw new IllegalArgumentException(
                    "Bit-set layouts differ: " + layout + " vs " + other.layout);
        }
    }

    @Override
    public int compareTo(EnumBitSet<E> other) {
        requireSameLayout(other);
        return Long.compareUnsigned(data, other.data);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EnumBitSet<?> that)) return false;
        return data == that.data && layout.equals(that.layout);
    }

    @Override
    public int hashCode() {
        return 31 * layout.hashCode() + Long.hashCode(data);
    }

    @Override
    public String toString() {
        return stream()
                .map(Enum::name)
                .collect(Collectors.joining(", ", "{", "}"));
    }
}

package com.questrail.enumbits.mapping;

import com.questrail.enumbits.api.StorageType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * OrdinalBitLayout
 * -----------------------------------------------------------------------------
 * The standard {@link BitLayout}: constant {@code v} lives at bit
 * {@code v.ordinal()} of the storage word.
 *
 * <ul>
 *   <li>Storage defaults to {@link StorageType#UINT64}</li>
 *   <li>The end value defaults to the full width of the storage word</li>
 *   <li>An explicit end value may be given as an integer or as a sentinel
 *       constant (e.g. {@code END}), which is then itself not storable</li>
 * </ul>
 *
 * Example:
 * <pre>{@code
 * static final BitLayout<Direction> DIRECTIONS =
 *         OrdinalBitLayout.builder(Direction.class)
 *                 .withStorage(StorageType.UINT8)
 *                 .withEndValue(Direction.END)
 *                 .build();
 * }</pre>
 */
public final class OrdinalBitLayout<E extends Enum<E>> implements BitLayout<E>
{
    private static final Logger log = LoggerFactory.getLogger(OrdinalBitLayout.class);

    private final Class<E> enumType;
    private final E[] constants;
    private final StorageType storage;
    private final int endValue;
    private final long mask;

    private OrdinalBitLayout(Class<E> enumType, StorageType storage, int endValue) {
        this.enumType = enumType;
        this.constants = enumType.getEnumConstants();
        this.storage = storage;
        this.endValue = endValue;
        this.mask = endValue == 0 ? 0L : storage.max() >>> (storage.digits() - endValue);
    }

    /**
     * Creates a layout spanning the full width of the given storage word.
     */
    public static <E extends Enum<E>> OrdinalBitLayout<E> of(Class<E> enumType, StorageType storage) {
        return builder(enumType).withStorage(storage).build();
    }

    public static <E extends Enum<E>> Builder<E> builder(Class<E> enumType) {
        return new Builder<>(enumType);
    }

    @Override
    public Class<E> enumType() {
        return enumType;
    }

    @Override
    public StorageType storage() {
        return storage;
    }

    @Override
    public int endValue() {
        return endValue;
    }

    @Override
    public long mask() {
        return mask;
    }

    @Override
    public int positionOf(E value) {
        Objects.requireNonNull(value, "value");
        int position = value.ordinal();
        if (position >= endValue) {
            throw new IllegalArgumentException(
                    value + " is outside " + this + " (position " + position + ")");
        }
        return position;
    }

    @Override
    public int size() {
        return Math.min(endValue, constants.length);
    }

    @Override
    public E constantAt(int position) {
        if (position < 0 || position >= size()) {
            throw new IndexOutOfBoundsException("position=" + position + ", size=" + size());
        }
        return constants[position];
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof OrdinalBitLayout<?> that)) return false;
        return enumType == that.enumType
                && storage == that.storage
                && endValue == that.endValue;
    }

    @Override
    public int hashCode() {
        return Objects.hash(enumType, storage, endValue);
    }

    @Override
    public String toString() {
        return "OrdinalBitLayout[" + enumType.getSimpleName()
                + ", " + storage + ", end=" + endValue + "]";
    }

    public static final class Builder<E extends Enum<E>>
    {
        private final Class<E> enumType;
        private StorageType storage = StorageType.UINT64;
        private Integer endValue;

        private Builder(Class<E> enumType) {
            this.enumType = Objects.requireNonNull(enumType, "enumType");
        }

        public Builder<E> withStorage(StorageType storage) {
            this.storage = Objects.requireNonNull(storage, "storage");
            return this;
        }

        /**
         * Sets the exclusive upper bound of storable positions.
         */
        public Builder<E> withEndValue(int endValue) {
            this.endValue = endValue;
            return this;
        }

        /**
         * Sets the exclusive upper bound to the ordinal of a sentinel constant.
         */
        public Builder<E> withEndValue(E sentinel) {
            this.endValue = Objects.requireNonNull(sentinel, "sentinel").ordinal();
            return this;
        }

        public OrdinalBitLayout<E> build() {
            int digits = storage.digits();
            int declared = enumType.getEnumConstants().length;
            int end;
            if (endValue == null) {
                if (declared > digits) {
                    throw new BitLayoutException(
                            enumType.getSimpleName() + " declares " + declared
                                    + " constants but " + storage + " holds only " + digits
                                    + " bits; use a wider storage type or an explicit end value");
                }
                end = digits;
            } else {
                end = endValue;
                if (end < 0 || end > digits) {
                    throw new BitLayoutException(
                            "End value for " + enumType.getSimpleName() + " must be in range 0–"
                                    + digits + " for " + storage + " (was " + end + ")");
                }
            }

            OrdinalBitLayout<E> layout = new OrdinalBitLayout<>(enumType, storage, end);
            log.debug("Built {} with mask 0x{}", layout, Long.toHexString(layout.mask()));
            return layout;
        }
    }
}

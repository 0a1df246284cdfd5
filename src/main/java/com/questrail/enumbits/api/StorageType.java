package com.questrail.enumbits.api;

/**
 * StorageType
 * -----------------------------------------------------------------------------
 * {@code StorageType} names the unsigned integer word that backs an enum
 * bit-set. Java has no unsigned primitives, so every word is held in a
 * {@code long} and interpreted as unsigned within {@link #digits()} bits.
 *
 * <h2>The Four Widths</h2>
 * <ul>
 *   <li>{@link #UINT8}  – 8 value bits</li>
 *   <li>{@link #UINT16} – 16 value bits</li>
 *   <li>{@link #UINT32} – 32 value bits</li>
 *   <li>{@link #UINT64} – 64 value bits (the whole {@code long})</li>
 * </ul>
 *
 * <h2>Byte Order and Encoding</h2>
 * A storage type says nothing about byte order or wire width. Those are the
 * concern of whatever serializes the raw word.
 */
public enum StorageType
{
    UINT8(8),
    UINT16(16),
    UINT32(32),
    UINT64(64);

    private final int digits;

    StorageType(int digits) {
        this.digits = digits;
    }

    /**
     * Returns the number of value bits in this storage word.
     *
     * @return 8, 16, 32 or 64
     */
    public int digits() {
        return digits;
    }

    /**
     * Returns the all-ones value of this storage word.
     *
     * @return the maximum unsigned value, held in a {@code long}
     */
    public long max() {
        return digits == Long.SIZE ? -1L : (1L << digits) - 1;
    }
}

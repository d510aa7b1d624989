package org.Aayush.pivot.grid;

/**
 * Fixed-capacity bit array packed into 64-bit words.
 * <p>
 * Every position in {@code [0, length)} maps to exactly one bit. Reads and writes outside
 * that range are programmer errors and fail fast with {@link IndexOutOfBoundsException};
 * the array never grows.
 * </p>
 * <p>
 * <strong>Thread Safety:</strong> This class is NOT thread-safe. Concurrent readers are
 * safe only while no writer is active.
 * </p>
 */
public final class BitArray {

    private static final int WORD_SHIFT = 6;
    private static final int WORD_MASK = 63;

    private final long[] words;
    private final int length;

    /**
     * Creates a cleared bit array.
     *
     * @param length number of addressable bits. Must be non-negative.
     * @throws IllegalArgumentException if length is negative.
     */
    public BitArray(int length) {
        if (length < 0) {
            throw new IllegalArgumentException("length must be non-negative, got " + length);
        }
        this.length = length;
        this.words = new long[(length + WORD_MASK) >>> WORD_SHIFT];
    }

    /**
     * Sets the bit at {@code position}.
     */
    public void set(int position) {
        checkIndex(position);
        words[position >>> WORD_SHIFT] |= 1L << (position & WORD_MASK);
    }

    /**
     * Clears the bit at {@code position}.
     */
    public void clear(int position) {
        checkIndex(position);
        words[position >>> WORD_SHIFT] &= ~(1L << (position & WORD_MASK));
    }

    /**
     * Flips the bit at {@code position}.
     */
    public void toggle(int position) {
        checkIndex(position);
        words[position >>> WORD_SHIFT] ^= 1L << (position & WORD_MASK);
    }

    /**
     * Writes a boolean value at {@code position}.
     */
    public void set(int position, boolean value) {
        if (value) {
            set(position);
        } else {
            clear(position);
        }
    }

    /**
     * Reads the bit at {@code position}.
     *
     * @return {@code true} if the bit is set.
     * @throws IndexOutOfBoundsException if position is outside {@code [0, length)}.
     */
    public boolean get(int position) {
        checkIndex(position);
        return (words[position >>> WORD_SHIFT] & (1L << (position & WORD_MASK))) != 0L;
    }

    /**
     * @return number of addressable bits.
     */
    public int length() {
        return length;
    }

    /**
     * @return number of set bits.
     */
    public int cardinality() {
        int count = 0;
        for (long word : words) {
            count += Long.bitCount(word);
        }
        return count;
    }

    private void checkIndex(int position) {
        if (position < 0 || position >= length) {
            throw new IndexOutOfBoundsException(
                    "bit index " + position + " out of range [0, " + length + ")"
            );
        }
    }
}

package software.amazon.ahocorasick;

import javax.annotation.concurrent.NotThreadSafe;

import java.util.Arrays;

/**
 * The outgoing trie edges of one automaton state: a primitive map from a code point to the index of the child state.
 * Keys and values may only be non-negative. Entries are never removed since the trie only grows while it is built.
 */
@NotThreadSafe
final class TransitionMap {

    // taken from FastUtil
    private static final int INT_PHI = 0x9E3779B9;

    private static final long KEY_MASK = 0xFFFFFFFFL;
    private static final long EMPTY_CELL = -1 & KEY_MASK;

    static final int NO_VALUE = -1;
    private static final float DEFAULT_LOAD_FACTOR = 0.75f;

    /**
     * Most states have one or two children, so start small. Capacity of 4 with data type long is half a cache line.
     */
    private static final int DEFAULT_INITIAL_CAPACITY = 4;

    /**
     * Holds code point to state pairs. The highest 32 bits hold the state index, and the lowest 32 bits hold the code
     * point. Must always have a length that is a power of two so that {@link #mask} can be computed correctly.
     */
    private long[] table;

    private final float loadFactor;

    /**
     * We will resize once the map reaches this size.
     */
    private int threshold;

    private int size;

    /**
     * Mask to calculate the position in the table for a code point.
     */
    private int mask;

    TransitionMap() {
        this(DEFAULT_INITIAL_CAPACITY, DEFAULT_LOAD_FACTOR);
    }

    TransitionMap(final int initialCapacity, final float loadFactor) {
        if (loadFactor <= 0 || loadFactor >= 1) {
            throw new IllegalArgumentException("loadFactor must be in (0, 1)");
        }
        if (initialCapacity <= 0) {
            throw new IllegalArgumentException("initialCapacity must be positive");
        }
        if (Integer.bitCount(initialCapacity) != 1) {
            throw new IllegalArgumentException("initialCapacity must be a power of two");
        }
        this.mask = initialCapacity - 1;
        this.loadFactor = loadFactor;
        this.table = makeTable(initialCapacity);
        this.threshold = (int) (initialCapacity * loadFactor);
    }

    /**
     * Gets the state reached on {@code codePoint}.
     *
     * @param codePoint the non-negative symbol
     * @return the child state index, or {@link #NO_VALUE} if there is no edge for {@code codePoint}
     */
    int get(final int codePoint) {
        int idx = getStartIndex(codePoint);
        do {
            long cell = table[idx];
            if (cell == EMPTY_CELL) {
                return NO_VALUE;
            }
            if (((int) (cell & KEY_MASK)) == codePoint) {
                return (int) (cell >> 32);
            }
            idx = getNextIndex(idx);
        } while (true);
    }

    /**
     * Adds an edge from {@code codePoint} to {@code state}, replacing any existing edge for the same code point.
     *
     * @param codePoint the non-negative symbol
     * @param state the non-negative child state index
     * @return the state previously reached on {@code codePoint}, or {@link #NO_VALUE} if there was none
     * @throws IllegalArgumentException if either argument is negative
     */
    int put(final int codePoint, final int state) {
        if (codePoint < 0) {
            throw new IllegalArgumentException("codePoint cannot be negative");
        }
        if (state < 0) {
            throw new IllegalArgumentException("state cannot be negative");
        }
        long cellToPut = (((long) codePoint) & KEY_MASK) | (((long) state) << 32);
        int idx = getStartIndex(codePoint);
        do {
            long cell = table[idx];
            if (cell == EMPTY_CELL) {
                table[idx] = cellToPut;
                if (size >= threshold) {
                    rehash(table.length * 2);
                    // 'size' is set inside rehash()
                } else {
                    size++;
                }
                return NO_VALUE;
            }
            if (((int) (cell & KEY_MASK)) == codePoint) {
                table[idx] = cellToPut;
                return (int) (cell >> 32);
            }
            idx = getNextIndex(idx);
        } while (true);
    }

    int size() {
        return size;
    }

    boolean isEmpty() {
        return size == 0;
    }

    /**
     * Returns the code points that have an edge, in ascending order. Used to visit children in a stable order.
     *
     * @return a new array of the code points held by this map
     */
    int[] keys() {
        int[] keys = new int[size];
        int i = 0;
        for (long cell : table) {
            if (cell != EMPTY_CELL) {
                keys[i++] = (int) (cell & KEY_MASK);
            }
        }
        Arrays.sort(keys);
        return keys;
    }

    private void rehash(final int newCapacity) {
        threshold = (int) (newCapacity * loadFactor);
        mask = newCapacity - 1;

        final long[] oldTable = table;

        table = makeTable(newCapacity);
        size = 0;

        for (int i = oldTable.length - 1; i >= 0; i--) {
            if (oldTable[i] != EMPTY_CELL) {
                put((int) (oldTable[i] & KEY_MASK), (int) (oldTable[i] >> 32));
            }
        }
    }

    private static long[] makeTable(final int capacity) {
        long[] result = new long[capacity];
        Arrays.fill(result, EMPTY_CELL);
        return result;
    }

    private int getStartIndex(final int codePoint) {
        return phiMix(codePoint) & mask;
    }

    private int getNextIndex(final int currentIndex) {
        return (currentIndex + 1) & mask;
    }

    private static int phiMix(final int val) {
        final int h = val * INT_PHI;
        return h ^ (h >> 16);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("{");
        for (int codePoint : keys()) {
            if (sb.length() > 1) {
                sb.append(", ");
            }
            sb.appendCodePoint(codePoint).append("->").append(get(codePoint));
        }
        return sb.append('}').toString();
    }
}

/*
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package ai.lzw.codec;

import java.util.Arrays;

/**
 * Open addressing map from a phrase key to its code.
 * A phrase of two or more symbols is keyed by the code of its prefix and the code of its last
 * symbol, which identifies it uniquely since every prefix of a stored phrase is stored too.
 */
final class PhraseTable
{
    private static final long EMPTY = -1L;
    private static final int MIN_CAPACITY = 16;
    private static final int MAX_CAPACITY = 1 << 30;

    private final int maxCapacity;
    private long[] keys;
    private int[] values;
    private int mask;
    private int size;

    PhraseTable(int expectedSize)
    {
        this(expectedSize, MAX_CAPACITY);
    }

    PhraseTable(int expectedSize, int maxCapacity)
    {
        this.maxCapacity = maxCapacity;
        int capacity = MIN_CAPACITY;
        while (capacity < expectedSize * 2L && capacity < maxCapacity) {
            capacity <<= 1;
        }
        allocate(capacity);
    }

    static long key(int prefixCode, int symbolCode)
    {
        return ((long) prefixCode << 32) | (symbolCode & 0xFFFF_FFFFL);
    }

    /**
     * @return the code stored for {@code key}, or -1
     */
    int get(long key)
    {
        int slot = slot(key);
        while (keys[slot] != EMPTY) {
            if (keys[slot] == key) {
                return values[slot];
            }
            slot = (slot + 1) & mask;
        }
        return -1;
    }

    /**
     * Stores {@code code} under {@code key} unless the key is present.
     *
     * @return the code already stored for {@code key}, or -1 if {@code code} was inserted
     * @throws CapacityExceededException if the table is at its maximum capacity and half full
     */
    int putIfAbsent(long key, int code)
    {
        int slot = slot(key);
        while (keys[slot] != EMPTY) {
            if (keys[slot] == key) {
                return values[slot];
            }
            slot = (slot + 1) & mask;
        }
        if ((size + 1) * 2L > keys.length) {
            if (keys.length >= maxCapacity) {
                throw new CapacityExceededException(size + 1L, "Phrase table is full");
            }
            rehash();
            slot = slot(key);
            while (keys[slot] != EMPTY) {
                slot = (slot + 1) & mask;
            }
        }
        keys[slot] = key;
        values[slot] = code;
        size++;
        return -1;
    }

    private int slot(long key)
    {
        long hash = key * 0x9E3779B97F4A7C15L;
        return (int) (hash ^ (hash >>> 32)) & mask;
    }

    private void allocate(int capacity)
    {
        keys = new long[capacity];
        values = new int[capacity];
        Arrays.fill(keys, EMPTY);
        mask = capacity - 1;
    }

    private void rehash()
    {
        long[] oldKeys = keys;
        int[] oldValues = values;
        allocate(oldKeys.length * 2);
        for (int i = 0; i < oldKeys.length; i++) {
            if (oldKeys[i] != EMPTY) {
                int slot = slot(oldKeys[i]);
                while (keys[slot] != EMPTY) {
                    slot = (slot + 1) & mask;
                }
                keys[slot] = oldKeys[i];
                values[slot] = oldValues[i];
            }
        }
    }
}

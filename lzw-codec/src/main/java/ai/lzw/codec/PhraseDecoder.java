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

import static ai.lzw.codec.Util.fail;
import static ai.lzw.codec.Util.verify;

/**
 * Rebuilds the symbol sequence from LZW codes, growing the phrase dictionary exactly as the
 * encoder did.
 * <p>
 * Phrases are stored as a link to their prefix phrase plus their last symbol, so adding an entry
 * is constant time and a phrase is written out back to front.
 */
final class PhraseDecoder
{
    private static final int NO_PREFIX = -1;

    private final BaseDictionary base;

    PhraseDecoder(BaseDictionary base)
    {
        this.base = base;
    }

    int[] decode(int[] codes, int count)
    {
        if (count == 0) {
            return new int[0];
        }

        int baseSize = base.size();
        // every code after the first adds exactly one phrase
        int capacity = baseSize + count - 1;

        int[] prefix = new int[capacity];
        int[] last = new int[capacity];
        int[] first = new int[capacity];
        int[] lengths = new int[capacity];

        Arrays.fill(prefix, 0, baseSize, NO_PREFIX);
        Arrays.fill(lengths, 0, baseSize, 1);
        base.copySymbols(last);
        base.copySymbols(first);
        int size = baseSize;

        int code = codes[0];
        verify(code >= 0 && code < baseSize, 0, "First code " + code + " is not a base code");

        int[] output = new int[Math.max(16, count * 2)];
        int outputSize = 0;

        output = ensureCapacity(output, outputSize, 1);
        output[outputSize++] = last[code];
        int previous = code;

        for (int i = 1; i < count; i++) {
            code = codes[i];
            if (code < 0 || code > size) {
                throw fail(i, "Code " + code + " is beyond the dictionary of size " + size);
            }

            // code == size is the phrase being defined by this very step: previous + its own first symbol
            int firstSymbol = code < size ? first[code] : first[previous];

            prefix[size] = previous;
            last[size] = firstSymbol;
            first[size] = first[previous];
            lengths[size] = lengths[previous] + 1;
            size++;

            int length = lengths[code];
            output = ensureCapacity(output, outputSize, length);
            int entry = code;
            for (int position = outputSize + length - 1; position >= outputSize; position--) {
                output[position] = last[entry];
                entry = prefix[entry];
            }
            outputSize += length;

            previous = code;
        }

        return Arrays.copyOf(output, outputSize);
    }

    private static int[] ensureCapacity(int[] buffer, int size, int needed)
    {
        long required = (long) size + needed;
        if (required <= buffer.length) {
            return buffer;
        }
        if (required > Integer.MAX_VALUE - 8) {
            throw new CapacityExceededException(required, "Decoded output too large");
        }
        long grown = Math.max(required, Math.min((long) buffer.length * 2, Integer.MAX_VALUE - 8));
        return Arrays.copyOf(buffer, (int) grown);
    }
}

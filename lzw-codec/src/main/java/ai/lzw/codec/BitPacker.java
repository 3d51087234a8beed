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

import ai.lzw.alphabet.SymbolDictionary;

import static ai.lzw.codec.Util.MAX_BIT_DEPTH;
import static ai.lzw.codec.Util.checkArgument;
import static ai.lzw.codec.Util.mask;

/**
 * Writes fixed width codes into pack alphabet symbols carrying {@code capacity} bits each.
 * <p>
 * Output layout: {@code [bitDepth][deadBits][payload...]}. The two header values are stored as
 * pack alphabet indices. Codes are laid out least significant bit first and span symbol
 * boundaries freely; the last symbol is zero padded and {@code deadBits} counts that padding.
 * <pre>
 * depth=11, capacity=8:
 * [11111111][22222111][33222222][33333333][.......3]
 * </pre>
 */
final class BitPacker
{
    static final int HEADER_SIZE = 2;

    private final SymbolDictionary pack;
    private final int capacity;

    BitPacker(SymbolDictionary pack, int capacity)
    {
        this.pack = pack;
        this.capacity = capacity;
    }

    /**
     * @return number of pack symbols needed for {@code count} codes of {@code bitDepth} bits, header included
     */
    long packedLength(int count, int bitDepth)
    {
        return HEADER_SIZE + payloadLength(count, bitDepth);
    }

    private long payloadLength(int count, int bitDepth)
    {
        long bits = (long) count * bitDepth;
        return (bits + capacity - 1) / capacity;
    }

    int[] pack(int[] codes, int count, int bitDepth)
    {
        checkArgument(count > 0, "Nothing to pack");
        checkArgument(bitDepth >= 1 && bitDepth <= MAX_BIT_DEPTH, "Bit depth must be in [1, " + MAX_BIT_DEPTH + "]: " + bitDepth);

        long payloadLength = payloadLength(count, bitDepth);
        checkArgument(payloadLength + HEADER_SIZE <= Integer.MAX_VALUE - 8, "Packed output too large: " + payloadLength + " symbols");
        int deadBits = (int) (payloadLength * capacity - (long) count * bitDepth);

        int[] output = new int[(int) payloadLength + HEADER_SIZE];
        int outputSize = 0;
        output[outputSize++] = pack.symbolByIndex(bitDepth);
        output[outputSize++] = pack.symbolByIndex(deadBits);

        long codeMask = mask(bitDepth);
        long symbolMask = mask(capacity);

        // less than capacity bits are held between codes, so a code always fits
        long container = 0;
        int bitCount = 0;
        for (int i = 0; i < count; i++) {
            int code = codes[i];
            checkArgument((code & ~codeMask) == 0, "Code " + code + " does not fit in " + bitDepth + " bits");

            container |= (code & codeMask) << bitCount;
            bitCount += bitDepth;

            while (bitCount >= capacity) {
                output[outputSize++] = pack.symbolByIndex(container & symbolMask);
                container >>>= capacity;
                bitCount -= capacity;
            }
        }

        if (bitCount > 0) {
            output[outputSize++] = pack.symbolByIndex(container);
        }

        return output;
    }
}

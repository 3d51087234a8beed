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
import ai.lzw.alphabet.SymbolOutOfRangeException;
import ai.lzw.compress.MalformedInputException;

import java.util.Arrays;

import static ai.lzw.codec.BitPacker.HEADER_SIZE;
import static ai.lzw.codec.Util.MAX_BIT_DEPTH;
import static ai.lzw.codec.Util.mask;
import static ai.lzw.codec.Util.verify;

/**
 * Reads back the codes written by {@link BitPacker}.
 * <p>
 * The stream ends at the first code boundary where no symbols are left and the unread bits of
 * the last symbol are exactly the {@code deadBits} announced in the header. The number of codes
 * read must then match what the header and payload length imply.
 */
final class BitUnpacker
{
    private final SymbolDictionary pack;
    private final int capacity;

    BitUnpacker(SymbolDictionary pack, int capacity)
    {
        this.pack = pack;
        this.capacity = capacity;
    }

    int[] unpack(int[] input, int offset, int length)
    {
        verify(length > HEADER_SIZE, offset + length, "Packed stream too short: " + length + " symbols");

        int bitDepth = headerValue(input, offset);
        verify(bitDepth >= 1 && bitDepth <= MAX_BIT_DEPTH, offset, "Invalid bit depth " + bitDepth);
        int deadBits = headerValue(input, offset + 1);
        verify(deadBits < capacity, offset + 1, "Invalid dead bit count " + deadBits + " for " + capacity + " bit symbols");

        int payloadLength = length - HEADER_SIZE;
        long payloadBits = (long) payloadLength * capacity - deadBits;
        verify(payloadBits % bitDepth == 0, offset + 1, "Payload of " + payloadBits + " bits is not a whole number of " + bitDepth + " bit codes");
        long expectedCount = payloadBits / bitDepth;
        verify(expectedCount <= Integer.MAX_VALUE - 8, offset, "Too many codes: " + expectedCount);

        int[] codes = new int[(int) expectedCount];
        int count = 0;

        long codeMask = mask(bitDepth);
        int position = offset + HEADER_SIZE;
        int limit = offset + length;

        long container = 0;
        int bitCount = 0;
        while (true) {
            if (position == limit && bitCount == deadBits) {
                break;
            }

            while (bitCount < bitDepth && position < limit) {
                container |= (long) payloadValue(input, position++) << bitCount;
                bitCount += capacity;
            }
            if (bitCount < bitDepth) {
                // partial code at the end of the stream is padding
                break;
            }

            verify(count < codes.length, position, "More codes than announced by the header");
            codes[count++] = (int) (container & codeMask);
            container >>>= bitDepth;
            bitCount -= bitDepth;
        }

        verify(count == expectedCount, limit, "Decoded " + count + " codes, header announced " + expectedCount);
        return count == codes.length ? codes : Arrays.copyOf(codes, count);
    }

    private int headerValue(int[] input, int position)
    {
        try {
            return pack.indexOfSymbol(input[position]);
        }
        catch (SymbolOutOfRangeException e) {
            throw new MalformedInputException(position, "Symbol " + input[position] + " is not in the pack alphabet", e);
        }
    }

    private int payloadValue(int[] input, int position)
    {
        int index = headerValue(input, position);
        verify(index >>> capacity == 0, position, "Symbol " + input[position] + " carries more than " + capacity + " bits");
        return index;
    }
}

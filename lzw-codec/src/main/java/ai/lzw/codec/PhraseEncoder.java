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

import static ai.lzw.codec.Util.MAX_BIT_DEPTH;
import static ai.lzw.codec.Util.log2Ceil;

/**
 * Turns a symbol sequence into LZW codes, building the phrase dictionary as it goes.
 * <p>
 * The input is consumed left to right, extending the current phrase greedily while the
 * extension is already known. The first unknown extension is added under the next free code,
 * the code of the current phrase is emitted, and matching restarts from the new symbol.
 */
final class PhraseEncoder
{
    private final BaseDictionary base;

    PhraseEncoder(BaseDictionary base)
    {
        this.base = base;
    }

    EncodedCodes encode(int[] symbols, int offset, int length)
    {
        if (length == 0) {
            return EncodedCodes.EMPTY;
        }

        PhraseTable table = new PhraseTable(Math.min(length, 1 << 20));
        int nextCode = base.size();

        // at most one code per input symbol
        int[] codes = new int[length];
        int count = 0;
        int maxCode = 0;

        int phrase = base.codeOf(symbols[offset]);
        int limit = offset + length;
        for (int i = offset + 1; i < limit; i++) {
            int symbol = base.codeOf(symbols[i]);
            long key = PhraseTable.key(phrase, symbol);

            int extended = table.get(key);
            if (extended >= 0) {
                phrase = extended;
                continue;
            }

            if (nextCode == Integer.MAX_VALUE) {
                throw new CapacityExceededException(nextCode, "Phrase dictionary is full");
            }
            table.putIfAbsent(key, nextCode++);

            codes[count++] = phrase;
            maxCode = Math.max(maxCode, phrase);
            phrase = symbol;
        }

        codes[count++] = phrase;
        maxCode = Math.max(maxCode, phrase);

        int bitDepth = log2Ceil((long) maxCode + 1);
        if (bitDepth > MAX_BIT_DEPTH) {
            throw new CapacityExceededException(bitDepth, "Bit depth exceeds " + MAX_BIT_DEPTH + " bits");
        }
        return new EncodedCodes(codes, count, bitDepth, nextCode);
    }
}
